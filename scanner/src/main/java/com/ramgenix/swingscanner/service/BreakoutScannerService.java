package com.ramgenix.swingscanner.service;

import java.util.Collections;
import java.util.List;
import java.util.Optional;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

import com.ramgenix.swingscanner.config.ScannerProperties;
import com.ramgenix.swingscanner.entity.BarSeries;
import com.ramgenix.swingscanner.entity.Setup;
import com.ramgenix.swingscanner.entity.SetupMetadata;
import com.ramgenix.swingscanner.entity.SetupType;
import com.ramgenix.swingscanner.entity.Trendline;
import com.ramgenix.swingscanner.entity.Zone;
import com.ramgenix.swingscanner.service.breakout.BreakoutContext;
import com.ramgenix.swingscanner.service.breakout.BreakoutPath;
import com.ramgenix.swingscanner.service.breakout.BreakoutSignal;
import com.ramgenix.swingscanner.service.breakout.ConfirmedBreakoutPath;
import com.ramgenix.swingscanner.service.breakout.DryBasePath;
import com.ramgenix.swingscanner.service.breakout.LevelBreakoutPath;
import com.ramgenix.swingscanner.service.breakout.RsLeadBreakoutPath;
import com.ramgenix.swingscanner.service.breakout.TrendlineBreakoutPath;
import com.ramgenix.swingscanner.utility.Indicators;
import com.ramgenix.swingscanner.utility.StockCalculationUtility;

/**
 * Breakout and consolidation detection. Paths are tried in priority order and the first match decides the outcome,
 * including a risk rejection.
 */
@Service
public class BreakoutScannerService {

	private static final Logger LOG = LoggerFactory.getLogger(BreakoutScannerService.class);

	public static final String LEVEL_TYPE_ZONE = "ZONE";
	public static final String LEVEL_TYPE_TRENDLINE = "TRENDLINE";

	private final ScannerProperties properties;
	private final RiskCalculator riskCalculator;
	private final TrendlineService trendlineService;
	private final List<BreakoutPath> paths;

	public BreakoutScannerService(ScannerProperties properties, RiskCalculator riskCalculator,
			TrendlineService trendlineService) {
		this.properties = properties;
		this.riskCalculator = riskCalculator;
		this.trendlineService = trendlineService;
		this.paths = List.of(new ConfirmedBreakoutPath(), new TrendlineBreakoutPath(), new LevelBreakoutPath(),
				new RsLeadBreakoutPath(), new DryBasePath());
	}

	public List<BreakoutPath> getPaths() {
		return Collections.unmodifiableList(paths);
	}

	public DetectionResult scan(BarSeries series, List<Zone> zones, double benchmarkReturn3m, boolean rsBlueDot) {
		return scan(series, zones, benchmarkReturn3m, rsBlueDot, trendlineService.detect(series).orElse(null));
	}

	public DetectionResult scan(BarSeries series, List<Zone> zones, double benchmarkReturn3m, boolean rsBlueDot,
			Trendline trendline) {
		String ticker = series.getSymbol();
		try {
			if (series.size() < properties.getMinBars()) {
				return DetectionResult.rejected(RejectReason.INSUFFICIENT_DATA, series.size() + " bars");
			}
			BreakoutContext context = createContext(series, zones, benchmarkReturn3m, rsBlueDot, trendline);
			Optional<DetectionResult> precondition = checkPreconditions(context);
			if (precondition.isPresent()) {
				LOG.debug("{}: breakout rejected, {}", ticker, precondition.get());
				return precondition.get();
			}

			for (BreakoutPath path : paths) {
				Optional<BreakoutSignal> signal = path.detect(context);
				if (signal.isPresent()) {
					return buildSetup(context, signal.get());
				}
			}
			return DetectionResult.rejected(RejectReason.NO_SIGNAL, null);
		} catch (ArithmeticException | IllegalStateException e) {
			LOG.warn("{}: breakout computation failed: {}", ticker, e.getMessage());
			return DetectionResult.rejected(RejectReason.COMPUTATION_ERROR, e.getMessage());
		}
	}

	/**
	 * Indicator snapshot shared by every path. Values that are still warming up are NaN.
	 */
	public BreakoutContext createContext(BarSeries series, List<Zone> zones, double benchmarkReturn3m,
			boolean rsBlueDot, Trendline trendline) {
		ScannerProperties.Breakout config = properties.getBreakout();
		double[] closes = series.closes();
		double[] volumes = series.volumes();
		IndicatorsSnapshot snapshot = new IndicatorsSnapshot(series, config, properties.getRisk().getAtrLength());
		double volumeSma = Indicators.sma(volumes, config.getVolumeSma())[volumes.length - 1];
		double previousClose = closes.length > 1 ? closes[closes.length - 2] : Double.NaN;

		return BreakoutContext.builder().series(series).zones(zones == null ? Collections.emptyList() : zones)
				.config(config).close(series.lastClose()).high(series.lastHigh()).low(series.lastLow())
				.previousClose(previousClose).ema8(snapshot.ema8).ema20(snapshot.ema20).sma50(snapshot.sma50)
				.atr(snapshot.atr).volumeSma50(volumeSma)
				.volumeRatio(volumeSma > 0 ? series.lastVolume() / volumeSma : Double.NaN)
				.stockReturn3m(StockCalculationUtility.periodReturn(closes, properties.getThreeMonthBars()))
				.benchmarkReturn3m(benchmarkReturn3m).rsBlueDot(rsBlueDot).trendline(trendline).build();
	}

	Optional<DetectionResult> checkPreconditions(BreakoutContext context) {
		if (!StockCalculationUtility.allFinite(context.getClose(), context.getHigh(), context.getLow(),
				context.getEma8(), context.getEma20(), context.getSma50(), context.getAtr())) {
			return Optional.of(DetectionResult.rejected(RejectReason.INSUFFICIENT_DATA, "indicators warming up"));
		}
		if (!(context.getEma8() > context.getEma20() && context.getClose() > context.getSma50())) {
			return Optional.of(DetectionResult.rejected(RejectReason.TREND_FILTER, null));
		}
		if (!(context.getVolumeSma50() > 0)) {
			return Optional.of(DetectionResult.rejected(RejectReason.INSUFFICIENT_DATA, "no volume average"));
		}
		return Optional.empty();
	}

	private DetectionResult buildSetup(BreakoutContext context, BreakoutSignal signal) {
		double stopBase = Math.min(context.getLow(), signal.getStopReference());
		Optional<RiskCalculator.RiskPlan> plan = riskCalculator.plan(context.getHigh(), stopBase, context.getAtr());
		if (plan.isEmpty()) {
			LOG.debug("{}: {} matched but risk rejected", context.getSeries().getSymbol(), signal.getPath());
			return DetectionResult.rejected(RejectReason.RISK_REJECTED, signal.getPath());
		}
		Setup.SetupBuilder builder = Setup.builder().ticker(context.getSeries().getSymbol())
				.setupType(SetupType.BREAKOUT).setupDate(context.getSeries().lastDate())
				.meta(SetupMetadata.PATH, signal.getPath()).meta(SetupMetadata.VOLUME_RATIO, context.getVolumeRatio())
				.metadata(signal.getMetadata());
		return DetectionResult.detected(plan.get().applyTo(builder).build());
	}

	/**
	 * Near-breakout watch: close just under the nearer of an overhead zone's upper bound and today's
	 * trendline value. No trend filter and no risk math.
	 */
	public DetectionResult scanNearBreakout(BarSeries series, List<Zone> zones, Trendline trendline,
			boolean rsBlueDot) {
		if (series.isEmpty()) {
			return DetectionResult.rejected(RejectReason.INSUFFICIENT_DATA, "no bars");
		}
		double proximity = properties.getBreakout().getWatchlistProximity();
		double close = series.lastClose();
		if (!(close > 0)) {
			return DetectionResult.rejected(RejectReason.INSUFFICIENT_DATA, "no close");
		}

		String levelType = null;
		double level = Double.NaN;
		double distance = Double.POSITIVE_INFINITY;

		double previousClose = series.size() > 1 ? series.close(series.size() - 2) : Double.NaN;
		for (Zone zone : BreakoutContext.overheadZones(zones, previousClose)) {
			double d = (zone.getUpper() - close) / zone.getUpper();
			if (d >= 0 && d <= proximity && d < distance) {
				distance = d;
				level = zone.getUpper();
				levelType = LEVEL_TYPE_ZONE;
			}
		}
		if (trendline != null) {
			double lineToday = trendline.getTodayValue();
			if (lineToday > 0) {
				double d = (lineToday - close) / lineToday;
				if (d >= 0 && d <= proximity && d < distance) {
					distance = d;
					level = lineToday;
					levelType = LEVEL_TYPE_TRENDLINE;
				}
			}
		}
		if (levelType == null) {
			return DetectionResult.rejected(RejectReason.NO_SIGNAL, null);
		}

		Setup setup = Setup.builder().ticker(series.getSymbol()).setupType(SetupType.WATCHLIST)
				.setupDate(series.lastDate()).meta(SetupMetadata.LEVEL_TYPE, levelType)
				.meta(SetupMetadata.LEVEL, level).meta(SetupMetadata.DISTANCE_PCT, distance * 100)
				.meta(SetupMetadata.RS_BLUE_DOT, rsBlueDot).build();
		return DetectionResult.detected(setup);
	}

	private static final class IndicatorsSnapshot {
		private final double ema8;
		private final double ema20;
		private final double sma50;
		private final double atr;

		IndicatorsSnapshot(BarSeries series, ScannerProperties.Breakout config, int atrLength) {
			double[] closes = series.closes();
			int last = closes.length - 1;
			this.ema8 = Indicators.ema(closes, config.getFastEma())[last];
			this.ema20 = Indicators.ema(closes, config.getSlowEma())[last];
			this.sma50 = Indicators.sma(closes, config.getTrendSma())[last];
			this.atr = Indicators.atr(series.highs(), series.lows(), closes, atrLength)[last];
		}
	}
}
