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
import com.ramgenix.swingscanner.entity.Zone;
import com.ramgenix.swingscanner.utility.Indicators;
import com.ramgenix.swingscanner.utility.StockCalculationUtility;

/**
 * Retracements into the 8/20 EMA value zone. The strict form needs a support-zone touch, a same-day rejection and
 * an oversold CCI hook; the relaxed form is only tried when the strict one finds nothing.
 */
@Service
public class PullbackScannerService {

	private static final Logger LOG = LoggerFactory.getLogger(PullbackScannerService.class);

	private final ScannerProperties properties;
	private final RiskCalculator riskCalculator;

	public PullbackScannerService(ScannerProperties properties, RiskCalculator riskCalculator) {
		this.properties = properties;
		this.riskCalculator = riskCalculator;
	}

	public DetectionResult scan(BarSeries series, List<Zone> zones) {
		DetectionResult strict = scanStrict(series, zones);
		if (strict.isDetected()) {
			return strict;
		}
		return scanRelaxed(series, zones);
	}

	public DetectionResult scanStrict(BarSeries series, List<Zone> zones) {
		try {
			Optional<Snapshot> prepared = prepare(series);
			if (prepared.isEmpty()) {
				return DetectionResult.rejected(RejectReason.INSUFFICIENT_DATA, null);
			}
			Snapshot s = prepared.get();
			Optional<DetectionResult> common = checkCommon(s);
			if (common.isPresent()) {
				return common.get();
			}
			ScannerProperties.Pullback config = properties.getPullback();

			if (!(s.low <= s.ema8 || s.low <= s.ema20)) {
				return DetectionResult.rejected(RejectReason.NO_SIGNAL, "low above value zone");
			}

			Zone support = null;
			for (Zone zone : nonNull(zones)) {
				if (!zone.isSupport()) {
					continue;
				}
				boolean lowInZone = zone.getLower() * (1 - config.getSupportTolerance()) <= s.low
						&& s.low <= zone.getUpper() * (1 + config.getSupportTolerance());
				boolean closeInZone = zone.contains(s.close);
				if (lowInZone || closeInZone) {
					support = zone;
					break;
				}
			}
			if (support == null) {
				return DetectionResult.rejected(RejectReason.NO_SIGNAL, "no support touch");
			}
			if (s.close < s.ema20) {
				return DetectionResult.rejected(RejectReason.NO_SIGNAL, "no rejection");
			}
			if (!(s.cciPrevious < config.getCciOversold() && s.cciToday > s.cciPrevious)) {
				return DetectionResult.rejected(RejectReason.NO_SIGNAL, "no CCI hook");
			}

			return build(series, s, Math.min(s.low, support.getLower()), support.getLevel(), false);
		} catch (ArithmeticException | IllegalStateException e) {
			LOG.warn("{}: pullback computation failed: {}", series.getSymbol(), e.getMessage());
			return DetectionResult.rejected(RejectReason.COMPUTATION_ERROR, e.getMessage());
		}
	}

	public DetectionResult scanRelaxed(BarSeries series, List<Zone> zones) {
		try {
			Optional<Snapshot> prepared = prepare(series);
			if (prepared.isEmpty()) {
				return DetectionResult.rejected(RejectReason.INSUFFICIENT_DATA, null);
			}
			Snapshot s = prepared.get();
			Optional<DetectionResult> common = checkCommon(s);
			if (common.isPresent()) {
				return common.get();
			}
			ScannerProperties.Pullback config = properties.getPullback();

			double distanceTo8 = s.ema8 > 0 ? Math.abs(s.close - s.ema8) / s.ema8 : Double.POSITIVE_INFINITY;
			double distanceTo20 = s.ema20 > 0 ? Math.abs(s.close - s.ema20) / s.ema20 : Double.POSITIVE_INFINITY;
			if (distanceTo8 > config.getEmaProximity() && distanceTo20 > config.getEmaProximity()) {
				return DetectionResult.rejected(RejectReason.NO_SIGNAL, "away from EMAs");
			}
			if (!(s.cciToday > s.cciPrevious && s.cciPrevious < 0)) {
				return DetectionResult.rejected(RejectReason.NO_SIGNAL, "no CCI turn");
			}

			double[] volumes = series.volumes();
			double volumeSma = Indicators.sma(volumes, properties.getBreakout().getVolumeSma())[volumes.length - 1];
			if (!(volumeSma > 0)) {
				return DetectionResult.rejected(RejectReason.INSUFFICIENT_DATA, "no volume average");
			}
			double recentVolume = StockCalculationUtility.meanOfLast(volumes, config.getQuietVolumeBars());
			if (recentVolume > volumeSma) {
				return DetectionResult.rejected(RejectReason.NO_SIGNAL, "heavy volume");
			}

			double supportLevel = nonNull(zones).stream().filter(Zone::isSupport).mapToDouble(Zone::getLevel).min()
					.orElse(s.sma50);
			if (supportLevel >= s.close) {
				return DetectionResult.rejected(RejectReason.NO_SIGNAL, "support not below close");
			}

			return build(series, s, Math.min(s.low, supportLevel), supportLevel, true);
		} catch (ArithmeticException | IllegalStateException e) {
			LOG.warn("{}: relaxed pullback computation failed: {}", series.getSymbol(), e.getMessage());
			return DetectionResult.rejected(RejectReason.COMPUTATION_ERROR, e.getMessage());
		}
	}

	private Optional<DetectionResult> checkCommon(Snapshot s) {
		if (!StockCalculationUtility.allFinite(s.close, s.high, s.low, s.ema8, s.ema20, s.sma50, s.atr)) {
			return Optional.of(DetectionResult.rejected(RejectReason.INSUFFICIENT_DATA, "indicators warming up"));
		}
		// zero mean deviation leaves CCI undefined
		if (!StockCalculationUtility.allFinite(s.cciToday, s.cciPrevious)) {
			return Optional.of(DetectionResult.rejected(RejectReason.NO_SIGNAL, "CCI undefined"));
		}
		if (!(s.ema8 > s.ema20 && s.close > s.sma50)) {
			return Optional.of(DetectionResult.rejected(RejectReason.TREND_FILTER, null));
		}
		return Optional.empty();
	}

	private DetectionResult build(BarSeries series, Snapshot s, double stopBase, double supportLevel,
			boolean relaxed) {
		Optional<RiskCalculator.RiskPlan> plan = riskCalculator.plan(s.high, stopBase, s.atr);
		if (plan.isEmpty()) {
			return DetectionResult.rejected(RejectReason.RISK_REJECTED, null);
		}
		Setup.SetupBuilder builder = Setup.builder().ticker(series.getSymbol()).setupType(SetupType.PULLBACK)
				.setupDate(series.lastDate()).meta(SetupMetadata.CCI_TODAY, s.cciToday)
				.meta(SetupMetadata.CCI_YESTERDAY, s.cciPrevious).meta(SetupMetadata.SUPPORT_LEVEL, supportLevel)
				.meta(SetupMetadata.EMA8, s.ema8).meta(SetupMetadata.EMA20, s.ema20)
				.meta(SetupMetadata.IS_RELAXED, relaxed);
		return DetectionResult.detected(plan.get().applyTo(builder).build());
	}

	private static List<Zone> nonNull(List<Zone> zones) {
		return zones == null ? Collections.emptyList() : zones;
	}

	private Optional<Snapshot> prepare(BarSeries series) {
		if (series.size() < properties.getMinBars()) {
			return Optional.empty();
		}
		ScannerProperties.Breakout trend = properties.getBreakout();
		double[] highs = series.highs();
		double[] lows = series.lows();
		double[] closes = series.closes();
		int last = closes.length - 1;
		double[] cci = Indicators.cci(highs, lows, closes, properties.getPullback().getCciLength());

		Snapshot s = new Snapshot();
		s.close = closes[last];
		s.high = highs[last];
		s.low = lows[last];
		s.ema8 = Indicators.ema(closes, trend.getFastEma())[last];
		s.ema20 = Indicators.ema(closes, trend.getSlowEma())[last];
		s.sma50 = Indicators.sma(closes, trend.getTrendSma())[last];
		s.atr = Indicators.atr(highs, lows, closes, properties.getRisk().getAtrLength())[last];
		s.cciToday = cci[last];
		s.cciPrevious = cci[last - 1];
		return Optional.of(s);
	}

	private static final class Snapshot {
		double close;
		double high;
		double low;
		double ema8;
		double ema20;
		double sma50;
		double atr;
		double cciToday;
		double cciPrevious;
	}
}
