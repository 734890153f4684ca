package com.ramgenix.swingscanner.service;

import java.util.Arrays;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Optional;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

import com.ramgenix.swingscanner.config.ScannerProperties;
import com.ramgenix.swingscanner.entity.BarSeries;
import com.ramgenix.swingscanner.entity.Setup;
import com.ramgenix.swingscanner.entity.SetupMetadata;
import com.ramgenix.swingscanner.entity.SetupType;
import com.ramgenix.swingscanner.utility.Indicators;
import com.ramgenix.swingscanner.utility.QuadraticFit;
import com.ramgenix.swingscanner.utility.StockCalculationUtility;

/**
 * Cup-and-handle and flat-base detection for stage-2 stocks. Both patterns are measured on the bars before today;
 * today's bar is the trigger.
 */
@Service
public class BasePatternScannerService {

	private static final Logger LOG = LoggerFactory.getLogger(BasePatternScannerService.class);

	public static final String CUP_HANDLE = "CUP_HANDLE";
	public static final String FLAT_BASE = "FLAT_BASE";
	public static final String SIGNAL_BREAKOUT = "BRK";
	public static final String SIGNAL_DRY = "DRY";

	private static final int MIN_CUP_WINDOW = 30;
	private static final int MIN_LEFT_SEARCH = 10;
	private static final int MIN_LEG = 5;
	private static final int MIN_CUP_SEGMENT = 6;
	private static final double FULL_TIGHTNESS_DEPTH = 0.08;
	private static final double FULL_DRY_UP = 0.3;
	private static final double FULL_RS_OUTPERFORMANCE = 0.05;
	private static final double FACTOR_POINTS = 25.0;

	private final ScannerProperties properties;
	private final RiskCalculator riskCalculator;

	public BasePatternScannerService(ScannerProperties properties, RiskCalculator riskCalculator) {
		this.properties = properties;
		this.riskCalculator = riskCalculator;
	}

	/**
	 * Runs both detectors and keeps the higher-scoring setup; setups scoring under the minimum are dropped.
	 */
	public DetectionResult scan(BarSeries series, double benchmarkReturn3m, boolean rsBlueDot) {
		DetectionResult cup = scanCupHandle(series, benchmarkReturn3m, rsBlueDot);
		DetectionResult flat = scanFlatBase(series, benchmarkReturn3m, rsBlueDot);

		Setup best = null;
		boolean lowQuality = false;
		for (DetectionResult result : Arrays.asList(cup, flat)) {
			if (!result.isDetected()) {
				continue;
			}
			Setup setup = result.getSetup().get();
			int score = (Integer) setup.meta(SetupMetadata.QUALITY_SCORE);
			if (score < properties.getBase().getMinQualityScore()) {
				lowQuality = true;
				continue;
			}
			if (best == null || score > (Integer) best.meta(SetupMetadata.QUALITY_SCORE)) {
				best = setup;
			}
		}
		if (best != null) {
			return DetectionResult.detected(best);
		}
		if (lowQuality) {
			return DetectionResult.rejected(RejectReason.LOW_QUALITY, null);
		}
		return cup.getReason() == RejectReason.NO_SIGNAL ? flat : cup;
	}

	public DetectionResult scanCupHandle(BarSeries series, double benchmarkReturn3m, boolean rsBlueDot) {
		try {
			Optional<DetectionResult> stage = checkStageTwo(series);
			if (stage.isPresent()) {
				return stage.get();
			}
			ScannerProperties.Base config = properties.getBase();
			int n = series.size();
			double[] closes = series.closes();
			double[] volumes = series.volumes();
			double atr = Indicators.atr(series.highs(), series.lows(), closes,
					properties.getRisk().getAtrLength())[n - 1];
			double volumeSma = volumeSma(volumes);
			if (!(atr > 0) || !(volumeSma > 0)) {
				return DetectionResult.rejected(RejectReason.INSUFFICIENT_DATA, "no ATR or volume average");
			}

			int lookback = Math.min(config.getCupLookback(), n - 1);
			int offset = n - 1 - lookback;
			double[] window = Arrays.copyOfRange(closes, offset, n - 1);
			double[] windowVolumes = Arrays.copyOfRange(volumes, offset, n - 1);

			Optional<Cup> found = findCup(window);
			if (found.isEmpty()) {
				return DetectionResult.rejected(RejectReason.NO_SIGNAL, "no cup");
			}
			Cup cup = found.get();
			double[] segment = Arrays.copyOfRange(window, cup.leftPeakIndex, cup.rightRimIndex + 1);
			if (segment.length < MIN_CUP_SEGMENT || !QuadraticFit.isUShaped(segment, 0.0, true)) {
				return DetectionResult.rejected(RejectReason.NO_SIGNAL, "cup is not U-shaped");
			}

			Optional<Handle> handleFound = findHandle(window, windowVolumes, cup, volumeSma);
			if (handleFound.isEmpty()) {
				return DetectionResult.rejected(RejectReason.NO_SIGNAL, "no handle");
			}
			Handle handle = handleFound.get();

			Optional<String> signal = signal(series, handle.high, volumeSma);
			if (signal.isEmpty()) {
				return DetectionResult.rejected(RejectReason.NO_SIGNAL, "not at pivot");
			}

			double volumeDry = StockCalculationUtility.meanOfLast(volumes, 5) / volumeSma;
			if (volumeDry > config.getCupMaxRecentVolume()) {
				return DetectionResult.rejected(RejectReason.NO_SIGNAL, "volume not contracting");
			}

			Optional<RiskCalculator.RiskPlan> plan = riskCalculator.plan(series.lastHigh(), handle.low, atr);
			if (plan.isEmpty()) {
				return DetectionResult.rejected(RejectReason.RISK_REJECTED, CUP_HANDLE);
			}

			double rsVsBenchmark = rsVsBenchmark(closes, benchmarkReturn3m);
			int score = qualityScore(cup.depth, config.getCupMaxDepth(), volumeDry, rsVsBenchmark, rsBlueDot);

			Map<String, Object> geometry = new LinkedHashMap<>();
			geometry.put("leftPeakDate", series.getDates().get(offset + cup.leftPeakIndex));
			geometry.put("leftPeakPrice", cup.leftPeak);
			geometry.put("cupBottomDate", series.getDates().get(offset + cup.bottomIndex));
			geometry.put("cupBottomPrice", cup.bottom);
			geometry.put("rightRimDate", series.getDates().get(offset + cup.rightRimIndex));
			geometry.put("rightRimPrice", cup.rightRim);
			geometry.put("handleHigh", handle.high);
			geometry.put("handleLow", handle.low);

			int baseLength = (n - 1) - (offset + cup.leftPeakIndex);
			Setup setup = baseSetup(series, plan.get(), CUP_HANDLE, signal.get(), score, cup.depth, baseLength,
					volumeDry, rsVsBenchmark, geometry);
			LOG.debug("{}: cup and handle {} score {}", series.getSymbol(), signal.get(), score);
			return DetectionResult.detected(setup);
		} catch (ArithmeticException | IllegalStateException e) {
			LOG.warn("{}: cup and handle computation failed: {}", series.getSymbol(), e.getMessage());
			return DetectionResult.rejected(RejectReason.COMPUTATION_ERROR, e.getMessage());
		}
	}

	public DetectionResult scanFlatBase(BarSeries series, double benchmarkReturn3m, boolean rsBlueDot) {
		try {
			Optional<DetectionResult> stage = checkStageTwo(series);
			if (stage.isPresent()) {
				return stage.get();
			}
			ScannerProperties.Base config = properties.getBase();
			int n = series.size();
			double[] highs = series.highs();
			double[] lows = series.lows();
			double[] closes = series.closes();
			double[] volumes = series.volumes();

			// longest trailing window (ending yesterday) that stays inside the depth limit
			int maxLookback = Math.min(config.getFlatMaxBars(), n - 1);
			int lookback = 0;
			for (int lb = maxLookback; lb >= config.getFlatMinBars(); lb--) {
				double windowHigh = StockCalculationUtility.max(highs, n - 1 - lb, n - 1);
				double windowLow = StockCalculationUtility.min(lows, n - 1 - lb, n - 1);
				if (windowHigh > 0 && (windowHigh - windowLow) / windowHigh <= config.getFlatMaxDepth()) {
					lookback = lb;
					break;
				}
			}
			if (lookback < config.getFlatMinBars()) {
				return DetectionResult.rejected(RejectReason.NO_SIGNAL, "no flat base");
			}

			int start = n - 1 - lookback;
			double baseHighPrice = StockCalculationUtility.max(highs, start, n - 1);
			double baseLowPrice = StockCalculationUtility.min(lows, start, n - 1);
			double depth = (baseHighPrice - baseLowPrice) / baseHighPrice;
			double pivot = StockCalculationUtility.max(closes, start, n - 1);

			double close = series.lastClose();
			double span = baseHighPrice - baseLowPrice;
			if (span > 0 && (close - baseLowPrice) / span < config.getFlatUpperRange()) {
				return DetectionResult.rejected(RejectReason.NO_SIGNAL, "close low in range");
			}

			double volumeSma = volumeSma(volumes);
			double volume10 = Indicators.sma(volumes, 10)[n - 1];
			if (!(volumeSma > 0) || Double.isNaN(volume10)) {
				return DetectionResult.rejected(RejectReason.INSUFFICIENT_DATA, "no volume average");
			}
			double volumeDry = volume10 / volumeSma;
			if (volumeDry > config.getFlatMaxRecentVolume()) {
				return DetectionResult.rejected(RejectReason.NO_SIGNAL, "volume not contracting");
			}

			double atr = Indicators.atr(highs, lows, closes, properties.getRisk().getAtrLength())[n - 1];
			if (!(atr > 0)) {
				return DetectionResult.rejected(RejectReason.INSUFFICIENT_DATA, "no ATR");
			}

			Optional<String> signal = signal(series, pivot, volumeSma);
			if (signal.isEmpty()) {
				return DetectionResult.rejected(RejectReason.NO_SIGNAL, "not at pivot");
			}

			Optional<RiskCalculator.RiskPlan> plan = riskCalculator.plan(series.lastHigh(), baseLowPrice, atr);
			if (plan.isEmpty()) {
				return DetectionResult.rejected(RejectReason.RISK_REJECTED, FLAT_BASE);
			}

			double rsVsBenchmark = rsVsBenchmark(closes, benchmarkReturn3m);
			int score = qualityScore(depth, config.getFlatMaxDepth(), volumeDry, rsVsBenchmark, rsBlueDot);

			Map<String, Object> geometry = new LinkedHashMap<>();
			geometry.put("startDate", series.getDates().get(start));
			geometry.put("endDate", series.lastDate());
			geometry.put("baseHigh", baseHighPrice);
			geometry.put("baseLow", baseLowPrice);

			Setup setup = baseSetup(series, plan.get(), FLAT_BASE, signal.get(), score, depth, lookback, volumeDry,
					rsVsBenchmark, geometry);
			LOG.debug("{}: flat base {} score {}", series.getSymbol(), signal.get(), score);
			return DetectionResult.detected(setup);
		} catch (ArithmeticException | IllegalStateException e) {
			LOG.warn("{}: flat base computation failed: {}", series.getSymbol(), e.getMessage());
			return DetectionResult.rejected(RejectReason.COMPUTATION_ERROR, e.getMessage());
		}
	}

	/**
	 * Four 25-point factors: outperformance of the benchmark, base tightness, volume dry-up and the RS blue dot.
	 *
	 * @return score in [0, 100]
	 */
	public static int qualityScore(double depth, double maxDepth, double volumeDry, double rsVsBenchmark,
			boolean rsBlueDot) {
		double rs = Double.isFinite(rsVsBenchmark) ? rsVsBenchmark : 0.0;
		double rsPoints = Math.min(FACTOR_POINTS, Math.max(0.0, rs / FULL_RS_OUTPERFORMANCE * FACTOR_POINTS));

		double tightPoints;
		if (depth <= FULL_TIGHTNESS_DEPTH) {
			tightPoints = FACTOR_POINTS;
		} else if (depth >= maxDepth) {
			tightPoints = 0.0;
		} else {
			double ratio = (depth - FULL_TIGHTNESS_DEPTH) / (maxDepth - FULL_TIGHTNESS_DEPTH);
			tightPoints = (1.0 - ratio) * FACTOR_POINTS;
		}

		double volumePoints;
		if (volumeDry <= FULL_DRY_UP) {
			volumePoints = FACTOR_POINTS;
		} else if (volumeDry >= 1.0 || Double.isNaN(volumeDry)) {
			volumePoints = 0.0;
		} else {
			volumePoints = (1.0 - volumeDry) / (1.0 - FULL_DRY_UP) * FACTOR_POINTS;
		}

		double blueDotPoints = rsBlueDot ? FACTOR_POINTS : 0.0;
		long total = Math.round(rsPoints + tightPoints + volumePoints + blueDotPoints);
		return (int) Math.max(0, Math.min(100, total));
	}

	private Optional<DetectionResult> checkStageTwo(BarSeries series) {
		ScannerProperties.Base config = properties.getBase();
		int n = series.size();
		if (n < properties.getMinBars()) {
			return Optional.of(DetectionResult.rejected(RejectReason.INSUFFICIENT_DATA, n + " bars"));
		}
		double[] closes = series.closes();
		double close = closes[n - 1];
		if (!Double.isFinite(close)) {
			return Optional.of(DetectionResult.rejected(RejectReason.INSUFFICIENT_DATA, "no close"));
		}
		double[] sma200 = Indicators.sma(closes, config.getLongSma());
		double sma50 = Indicators.sma(closes, properties.getBreakout().getTrendSma())[n - 1];
		double sma200Today = sma200[n - 1];
		if (Double.isFinite(sma200Today) && close < sma200Today) {
			return Optional.of(DetectionResult.rejected(RejectReason.TREND_FILTER, "below 200 SMA"));
		}
		if (Double.isFinite(sma50) && close < sma50) {
			return Optional.of(DetectionResult.rejected(RejectReason.TREND_FILTER, "below 50 SMA"));
		}

		int yearBars = Math.min(config.getYearBars(), n);
		double yearLow = StockCalculationUtility.min(series.lows(), n - yearBars, n);
		if (yearLow > 0 && close < yearLow * (1 + config.getMinAdvance())) {
			return Optional.of(DetectionResult.rejected(RejectReason.TREND_FILTER, "no prior advance"));
		}

		int riseBars = config.getSmaRiseBars();
		if (Double.isFinite(sma200Today) && n > riseBars) {
			double sma200Before = sma200[n - 1 - riseBars];
			if (Double.isFinite(sma200Before) && sma200Today <= sma200Before) {
				return Optional.of(DetectionResult.rejected(RejectReason.TREND_FILTER, "200 SMA not rising"));
			}
		}
		return Optional.empty();
	}

	Optional<Cup> findCup(double[] window) {
		ScannerProperties.Base config = properties.getBase();
		int length = window.length;
		if (length < MIN_CUP_WINDOW) {
			return Optional.empty();
		}
		int twoThirds = length * 2 / 3;
		if (twoThirds < MIN_LEFT_SEARCH) {
			return Optional.empty();
		}
		int leftPeakIndex = StockCalculationUtility.argMax(window, 0, twoThirds);
		if (length - leftPeakIndex < MIN_LEG) {
			return Optional.empty();
		}
		int bottomIndex = StockCalculationUtility.argMin(window, leftPeakIndex, length);
		double leftPeak = window[leftPeakIndex];
		double bottom = window[bottomIndex];
		double depth = (leftPeak - bottom) / leftPeak;
		if (depth < config.getCupMinDepth() || depth > config.getCupMaxDepth()) {
			return Optional.empty();
		}
		if (length - bottomIndex < MIN_LEG) {
			return Optional.empty();
		}
		int rightRimIndex = StockCalculationUtility.argMax(window, bottomIndex, length);
		double rightRim = window[rightRimIndex];
		if ((leftPeak - rightRim) / leftPeak > config.getRimRecovery()) {
			return Optional.empty();
		}
		if (rightRimIndex - leftPeakIndex < config.getCupMinBars()) {
			return Optional.empty();
		}
		return Optional.of(new Cup(leftPeakIndex, leftPeak, bottomIndex, bottom, rightRimIndex, rightRim, depth));
	}

	Optional<Handle> findHandle(double[] window, double[] windowVolumes, Cup cup, double volumeSma) {
		ScannerProperties.Base config = properties.getBase();
		int from = cup.rightRimIndex + 1;
		int to = Math.min(cup.rightRimIndex + config.getHandleSearchBars(), window.length);
		if (to - from < config.getHandleMinBars()) {
			return Optional.empty();
		}
		double low = StockCalculationUtility.min(window, from, to);
		double pullback = (cup.rightRim - low) / cup.rightRim;
		if (pullback < config.getHandleMinPullback() || pullback > config.getHandleMaxPullback()) {
			return Optional.empty();
		}
		double midpoint = (cup.leftPeak + cup.bottom) / 2.0;
		if (low < midpoint) {
			return Optional.empty();
		}
		double handleVolume = StockCalculationUtility.mean(windowVolumes, from, to);
		if (handleVolume >= volumeSma) {
			return Optional.empty();
		}
		return Optional.of(new Handle(cup.rightRim, low, to - from));
	}

	private Optional<String> signal(BarSeries series, double pivot, double volumeSma) {
		ScannerProperties.Base config = properties.getBase();
		double close = series.lastClose();
		double volumeRatio = series.lastVolume() / volumeSma;
		if (close > pivot && volumeRatio >= config.getBreakoutVolumeRatio()) {
			return Optional.of(SIGNAL_BREAKOUT);
		}
		double distance = (pivot - close) / pivot;
		if (distance >= 0 && distance <= config.getPivotProximity()) {
			return Optional.of(SIGNAL_DRY);
		}
		return Optional.empty();
	}

	private double volumeSma(double[] volumes) {
		return Indicators.sma(volumes, properties.getBreakout().getVolumeSma())[volumes.length - 1];
	}

	private double rsVsBenchmark(double[] closes, double benchmarkReturn3m) {
		double stockReturn = StockCalculationUtility.periodReturn(closes, properties.getThreeMonthBars());
		double difference = stockReturn - benchmarkReturn3m;
		return Double.isFinite(difference) ? difference : 0.0;
	}

	private Setup baseSetup(BarSeries series, RiskCalculator.RiskPlan plan, String baseType, String signal,
			int score, double depth, int baseLength, double volumeDry, double rsVsBenchmark,
			Map<String, Object> geometry) {
		Setup.SetupBuilder builder = Setup.builder().ticker(series.getSymbol()).setupType(SetupType.BASE)
				.setupDate(series.lastDate()).meta(SetupMetadata.BASE_TYPE, baseType)
				.meta(SetupMetadata.SIGNAL, signal).meta(SetupMetadata.QUALITY_SCORE, score)
				.meta(SetupMetadata.BASE_DEPTH_PCT, depth * 100).meta(SetupMetadata.BASE_LENGTH_DAYS,
						Math.max(0, baseLength))
				.meta(SetupMetadata.VOLUME_DRY_PCT, volumeDry * 100)
				.meta(SetupMetadata.RS_VS_BENCHMARK_PCT, rsVsBenchmark * 100)
				.meta(SetupMetadata.GEOMETRY, Collections.unmodifiableMap(geometry));
		return plan.applyTo(builder).build();
	}

	static final class Cup {
		final int leftPeakIndex;
		final double leftPeak;
		final int bottomIndex;
		final double bottom;
		final int rightRimIndex;
		final double rightRim;
		final double depth;

		Cup(int leftPeakIndex, double leftPeak, int bottomIndex, double bottom, int rightRimIndex, double rightRim,
				double depth) {
			this.leftPeakIndex = leftPeakIndex;
			this.leftPeak = leftPeak;
			this.bottomIndex = bottomIndex;
			this.bottom = bottom;
			this.rightRimIndex = rightRimIndex;
			this.rightRim = rightRim;
			this.depth = depth;
		}
	}

	static final class Handle {
		final double high;
		final double low;
		final int length;

		Handle(double high, double low, int length) {
			this.high = high;
			this.low = low;
			this.length = length;
		}
	}
}
