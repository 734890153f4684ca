package com.ramgenix.swingscanner.service.breakout;

import java.util.Arrays;
import java.util.Optional;

import com.ramgenix.swingscanner.config.ScannerProperties;
import com.ramgenix.swingscanner.entity.BarSeries;
import com.ramgenix.swingscanner.entity.SetupMetadata;
import com.ramgenix.swingscanner.entity.Zone;
import com.ramgenix.swingscanner.utility.Indicators;
import com.ramgenix.swingscanner.utility.QuadraticFit;
import com.ramgenix.swingscanner.utility.StockCalculationUtility;

/**
 * Coiled spring under resistance: contracting ranges, a rounded (not V) recent close profile, and either quiet
 * volume below the zone or a high-volume push into it.
 */
public class DryBasePath implements BreakoutPath {

	public static final String NAME = "DRY_BASE";

	@Override
	public String getName() {
		return NAME;
	}

	@Override
	public Optional<BreakoutSignal> detect(BreakoutContext context) {
		ScannerProperties.Breakout config = context.getConfig();
		BarSeries series = context.getSeries();

		int recentBars = config.getDryRecentRangeBars();
		int priorBars = config.getDryPriorRangeBars();
		double[] trueRange = Indicators.trueRange(series.highs(), series.lows(), series.closes());
		// first entry is undefined
		if (trueRange.length - 1 < recentBars + priorBars + 1) {
			return Optional.empty();
		}
		int n = trueRange.length;
		double recentRange = StockCalculationUtility.mean(trueRange, n - recentBars, n);
		double priorRange = StockCalculationUtility.mean(trueRange, n - recentBars - priorBars, n - recentBars);
		if (!(recentRange < priorRange)) {
			return Optional.empty();
		}

		int curveBars = Math.min(config.getDryCurveBars(), series.size());
		double[] closes = series.closes();
		double[] recentCloses = Arrays.copyOfRange(closes, closes.length - curveBars, closes.length);
		if (!QuadraticFit.isUShaped(recentCloses, config.getDryCurveEpsilon(), true)) {
			return Optional.empty();
		}

		Optional<Zone> nearest = context.nearestOverheadZone();
		if (nearest.isEmpty()) {
			return Optional.empty();
		}
		Zone zone = nearest.get();
		double close = context.getClose();
		double recentVolume = StockCalculationUtility.meanOfLast(series.volumes(), config.getDryVolumeBars());
		boolean breakout = close >= zone.getLower() && context.getVolumeRatio() >= config.getDryVolumeRatio();
		boolean dryUp = close < zone.getLower() && recentVolume < context.getVolumeSma50()
				&& zone.getLevel() - close <= zone.getLevel() * config.getDryMaxDistanceBelowLevel();
		if (!breakout && !dryUp) {
			return Optional.empty();
		}

		double contractionPct = (1 - recentRange / priorRange) * 100;
		return Optional.of(BreakoutSignal.builder().path(NAME).stopReference(zone.getLower())
				.meta(SetupMetadata.RESISTANCE_LEVEL, zone.getLevel()).meta(SetupMetadata.IS_BREAKOUT, breakout)
				.meta(SetupMetadata.TR_CONTRACTION_PCT, contractionPct).build());
	}
}
