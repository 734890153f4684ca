package com.ramgenix.swingscanner.service;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.Collections;
import java.util.Comparator;
import java.util.List;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

import com.ramgenix.swingscanner.config.ScannerProperties;
import com.ramgenix.swingscanner.entity.BarSeries;
import com.ramgenix.swingscanner.entity.PriceBar;
import com.ramgenix.swingscanner.entity.Zone;
import com.ramgenix.swingscanner.entity.ZoneType;
import com.ramgenix.swingscanner.utility.Indicators;
import com.ramgenix.swingscanner.utility.KernelDensityEstimator;
import com.ramgenix.swingscanner.utility.PeakFinder;
import com.ramgenix.swingscanner.utility.StockCalculationUtility;
import com.ramgenix.swingscanner.utility.WeeklyBarConverter;

/**
 * Support and resistance zones from a density estimate over weekly closes and weekly pivots. Every failure path
 * yields an empty list.
 */
@Service
public class SupportResistanceService {

	private static final Logger LOG = LoggerFactory.getLogger(SupportResistanceService.class);

	private final ScannerProperties properties;
	private final WeeklyBarConverter weeklyBarConverter;

	public SupportResistanceService(ScannerProperties properties, WeeklyBarConverter weeklyBarConverter) {
		this.properties = properties;
		this.weeklyBarConverter = weeklyBarConverter;
	}

	/**
	 * @return zones sorted ascending by level, possibly empty
	 */
	public List<Zone> extractZones(BarSeries series) {
		try {
			return calculateZones(series);
		} catch (ArithmeticException | IllegalStateException e) {
			LOG.debug("{}: zone extraction failed: {}", series.getSymbol(), e.getMessage());
			return Collections.emptyList();
		}
	}

	private List<Zone> calculateZones(BarSeries series) {
		ScannerProperties.Zones config = properties.getZones();
		if (series.size() < properties.getMinBars()) {
			return Collections.emptyList();
		}

		double[] atr = Indicators.atr(series.highs(), series.lows(), series.closes(), config.getAtrLength());
		double dailyAtr = lastDefined(atr);
		if (!(dailyAtr > 0)) {
			LOG.debug("{}: no positive ATR, skipping zones", series.getSymbol());
			return Collections.emptyList();
		}

		List<PriceBar> weekly = new ArrayList<>();
		for (PriceBar week : weeklyBarConverter.convertToWeeklyBars(series.getBars())) {
			if (StockCalculationUtility.allFinite(week.getHigh(), week.getLow(), week.getAdjustedClose())) {
				weekly.add(week);
			}
		}
		if (weekly.size() < config.getMinWeeks()) {
			return Collections.emptyList();
		}

		int weeks = weekly.size();
		double[] highs = new double[weeks];
		double[] lows = new double[weeks];
		double[] closes = new double[weeks];
		for (int i = 0; i < weeks; i++) {
			highs[i] = weekly.get(i).getHigh();
			lows[i] = weekly.get(i).getLow();
			closes[i] = weekly.get(i).getAdjustedClose();
		}

		int order = Math.max(2, weeks / 20);
		List<Double> cloud = new ArrayList<>();
		for (double close : closes) {
			cloud.add(close);
		}
		for (int index : PeakFinder.relativeMaxima(highs, order, true)) {
			cloud.add(highs[index]);
		}
		for (int index : PeakFinder.relativeMinima(lows, order, true)) {
			cloud.add(lows[index]);
		}
		double[] points = cloud.stream().mapToDouble(Double::doubleValue).filter(p -> Double.isFinite(p) && p > 0)
				.toArray();
		if (points.length < config.getMinPoints()) {
			return Collections.emptyList();
		}

		KernelDensityEstimator kde = new KernelDensityEstimator(points);
		double min = Arrays.stream(points).min().getAsDouble();
		double max = Arrays.stream(points).max().getAsDouble();
		double[] grid = KernelDensityEstimator.linspace(min * config.getGridLowFactor(),
				max * config.getGridHighFactor(), config.getGridPoints());
		double[] density = kde.evaluate(grid);

		List<Integer> peakIndices = PeakFinder.relativeMaxima(density, config.getPeakSeparation(), false);
		if (peakIndices.isEmpty()) {
			return Collections.emptyList();
		}
		double[] peakDensities = peakIndices.stream().mapToDouble(i -> density[i]).toArray();
		double threshold = StockCalculationUtility.percentile(peakDensities, config.getPeakPercentileCut());
		List<Double> peakPrices = new ArrayList<>();
		for (int index : peakIndices) {
			if (density[index] >= threshold) {
				peakPrices.add(grid[index]);
			}
		}
		Collections.sort(peakPrices);

		List<Double> levels = mergeLevels(peakPrices, dailyAtr);
		double halfWidth = config.getBandAtrFraction() * dailyAtr;
		double lastClose = series.lastClose();
		List<Zone> zones = new ArrayList<>();
		for (double level : levels) {
			ZoneType type = level > lastClose ? ZoneType.RESISTANCE : ZoneType.SUPPORT;
			zones.add(new Zone(level, level + halfWidth, level - halfWidth, type, dailyAtr));
		}
		zones.sort(Comparator.comparingDouble(Zone::getLevel));
		LOG.debug("{}: {} zones from {} density peaks (ATR {})", series.getSymbol(), zones.size(), peakPrices.size(),
				String.format("%.2f", dailyAtr));
		return zones;
	}

	/**
	 * Folds ascending prices into clusters: a price joins the open cluster while it sits within {@code distance} of
	 * that cluster's running mean. Each cluster collapses to its mean.
	 */
	static List<Double> mergeLevels(List<Double> ascendingPrices, double distance) {
		List<Double> merged = new ArrayList<>();
		double sum = 0;
		int count = 0;
		for (double price : ascendingPrices) {
			if (count > 0 && price - sum / count >= distance) {
				merged.add(sum / count);
				sum = 0;
				count = 0;
			}
			sum += price;
			count++;
		}
		if (count > 0) {
			merged.add(sum / count);
		}
		return merged;
	}

	private static double lastDefined(double[] values) {
		for (int i = values.length - 1; i >= 0; i--) {
			if (!Double.isNaN(values[i])) {
				return values[i];
			}
		}
		return Double.NaN;
	}
}
