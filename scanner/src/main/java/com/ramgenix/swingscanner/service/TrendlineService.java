package com.ramgenix.swingscanner.service;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.Comparator;
import java.util.List;
import java.util.Optional;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

import com.ramgenix.swingscanner.config.ScannerProperties;
import com.ramgenix.swingscanner.entity.BarSeries;
import com.ramgenix.swingscanner.entity.SwingPoint;
import com.ramgenix.swingscanner.entity.Trendline;
import com.ramgenix.swingscanner.utility.PeakFinder;
import com.ramgenix.swingscanner.utility.StockCalculationUtility;

/**
 * Descending resistance line through the two most prominent recent swing highs.
 */
@Service
public class TrendlineService {

	private static final Logger LOG = LoggerFactory.getLogger(TrendlineService.class);
	private static final int MIN_WINDOW = 10;

	private final ScannerProperties.Trendline config;

	public TrendlineService(ScannerProperties properties) {
		this.config = properties.getTrendline();
	}

	public Optional<Trendline> detect(BarSeries series) {
		int window = Math.min(config.getLookback(), series.size());
		if (window < MIN_WINDOW) {
			return Optional.empty();
		}
		int offset = series.size() - window;
		double[] highs = Arrays.copyOfRange(series.highs(), offset, series.size());
		if (!StockCalculationUtility.allFinite(highs)) {
			return Optional.empty();
		}

		double minProminence = config.getProminenceFactor() * StockCalculationUtility.std(highs, 0);
		List<PeakFinder.Peak> peaks = new ArrayList<>(
				PeakFinder.findPeaks(highs, minProminence, config.getPeakDistance()));
		if (peaks.size() < 2) {
			return Optional.empty();
		}
		peaks.sort(Comparator.comparingDouble(PeakFinder.Peak::getProminence).reversed());

		PeakFinder.Peak first = peaks.get(0);
		PeakFinder.Peak second = peaks.get(1);
		SwingPoint a = toSwingPoint(series, offset, first);
		SwingPoint b = toSwingPoint(series, offset, second);

		Trendline candidate = new Trendline(a, b, 0, window - 1);
		if (!candidate.isDescending()) {
			return Optional.empty();
		}

		int touches = 0;
		for (int x = 0; x < window; x++) {
			double lineValue = candidate.getPriceAtChronologicalX(x);
			if (lineValue > 0 && Math.abs(highs[x] - lineValue) / lineValue <= config.getTouchTolerance()) {
				touches++;
			}
		}
		if (touches < config.getMinTouches()) {
			return Optional.empty();
		}

		Trendline trendline = new Trendline(a, b, touches, window - 1);
		LOG.debug("{}: {}", series.getSymbol(), trendline);
		return Optional.of(trendline);
	}

	private static SwingPoint toSwingPoint(BarSeries series, int offset, PeakFinder.Peak peak) {
		return new SwingPoint(series.getDates().get(offset + peak.getIndex()), peak.getValue(), peak.getProminence(),
				peak.getIndex());
	}
}
