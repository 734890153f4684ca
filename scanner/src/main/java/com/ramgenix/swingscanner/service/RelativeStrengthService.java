package com.ramgenix.swingscanner.service;

import java.time.LocalDate;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

import com.ramgenix.swingscanner.config.ScannerProperties;
import com.ramgenix.swingscanner.entity.BarSeries;
import com.ramgenix.swingscanner.entity.RsLine;

@Service
public class RelativeStrengthService {

	private static final Logger LOG = LoggerFactory.getLogger(RelativeStrengthService.class);

	private final ScannerProperties properties;

	public RelativeStrengthService(ScannerProperties properties) {
		this.properties = properties;
	}

	/**
	 * Ticker/benchmark close ratio over the dates both series share, trimmed to the trailing window.
	 *
	 * @return the RS line, or empty when fewer aligned days than the window are available
	 */
	public Optional<RsLine> calculate(BarSeries ticker, BarSeries benchmark) {
		if (ticker == null || benchmark == null || ticker.isEmpty() || benchmark.isEmpty()) {
			return Optional.empty();
		}
		Map<LocalDate, Double> benchmarkCloses = new HashMap<>();
		for (int i = 0; i < benchmark.size(); i++) {
			benchmarkCloses.put(benchmark.getDates().get(i), benchmark.close(i));
		}

		List<Double> ratios = new ArrayList<>();
		for (int i = 0; i < ticker.size(); i++) {
			Double benchmarkClose = benchmarkCloses.get(ticker.getDates().get(i));
			double tickerClose = ticker.close(i);
			if (benchmarkClose == null || !(benchmarkClose > 0) || !Double.isFinite(tickerClose)) {
				continue;
			}
			ratios.add(tickerClose / benchmarkClose);
		}

		ScannerProperties.RelativeStrength config = properties.getRelativeStrength();
		int window = Math.max(config.getWindow(), properties.getMinRsDays());
		if (ratios.size() < window) {
			LOG.debug("{}: RS unavailable, {} aligned days", ticker.getSymbol(), ratios.size());
			return Optional.empty();
		}
		double[] trailing = ratios.subList(ratios.size() - window, ratios.size()).stream()
				.mapToDouble(Double::doubleValue).toArray();
		return Optional.of(new RsLine(trailing, isBlueDot(trailing, config.getBlueDotTolerance())));
	}

	static boolean isBlueDot(double[] ratios, double tolerance) {
		if (ratios.length == 0) {
			return false;
		}
		double high = Arrays.stream(ratios).max().getAsDouble();
		return ratios[ratios.length - 1] >= high * tolerance;
	}
}
