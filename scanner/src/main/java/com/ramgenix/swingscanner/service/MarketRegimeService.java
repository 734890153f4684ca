package com.ramgenix.swingscanner.service;

import java.util.List;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

import com.ramgenix.swingscanner.config.ScannerProperties;
import com.ramgenix.swingscanner.entity.PriceBar;
import com.ramgenix.swingscanner.entity.RegimeSnapshot;
import com.ramgenix.swingscanner.utility.Indicators;

/**
 * Bull/bear gate from the benchmark close against its 20-period EMA. Fails closed.
 */
@Service
public class MarketRegimeService {

	private static final Logger LOG = LoggerFactory.getLogger(MarketRegimeService.class);

	private final ScannerProperties properties;

	public MarketRegimeService(ScannerProperties properties) {
		this.properties = properties;
	}

	public RegimeSnapshot evaluate(List<PriceBar> benchmarkBars) {
		try {
			if (benchmarkBars == null || benchmarkBars.isEmpty()) {
				return RegimeSnapshot.error("No benchmark data");
			}
			double[] closes = benchmarkBars.stream().mapToDouble(PriceBar::getAdjustedClose)
					.filter(Double::isFinite).toArray();
			if (closes.length < properties.getMinRegimeBars()) {
				return RegimeSnapshot.error("Insufficient benchmark data: " + closes.length + " bars");
			}

			int emaLength = properties.getRegime().getEmaLength();
			double[] ema = Indicators.ema(closes, emaLength);
			double latestEma = ema[ema.length - 1];
			if (Double.isNaN(latestEma)) {
				return RegimeSnapshot.error("EMA-" + emaLength + " calculation failed");
			}
			double latestClose = closes[closes.length - 1];
			boolean bullish = latestClose > latestEma;
			return new RegimeSnapshot(bullish, latestClose, latestEma,
					bullish ? RegimeSnapshot.BULLISH : RegimeSnapshot.BEARISH);
		} catch (RuntimeException e) {
			LOG.error("Regime evaluation failed: {}", e.getMessage(), e);
			return RegimeSnapshot.error(e.getClass().getSimpleName() + ": " + e.getMessage());
		}
	}
}
