package com.ramgenix.swingscanner.entity;

import java.time.LocalDate;
import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

/**
 * Ascending daily bars of one symbol with column views used by the indicator code. Closes are adjusted closes.
 */
public final class BarSeries {

	private final String symbol;
	private final List<PriceBar> bars;
	private final List<LocalDate> dates;
	private final double[] highs;
	private final double[] lows;
	private final double[] closes;
	private final double[] volumes;

	public BarSeries(String symbol, List<PriceBar> bars) {
		this.symbol = symbol;
		this.bars = Collections.unmodifiableList(new ArrayList<>(bars));
		int n = bars.size();
		List<LocalDate> dateList = new ArrayList<>(n);
		this.highs = new double[n];
		this.lows = new double[n];
		this.closes = new double[n];
		this.volumes = new double[n];
		for (int i = 0; i < n; i++) {
			PriceBar bar = bars.get(i);
			dateList.add(bar.getDate());
			highs[i] = bar.getHigh();
			lows[i] = bar.getLow();
			closes[i] = bar.getAdjustedClose();
			volumes[i] = bar.getVolume();
		}
		this.dates = Collections.unmodifiableList(dateList);
	}

	public String getSymbol() {
		return symbol;
	}

	public List<PriceBar> getBars() {
		return bars;
	}

	public List<LocalDate> getDates() {
		return dates;
	}

	public int size() {
		return bars.size();
	}

	public boolean isEmpty() {
		return bars.isEmpty();
	}

	public PriceBar lastBar() {
		return bars.get(bars.size() - 1);
	}

	public LocalDate lastDate() {
		return dates.get(dates.size() - 1);
	}

	public double lastClose() {
		return closes[closes.length - 1];
	}

	public double lastHigh() {
		return highs[highs.length - 1];
	}

	public double lastLow() {
		return lows[lows.length - 1];
	}

	public double lastVolume() {
		return volumes[volumes.length - 1];
	}

	public double[] highs() {
		return highs.clone();
	}

	public double[] lows() {
		return lows.clone();
	}

	public double[] closes() {
		return closes.clone();
	}

	public double[] volumes() {
		return volumes.clone();
	}

	public double close(int index) {
		return closes[index];
	}

	public double high(int index) {
		return highs[index];
	}

	public double low(int index) {
		return lows[index];
	}

	public double volume(int index) {
		return volumes[index];
	}
}
