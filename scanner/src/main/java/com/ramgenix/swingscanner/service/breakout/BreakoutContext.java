package com.ramgenix.swingscanner.service.breakout;

import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;
import java.util.Optional;

import com.ramgenix.swingscanner.config.ScannerProperties;
import com.ramgenix.swingscanner.entity.BarSeries;
import com.ramgenix.swingscanner.entity.Trendline;
import com.ramgenix.swingscanner.entity.Zone;

import lombok.Builder;
import lombok.Getter;

/**
 * Everything a breakout path reads for one ticker, computed once before the paths run.
 */
@Getter
@Builder
public class BreakoutContext {

	private final BarSeries series;
	private final List<Zone> zones;
	private final ScannerProperties.Breakout config;

	private final double close;
	private final double high;
	private final double low;
	private final double previousClose;
	private final double ema8;
	private final double ema20;
	private final double sma50;
	private final double atr;
	private final double volumeSma50;
	private final double volumeRatio;
	private final double stockReturn3m;
	private final double benchmarkReturn3m;
	private final boolean rsBlueDot;
	private final Trendline trendline;

	public Optional<Trendline> trendline() {
		return Optional.ofNullable(trendline);
	}

	/** Stock minus benchmark return over three months; NaN when either side is unknown. */
	public double rsVsBenchmark() {
		return stockReturn3m - benchmarkReturn3m;
	}

	/**
	 * Zones still acting as resistance for today's bar: tagged RESISTANCE, or sitting above yesterday's close so a
	 * zone cleared today still counts.
	 */
	public List<Zone> overheadZones() {
		return overheadZones(zones, previousClose);
	}

	public static List<Zone> overheadZones(List<Zone> zones, double previousClose) {
		List<Zone> overhead = new ArrayList<>();
		if (zones == null) {
			return overhead;
		}
		for (Zone zone : zones) {
			if (zone.isResistance() || zone.getLevel() > previousClose) {
				overhead.add(zone);
			}
		}
		return overhead;
	}

	public Optional<Zone> highestOverheadZone() {
		return overheadZones().stream().max(Comparator.comparingDouble(Zone::getLevel));
	}

	public Optional<Zone> nearestOverheadZone() {
		return overheadZones().stream().min(Comparator.comparingDouble(z -> Math.abs(z.getLevel() - close)));
	}
}
