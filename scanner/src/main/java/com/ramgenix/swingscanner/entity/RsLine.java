package com.ramgenix.swingscanner.entity;

import java.util.Arrays;

/**
 * Snapshot of the ticker/benchmark close ratio over the trailing year, oldest first.
 */
public final class RsLine {

	public enum Trend {
		UP, DOWN, FLAT
	}

	private final double[] ratios;
	private final boolean blueDot;

	public RsLine(double[] ratios, boolean blueDot) {
		this.ratios = ratios.clone();
		this.blueDot = blueDot;
	}

	public int size() {
		return ratios.length;
	}

	public double[] getRatios() {
		return ratios.clone();
	}

	public double getToday() {
		return ratios[ratios.length - 1];
	}

	public double getHigh() {
		return Arrays.stream(ratios).max().orElse(Double.NaN);
	}

	public boolean isBlueDot() {
		return blueDot;
	}

	public Trend getTrend() {
		if (ratios.length < 2) {
			return Trend.FLAT;
		}
		double today = ratios[ratios.length - 1];
		double previous = ratios[ratios.length - 2];
		if (today > previous) {
			return Trend.UP;
		}
		if (today < previous) {
			return Trend.DOWN;
		}
		return Trend.FLAT;
	}

	@Override
	public String toString() {
		return "RsLine [today=" + String.format("%.4f", getToday()) + ", high=" + String.format("%.4f", getHigh())
				+ ", blueDot=" + blueDot + ", trend=" + getTrend() + "]";
	}
}
