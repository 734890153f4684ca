package com.ramgenix.swingscanner.entity;

import lombok.AllArgsConstructor;
import lombok.Getter;
import lombok.ToString;

@Getter
@AllArgsConstructor
@ToString
public class RegimeSnapshot {

	public static final String BULLISH = "BULLISH";
	public static final String BEARISH = "BEARISH";
	public static final String ERROR_PREFIX = "ERROR: ";

	private final boolean bullish;
	private final double close;
	private final double ema20;
	private final String label;

	public static RegimeSnapshot error(String reason) {
		return new RegimeSnapshot(false, Double.NaN, Double.NaN, ERROR_PREFIX + reason);
	}

	public boolean isError() {
		return label != null && label.startsWith(ERROR_PREFIX);
	}
}
