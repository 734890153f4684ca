package com.ramgenix.swingscanner.entity;

import java.time.LocalDate;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.EqualsAndHashCode;
import lombok.Getter;
import lombok.ToString;

/**
 * One end-of-day bar. Statistics are derived from {@code adjustedClose}; the raw close is kept for display.
 */
@Getter
@Builder
@AllArgsConstructor
@EqualsAndHashCode
@ToString
public class PriceBar {

	private final LocalDate date;
	private final double open;
	private final double high;
	private final double low;
	private final double close;
	private final double adjustedClose;
	private final double volume;

	public static PriceBar of(LocalDate date, double open, double high, double low, double close, double volume) {
		return new PriceBar(date, open, high, low, close, close, volume);
	}
}
