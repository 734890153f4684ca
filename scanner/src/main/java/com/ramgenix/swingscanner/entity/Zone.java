package com.ramgenix.swingscanner.entity;

import lombok.AllArgsConstructor;
import lombok.EqualsAndHashCode;
import lombok.Getter;
import lombok.ToString;

/**
 * Price band around a density cluster level. Immutable for the lifetime of a scan.
 */
@Getter
@AllArgsConstructor
@EqualsAndHashCode
@ToString
public class Zone {

	private final double level;
	private final double upper;
	private final double lower;
	private final ZoneType type;
	private final double atr;

	public boolean isResistance() {
		return type == ZoneType.RESISTANCE;
	}

	public boolean isSupport() {
		return type == ZoneType.SUPPORT;
	}

	public boolean contains(double price) {
		return price >= lower && price <= upper;
	}
}
