package com.ramgenix.swingscanner.entity;

import lombok.AllArgsConstructor;
import lombok.EqualsAndHashCode;
import lombok.Getter;
import lombok.ToString;

@Getter
@AllArgsConstructor
@EqualsAndHashCode
@ToString
public class TickerEntry {

	public static final String UNKNOWN_SECTOR = "Unknown";

	private final String symbol;
	private final String sector;
}
