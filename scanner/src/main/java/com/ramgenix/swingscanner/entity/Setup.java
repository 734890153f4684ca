package com.ramgenix.swingscanner.entity;

import java.time.LocalDate;
import java.util.Map;

import lombok.Builder;
import lombok.Getter;
import lombok.Singular;
import lombok.ToString;

/**
 * Trade candidate emitted by one engine for one ticker. Risk fields are null for {@link SetupType#WATCHLIST}.
 */
@Getter
@Builder(toBuilder = true)
@ToString
public class Setup {

	private final String ticker;
	private final String sector;
	private final SetupType setupType;
	private final Double entry;
	private final Double stopLoss;
	private final Double takeProfit;
	private final Double riskReward;
	private final LocalDate setupDate;
	@Singular("meta")
	private final Map<String, Object> metadata;

	public boolean hasRiskMath() {
		return entry != null && stopLoss != null && takeProfit != null;
	}

	public double getRisk() {
		return hasRiskMath() ? entry - stopLoss : Double.NaN;
	}

	public Object meta(String key) {
		return metadata.get(key);
	}
}
