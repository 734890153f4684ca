package com.ramgenix.swingscanner.service;

import java.time.LocalDateTime;
import java.util.List;
import java.util.Map;

import com.ramgenix.swingscanner.entity.RegimeSnapshot;
import com.ramgenix.swingscanner.entity.Setup;
import com.ramgenix.swingscanner.entity.Zone;

import lombok.Builder;
import lombok.Getter;
import lombok.Singular;
import lombok.ToString;

@Getter
@Builder(toBuilder = true)
@ToString
public class ScanResult {

	private final String scanId;
	private final RegimeSnapshot regime;
	private final double benchmarkReturn3m;
	private final int tickerCount;
	@Singular("zones")
	private final Map<String, List<Zone>> zonesByTicker;
	@Singular
	private final List<Setup> setups;
	@Singular
	private final List<String> failedTickers;
	private final LocalDateTime startedAt;
	private final LocalDateTime completedAt;
}
