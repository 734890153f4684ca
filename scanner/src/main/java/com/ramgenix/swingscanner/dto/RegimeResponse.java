package com.ramgenix.swingscanner.dto;

import java.time.LocalDateTime;

import com.ramgenix.swingscanner.entity.ScanRun;
import com.ramgenix.swingscanner.service.ScanResult;

import lombok.AllArgsConstructor;
import lombok.Getter;
import lombok.NoArgsConstructor;
import lombok.Setter;
import lombok.ToString;

@AllArgsConstructor
@NoArgsConstructor
@Getter
@Setter
@ToString
public class RegimeResponse {

	private String scanId;
	private String label;
	private boolean bullish;
	private Double benchmarkClose;
	private Double benchmarkEma20;
	private Double benchmarkReturn3m;
	private LocalDateTime asOf;

	public static RegimeResponse from(ScanRun run) {
		return new RegimeResponse(run.getScanId(), run.getRegimeLabel(), run.isBullish(), run.getBenchmarkClose(),
				run.getBenchmarkEma20(), run.getBenchmarkReturn3m(), run.getCompletedAt());
	}

	public static RegimeResponse from(ScanResult result) {
		return new RegimeResponse(result.getScanId(), result.getRegime().getLabel(), result.getRegime().isBullish(),
				finiteOrNull(result.getRegime().getClose()), finiteOrNull(result.getRegime().getEma20()),
				finiteOrNull(result.getBenchmarkReturn3m()), result.getCompletedAt());
	}

	private static Double finiteOrNull(double value) {
		return Double.isFinite(value) ? value : null;
	}
}
