package com.ramgenix.swingscanner.service;

import java.util.concurrent.Semaphore;

import com.ramgenix.swingscanner.entity.BarSeries;
import com.ramgenix.swingscanner.entity.RegimeSnapshot;

import lombok.Getter;

/**
 * Per-scan state shared read-only by the ticker tasks, apart from the limiter and the progress counters.
 */
@Getter
public class ScanContext {

	private final String scanId;
	private final BarSeries benchmark;
	private final RegimeSnapshot regime;
	private final double benchmarkReturn3m;
	private final Semaphore limiter;
	private final ScanProgress progress;

	public ScanContext(String scanId, BarSeries benchmark, RegimeSnapshot regime, double benchmarkReturn3m,
			int concurrencyLimit, ScanProgress progress) {
		this.scanId = scanId;
		this.benchmark = benchmark;
		this.regime = regime;
		this.benchmarkReturn3m = benchmarkReturn3m;
		this.limiter = new Semaphore(Math.max(1, concurrencyLimit));
		this.progress = progress;
	}
}
