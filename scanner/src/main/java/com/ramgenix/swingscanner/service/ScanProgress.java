package com.ramgenix.swingscanner.service;

import java.time.LocalDateTime;
import java.util.concurrent.atomic.AtomicInteger;

/**
 * Progress of one scan. Owned by the scan that created it and handed by reference to whoever reports on it.
 */
public class ScanProgress {

	private final String scanId;
	private final AtomicInteger processed = new AtomicInteger();
	private final AtomicInteger failed = new AtomicInteger();
	private volatile int total;
	private volatile boolean inProgress;
	private volatile LocalDateTime startedAt;
	private volatile LocalDateTime completedAt;
	private volatile String lastError;

	public ScanProgress(String scanId) {
		this.scanId = scanId;
	}

	public void start(int totalTickers) {
		this.total = totalTickers;
		this.processed.set(0);
		this.failed.set(0);
		this.startedAt = LocalDateTime.now();
		this.completedAt = null;
		this.inProgress = true;
	}

	public void tickerDone() {
		processed.incrementAndGet();
	}

	public void tickerFailed(String ticker, String message) {
		failed.incrementAndGet();
		lastError = ticker + ": " + message;
	}

	public void complete() {
		completedAt = LocalDateTime.now();
		inProgress = false;
	}

	public void abort(String message) {
		lastError = message;
		complete();
	}

	public String getScanId() {
		return scanId;
	}

	public int getProcessed() {
		return processed.get();
	}

	public int getFailed() {
		return failed.get();
	}

	public int getTotal() {
		return total;
	}

	public boolean isInProgress() {
		return inProgress;
	}

	public LocalDateTime getStartedAt() {
		return startedAt;
	}

	public LocalDateTime getCompletedAt() {
		return completedAt;
	}

	public String getLastError() {
		return lastError;
	}

	public double getPercent() {
		int t = total;
		return t == 0 ? (inProgress ? 0.0 : 100.0) : 100.0 * processed.get() / t;
	}
}
