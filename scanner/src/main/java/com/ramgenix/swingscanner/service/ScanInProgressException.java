package com.ramgenix.swingscanner.service;

/**
 * Thrown when a scan is requested while another one is still running.
 */
public class ScanInProgressException extends IllegalStateException {

	private static final long serialVersionUID = 1L;

	private final transient ScanProgress running;

	public ScanInProgressException(ScanProgress running) {
		super("Scan " + running.getScanId() + " is already running");
		this.running = running;
	}

	public ScanProgress getRunning() {
		return running;
	}
}
