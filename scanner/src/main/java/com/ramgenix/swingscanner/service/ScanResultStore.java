package com.ramgenix.swingscanner.service;

/**
 * Sink for finished scans. The scan pipeline never reads back what it stored.
 */
public interface ScanResultStore {

	void save(ScanResult result);
}
