package com.ramgenix.swingscanner.service;

import java.util.Optional;

import com.ramgenix.swingscanner.entity.Setup;

/**
 * Outcome of one engine invocation: either a setup or the reason none was produced.
 */
public final class DetectionResult {

	private final Setup setup;
	private final RejectReason reason;
	private final String detail;

	private DetectionResult(Setup setup, RejectReason reason, String detail) {
		this.setup = setup;
		this.reason = reason;
		this.detail = detail;
	}

	public static DetectionResult detected(Setup setup) {
		return new DetectionResult(setup, null, null);
	}

	public static DetectionResult rejected(RejectReason reason, String detail) {
		return new DetectionResult(null, reason, detail);
	}

	public boolean isDetected() {
		return setup != null;
	}

	public Optional<Setup> getSetup() {
		return Optional.ofNullable(setup);
	}

	public RejectReason getReason() {
		return reason;
	}

	public String getDetail() {
		return detail;
	}

	@Override
	public String toString() {
		return isDetected() ? "DetectionResult[detected " + setup.getSetupType() + "]"
				: "DetectionResult[" + reason + (detail != null ? ": " + detail : "") + "]";
	}
}
