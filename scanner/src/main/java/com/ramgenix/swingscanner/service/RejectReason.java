package com.ramgenix.swingscanner.service;

public enum RejectReason {
	INSUFFICIENT_DATA, TREND_FILTER, NO_SIGNAL, RISK_REJECTED, LOW_QUALITY, COMPUTATION_ERROR, REGIME_BEARISH
}
