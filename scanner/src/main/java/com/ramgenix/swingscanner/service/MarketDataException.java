package com.ramgenix.swingscanner.service;

/**
 * Raised by a market data provider when bars for a symbol could not be fetched. Missing history is not an error and
 * is reported as an empty list instead.
 */
public class MarketDataException extends RuntimeException {

	private static final long serialVersionUID = 1L;

	public MarketDataException(String message) {
		super(message);
	}

	public MarketDataException(String message, Throwable cause) {
		super(message, cause);
	}
}
