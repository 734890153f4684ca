package com.ramgenix.swingscanner.entity;

public enum SetupType {
	BREAKOUT, PULLBACK, BASE, WATCHLIST
}
