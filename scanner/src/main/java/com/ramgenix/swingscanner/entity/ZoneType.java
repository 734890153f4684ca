package com.ramgenix.swingscanner.entity;

public enum ZoneType {
	SUPPORT, RESISTANCE
}
