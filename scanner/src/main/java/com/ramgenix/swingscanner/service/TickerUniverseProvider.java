package com.ramgenix.swingscanner.service;

import java.util.List;

import com.ramgenix.swingscanner.entity.TickerEntry;

public interface TickerUniverseProvider {

	List<TickerEntry> loadUniverse();
}
