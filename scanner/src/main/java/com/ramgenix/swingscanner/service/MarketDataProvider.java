package com.ramgenix.swingscanner.service;

import java.util.List;

import com.ramgenix.swingscanner.entity.PriceBar;

public interface MarketDataProvider {

	/**
	 * @return daily bars ascending by date, possibly empty
	 * @throws MarketDataException when the source cannot be read
	 */
	List<PriceBar> fetchDailyBars(String symbol);
}
