package com.ramgenix.swingscanner.utility;

import static org.junit.jupiter.api.Assertions.*;

import java.time.LocalDate;
import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import com.ramgenix.swingscanner.entity.PriceBar;

class WeeklyBarConverterTest {

	private final WeeklyBarConverter converter = new WeeklyBarConverter();

	@Test
	@DisplayName("groups ISO weeks into open/high/low/close/volume bars dated on the last trading day")
	void aggregatesWeeks() {
		List<PriceBar> daily = new ArrayList<>();
		// Thursday 2021-12-30 and Friday 2021-12-31 belong to ISO week 52 of 2021
		daily.add(PriceBar.of(LocalDate.of(2021, 12, 30), 10, 12, 9, 11, 100));
		daily.add(PriceBar.of(LocalDate.of(2021, 12, 31), 11, 13, 10, 12, 200));
		daily.add(PriceBar.of(LocalDate.of(2022, 1, 3), 12, 14, 11, 13, 300));
		daily.add(PriceBar.of(LocalDate.of(2022, 1, 4), 13, 15, 8, 14, 400));
		daily.add(PriceBar.of(LocalDate.of(2022, 1, 7), 14, 16, 12, 15, 500));

		List<PriceBar> weekly = converter.convertToWeeklyBars(daily);

		assertEquals(2, weekly.size());
		PriceBar first = weekly.get(0);
		assertEquals(LocalDate.of(2021, 12, 31), first.getDate());
		assertEquals(10, first.getOpen(), 1e-12);
		assertEquals(13, first.getHigh(), 1e-12);
		assertEquals(9, first.getLow(), 1e-12);
		assertEquals(12, first.getClose(), 1e-12);
		assertEquals(300, first.getVolume(), 1e-12);

		PriceBar second = weekly.get(1);
		assertEquals(LocalDate.of(2022, 1, 7), second.getDate());
		assertEquals(12, second.getOpen(), 1e-12);
		assertEquals(16, second.getHigh(), 1e-12);
		assertEquals(8, second.getLow(), 1e-12);
		assertEquals(15, second.getAdjustedClose(), 1e-12);
		assertEquals(1200, second.getVolume(), 1e-12);
	}

	@Test
	@DisplayName("empty input gives no weeks")
	void emptyInput() {
		assertTrue(converter.convertToWeeklyBars(Collections.emptyList()).isEmpty());
		assertTrue(converter.convertToWeeklyBars(null).isEmpty());
	}
}
