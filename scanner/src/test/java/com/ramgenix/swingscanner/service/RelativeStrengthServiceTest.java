package com.ramgenix.swingscanner.service;

import static org.junit.jupiter.api.Assertions.*;

import java.util.ArrayList;
import java.util.List;
import java.util.Optional;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import com.ramgenix.swingscanner.SyntheticBars;
import com.ramgenix.swingscanner.config.ScannerProperties;
import com.ramgenix.swingscanner.entity.BarSeries;
import com.ramgenix.swingscanner.entity.PriceBar;
import com.ramgenix.swingscanner.entity.RsLine;

class RelativeStrengthServiceTest {

	private final RelativeStrengthService service = new RelativeStrengthService(new ScannerProperties());

	private final BarSeries benchmark = SyntheticBars.fromCloses("SPY", SyntheticBars.linear(400, 460, 300), 0.005,
			1e7);

	@Test
	@DisplayName("outperformer sits at its RS high with a blue dot and rising trend")
	void leader() {
		BarSeries leader = SyntheticBars.fromCloses("LEAD", SyntheticBars.compounding(20, 0.004, 300), 0.01, 1e6);
		RsLine rs = service.calculate(leader, benchmark).get();
		assertEquals(252, rs.size());
		assertTrue(rs.isBlueDot());
		assertEquals(RsLine.Trend.UP, rs.getTrend());
		assertEquals(rs.getHigh(), rs.getToday(), 1e-12);
	}

	@Test
	@DisplayName("laggard has no blue dot")
	void laggard() {
		BarSeries laggard = SyntheticBars.fromCloses("LAG", SyntheticBars.linear(100, 80, 300), 0.01, 1e6);
		RsLine rs = service.calculate(laggard, benchmark).get();
		assertFalse(rs.isBlueDot());
		assertEquals(RsLine.Trend.DOWN, rs.getTrend());
		assertTrue(rs.getToday() < rs.getHigh());
	}

	@Test
	@DisplayName("only dates present in both series are compared")
	void alignsOnDates() {
		BarSeries ticker = SyntheticBars.fromCloses("GAPS", SyntheticBars.linear(50, 60, 300), 0.01, 1e6);
		List<PriceBar> sparse = new ArrayList<>();
		for (int i = 0; i < ticker.size(); i++) {
			if (i % 10 != 0) {
				sparse.add(ticker.getBars().get(i));
			}
		}
		Optional<RsLine> rs = service.calculate(new BarSeries("GAPS", sparse), benchmark);
		assertTrue(rs.isPresent());
		assertEquals(252, rs.get().size());

		// 200 shared days is short of a year
		BarSeries young = SyntheticBars.fromCloses("IPO", SyntheticBars.linear(10, 12, 200), 0.01, 1e6);
		assertTrue(service.calculate(young, benchmark).isEmpty());
	}

	@Test
	@DisplayName("blue dot tolerates half a percent under the high")
	void blueDotTolerance() {
		assertTrue(RelativeStrengthService.isBlueDot(new double[] { 1.0, 1.2, 1.195 }, 0.995));
		assertFalse(RelativeStrengthService.isBlueDot(new double[] { 1.0, 1.2, 1.19 }, 0.995));
		assertFalse(RelativeStrengthService.isBlueDot(new double[0], 0.995));
	}
}
