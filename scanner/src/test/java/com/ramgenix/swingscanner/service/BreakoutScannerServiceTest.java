package com.ramgenix.swingscanner.service;

import static org.junit.jupiter.api.Assertions.*;

import java.time.LocalDate;
import java.util.Arrays;
import java.util.Collections;
import java.util.List;
import java.util.stream.Collectors;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

import com.ramgenix.swingscanner.SyntheticBars;
import com.ramgenix.swingscanner.config.ScannerProperties;
import com.ramgenix.swingscanner.entity.BarSeries;
import com.ramgenix.swingscanner.entity.Setup;
import com.ramgenix.swingscanner.entity.SetupMetadata;
import com.ramgenix.swingscanner.entity.SetupType;
import com.ramgenix.swingscanner.entity.SwingPoint;
import com.ramgenix.swingscanner.entity.Trendline;
import com.ramgenix.swingscanner.entity.Zone;
import com.ramgenix.swingscanner.entity.ZoneType;
import com.ramgenix.swingscanner.service.breakout.BreakoutContext;
import com.ramgenix.swingscanner.service.breakout.BreakoutPath;
import com.ramgenix.swingscanner.service.breakout.ConfirmedBreakoutPath;
import com.ramgenix.swingscanner.service.breakout.DryBasePath;

class BreakoutScannerServiceTest {

	private static final Zone SHELF = new Zone(98.5, 98.9, 98.1, ZoneType.RESISTANCE, 2.0);

	private final ScannerProperties properties = new ScannerProperties();
	private final BreakoutScannerService service = new BreakoutScannerService(properties,
			new RiskCalculator(properties), new TrendlineService(properties));

	@Nested
	@DisplayName("priority")
	class PriorityTests {

		@Test
		@DisplayName("paths run in the fixed order confirmed, trendline, level, RS lead, dry base")
		void pathOrder() {
			List<String> names = service.getPaths().stream().map(BreakoutPath::getName).collect(Collectors.toList());
			assertEquals(Arrays.asList("CONFIRMED_BREAKOUT", "TRENDLINE_BREAKOUT", "LEVEL_BREAKOUT", "RS_LEAD",
					"DRY_BASE"), names);
		}

		@Test
		@DisplayName("series that is both a confirmed breakout and a dry base reports the confirmed breakout")
		void confirmedBeatsDryBase() {
			BarSeries series = SyntheticBars.breakoutOverZone("PRIO");
			List<Zone> zones = Collections.singletonList(SHELF);

			BreakoutContext context = service.createContext(series, zones, 0.0, false, null);
			assertTrue(new DryBasePath().detect(context).isPresent(), "dry base matches on its own");
			assertTrue(new ConfirmedBreakoutPath().detect(context).isPresent());

			DetectionResult result = service.scan(series, zones, 0.0, false, null);
			assertTrue(result.isDetected());
			Setup setup = result.getSetup().get();
			assertEquals(SetupType.BREAKOUT, setup.getSetupType());
			assertEquals(ConfirmedBreakoutPath.NAME, setup.meta(SetupMetadata.PATH));
			assertEquals(series.lastDate(), setup.getSetupDate());
		}

		@Test
		@DisplayName("risk-rejected match stops the search instead of falling through")
		void riskRejectedStops() {
			Zone wide = new Zone(98.5, 98.9, 80.0, ZoneType.RESISTANCE, 2.0);
			DetectionResult result = service.scan(SyntheticBars.breakoutOverZone("WIDE"),
					Collections.singletonList(wide), 0.0, false, null);
			assertFalse(result.isDetected());
			assertEquals(RejectReason.RISK_REJECTED, result.getReason());
			assertEquals(ConfirmedBreakoutPath.NAME, result.getDetail());
		}
	}

	@Nested
	@DisplayName("setup risk math")
	class RiskTests {

		@Test
		@DisplayName("entry over today's high, stop under the zone, target at twice the risk")
		void riskMath() {
			BarSeries series = SyntheticBars.breakoutOverZone("RISK");
			Setup setup = service.scan(series, Collections.singletonList(SHELF), 0.0, false, null).getSetup().get();
			double entry = setup.getEntry();
			double risk = entry - setup.getStopLoss();
			assertEquals(series.lastHigh() * 1.001, entry, 1e-9);
			assertTrue(setup.getStopLoss() < SHELF.getLower());
			assertTrue(risk > 0 && risk <= 0.15 * entry);
			assertEquals(2 * risk, setup.getTakeProfit() - entry, 1e-9);
			assertEquals(2.0, setup.getRiskReward(), 1e-12);
		}
	}

	@Nested
	@DisplayName("rejections")
	class RejectionTests {

		@Test
		@DisplayName("falling stock fails the trend filter")
		void trendFilter() {
			BarSeries series = SyntheticBars.fromCloses("DOWN", SyntheticBars.linear(100, 60, 120), 0.01, 1e6);
			DetectionResult result = service.scan(series, Collections.singletonList(SHELF), 0.0, true, null);
			assertEquals(RejectReason.TREND_FILTER, result.getReason());
		}

		@Test
		@DisplayName("fewer than 60 bars is insufficient data")
		void shortHistory() {
			BarSeries series = SyntheticBars.fromCloses("NEW", SyntheticBars.linear(10, 12, 30), 0.01, 1e6);
			assertEquals(RejectReason.INSUFFICIENT_DATA, service.scan(series, null, 0.0, false).getReason());
		}

		@Test
		@DisplayName("steady low-volatility advance with nothing overhead has no signal")
		void steadyRiser() {
			DetectionResult result = service.scan(SyntheticBars.steadyRiser("CALM"), Collections.emptyList(), 0.0,
					true, null);
			assertEquals(RejectReason.NO_SIGNAL, result.getReason());
		}
	}

	@Nested
	@DisplayName("near-breakout watchlist")
	class WatchlistTests {

		private final BarSeries series = SyntheticBars.steadyRiser("NEAR");

		private Trendline lineAt123() {
			return new Trendline(new SwingPoint(LocalDate.of(2023, 1, 2), 130, 5, 0),
					new SwingPoint(LocalDate.of(2023, 1, 16), 128, 4, 10), 2, 35);
		}

		@Test
		@DisplayName("close within 1.5% under a resistance zone")
		void zone() {
			Zone overhead = new Zone(123.5, 124.0, 123.0, ZoneType.RESISTANCE, 1.0);
			Zone support = new Zone(122.0, 122.5, 121.5, ZoneType.SUPPORT, 1.0);
			Setup setup = service.scanNearBreakout(series, Arrays.asList(support, overhead), null, true).getSetup()
					.get();
			assertEquals(SetupType.WATCHLIST, setup.getSetupType());
			assertEquals(BreakoutScannerService.LEVEL_TYPE_ZONE, setup.meta(SetupMetadata.LEVEL_TYPE));
			assertEquals(124.0, setup.meta(SetupMetadata.LEVEL));
			assertEquals((124.0 - series.lastClose()) / 124.0 * 100,
					(Double) setup.meta(SetupMetadata.DISTANCE_PCT), 1e-9);
			assertEquals(Boolean.TRUE, setup.meta(SetupMetadata.RS_BLUE_DOT));
			assertFalse(setup.hasRiskMath());
		}

		@Test
		@DisplayName("zone above yesterday's close is watched whatever its label")
		void untaggedOverheadZone() {
			Zone above = new Zone(123.5, 124.0, 123.0, ZoneType.SUPPORT, 1.0);
			Setup setup = service.scanNearBreakout(series, Collections.singletonList(above), null, false).getSetup()
					.get();
			assertEquals(BreakoutScannerService.LEVEL_TYPE_ZONE, setup.meta(SetupMetadata.LEVEL_TYPE));
			assertEquals(124.0, setup.meta(SetupMetadata.LEVEL));
		}

		@Test
		@DisplayName("nearer trendline wins over a zone")
		void trendlineNearer() {
			Zone overhead = new Zone(123.5, 124.0, 123.0, ZoneType.RESISTANCE, 1.0);
			Setup setup = service.scanNearBreakout(series, Collections.singletonList(overhead), lineAt123(), false)
					.getSetup().get();
			assertEquals(BreakoutScannerService.LEVEL_TYPE_TRENDLINE, setup.meta(SetupMetadata.LEVEL_TYPE));
			assertEquals(123.0, (Double) setup.meta(SetupMetadata.LEVEL), 1e-9);
		}

		@Test
		@DisplayName("levels further than 1.5% away are ignored")
		void tooFar() {
			Zone far = new Zone(129.5, 130.0, 129.0, ZoneType.RESISTANCE, 1.0);
			DetectionResult result = service.scanNearBreakout(series, Collections.singletonList(far), null, true);
			assertFalse(result.isDetected());
			assertEquals(RejectReason.NO_SIGNAL, result.getReason());
		}
	}
}
