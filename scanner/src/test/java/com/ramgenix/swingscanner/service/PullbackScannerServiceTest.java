package com.ramgenix.swingscanner.service;

import static org.junit.jupiter.api.Assertions.*;

import java.util.Arrays;
import java.util.Collections;
import java.util.List;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

import com.ramgenix.swingscanner.SyntheticBars;
import com.ramgenix.swingscanner.config.ScannerProperties;
import com.ramgenix.swingscanner.entity.BarSeries;
import com.ramgenix.swingscanner.entity.Setup;
import com.ramgenix.swingscanner.entity.SetupMetadata;
import com.ramgenix.swingscanner.entity.SetupType;
import com.ramgenix.swingscanner.entity.Zone;
import com.ramgenix.swingscanner.entity.ZoneType;
import com.ramgenix.swingscanner.utility.Indicators;

class PullbackScannerServiceTest {

	private static final Zone SUPPORT = new Zone(97.8, 98.2, 97.4, ZoneType.SUPPORT, 2.0);

	private final ScannerProperties properties = new ScannerProperties();
	private final PullbackScannerService service = new PullbackScannerService(properties,
			new RiskCalculator(properties));

	@Nested
	@DisplayName("strict pullback")
	class StrictTests {

		@Test
		@DisplayName("hammer into support with an oversold CCI hook")
		void detected() {
			BarSeries series = SyntheticBars.pullbackHammer("HAMR");
			DetectionResult result = service.scanStrict(series, Collections.singletonList(SUPPORT));

			assertTrue(result.isDetected(), String.valueOf(result));
			Setup setup = result.getSetup().get();
			assertEquals(SetupType.PULLBACK, setup.getSetupType());
			assertEquals(Boolean.FALSE, setup.meta(SetupMetadata.IS_RELAXED));
			assertEquals(97.8, setup.meta(SetupMetadata.SUPPORT_LEVEL));
			assertTrue((Double) setup.meta(SetupMetadata.CCI_YESTERDAY) < -100);
			assertTrue((Double) setup.meta(SetupMetadata.CCI_TODAY) > (Double) setup.meta(SetupMetadata.CCI_YESTERDAY));

			double atr = Indicators.atr(series.highs(), series.lows(), series.closes(), 14)[series.size() - 1];
			assertEquals(97.0 - 0.2 * atr, setup.getStopLoss(), 1e-9);
			assertEquals(100.3 * 1.001, setup.getEntry(), 1e-9);
			assertEquals(2 * setup.getRisk(), setup.getTakeProfit() - setup.getEntry(), 1e-9);
		}

		@Test
		@DisplayName("no support zone under the low means no strict setup")
		void noSupport() {
			DetectionResult result = service.scanStrict(SyntheticBars.pullbackHammer("HAMR"),
					Collections.emptyList());
			assertFalse(result.isDetected());
			assertEquals(RejectReason.NO_SIGNAL, result.getReason());
		}

		@Test
		@DisplayName("resistance zones are not support")
		void resistanceIgnored() {
			Zone resistance = new Zone(97.8, 98.2, 97.4, ZoneType.RESISTANCE, 2.0);
			assertFalse(service.scanStrict(SyntheticBars.pullbackHammer("HAMR"),
					Collections.singletonList(resistance)).isDetected());
		}
	}

	@Nested
	@DisplayName("relaxed pullback")
	class RelaxedTests {

		@Test
		@DisplayName("without support zones the 50 SMA anchors the stop")
		void fallsBackToSma() {
			BarSeries series = SyntheticBars.pullbackHammer("SOFT");
			DetectionResult result = service.scan(series, Collections.emptyList());

			assertTrue(result.isDetected(), String.valueOf(result));
			Setup setup = result.getSetup().get();
			assertEquals(Boolean.TRUE, setup.meta(SetupMetadata.IS_RELAXED));
			double sma50 = Indicators.sma(series.closes(), 50)[series.size() - 1];
			assertEquals(sma50, (Double) setup.meta(SetupMetadata.SUPPORT_LEVEL), 1e-9);
			assertTrue(setup.getStopLoss() < sma50);
		}

		@Test
		@DisplayName("strict match is preferred when both qualify")
		void strictFirst() {
			List<Zone> zones = Collections.singletonList(SUPPORT);
			Setup setup = service.scan(SyntheticBars.pullbackHammer("BOTH"), zones).getSetup().get();
			assertEquals(Boolean.FALSE, setup.meta(SetupMetadata.IS_RELAXED));
			assertTrue(service.scanRelaxed(SyntheticBars.pullbackHammer("BOTH"), zones).isDetected());
		}

		@Test
		@DisplayName("steady advance never pulls back to the EMAs")
		void steadyRiser() {
			DetectionResult result = service.scan(SyntheticBars.steadyRiser("CALM"), Collections.emptyList());
			assertFalse(result.isDetected());
			assertEquals(RejectReason.NO_SIGNAL, result.getReason());
		}
	}

	@Test
	@DisplayName("falling stock fails the trend filter on both paths")
	void trendFilter() {
		BarSeries series = SyntheticBars.fromCloses("DOWN", SyntheticBars.linear(100, 60, 120), 0.01, 1e6);
		assertEquals(RejectReason.TREND_FILTER, service.scanStrict(series, null).getReason());
		assertEquals(RejectReason.TREND_FILTER, service.scanRelaxed(series, null).getReason());
	}

	@Test
	@DisplayName("flat prices leave CCI undefined")
	void undefinedCci() {
		double[] closes = new double[80];
		Arrays.fill(closes, 25.0);
		DetectionResult result = service.scan(SyntheticBars.fromCloses("FLAT", closes, 0.0, 1e6), null);
		assertEquals(RejectReason.NO_SIGNAL, result.getReason());
		assertEquals("CCI undefined", result.getDetail());
	}
}
