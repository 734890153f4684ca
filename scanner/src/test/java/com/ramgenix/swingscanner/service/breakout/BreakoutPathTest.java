package com.ramgenix.swingscanner.service.breakout;

import static org.junit.jupiter.api.Assertions.*;

import java.time.LocalDate;
import java.util.Arrays;
import java.util.Collections;
import java.util.List;
import java.util.Optional;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

import com.ramgenix.swingscanner.SyntheticBars;
import com.ramgenix.swingscanner.config.ScannerProperties;
import com.ramgenix.swingscanner.entity.BarSeries;
import com.ramgenix.swingscanner.entity.SetupMetadata;
import com.ramgenix.swingscanner.entity.SwingPoint;
import com.ramgenix.swingscanner.entity.Trendline;
import com.ramgenix.swingscanner.entity.Zone;
import com.ramgenix.swingscanner.entity.ZoneType;

/**
 * Each breakout path in isolation, fed a hand-built context.
 */
class BreakoutPathTest {

	private static final Zone RESISTANCE = new Zone(100, 101, 99, ZoneType.RESISTANCE, 5);
	private static final Zone LOWER_RESISTANCE = new Zone(90, 91, 89, ZoneType.RESISTANCE, 5);

	private static BreakoutContext.BreakoutContextBuilder context(double close, double volumeRatio,
			double stockReturn, List<Zone> zones) {
		return BreakoutContext.builder().config(new ScannerProperties().getBreakout()).zones(zones).close(close)
				.high(close + 0.5).low(close - 1).previousClose(99.5).ema8(98).ema20(96).sma50(92).atr(1.5)
				.volumeSma50(1e6).volumeRatio(volumeRatio).stockReturn3m(stockReturn).benchmarkReturn3m(0.0);
	}

	@Nested
	@DisplayName("confirmed breakout")
	class ConfirmedTests {

		private final ConfirmedBreakoutPath path = new ConfirmedBreakoutPath();

		@Test
		@DisplayName("close 1% over the highest cleared zone on heavy volume")
		void detected() {
			Optional<BreakoutSignal> signal = path
					.detect(context(102, 2.0, 0.10, Arrays.asList(LOWER_RESISTANCE, RESISTANCE)).build());
			assertTrue(signal.isPresent());
			assertEquals(ConfirmedBreakoutPath.NAME, signal.get().getPath());
			assertEquals(99, signal.get().getStopReference(), 1e-12);
			assertEquals(100.0, signal.get().getMetadata().get(SetupMetadata.RESISTANCE_LEVEL));
		}

		@Test
		@DisplayName("needs outperformance, volume, and a 0.5%-3% extension")
		void rejected() {
			List<Zone> zones = Collections.singletonList(RESISTANCE);
			assertTrue(path.detect(context(102, 2.0, 0.0, zones).build()).isEmpty());
			assertTrue(path.detect(context(102, 1.4, 0.10, zones).build()).isEmpty());
			assertTrue(path.detect(context(104.5, 2.0, 0.10, zones).build()).isEmpty());
			assertTrue(path.detect(context(101.2, 2.0, 0.10, zones).build()).isEmpty());
			assertTrue(path.detect(context(102, 2.0, 0.10, Collections.emptyList()).build()).isEmpty());
		}
	}

	@Nested
	@DisplayName("trendline breakout")
	class TrendlineTests {

		private final TrendlineBreakoutPath path = new TrendlineBreakoutPath();

		private Trendline lineEndingAt100() {
			SwingPoint first = new SwingPoint(LocalDate.of(2024, 1, 10), 110, 8, 0);
			SwingPoint second = new SwingPoint(LocalDate.of(2024, 2, 7), 105, 6, 20);
			return new Trendline(first, second, 3, 40);
		}

		@Test
		@DisplayName("close over today's line value with 1.2x volume, stop under the line")
		void detected() {
			BreakoutSignal signal = path.detect(
					context(101, 1.3, 0.0, Collections.emptyList()).trendline(lineEndingAt100()).build()).get();
			assertEquals(TrendlineBreakoutPath.NAME, signal.getPath());
			assertEquals(98.0, signal.getStopReference(), 1e-9);
			assertEquals(3, signal.getMetadata().get(SetupMetadata.TRENDLINE_TOUCHES));
		}

		@Test
		@DisplayName("no line, close under the line, or light volume")
		void rejected() {
			assertTrue(path.detect(context(101, 1.3, 0.0, Collections.emptyList()).build()).isEmpty());
			assertTrue(path.detect(context(99.5, 1.3, 0.0, Collections.emptyList()).trendline(lineEndingAt100())
					.build()).isEmpty());
			assertTrue(path.detect(context(101, 1.1, 0.0, Collections.emptyList()).trendline(lineEndingAt100())
					.build()).isEmpty());
		}
	}

	@Nested
	@DisplayName("level breakout")
	class LevelTests {

		private final LevelBreakoutPath path = new LevelBreakoutPath();

		@Test
		@DisplayName("moderate volume push just over the highest zone")
		void detected() {
			Optional<BreakoutSignal> signal = path
					.detect(context(102, 1.2, 0.0, Arrays.asList(LOWER_RESISTANCE, RESISTANCE)).build());
			assertTrue(signal.isPresent());
			assertEquals(LevelBreakoutPath.NAME, signal.get().getPath());
		}

		@Test
		@DisplayName("lagging the benchmark or extended past 2.5% is not a level breakout")
		void rejected() {
			List<Zone> zones = Collections.singletonList(RESISTANCE);
			assertTrue(path.detect(context(102, 1.2, -0.01, zones).build()).isEmpty());
			assertTrue(path.detect(context(103.8, 1.2, 0.0, zones).build()).isEmpty());
			assertTrue(path.detect(context(102, 1.1, 0.0, zones).build()).isEmpty());
		}
	}

	@Nested
	@DisplayName("RS-led early breakout")
	class RsLeadTests {

		private final RsLeadBreakoutPath path = new RsLeadBreakoutPath();

		@Test
		@DisplayName("blue dot with price up to 3% under the highest zone, no volume needed")
		void detected() {
			BreakoutSignal signal = path
					.detect(context(99.5, 0.5, 0.0, Collections.singletonList(RESISTANCE)).rsBlueDot(true).build())
					.get();
			assertEquals(RsLeadBreakoutPath.NAME, signal.getPath());
			assertEquals(Boolean.TRUE, signal.getMetadata().get(SetupMetadata.IS_RS_LEAD));
			assertEquals(Boolean.FALSE, signal.getMetadata().get(SetupMetadata.IS_BREAKOUT));
		}

		@Test
		@DisplayName("no blue dot, already above the zone, or too far below")
		void rejected() {
			List<Zone> zones = Collections.singletonList(RESISTANCE);
			assertTrue(path.detect(context(99.5, 0.5, 0.0, zones).build()).isEmpty());
			assertTrue(path.detect(context(101.5, 0.5, 0.0, zones).rsBlueDot(true).build()).isEmpty());
			assertTrue(path.detect(context(96, 0.5, 0.0, zones).rsBlueDot(true).build()).isEmpty());
		}
	}

	@Nested
	@DisplayName("overhead zones")
	class OverheadTests {

		@Test
		@DisplayName("a support zone above yesterday's close still counts as overhead")
		void clearedToday() {
			Zone justCleared = new Zone(100, 101, 99, ZoneType.SUPPORT, 5);
			Zone below = new Zone(80, 81, 79, ZoneType.SUPPORT, 5);
			BreakoutContext ctx = context(102, 2.0, 0.1, Arrays.asList(below, justCleared)).build();
			assertEquals(Collections.singletonList(justCleared), ctx.overheadZones());
			assertEquals(justCleared, ctx.nearestOverheadZone().get());
			assertEquals(0.1, ctx.rsVsBenchmark(), 1e-12);
		}
	}

	@Nested
	@DisplayName("dry coiled-spring base")
	class DryBaseTests {

		private final DryBasePath path = new DryBasePath();
		private final Zone overhead = new Zone(100, 100.5, 99.5, ZoneType.RESISTANCE, 5);

		/**
		 * 40 bars: flat at 97, then a 15-bar rounded dip ending at 96.98. Bars before the last five swing +/-1,
		 * the last five swing +/-{@code recentHalfRange}.
		 */
		private BarSeries base(double[] lastFifteen, double recentHalfRange, double recentVolume) {
			int n = 40;
			double[] closes = new double[n];
			double[] highs = new double[n];
			double[] lows = new double[n];
			double[] volumes = new double[n];
			for (int i = 0; i < n; i++) {
				closes[i] = i < 25 ? 97.0 : lastFifteen[i - 25];
				double half = i < 35 ? 1.0 : recentHalfRange;
				highs[i] = closes[i] + half;
				lows[i] = closes[i] - half;
				volumes[i] = i < 37 ? 1e6 : recentVolume;
			}
			return SyntheticBars.series("COIL", highs, lows, closes, volumes);
		}

		private double[] roundedDip() {
			double[] closes = new double[15];
			for (int j = 0; j < 15; j++) {
				closes[j] = 96 + 0.02 * (j - 7) * (j - 7);
			}
			return closes;
		}

		private BreakoutContext contextFor(BarSeries series, double volumeRatio, Zone zone) {
			return context(series.lastClose(), volumeRatio, 0.0, Collections.singletonList(zone)).series(series)
					.previousClose(series.close(series.size() - 2)).build();
		}

		@Test
		@DisplayName("quiet contraction in a rounded dip just under resistance")
		void dryUp() {
			BreakoutSignal signal = path.detect(contextFor(base(roundedDip(), 0.2, 5e5), 0.5, overhead)).get();
			assertEquals(DryBasePath.NAME, signal.getPath());
			assertEquals(99.5, signal.getStopReference(), 1e-12);
			assertEquals(Boolean.FALSE, signal.getMetadata().get(SetupMetadata.IS_BREAKOUT));
			// recent mean range 0.416 against 2.0 before
			assertEquals(79.2, (Double) signal.getMetadata().get(SetupMetadata.TR_CONTRACTION_PCT), 1e-6);
		}

		@Test
		@DisplayName("ranges that do not contract are not a coil")
		void noContraction() {
			assertTrue(path.detect(contextFor(base(roundedDip(), 1.5, 5e5), 0.5, overhead)).isEmpty());
		}

		@Test
		@DisplayName("straight or still-falling declines are not U-shaped")
		void notRounded() {
			double[] straight = new double[15];
			double[] stillFalling = new double[15];
			for (int j = 0; j < 15; j++) {
				straight[j] = 98 - 0.1 * j;
				stillFalling[j] = 96 + 0.01 * (20 - j) * (20 - j);
			}
			assertTrue(path.detect(contextFor(base(straight, 0.2, 5e5), 0.5, overhead)).isEmpty());
			assertTrue(path.detect(contextFor(base(stillFalling, 0.2, 5e5), 0.5, overhead)).isEmpty());
		}

		@Test
		@DisplayName("below the zone needs 3-day volume under its average and a close within 5% of the level")
		void dryUpRules() {
			assertTrue(path.detect(contextFor(base(roundedDip(), 0.2, 1.2e6), 0.5, overhead)).isEmpty());
			Zone farAbove = new Zone(104, 104.5, 103.5, ZoneType.RESISTANCE, 5);
			assertTrue(path.detect(contextFor(base(roundedDip(), 0.2, 5e5), 0.5, farAbove)).isEmpty());
		}

		@Test
		@DisplayName("at or above the zone needs 1.5x volume")
		void breakoutBranch() {
			Zone underfoot = new Zone(96.5, 96.9, 96.1, ZoneType.RESISTANCE, 5);
			BarSeries series = base(roundedDip(), 0.2, 5e5);

			BreakoutSignal signal = path.detect(contextFor(series, 1.6, underfoot)).get();
			assertEquals(Boolean.TRUE, signal.getMetadata().get(SetupMetadata.IS_BREAKOUT));
			assertTrue(path.detect(contextFor(series, 1.4, underfoot)).isEmpty());
		}
	}
}
