package com.ramgenix.swingscanner.utility;

import static org.junit.jupiter.api.Assertions.*;

import java.util.Arrays;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

class IndicatorsTest {

	private static final double[] PRICES = { 10, 11, 12, 11, 13, 14, 13, 15, 16, 15, 17, 18 };

	@Nested
	@DisplayName("sma")
	class SmaTests {

		@Test
		@DisplayName("undefined for the first p-1 points, mean of exactly p values after")
		void warmUpAndWindowMean() {
			for (int p = 1; p <= 6; p++) {
				double[] sma = Indicators.sma(PRICES, p);
				for (int i = 0; i < PRICES.length; i++) {
					if (i < p - 1) {
						assertTrue(Double.isNaN(sma[i]), "p=" + p + " i=" + i);
					} else {
						double sum = 0;
						for (int j = i - p + 1; j <= i; j++) {
							sum += PRICES[j];
						}
						assertEquals(sum / p, sma[i], 1e-12, "p=" + p + " i=" + i);
					}
				}
			}
		}

		@Test
		@DisplayName("window containing NaN stays undefined")
		void nanInWindow() {
			double[] sma = Indicators.sma(new double[] { 1, Double.NaN, 3, 4, 5 }, 2);
			assertTrue(Double.isNaN(sma[1]));
			assertTrue(Double.isNaN(sma[2]));
			assertEquals(3.5, sma[3], 1e-12);
		}
	}

	@Nested
	@DisplayName("ema")
	class EmaTests {

		@Test
		@DisplayName("seeded with the first value and reported from the length-th observation")
		void seededRecursion() {
			double[] ema = Indicators.ema(new double[] { 2, 4, 6, 8 }, 3);
			assertTrue(Double.isNaN(ema[0]));
			assertTrue(Double.isNaN(ema[1]));
			// alpha 0.5: 2 -> 3 -> 4.5 -> 6.25
			assertEquals(4.5, ema[2], 1e-12);
			assertEquals(6.25, ema[3], 1e-12);
		}

		@Test
		@DisplayName("non-negative for non-negative input")
		void nonNegative() {
			double[] ema = Indicators.ema(new double[] { 0, 5, 0, 0, 0, 0, 0, 0, 0, 0 }, 4);
			for (double value : ema) {
				assertTrue(Double.isNaN(value) || value >= 0);
			}
		}
	}

	@Nested
	@DisplayName("atr and true range")
	class AtrTests {

		@Test
		@DisplayName("true range uses the previous close and leaves the first bar undefined")
		void trueRangeGaps() {
			double[] high = { 10, 12, 11 };
			double[] low = { 9, 11, 8 };
			double[] close = { 9.5, 11.5, 10 };
			double[] tr = Indicators.trueRange(high, low, close);
			assertTrue(Double.isNaN(tr[0]));
			assertEquals(2.5, tr[1], 1e-12);
			assertEquals(3.5, tr[2], 1e-12);
		}

		@Test
		@DisplayName("never negative on a random-looking series")
		void nonNegative() {
			int n = 80;
			double[] high = new double[n];
			double[] low = new double[n];
			double[] close = new double[n];
			for (int i = 0; i < n; i++) {
				close[i] = 50 + 5 * Math.sin(i * 1.3) + i * 0.1;
				high[i] = close[i] + Math.abs(Math.cos(i)) * 2;
				low[i] = close[i] - Math.abs(Math.sin(i * 0.5)) * 2;
			}
			double[] atr = Indicators.atr(high, low, close, 14);
			for (int i = 0; i < n; i++) {
				assertTrue(Double.isNaN(atr[i]) || atr[i] >= 0, "i=" + i);
			}
			assertTrue(Double.isNaN(atr[13]));
			assertFalse(Double.isNaN(atr[14]));
		}

		@Test
		@DisplayName("wilder smoothing of a constant range is that constant")
		void constantRange() {
			int n = 30;
			double[] high = new double[n];
			double[] low = new double[n];
			double[] close = new double[n];
			for (int i = 0; i < n; i++) {
				high[i] = 101;
				low[i] = 99;
				close[i] = 100;
			}
			assertEquals(2.0, Indicators.atr(high, low, close, 14)[n - 1], 1e-12);
		}
	}

	@Nested
	@DisplayName("cci")
	class CciTests {

		@Test
		@DisplayName("flat prices leave CCI undefined")
		void zeroDeviation() {
			double[] flat = new double[25];
			Arrays.fill(flat, 42.0);
			double[] cci = Indicators.cci(flat, flat, flat, 20);
			for (double value : cci) {
				assertTrue(Double.isNaN(value));
			}
		}

		@Test
		@DisplayName("last bar of a steady rise reads strongly positive")
		void risingSeries() {
			double[] close = new double[30];
			for (int i = 0; i < close.length; i++) {
				close[i] = 100 + i;
			}
			double[] cci = Indicators.cci(close, close, close, 20);
			assertTrue(Double.isNaN(cci[18]));
			// typical price equals close: (129 - 119.5) / (0.015 * 5)
			assertEquals(9.5 / (Indicators.CCI_CONSTANT * 5.0), cci[29], 1e-9);
		}
	}
}
