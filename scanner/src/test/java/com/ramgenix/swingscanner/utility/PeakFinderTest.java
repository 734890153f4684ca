package com.ramgenix.swingscanner.utility;

import static org.junit.jupiter.api.Assertions.*;

import java.util.Arrays;
import java.util.List;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

class PeakFinderTest {

	@Test
	@DisplayName("inclusive extrema let end points and ties qualify")
	void inclusiveMaxima() {
		double[] data = { 5, 1, 3, 3, 1, 4 };
		assertEquals(Arrays.asList(0, 2, 3, 5), PeakFinder.relativeMaxima(data, 1, true));
		assertEquals(Arrays.asList(1, 4), PeakFinder.relativeMinima(data, 1, true));
	}

	@Test
	@DisplayName("strict extrema never report the ends or plateaus")
	void strictMaxima() {
		double[] data = { 5, 1, 3, 3, 1, 4, 2 };
		assertEquals(Arrays.asList(5), PeakFinder.relativeMaxima(data, 1, false));
	}

	@Test
	@DisplayName("flat top reports its middle sample")
	void plateauMidpoint() {
		double[] data = { 0, 1, 2, 2, 2, 1, 0 };
		List<PeakFinder.Peak> peaks = PeakFinder.findPeaks(data, 0.0, 1);
		assertEquals(1, peaks.size());
		assertEquals(3, peaks.get(0).getIndex());
		assertEquals(2.0, peaks.get(0).getProminence(), 1e-12);
	}

	@Test
	@DisplayName("distance keeps the taller of two close peaks")
	void distanceFilter() {
		double[] data = { 0, 5, 0, 7, 0, 0, 0, 0, 3, 0 };
		List<PeakFinder.Peak> peaks = PeakFinder.findPeaks(data, 0.0, 3);
		assertEquals(2, peaks.size());
		assertEquals(3, peaks.get(0).getIndex());
		assertEquals(8, peaks.get(1).getIndex());
	}

	@Test
	@DisplayName("prominence is measured to the higher of the two surrounding minima")
	void prominenceFilter() {
		double[] data = { 0, 10, 6, 8, 6, 12, 0 };
		List<PeakFinder.Peak> all = PeakFinder.findPeaks(data, 0.0, 1);
		assertEquals(3, all.size());
		assertEquals(2.0, all.get(1).getProminence(), 1e-12);
		assertEquals(4.0, all.get(0).getProminence(), 1e-12);
		assertEquals(12.0, all.get(2).getProminence(), 1e-12);

		List<PeakFinder.Peak> prominent = PeakFinder.findPeaks(data, 3.0, 1);
		assertEquals(2, prominent.size());
		assertEquals(1, prominent.get(0).getIndex());
		assertEquals(5, prominent.get(1).getIndex());
	}
}
