package com.ramgenix.swingscanner.utility;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.Comparator;
import java.util.List;

/**
 * Local extremum search over a sampled series.
 */
public final class PeakFinder {

	private PeakFinder() {
	}

	/**
	 * Indices whose value beats every neighbour within {@code order} positions on both sides. Neighbour positions past
	 * either end are clamped to the end point, so with {@code inclusive} the ends can qualify and without it they never
	 * do.
	 */
	public static List<Integer> relativeMaxima(double[] data, int order, boolean inclusive) {
		return relativeExtrema(data, order, inclusive, true);
	}

	/** Mirror of {@link #relativeMaxima(double[], int, boolean)} for minima. */
	public static List<Integer> relativeMinima(double[] data, int order, boolean inclusive) {
		return relativeExtrema(data, order, inclusive, false);
	}

	private static List<Integer> relativeExtrema(double[] data, int order, boolean inclusive, boolean maxima) {
		List<Integer> result = new ArrayList<>();
		int n = data.length;
		for (int i = 0; i < n; i++) {
			boolean extremum = !Double.isNaN(data[i]);
			for (int k = 1; k <= order && extremum; k++) {
				double left = data[Math.max(0, i - k)];
				double right = data[Math.min(n - 1, i + k)];
				extremum = beats(data[i], left, inclusive, maxima) && beats(data[i], right, inclusive, maxima);
			}
			if (extremum) {
				result.add(i);
			}
		}
		return result;
	}

	private static boolean beats(double value, double other, boolean inclusive, boolean maxima) {
		if (maxima) {
			return inclusive ? value >= other : value > other;
		}
		return inclusive ? value <= other : value < other;
	}

	/**
	 * Peaks of {@code x} at least {@code distance} samples apart (taller peaks win) whose topographic prominence is at
	 * least {@code minProminence}. Flat tops report their middle sample. Results are in index order.
	 */
	public static List<Peak> findPeaks(double[] x, double minProminence, int distance) {
		List<Integer> candidates = localMaxima(x);
		List<Integer> spaced = selectByDistance(x, candidates, distance);
		List<Peak> peaks = new ArrayList<>();
		for (int index : spaced) {
			double prominence = prominence(x, index);
			if (prominence >= minProminence) {
				peaks.add(new Peak(index, x[index], prominence));
			}
		}
		return peaks;
	}

	static List<Integer> localMaxima(double[] x) {
		List<Integer> maxima = new ArrayList<>();
		int n = x.length;
		int i = 1;
		while (i < n - 1) {
			if (x[i - 1] < x[i]) {
				int ahead = i + 1;
				while (ahead < n - 1 && x[ahead] == x[i]) {
					ahead++;
				}
				if (x[ahead] < x[i]) {
					maxima.add((i + ahead - 1) / 2);
					i = ahead;
				}
			}
			i++;
		}
		return maxima;
	}

	private static List<Integer> selectByDistance(double[] x, List<Integer> peaks, int distance) {
		int count = peaks.size();
		boolean[] keep = new boolean[count];
		Arrays.fill(keep, true);
		List<Integer> order = new ArrayList<>();
		for (int j = 0; j < count; j++) {
			order.add(j);
		}
		order.sort(Comparator.comparingDouble((Integer j) -> x[peaks.get(j)]).reversed()
				.thenComparing(Comparator.<Integer>reverseOrder()));
		for (int j : order) {
			if (!keep[j]) {
				continue;
			}
			for (int k = j - 1; k >= 0 && peaks.get(j) - peaks.get(k) < distance; k--) {
				keep[k] = false;
			}
			for (int k = j + 1; k < count && peaks.get(k) - peaks.get(j) < distance; k++) {
				keep[k] = false;
			}
		}
		List<Integer> selected = new ArrayList<>();
		for (int j = 0; j < count; j++) {
			if (keep[j]) {
				selected.add(peaks.get(j));
			}
		}
		return selected;
	}

	static double prominence(double[] x, int peak) {
		double height = x[peak];
		double leftMin = height;
		for (int i = peak; i >= 0 && x[i] <= height; i--) {
			leftMin = Math.min(leftMin, x[i]);
		}
		double rightMin = height;
		for (int i = peak; i < x.length && x[i] <= height; i++) {
			rightMin = Math.min(rightMin, x[i]);
		}
		return height - Math.max(leftMin, rightMin);
	}

	public static final class Peak {
		private final int index;
		private final double value;
		private final double prominence;

		public Peak(int index, double value, double prominence) {
			this.index = index;
			this.value = value;
			this.prominence = prominence;
		}

		public int getIndex() {
			return index;
		}

		public double getValue() {
			return value;
		}

		public double getProminence() {
			return prominence;
		}

		@Override
		public String toString() {
			return "Peak{index=" + index + ", value=" + String.format("%.2f", value) + ", prominence="
					+ String.format("%.2f", prominence) + '}';
		}
	}
}
