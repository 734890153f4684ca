package com.ramgenix.swingscanner.utility;

import java.util.Arrays;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import io.micrometer.common.util.StringUtils;

public class StockCalculationUtility {

	private static final Logger LOG = LoggerFactory.getLogger(StockCalculationUtility.class);

	private StockCalculationUtility() {
	}

	/**
	 * Fractional change of the last close against the close {@code bars} bars earlier.
	 *
	 * @return the return, or NaN when the history is too short or the base price is not positive
	 */
	public static double periodReturn(double[] closes, int bars) {
		if (closes == null || closes.length <= bars) {
			return Double.NaN;
		}
		double latestClose = closes[closes.length - 1];
		double oldClose = closes[closes.length - 1 - bars];
		if (!(oldClose > 0) || Double.isNaN(latestClose)) {
			return Double.NaN;
		}
		return (latestClose - oldClose) / oldClose;
	}

	/** Mean of {@code values[from..to)}. */
	public static double mean(double[] values, int from, int to) {
		if (from < 0 || to > values.length || from >= to) {
			return Double.NaN;
		}
		double sum = 0;
		for (int i = from; i < to; i++) {
			sum += values[i];
		}
		return sum / (to - from);
	}

	/** Mean of the last {@code count} values. */
	public static double meanOfLast(double[] values, int count) {
		return mean(values, values.length - count, values.length);
	}

	public static double max(double[] values, int from, int to) {
		double max = Double.NEGATIVE_INFINITY;
		for (int i = from; i < to; i++) {
			max = Math.max(max, values[i]);
		}
		return max;
	}

	public static double min(double[] values, int from, int to) {
		double min = Double.POSITIVE_INFINITY;
		for (int i = from; i < to; i++) {
			min = Math.min(min, values[i]);
		}
		return min;
	}

	public static int argMax(double[] values, int from, int to) {
		int best = from;
		for (int i = from + 1; i < to; i++) {
			if (values[i] > values[best]) {
				best = i;
			}
		}
		return best;
	}

	public static int argMin(double[] values, int from, int to) {
		int best = from;
		for (int i = from + 1; i < to; i++) {
			if (values[i] < values[best]) {
				best = i;
			}
		}
		return best;
	}

	/** Standard deviation with divisor {@code n - ddof}. */
	public static double std(double[] values, int ddof) {
		int n = values.length;
		if (n - ddof <= 0) {
			return Double.NaN;
		}
		double mean = mean(values, 0, n);
		double sumSq = 0;
		for (double value : values) {
			double d = value - mean;
			sumSq += d * d;
		}
		return Math.sqrt(sumSq / (n - ddof));
	}

	/**
	 * Percentile with linear interpolation between closest ranks.
	 *
	 * @param percent value in [0, 100]
	 */
	public static double percentile(double[] values, double percent) {
		if (values.length == 0) {
			return Double.NaN;
		}
		double[] sorted = values.clone();
		Arrays.sort(sorted);
		double rank = percent / 100.0 * (sorted.length - 1);
		int lower = (int) Math.floor(rank);
		int upper = (int) Math.ceil(rank);
		double weight = rank - lower;
		return sorted[lower] + (sorted[upper] - sorted[lower]) * weight;
	}

	public static boolean allFinite(double... values) {
		for (double value : values) {
			if (!Double.isFinite(value)) {
				return false;
			}
		}
		return true;
	}

	/**
	 * Safely parse a double value from a string.
	 *
	 * @return the parsed value, or NaN when blank or malformed
	 */
	public static double parseDouble(String value) {
		if (StringUtils.isBlank(value)) {
			return Double.NaN;
		}
		try {
			return Double.parseDouble(value.trim());
		} catch (NumberFormatException e) {
			LOG.debug("Invalid number format: {}", value);
			return Double.NaN;
		}
	}

}
