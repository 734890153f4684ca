package com.ramgenix.swingscanner.utility;

import java.util.Arrays;

/**
 * Moving averages and oscillators over aligned double arrays. Undefined positions are {@code NaN}; a NaN input makes
 * the affected output positions NaN instead of failing.
 */
public final class Indicators {

	public static final double CCI_CONSTANT = 0.015;

	private Indicators() {
	}

	/**
	 * Exponential moving average with smoothing factor {@code 2/(length+1)}, seeded with the first observation and
	 * reported only once {@code length} observations have been seen.
	 */
	public static double[] ema(double[] values, int length) {
		return exponentialSmoothing(values, 2.0 / (length + 1), length);
	}

	/** Wilder smoothing: exponential smoothing with factor {@code 1/length}. */
	public static double[] wilder(double[] values, int length) {
		return exponentialSmoothing(values, 1.0 / length, length);
	}

	public static double[] sma(double[] values, int length) {
		double[] out = nanArray(values.length);
		for (int i = length - 1; i < values.length; i++) {
			double sum = 0;
			boolean defined = true;
			for (int j = i - length + 1; j <= i; j++) {
				if (Double.isNaN(values[j])) {
					defined = false;
					break;
				}
				sum += values[j];
			}
			if (defined) {
				out[i] = sum / length;
			}
		}
		return out;
	}

	public static double[] trueRange(double[] high, double[] low, double[] close) {
		double[] out = nanArray(close.length);
		for (int i = 1; i < close.length; i++) {
			double prevClose = close[i - 1];
			double range = high[i] - low[i];
			double upMove = Math.abs(high[i] - prevClose);
			double downMove = Math.abs(low[i] - prevClose);
			out[i] = Math.max(range, Math.max(upMove, downMove));
		}
		return out;
	}

	public static double[] atr(double[] high, double[] low, double[] close, int length) {
		return wilder(trueRange(high, low, close), length);
	}

	/**
	 * Commodity channel index. Windows with zero mean deviation are undefined.
	 */
	public static double[] cci(double[] high, double[] low, double[] close, int length) {
		int n = close.length;
		double[] typical = new double[n];
		for (int i = 0; i < n; i++) {
			typical[i] = (high[i] + low[i] + close[i]) / 3.0;
		}
		double[] mean = sma(typical, length);
		double[] out = nanArray(n);
		for (int i = length - 1; i < n; i++) {
			if (Double.isNaN(mean[i])) {
				continue;
			}
			double deviation = 0;
			for (int j = i - length + 1; j <= i; j++) {
				deviation += Math.abs(typical[j] - mean[i]);
			}
			deviation /= length;
			if (deviation > 0) {
				out[i] = (typical[i] - mean[i]) / (CCI_CONSTANT * deviation);
			}
		}
		return out;
	}

	private static double[] exponentialSmoothing(double[] values, double alpha, int minObservations) {
		double[] out = nanArray(values.length);
		double state = Double.NaN;
		int observations = 0;
		for (int i = 0; i < values.length; i++) {
			double value = values[i];
			if (Double.isNaN(value)) {
				continue;
			}
			state = Double.isNaN(state) ? value : alpha * value + (1 - alpha) * state;
			observations++;
			if (observations >= minObservations) {
				out[i] = state;
			}
		}
		return out;
	}

	static double[] nanArray(int size) {
		double[] out = new double[size];
		Arrays.fill(out, Double.NaN);
		return out;
	}
}
