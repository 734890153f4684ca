package com.ramgenix.swingscanner.utility;

/**
 * One-dimensional Gaussian kernel density estimate with Scott's rule bandwidth ({@code n^(-1/5)} times the sample
 * standard deviation).
 */
public class KernelDensityEstimator {

	private static final double INV_SQRT_2PI = 1.0 / Math.sqrt(2 * Math.PI);

	private final double[] points;
	private final double bandwidth;

	/**
	 * @throws ArithmeticException when the sample has fewer than two points or zero spread
	 */
	public KernelDensityEstimator(double[] points) {
		if (points.length < 2) {
			throw new ArithmeticException("Density estimate needs at least two points");
		}
		double std = StockCalculationUtility.std(points, 1);
		if (!(std > 0) || !Double.isFinite(std)) {
			throw new ArithmeticException("Density estimate over a degenerate sample (std=" + std + ")");
		}
		this.points = points.clone();
		this.bandwidth = Math.pow(points.length, -0.2) * std;
	}

	public double getBandwidth() {
		return bandwidth;
	}

	public double density(double x) {
		double sum = 0;
		for (double point : points) {
			double z = (x - point) / bandwidth;
			sum += Math.exp(-0.5 * z * z);
		}
		return sum * INV_SQRT_2PI / (points.length * bandwidth);
	}

	public double[] evaluate(double[] grid) {
		double[] out = new double[grid.length];
		for (int i = 0; i < grid.length; i++) {
			out[i] = density(grid[i]);
		}
		return out;
	}

	/** {@code count} evenly spaced points from {@code start} to {@code end}, both included. */
	public static double[] linspace(double start, double end, int count) {
		double[] out = new double[count];
		if (count == 1) {
			out[0] = start;
			return out;
		}
		double step = (end - start) / (count - 1);
		for (int i = 0; i < count; i++) {
			out[i] = start + step * i;
		}
		out[count - 1] = end;
		return out;
	}
}
