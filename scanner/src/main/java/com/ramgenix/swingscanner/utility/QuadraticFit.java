package com.ramgenix.swingscanner.utility;

/**
 * Least-squares parabola {@code y = a*x^2 + b*x + c} over {@code x = 0..n-1}.
 */
public final class QuadraticFit {

	private final double a;
	private final double b;
	private final double c;
	private final int length;

	private QuadraticFit(double a, double b, double c, int length) {
		this.a = a;
		this.b = b;
		this.c = c;
		this.length = length;
	}

	/**
	 * @throws ArithmeticException when fewer than three finite points are supplied or the system is singular
	 */
	public static QuadraticFit fit(double[] y) {
		int n = y.length;
		if (n < 3) {
			throw new ArithmeticException("Quadratic fit needs at least three points, got " + n);
		}
		// centred abscissa keeps the normal equations well conditioned
		double centre = (n - 1) / 2.0;
		double s0 = n, s1 = 0, s2 = 0, s3 = 0, s4 = 0;
		double t0 = 0, t1 = 0, t2 = 0;
		for (int i = 0; i < n; i++) {
			if (!Double.isFinite(y[i])) {
				throw new ArithmeticException("Quadratic fit over non-finite value at " + i);
			}
			double x = i - centre;
			double x2 = x * x;
			s1 += x;
			s2 += x2;
			s3 += x2 * x;
			s4 += x2 * x2;
			t0 += y[i];
			t1 += x * y[i];
			t2 += x2 * y[i];
		}
		// normal equations: [s4 s3 s2; s3 s2 s1; s2 s1 s0] * [a b c] = [t2 t1 t0]
		double det = det3(s4, s3, s2, s3, s2, s1, s2, s1, s0);
		if (Math.abs(det) < 1e-12) {
			throw new ArithmeticException("Singular quadratic fit");
		}
		double ac = det3(t2, s3, s2, t1, s2, s1, t0, s1, s0) / det;
		double bc = det3(s4, t2, s2, s3, t1, s1, s2, t0, s0) / det;
		double cc = det3(s4, s3, t2, s3, s2, t1, s2, s1, t0) / det;

		double a = ac;
		double b = bc - 2 * ac * centre;
		double c = ac * centre * centre - bc * centre + cc;
		return new QuadraticFit(a, b, c, n);
	}

	/**
	 * True when the parabola through {@code y} opens upward with curvature above {@code epsilon} and its vertex lies
	 * inside the fitted window. With {@code standardize} the values are z-scored first; a flat window is never a U.
	 */
	public static boolean isUShaped(double[] y, double epsilon, boolean standardize) {
		double[] values = y;
		if (standardize) {
			double mean = StockCalculationUtility.mean(y, 0, y.length);
			double std = StockCalculationUtility.std(y, 0);
			if (!(std >= 1e-8)) {
				return false;
			}
			values = new double[y.length];
			for (int i = 0; i < y.length; i++) {
				values[i] = (y[i] - mean) / std;
			}
		}
		QuadraticFit fit = fit(values);
		if (!(fit.a > epsilon)) {
			return false;
		}
		double vertex = fit.vertex();
		return vertex >= 0 && vertex <= fit.length - 1;
	}

	private static double det3(double m00, double m01, double m02, double m10, double m11, double m12, double m20,
			double m21, double m22) {
		return m00 * (m11 * m22 - m12 * m21) - m01 * (m10 * m22 - m12 * m20) + m02 * (m10 * m21 - m11 * m20);
	}

	public double getA() {
		return a;
	}

	public double getB() {
		return b;
	}

	public double getC() {
		return c;
	}

	public double vertex() {
		return -b / (2 * a);
	}

	public double valueAt(double x) {
		return a * x * x + b * x + c;
	}
}
