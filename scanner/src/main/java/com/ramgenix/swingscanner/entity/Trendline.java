package com.ramgenix.swingscanner.entity;

/**
 * Straight line through two swing highs, extrapolated by bar index. Slope is price per bar.
 */
public class Trendline {

	private final SwingPoint startPoint;
	private final SwingPoint endPoint;
	private final double slope;
	private final double intercept;
	private final int touchCount;
	private final int lastX;

	public Trendline(SwingPoint point1, SwingPoint point2, int touchCount, int lastX) {
		if (point1.getChronologicalX() > point2.getChronologicalX()) {
			this.startPoint = point2;
			this.endPoint = point1;
		} else {
			this.startPoint = point1;
			this.endPoint = point2;
		}
		this.touchCount = touchCount;
		this.lastX = lastX;
		if (endPoint.getChronologicalX() == startPoint.getChronologicalX()) {
			this.slope = 0;
			this.intercept = startPoint.getPrice();
		} else {
			this.slope = (endPoint.getPrice() - startPoint.getPrice())
					/ (double) (endPoint.getChronologicalX() - startPoint.getChronologicalX());
			this.intercept = startPoint.getPrice() - this.slope * startPoint.getChronologicalX();
		}
	}

	public double getPriceAtChronologicalX(int chronologicalX) {
		return slope * chronologicalX + intercept;
	}

	/** Line value projected onto the most recent bar of the window. */
	public double getTodayValue() {
		return getPriceAtChronologicalX(lastX);
	}

	public boolean isDescending() {
		return slope < 0;
	}

	public SwingPoint getStartPoint() {
		return startPoint;
	}

	public SwingPoint getEndPoint() {
		return endPoint;
	}

	public double getSlope() {
		return slope;
	}

	public double getIntercept() {
		return intercept;
	}

	public int getTouchCount() {
		return touchCount;
	}

	public int getLastX() {
		return lastX;
	}

	@Override
	public String toString() {
		return "Trendline [Start: " + startPoint.getDate() + " (Price: " + String.format("%.2f", startPoint.getPrice())
				+ "), End: " + endPoint.getDate() + " (Price: " + String.format("%.2f", endPoint.getPrice())
				+ "), Slope: " + String.format("%.4f", slope) + ", Touches: " + touchCount + "]";
	}
}
