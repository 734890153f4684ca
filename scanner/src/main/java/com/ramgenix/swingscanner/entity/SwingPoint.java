package com.ramgenix.swingscanner.entity;

import java.time.LocalDate;

/**
 * A confirmed peak of the daily highs. {@code chronologicalX} is the bar index inside the fitted window, oldest bar
 * at 0.
 */
public class SwingPoint {

	private final LocalDate date;
	private final double price;
	private final double prominence;
	private final int chronologicalX;

	public SwingPoint(LocalDate date, double price, double prominence, int chronologicalX) {
		this.date = date;
		this.price = price;
		this.prominence = prominence;
		this.chronologicalX = chronologicalX;
	}

	public LocalDate getDate() {
		return date;
	}

	public double getPrice() {
		return price;
	}

	public double getProminence() {
		return prominence;
	}

	public int getChronologicalX() {
		return chronologicalX;
	}

	@Override
	public String toString() {
		return "SwingPoint{" + "date=" + date + ", price=" + String.format("%.2f", price) + ", prominence="
				+ String.format("%.2f", prominence) + ", chronologicalX=" + chronologicalX + '}';
	}
}
