package com.ramgenix.swingscanner.utility;

import java.time.temporal.WeekFields;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.TreeMap;

import org.springframework.stereotype.Service;

import com.ramgenix.swingscanner.entity.PriceBar;

@Service
public class WeeklyBarConverter {

	/**
	 * Groups ascending daily bars into ISO weeks. Each weekly bar carries the first open, the highest high, the lowest
	 * low, the last close and the summed volume, dated on the last trading day of the week. Output is ascending.
	 */
	public List<PriceBar> convertToWeeklyBars(List<PriceBar> dailyBars) {
		List<PriceBar> weeklyBars = new ArrayList<>();
		if (dailyBars == null || dailyBars.isEmpty()) {
			return weeklyBars;
		}

		WeekFields weekFields = WeekFields.ISO;
		Map<Integer, List<PriceBar>> weekGroups = new TreeMap<>();
		for (PriceBar bar : dailyBars) {
			if (bar.getDate() == null) {
				continue;
			}
			int year = bar.getDate().get(weekFields.weekBasedYear());
			int week = bar.getDate().get(weekFields.weekOfWeekBasedYear());
			weekGroups.computeIfAbsent(year * 100 + week, k -> new ArrayList<>()).add(bar);
		}

		for (List<PriceBar> week : weekGroups.values()) {
			week.sort((a, b) -> a.getDate().compareTo(b.getDate()));
			PriceBar first = week.get(0);
			PriceBar last = week.get(week.size() - 1);

			double high = Double.NEGATIVE_INFINITY;
			double low = Double.POSITIVE_INFINITY;
			double volume = 0;
			for (PriceBar day : week) {
				high = Math.max(high, day.getHigh());
				low = Math.min(low, day.getLow());
				volume += day.getVolume();
			}
			weeklyBars.add(new PriceBar(last.getDate(), first.getOpen(), high, low, last.getClose(),
					last.getAdjustedClose(), volume));
		}
		return weeklyBars;
	}

}
