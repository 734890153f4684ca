package com.ramgenix.swingscanner.service.breakout;

import java.util.Optional;

import com.ramgenix.swingscanner.entity.SetupMetadata;
import com.ramgenix.swingscanner.entity.Trendline;

/**
 * Close above today's value of the descending trendline with above-average volume.
 */
public class TrendlineBreakoutPath implements BreakoutPath {

	public static final String NAME = "TRENDLINE_BREAKOUT";

	@Override
	public String getName() {
		return NAME;
	}

	@Override
	public Optional<BreakoutSignal> detect(BreakoutContext context) {
		Optional<Trendline> line = context.trendline();
		if (line.isEmpty()) {
			return Optional.empty();
		}
		double lineToday = line.get().getTodayValue();
		if (!(context.getClose() > lineToday)
				|| context.getVolumeRatio() < context.getConfig().getTrendlineVolumeRatio()) {
			return Optional.empty();
		}
		return Optional.of(BreakoutSignal.builder().path(NAME)
				.stopReference(lineToday * context.getConfig().getTrendlineStopFactor())
				.meta(SetupMetadata.TRENDLINE_VALUE, lineToday)
				.meta(SetupMetadata.TRENDLINE_SLOPE, line.get().getSlope())
				.meta(SetupMetadata.TRENDLINE_TOUCHES, line.get().getTouchCount())
				.meta(SetupMetadata.IS_BREAKOUT, true).build());
	}
}
