package com.ramgenix.swingscanner.service.breakout;

import java.util.Optional;

import com.ramgenix.swingscanner.entity.SetupMetadata;
import com.ramgenix.swingscanner.entity.Zone;

/**
 * RS line at its yearly high while price is still just under the highest resistance. No volume requirement.
 */
public class RsLeadBreakoutPath implements BreakoutPath {

	public static final String NAME = "RS_LEAD";

	@Override
	public String getName() {
		return NAME;
	}

	@Override
	public Optional<BreakoutSignal> detect(BreakoutContext context) {
		if (!context.isRsBlueDot()) {
			return Optional.empty();
		}
		Optional<Zone> highest = context.highestOverheadZone();
		if (highest.isEmpty()) {
			return Optional.empty();
		}
		Zone zone = highest.get();
		double distance = (zone.getUpper() - context.getClose()) / zone.getUpper();
		if (distance < 0 || distance > context.getConfig().getRsLeadMaxDistance()) {
			return Optional.empty();
		}
		return Optional.of(BreakoutSignal.builder().path(NAME).stopReference(zone.getLower())
				.meta(SetupMetadata.RESISTANCE_LEVEL, zone.getLevel()).meta(SetupMetadata.IS_RS_LEAD, true)
				.meta(SetupMetadata.IS_BREAKOUT, false).build());
	}
}
