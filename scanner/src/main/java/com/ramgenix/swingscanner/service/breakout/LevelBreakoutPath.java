package com.ramgenix.swingscanner.service.breakout;

import java.util.Optional;

import com.ramgenix.swingscanner.config.ScannerProperties;
import com.ramgenix.swingscanner.entity.SetupMetadata;
import com.ramgenix.swingscanner.entity.Zone;

/**
 * Fresh push through the highest resistance zone on moderate volume, not lagging the benchmark.
 */
public class LevelBreakoutPath implements BreakoutPath {

	public static final String NAME = "LEVEL_BREAKOUT";

	@Override
	public String getName() {
		return NAME;
	}

	@Override
	public Optional<BreakoutSignal> detect(BreakoutContext context) {
		ScannerProperties.Breakout config = context.getConfig();
		Optional<Zone> highest = context.highestOverheadZone();
		if (highest.isEmpty()) {
			return Optional.empty();
		}
		Zone zone = highest.get();
		double extension = (context.getClose() - zone.getUpper()) / zone.getUpper();
		if (extension < config.getLevelMinExtension() || extension > config.getLevelMaxExtension()) {
			return Optional.empty();
		}
		if (context.getVolumeRatio() < config.getLevelVolumeRatio() || !(context.rsVsBenchmark() >= 0)) {
			return Optional.empty();
		}
		return Optional.of(BreakoutSignal.builder().path(NAME).stopReference(zone.getLower())
				.meta(SetupMetadata.RESISTANCE_LEVEL, zone.getLevel()).meta(SetupMetadata.IS_BREAKOUT, true)
				.meta(SetupMetadata.RS_VS_BENCHMARK, context.rsVsBenchmark()).build());
	}
}
