package com.ramgenix.swingscanner.service.breakout;

import java.util.Comparator;
import java.util.Optional;

import com.ramgenix.swingscanner.config.ScannerProperties;
import com.ramgenix.swingscanner.entity.SetupMetadata;
import com.ramgenix.swingscanner.entity.Zone;

/**
 * Close cleared a resistance zone on heavy volume while outperforming the benchmark.
 */
public class ConfirmedBreakoutPath implements BreakoutPath {

	public static final String NAME = "CONFIRMED_BREAKOUT";

	@Override
	public String getName() {
		return NAME;
	}

	@Override
	public Optional<BreakoutSignal> detect(BreakoutContext context) {
		ScannerProperties.Breakout config = context.getConfig();
		if (context.overheadZones().isEmpty() || context.getVolumeRatio() < config.getConfirmedVolumeRatio()) {
			return Optional.empty();
		}
		if (!(context.rsVsBenchmark() > 0)) {
			return Optional.empty();
		}

		double close = context.getClose();
		Optional<Zone> cleared = context.overheadZones().stream().filter(z -> close > z.getUpper())
				.max(Comparator.comparingDouble(Zone::getLevel));
		if (cleared.isEmpty()) {
			return Optional.empty();
		}
		Zone zone = cleared.get();
		double extension = (close - zone.getUpper()) / zone.getUpper();
		if (extension < config.getConfirmedMinExtension() || extension > config.getConfirmedMaxExtension()) {
			return Optional.empty();
		}
		return Optional.of(BreakoutSignal.builder().path(NAME).stopReference(zone.getLower())
				.meta(SetupMetadata.RESISTANCE_LEVEL, zone.getLevel()).meta(SetupMetadata.IS_BREAKOUT, true)
				.meta(SetupMetadata.RS_VS_BENCHMARK, context.rsVsBenchmark()).build());
	}
}
