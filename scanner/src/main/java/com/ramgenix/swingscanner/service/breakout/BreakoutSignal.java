package com.ramgenix.swingscanner.service.breakout;

import java.util.Map;

import lombok.Builder;
import lombok.Getter;
import lombok.Singular;
import lombok.ToString;

/**
 * A path's match: the level the stop hangs under plus what the path wants recorded on the setup.
 */
@Getter
@Builder
@ToString
public class BreakoutSignal {

	private final String path;
	private final double stopReference;
	@Singular("meta")
	private final Map<String, Object> metadata;
}
