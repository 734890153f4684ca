package com.ramgenix.swingscanner.service.breakout;

import java.util.Optional;

/**
 * One entry of the priority-ordered breakout policy. Implementations only decide whether their pattern is present;
 * shared trend and volume checks and the risk math are applied by the caller.
 */
public interface BreakoutPath {

	String getName();

	Optional<BreakoutSignal> detect(BreakoutContext context);
}
