package com.prudhvi.llm_gateway.events;

import java.time.Instant;

/**
 * One attempt (1-based) of a logical call finished.
 */
public record AttemptEvent(
        String         provider,
        int            attempt,
        AttemptOutcome outcome,
        Instant        timestamp
) implements GatewayEvent {}
