package com.prudhvi.llm_gateway.events;

import com.prudhvi.llm_gateway.circuitbreaker.CircuitState;

import java.time.Instant;

/**
 * A provider's breaker moved from one state to another.
 */
public record StateTransitionEvent(
        String       provider,
        CircuitState from,
        CircuitState to,
        Instant      timestamp
) implements GatewayEvent {}
