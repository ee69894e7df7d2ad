package com.prudhvi.llm_gateway.circuitbreaker;

import java.time.Instant;

/**
 * Receives every state change of a breaker. Implementations must return
 * quickly; they are invoked on the caller's thread right after the change is
 * installed.
 */
@FunctionalInterface
public interface TransitionListener {

    TransitionListener NO_OP = (provider, from, to, at) -> { };

    void onTransition(String provider, CircuitState from, CircuitState to, Instant at);
}
