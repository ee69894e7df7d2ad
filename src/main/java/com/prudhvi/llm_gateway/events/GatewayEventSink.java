package com.prudhvi.llm_gateway.events;

import com.prudhvi.llm_gateway.circuitbreaker.ProviderCircuitBreaker;

/**
 * Consumer of gateway events (metrics, logs, Kafka, SSE).
 *
 * Called from the emitter's dispatch thread, never from a request thread.
 * Implement only the callbacks you care about.
 */
public interface GatewayEventSink {

    /**
     * A breaker was created. Sinks that need the live state keep the breaker
     * and read it; transition events may arrive out of order across threads.
     */
    default void onProviderRegistered(ProviderCircuitBreaker breaker) {
    }

    default void onTransition(StateTransitionEvent event) {
    }

    default void onAttempt(AttemptEvent event) {
    }

    default void onCallCompleted(CallCompletedEvent event) {
    }
}
