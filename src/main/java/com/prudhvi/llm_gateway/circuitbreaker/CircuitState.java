package com.prudhvi.llm_gateway.circuitbreaker;

/**
 * The three externally visible states of a provider's circuit breaker.
 *
 * CLOSED    - calls flow through; consecutive failures are counted.
 * OPEN      - calls are rejected without touching the provider until the
 *             recovery timeout has elapsed.
 * HALF_OPEN - a single probe call at a time is let through to test recovery.
 */
public enum CircuitState {

    CLOSED(0),
    HALF_OPEN(1),
    OPEN(2);

    private final int gaugeValue;

    CircuitState(int gaugeValue) {
        this.gaugeValue = gaugeValue;
    }

    /**
     * Numeric value exported on the breaker.state gauge
     * (0 = closed, 1 = half open, 2 = open).
     */
    public int gaugeValue() {
        return gaugeValue;
    }
}
