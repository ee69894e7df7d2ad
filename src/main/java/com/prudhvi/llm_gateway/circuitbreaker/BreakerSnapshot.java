package com.prudhvi.llm_gateway.circuitbreaker;

import java.time.Instant;

/**
 * Point-in-time view of a breaker for monitoring endpoints.
 *
 * openedAt is null while CLOSED.
 */
public record BreakerSnapshot(
        String       name,
        CircuitState state,
        int          failureCount,
        int          successCount,
        Instant      openedAt,
        boolean      probeInFlight
) {}
