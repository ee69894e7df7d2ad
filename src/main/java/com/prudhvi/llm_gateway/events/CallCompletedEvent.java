package com.prudhvi.llm_gateway.events;

import com.prudhvi.llm_gateway.error.ErrorKind;

import java.time.Duration;
import java.time.Instant;

/**
 * Terminal outcome of a logical call, including fail-fast rejections.
 *
 * attempts is the number of attempts that reached the provider (0 when the
 * breaker rejected the call outright). errorKind is null on success.
 */
public record CallCompletedEvent(
        String    provider,
        int       attempts,
        boolean   succeeded,
        ErrorKind errorKind,
        Duration  elapsed,
        Instant   timestamp
) implements GatewayEvent {}
