package com.prudhvi.llm_gateway.timeout;

import com.prudhvi.llm_gateway.error.GatewayException;

import java.time.Duration;

/**
 * Result of one guarded attempt: either a value or a classified error,
 * plus the wall-clock time the attempt took.
 */
public record AttemptResult<T>(T value, GatewayException error, Duration elapsed) {

    public static <T> AttemptResult<T> success(T value, Duration elapsed) {
        return new AttemptResult<>(value, null, elapsed);
    }

    public static <T> AttemptResult<T> failure(GatewayException error, Duration elapsed) {
        return new AttemptResult<>(null, error, elapsed);
    }

    public boolean succeeded() {
        return error == null;
    }
}
