package com.prudhvi.llm_gateway.events;

import com.prudhvi.llm_gateway.error.ErrorKind;

import java.time.Duration;

/**
 * How one call attempt ended. errorKind is null when the attempt succeeded.
 */
public record AttemptOutcome(boolean succeeded, ErrorKind errorKind, Duration elapsed) {

    public static AttemptOutcome success(Duration elapsed) {
        return new AttemptOutcome(true, null, elapsed);
    }

    public static AttemptOutcome failure(ErrorKind errorKind, Duration elapsed) {
        return new AttemptOutcome(false, errorKind, elapsed);
    }
}
