package com.prudhvi.llm_gateway.error;

import java.time.Duration;

/**
 * A single attempt did not complete within its deadline.
 */
public class CallTimeoutException extends GatewayException {

    private final Duration elapsed;

    public CallTimeoutException(String provider, Duration elapsed) {
        super(provider, "Call to provider '" + provider + "' timed out after " + elapsed.toMillis() + " ms");
        this.elapsed = elapsed;
    }

    public CallTimeoutException(String provider, Duration elapsed, Throwable cause) {
        super(provider, "Call to provider '" + provider + "' timed out after " + elapsed.toMillis() + " ms", cause);
        this.elapsed = elapsed;
    }

    public Duration getElapsed() {
        return elapsed;
    }

    @Override
    public ErrorKind getKind() {
        return ErrorKind.TIMEOUT;
    }
}
