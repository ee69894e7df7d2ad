package com.prudhvi.llm_gateway.error;

/**
 * The provider's breaker rejected the call before any network activity.
 *
 * Thrown either because the breaker is OPEN or because it is HALF_OPEN with a
 * probe already in flight. When it interrupts a retry sequence, the failure
 * that preceded it is attached as the cause.
 */
public class CircuitOpenException extends GatewayException {

    public CircuitOpenException(String provider) {
        super(provider, "Circuit breaker for provider '" + provider + "' is open");
    }

    public CircuitOpenException(String provider, Throwable lastFailure) {
        super(provider, "Circuit breaker for provider '" + provider + "' is open", lastFailure);
    }

    @Override
    public ErrorKind getKind() {
        return ErrorKind.CIRCUIT_OPEN;
    }
}
