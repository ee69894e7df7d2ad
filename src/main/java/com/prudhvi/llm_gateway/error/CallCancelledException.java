package com.prudhvi.llm_gateway.error;

/**
 * The caller abandoned the call (its thread was interrupted or its own
 * future was cancelled). Not counted against the provider's breaker.
 */
public class CallCancelledException extends GatewayException {

    public CallCancelledException(String provider) {
        super(provider, "Call to provider '" + provider + "' was cancelled by the caller");
    }

    public CallCancelledException(String provider, Throwable cause) {
        super(provider, "Call to provider '" + provider + "' was cancelled by the caller", cause);
    }

    @Override
    public ErrorKind getKind() {
        return ErrorKind.CANCELLED;
    }
}
