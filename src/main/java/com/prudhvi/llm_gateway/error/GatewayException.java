package com.prudhvi.llm_gateway.error;

/**
 * Base type of every error the gateway returns to callers.
 *
 * Unchecked, so AI-flow code can let it propagate to the web layer where
 * {@link com.prudhvi.llm_gateway.provider.GatewayExceptionHandler} turns it
 * into an HTTP status.
 */
public abstract class GatewayException extends RuntimeException {

    private final String provider;

    protected GatewayException(String provider, String message) {
        super(message);
        this.provider = provider;
    }

    protected GatewayException(String provider, String message, Throwable cause) {
        super(message, cause);
        this.provider = provider;
    }

    public String getProvider() {
        return provider;
    }

    public abstract ErrorKind getKind();
}
