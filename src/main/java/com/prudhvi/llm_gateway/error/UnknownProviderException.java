package com.prudhvi.llm_gateway.error;

/**
 * Raised by the monitoring endpoints for a provider name that has never been
 * registered.
 */
public class UnknownProviderException extends RuntimeException {

    private final String provider;

    public UnknownProviderException(String provider) {
        super("No circuit breaker registered for provider '" + provider + "'");
        this.provider = provider;
    }

    public String getProvider() {
        return provider;
    }
}
