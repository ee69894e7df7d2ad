package com.prudhvi.llm_gateway.error;

/**
 * Every permitted attempt failed with a retryable error.
 *
 * The last attempt's failure is available from {@link #getLastError()} (and as
 * the cause); {@link #getKind()} reports that failure's classification.
 */
public class RetriesExhaustedException extends GatewayException {

    private final GatewayException lastError;
    private final int attempts;

    public RetriesExhaustedException(String provider, int attempts, GatewayException lastError) {
        super(provider, "Provider '" + provider + "' failed after " + attempts + " attempts: "
                + lastError.getMessage(), lastError);
        this.lastError = lastError;
        this.attempts = attempts;
    }

    public GatewayException getLastError() {
        return lastError;
    }

    public int getAttempts() {
        return attempts;
    }

    @Override
    public ErrorKind getKind() {
        return lastError.getKind();
    }
}
