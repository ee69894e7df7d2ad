package com.prudhvi.llm_gateway.error;

import java.util.Optional;
import java.util.Set;

/**
 * The provider (or the transport talking to it) reported an error.
 *
 * statusCode is the HTTP status the provider answered with, or null when the
 * failure happened below HTTP (connection errors, unexpected exceptions).
 * Transport adapters throw this from inside a
 * {@link com.prudhvi.llm_gateway.timeout.ProviderCall} so the gateway can tell
 * transient errors from malformed requests.
 */
public class ProviderException extends GatewayException {

    // Client-side statuses that are still worth retrying.
    private static final Set<Integer> TRANSIENT_CLIENT_STATUSES = Set.of(408, 425, 429);

    private final Integer statusCode;
    private final ErrorKind kind;

    public ProviderException(String provider, Integer statusCode, String message) {
        this(provider, statusCode, message, null);
    }

    public ProviderException(String provider, Integer statusCode, String message, Throwable cause) {
        this(provider, statusCode, message, cause, classifyStatus(statusCode));
    }

    private ProviderException(String provider, Integer statusCode, String message, Throwable cause, ErrorKind kind) {
        super(provider, message, cause);
        this.statusCode = statusCode;
        this.kind = kind;
    }

    /**
     * Failure that did not come from the provider's answer: wraps exceptions
     * the transport threw that the gateway does not otherwise recognise.
     */
    public static ProviderException unexpected(String provider, Throwable cause) {
        return new ProviderException(provider, null,
                "Call to provider '" + provider + "' failed: " + cause, cause, ErrorKind.PROVIDER);
    }

    /**
     * Connection-level failure below HTTP.
     */
    public static ProviderException network(String provider, Throwable cause) {
        return new ProviderException(provider, null,
                "Request to provider '" + provider + "' failed: " + cause.getMessage(), cause, ErrorKind.NETWORK);
    }

    /**
     * The request is invalid regardless of provider health.
     */
    public static ProviderException malformedRequest(String provider, Throwable cause) {
        return new ProviderException(provider, null,
                "Request to provider '" + provider + "' was rejected as malformed: " + cause.getMessage(),
                cause, ErrorKind.NON_RETRYABLE);
    }

    public Optional<Integer> getStatusCode() {
        return Optional.ofNullable(statusCode);
    }

    @Override
    public ErrorKind getKind() {
        return kind;
    }

    private static ErrorKind classifyStatus(Integer statusCode) {
        if (statusCode == null || statusCode >= 500 || TRANSIENT_CLIENT_STATUSES.contains(statusCode)) {
            return ErrorKind.PROVIDER;
        }
        if (statusCode >= 400) {
            return ErrorKind.NON_RETRYABLE;
        }
        return ErrorKind.PROVIDER;
    }
}
