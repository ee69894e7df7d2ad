package com.prudhvi.llm_gateway.gateway;

import com.prudhvi.llm_gateway.timeout.ProviderCall;

import java.time.Duration;
import java.util.Objects;

/**
 * A request to invoke a named provider.
 *
 * @param provider        registry name of the provider to protect, e.g. "ollama"
 * @param timeoutOverride per-attempt deadline for this call only; null uses
 *                        the provider's configured call timeout
 * @param operation       the actual call; already validated and ready to send
 */
public record CallDescriptor<T>(String provider, Duration timeoutOverride, ProviderCall<T> operation) {

    public CallDescriptor {
        if (provider == null || provider.isBlank()) {
            throw new IllegalArgumentException("provider must not be blank");
        }
        Objects.requireNonNull(operation, "operation must not be null");
        if (timeoutOverride != null && (timeoutOverride.isNegative() || timeoutOverride.isZero())) {
            throw new IllegalArgumentException("timeoutOverride must be positive, was " + timeoutOverride);
        }
    }

    public static <T> CallDescriptor<T> of(String provider, ProviderCall<T> operation) {
        return new CallDescriptor<>(provider, null, operation);
    }

    public CallDescriptor<T> withTimeout(Duration timeout) {
        return new CallDescriptor<>(provider, timeout, operation);
    }
}
