package com.prudhvi.llm_gateway.config;

import lombok.With;

import java.time.Duration;
import java.util.Objects;

/**
 * Immutable per-provider resilience settings.
 *
 * Validated on construction so a misconfigured provider fails at startup (or
 * at first registration) rather than on a request path. Use {@link #defaults()}
 * and the generated {@code withXxx} methods to derive variants.
 *
 * @param failureThreshold consecutive CLOSED failures that open the breaker
 * @param recoveryTimeout  how long the breaker stays OPEN before admitting a probe
 * @param successThreshold consecutive HALF_OPEN successes that close the breaker
 * @param callTimeout      deadline for one attempt
 * @param maxRetries       attempts after the first one; total attempts = 1 + maxRetries
 * @param backoffBase      delay before the first retry
 * @param backoffFactor    multiplier applied per further retry
 * @param maxBackoff       upper bound for any single backoff delay
 * @param backoffJitter    fraction in [0, 1] by which a delay is randomly spread
 */
@With
public record BreakerConfig(
        int      failureThreshold,
        Duration recoveryTimeout,
        int      successThreshold,
        Duration callTimeout,
        int      maxRetries,
        Duration backoffBase,
        double   backoffFactor,
        Duration maxBackoff,
        double   backoffJitter
) {

    public static final int DEFAULT_FAILURE_THRESHOLD = 5;
    public static final Duration DEFAULT_RECOVERY_TIMEOUT = Duration.ofSeconds(30);
    public static final int DEFAULT_SUCCESS_THRESHOLD = 2;
    public static final Duration DEFAULT_CALL_TIMEOUT = Duration.ofSeconds(60);
    public static final int DEFAULT_MAX_RETRIES = 2;
    public static final Duration DEFAULT_BACKOFF_BASE = Duration.ofSeconds(1);
    public static final double DEFAULT_BACKOFF_FACTOR = 2.0;
    public static final Duration DEFAULT_MAX_BACKOFF = Duration.ofSeconds(10);

    private static final BreakerConfig DEFAULTS = new BreakerConfig(
            DEFAULT_FAILURE_THRESHOLD, DEFAULT_RECOVERY_TIMEOUT, DEFAULT_SUCCESS_THRESHOLD,
            DEFAULT_CALL_TIMEOUT, DEFAULT_MAX_RETRIES, DEFAULT_BACKOFF_BASE,
            DEFAULT_BACKOFF_FACTOR, DEFAULT_MAX_BACKOFF, 0.0);

    public BreakerConfig {
        Objects.requireNonNull(recoveryTimeout, "recoveryTimeout must not be null");
        Objects.requireNonNull(callTimeout, "callTimeout must not be null");
        Objects.requireNonNull(backoffBase, "backoffBase must not be null");
        Objects.requireNonNull(maxBackoff, "maxBackoff must not be null");

        if (failureThreshold < 1) {
            throw new IllegalArgumentException("failureThreshold must be >= 1, was " + failureThreshold);
        }
        if (successThreshold < 1) {
            throw new IllegalArgumentException("successThreshold must be >= 1, was " + successThreshold);
        }
        if (recoveryTimeout.isNegative() || recoveryTimeout.isZero()) {
            throw new IllegalArgumentException("recoveryTimeout must be positive, was " + recoveryTimeout);
        }
        if (callTimeout.isNegative() || callTimeout.isZero()) {
            throw new IllegalArgumentException("callTimeout must be positive, was " + callTimeout);
        }
        if (maxRetries < 0) {
            throw new IllegalArgumentException("maxRetries must be >= 0, was " + maxRetries);
        }
        if (backoffBase.isNegative()) {
            throw new IllegalArgumentException("backoffBase must not be negative, was " + backoffBase);
        }
        if (Double.isNaN(backoffFactor) || backoffFactor < 1.0) {
            throw new IllegalArgumentException("backoffFactor must be >= 1.0, was " + backoffFactor);
        }
        if (maxBackoff.compareTo(backoffBase) < 0) {
            throw new IllegalArgumentException("maxBackoff must be >= backoffBase, was " + maxBackoff);
        }
        if (Double.isNaN(backoffJitter) || backoffJitter < 0.0 || backoffJitter > 1.0) {
            throw new IllegalArgumentException("backoffJitter must be within [0, 1], was " + backoffJitter);
        }
    }

    public static BreakerConfig defaults() {
        return DEFAULTS;
    }

    public int maxAttempts() {
        return 1 + maxRetries;
    }
}
