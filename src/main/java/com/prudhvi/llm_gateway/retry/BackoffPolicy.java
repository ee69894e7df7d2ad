package com.prudhvi.llm_gateway.retry;

import com.prudhvi.llm_gateway.config.BreakerConfig;

import java.time.Duration;
import java.util.concurrent.ThreadLocalRandom;
import java.util.function.DoubleSupplier;

/**
 * Exponential backoff: the delay after failed attempt n (1-based) is
 * {@code backoffBase * backoffFactor^(n-1)}, capped at maxBackoff.
 *
 * With a jitter fraction j the delay is spread uniformly over
 * {@code [delay * (1 - j), delay * (1 + j)]} before capping.
 */
public class BackoffPolicy {

    private final BreakerConfig config;
    private final DoubleSupplier random;

    public BackoffPolicy(BreakerConfig config) {
        this(config, () -> ThreadLocalRandom.current().nextDouble());
    }

    BackoffPolicy(BreakerConfig config, DoubleSupplier random) {
        this.config = config;
        this.random = random;
    }

    public Duration delayAfter(int failedAttempt) {
        if (failedAttempt < 1) {
            throw new IllegalArgumentException("failedAttempt must be >= 1, was " + failedAttempt);
        }
        double baseMillis = config.backoffBase().toMillis();
        double maxMillis = config.maxBackoff().toMillis();

        double delay = baseMillis * Math.pow(config.backoffFactor(), failedAttempt - 1);
        double jitter = config.backoffJitter();
        if (jitter > 0.0) {
            delay = delay * (1.0 - jitter + 2.0 * jitter * random.getAsDouble());
        }
        return Duration.ofMillis((long) Math.min(delay, maxMillis));
    }
}
