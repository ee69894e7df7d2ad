package com.prudhvi.llm_gateway.retry;

import com.prudhvi.llm_gateway.circuitbreaker.BreakerPermit;
import com.prudhvi.llm_gateway.circuitbreaker.CircuitState;
import com.prudhvi.llm_gateway.circuitbreaker.ProviderCircuitBreaker;
import com.prudhvi.llm_gateway.config.BreakerConfig;
import com.prudhvi.llm_gateway.error.CallCancelledException;
import com.prudhvi.llm_gateway.error.CircuitOpenException;
import com.prudhvi.llm_gateway.error.ErrorKind;
import com.prudhvi.llm_gateway.error.GatewayException;
import com.prudhvi.llm_gateway.error.RetriesExhaustedException;
import com.prudhvi.llm_gateway.events.AttemptOutcome;
import com.prudhvi.llm_gateway.events.GatewayEventEmitter;
import com.prudhvi.llm_gateway.timeout.AttemptResult;
import com.prudhvi.llm_gateway.timeout.ProviderCall;
import com.prudhvi.llm_gateway.timeout.TimeoutGuard;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Duration;
import java.util.Optional;

/**
 * Runs a logical call against one provider with bounded retries.
 *
 * For each of the {@code 1 + maxRetries} attempts:
 * <ol>
 *   <li>Ask the breaker for a permit. A denial ends the call at once with
 *       {@link CircuitOpenException}: no attempt, no backoff, and nothing
 *       recorded against the breaker.</li>
 *   <li>Run the call under the {@link TimeoutGuard}.</li>
 *   <li>Success: record it, return the value.</li>
 *   <li>Failure: record it against the breaker unless the caller cancelled.
 *       Non-retryable and cancelled failures are returned immediately;
 *       retryable ones back off and loop.</li>
 * </ol>
 * When every attempt failed the last failure is returned wrapped in
 * {@link RetriesExhaustedException}.
 *
 * The breaker is consulted before every attempt, so a provider that trips its
 * breaker in the middle of a retry sequence stops receiving traffic from that
 * sequence too.
 */
public class RetryExecutor {

    private static final Logger log = LoggerFactory.getLogger(RetryExecutor.class);

    private final ProviderCircuitBreaker breaker;
    private final BreakerConfig config;
    private final TimeoutGuard timeoutGuard;
    private final GatewayEventEmitter emitter;
    private final BackoffSleeper sleeper;
    private final BackoffPolicy backoff;

    public RetryExecutor(ProviderCircuitBreaker breaker, TimeoutGuard timeoutGuard,
                         GatewayEventEmitter emitter, BackoffSleeper sleeper) {
        this(breaker, timeoutGuard, emitter, sleeper, new BackoffPolicy(breaker.getConfig()));
    }

    RetryExecutor(ProviderCircuitBreaker breaker, TimeoutGuard timeoutGuard,
                  GatewayEventEmitter emitter, BackoffSleeper sleeper, BackoffPolicy backoff) {
        this.breaker = breaker;
        this.config = breaker.getConfig();
        this.timeoutGuard = timeoutGuard;
        this.emitter = emitter;
        this.sleeper = sleeper;
        this.backoff = backoff;
    }

    public <T> T execute(ProviderCall<T> call) {
        return execute(call, null);
    }

    /**
     * @param timeoutOverride per-attempt deadline replacing the configured
     *                        call timeout, or null to use the configured one
     * @throws GatewayException the final failure of the call
     */
    public <T> T execute(ProviderCall<T> call, Duration timeoutOverride) {
        String provider = breaker.getName();
        Duration deadline = timeoutOverride != null ? timeoutOverride : config.callTimeout();
        int maxAttempts = config.maxAttempts();
        long startNanos = System.nanoTime();

        GatewayException lastError = null;
        int attempted = 0;

        for (int attempt = 1; attempt <= maxAttempts; attempt++) {
            Optional<BreakerPermit> permit = breaker.permit();
            if (permit.isEmpty()) {
                log.debug("Circuit for provider {} is open, rejecting attempt {}", provider, attempt);
                completed(provider, attempted, ErrorKind.CIRCUIT_OPEN, startNanos);
                throw lastError == null
                        ? new CircuitOpenException(provider)
                        : new CircuitOpenException(provider, lastError);
            }
            attempted = attempt;

            AttemptResult<T> result = timeoutGuard.run(provider, call, deadline);

            if (result.succeeded()) {
                breaker.recordSuccess(permit.get());
                emitter.attemptFinished(provider, attempt, AttemptOutcome.success(result.elapsed()));
                completed(provider, attempt, null, startNanos);
                return result.value();
            }

            GatewayException error = result.error();
            ErrorKind kind = error.getKind();
            if (kind.countsAgainstBreaker()) {
                breaker.recordFailure(permit.get());
            } else {
                breaker.releasePermit(permit.get());
            }
            emitter.attemptFinished(provider, attempt, AttemptOutcome.failure(kind, result.elapsed()));
            lastError = error;

            if (!kind.isRetryable()) {
                log.debug("Attempt {} to provider {} failed with non-retryable {}: {}",
                        attempt, provider, kind, error.getMessage());
                completed(provider, attempt, kind, startNanos);
                throw error;
            }

            // A breaker this failure just opened will deny the next permit; skip the wait.
            if (attempt < maxAttempts && breaker.getState() != CircuitState.OPEN) {
                Duration delay = backoff.delayAfter(attempt);
                log.debug("Attempt {}/{} to provider {} failed ({}), retrying in {} ms",
                        attempt, maxAttempts, provider, kind, delay.toMillis());
                try {
                    sleeper.sleep(delay);
                } catch (InterruptedException e) {
                    Thread.currentThread().interrupt();
                    completed(provider, attempt, ErrorKind.CANCELLED, startNanos);
                    throw new CallCancelledException(provider, e);
                }
            }
        }

        log.warn("Provider {} failed after {} attempts: {}", provider, attempted, lastError.getMessage());
        completed(provider, attempted, lastError.getKind(), startNanos);
        throw new RetriesExhaustedException(provider, attempted, lastError);
    }

    public ProviderCircuitBreaker getBreaker() {
        return breaker;
    }

    private void completed(String provider, int attempts, ErrorKind errorKind, long startNanos) {
        emitter.callCompleted(provider, attempts, errorKind, Duration.ofNanos(System.nanoTime() - startNanos));
    }
}
