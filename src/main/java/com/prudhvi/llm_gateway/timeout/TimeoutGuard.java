package com.prudhvi.llm_gateway.timeout;

import com.prudhvi.llm_gateway.error.CallCancelledException;
import com.prudhvi.llm_gateway.error.CallTimeoutException;
import com.prudhvi.llm_gateway.error.ErrorClassifier;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Duration;
import java.util.Objects;
import java.util.concurrent.CancellationException;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Future;
import java.util.concurrent.RejectedExecutionException;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;

/**
 * Bounds the wall-clock duration of a single attempt.
 *
 * The call runs on the injected worker pool while the caller waits on its
 * future for at most the deadline. On overrun the future is cancelled with
 * interruption (best effort; the call is expected to notice) and a
 * {@link CallTimeoutException} is reported. If the caller's own thread is
 * interrupted while waiting, the attempt is cancelled the same way but
 * reported as {@link CallCancelledException}, and the interrupt flag is
 * restored for the caller.
 *
 * The guard never retries.
 */
public class TimeoutGuard {

    private static final Logger log = LoggerFactory.getLogger(TimeoutGuard.class);

    private final ExecutorService workers;

    public TimeoutGuard(ExecutorService workers) {
        this.workers = Objects.requireNonNull(workers, "workers must not be null");
    }

    public <T> AttemptResult<T> run(String provider, ProviderCall<T> call, Duration deadline) {
        long startNanos = System.nanoTime();

        Future<T> future;
        try {
            future = workers.submit(call::call);
        } catch (RejectedExecutionException e) {
            // The gateway is shutting down; the provider never saw the request.
            log.warn("Worker pool rejected call to provider {}: {}", provider, e.getMessage());
            return AttemptResult.failure(new CallCancelledException(provider, e), elapsedSince(startNanos));
        }

        try {
            T value = future.get(deadline.toNanos(), TimeUnit.NANOSECONDS);
            return AttemptResult.success(value, elapsedSince(startNanos));

        } catch (TimeoutException e) {
            future.cancel(true);
            Duration elapsed = elapsedSince(startNanos);
            log.debug("Call to provider {} exceeded its {} ms deadline", provider, deadline.toMillis());
            return AttemptResult.failure(new CallTimeoutException(provider, elapsed), elapsed);

        } catch (InterruptedException e) {
            future.cancel(true);
            Thread.currentThread().interrupt();
            return AttemptResult.failure(new CallCancelledException(provider, e), elapsedSince(startNanos));

        } catch (CancellationException e) {
            return AttemptResult.failure(new CallCancelledException(provider, e), elapsedSince(startNanos));

        } catch (ExecutionException e) {
            Duration elapsed = elapsedSince(startNanos);
            return AttemptResult.failure(ErrorClassifier.classify(provider, e.getCause(), elapsed), elapsed);
        }
    }

    private static Duration elapsedSince(long startNanos) {
        return Duration.ofNanos(System.nanoTime() - startNanos);
    }
}
