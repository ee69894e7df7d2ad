package com.prudhvi.llm_gateway.retry;

import com.prudhvi.llm_gateway.MutableClock;
import com.prudhvi.llm_gateway.circuitbreaker.CircuitState;
import com.prudhvi.llm_gateway.circuitbreaker.ProviderCircuitBreaker;
import com.prudhvi.llm_gateway.config.BreakerConfig;
import com.prudhvi.llm_gateway.error.CallCancelledException;
import com.prudhvi.llm_gateway.error.CallTimeoutException;
import com.prudhvi.llm_gateway.error.CircuitOpenException;
import com.prudhvi.llm_gateway.error.ErrorKind;
import com.prudhvi.llm_gateway.error.ProviderException;
import com.prudhvi.llm_gateway.error.RetriesExhaustedException;
import com.prudhvi.llm_gateway.events.AttemptEvent;
import com.prudhvi.llm_gateway.events.CallCompletedEvent;
import com.prudhvi.llm_gateway.events.GatewayEventEmitter;
import com.prudhvi.llm_gateway.events.RecordingEventSink;
import com.prudhvi.llm_gateway.timeout.ProviderCall;
import com.prudhvi.llm_gateway.timeout.TimeoutGuard;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.net.ConnectException;
import java.time.Duration;
import java.util.List;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.atomic.AtomicInteger;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class RetryExecutorTest {

    private static final String PROVIDER = "ollama";

    private ExecutorService workers;
    private MutableClock clock;
    private RecordingEventSink events;
    private GatewayEventEmitter emitter;
    private List<Duration> sleeps;

    @BeforeEach
    void setUp() {
        workers = Executors.newCachedThreadPool();
        clock = MutableClock.startingAt("2026-01-01T00:00:00Z");
        events = new RecordingEventSink();
        emitter = events.directEmitter(clock);
        sleeps = new CopyOnWriteArrayList<>();
    }

    @AfterEach
    void tearDown() {
        workers.shutdownNow();
        // Clear any interrupt a cancellation test left on the test thread.
        Thread.interrupted();
    }

    @Test
    void returnsFirstSuccessWithoutRetrying() {
        RetryExecutor executor = executorFor(BreakerConfig.defaults());
        CountingCall<String> call = new CountingCall<>(() -> "answer");

        assertThat(executor.execute(call)).isEqualTo("answer");

        assertThat(call.invocations()).isEqualTo(1);
        assertThat(sleeps).isEmpty();
        assertThat(events.attempts).singleElement()
                .satisfies(event -> assertThat(event.outcome().succeeded()).isTrue());
        assertThat(events.calls).singleElement()
                .satisfies(event -> {
                    assertThat(event.succeeded()).isTrue();
                    assertThat(event.attempts()).isEqualTo(1);
                    assertThat(event.errorKind()).isNull();
                });
    }

    @Test
    void persistentFailureIsInvokedAtMostOnePlusMaxRetriesTimes() {
        RetryExecutor executor = executorFor(BreakerConfig.defaults().withFailureThreshold(10));
        CountingCall<String> call = new CountingCall<>(() -> {
            throw new ProviderException(PROVIDER, 503, "model loading");
        });

        assertThatThrownBy(() -> executor.execute(call))
                .isInstanceOfSatisfying(RetriesExhaustedException.class, ex -> {
                    assertThat(ex.getAttempts()).isEqualTo(3);
                    assertThat(ex.getLastError()).isInstanceOf(ProviderException.class);
                    assertThat(ex.getProvider()).isEqualTo(PROVIDER);
                });

        assertThat(call.invocations()).isEqualTo(3);
        assertThat(sleeps).containsExactly(Duration.ofSeconds(1), Duration.ofSeconds(2));
        assertThat(executor.getBreaker().snapshot().failureCount()).isEqualTo(3);
        assertThat(events.calls).singleElement()
                .extracting(CallCompletedEvent::errorKind)
                .isEqualTo(ErrorKind.PROVIDER);
    }

    @Test
    void recoversOnLaterAttemptAndResetsFailureCount() {
        RetryExecutor executor = executorFor(BreakerConfig.defaults());
        AtomicInteger calls = new AtomicInteger();

        String result = executor.execute(() -> {
            if (calls.incrementAndGet() == 1) {
                throw new ConnectException("Connection refused");
            }
            return "answer";
        });

        assertThat(result).isEqualTo("answer");
        assertThat(calls.get()).isEqualTo(2);
        assertThat(executor.getBreaker().snapshot().failureCount()).isZero();
        assertThat(events.attempts)
                .extracting(event -> event.outcome().errorKind())
                .containsExactly(ErrorKind.NETWORK, null);
    }

    @Test
    @DisplayName("non-retryable error returns on the first attempt yet still counts against the breaker")
    void nonRetryableErrorIsReturnedImmediately() {
        RetryExecutor executor = executorFor(BreakerConfig.defaults());
        CountingCall<String> call = new CountingCall<>(() -> {
            throw new ProviderException(PROVIDER, 400, "invalid request body");
        });

        assertThatThrownBy(() -> executor.execute(call))
                .isInstanceOf(ProviderException.class)
                .hasMessageContaining("invalid request body");

        assertThat(call.invocations()).isEqualTo(1);
        assertThat(sleeps).isEmpty();
        assertThat(executor.getBreaker().snapshot().failureCount()).isEqualTo(1);
    }

    @Test
    void openBreakerFailsFastWithoutInvokingOrCounting() {
        RetryExecutor executor = executorFor(BreakerConfig.defaults().withFailureThreshold(1));
        ProviderCircuitBreaker breaker = executor.getBreaker();
        breaker.recordFailure(breaker.permit().orElseThrow());
        CountingCall<String> call = new CountingCall<>(() -> "never");

        assertThatThrownBy(() -> executor.execute(call))
                .isInstanceOf(CircuitOpenException.class)
                .hasNoCause();

        assertThat(call.invocations()).isZero();
        assertThat(sleeps).isEmpty();
        assertThat(breaker.getState()).isEqualTo(CircuitState.OPEN);
        assertThat(events.attempts).isEmpty();
        assertThat(events.calls).singleElement()
                .satisfies(event -> {
                    assertThat(event.attempts()).isZero();
                    assertThat(event.errorKind()).isEqualTo(ErrorKind.CIRCUIT_OPEN);
                });
    }

    @Test
    void breakerTrippingMidSequenceStopsTheRetries() {
        RetryExecutor executor = executorFor(BreakerConfig.defaults()
                .withFailureThreshold(2)
                .withMaxRetries(4));
        CountingCall<String> call = new CountingCall<>(() -> {
            throw new ConnectException("Connection reset");
        });

        assertThatThrownBy(() -> executor.execute(call))
                .isInstanceOf(CircuitOpenException.class)
                .hasCauseInstanceOf(ProviderException.class);

        assertThat(call.invocations()).isEqualTo(2);
        assertThat(sleeps).containsExactly(Duration.ofSeconds(1));
        assertThat(executor.getBreaker().getState()).isEqualTo(CircuitState.OPEN);
    }

    @Test
    void timeoutOverrideReplacesConfiguredCallTimeout() {
        RetryExecutor executor = executorFor(BreakerConfig.defaults().withMaxRetries(0));

        assertThatThrownBy(() -> executor.execute(() -> {
            Thread.sleep(5_000);
            return "too late";
        }, Duration.ofMillis(50)))
                .isInstanceOfSatisfying(RetriesExhaustedException.class,
                        ex -> assertThat(ex.getLastError()).isInstanceOf(CallTimeoutException.class));
    }

    @Test
    void callerCancellationIsNotCountedNorRetried() {
        RetryExecutor executor = executorFor(BreakerConfig.defaults().withFailureThreshold(1));
        CountingCall<String> call = new CountingCall<>(() -> {
            throw new InterruptedException("client disconnected");
        });

        assertThatThrownBy(() -> executor.execute(call)).isInstanceOf(CallCancelledException.class);

        assertThat(call.invocations()).isEqualTo(1);
        assertThat(executor.getBreaker().getState()).isEqualTo(CircuitState.CLOSED);
        assertThat(executor.getBreaker().snapshot().failureCount()).isZero();
    }

    @Test
    void cancelledProbeFreesTheHalfOpenSlot() {
        RetryExecutor executor = executorFor(BreakerConfig.defaults()
                .withFailureThreshold(1)
                .withRecoveryTimeout(Duration.ofSeconds(30)));
        ProviderCircuitBreaker breaker = executor.getBreaker();
        breaker.recordFailure(breaker.permit().orElseThrow());
        clock.advance(Duration.ofSeconds(30));

        assertThatThrownBy(() -> executor.execute(() -> {
            throw new InterruptedException("client disconnected");
        })).isInstanceOf(CallCancelledException.class);

        assertThat(executor.getBreaker().getState()).isEqualTo(CircuitState.HALF_OPEN);
        assertThat(executor.getBreaker().snapshot().probeInFlight()).isFalse();
        assertThat(executor.execute(() -> "recovered")).isEqualTo("recovered");
    }

    @Test
    void interruptedBackoffIsACancellation() {
        BackoffSleeper interruptedSleeper = delay -> {
            throw new InterruptedException("shutting down");
        };
        ProviderCircuitBreaker breaker = new ProviderCircuitBreaker(PROVIDER,
                BreakerConfig.defaults(), clock, emitter);
        RetryExecutor executor = new RetryExecutor(breaker, new TimeoutGuard(workers), emitter, interruptedSleeper);
        CountingCall<String> call = new CountingCall<>(() -> {
            throw new ConnectException("Connection refused");
        });

        assertThatThrownBy(() -> executor.execute(call)).isInstanceOf(CallCancelledException.class);

        assertThat(call.invocations()).isEqualTo(1);
        assertThat(Thread.currentThread().isInterrupted()).isTrue();
        assertThat(events.calls).singleElement()
                .extracting(CallCompletedEvent::errorKind)
                .isEqualTo(ErrorKind.CANCELLED);
    }

    @Test
    @DisplayName("three timeouts open the breaker; it fails fast, then recovers through two probes")
    void timeoutsOpenThenProbesClose() {
        RetryExecutor executor = executorFor(BreakerConfig.defaults()
                .withFailureThreshold(3)
                .withRecoveryTimeout(Duration.ofSeconds(30))
                .withSuccessThreshold(2)
                .withCallTimeout(Duration.ofMillis(50)));
        ProviderCircuitBreaker breaker = executor.getBreaker();

        assertThatThrownBy(() -> executor.execute(() -> {
            Thread.sleep(5_000);
            return "too late";
        })).isInstanceOf(RetriesExhaustedException.class);
        assertThat(breaker.getState()).isEqualTo(CircuitState.OPEN);
        assertThat(events.attempts)
                .extracting(AttemptEvent::attempt)
                .containsExactly(1, 2, 3);

        clock.advance(Duration.ofSeconds(1));
        CountingCall<String> rejected = new CountingCall<>(() -> "never");
        assertThatThrownBy(() -> executor.execute(rejected)).isInstanceOf(CircuitOpenException.class);
        assertThat(rejected.invocations()).isZero();

        clock.advance(Duration.ofSeconds(30));
        assertThat(executor.execute(() -> "probe one")).isEqualTo("probe one");
        assertThat(breaker.getState()).isEqualTo(CircuitState.HALF_OPEN);

        assertThat(executor.execute(() -> "probe two")).isEqualTo("probe two");
        assertThat(breaker.getState()).isEqualTo(CircuitState.CLOSED);
        assertThat(breaker.snapshot().failureCount()).isZero();
    }

    private RetryExecutor executorFor(BreakerConfig config) {
        ProviderCircuitBreaker breaker = new ProviderCircuitBreaker(PROVIDER, config, clock, emitter);
        return new RetryExecutor(breaker, new TimeoutGuard(workers), emitter, sleeps::add);
    }

    private static final class CountingCall<T> implements ProviderCall<T> {

        private final ProviderCall<T> delegate;
        private final AtomicInteger invocations = new AtomicInteger();

        CountingCall(ProviderCall<T> delegate) {
            this.delegate = delegate;
        }

        @Override
        public T call() throws Exception {
            invocations.incrementAndGet();
            return delegate.call();
        }

        int invocations() {
            return invocations.get();
        }
    }
}
