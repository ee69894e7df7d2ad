package com.prudhvi.llm_gateway.events;

import com.prudhvi.llm_gateway.circuitbreaker.CircuitState;
import com.prudhvi.llm_gateway.circuitbreaker.ProviderCircuitBreaker;
import com.prudhvi.llm_gateway.circuitbreaker.TransitionListener;
import com.prudhvi.llm_gateway.error.ErrorKind;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.List;
import java.util.concurrent.Executor;
import java.util.concurrent.RejectedExecutionException;
import java.util.function.Consumer;

/**
 * Fans gateway events out to every registered {@link GatewayEventSink}.
 *
 * Fire-and-forget: events are handed to a dispatch executor and the request
 * thread returns immediately. If the executor's queue is full the event is
 * dropped with a WARN, and a sink that throws is logged and skipped. Neither
 * case ever reaches the caller of the gateway.
 *
 * With a single-threaded dispatcher, sinks see events of a provider in the
 * order they were emitted.
 */
public class GatewayEventEmitter implements TransitionListener {

    private static final Logger log = LoggerFactory.getLogger(GatewayEventEmitter.class);

    private final List<GatewayEventSink> sinks;
    private final Executor dispatcher;
    private final Clock clock;

    public GatewayEventEmitter(List<GatewayEventSink> sinks, Executor dispatcher, Clock clock) {
        this.sinks = List.copyOf(sinks);
        this.dispatcher = dispatcher;
        this.clock = clock;
    }

    @Override
    public void onTransition(String provider, CircuitState from, CircuitState to, Instant at) {
        StateTransitionEvent event = new StateTransitionEvent(provider, from, to, at);
        dispatch(event, sink -> sink.onTransition(event));
    }

    public void providerRegistered(ProviderCircuitBreaker breaker) {
        dispatch(breaker.getName() + " registered", sink -> sink.onProviderRegistered(breaker));
    }

    public void attemptFinished(String provider, int attempt, AttemptOutcome outcome) {
        AttemptEvent event = new AttemptEvent(provider, attempt, outcome, clock.instant());
        dispatch(event, sink -> sink.onAttempt(event));
    }

    public void callCompleted(String provider, int attempts, ErrorKind errorKind, Duration elapsed) {
        CallCompletedEvent event = new CallCompletedEvent(
                provider, attempts, errorKind == null, errorKind, elapsed, clock.instant());
        dispatch(event, sink -> sink.onCallCompleted(event));
    }

    private void dispatch(Object event, Consumer<GatewayEventSink> delivery) {
        if (sinks.isEmpty()) {
            return;
        }
        try {
            dispatcher.execute(() -> deliver(event, delivery));
        } catch (RejectedExecutionException e) {
            log.warn("Dropping gateway event, dispatcher is saturated: {}", event);
        }
    }

    private void deliver(Object event, Consumer<GatewayEventSink> delivery) {
        for (GatewayEventSink sink : sinks) {
            try {
                delivery.accept(sink);
            } catch (RuntimeException e) {
                log.warn("Event sink {} failed on {}: {}", sink.getClass().getSimpleName(), event, e.getMessage());
            }
        }
    }
}
