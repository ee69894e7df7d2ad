package com.prudhvi.llm_gateway.events;

import com.prudhvi.llm_gateway.circuitbreaker.ProviderCircuitBreaker;
import io.micrometer.core.instrument.Counter;
import io.micrometer.core.instrument.Gauge;
import io.micrometer.core.instrument.MeterRegistry;
import io.micrometer.core.instrument.Timer;
import org.springframework.stereotype.Component;

import java.util.Locale;

/**
 * Publishes gateway events as Micrometer meters.
 *
 * breaker.state{provider}                 gauge, 0 = closed, 1 = half open, 2 = open
 * breaker.failures{provider}              attempts that counted against the breaker
 * llm.gateway.attempts{provider,outcome}  every attempt, by outcome
 * llm.gateway.attempt.duration{provider}  attempt latency
 * llm.gateway.calls{provider,result}      terminal result of each logical call
 *
 * With the Prometheus registry these are exported as breaker_state,
 * breaker_failures_total, and so on.
 *
 * The state gauge samples the breaker itself, so it cannot be left behind
 * by transition events delivered out of order.
 */
@Component
public class MetricsEventSink implements GatewayEventSink {

    static final String STATE_GAUGE = "breaker.state";
    static final String FAILURES = "breaker.failures";
    static final String ATTEMPTS = "llm.gateway.attempts";
    static final String ATTEMPT_DURATION = "llm.gateway.attempt.duration";
    static final String CALLS = "llm.gateway.calls";

    private final MeterRegistry registry;

    public MetricsEventSink(MeterRegistry registry) {
        this.registry = registry;
    }

    // The registry holds every breaker for the life of the process, so the
    // gauge's weak reference never clears.
    @Override
    public void onProviderRegistered(ProviderCircuitBreaker breaker) {
        Gauge.builder(STATE_GAUGE, breaker, b -> b.getState().gaugeValue())
                .description("Circuit breaker state (0=closed, 1=half_open, 2=open)")
                .tag("provider", breaker.getName())
                .register(registry);
    }

    @Override
    public void onAttempt(AttemptEvent event) {
        AttemptOutcome outcome = event.outcome();
        String label = outcome.succeeded() ? "success" : tagValue(outcome.errorKind());

        Counter.builder(ATTEMPTS)
                .description("LLM provider call attempts")
                .tag("provider", event.provider())
                .tag("outcome", label)
                .register(registry)
                .increment();

        Timer.builder(ATTEMPT_DURATION)
                .description("Duration of LLM provider call attempts")
                .tag("provider", event.provider())
                .register(registry)
                .record(outcome.elapsed());

        if (!outcome.succeeded() && outcome.errorKind().countsAgainstBreaker()) {
            Counter.builder(FAILURES)
                    .description("Failures counted against the provider's circuit breaker")
                    .tag("provider", event.provider())
                    .register(registry)
                    .increment();
        }
    }

    @Override
    public void onCallCompleted(CallCompletedEvent event) {
        String result = event.succeeded() ? "success" : tagValue(event.errorKind());
        Counter.builder(CALLS)
                .description("Logical LLM calls by terminal result")
                .tag("provider", event.provider())
                .tag("result", result)
                .register(registry)
                .increment();
    }

    private static String tagValue(Enum<?> kind) {
        return kind.name().toLowerCase(Locale.ROOT);
    }
}
