package com.prudhvi.llm_gateway.circuitbreaker;

import com.prudhvi.llm_gateway.circuitbreaker.BreakerStatus.Closed;
import com.prudhvi.llm_gateway.circuitbreaker.BreakerStatus.HalfOpen;
import com.prudhvi.llm_gateway.circuitbreaker.BreakerStatus.Open;
import com.prudhvi.llm_gateway.circuitbreaker.BreakerTransitions.PermitDecision;
import com.prudhvi.llm_gateway.config.BreakerConfig;

import java.time.Clock;
import java.time.Instant;
import java.util.Objects;
import java.util.Optional;
import java.util.concurrent.atomic.AtomicReference;
import java.util.function.UnaryOperator;

/**
 * Circuit breaker guarding a single named LLM provider.
 *
 * One instance exists per provider name for the lifetime of the process and
 * is shared by every concurrent caller of that provider (the
 * {@link com.prudhvi.llm_gateway.registry.ProviderRegistry} enforces this).
 *
 * Thread safety: the complete state lives in one immutable
 * {@link BreakerStatus} held by an {@link AtomicReference}. Each operation
 * reads the current status, computes the next one with
 * {@link BreakerTransitions}, and installs it with compare-and-set, retrying
 * on contention. Because the failure counter, the threshold check and the
 * transition to OPEN are a single swap, two threads can never both trip the
 * breaker, and only the thread whose swap sets the probe flag is admitted as
 * the HALF_OPEN probe.
 *
 * Only real state changes are reported to the {@link TransitionListener};
 * counter updates inside a state are not. Notification happens after the
 * swap, so two transitions racing on different threads may reach the
 * listener in either order. Consumers that need the current state read it
 * from the breaker rather than replaying events.
 */
public class ProviderCircuitBreaker {

    private final String name;
    private final BreakerConfig config;
    private final Clock clock;
    private final TransitionListener listener;

    private final AtomicReference<BreakerStatus> status = new AtomicReference<>(Closed.INITIAL);

    public ProviderCircuitBreaker(String name, BreakerConfig config, Clock clock, TransitionListener listener) {
        this.name = Objects.requireNonNull(name, "name must not be null");
        this.config = Objects.requireNonNull(config, "config must not be null");
        this.clock = Objects.requireNonNull(clock, "clock must not be null");
        this.listener = Objects.requireNonNull(listener, "listener must not be null");
    }

    /**
     * Asks whether a call may go to the provider right now.
     *
     * CLOSED always permits. OPEN permits once the recovery timeout has
     * elapsed, moving to HALF_OPEN and admitting exactly one caller as the
     * probe. HALF_OPEN permits only while no probe is outstanding.
     * Callers that get an empty result must not touch the provider; the others
     * report the attempt's outcome with the returned permit.
     */
    public Optional<BreakerPermit> permit() {
        while (true) {
            BreakerStatus current = status.get();
            PermitDecision decision = BreakerTransitions.permit(current, clock.instant(), config);
            if (decision.next() == current || status.compareAndSet(current, decision.next())) {
                notifyIfStateChanged(current, decision.next());
                return decision.permitted()
                        ? Optional.of(new BreakerPermit(decision.next().generation()))
                        : Optional.empty();
            }
        }
    }

    public void recordSuccess(BreakerPermit permit) {
        update(current -> BreakerTransitions.onSuccess(current, permit, config));
    }

    public void recordFailure(BreakerPermit permit) {
        update(current -> BreakerTransitions.onFailure(current, permit, clock.instant(), config));
    }

    /**
     * Hands back a permit without an outcome, e.g. when the caller cancelled
     * the attempt. Counters are left untouched.
     */
    public void releasePermit(BreakerPermit permit) {
        update(current -> BreakerTransitions.onRelease(current, permit));
    }

    /**
     * Administrative override: forces the breaker CLOSED with zeroed counters.
     * Results of attempts still running are ignored when they arrive.
     */
    public void reset() {
        update(BreakerTransitions::reset);
    }

    public String getName() {
        return name;
    }

    public BreakerConfig getConfig() {
        return config;
    }

    public CircuitState getState() {
        return status.get().state();
    }

    BreakerStatus currentStatus() {
        return status.get();
    }

    public BreakerSnapshot snapshot() {
        BreakerStatus current = status.get();
        if (current instanceof Closed closed) {
            return new BreakerSnapshot(name, CircuitState.CLOSED, closed.failures(), 0, null, false);
        }
        if (current instanceof Open open) {
            return new BreakerSnapshot(name, CircuitState.OPEN, 0, 0, open.since(), false);
        }
        HalfOpen halfOpen = (HalfOpen) current;
        return new BreakerSnapshot(name, CircuitState.HALF_OPEN, 0, halfOpen.successes(),
                halfOpen.openedAt(), halfOpen.probeInFlight());
    }

    private void update(UnaryOperator<BreakerStatus> transition) {
        while (true) {
            BreakerStatus current = status.get();
            BreakerStatus next = transition.apply(current);
            if (next == current) {
                return;
            }
            if (status.compareAndSet(current, next)) {
                notifyIfStateChanged(current, next);
                return;
            }
        }
    }

    private void notifyIfStateChanged(BreakerStatus from, BreakerStatus to) {
        if (from.state() == to.state()) {
            return;
        }
        Instant at = to instanceof Open open ? open.since() : clock.instant();
        listener.onTransition(name, from.state(), to.state(), at);
    }
}
