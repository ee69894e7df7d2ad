package com.prudhvi.llm_gateway.circuitbreaker;

import com.prudhvi.llm_gateway.circuitbreaker.BreakerStatus.Closed;
import com.prudhvi.llm_gateway.circuitbreaker.BreakerStatus.HalfOpen;
import com.prudhvi.llm_gateway.circuitbreaker.BreakerStatus.Open;
import com.prudhvi.llm_gateway.config.BreakerConfig;

import java.time.Instant;

/**
 * Pure transition functions of the breaker state machine.
 *
 * Every method takes the current {@link BreakerStatus} plus whatever input the
 * event needs and returns the next status. When an event does not change
 * anything the very same instance is returned, which the breaker uses to skip
 * its compare-and-set.
 *
 * <pre>
 *   CLOSED --(failures reach threshold)--> OPEN
 *   OPEN   --(recovery timeout elapsed, first permit)--> HALF_OPEN (probe admitted)
 *   HALF_OPEN --(probe failed)--> OPEN (fresh openedAt)
 *   HALF_OPEN --(successes reach threshold)--> CLOSED
 * </pre>
 *
 * Outcomes carry the {@link BreakerPermit} of the attempt. Only an outcome
 * issued under the current generation can move the state; everything else is
 * a late result and leaves the status untouched.
 */
public final class BreakerTransitions {

    /**
     * Outcome of asking for a permit: the status to install and whether the
     * caller may go ahead.
     */
    public record PermitDecision(BreakerStatus next, boolean permitted) {}

    private BreakerTransitions() {
    }

    public static PermitDecision permit(BreakerStatus current, Instant now, BreakerConfig config) {
        if (current instanceof Closed) {
            return new PermitDecision(current, true);
        }
        if (current instanceof Open open) {
            Instant retryAt = open.since().plus(config.recoveryTimeout());
            if (now.isBefore(retryAt)) {
                return new PermitDecision(current, false);
            }
            // The caller that performs this transition is the probe.
            return new PermitDecision(new HalfOpen(open.since(), 0, true, open.generation() + 1), true);
        }
        HalfOpen halfOpen = (HalfOpen) current;
        if (halfOpen.probeInFlight()) {
            return new PermitDecision(current, false);
        }
        return new PermitDecision(
                new HalfOpen(halfOpen.openedAt(), halfOpen.successes(), true, halfOpen.generation() + 1), true);
    }

    public static BreakerStatus onSuccess(BreakerStatus current, BreakerPermit permit, BreakerConfig config) {
        if (isStale(current, permit)) {
            return current;
        }
        if (current instanceof Closed closed) {
            return closed.failures() == 0 ? current : new Closed(0, closed.generation());
        }
        if (current instanceof HalfOpen halfOpen && halfOpen.probeInFlight()) {
            int successes = halfOpen.successes() + 1;
            if (successes >= config.successThreshold()) {
                return new Closed(0, halfOpen.generation() + 1);
            }
            return new HalfOpen(halfOpen.openedAt(), successes, false, halfOpen.generation());
        }
        return current;
    }

    public static BreakerStatus onFailure(BreakerStatus current, BreakerPermit permit, Instant now,
                                          BreakerConfig config) {
        if (isStale(current, permit)) {
            return current;
        }
        if (current instanceof Closed closed) {
            int failures = closed.failures() + 1;
            if (failures >= config.failureThreshold()) {
                return new Open(now, closed.generation() + 1);
            }
            return new Closed(failures, closed.generation());
        }
        if (current instanceof HalfOpen halfOpen && halfOpen.probeInFlight()) {
            return new Open(now, halfOpen.generation() + 1);
        }
        return current;
    }

    /**
     * An admitted attempt ended without a verdict on the provider (the caller
     * cancelled it). Frees the probe slot so another caller can test recovery.
     */
    public static BreakerStatus onRelease(BreakerStatus current, BreakerPermit permit) {
        if (!isStale(current, permit) && current instanceof HalfOpen halfOpen && halfOpen.probeInFlight()) {
            return new HalfOpen(halfOpen.openedAt(), halfOpen.successes(), false, halfOpen.generation());
        }
        return current;
    }

    /**
     * Administrative reset: CLOSED with zeroed counters. Outstanding permits
     * become stale.
     */
    public static BreakerStatus reset(BreakerStatus current) {
        return new Closed(0, current.generation() + 1);
    }

    // Outcomes of attempts admitted under an earlier generation, e.g. a call
    // that started while CLOSED and finishes after the breaker tripped and
    // admitted a probe, say nothing about the current probe.
    private static boolean isStale(BreakerStatus current, BreakerPermit permit) {
        return permit.generation() != current.generation();
    }
}
