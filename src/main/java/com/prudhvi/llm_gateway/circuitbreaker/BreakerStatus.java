package com.prudhvi.llm_gateway.circuitbreaker;

import java.time.Instant;
import java.util.Objects;

/**
 * Immutable state of one breaker, as a tagged variant.
 *
 * Each variant carries only the data that is meaningful in that state, so a
 * failure counter cannot leak into HALF_OPEN and a probe flag cannot exist
 * while CLOSED. Transitions never mutate a status; they produce a new one
 * (see {@link BreakerTransitions}), which lets the breaker swap the whole
 * state with a single compare-and-set.
 *
 * Every variant carries a generation. It grows on each state change and on
 * each probe admission, and stays put while only counters change. A
 * {@link BreakerPermit} remembers the generation it was issued under.
 */
public sealed interface BreakerStatus
        permits BreakerStatus.Closed, BreakerStatus.Open, BreakerStatus.HalfOpen {

    CircuitState state();

    long generation();

    /**
     * @param failures consecutive failures observed since the last success
     */
    record Closed(int failures, long generation) implements BreakerStatus {

        public static final Closed INITIAL = new Closed(0, 0);

        public Closed {
            if (failures < 0) {
                throw new IllegalArgumentException("failures must be >= 0");
            }
        }

        @Override
        public CircuitState state() {
            return CircuitState.CLOSED;
        }
    }

    /**
     * @param since the moment of the most recent transition into OPEN
     */
    record Open(Instant since, long generation) implements BreakerStatus {

        public Open {
            Objects.requireNonNull(since, "since");
        }

        @Override
        public CircuitState state() {
            return CircuitState.OPEN;
        }
    }

    /**
     * @param openedAt      when the breaker last opened; kept so snapshots can report it
     * @param successes     consecutive successful probes since entering HALF_OPEN
     * @param probeInFlight true while a probe has been admitted and not yet reported
     * @param generation    generation under which the current or last probe was admitted
     */
    record HalfOpen(Instant openedAt, int successes, boolean probeInFlight, long generation)
            implements BreakerStatus {

        public HalfOpen {
            Objects.requireNonNull(openedAt, "openedAt");
            if (successes < 0) {
                throw new IllegalArgumentException("successes must be >= 0");
            }
        }

        @Override
        public CircuitState state() {
            return CircuitState.HALF_OPEN;
        }
    }
}
