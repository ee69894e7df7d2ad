package com.prudhvi.llm_gateway.events;

import com.prudhvi.llm_gateway.circuitbreaker.CircuitState;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

/**
 * Writes gateway events to the application log.
 *
 * Opening a breaker is a WARN; recovery steps are INFO; individual failed
 * attempts are DEBUG since retries usually absorb them.
 */
@Component
public class LoggingEventSink implements GatewayEventSink {

    private static final Logger log = LoggerFactory.getLogger(LoggingEventSink.class);

    @Override
    public void onTransition(StateTransitionEvent event) {
        if (event.to() == CircuitState.OPEN) {
            log.warn("Circuit breaker for provider {} opened ({} -> {})",
                    event.provider(), event.from(), event.to());
        } else {
            log.info("Circuit breaker for provider {} moved {} -> {}",
                    event.provider(), event.from(), event.to());
        }
    }

    @Override
    public void onAttempt(AttemptEvent event) {
        AttemptOutcome outcome = event.outcome();
        if (!outcome.succeeded()) {
            log.debug("Attempt {} to provider {} failed with {} after {} ms",
                    event.attempt(), event.provider(), outcome.errorKind(), outcome.elapsed().toMillis());
        }
    }

    @Override
    public void onCallCompleted(CallCompletedEvent event) {
        if (!event.succeeded()) {
            log.info("Call to provider {} failed with {} after {} attempt(s) in {} ms",
                    event.provider(), event.errorKind(), event.attempts(), event.elapsed().toMillis());
        }
    }
}
