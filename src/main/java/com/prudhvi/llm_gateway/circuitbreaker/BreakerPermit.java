package com.prudhvi.llm_gateway.circuitbreaker;

/**
 * Ticket handed to a caller admitted by {@link ProviderCircuitBreaker#permit()}.
 *
 * The outcome of the attempt must be reported with the same ticket. An outcome
 * whose ticket no longer matches the breaker's generation belongs to an
 * attempt admitted before a later transition and is ignored.
 *
 * @param generation generation of the breaker status that admitted the attempt
 */
public record BreakerPermit(long generation) {
}
