package com.prudhvi.llm_gateway.registry;

import com.prudhvi.llm_gateway.circuitbreaker.ProviderCircuitBreaker;
import com.prudhvi.llm_gateway.retry.RetryExecutor;

/**
 * The breaker of one provider together with the executor bound to it.
 */
public record ProviderGateway(ProviderCircuitBreaker breaker, RetryExecutor executor) {

    public String name() {
        return breaker.getName();
    }
}
