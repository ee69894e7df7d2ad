package com.prudhvi.llm_gateway.provider;

import com.prudhvi.llm_gateway.circuitbreaker.BreakerSnapshot;
import com.prudhvi.llm_gateway.circuitbreaker.ProviderCircuitBreaker;
import com.prudhvi.llm_gateway.error.UnknownProviderException;
import com.prudhvi.llm_gateway.registry.ProviderGateway;
import com.prudhvi.llm_gateway.registry.ProviderRegistry;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

import java.util.List;

/**
 * Monitoring and administration of provider circuit breakers.
 *
 * Read-only endpoints never create breakers; only providers that have been
 * called at least once are listed.
 */
@RestController
@RequestMapping("/providers")
public class ProviderController {

    private static final Logger log = LoggerFactory.getLogger(ProviderController.class);

    private final ProviderRegistry registry;

    public ProviderController(ProviderRegistry registry) {
        this.registry = registry;
    }

    /**
     * GET /providers
     * Snapshots of every registered breaker, sorted by provider name.
     */
    @GetMapping
    public List<BreakerSnapshot> findAll() {
        return registry.all().stream()
                .map(gateway -> gateway.breaker().snapshot())
                .toList();
    }

    /**
     * GET /providers/{name}
     * Snapshot of one breaker, or 404 if the provider was never registered.
     */
    @GetMapping("/{name}")
    public BreakerSnapshot findByName(@PathVariable String name) {
        return breakerOf(name).snapshot();
    }

    /**
     * POST /providers/{name}/reset
     * Forces the breaker CLOSED with zeroed counters and returns the new snapshot.
     */
    @PostMapping("/{name}/reset")
    public BreakerSnapshot reset(@PathVariable String name) {
        ProviderCircuitBreaker breaker = breakerOf(name);
        log.info("Administrative reset of circuit breaker for provider {} (was {})", name, breaker.getState());
        breaker.reset();
        return breaker.snapshot();
    }

    private ProviderCircuitBreaker breakerOf(String name) {
        return registry.find(name)
                .map(ProviderGateway::breaker)
                .orElseThrow(() -> new UnknownProviderException(name));
    }
}
