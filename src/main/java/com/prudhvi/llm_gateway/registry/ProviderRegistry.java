package com.prudhvi.llm_gateway.registry;

import com.prudhvi.llm_gateway.circuitbreaker.ProviderCircuitBreaker;
import com.prudhvi.llm_gateway.config.BreakerConfig;
import com.prudhvi.llm_gateway.events.GatewayEventEmitter;
import com.prudhvi.llm_gateway.retry.BackoffSleeper;
import com.prudhvi.llm_gateway.retry.RetryExecutor;
import com.prudhvi.llm_gateway.timeout.TimeoutGuard;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

import java.time.Clock;
import java.util.Comparator;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;

/**
 * Process-wide home of every provider's breaker and executor.
 *
 * Breakers are created lazily on the first reference to a provider name and
 * then live as long as the application. Lookups of existing providers are a
 * plain ConcurrentHashMap read; creation happens under a single lock with a
 * re-check, so two threads racing on a new name still end up sharing one
 * breaker. Distinct names never share state, which is what isolates one
 * failing provider from the others.
 *
 * The config passed on first use is the one the provider keeps; config passed
 * on later calls is ignored.
 */
@Component
public class ProviderRegistry {

    private static final Logger log = LoggerFactory.getLogger(ProviderRegistry.class);

    private final Map<String, ProviderGateway> gateways = new ConcurrentHashMap<>();
    private final Object creationLock = new Object();

    private final TimeoutGuard timeoutGuard;
    private final GatewayEventEmitter emitter;
    private final BackoffSleeper sleeper;
    private final Clock clock;

    public ProviderRegistry(TimeoutGuard timeoutGuard, GatewayEventEmitter emitter,
                            BackoffSleeper sleeper, Clock clock) {
        this.timeoutGuard = timeoutGuard;
        this.emitter = emitter;
        this.sleeper = sleeper;
        this.clock = clock;
    }

    public ProviderGateway getOrCreate(String name, BreakerConfig config) {
        if (name == null || name.isBlank()) {
            throw new IllegalArgumentException("provider name must not be blank");
        }
        ProviderGateway existing = gateways.get(name);
        if (existing != null) {
            warnOnConfigMismatch(existing, config);
            return existing;
        }
        synchronized (creationLock) {
            existing = gateways.get(name);
            if (existing != null) {
                warnOnConfigMismatch(existing, config);
                return existing;
            }
            ProviderCircuitBreaker breaker = new ProviderCircuitBreaker(name, config, clock, emitter);
            RetryExecutor executor = new RetryExecutor(breaker, timeoutGuard, emitter, sleeper);
            ProviderGateway created = new ProviderGateway(breaker, executor);
            gateways.put(name, created);

            log.info("Registered provider {} (failureThreshold={}, recoveryTimeout={}, callTimeout={}, maxRetries={})",
                    name, config.failureThreshold(), config.recoveryTimeout(),
                    config.callTimeout(), config.maxRetries());
            emitter.providerRegistered(breaker);
            return created;
        }
    }

    public Optional<ProviderGateway> find(String name) {
        return Optional.ofNullable(gateways.get(name));
    }

    /**
     * All registered providers, sorted by name.
     */
    public List<ProviderGateway> all() {
        return gateways.values().stream()
                .sorted(Comparator.comparing(ProviderGateway::name))
                .toList();
    }

    private void warnOnConfigMismatch(ProviderGateway existing, BreakerConfig requested) {
        if (requested != null && !requested.equals(existing.breaker().getConfig())) {
            log.warn("Provider {} is already registered with a different config; keeping the original",
                    existing.name());
        }
    }
}
