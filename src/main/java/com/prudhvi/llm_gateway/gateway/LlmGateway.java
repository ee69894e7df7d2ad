package com.prudhvi.llm_gateway.gateway;

import com.prudhvi.llm_gateway.config.GatewayProperties;
import com.prudhvi.llm_gateway.error.GatewayException;
import com.prudhvi.llm_gateway.registry.ProviderGateway;
import com.prudhvi.llm_gateway.registry.ProviderRegistry;
import com.prudhvi.llm_gateway.timeout.ProviderCall;
import org.springframework.stereotype.Service;

/**
 * Entry point for the AI-flow layer.
 *
 * Callers name the provider they want; choosing that provider is their
 * business. The gateway looks up (or lazily creates) that provider's breaker
 * with the configuration from application.yaml and runs the call through the
 * provider's retry executor.
 *
 * Every failure surfaces as a {@link GatewayException} subtype.
 */
@Service
public class LlmGateway {

    private final ProviderRegistry registry;
    private final GatewayProperties properties;

    public LlmGateway(ProviderRegistry registry, GatewayProperties properties) {
        this.registry = registry;
        this.properties = properties;
    }

    public <T> T execute(CallDescriptor<T> descriptor) {
        ProviderGateway gateway = gatewayFor(descriptor.provider());
        return gateway.executor().execute(descriptor.operation(), descriptor.timeoutOverride());
    }

    public <T> T execute(String provider, ProviderCall<T> operation) {
        return execute(CallDescriptor.of(provider, operation));
    }

    ProviderGateway gatewayFor(String provider) {
        return registry.find(provider)
                .orElseGet(() -> registry.getOrCreate(provider, properties.resolve(provider)));
    }
}
