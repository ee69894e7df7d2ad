package com.prudhvi.llm_gateway.config;

import jakarta.annotation.PostConstruct;
import lombok.Getter;
import lombok.Setter;
import org.springframework.boot.context.properties.ConfigurationProperties;

import java.time.Duration;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Binds the llm-gateway.* block of application.yaml.
 *
 * Example:
 * <pre>
 * llm-gateway:
 *   defaults:
 *     failure-threshold: 5
 *     recovery-timeout: 30s
 *   providers:
 *     ollama:
 *       call-timeout: 120s
 * </pre>
 *
 * Every key under a provider is optional and falls back to the value under
 * defaults, which in turn falls back to {@link BreakerConfig#defaults()}.
 */
@Getter
@Setter
@ConfigurationProperties(prefix = "llm-gateway")
public class GatewayProperties {

    private Resilience defaults = new Resilience();

    private Map<String, Resilience> providers = new LinkedHashMap<>();

    private Events events = new Events();

    /**
     * Resolves the defaults and every configured provider once at startup, so
     * an invalid value fails context creation instead of a provider's first call.
     */
    @PostConstruct
    public void validate() {
        try {
            defaults.applyTo(BreakerConfig.defaults());
        } catch (IllegalArgumentException | NullPointerException e) {
            throw new IllegalStateException("Invalid llm-gateway.defaults: " + e.getMessage(), e);
        }
        providers.keySet().forEach(provider -> {
            try {
                resolve(provider);
            } catch (IllegalArgumentException | NullPointerException e) {
                throw new IllegalStateException(
                        "Invalid llm-gateway.providers." + provider + ": " + e.getMessage(), e);
            }
        });
    }

    /**
     * Builds the immutable config for a provider. Throws
     * IllegalArgumentException if the merged values are invalid.
     */
    public BreakerConfig resolve(String provider) {
        BreakerConfig base = defaults.applyTo(BreakerConfig.defaults());
        Resilience override = providers.get(provider);
        return override == null ? base : override.applyTo(base);
    }

    /**
     * Resilience settings; null means "inherit".
     */
    @Getter
    @Setter
    public static class Resilience {

        private Integer failureThreshold;
        private Duration recoveryTimeout;
        private Integer successThreshold;
        private Duration callTimeout;
        private Integer maxRetries;
        private Duration backoffBase;
        private Double backoffFactor;
        private Duration maxBackoff;
        private Double backoffJitter;

        BreakerConfig applyTo(BreakerConfig base) {
            return new BreakerConfig(
                    failureThreshold != null ? failureThreshold : base.failureThreshold(),
                    recoveryTimeout != null ? recoveryTimeout : base.recoveryTimeout(),
                    successThreshold != null ? successThreshold : base.successThreshold(),
                    callTimeout != null ? callTimeout : base.callTimeout(),
                    maxRetries != null ? maxRetries : base.maxRetries(),
                    backoffBase != null ? backoffBase : base.backoffBase(),
                    backoffFactor != null ? backoffFactor : base.backoffFactor(),
                    maxBackoff != null ? maxBackoff : base.maxBackoff(),
                    backoffJitter != null ? backoffJitter : base.backoffJitter());
        }
    }

    @Getter
    @Setter
    public static class Events {

        // Events beyond this many pending deliveries are dropped.
        private int queueCapacity = 10_000;

        private Kafka kafka = new Kafka();
    }

    @Getter
    @Setter
    public static class Kafka {

        private boolean enabled = false;
        private String topic = "llm-gateway.breaker-events";
    }
}
