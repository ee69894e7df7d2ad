package com.prudhvi.llm_gateway.gateway;

import com.prudhvi.llm_gateway.MutableClock;
import com.prudhvi.llm_gateway.circuitbreaker.CircuitState;
import com.prudhvi.llm_gateway.config.GatewayProperties;
import com.prudhvi.llm_gateway.error.CircuitOpenException;
import com.prudhvi.llm_gateway.error.ProviderException;
import com.prudhvi.llm_gateway.error.RetriesExhaustedException;
import com.prudhvi.llm_gateway.events.RecordingEventSink;
import com.prudhvi.llm_gateway.registry.ProviderRegistry;
import com.prudhvi.llm_gateway.timeout.TimeoutGuard;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.time.Duration;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.atomic.AtomicInteger;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class LlmGatewayTest {

    private ExecutorService workers;
    private ProviderRegistry registry;
    private LlmGateway gateway;

    @BeforeEach
    void setUp() {
        workers = Executors.newCachedThreadPool();
        MutableClock clock = MutableClock.startingAt("2026-01-01T00:00:00Z");

        GatewayProperties properties = new GatewayProperties();
        properties.getDefaults().setBackoffBase(Duration.ZERO);
        properties.getDefaults().setMaxBackoff(Duration.ZERO);
        GatewayProperties.Resilience ollama = new GatewayProperties.Resilience();
        ollama.setFailureThreshold(2);
        ollama.setMaxRetries(1);
        properties.getProviders().put("ollama", ollama);

        registry = new ProviderRegistry(new TimeoutGuard(workers),
                new RecordingEventSink().directEmitter(clock), delay -> { }, clock);
        gateway = new LlmGateway(registry, properties);
    }

    @AfterEach
    void tearDown() {
        workers.shutdownNow();
    }

    @Test
    void registersProviderLazilyWithItsConfiguredOverrides() {
        assertThat(registry.find("ollama")).isEmpty();

        String summary = gateway.execute("ollama", () -> "Deed of sale between two parties.");

        assertThat(summary).isEqualTo("Deed of sale between two parties.");
        assertThat(registry.find("ollama")).get()
                .satisfies(registered -> {
                    assertThat(registered.breaker().getConfig().failureThreshold()).isEqualTo(2);
                    assertThat(registered.breaker().getConfig().maxRetries()).isEqualTo(1);
                });
    }

    @Test
    void descriptorTimeoutAppliesToThatCallOnly() {
        AtomicInteger calls = new AtomicInteger();
        CallDescriptor<String> slow = CallDescriptor.<String>of("openai-compatible", () -> {
            calls.incrementAndGet();
            Thread.sleep(5_000);
            return "too late";
        }).withTimeout(Duration.ofMillis(50));

        assertThatThrownBy(() -> gateway.execute(slow)).isInstanceOf(RetriesExhaustedException.class);

        assertThat(calls.get()).isEqualTo(3);
        assertThat(gateway.execute("openai-compatible", () -> "fast")).isEqualTo("fast");
    }

    @Test
    void failingProviderIsIsolatedFromOthers() {
        assertThatThrownBy(() -> gateway.execute("ollama", () -> {
            throw new ProviderException("ollama", 502, "bad gateway");
        })).isInstanceOf(RetriesExhaustedException.class);

        assertThat(registry.find("ollama").orElseThrow().breaker().getState()).isEqualTo(CircuitState.OPEN);
        assertThatThrownBy(() -> gateway.execute("ollama", () -> "unreachable"))
                .isInstanceOf(CircuitOpenException.class);
        assertThat(gateway.execute("openai-compatible", () -> "still up")).isEqualTo("still up");
    }

    @Test
    void descriptorRejectsInvalidInput() {
        assertThatThrownBy(() -> CallDescriptor.of("", () -> "x"))
                .isInstanceOf(IllegalArgumentException.class);
        assertThatThrownBy(() -> CallDescriptor.of("ollama", () -> "x").withTimeout(Duration.ZERO))
                .isInstanceOf(IllegalArgumentException.class);
    }
}
