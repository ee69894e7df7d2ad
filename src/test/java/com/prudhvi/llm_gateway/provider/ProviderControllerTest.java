package com.prudhvi.llm_gateway.provider;

import com.prudhvi.llm_gateway.MutableClock;
import com.prudhvi.llm_gateway.circuitbreaker.ProviderCircuitBreaker;
import com.prudhvi.llm_gateway.config.BreakerConfig;
import com.prudhvi.llm_gateway.events.RecordingEventSink;
import com.prudhvi.llm_gateway.registry.ProviderRegistry;
import com.prudhvi.llm_gateway.timeout.TimeoutGuard;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.springframework.test.web.servlet.MockMvc;
import org.springframework.test.web.servlet.setup.MockMvcBuilders;

import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;

import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.get;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.post;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.jsonPath;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.status;

class ProviderControllerTest {

    private ExecutorService workers;
    private ProviderRegistry registry;
    private MockMvc mockMvc;

    @BeforeEach
    void setUp() {
        workers = Executors.newCachedThreadPool();
        MutableClock clock = MutableClock.startingAt("2026-01-01T00:00:00Z");
        registry = new ProviderRegistry(new TimeoutGuard(workers),
                new RecordingEventSink().directEmitter(clock), delay -> { }, clock);
        mockMvc = MockMvcBuilders.standaloneSetup(new ProviderController(registry))
                .setControllerAdvice(new GatewayExceptionHandler(registry))
                .build();
    }

    @AfterEach
    void tearDown() {
        workers.shutdownNow();
    }

    @Test
    void listsRegisteredBreakersSortedByName() throws Exception {
        registry.getOrCreate("openai-compatible", BreakerConfig.defaults());
        registry.getOrCreate("ollama", BreakerConfig.defaults());

        mockMvc.perform(get("/providers"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.length()").value(2))
                .andExpect(jsonPath("$[0].name").value("ollama"))
                .andExpect(jsonPath("$[0].state").value("CLOSED"))
                .andExpect(jsonPath("$[1].name").value("openai-compatible"));
    }

    @Test
    void showsOneBreaker() throws Exception {
        ProviderCircuitBreaker breaker = registry.getOrCreate("ollama", BreakerConfig.defaults()).breaker();
        breaker.recordFailure(breaker.permit().orElseThrow());

        mockMvc.perform(get("/providers/ollama"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.failureCount").value(1))
                .andExpect(jsonPath("$.probeInFlight").value(false));
    }

    @Test
    void unknownProviderIsNotFound() throws Exception {
        mockMvc.perform(get("/providers/anthropic"))
                .andExpect(status().isNotFound())
                .andExpect(jsonPath("$.provider").value("anthropic"));
    }

    @Test
    void resetClosesAnOpenBreaker() throws Exception {
        ProviderCircuitBreaker breaker = registry.getOrCreate("ollama",
                BreakerConfig.defaults().withFailureThreshold(1)).breaker();
        breaker.recordFailure(breaker.permit().orElseThrow());

        mockMvc.perform(post("/providers/ollama/reset"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.state").value("CLOSED"))
                .andExpect(jsonPath("$.failureCount").value(0));
    }

    @Test
    void resetOfUnknownProviderIsNotFound() throws Exception {
        mockMvc.perform(post("/providers/anthropic/reset"))
                .andExpect(status().isNotFound());
    }
}
