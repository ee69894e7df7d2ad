package com.prudhvi.llm_gateway.stream;

import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.RestController;
import org.springframework.web.servlet.mvc.method.annotation.SseEmitter;

/**
 * Server-Sent Events endpoint for the live breaker view of the dashboard.
 *
 * GET /providers/stream keeps the connection open; every breaker transition
 * flows GatewayEventEmitter -> SseEmitterRegistry -> browser.
 */
@RestController
public class BreakerStreamController {

    private final SseEmitterRegistry registry;

    public BreakerStreamController(SseEmitterRegistry registry) {
        this.registry = registry;
    }

    @GetMapping("/providers/stream")
    public SseEmitter stream() {
        return registry.register();
    }
}
