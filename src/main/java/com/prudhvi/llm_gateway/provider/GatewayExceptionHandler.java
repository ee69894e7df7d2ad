package com.prudhvi.llm_gateway.provider;

import com.prudhvi.llm_gateway.circuitbreaker.ProviderCircuitBreaker;
import com.prudhvi.llm_gateway.error.CallCancelledException;
import com.prudhvi.llm_gateway.error.CallTimeoutException;
import com.prudhvi.llm_gateway.error.CircuitOpenException;
import com.prudhvi.llm_gateway.error.GatewayException;
import com.prudhvi.llm_gateway.error.UnknownProviderException;
import com.prudhvi.llm_gateway.registry.ProviderGateway;
import com.prudhvi.llm_gateway.registry.ProviderRegistry;
import org.springframework.http.HttpHeaders;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.ExceptionHandler;
import org.springframework.web.bind.annotation.RestControllerAdvice;

import java.time.Duration;
import java.util.Map;

/**
 * Translates gateway errors raised anywhere in the web layer (the AI-flow
 * controllers included) into HTTP responses.
 *
 * 503 + Retry-After  circuit open, or the call was cancelled
 * 504                an attempt timed out
 * 502                provider error or retries exhausted
 * 404                unknown provider on the monitoring endpoints
 */
@RestControllerAdvice
public class GatewayExceptionHandler {

    private final ProviderRegistry registry;

    public GatewayExceptionHandler(ProviderRegistry registry) {
        this.registry = registry;
    }

    @ExceptionHandler(CircuitOpenException.class)
    public ResponseEntity<Map<String, String>> handleCircuitOpen(CircuitOpenException ex) {
        long retryAfterSeconds = registry.find(ex.getProvider())
                .map(ProviderGateway::breaker)
                .map(ProviderCircuitBreaker::getConfig)
                .map(config -> config.recoveryTimeout().toSeconds())
                .orElse(Duration.ofSeconds(30).toSeconds());
        return ResponseEntity
                .status(HttpStatus.SERVICE_UNAVAILABLE)
                .header(HttpHeaders.RETRY_AFTER, String.valueOf(Math.max(1, retryAfterSeconds)))
                .body(body(ex));
    }

    @ExceptionHandler(CallCancelledException.class)
    public ResponseEntity<Map<String, String>> handleCancelled(CallCancelledException ex) {
        return ResponseEntity.status(HttpStatus.SERVICE_UNAVAILABLE).body(body(ex));
    }

    @ExceptionHandler(CallTimeoutException.class)
    public ResponseEntity<Map<String, String>> handleTimeout(CallTimeoutException ex) {
        return ResponseEntity.status(HttpStatus.GATEWAY_TIMEOUT).body(body(ex));
    }

    @ExceptionHandler(GatewayException.class)
    public ResponseEntity<Map<String, String>> handleProviderFailure(GatewayException ex) {
        return ResponseEntity.status(HttpStatus.BAD_GATEWAY).body(body(ex));
    }

    @ExceptionHandler(UnknownProviderException.class)
    public ResponseEntity<Map<String, String>> handleUnknownProvider(UnknownProviderException ex) {
        return ResponseEntity
                .status(HttpStatus.NOT_FOUND)
                .body(Map.of("error", ex.getMessage(), "provider", ex.getProvider()));
    }

    private static Map<String, String> body(GatewayException ex) {
        return Map.of(
                "error", ex.getMessage(),
                "provider", String.valueOf(ex.getProvider()),
                "kind", ex.getKind().name());
    }
}
