package com.tbproxy.gateway.controller;

import com.tbproxy.gateway.dto.HealthResponse;
import io.swagger.v3.oas.annotations.Operation;
import io.swagger.v3.oas.annotations.tags.Tag;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.RestController;
import reactor.core.publisher.Mono;

import java.time.Clock;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Liveness endpoints. Neither requires an API key nor counts against the rate limit.
 */
@RestController
@Tag(name = "health", description = "Service health and status endpoints")
public class HealthController {

    private final String serviceName;
    private final String version;
    private final Clock clock;

    public HealthController(
            @Value("${spring.application.name:tb-proxy}") String serviceName,
            @Value("${app.version:0.1.0}") String version,
            Clock clock) {
        this.serviceName = serviceName;
        this.version = version;
        this.clock = clock;
    }

    @Operation(summary = "Health check")
    @GetMapping("/api/v1/health")
    public Mono<HealthResponse> health() {
        return Mono.just(new HealthResponse("success", clock.millis(), serviceName, version));
    }

    @Operation(summary = "Service name and version")
    @GetMapping("/")
    public Mono<Map<String, String>> root() {
        Map<String, String> body = new LinkedHashMap<>();
        body.put("service", serviceName);
        body.put("version", version);
        return Mono.just(body);
    }
}
