package com.tbproxy.gateway.filter;

import com.tbproxy.common.error.ErrorNormalizer;
import org.junit.jupiter.api.Test;
import org.springframework.http.HttpStatus;
import org.springframework.mock.http.server.reactive.MockServerHttpRequest;
import org.springframework.mock.web.server.MockServerWebExchange;
import reactor.core.publisher.Mono;

import java.util.concurrent.atomic.AtomicBoolean;

import static org.junit.jupiter.api.Assertions.*;

class ApiKeyFilterTest {

    private final ErrorResponseWriter writer = new ErrorResponseWriter(ErrorNormalizer.standard());

    private boolean passes(ApiKeyFilter filter, MockServerWebExchange exchange) {
        AtomicBoolean reached = new AtomicBoolean();
        filter.filter(exchange, ex -> {
            reached.set(true);
            return Mono.empty();
        }).block();
        return reached.get();
    }

    @Test
    void shouldAllowEverythingWhenNoKeyIsConfigured() {
        ApiKeyFilter filter = new ApiKeyFilter("", writer);

        assertTrue(passes(filter, MockServerWebExchange.from(MockServerHttpRequest.post("/api/v1/tb/telemetry/bulk"))));
    }

    @Test
    void shouldAcceptMatchingKey() {
        ApiKeyFilter filter = new ApiKeyFilter("s3cr3t", writer);

        assertTrue(passes(filter, MockServerWebExchange.from(MockServerHttpRequest.post("/api/v1/tb/telemetry/bulk")
                .header("X-API-Key", "s3cr3t"))));
    }

    @Test
    void shouldRejectWrongKeyWithoutEchoingIt() {
        ApiKeyFilter filter = new ApiKeyFilter("s3cr3t", writer);
        MockServerWebExchange exchange = MockServerWebExchange.from(MockServerHttpRequest.post("/api/v1/tb/telemetry/bulk")
                .header("X-API-Key", "s3cr3t-guess"));

        assertFalse(passes(filter, exchange));
        assertEquals(HttpStatus.UNAUTHORIZED, exchange.getResponse().getStatusCode());
        assertEquals("ApiKey", exchange.getResponse().getHeaders().getFirst("WWW-Authenticate"));

        String body = exchange.getResponse().getBodyAsString().block();
        assertNotNull(body);
        assertTrue(body.contains("AUTHENTICATION_FAILED"));
        assertFalse(body.contains("s3cr3t"));
    }

    @Test
    void shouldNotGuardRoutesOutsideProxy() {
        ApiKeyFilter filter = new ApiKeyFilter("s3cr3t", writer);

        assertTrue(passes(filter, MockServerWebExchange.from(MockServerHttpRequest.get("/api/v1/health"))));
        assertTrue(passes(filter, MockServerWebExchange.from(MockServerHttpRequest.get("/"))));
    }

    @Test
    void shouldGuardActuatorExceptHealthAndInfo() {
        ApiKeyFilter filter = new ApiKeyFilter("s3cr3t", writer);

        MockServerWebExchange metrics = MockServerWebExchange.from(MockServerHttpRequest.get("/actuator/metrics/gateway.bulk.targets.failed"));
        assertFalse(passes(filter, metrics));
        assertEquals(HttpStatus.UNAUTHORIZED, metrics.getResponse().getStatusCode());

        assertTrue(passes(filter, MockServerWebExchange.from(MockServerHttpRequest.get("/actuator/metrics")
                .header("X-API-Key", "s3cr3t"))));
        assertTrue(passes(filter, MockServerWebExchange.from(MockServerHttpRequest.get("/actuator/health"))));
        assertTrue(passes(filter, MockServerWebExchange.from(MockServerHttpRequest.get("/actuator/health/liveness"))));
        assertTrue(passes(filter, MockServerWebExchange.from(MockServerHttpRequest.get("/actuator/info"))));
    }
}
