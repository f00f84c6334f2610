package com.tbproxy.gateway.client;

import com.fasterxml.jackson.databind.JsonNode;
import com.tbproxy.common.dto.attribute.AttributeScope;
import com.tbproxy.common.dto.telemetry.TelemetryPayload;
import com.tbproxy.common.dto.telemetry.TelemetrySample;
import com.tbproxy.common.util.JsonUtil;
import com.tbproxy.gateway.exception.UpstreamException;
import io.micrometer.core.instrument.simple.SimpleMeterRegistry;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.springframework.http.HttpMethod;
import org.springframework.http.HttpStatus;
import org.springframework.web.reactive.function.client.ClientRequest;
import org.springframework.web.reactive.function.client.WebClientRequestException;
import reactor.core.publisher.Mono;
import reactor.test.StepVerifier;

import java.net.ConnectException;
import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.time.ZoneOffset;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.*;

class ThingsBoardTelemetryClientTest {

    private static final Instant NOW = Instant.parse("2024-01-15T10:30:00Z");
    private static final String DEVICE = "550e8400-e29b-41d4-a716-446655440000";
    private static final String TIMESERIES = "/api/plugins/telemetry/DEVICE/" + DEVICE + "/timeseries/any";
    private static final String SERVER_ATTRIBUTES = "/api/plugins/telemetry/DEVICE/" + DEVICE + "/attributes/SERVER_SCOPE";
    private static final String SHARED_ATTRIBUTES = "/api/plugins/telemetry/DEVICE/" + DEVICE + "/attributes/SHARED_SCOPE";

    private final StubThingsBoard thingsBoard = new StubThingsBoard();
    private final SimpleMeterRegistry meterRegistry = new SimpleMeterRegistry();
    private final String token = StubThingsBoard.jwt(NOW.plus(Duration.ofHours(2)));

    private ThingsBoardTelemetryClient client;
    private TelemetryPayload payload;

    @BeforeEach
    void setUp() {
        thingsBoard.on("/api/auth/login", request -> StubThingsBoard.tokens(token, "refresh-1"));
        ThingsBoardSession session = new ThingsBoardSession(thingsBoard.webClient(), "tenant", "secret",
                Duration.ofSeconds(2), Clock.fixed(NOW, ZoneOffset.UTC));
        client = new ThingsBoardTelemetryClient(thingsBoard.webClient(), session, Duration.ofMillis(300), meterRegistry);

        Map<String, List<TelemetrySample>> series = new LinkedHashMap<>();
        series.put("temperature", List.of(TelemetrySample.of(1609459200000L, 25.6), TelemetrySample.of(1609459260000L, 26.1)));
        series.put("humidity", List.of(TelemetrySample.of(1609459200000L, 60.2)));
        payload = TelemetryPayload.of(series);
    }

    @Test
    void shouldPostTimeseriesWithBearerToken() {
        thingsBoard.on(TIMESERIES, request -> StubThingsBoard.status(HttpStatus.OK));

        StepVerifier.create(client.upload(DEVICE, payload))
                .assertNext(ack -> {
                    assertEquals(List.of("temperature", "humidity"), ack.acceptedKeys());
                    assertEquals(3, ack.acceptedCount());
                })
                .verifyComplete();

        ClientRequest upload = thingsBoard.requests.stream()
                .filter(request -> request.url().getPath().equals(TIMESERIES))
                .findFirst()
                .orElseThrow();
        assertEquals(HttpMethod.POST, upload.method());
        assertEquals("Bearer " + token, upload.headers().getFirst("X-Authorization"));
        assertEquals(1, meterRegistry.timer("gateway.upstream.upload.latency").count());
    }

    @Test
    void shouldCarryUpstreamStatusOnRejection() {
        thingsBoard.on(TIMESERIES, request -> StubThingsBoard.json(HttpStatus.INTERNAL_SERVER_ERROR,
                "{\"message\": \"internal db failure\"}"));

        StepVerifier.create(client.upload(DEVICE, payload))
                .expectErrorSatisfies(error -> {
                    UpstreamException upstream = assertInstanceOf(UpstreamException.class, error);
                    assertEquals(Integer.valueOf(500), upstream.getStatusCode());
                })
                .verify();
    }

    @Test
    void shouldLoginAgainAfterTokenIsRejected() {
        thingsBoard.on(TIMESERIES, request -> StubThingsBoard.status(HttpStatus.UNAUTHORIZED));
        StepVerifier.create(client.upload(DEVICE, payload)).expectError(UpstreamException.class).verify();

        thingsBoard.on(TIMESERIES, request -> StubThingsBoard.status(HttpStatus.OK));
        StepVerifier.create(client.upload(DEVICE, payload)).expectNextCount(1).verifyComplete();

        assertEquals(2, thingsBoard.count("/api/auth/login"));
    }

    @Test
    void shouldTimeOutWithoutStatus() {
        thingsBoard.on(TIMESERIES, request -> Mono.never());

        StepVerifier.create(client.upload(DEVICE, payload))
                .expectErrorSatisfies(error -> {
                    UpstreamException upstream = assertInstanceOf(UpstreamException.class, error);
                    assertNull(upstream.getStatusCode());
                })
                .verify(Duration.ofSeconds(5));
    }

    @Test
    void shouldReportUnreachablePlatform() {
        thingsBoard.on(TIMESERIES, request -> Mono.error(new WebClientRequestException(
                new ConnectException("Connection refused"), request.method(), request.url(), request.headers())));

        StepVerifier.create(client.upload(DEVICE, payload))
                .expectErrorSatisfies(error -> {
                    UpstreamException upstream = assertInstanceOf(UpstreamException.class, error);
                    assertNull(upstream.getStatusCode());
                    assertTrue(upstream.getMessage().contains("unreachable"));
                })
                .verify();
    }

    @Test
    void shouldFailUploadWhenLoginFails() {
        thingsBoard.on("/api/auth/login", request -> StubThingsBoard.status(HttpStatus.UNAUTHORIZED));

        StepVerifier.create(client.upload(DEVICE, payload))
                .expectErrorSatisfies(error -> assertEquals(Integer.valueOf(401), ((UpstreamException) error).getStatusCode()))
                .verify();
        assertEquals(0, thingsBoard.count(TIMESERIES));
    }

    @Test
    void shouldPostAttributesToScopePath() {
        thingsBoard.on(SERVER_ATTRIBUTES, request -> StubThingsBoard.status(HttpStatus.OK));
        Map<String, JsonNode> attributes = new LinkedHashMap<>();
        attributes.put("serialNumber", JsonUtil.toTree("SN001234"));
        attributes.put("calibrationOffset", JsonUtil.toTree(0.5));

        StepVerifier.create(client.uploadAttributes(DEVICE, AttributeScope.SERVER_SCOPE, attributes))
                .assertNext(ack -> {
                    assertEquals(List.of("serialNumber", "calibrationOffset"), ack.acceptedKeys());
                    assertEquals(2, ack.acceptedCount());
                })
                .verifyComplete();

        ClientRequest upload = thingsBoard.requests.stream()
                .filter(request -> request.url().getPath().equals(SERVER_ATTRIBUTES))
                .findFirst()
                .orElseThrow();
        assertEquals(HttpMethod.POST, upload.method());
        assertEquals("Bearer " + token, upload.headers().getFirst("X-Authorization"));
        assertEquals(0, thingsBoard.count(SHARED_ATTRIBUTES));
    }

    @Test
    void shouldCarryUpstreamStatusOnAttributeRejection() {
        thingsBoard.on(SHARED_ATTRIBUTES, request -> StubThingsBoard.status(HttpStatus.BAD_REQUEST));

        StepVerifier.create(client.uploadAttributes(DEVICE, AttributeScope.SHARED_SCOPE,
                        Map.of("targetTemperature", JsonUtil.toTree(22.0))))
                .expectErrorSatisfies(error -> {
                    UpstreamException upstream = assertInstanceOf(UpstreamException.class, error);
                    assertEquals(Integer.valueOf(400), upstream.getStatusCode());
                    assertTrue(upstream.getMessage().contains("SHARED_SCOPE attributes"));
                })
                .verify();
    }
}
