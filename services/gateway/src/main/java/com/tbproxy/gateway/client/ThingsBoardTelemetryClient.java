package com.tbproxy.gateway.client;

import com.fasterxml.jackson.databind.JsonNode;
import com.tbproxy.common.dto.attribute.AttributeScope;
import com.tbproxy.common.dto.telemetry.TelemetryPayload;
import com.tbproxy.gateway.exception.UpstreamException;
import io.micrometer.core.instrument.MeterRegistry;
import io.micrometer.core.instrument.Timer;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.HttpStatus;
import org.springframework.http.MediaType;
import org.springframework.web.reactive.function.client.WebClient;
import org.springframework.web.reactive.function.client.WebClientRequestException;
import org.springframework.web.reactive.function.client.WebClientResponseException;
import reactor.core.publisher.Mono;

import java.time.Duration;
import java.util.List;
import java.util.Map;
import java.util.concurrent.TimeoutException;

/**
 * Uploads device timeseries and attributes through the ThingsBoard REST API.
 */
@Slf4j
public class ThingsBoardTelemetryClient implements UpstreamTelemetryClient {

    static final String TIMESERIES_PATH = "/api/plugins/telemetry/DEVICE/{deviceId}/timeseries/any";
    static final String ATTRIBUTES_PATH = "/api/plugins/telemetry/DEVICE/{deviceId}/attributes/{scope}";

    private final WebClient webClient;
    private final ThingsBoardSession session;
    private final Duration timeout;
    private final Timer uploadLatency;

    public ThingsBoardTelemetryClient(
            WebClient webClient,
            ThingsBoardSession session,
            Duration timeout,
            MeterRegistry meterRegistry) {
        this.webClient = webClient;
        this.session = session;
        this.timeout = timeout;

        this.uploadLatency = Timer.builder("gateway.upstream.upload.latency")
                .description("Time taken to upload one device's telemetry or attributes to ThingsBoard")
                .register(meterRegistry);
    }

    @Override
    public Mono<UploadAck> upload(String targetId, TelemetryPayload payload) {
        return post(targetId, "telemetry", payload, new UploadAck(payload.keys(), payload.dataPoints()),
                TIMESERIES_PATH, targetId);
    }

    @Override
    public Mono<UploadAck> uploadAttributes(String targetId, AttributeScope scope, Map<String, JsonNode> attributes) {
        return post(targetId, scope + " attributes", attributes, new UploadAck(List.copyOf(attributes.keySet()), attributes.size()),
                ATTRIBUTES_PATH, targetId, scope.name());
    }

    private Mono<UploadAck> post(String targetId, String what, Object body, UploadAck ack, String path, Object... uriVariables) {
        return Mono.defer(() -> {
            Timer.Sample sample = Timer.start();
            return session.accessToken()
                    .flatMap(token -> webClient.post()
                            .uri(path, uriVariables)
                            .header("X-Authorization", "Bearer " + token)
                            .contentType(MediaType.APPLICATION_JSON)
                            .bodyValue(body)
                            .retrieve()
                            .toBodilessEntity())
                    .timeout(timeout)
                    .map(response -> ack)
                    .doOnNext(accepted -> log.debug("Uploaded {} {} values for device {}", accepted.acceptedCount(), what, targetId))
                    .onErrorMap(error -> !(error instanceof UpstreamException), error -> translate(targetId, what, error))
                    .doFinally(signal -> sample.stop(uploadLatency));
        });
    }

    private UpstreamException translate(String targetId, String what, Throwable error) {
        if (error instanceof WebClientResponseException response) {
            int status = response.getStatusCode().value();
            if (status == HttpStatus.UNAUTHORIZED.value()) {
                session.invalidate();
            }
            return new UpstreamException(status,
                    "ThingsBoard rejected " + what + " for device " + targetId + " with status " + status, error);
        }
        if (error instanceof TimeoutException) {
            return new UpstreamException(null,
                    "ThingsBoard did not answer within " + timeout.toMillis() + " ms", error);
        }
        if (error instanceof WebClientRequestException) {
            return new UpstreamException(null, "ThingsBoard is unreachable: " + error.getMessage(), error);
        }
        return new UpstreamException(null, "ThingsBoard " + what + " upload failed: " + error.getMessage(), error);
    }
}
