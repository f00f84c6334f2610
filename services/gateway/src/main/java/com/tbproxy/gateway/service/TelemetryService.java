package com.tbproxy.gateway.service;

import com.tbproxy.common.dto.telemetry.TelemetryPayload;
import com.tbproxy.common.dto.telemetry.TelemetryPayloadReader;
import com.tbproxy.gateway.client.UpstreamTelemetryClient;
import com.tbproxy.gateway.dto.TelemetryUploadResponse;
import com.tbproxy.gateway.exception.RequestValidationException;
import com.tbproxy.gateway.exception.ResourceNotFoundException;
import com.tbproxy.gateway.exception.UpstreamException;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;
import reactor.core.publisher.Mono;

import java.time.Clock;

/**
 * Single-device telemetry upload.
 */
@Service
@RequiredArgsConstructor
@Slf4j
public class TelemetryService {

    private final UpstreamTelemetryClient upstreamClient;
    private final TelemetryPayloadReader payloadReader;
    private final Clock clock;

    public Mono<TelemetryUploadResponse> upload(String deviceId, TelemetryPayload body) {
        return Mono.defer(() -> {
            if (body == null || body.isEmpty()) {
                throw new RequestValidationException("No telemetry data provided");
            }
            TelemetryPayload payload = payloadReader.validate(body);

            return upstreamClient.upload(deviceId, payload)
                    .switchIfEmpty(Mono.error(() -> new UpstreamException(null, "No acknowledgement for device " + deviceId)))
                    .map(ack -> {
                        log.info("Uploaded {} telemetry points for device {} (keys={})",
                                payload.dataPoints(), deviceId, payload.keys());
                        return TelemetryUploadResponse.success(
                                clock.millis(), deviceId, payload.keys(), payload.dataPoints());
                    })
                    .onErrorMap(UpstreamException::isNotFound,
                            error -> new ResourceNotFoundException("Device " + deviceId));
        });
    }
}
