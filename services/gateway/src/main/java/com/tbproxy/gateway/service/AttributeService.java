package com.tbproxy.gateway.service;

import com.fasterxml.jackson.databind.JsonNode;
import com.tbproxy.common.dto.attribute.AttributeScope;
import com.tbproxy.gateway.client.UpstreamTelemetryClient;
import com.tbproxy.gateway.dto.AttributesUploadResponse;
import com.tbproxy.gateway.exception.RequestValidationException;
import com.tbproxy.gateway.exception.ResourceNotFoundException;
import com.tbproxy.gateway.exception.UpstreamException;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;
import reactor.core.publisher.Mono;

import java.time.Clock;
import java.util.List;
import java.util.Map;

/**
 * Server-side and shared attribute upload for one device.
 */
@Service
@RequiredArgsConstructor
@Slf4j
public class AttributeService {

    private final UpstreamTelemetryClient upstreamClient;
    private final Clock clock;

    public Mono<AttributesUploadResponse> upload(String deviceId, AttributeScope scope, Map<String, JsonNode> attributes) {
        return Mono.defer(() -> {
            if (attributes == null || attributes.isEmpty()) {
                throw new RequestValidationException("No attributes provided");
            }
            if (attributes.keySet().stream().anyMatch(String::isBlank)) {
                throw new RequestValidationException("Invalid attributes", List.of("attribute keys must be non-blank"));
            }

            return upstreamClient.uploadAttributes(deviceId, scope, attributes)
                    .switchIfEmpty(Mono.error(() -> new UpstreamException(null, "No acknowledgement for device " + deviceId)))
                    .map(ack -> {
                        log.info("Uploaded {} {} attributes for device {}", ack.acceptedCount(), scope, deviceId);
                        return AttributesUploadResponse.success(clock.millis(), deviceId, scope, ack.acceptedKeys());
                    })
                    .onErrorMap(UpstreamException::isNotFound,
                            error -> new ResourceNotFoundException("Device " + deviceId));
        });
    }
}
