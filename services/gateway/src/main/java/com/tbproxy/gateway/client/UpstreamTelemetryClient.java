package com.tbproxy.gateway.client;

import com.fasterxml.jackson.databind.JsonNode;
import com.tbproxy.common.dto.attribute.AttributeScope;
import com.tbproxy.common.dto.telemetry.TelemetryPayload;
import reactor.core.publisher.Mono;

import java.util.Map;

/**
 * Writes device data to the telemetry platform.
 * Failures are signalled as {@link com.tbproxy.gateway.exception.UpstreamException}.
 */
public interface UpstreamTelemetryClient {

    /**
     * Stores validated timeseries for one device.
     */
    Mono<UploadAck> upload(String targetId, TelemetryPayload payload);

    /**
     * Stores attribute values for one device in the given scope.
     */
    Mono<UploadAck> uploadAttributes(String targetId, AttributeScope scope, Map<String, JsonNode> attributes);
}
