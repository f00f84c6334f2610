package com.tbproxy.gateway.controller;

import com.fasterxml.jackson.databind.JsonNode;
import com.tbproxy.common.dto.attribute.AttributeScope;
import com.tbproxy.common.dto.bulk.BulkReport;
import com.tbproxy.common.dto.bulk.UploadTarget;
import com.tbproxy.common.dto.telemetry.TelemetryPayload;
import com.tbproxy.common.error.NormalizedError;
import com.tbproxy.gateway.dto.AttributesUploadResponse;
import com.tbproxy.gateway.dto.TelemetryUploadResponse;
import com.tbproxy.gateway.exception.RequestValidationException;
import com.tbproxy.gateway.service.AttributeService;
import com.tbproxy.gateway.service.BulkUploadOrchestrator;
import com.tbproxy.gateway.service.TelemetryService;
import io.swagger.v3.oas.annotations.Operation;
import io.swagger.v3.oas.annotations.Parameter;
import io.swagger.v3.oas.annotations.media.Content;
import io.swagger.v3.oas.annotations.media.Schema;
import io.swagger.v3.oas.annotations.responses.ApiResponse;
import io.swagger.v3.oas.annotations.tags.Tag;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.http.HttpStatus;
import org.springframework.http.MediaType;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.*;
import reactor.core.publisher.Mono;

import java.util.ArrayList;
import java.util.Iterator;
import java.util.List;
import java.util.Map;
import java.util.regex.Pattern;

/**
 * ThingsBoard device data upload endpoints.
 *
 * Endpoints:
 * - POST /api/v1/tb/devices/{deviceId}/telemetry - Telemetry for one device
 * - POST /api/v1/tb/devices/{deviceId}/attributes/server - Server-side attributes
 * - POST /api/v1/tb/devices/{deviceId}/attributes/shared - Shared attributes
 * - POST /api/v1/tb/telemetry/bulk - Telemetry for many devices
 */
@RestController
@RequestMapping("/api/v1/tb")
@Tag(name = "telemetry", description = "Time-series and attribute upload operations")
public class TelemetryController {

    private static final Logger log = LoggerFactory.getLogger(TelemetryController.class);

    private static final Pattern DEVICE_ID = Pattern.compile(
            "^[0-9a-f]{8}-[0-9a-f]{4}-[0-9a-f]{4}-[0-9a-f]{4}-[0-9a-f]{12}$");

    private final TelemetryService telemetryService;
    private final AttributeService attributeService;
    private final BulkUploadOrchestrator bulkUploadOrchestrator;

    public TelemetryController(
            TelemetryService telemetryService,
            AttributeService attributeService,
            BulkUploadOrchestrator bulkUploadOrchestrator) {
        this.telemetryService = telemetryService;
        this.attributeService = attributeService;
        this.bulkUploadOrchestrator = bulkUploadOrchestrator;
    }

    /**
     * Upload telemetry to a single device.
     */
    @Operation(summary = "Upload device telemetry",
            description = "Accepts telemetry keys mapped to arrays of timestamped values and stores them on the device.")
    @ApiResponse(responseCode = "201", description = "Telemetry stored")
    @ApiResponse(responseCode = "400", description = "Empty or unreadable payload, or malformed device id",
            content = @Content(schema = @Schema(implementation = NormalizedError.class)))
    @ApiResponse(responseCode = "422", description = "Samples break a constraint",
            content = @Content(schema = @Schema(implementation = NormalizedError.class)))
    @ApiResponse(responseCode = "502", description = "ThingsBoard rejected or did not answer",
            content = @Content(schema = @Schema(implementation = NormalizedError.class)))
    @PostMapping(
            path = "/devices/{deviceId}/telemetry",
            consumes = MediaType.APPLICATION_JSON_VALUE,
            produces = MediaType.APPLICATION_JSON_VALUE
    )
    public Mono<ResponseEntity<TelemetryUploadResponse>> uploadDeviceTelemetry(
            @Parameter(description = "UUID of the target device", example = "550e8400-e29b-41d4-a716-446655440000")
            @PathVariable String deviceId,
            @RequestBody TelemetryPayload payload) {

        if (!DEVICE_ID.matcher(deviceId).matches()) {
            return Mono.error(invalidDeviceId());
        }

        log.debug("Received telemetry upload: device={}", deviceId);

        return telemetryService.upload(deviceId, payload)
                .map(response -> ResponseEntity.status(HttpStatus.CREATED).body(response));
    }

    /**
     * Upload server-side attributes to a single device.
     */
    @Operation(summary = "Upload server-side attributes",
            description = "Stores configuration or metadata values visible to server applications only.")
    @ApiResponse(responseCode = "200", description = "Attributes stored")
    @ApiResponse(responseCode = "400", description = "No attributes or malformed device id",
            content = @Content(schema = @Schema(implementation = NormalizedError.class)))
    @ApiResponse(responseCode = "502", description = "ThingsBoard rejected or did not answer",
            content = @Content(schema = @Schema(implementation = NormalizedError.class)))
    @PostMapping(
            path = "/devices/{deviceId}/attributes/server",
            consumes = MediaType.APPLICATION_JSON_VALUE,
            produces = MediaType.APPLICATION_JSON_VALUE
    )
    public Mono<ResponseEntity<AttributesUploadResponse>> uploadServerAttributes(
            @PathVariable String deviceId,
            @RequestBody Map<String, JsonNode> attributes) {
        return uploadAttributes(deviceId, AttributeScope.SERVER_SCOPE, attributes);
    }

    /**
     * Upload shared attributes to a single device.
     */
    @Operation(summary = "Upload shared attributes",
            description = "Stores configuration values that the device itself can read, such as setpoints and thresholds.")
    @ApiResponse(responseCode = "200", description = "Attributes stored")
    @ApiResponse(responseCode = "400", description = "No attributes or malformed device id",
            content = @Content(schema = @Schema(implementation = NormalizedError.class)))
    @ApiResponse(responseCode = "502", description = "ThingsBoard rejected or did not answer",
            content = @Content(schema = @Schema(implementation = NormalizedError.class)))
    @PostMapping(
            path = "/devices/{deviceId}/attributes/shared",
            consumes = MediaType.APPLICATION_JSON_VALUE,
            produces = MediaType.APPLICATION_JSON_VALUE
    )
    public Mono<ResponseEntity<AttributesUploadResponse>> uploadSharedAttributes(
            @PathVariable String deviceId,
            @RequestBody Map<String, JsonNode> attributes) {
        return uploadAttributes(deviceId, AttributeScope.SHARED_SCOPE, attributes);
    }

    private Mono<ResponseEntity<AttributesUploadResponse>> uploadAttributes(
            String deviceId, AttributeScope scope, Map<String, JsonNode> attributes) {
        if (!DEVICE_ID.matcher(deviceId).matches()) {
            return Mono.error(invalidDeviceId());
        }

        log.debug("Received attribute upload: device={}, scope={}", deviceId, scope);

        return attributeService.upload(deviceId, scope, attributes)
                .map(ResponseEntity::ok);
    }

    private static RequestValidationException invalidDeviceId() {
        return new RequestValidationException("Invalid device id", List.of("deviceId: must be a lowercase UUID"));
    }

    /**
     * Upload telemetry to many devices in one call.
     */
    @Operation(summary = "Bulk upload telemetry",
            description = "Uploads telemetry for several devices concurrently. Always answers 200 with a per-device "
                    + "result once the batch itself is well formed; device failures are reported inside the results.")
    @ApiResponse(responseCode = "200", description = "Batch processed")
    @ApiResponse(responseCode = "400", description = "Malformed body, empty batch or repeated device ids",
            content = @Content(schema = @Schema(implementation = NormalizedError.class)))
    @PostMapping(
            path = "/telemetry/bulk",
            consumes = MediaType.APPLICATION_JSON_VALUE,
            produces = MediaType.APPLICATION_JSON_VALUE
    )
    public Mono<ResponseEntity<BulkReport>> uploadBulkTelemetry(@RequestBody JsonNode body) {
        if (body == null || !body.isObject()) {
            return Mono.error(new RequestValidationException("Request body must be an object keyed by device id"));
        }

        List<UploadTarget> targets = new ArrayList<>(body.size());
        Iterator<Map.Entry<String, JsonNode>> fields = body.fields();
        while (fields.hasNext()) {
            Map.Entry<String, JsonNode> field = fields.next();
            targets.add(new UploadTarget(field.getKey(), field.getValue()));
        }

        log.debug("Received bulk telemetry upload: devices={}", targets.size());

        return bulkUploadOrchestrator.run(targets)
                .map(ResponseEntity::ok);
    }
}
