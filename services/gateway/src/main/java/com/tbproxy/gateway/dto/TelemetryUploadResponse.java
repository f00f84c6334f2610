package com.tbproxy.gateway.dto;

import com.fasterxml.jackson.annotation.JsonProperty;

import java.util.List;

/**
 * Response for a single-device telemetry upload.
 *
 * Example JSON:
 * {
 *   "status": "success",
 *   "timestamp": 1640995200000,
 *   "device_id": "550e8400-e29b-41d4-a716-446655440000",
 *   "keys_uploaded": ["temperature", "humidity"],
 *   "total_data_points": 3,
 *   "message": "Successfully uploaded 3 data points for 2 telemetry keys"
 * }
 */
public record TelemetryUploadResponse(
    @JsonProperty("status")
    String status,

    @JsonProperty("timestamp")
    long timestamp,

    @JsonProperty("device_id")
    String deviceId,

    @JsonProperty("keys_uploaded")
    List<String> keysUploaded,

    @JsonProperty("total_data_points")
    int totalDataPoints,

    @JsonProperty("message")
    String message
) {
    public static TelemetryUploadResponse success(long timestamp, String deviceId, List<String> keys, int dataPoints) {
        return new TelemetryUploadResponse(
            "success",
            timestamp,
            deviceId,
            List.copyOf(keys),
            dataPoints,
            String.format("Successfully uploaded %d data points for %d telemetry keys", dataPoints, keys.size())
        );
    }
}
