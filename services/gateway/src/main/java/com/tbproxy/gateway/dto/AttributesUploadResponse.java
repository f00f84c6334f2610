package com.tbproxy.gateway.dto;

import com.fasterxml.jackson.annotation.JsonProperty;
import com.tbproxy.common.dto.attribute.AttributeScope;

import java.util.List;

/**
 * Response for a device attribute upload.
 *
 * Example JSON:
 * {
 *   "status": "success",
 *   "timestamp": 1640995200000,
 *   "device_id": "550e8400-e29b-41d4-a716-446655440000",
 *   "scope": "SERVER_SCOPE",
 *   "attributes_uploaded": ["serialNumber", "firmwareVersion"],
 *   "count": 2,
 *   "message": "Successfully uploaded 2 server-side attributes"
 * }
 */
public record AttributesUploadResponse(
    @JsonProperty("status")
    String status,

    @JsonProperty("timestamp")
    long timestamp,

    @JsonProperty("device_id")
    String deviceId,

    @JsonProperty("scope")
    AttributeScope scope,

    @JsonProperty("attributes_uploaded")
    List<String> attributesUploaded,

    @JsonProperty("count")
    int count,

    @JsonProperty("message")
    String message
) {
    public static AttributesUploadResponse success(long timestamp, String deviceId, AttributeScope scope, List<String> keys) {
        return new AttributesUploadResponse(
            "success",
            timestamp,
            deviceId,
            scope,
            List.copyOf(keys),
            keys.size(),
            String.format("Successfully uploaded %d %s attributes", keys.size(), scope.getLabel())
        );
    }
}
