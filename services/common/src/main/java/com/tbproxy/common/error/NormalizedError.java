package com.tbproxy.common.error;

import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonProperty;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Standard error response format.
 *
 * Example JSON:
 * {
 *   "status": 429,
 *   "error_code": "RATE_LIMIT_EXCEEDED",
 *   "message": "Too many requests. Please slow down and try again later.",
 *   "details": {"limit": 100, "window_seconds": 60, "retry_after": 42},
 *   "timestamp": 1640995200000
 * }
 */
@JsonInclude(JsonInclude.Include.NON_NULL)
public record NormalizedError(
    @JsonProperty("status")
    int status,

    @JsonProperty("error_code")
    ErrorCode errorCode,

    @JsonProperty("message")
    String message,

    @JsonProperty("details")
    Map<String, Object> details,

    @JsonProperty("timestamp")
    long timestamp,

    @JsonProperty("path")
    String path
) {
    public NormalizedError {
        details = details == null || details.isEmpty()
                ? null
                : Collections.unmodifiableMap(new LinkedHashMap<>(details));
    }

    public NormalizedError withPath(String path) {
        return new NormalizedError(status, errorCode, message, details, timestamp, path);
    }
}
