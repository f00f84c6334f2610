package com.tbproxy.common.error;

import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Caller exceeded its request quota.
 *
 * @param limit             maximum requests per window
 * @param windowSeconds     window length in seconds
 * @param retryAfterSeconds seconds until a slot frees up
 */
public record RateLimitFailure(
    int limit,
    long windowSeconds,
    long retryAfterSeconds
) implements FailureCause {

    @Override
    public ErrorCode code() {
        return ErrorCode.RATE_LIMIT_EXCEEDED;
    }

    @Override
    public String internalMessage() {
        return String.format("Maximum %d requests per %d seconds allowed", limit, windowSeconds);
    }

    @Override
    public Map<String, Object> publicDetails() {
        Map<String, Object> details = new LinkedHashMap<>();
        details.put("limit", limit);
        details.put("window_seconds", windowSeconds);
        details.put("retry_after", retryAfterSeconds);
        return details;
    }
}
