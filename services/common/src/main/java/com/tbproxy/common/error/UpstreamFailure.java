package com.tbproxy.common.error;

import java.util.Map;

/**
 * Call to the telemetry platform failed: timeout, connection error,
 * non-2xx answer or failed platform login.
 *
 * @param upstreamStatus HTTP status returned by the platform, {@code null} if none was received
 * @param internalMessage description of the failure, may contain upstream response text
 */
public record UpstreamFailure(
    Integer upstreamStatus,
    String internalMessage
) implements FailureCause {

    @Override
    public ErrorCode code() {
        return ErrorCode.UPSTREAM_ERROR;
    }

    @Override
    public Map<String, Object> publicDetails() {
        return upstreamStatus == null ? Map.of() : Map.of("upstream_status", upstreamStatus);
    }
}
