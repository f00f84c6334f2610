package com.tbproxy.common.dto.bulk;

import com.fasterxml.jackson.databind.JsonNode;
import com.tbproxy.common.dto.telemetry.TelemetryPayload;
import com.tbproxy.common.util.JsonUtil;

/**
 * One member of a bulk upload request. The payload is kept raw so that a
 * malformed target can be reported on its own instead of failing the batch.
 *
 * @param targetId opaque target (device) identifier
 * @param payload  raw telemetry object for this target
 */
public record UploadTarget(
    String targetId,
    JsonNode payload
) {

    public static UploadTarget of(String targetId, TelemetryPayload payload) {
        return new UploadTarget(targetId, JsonUtil.toTree(payload));
    }
}
