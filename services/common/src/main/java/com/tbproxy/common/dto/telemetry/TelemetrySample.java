package com.tbproxy.common.dto.telemetry;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonProperty;
import com.fasterxml.jackson.databind.JsonNode;
import com.tbproxy.common.util.JsonUtil;
import jakarta.validation.constraints.NotNull;
import jakarta.validation.constraints.Positive;

/**
 * A single timestamped telemetry value, in the platform's wire format.
 *
 * Example JSON:
 * {"ts": 1609459200000, "value": 25.6}
 *
 * @param ts    Unix milliseconds, always positive
 * @param value number, string, boolean or structured JSON value; JSON null reads as absent
 */
public record TelemetrySample(
    @NotNull(message = "is required")
    @Positive(message = "must be a positive integer")
    @JsonProperty("ts")
    Long ts,

    @NotNull(message = "is required")
    @JsonProperty("value")
    JsonNode value
) {

    @JsonCreator
    public TelemetrySample(
        @JsonProperty("ts") Long ts,
        @JsonProperty("value") JsonNode value
    ) {
        this.ts = ts;
        this.value = value == null || value.isNull() || value.isMissingNode() ? null : value;
    }

    /**
     * Factory method for convenience.
     */
    public static TelemetrySample of(long ts, Object value) {
        return new TelemetrySample(ts, JsonUtil.toTree(value));
    }
}
