package com.tbproxy.common.dto.bulk;

import com.fasterxml.jackson.annotation.JsonIgnore;
import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonProperty;
import com.fasterxml.jackson.annotation.JsonValue;
import com.tbproxy.common.error.NormalizedError;

import java.util.List;

/**
 * Result of processing one {@link UploadTarget}.
 *
 * Example JSON:
 * {"status": "success", "keys_uploaded": ["temperature"], "data_points": 2}
 * {"status": "failed", "error": {"status": 502, "error_code": "UPSTREAM_ERROR", ...}, "data_points": 0}
 */
@JsonInclude(JsonInclude.Include.NON_NULL)
public record TargetOutcome(
    @JsonProperty("status")
    Status status,

    @JsonProperty("keys_uploaded")
    List<String> keysUploaded,

    @JsonProperty("error")
    NormalizedError error,

    @JsonProperty("data_points")
    int dataPoints
) {

    public static TargetOutcome success(List<String> keysUploaded, int dataPoints) {
        return new TargetOutcome(Status.SUCCESS, List.copyOf(keysUploaded), null, dataPoints);
    }

    public static TargetOutcome failed(NormalizedError error) {
        return new TargetOutcome(Status.FAILED, null, error, 0);
    }

    @JsonIgnore
    public boolean isSuccess() {
        return status == Status.SUCCESS;
    }

    public enum Status {
        SUCCESS("success"),
        FAILED("failed");

        private final String value;

        Status(String value) {
            this.value = value;
        }

        @JsonValue
        public String getValue() {
            return value;
        }
    }
}
