package com.tbproxy.common.dto.bulk;

import com.fasterxml.jackson.annotation.JsonProperty;

import java.util.Collection;

/**
 * Aggregate counts of a bulk upload. Always derived from the outcomes,
 * never tracked separately.
 */
public record BulkSummary(
    @JsonProperty("total_devices")
    int totalDevices,

    @JsonProperty("successful_devices")
    int successfulDevices,

    @JsonProperty("failed_devices")
    int failedDevices,

    @JsonProperty("total_data_points")
    long totalDataPoints
) {

    public static BulkSummary of(Collection<TargetOutcome> outcomes) {
        int successful = 0;
        long dataPoints = 0;
        for (TargetOutcome outcome : outcomes) {
            if (outcome.isSuccess()) {
                successful++;
                dataPoints += outcome.dataPoints();
            }
        }
        return new BulkSummary(outcomes.size(), successful, outcomes.size() - successful, dataPoints);
    }
}
