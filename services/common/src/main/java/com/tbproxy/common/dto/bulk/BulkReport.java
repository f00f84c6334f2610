package com.tbproxy.common.dto.bulk;

import com.fasterxml.jackson.annotation.JsonProperty;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Response for a bulk telemetry upload.
 *
 * Example JSON:
 * {
 *   "status": "completed",
 *   "summary": {"total_devices": 2, "successful_devices": 1, "failed_devices": 1, "total_data_points": 3},
 *   "results": {
 *     "device-a": {"status": "success", "keys_uploaded": ["temperature"], "data_points": 3},
 *     "device-b": {"status": "failed", "error": {...}, "data_points": 0}
 *   },
 *   "message": "Bulk upload completed: 1/2 devices successful"
 * }
 */
public record BulkReport(
    @JsonProperty("status")
    String status,

    @JsonProperty("summary")
    BulkSummary summary,

    @JsonProperty("results")
    Map<String, TargetOutcome> results,

    @JsonProperty("message")
    String message
) {
    public static final String COMPLETED = "completed";

    public BulkReport {
        results = Collections.unmodifiableMap(new LinkedHashMap<>(results));
    }

    /**
     * Builds the report from per-target outcomes. Iteration order of
     * {@code results} is kept in the rendered output.
     */
    public static BulkReport from(Map<String, TargetOutcome> results) {
        BulkSummary summary = BulkSummary.of(results.values());
        return new BulkReport(
            COMPLETED,
            summary,
            results,
            String.format("Bulk upload completed: %d/%d devices successful",
                    summary.successfulDevices(), summary.totalDevices())
        );
    }
}
