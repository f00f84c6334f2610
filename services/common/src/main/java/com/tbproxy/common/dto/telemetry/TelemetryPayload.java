package com.tbproxy.common.dto.telemetry;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonValue;
import jakarta.validation.Valid;
import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.NotEmpty;
import jakarta.validation.constraints.NotNull;

import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Telemetry for one device: metric key mapped to an ordered, non-empty
 * list of samples. Serializes to the platform's timeseries body.
 *
 * Example JSON:
 * {
 *   "temperature": [{"ts": 1609459200000, "value": 25.6}, {"ts": 1609459260000, "value": 26.1}],
 *   "humidity": [{"ts": 1609459200000, "value": 60.2}]
 * }
 *
 * Instances are not validated on construction; run them through
 * {@link TelemetryPayloadReader} before use.
 */
public final class TelemetryPayload {

    @NotEmpty(message = "payload must contain at least one telemetry key")
    private final Map<
            @NotBlank(message = "telemetry keys must be non-blank") String,
            @NotEmpty(message = "must be a non-empty array") List<@NotNull(message = "sample is required") @Valid TelemetrySample>
            > series;

    @JsonCreator(mode = JsonCreator.Mode.DELEGATING)
    public TelemetryPayload(Map<String, List<TelemetrySample>> series) {
        this.series = copy(series);
    }

    public static TelemetryPayload of(Map<String, List<TelemetrySample>> series) {
        return new TelemetryPayload(series);
    }

    private static Map<String, List<TelemetrySample>> copy(Map<String, List<TelemetrySample>> series) {
        Map<String, List<TelemetrySample>> copy = new LinkedHashMap<>();
        if (series != null) {
            // null lists and samples are kept so validation can report them
            series.forEach((key, samples) -> copy.put(key,
                    samples == null ? null : Collections.unmodifiableList(new ArrayList<>(samples))));
        }
        return Collections.unmodifiableMap(copy);
    }

    @JsonValue
    public Map<String, List<TelemetrySample>> series() {
        return series;
    }

    public boolean isEmpty() {
        return series.isEmpty();
    }

    /**
     * Metric keys in submission order.
     */
    public List<String> keys() {
        return List.copyOf(series.keySet());
    }

    /**
     * Total number of samples across all keys.
     */
    public int dataPoints() {
        return series.values().stream().mapToInt(samples -> samples == null ? 0 : samples.size()).sum();
    }

    @Override
    public boolean equals(Object o) {
        return o instanceof TelemetryPayload other && series.equals(other.series);
    }

    @Override
    public int hashCode() {
        return series.hashCode();
    }

    @Override
    public String toString() {
        return "TelemetryPayload" + series;
    }
}
