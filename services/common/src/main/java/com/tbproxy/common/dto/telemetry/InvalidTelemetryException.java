package com.tbproxy.common.dto.telemetry;

import java.util.List;

/**
 * Thrown when a telemetry payload does not have the expected shape.
 */
public class InvalidTelemetryException extends IllegalArgumentException {

    private final List<String> errors;

    public InvalidTelemetryException(List<String> errors) {
        super("Invalid telemetry payload: " + String.join("; ", errors));
        this.errors = List.copyOf(errors);
    }

    public List<String> getErrors() {
        return errors;
    }
}
