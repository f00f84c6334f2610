package com.tbproxy.common.dto.telemetry;

import com.fasterxml.jackson.databind.JsonMappingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.tbproxy.common.util.JsonUtil;
import jakarta.validation.ConstraintViolation;
import jakarta.validation.Path;
import jakarta.validation.Validator;

import java.util.List;

/**
 * Turns raw or decoded telemetry into a checked {@link TelemetryPayload}.
 * Every problem found is reported, not only the first one.
 */
public class TelemetryPayloadReader {

    private final Validator validator;

    public TelemetryPayloadReader(Validator validator) {
        this.validator = validator;
    }

    /**
     * Binds a raw JSON object and validates it.
     *
     * @throws InvalidTelemetryException if the node does not bind or breaks a constraint
     */
    public TelemetryPayload read(JsonNode node) {
        if (node == null || !node.isObject()) {
            throw new InvalidTelemetryException(List.of("payload must be a non-empty object"));
        }
        TelemetryPayload payload;
        try {
            payload = JsonUtil.getObjectMapper().convertValue(node, TelemetryPayload.class);
        } catch (IllegalArgumentException e) {
            throw new InvalidTelemetryException(List.of(describe(e)));
        }
        return validate(payload);
    }

    /**
     * Validates an already decoded payload.
     *
     * @throws InvalidTelemetryException if any constraint is broken
     */
    public TelemetryPayload validate(TelemetryPayload payload) {
        List<String> errors = validator.validate(payload).stream()
                .map(TelemetryPayloadReader::describe)
                .sorted()
                .toList();
        if (!errors.isEmpty()) {
            throw new InvalidTelemetryException(errors);
        }
        return payload;
    }

    /**
     * Renders a violation as {@code key[index].field: message}, e.g.
     * {@code humidity[0].ts: must be a positive integer}.
     */
    static String describe(ConstraintViolation<?> violation) {
        StringBuilder field = new StringBuilder();
        for (Path.Node node : violation.getPropertyPath()) {
            if (node.getKey() != null) {
                appendName(field, String.valueOf(node.getKey()));
            }
            if (node.getIndex() != null) {
                field.append('[').append(node.getIndex()).append(']');
            }
            String name = node.getName();
            if (name != null && !name.startsWith("<") && !"series".equals(name)) {
                appendName(field, name);
            }
        }
        String path = field.toString();
        return path.isBlank() ? violation.getMessage() : path + ": " + violation.getMessage();
    }

    private static String describe(IllegalArgumentException conversionError) {
        if (conversionError.getCause() instanceof JsonMappingException mapping && !mapping.getPath().isEmpty()) {
            StringBuilder field = new StringBuilder();
            for (JsonMappingException.Reference reference : mapping.getPath()) {
                if (reference.getFieldName() != null) {
                    appendName(field, reference.getFieldName());
                } else if (reference.getIndex() >= 0) {
                    field.append('[').append(reference.getIndex()).append(']');
                }
            }
            return field + ": has the wrong type";
        }
        return "payload must map telemetry keys to arrays of {ts, value} samples";
    }

    private static void appendName(StringBuilder field, String name) {
        if (field.length() > 0) {
            field.append('.');
        }
        field.append(name);
    }
}
