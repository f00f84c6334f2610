package com.tbproxy.common.error;

import java.util.List;
import java.util.Map;

/**
 * Request data failed validation.
 * Malformed or empty requests answer 400, well-formed but invalid data answers 422.
 */
public record ValidationFailure(
    int status,
    String internalMessage,
    List<String> errors
) implements FailureCause {

    public ValidationFailure {
        errors = errors != null ? List.copyOf(errors) : List.of();
    }

    public static ValidationFailure invalid(String message, List<String> errors) {
        return new ValidationFailure(ErrorCode.VALIDATION_ERROR.getStatus(), message, errors);
    }

    public static ValidationFailure badRequest(String message, List<String> errors) {
        return new ValidationFailure(400, message, errors);
    }

    @Override
    public ErrorCode code() {
        return ErrorCode.VALIDATION_ERROR;
    }

    @Override
    public Map<String, Object> internalDetails() {
        return errors.isEmpty() ? Map.of() : Map.of("validation_errors", errors);
    }
}
