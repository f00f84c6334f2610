package com.tbproxy.gateway.exception;

import com.tbproxy.common.error.FailureCause;
import com.tbproxy.common.error.ValidationFailure;

import java.util.List;

/**
 * The request as a whole cannot be processed: malformed body, empty batch or
 * repeated target ids. Answered with 400.
 */
public class RequestValidationException extends ProxyException {

    private final List<String> errors;

    public RequestValidationException(String message) {
        this(message, List.of());
    }

    public RequestValidationException(String message, List<String> errors) {
        super(message);
        this.errors = List.copyOf(errors);
    }

    public List<String> getErrors() {
        return errors;
    }

    @Override
    public FailureCause failure() {
        return ValidationFailure.badRequest(getMessage(), errors);
    }
}
