package com.tbproxy.common.error;

/**
 * Closed set of machine-readable error codes exposed to API callers.
 * Each code carries its default HTTP status and the generic message used
 * when internal context must not be revealed.
 */
public enum ErrorCode {
    VALIDATION_ERROR(422, "The request contains invalid data. Please check your input and try again."),
    AUTHENTICATION_FAILED(401, "Authentication is required to access this resource."),
    RATE_LIMIT_EXCEEDED(429, "Too many requests. Please slow down and try again later."),
    RESOURCE_NOT_FOUND(404, "The requested resource was not found."),
    UPSTREAM_ERROR(502, "The backend service is temporarily unavailable."),
    INTERNAL_ERROR(500, "An internal server error occurred. Please try again later.");

    private final int status;
    private final String genericMessage;

    ErrorCode(int status, String genericMessage) {
        this.status = status;
        this.genericMessage = genericMessage;
    }

    public int getStatus() {
        return status;
    }

    public String getGenericMessage() {
        return genericMessage;
    }
}
