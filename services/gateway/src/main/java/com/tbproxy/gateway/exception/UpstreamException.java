package com.tbproxy.gateway.exception;

import com.tbproxy.common.error.FailureCause;
import com.tbproxy.common.error.UpstreamFailure;

/**
 * The telemetry platform could not be reached or refused a call.
 */
public class UpstreamException extends ProxyException {

    private final Integer statusCode;

    public UpstreamException(Integer statusCode, String message) {
        this(statusCode, message, null);
    }

    public UpstreamException(Integer statusCode, String message, Throwable cause) {
        super(message, cause);
        this.statusCode = statusCode;
    }

    /**
     * HTTP status answered by the platform, {@code null} when no response was received.
     */
    public Integer getStatusCode() {
        return statusCode;
    }

    /**
     * Whether the platform answered 404 for the addressed entity.
     */
    public static boolean isNotFound(Throwable error) {
        return error instanceof UpstreamException upstream
                && upstream.statusCode != null
                && upstream.statusCode == 404;
    }

    @Override
    public FailureCause failure() {
        return new UpstreamFailure(statusCode, getMessage());
    }
}
