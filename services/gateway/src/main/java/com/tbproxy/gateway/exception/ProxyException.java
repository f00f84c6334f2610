package com.tbproxy.gateway.exception;

import com.tbproxy.common.error.FailureCause;

/**
 * Base class for exceptions that already know how they are reported to callers.
 */
public abstract class ProxyException extends RuntimeException {

    protected ProxyException(String message) {
        super(message);
    }

    protected ProxyException(String message, Throwable cause) {
        super(message, cause);
    }

    public abstract FailureCause failure();
}
