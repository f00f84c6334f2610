package com.tbproxy.common.error;

import java.util.Map;

/**
 * Sealed interface for every failure the proxy can report.
 * Each variant names its own {@link ErrorCode}, so adding a variant without
 * a code does not compile.
 */
public sealed interface FailureCause
        permits ValidationFailure, AuthenticationFailure, RateLimitFailure,
                NotFoundFailure, UpstreamFailure, InternalFailure {

    ErrorCode code();

    /**
     * HTTP status to answer with. Defaults to the code's status.
     */
    default int status() {
        return code().getStatus();
    }

    /**
     * Message carrying internal context. Only surfaced in verbose mode.
     */
    String internalMessage();

    /**
     * Detail fields that are safe to expose in every mode.
     */
    default Map<String, Object> publicDetails() {
        return Map.of();
    }

    /**
     * Additional detail fields exposed only in verbose mode.
     */
    default Map<String, Object> internalDetails() {
        return Map.of();
    }
}
