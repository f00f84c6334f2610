package com.tbproxy.common.error;

/**
 * Anything not covered by a more specific variant.
 */
public record InternalFailure(Throwable error) implements FailureCause {

    @Override
    public ErrorCode code() {
        return ErrorCode.INTERNAL_ERROR;
    }

    @Override
    public String internalMessage() {
        if (error == null) {
            return "Unknown error";
        }
        return error.getClass().getSimpleName() + ": " + error.getMessage();
    }
}
