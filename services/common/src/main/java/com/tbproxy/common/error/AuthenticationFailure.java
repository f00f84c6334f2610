package com.tbproxy.common.error;

/**
 * Caller did not present valid credentials.
 */
public record AuthenticationFailure(String internalMessage) implements FailureCause {

    @Override
    public ErrorCode code() {
        return ErrorCode.AUTHENTICATION_FAILED;
    }
}
