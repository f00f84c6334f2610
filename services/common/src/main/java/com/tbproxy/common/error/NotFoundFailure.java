package com.tbproxy.common.error;

import java.util.Map;

/**
 * Requested resource does not exist, either locally or upstream.
 */
public record NotFoundFailure(String resource) implements FailureCause {

    @Override
    public ErrorCode code() {
        return ErrorCode.RESOURCE_NOT_FOUND;
    }

    @Override
    public String internalMessage() {
        return "Resource not found: " + resource;
    }

    @Override
    public Map<String, Object> internalDetails() {
        return resource == null ? Map.of() : Map.of("resource", resource);
    }
}
