package com.tbproxy.gateway.exception;

import com.tbproxy.common.error.FailureCause;
import com.tbproxy.common.error.NotFoundFailure;

public class ResourceNotFoundException extends ProxyException {

    private final String resource;

    public ResourceNotFoundException(String resource) {
        super(resource + " not found");
        this.resource = resource;
    }

    public String getResource() {
        return resource;
    }

    @Override
    public FailureCause failure() {
        return new NotFoundFailure(resource);
    }
}
