package com.tbproxy.gateway.ratelimit;

import org.springframework.http.server.reactive.ServerHttpRequest;

/**
 * Derives the rate-limit key for an inbound request.
 */
public interface IdentityExtractor {

    String extract(ServerHttpRequest request);
}
