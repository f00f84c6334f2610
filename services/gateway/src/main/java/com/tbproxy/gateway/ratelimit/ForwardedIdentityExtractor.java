package com.tbproxy.gateway.ratelimit;

import org.springframework.http.server.reactive.ServerHttpRequest;
import org.springframework.stereotype.Component;

import java.net.InetSocketAddress;

/**
 * Client address as seen through a reverse proxy: first {@code X-Forwarded-For}
 * entry, then {@code X-Real-IP}, then the socket peer.
 */
@Component
public class ForwardedIdentityExtractor implements IdentityExtractor {

    static final String UNKNOWN = "unknown";

    @Override
    public String extract(ServerHttpRequest request) {
        String forwardedFor = request.getHeaders().getFirst("X-Forwarded-For");
        if (forwardedFor != null && !forwardedFor.isBlank()) {
            String first = forwardedFor.split(",")[0].trim();
            if (!first.isEmpty()) {
                return first;
            }
        }

        String realIp = request.getHeaders().getFirst("X-Real-IP");
        if (realIp != null && !realIp.isBlank()) {
            return realIp.trim();
        }

        InetSocketAddress remote = request.getRemoteAddress();
        if (remote != null) {
            return remote.getAddress() != null
                    ? remote.getAddress().getHostAddress()
                    : remote.getHostString();
        }
        return UNKNOWN;
    }
}
