package com.tbproxy.gateway.filter;

import com.tbproxy.common.error.ValidationFailure;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.core.Ordered;
import org.springframework.stereotype.Component;
import org.springframework.web.server.ServerWebExchange;
import org.springframework.web.server.WebFilter;
import org.springframework.web.server.WebFilterChain;
import reactor.core.publisher.Mono;

import java.net.InetSocketAddress;
import java.util.List;
import java.util.Locale;

/**
 * Rejects requests whose {@code Host} header is not listed in
 * {@code app.allowed-hosts}. Entries may be exact names or {@code *.domain}
 * wildcards. Every host is accepted when the list is empty.
 */
@Component
@Slf4j
public class AllowedHostsFilter implements WebFilter, Ordered {

    private final List<String> allowedHosts;
    private final ErrorResponseWriter errorResponseWriter;

    public AllowedHostsFilter(
            @Value("${app.allowed-hosts:}") List<String> allowedHosts,
            ErrorResponseWriter errorResponseWriter) {
        this.allowedHosts = allowedHosts.stream()
                .map(String::trim)
                .filter(host -> !host.isEmpty())
                .map(host -> host.toLowerCase(Locale.ROOT))
                .toList();
        this.errorResponseWriter = errorResponseWriter;
    }

    @Override
    public Mono<Void> filter(ServerWebExchange exchange, WebFilterChain chain) {
        if (allowedHosts.isEmpty() || allowedHosts.contains("*")) {
            return chain.filter(exchange);
        }

        InetSocketAddress hostHeader = exchange.getRequest().getHeaders().getHost();
        String host = hostHeader != null ? hostHeader.getHostString().toLowerCase(Locale.ROOT) : null;
        if (host != null && isAllowed(host)) {
            return chain.filter(exchange);
        }

        log.warn("Rejected request for {} with untrusted host {}", exchange.getRequest().getPath().value(), host);
        return errorResponseWriter.write(exchange, ValidationFailure.badRequest("Invalid host header", List.of()));
    }

    private boolean isAllowed(String host) {
        for (String allowed : allowedHosts) {
            if (allowed.startsWith("*.") ? host.endsWith(allowed.substring(1)) : host.equals(allowed)) {
                return true;
            }
        }
        return false;
    }

    @Override
    public int getOrder() {
        return Ordered.HIGHEST_PRECEDENCE + 1;
    }
}
