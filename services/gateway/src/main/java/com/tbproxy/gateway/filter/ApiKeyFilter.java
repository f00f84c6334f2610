package com.tbproxy.gateway.filter;

import com.tbproxy.common.error.AuthenticationFailure;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.core.Ordered;
import org.springframework.http.HttpHeaders;
import org.springframework.stereotype.Component;
import org.springframework.web.server.ServerWebExchange;
import org.springframework.web.server.WebFilter;
import org.springframework.web.server.WebFilterChain;
import reactor.core.publisher.Mono;

import java.nio.charset.StandardCharsets;
import java.security.MessageDigest;
import java.util.List;
import java.util.Set;

/**
 * Requires a matching {@code X-API-Key} header on the ThingsBoard proxy routes
 * and on actuator endpoints other than health. Disabled when no key is configured.
 */
@Component
@Slf4j
public class ApiKeyFilter implements WebFilter, Ordered {

    static final String API_KEY_HEADER = "X-API-Key";
    static final List<String> PROTECTED_PREFIXES = List.of("/api/v1/tb", "/actuator");
    static final Set<String> OPEN_PATHS = Set.of("/actuator/health", "/actuator/info");

    private final byte[] apiKey;
    private final ErrorResponseWriter errorResponseWriter;

    public ApiKeyFilter(
            @Value("${app.api-key:}") String apiKey,
            ErrorResponseWriter errorResponseWriter) {
        this.apiKey = apiKey.getBytes(StandardCharsets.UTF_8);
        this.errorResponseWriter = errorResponseWriter;
        if (this.apiKey.length == 0) {
            log.warn("No API key configured, proxy routes accept unauthenticated requests");
        }
    }

    @Override
    public Mono<Void> filter(ServerWebExchange exchange, WebFilterChain chain) {
        String path = exchange.getRequest().getPath().value();
        if (apiKey.length == 0 || !isProtected(path)) {
            return chain.filter(exchange);
        }

        String provided = exchange.getRequest().getHeaders().getFirst(API_KEY_HEADER);
        if (provided == null || provided.isEmpty()) {
            log.warn("API key required but not provided for {}", path);
            return reject(exchange, "API key required. Provide X-API-Key header.");
        }
        if (!MessageDigest.isEqual(apiKey, provided.getBytes(StandardCharsets.UTF_8))) {
            log.warn("Invalid API key provided for {}", path);
            return reject(exchange, "Invalid API key");
        }

        log.debug("API key accepted for {}", path);
        return chain.filter(exchange);
    }

    private static boolean isProtected(String path) {
        if (OPEN_PATHS.contains(path) || path.startsWith("/actuator/health/")) {
            return false;
        }
        return PROTECTED_PREFIXES.stream().anyMatch(path::startsWith);
    }

    private Mono<Void> reject(ServerWebExchange exchange, String reason) {
        exchange.getResponse().getHeaders().set(HttpHeaders.WWW_AUTHENTICATE, "ApiKey");
        return errorResponseWriter.write(exchange, new AuthenticationFailure(reason));
    }

    @Override
    public int getOrder() {
        return Ordered.HIGHEST_PRECEDENCE + 20;
    }
}
