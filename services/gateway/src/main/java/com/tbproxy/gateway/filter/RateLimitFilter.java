package com.tbproxy.gateway.filter;

import com.tbproxy.common.error.RateLimitFailure;
import com.tbproxy.gateway.ratelimit.IdentityExtractor;
import com.tbproxy.gateway.ratelimit.RateLimitDecision;
import com.tbproxy.gateway.ratelimit.SlidingWindowRateLimiter;
import io.micrometer.core.instrument.Counter;
import io.micrometer.core.instrument.MeterRegistry;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.core.Ordered;
import org.springframework.http.HttpHeaders;
import org.springframework.stereotype.Component;
import org.springframework.web.server.ServerWebExchange;
import org.springframework.web.server.WebFilter;
import org.springframework.web.server.WebFilterChain;
import reactor.core.publisher.Mono;

import java.time.Clock;
import java.util.List;
import java.util.Set;

/**
 * Applies the per-client rate limit before any other request handling.
 * Admitted responses carry the current quota in {@code X-RateLimit-*} headers;
 * rejected requests get a 429 with {@code Retry-After}.
 */
@Component
@Slf4j
public class RateLimitFilter implements WebFilter, Ordered {

    static final String LIMIT_HEADER = "X-RateLimit-Limit";
    static final String REMAINING_HEADER = "X-RateLimit-Remaining";
    static final String RESET_HEADER = "X-RateLimit-Reset";

    private final SlidingWindowRateLimiter rateLimiter;
    private final IdentityExtractor identityExtractor;
    private final ErrorResponseWriter errorResponseWriter;
    private final Clock clock;
    private final Set<String> exemptPaths;
    private final Counter rejected;

    public RateLimitFilter(
            SlidingWindowRateLimiter rateLimiter,
            IdentityExtractor identityExtractor,
            ErrorResponseWriter errorResponseWriter,
            Clock clock,
            @Value("${app.rate-limit.exempt-paths:/,/api/v1/health}") List<String> exemptPaths,
            MeterRegistry meterRegistry) {
        this.rateLimiter = rateLimiter;
        this.identityExtractor = identityExtractor;
        this.errorResponseWriter = errorResponseWriter;
        this.clock = clock;
        this.exemptPaths = Set.copyOf(exemptPaths);

        this.rejected = Counter.builder("gateway.ratelimit.rejected")
                .description("Number of requests rejected by the rate limiter")
                .register(meterRegistry);
    }

    @Override
    public Mono<Void> filter(ServerWebExchange exchange, WebFilterChain chain) {
        String path = exchange.getRequest().getPath().value();
        if (exemptPaths.contains(path)) {
            return chain.filter(exchange);
        }

        String identity = identityExtractor.extract(exchange.getRequest());
        RateLimitDecision decision = rateLimiter.admit(identity);

        HttpHeaders headers = exchange.getResponse().getHeaders();
        headers.set(LIMIT_HEADER, String.valueOf(decision.limit()));
        headers.set(REMAINING_HEADER, String.valueOf(decision.remaining()));
        headers.set(RESET_HEADER, String.valueOf(resetEpochSeconds(decision)));

        if (decision.allowed()) {
            return chain.filter(exchange);
        }

        rejected.increment();
        long retryAfter = decision.retryAfterSeconds();
        log.warn("Rate limit exceeded for client {} on {}: retry after {}s", identity, path, retryAfter);

        headers.set(HttpHeaders.RETRY_AFTER, String.valueOf(retryAfter));
        return errorResponseWriter.write(exchange, new RateLimitFailure(
                rateLimiter.getMaxRequests(),
                rateLimiter.getWindow().toSeconds(),
                retryAfter));
    }

    private long resetEpochSeconds(RateLimitDecision decision) {
        long nowMillis = clock.millis();
        return Math.floorDiv(nowMillis, 1000L) + decision.resetAfterSeconds();
    }

    @Override
    public int getOrder() {
        return Ordered.HIGHEST_PRECEDENCE + 10;
    }
}
