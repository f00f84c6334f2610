package com.tbproxy.gateway.config;

import com.github.benmanes.caffeine.cache.Ticker;
import com.tbproxy.gateway.ratelimit.SlidingWindowRateLimiter;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

import java.time.Duration;

/**
 * Rate limiter settings. One limiter instance serves the whole process.
 */
@Configuration
@Slf4j
public class RateLimitConfig {

    @Value("${app.rate-limit.max-requests:100}")
    private int maxRequests;

    @Value("${app.rate-limit.window-seconds:60}")
    private long windowSeconds;

    @Value("${app.rate-limit.max-tracked-clients:10000}")
    private long maxTrackedClients;

    @Bean
    public SlidingWindowRateLimiter slidingWindowRateLimiter() {
        log.info("Rate limit: {} requests per {}s, tracking up to {} clients",
                maxRequests, windowSeconds, maxTrackedClients);
        return new SlidingWindowRateLimiter(
                maxRequests,
                Duration.ofSeconds(windowSeconds),
                maxTrackedClients,
                Ticker.systemTicker());
    }
}
