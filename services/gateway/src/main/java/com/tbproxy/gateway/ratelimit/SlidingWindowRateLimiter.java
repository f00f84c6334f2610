package com.tbproxy.gateway.ratelimit;

import com.github.benmanes.caffeine.cache.Cache;
import com.github.benmanes.caffeine.cache.Caffeine;
import com.github.benmanes.caffeine.cache.Ticker;
import lombok.extern.slf4j.Slf4j;

import java.time.Duration;

/**
 * Per-client sliding window log.
 *
 * Every identity keeps the instants of its admitted requests. A request at
 * {@code now} is admitted when fewer than {@code maxRequests} admissions fall in
 * {@code (now - window, now]}. Rejections are not recorded, so a client that keeps
 * retrying does not push its own reset further away.
 *
 * Checks for the same identity are serialized through the cache's atomic
 * compute; different identities proceed independently. Idle identities expire
 * after one window and at most {@code maxTrackedClients} are kept.
 */
@Slf4j
public class SlidingWindowRateLimiter {

    private final int maxRequests;
    private final long windowNanos;
    private final Ticker ticker;
    private final Cache<String, ClientWindow> windows;

    public SlidingWindowRateLimiter(int maxRequests, Duration window, long maxTrackedClients, Ticker ticker) {
        if (maxRequests <= 0) throw new IllegalArgumentException("maxRequests must be positive");
        if (window.isZero() || window.isNegative()) throw new IllegalArgumentException("window must be positive");
        if (maxTrackedClients <= 0) throw new IllegalArgumentException("maxTrackedClients must be positive");

        this.maxRequests = maxRequests;
        this.windowNanos = window.toNanos();
        this.ticker = ticker;
        this.windows = Caffeine.newBuilder()
                .maximumSize(maxTrackedClients)
                .expireAfterAccess(window)
                .ticker(ticker)
                .build();
    }

    /**
     * Checks and records a request for {@code identity} at the current ticker instant.
     */
    public RateLimitDecision admit(String identity) {
        return admit(identity, ticker.read());
    }

    /**
     * Checks and records a request for {@code identity} at {@code nowNanos}.
     */
    public RateLimitDecision admit(String identity, long nowNanos) {
        RateLimitDecision[] decision = new RateLimitDecision[1];

        windows.asMap().compute(identity, (key, window) -> {
            ClientWindow current = window != null ? window : new ClientWindow();
            current.evict(nowNanos, windowNanos);

            if (current.size() < maxRequests) {
                current.append(nowNanos);
                decision[0] = RateLimitDecision.allow(
                        maxRequests,
                        maxRequests - current.size(),
                        current.oldest() + windowNanos,
                        nowNanos);
            } else {
                decision[0] = RateLimitDecision.reject(maxRequests, current.oldest() + windowNanos, nowNanos);
            }
            return current;
        });

        if (!decision[0].allowed()) {
            log.debug("Rate limit reached for {}: retry in {}s", identity, decision[0].retryAfterSeconds());
        }
        return decision[0];
    }

    public int getMaxRequests() {
        return maxRequests;
    }

    public Duration getWindow() {
        return Duration.ofNanos(windowNanos);
    }

    /**
     * Number of identities currently held, after pending expirations are applied.
     */
    public long trackedClients() {
        windows.cleanUp();
        return windows.estimatedSize();
    }
}
