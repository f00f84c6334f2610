package com.tbproxy.gateway.ratelimit;

import java.time.Duration;

/**
 * Outcome of one admission check.
 *
 * @param allowed      whether the request may proceed
 * @param limit        configured maximum requests per window
 * @param remaining    admissions left in the current window, 0 when rejected
 * @param resetAtNanos ticker instant at which the oldest admission leaves the window
 * @param resetAfter   time from the check until {@code resetAtNanos}
 */
public record RateLimitDecision(
    boolean allowed,
    int limit,
    int remaining,
    long resetAtNanos,
    Duration resetAfter
) {

    static RateLimitDecision allow(int limit, int remaining, long resetAtNanos, long nowNanos) {
        return new RateLimitDecision(true, limit, remaining, resetAtNanos, Duration.ofNanos(resetAtNanos - nowNanos));
    }

    static RateLimitDecision reject(int limit, long resetAtNanos, long nowNanos) {
        return new RateLimitDecision(false, limit, 0, resetAtNanos, Duration.ofNanos(resetAtNanos - nowNanos));
    }

    /**
     * Delay before a retry can succeed. Zero for admitted requests.
     */
    public Duration retryAfter() {
        return allowed ? Duration.ZERO : resetAfter;
    }

    /**
     * {@link #retryAfter()} in whole seconds, rounded up.
     */
    public long retryAfterSeconds() {
        return ceilSeconds(retryAfter());
    }

    /**
     * {@link #resetAfter()} in whole seconds, rounded up.
     */
    public long resetAfterSeconds() {
        return ceilSeconds(resetAfter);
    }

    private static long ceilSeconds(Duration duration) {
        long seconds = duration.getSeconds();
        return duration.getNano() > 0 ? seconds + 1 : seconds;
    }
}
