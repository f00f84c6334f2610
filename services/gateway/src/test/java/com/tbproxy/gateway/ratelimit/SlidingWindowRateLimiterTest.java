package com.tbproxy.gateway.ratelimit;

import org.junit.jupiter.api.Test;

import java.time.Duration;

import static org.junit.jupiter.api.Assertions.*;

class SlidingWindowRateLimiterTest {

    private static final long SECOND = 1_000_000_000L;

    private final ManualTicker ticker = new ManualTicker(0);

    private SlidingWindowRateLimiter limiter(int maxRequests, long windowSeconds) {
        return new SlidingWindowRateLimiter(maxRequests, Duration.ofSeconds(windowSeconds), 10_000, ticker);
    }

    private RateLimitDecision admitAt(SlidingWindowRateLimiter limiter, String identity, long nanos) {
        ticker.set(nanos);
        return limiter.admit(identity);
    }

    @Test
    void shouldAdmitUntilLimitThenRejectUntilOldestLeavesWindow() {
        SlidingWindowRateLimiter limiter = limiter(2, 60);

        RateLimitDecision first = admitAt(limiter, "10.0.0.1", 0);
        RateLimitDecision second = admitAt(limiter, "10.0.0.1", 0);
        RateLimitDecision third = admitAt(limiter, "10.0.0.1", 10 * SECOND);
        RateLimitDecision fourth = admitAt(limiter, "10.0.0.1", 61 * SECOND);

        assertTrue(first.allowed());
        assertEquals(1, first.remaining());
        assertTrue(second.allowed());
        assertEquals(0, second.remaining());

        assertFalse(third.allowed());
        assertEquals(0, third.remaining());
        assertEquals(2, third.limit());
        assertEquals(Duration.ofSeconds(50), third.retryAfter());
        assertEquals(50, third.retryAfterSeconds());
        assertEquals(60 * SECOND, third.resetAtNanos());

        assertTrue(fourth.allowed());
        assertEquals(1, fourth.remaining());
    }

    @Test
    void shouldNotAllowDoubleBurstAcrossWindowBoundary() {
        SlidingWindowRateLimiter limiter = limiter(3, 60);
        long lateInFirstMinute = 59 * SECOND + 900_000_000L;

        for (int i = 0; i < 3; i++) {
            assertTrue(admitAt(limiter, "client", lateInFirstMinute).allowed());
        }

        assertFalse(admitAt(limiter, "client", 60 * SECOND + 100_000_000L).allowed());
        assertFalse(admitAt(limiter, "client", 119 * SECOND).allowed());
        assertTrue(admitAt(limiter, "client", lateInFirstMinute + 60 * SECOND).allowed());
    }

    @Test
    void shouldAdmitExactlyWhenOldestAdmissionExpires() {
        SlidingWindowRateLimiter limiter = limiter(1, 60);

        assertTrue(admitAt(limiter, "client", 5 * SECOND).allowed());
        assertFalse(admitAt(limiter, "client", 65 * SECOND - 1).allowed());
        assertTrue(admitAt(limiter, "client", 65 * SECOND).allowed());
    }

    @Test
    void rejectedRequestsShouldNotConsumeQuota() {
        SlidingWindowRateLimiter limiter = limiter(1, 60);

        assertTrue(admitAt(limiter, "client", 0).allowed());
        for (int i = 1; i <= 50; i++) {
            RateLimitDecision rejected = admitAt(limiter, "client", i * SECOND / 2);
            assertFalse(rejected.allowed());
            assertEquals(60 * SECOND, rejected.resetAtNanos());
        }

        assertTrue(admitAt(limiter, "client", 60 * SECOND).allowed());
    }

    @Test
    void shouldNeverAdmitMoreThanLimitInAnyWindow() {
        SlidingWindowRateLimiter limiter = limiter(5, 10);
        long[] admittedAt = new long[1000];
        int admitted = 0;

        for (int step = 0; step < 1000; step++) {
            long now = step * 97_000_000L;
            if (admitAt(limiter, "client", now).allowed()) {
                admittedAt[admitted++] = now;
            }
        }

        for (int i = 5; i < admitted; i++) {
            assertTrue(admittedAt[i] - admittedAt[i - 5] >= 10 * SECOND,
                    "six admissions inside one window ending at " + admittedAt[i]);
        }
        assertTrue(admitted > 5);
    }

    @Test
    void identitiesShouldBeIndependent() {
        SlidingWindowRateLimiter limiter = limiter(1, 60);

        assertTrue(admitAt(limiter, "a", 0).allowed());
        assertFalse(admitAt(limiter, "a", SECOND).allowed());
        assertTrue(admitAt(limiter, "b", SECOND).allowed());
    }

    @Test
    void retryAfterShouldRoundUpToWholeSeconds() {
        SlidingWindowRateLimiter limiter = limiter(1, 60);

        admitAt(limiter, "client", 0);
        RateLimitDecision rejected = admitAt(limiter, "client", 10 * SECOND + 500_000_000L);

        assertEquals(50, rejected.retryAfterSeconds());
        assertEquals(Duration.ZERO, admitAt(limiter, "other", 0).retryAfter());
    }

    @Test
    void admittedDecisionShouldReportWhenOldestAdmissionExpires() {
        SlidingWindowRateLimiter limiter = limiter(3, 60);

        admitAt(limiter, "client", 0);
        RateLimitDecision later = admitAt(limiter, "client", 20 * SECOND);

        assertEquals(60 * SECOND, later.resetAtNanos());
        assertEquals(40, later.resetAfterSeconds());
    }

    @Test
    void idleIdentitiesShouldBeDropped() {
        SlidingWindowRateLimiter limiter = limiter(10, 60);

        admitAt(limiter, "a", 0);
        admitAt(limiter, "b", 0);
        assertEquals(2, limiter.trackedClients());

        ticker.advance(Duration.ofSeconds(61));
        assertEquals(0, limiter.trackedClients());
    }

    @Test
    void shouldRejectInvalidConfiguration() {
        assertThrows(IllegalArgumentException.class,
                () -> new SlidingWindowRateLimiter(0, Duration.ofSeconds(60), 10, ticker));
        assertThrows(IllegalArgumentException.class,
                () -> new SlidingWindowRateLimiter(1, Duration.ZERO, 10, ticker));
        assertThrows(IllegalArgumentException.class,
                () -> new SlidingWindowRateLimiter(1, Duration.ofSeconds(60), 0, ticker));
    }
}
