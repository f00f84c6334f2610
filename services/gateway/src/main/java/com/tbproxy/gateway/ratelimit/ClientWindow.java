package com.tbproxy.gateway.ratelimit;

import java.util.ArrayDeque;

/**
 * Admission log of one client identity.
 * Not thread-safe: callers mutate it only inside the limiter's per-key compute.
 */
final class ClientWindow {

    private final ArrayDeque<Long> timestamps = new ArrayDeque<>();

    /**
     * Drops every admission that is no longer inside {@code (now - window, now]}.
     */
    void evict(long nowNanos, long windowNanos) {
        while (!timestamps.isEmpty() && nowNanos - timestamps.peekFirst() >= windowNanos) {
            timestamps.removeFirst();
        }
    }

    void append(long nowNanos) {
        timestamps.addLast(nowNanos);
    }

    int size() {
        return timestamps.size();
    }

    long oldest() {
        return timestamps.peekFirst();
    }
}
