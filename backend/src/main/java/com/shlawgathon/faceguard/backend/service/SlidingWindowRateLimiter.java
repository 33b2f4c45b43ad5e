package com.shlawgathon.faceguard.backend.service;

import java.time.Duration;
import java.time.Instant;
import java.util.ArrayDeque;
import java.util.Deque;
import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;

/**
 * Per-key sliding window counter. A key may be acquired at most {@code limit}
 * times within any window.
 */
public class SlidingWindowRateLimiter {

    private final Duration window;
    private final Map<String, Deque<Instant>> hits = new ConcurrentHashMap<>();

    public SlidingWindowRateLimiter(Duration window) {
        this.window = window;
    }

    public boolean tryAcquire(String key, int limit, Instant now) {
        Deque<Instant> timestamps = hits.computeIfAbsent(key, k -> new ArrayDeque<>());
        synchronized (timestamps) {
            Instant cutoff = now.minus(window);
            while (!timestamps.isEmpty() && !timestamps.peekFirst().isAfter(cutoff)) {
                timestamps.pollFirst();
            }
            if (timestamps.size() >= limit) {
                return false;
            }
            timestamps.addLast(now);
            return true;
        }
    }

    public int currentCount(String key, Instant now) {
        Deque<Instant> timestamps = hits.get(key);
        if (timestamps == null) {
            return 0;
        }
        synchronized (timestamps) {
            Instant cutoff = now.minus(window);
            return (int) timestamps.stream().filter(t -> t.isAfter(cutoff)).count();
        }
    }
}
