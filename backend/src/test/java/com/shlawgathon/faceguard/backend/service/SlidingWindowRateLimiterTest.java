package com.shlawgathon.faceguard.backend.service;

import org.junit.jupiter.api.Test;

import java.time.Duration;
import java.time.Instant;

import static org.junit.jupiter.api.Assertions.*;

class SlidingWindowRateLimiterTest {

    private static final Instant T0 = Instant.parse("2024-03-01T10:00:00Z");

    @Test
    void shouldAllowUpToLimitWithinWindow() {
        SlidingWindowRateLimiter limiter = new SlidingWindowRateLimiter(Duration.ofMinutes(1));

        assertTrue(limiter.tryAcquire("ch", 2, T0));
        assertTrue(limiter.tryAcquire("ch", 2, T0.plusSeconds(10)));
        assertFalse(limiter.tryAcquire("ch", 2, T0.plusSeconds(20)));
        assertEquals(2, limiter.currentCount("ch", T0.plusSeconds(20)));
    }

    @Test
    void shouldFreeSlotsAsWindowSlides() {
        SlidingWindowRateLimiter limiter = new SlidingWindowRateLimiter(Duration.ofMinutes(1));
        limiter.tryAcquire("ch", 1, T0);

        assertFalse(limiter.tryAcquire("ch", 1, T0.plusSeconds(59)));
        assertTrue(limiter.tryAcquire("ch", 1, T0.plusSeconds(60)));
    }

    @Test
    void shouldTrackKeysIndependently() {
        SlidingWindowRateLimiter limiter = new SlidingWindowRateLimiter(Duration.ofHours(1));

        assertTrue(limiter.tryAcquire("rule-a", 1, T0));
        assertTrue(limiter.tryAcquire("rule-b", 1, T0));
        assertFalse(limiter.tryAcquire("rule-a", 1, T0));
        assertEquals(0, limiter.currentCount("rule-c", T0));
    }
}
