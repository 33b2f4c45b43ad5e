package com.shlawgathon.faceguard.backend.service;

import java.time.Duration;
import java.time.Instant;

/**
 * Consecutive-failure circuit breaker. After {@code failureThreshold} failures
 * the circuit opens for {@code openDuration}; the first request after that is
 * let through as a trial and its outcome closes or re-opens the circuit.
 */
public class CircuitBreaker {

    public enum State {
        CLOSED, OPEN, HALF_OPEN
    }

    private final int failureThreshold;
    private final Duration openDuration;

    private State state = State.CLOSED;
    private int consecutiveFailures;
    private Instant openedAt;
    private boolean trialInFlight;

    public CircuitBreaker(int failureThreshold, Duration openDuration) {
        this.failureThreshold = failureThreshold;
        this.openDuration = openDuration;
    }

    public synchronized boolean allowRequest(Instant now) {
        switch (state) {
            case CLOSED:
                return true;
            case OPEN:
                if (now.isBefore(openedAt.plus(openDuration))) {
                    return false;
                }
                state = State.HALF_OPEN;
                trialInFlight = true;
                return true;
            default:
                if (trialInFlight) {
                    return false;
                }
                trialInFlight = true;
                return true;
        }
    }

    public synchronized void recordSuccess() {
        state = State.CLOSED;
        consecutiveFailures = 0;
        trialInFlight = false;
        openedAt = null;
    }

    public synchronized void recordFailure(Instant now) {
        trialInFlight = false;
        if (state == State.HALF_OPEN) {
            state = State.OPEN;
            openedAt = now;
            return;
        }
        consecutiveFailures++;
        if (consecutiveFailures >= failureThreshold) {
            state = State.OPEN;
            openedAt = now;
        }
    }

    public synchronized State getState() {
        return state;
    }
}
