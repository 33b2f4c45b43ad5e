package com.shlawgathon.faceguard.backend.service;

import com.shlawgathon.faceguard.backend.client.RecordStoreClient;
import com.shlawgathon.faceguard.backend.client.RecordStoreException;
import com.shlawgathon.faceguard.backend.client.UpstreamUnavailableException;
import com.shlawgathon.faceguard.backend.model.AlertRule;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.scheduling.annotation.Scheduled;
import org.springframework.stereotype.Component;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.List;
import java.util.Optional;
import java.util.concurrent.atomic.AtomicLong;
import java.util.concurrent.locks.ReentrantLock;

/**
 * Read-through cache of alert rules from the record store, refreshed on a
 * schedule and lazily when it has gone stale. After a failed refresh the lazy
 * path stays quiet until the next interval, leaving retries to the scheduler.
 */
@Component
public class AlertRuleCache {

    private static final Logger log = LoggerFactory.getLogger(AlertRuleCache.class);

    private final RecordStoreClient recordStoreClient;
    private final Clock clock;
    private final Duration refreshInterval;
    private final ReentrantLock refreshLock = new ReentrantLock();
    private final AtomicLong refreshFailures = new AtomicLong();

    private volatile List<AlertRule> rules = List.of();
    private volatile Instant lastRefreshAt;
    private volatile Instant lastFailureAt;

    public AlertRuleCache(RecordStoreClient recordStoreClient,
            Clock clock,
            @Value("${faceguard.alerts.rule-refresh-interval:PT60S}") Duration refreshInterval) {
        this.recordStoreClient = recordStoreClient;
        this.clock = clock;
        this.refreshInterval = refreshInterval;
    }

    @Scheduled(fixedDelayString = "${faceguard.alerts.rule-refresh-interval:PT60S}")
    public void scheduledRefresh() {
        refresh();
    }

    /**
     * Reload every rule from the record store.
     *
     * @return false when the record store could not be read; the previous rules are kept
     */
    public boolean refresh() {
        refreshLock.lock();
        try {
            List<AlertRule> fetched = recordStoreClient.listAlertRules();
            rules = List.copyOf(fetched);
            lastRefreshAt = clock.instant();
            log.debug("[ALERT] Rule cache refreshed with {} rules", fetched.size());
            return true;
        } catch (UpstreamUnavailableException | RecordStoreException e) {
            refreshFailures.incrementAndGet();
            lastFailureAt = clock.instant();
            log.warn("[ALERT] Rule refresh failed, keeping {} cached rules: {}", rules.size(), e.getMessage());
            return false;
        } finally {
            refreshLock.unlock();
        }
    }

    /**
     * Active rules for one evaluation cycle. A stale cache is refreshed inline
     * at most once per refresh interval after a failure; callers never wait on
     * a refresh another thread is already running.
     *
     * @return empty when the cache is stale and could not be refreshed
     */
    public Optional<List<AlertRule>> activeRules() {
        if (isStale() && !inFailureBackoff() && refreshLock.tryLock()) {
            try {
                if (isStale() && !inFailureBackoff()) {
                    refresh();
                }
            } finally {
                refreshLock.unlock();
            }
        }
        if (isStale()) {
            return Optional.empty();
        }
        return Optional.of(rules.stream().filter(AlertRule::isActive).toList());
    }

    private boolean inFailureBackoff() {
        Instant failure = lastFailureAt;
        return failure != null && clock.instant().isBefore(failure.plus(refreshInterval));
    }

    public boolean isStale() {
        Instant last = lastRefreshAt;
        return last == null || Duration.between(last, clock.instant()).compareTo(refreshInterval) > 0;
    }

    /**
     * Degraded means the cached rules are stale because the record store is failing.
     */
    public boolean isDegraded() {
        Instant failure = lastFailureAt;
        Instant refreshed = lastRefreshAt;
        return failure != null && (refreshed == null || failure.isAfter(refreshed)) && isStale();
    }

    /**
     * Every cached rule, active or not, without triggering a refresh.
     */
    public List<AlertRule> cachedRules() {
        return rules;
    }

    public int size() {
        return rules.size();
    }

    public long getRefreshFailures() {
        return refreshFailures.get();
    }

    public Instant getLastRefreshAt() {
        return lastRefreshAt;
    }
}
