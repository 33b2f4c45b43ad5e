package com.shlawgathon.faceguard.backend.service;

import com.shlawgathon.faceguard.backend.client.RecordStoreClient;
import com.shlawgathon.faceguard.backend.client.RecordStoreException;
import com.shlawgathon.faceguard.backend.client.UpstreamUnavailableException;
import com.shlawgathon.faceguard.backend.dto.AlertEngineStats;
import com.shlawgathon.faceguard.backend.model.AlertInstance;
import com.shlawgathon.faceguard.backend.model.AlertPriority;
import com.shlawgathon.faceguard.backend.model.AlertRule;
import com.shlawgathon.faceguard.backend.model.AlertStatus;
import com.shlawgathon.faceguard.backend.model.ChannelType;
import com.shlawgathon.faceguard.backend.model.HighPriorityStatus;
import com.shlawgathon.faceguard.backend.model.PersonMatch;
import com.shlawgathon.faceguard.backend.model.RecognitionEvent;
import com.shlawgathon.faceguard.backend.pubsub.RealtimeEventPublisher;
import com.shlawgathon.faceguard.backend.repository.AlertInstanceRepository;
import jakarta.annotation.PostConstruct;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.dao.DataAccessException;
import org.springframework.data.domain.PageRequest;
import org.springframework.data.domain.Sort;
import org.springframework.stereotype.Service;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.HashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.Set;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.atomic.AtomicLong;
import java.util.concurrent.locks.ReentrantLock;

/**
 * Turns recognition events into alert instances and drives their lifecycle.
 * <p>
 * Decisions for one (rule, subject) pair are serialized by a per-pair lock so
 * cooldown checks and instance creation cannot interleave. Delivery happens
 * after the lock is released. Instance state changes are made while holding
 * the instance's monitor.
 * <p>
 * Only TRIGGERED instances are held in memory; acknowledged and resolved ones
 * are read back from the repository. Cooldown marks and idle pair locks are
 * pruned on every deadline tick.
 */
@Service
public class AlertDecisionEngine {

    private static final Logger log = LoggerFactory.getLogger(AlertDecisionEngine.class);

    static final String UNKNOWN_SUBJECT = "unknown";
    static final String SYSTEM_ACTOR = "system";
    private static final List<String> HIGH_PRIORITY_CHANNELS = List.of(
            ChannelType.SMS.getValue(), ChannelType.EMAIL.getValue(), ChannelType.DASHBOARD.getValue());

    private final AlertRuleCache ruleCache;
    private final TriggerConditionEvaluator evaluator;
    private final RecordStoreClient recordStoreClient;
    private final AlertInstanceRepository repository;
    private final NotificationDispatcher dispatcher;
    private final RealtimeEventPublisher publisher;
    private final Clock clock;
    private final int maxAlertsPerRulePerHour;
    private final int defaultCooldownMinutes;

    private final Map<String, ReentrantLock> pairLocks = new ConcurrentHashMap<>();
    private final Map<String, Instant> lastTriggered = new ConcurrentHashMap<>();
    private final Map<String, AlertInstance> activeInstances = new ConcurrentHashMap<>();
    private final SlidingWindowRateLimiter hourlyLimiter = new SlidingWindowRateLimiter(Duration.ofHours(1));

    private final AtomicLong sightingsProcessed = new AtomicLong();
    private final AtomicLong rulesEvaluated = new AtomicLong();
    private final AtomicLong alertsTriggered = new AtomicLong();
    private final AtomicLong suppressedByCooldown = new AtomicLong();
    private final AtomicLong rateLimited = new AtomicLong();
    private final AtomicLong escalations = new AtomicLong();
    private final AtomicLong autoResolved = new AtomicLong();
    private final AtomicLong notificationsSent = new AtomicLong();
    private final AtomicLong ruleStoreFailures = new AtomicLong();
    private final AtomicLong ruleEvaluationErrors = new AtomicLong();

    public AlertDecisionEngine(AlertRuleCache ruleCache,
            TriggerConditionEvaluator evaluator,
            RecordStoreClient recordStoreClient,
            AlertInstanceRepository repository,
            NotificationDispatcher dispatcher,
            RealtimeEventPublisher publisher,
            Clock clock,
            @Value("${faceguard.alerts.max-alerts-per-rule-per-hour:100}") int maxAlertsPerRulePerHour,
            @Value("${faceguard.alerts.default-cooldown-minutes:30}") int defaultCooldownMinutes) {
        this.ruleCache = ruleCache;
        this.evaluator = evaluator;
        this.recordStoreClient = recordStoreClient;
        this.repository = repository;
        this.dispatcher = dispatcher;
        this.publisher = publisher;
        this.clock = clock;
        this.maxAlertsPerRulePerHour = maxAlertsPerRulePerHour;
        this.defaultCooldownMinutes = defaultCooldownMinutes;
    }

    /**
     * Reload triggered instances so escalation and auto-resolve deadlines survive a restart.
     */
    @PostConstruct
    public void loadOpenInstances() {
        try {
            List<AlertInstance> open = repository.findByStatus(AlertStatus.TRIGGERED);
            for (AlertInstance instance : open) {
                activeInstances.put(instance.getId(), instance);
                lastTriggered.merge(pairKey(instance.getRuleId(), instance.getSubjectPersonId()),
                        instance.getTriggeredAt(), (a, b) -> a.isAfter(b) ? a : b);
            }
            log.info("[ALERT] Loaded {} open alert instances", open.size());
        } catch (DataAccessException e) {
            log.warn("[ALERT] Could not load open alert instances: {}", e.getMessage());
        }
    }

    /**
     * Evaluate every active rule against one sighting.
     *
     * @return the instances created by this sighting, possibly empty
     */
    public List<AlertInstance> evaluate(RecognitionEvent event) {
        sightingsProcessed.incrementAndGet();

        Optional<List<AlertRule>> cached = ruleCache.activeRules();
        if (cached.isEmpty()) {
            ruleStoreFailures.incrementAndGet();
            log.error("[ALERT] Rule cache is stale and the record store is unreachable, skipping sighting {}",
                    event.getSightingId());
            return List.of();
        }
        List<AlertRule> rules = cached.get();
        if (rules.isEmpty()) {
            return List.of();
        }

        HighPriorityStatus priorityStatus = lookupHighPriority(event.getSubjectPersonId());
        List<AlertInstance> created = new ArrayList<>();

        for (AlertRule rule : rules) {
            rulesEvaluated.incrementAndGet();
            try {
                if (!evaluator.matches(rule.getTriggerConditions(), event, priorityStatus.isHighPriority())) {
                    continue;
                }
                createInstance(rule, event, priorityStatus).ifPresent(created::add);
            } catch (RuntimeException e) {
                ruleEvaluationErrors.incrementAndGet();
                log.error("[ALERT] Rule {} failed for sighting {}", rule.getId(), event.getSightingId(), e);
            }
        }

        for (AlertInstance instance : created) {
            deliverAndAnnounce(instance);
        }
        return created;
    }

    public AlertInstance acknowledge(String alertId, String acknowledgedBy) {
        AlertInstance instance = find(alertId);
        synchronized (instance) {
            if (instance.getStatus() == AlertStatus.RESOLVED) {
                throw new IllegalStateException("Alert " + alertId + " is already resolved");
            }
            if (instance.getStatus() == AlertStatus.ACKNOWLEDGED) {
                return instance;
            }
            instance.setStatus(AlertStatus.ACKNOWLEDGED);
            instance.setAcknowledgedAt(clock.instant());
            instance.setAcknowledgedBy(acknowledgedBy);
            repository.save(instance);
        }
        activeInstances.remove(alertId, instance);
        log.info("[ALERT] Alert {} acknowledged by {}", alertId, acknowledgedBy);
        publisher.publishAlertAcknowledged(instance);
        return instance;
    }

    public AlertInstance resolve(String alertId, String resolvedBy) {
        AlertInstance instance = find(alertId);
        synchronized (instance) {
            if (instance.getStatus() == AlertStatus.RESOLVED) {
                return instance;
            }
            instance.setStatus(AlertStatus.RESOLVED);
            instance.setResolvedAt(clock.instant());
            instance.setResolvedBy(resolvedBy);
            repository.save(instance);
        }
        activeInstances.remove(alertId, instance);
        log.info("[ALERT] Alert {} resolved by {}", alertId, resolvedBy);
        publisher.publishAlertResolved(instance);
        return instance;
    }

    /**
     * Raise every still-triggered instance whose escalation deadline has
     * passed. Each instance escalates at most once.
     *
     * @return the escalation instances created
     */
    public List<AlertInstance> escalateDue() {
        Instant now = clock.instant();
        List<AlertInstance> raised = new ArrayList<>();

        for (AlertInstance original : new ArrayList<>(activeInstances.values())) {
            AlertInstance escalation;
            synchronized (original) {
                if (!isEscalationDue(original, now)) {
                    continue;
                }
                original.setEscalated(true);
                try {
                    escalation = repository.save(buildEscalation(original, now));
                } catch (DataAccessException e) {
                    original.setEscalated(false);
                    log.error("[ALERT] Could not persist escalation of {}, retrying next tick: {}",
                            original.getId(), e.getMessage());
                    continue;
                }
                try {
                    repository.save(original);
                } catch (DataAccessException e) {
                    // the escalation exists, so it is still delivered
                    log.warn("[ALERT] Escalation {} saved but the escalated flag on {} was not: {}",
                            escalation.getId(), original.getId(), e.getMessage());
                }
            }
            activeInstances.put(escalation.getId(), escalation);
            escalations.incrementAndGet();
            log.warn("[ALERT] Alert {} unacknowledged for {} min, escalated to {} as {}", original.getId(),
                    original.getEscalationMinutes(), escalation.getPriority(), escalation.getId());
            raised.add(escalation);
        }

        raised.forEach(this::deliverAndAnnounce);
        return raised;
    }

    /**
     * Resolve triggered instances older than their rule's auto-resolve window.
     */
    public int autoResolveDue() {
        Instant now = clock.instant();
        int count = 0;
        for (AlertInstance instance : new ArrayList<>(activeInstances.values())) {
            Integer minutes = instance.getAutoResolveMinutes();
            if (minutes == null || instance.getStatus() != AlertStatus.TRIGGERED) {
                continue;
            }
            if (!now.isBefore(instance.getTriggeredAt().plus(Duration.ofMinutes(minutes)))) {
                resolve(instance.getId(), SYSTEM_ACTOR);
                autoResolved.incrementAndGet();
                count++;
            }
        }
        return count;
    }

    /**
     * Drop cooldown marks that can no longer suppress anything and pair locks
     * nobody holds. A dropped mark is rebuilt from the repository if needed.
     */
    public void pruneIdleState() {
        Instant now = clock.instant();
        Duration horizon = Duration.ofMinutes(longestCooldownMinutes());
        lastTriggered.entrySet().removeIf(entry -> !now.isBefore(entry.getValue().plus(horizon)));
        pairLocks.forEach((key, lock) -> {
            if (lock.tryLock()) {
                try {
                    if (!lock.hasQueuedThreads()) {
                        pairLocks.remove(key, lock);
                    }
                } finally {
                    lock.unlock();
                }
            }
        });
    }

    int trackedCooldowns() {
        return lastTriggered.size();
    }

    int pairLockCount() {
        return pairLocks.size();
    }

    public AlertInstance get(String alertId) {
        return find(alertId);
    }

    public List<AlertInstance> findAll(AlertStatus status, int limit) {
        PageRequest page = PageRequest.of(0, Math.max(1, limit), Sort.by(Sort.Direction.DESC, "triggeredAt"));
        if (status == null) {
            return repository.findAll(page).getContent();
        }
        return repository.findByStatus(status, page).getContent();
    }

    public AlertEngineStats stats() {
        int pending = (int) activeInstances.values().stream()
                .filter(i -> i.getStatus() == AlertStatus.TRIGGERED && !i.isEscalated() && i.getEscalationMinutes() != null)
                .count();
        return AlertEngineStats.builder()
                .sightingsProcessed(sightingsProcessed.get())
                .rulesEvaluated(rulesEvaluated.get())
                .alertsTriggered(alertsTriggered.get())
                .suppressedByCooldown(suppressedByCooldown.get())
                .rateLimited(rateLimited.get())
                .escalations(escalations.get())
                .autoResolved(autoResolved.get())
                .notificationsSent(notificationsSent.get())
                .ruleStoreFailures(ruleStoreFailures.get())
                .ruleEvaluationErrors(ruleEvaluationErrors.get())
                .activeAlerts(activeInstances.size())
                .pendingEscalations(pending)
                .cachedRules(ruleCache.size())
                .rulesRefreshedAt(ruleCache.getLastRefreshAt())
                .build();
    }

    private Optional<AlertInstance> createInstance(AlertRule rule, RecognitionEvent event,
            HighPriorityStatus priorityStatus) {
        String subject = event.getSubjectPersonId();
        String key = pairKey(rule.getId(), subject);
        ReentrantLock lock = lockPair(key);
        try {
            Instant now = clock.instant();
            if (inCooldown(rule, key, subject, now)) {
                suppressedByCooldown.incrementAndGet();
                log.debug("[ALERT] Rule {} for {} suppressed by cooldown", rule.getId(), subjectLabel(subject));
                return Optional.empty();
            }
            if (!hourlyLimiter.tryAcquire(rule.getId(), maxAlertsPerRulePerHour, now)) {
                rateLimited.incrementAndGet();
                log.warn("[ALERT] Rule {} hit {} alerts/hour, dropping alert for {}", rule.getId(),
                        maxAlertsPerRulePerHour, subjectLabel(subject));
                return Optional.empty();
            }

            AlertInstance instance = repository.save(buildInstance(rule, event, priorityStatus, now));
            lastTriggered.put(key, now);
            activeInstances.put(instance.getId(), instance);
            alertsTriggered.incrementAndGet();
            log.info("[ALERT] Rule '{}' triggered {} alert {} for {}", rule.getRuleName(), instance.getPriority(),
                    instance.getId(), subjectLabel(subject));
            return Optional.of(instance);
        } finally {
            lock.unlock();
        }
    }

    private ReentrantLock lockPair(String key) {
        while (true) {
            ReentrantLock lock = pairLocks.computeIfAbsent(key, k -> new ReentrantLock());
            lock.lock();
            // pruned between lookup and lock
            if (pairLocks.get(key) == lock) {
                return lock;
            }
            lock.unlock();
        }
    }

    private int longestCooldownMinutes() {
        int longest = defaultCooldownMinutes;
        for (AlertRule rule : ruleCache.cachedRules()) {
            if (rule.getCooldownMinutes() != null) {
                longest = Math.max(longest, rule.getCooldownMinutes());
            }
        }
        return longest;
    }

    private boolean inCooldown(AlertRule rule, String key, String subject, Instant now) {
        int cooldown = rule.getCooldownMinutes() != null ? rule.getCooldownMinutes() : defaultCooldownMinutes;
        if (cooldown <= 0) {
            return false;
        }
        Instant last = lastTriggered.get(key);
        if (last == null) {
            last = newestPersisted(rule.getId(), subject);
            if (last != null) {
                lastTriggered.put(key, last);
            }
        }
        return last != null && now.isBefore(last.plus(Duration.ofMinutes(cooldown)));
    }

    private Instant newestPersisted(String ruleId, String subject) {
        try {
            return repository.findFirstByRuleIdAndSubjectPersonIdOrderByTriggeredAtDesc(ruleId, subject)
                    .map(AlertInstance::getTriggeredAt)
                    .orElse(null);
        } catch (DataAccessException e) {
            log.warn("[ALERT] Cooldown lookup for rule {} failed: {}", ruleId, e.getMessage());
            return null;
        }
    }

    private AlertInstance buildInstance(AlertRule rule, RecognitionEvent event, HighPriorityStatus priorityStatus,
            Instant now) {
        boolean highPriority = priorityStatus.isHighPriority();
        AlertPriority priority = highPriority
                ? AlertPriority.max(rule.getPriority(), priorityStatus.getPriority())
                : rule.getPriority();

        Set<String> channels = new LinkedHashSet<>(rule.getNotificationChannels());
        if (highPriority) {
            channels.addAll(HIGH_PRIORITY_CHANNELS);
        }

        Map<String, Object> payload = triggerPayload(rule, event, priority, now);
        if (highPriority && priorityStatus.getAlertReason() != null) {
            payload.put("alert_reason", priorityStatus.getAlertReason());
        }

        return AlertInstance.builder()
                .ruleId(rule.getId())
                .ruleName(rule.getRuleName())
                .subjectPersonId(event.getSubjectPersonId())
                .priority(priority)
                .status(AlertStatus.TRIGGERED)
                .message(renderMessage(rule, payload))
                .triggerPayload(payload)
                .notificationChannels(new ArrayList<>(channels))
                .triggeredAt(now)
                .escalationMinutes(rule.getEscalationMinutes())
                .autoResolveMinutes(rule.getAutoResolveMinutes())
                .highPrioritySubject(highPriority)
                .build();
    }

    private static Map<String, Object> triggerPayload(AlertRule rule, RecognitionEvent event, AlertPriority priority,
            Instant now) {
        Map<String, Object> payload = new HashMap<>();
        payload.put("rule_name", rule.getRuleName());
        payload.put("priority", priority.getValue());
        payload.put("person_id", subjectLabel(event.getSubjectPersonId()));
        payload.put("sighting_id", event.getSightingId());
        payload.put("camera_id", event.getCameraId());
        payload.put("location_id", event.getLocationId());
        payload.put("confidence", event.getConfidence());
        payload.put("triggered_at", now.toString());
        if (event.getObservedAt() != null) {
            payload.put("observed_at", event.getObservedAt().toString());
        }
        PersonMatch match = event.getMatch();
        if (match != null) {
            payload.put("max_similarity", match.getMaxSimilarity());
            payload.put("avg_similarity", match.getAvgSimilarity());
            payload.put("matching_embeddings", match.getMatchingEmbeddingCount());
            payload.put("total_embeddings", match.getTotalEmbeddingCount());
        }
        payload.values().removeIf(Objects::isNull);
        return payload;
    }

    private static String renderMessage(AlertRule rule, Map<String, Object> payload) {
        if (rule.getNotificationTemplate() != null && !rule.getNotificationTemplate().isBlank()) {
            return MessageTemplates.render(rule.getNotificationTemplate(), payload);
        }
        return MessageTemplates.render("{rule_name}: {person_id} seen on camera {camera_id}", payload);
    }

    private AlertInstance buildEscalation(AlertInstance original, Instant now) {
        Set<String> channels = new LinkedHashSet<>(original.getNotificationChannels());
        channels.add(ChannelType.DASHBOARD.getValue());

        Map<String, Object> payload = new HashMap<>(original.getTriggerPayload());
        payload.put("escalated_from", original.getId());
        payload.put("priority", original.getPriority().escalate().getValue());

        return AlertInstance.builder()
                .ruleId(original.getRuleId())
                .ruleName(original.getRuleName())
                .subjectPersonId(original.getSubjectPersonId())
                .priority(original.getPriority().escalate())
                .status(AlertStatus.TRIGGERED)
                .message("ESCALATED: " + original.getMessage())
                .triggerPayload(payload)
                .notificationChannels(new ArrayList<>(channels))
                .triggeredAt(now)
                .autoResolveMinutes(original.getAutoResolveMinutes())
                .highPrioritySubject(original.isHighPrioritySubject())
                .escalatedFromId(original.getId())
                .build();
    }

    private static boolean isEscalationDue(AlertInstance instance, Instant now) {
        Integer minutes = instance.getEscalationMinutes();
        return minutes != null
                && instance.getStatus() == AlertStatus.TRIGGERED
                && !instance.isEscalated()
                && !now.isBefore(instance.getTriggeredAt().plus(Duration.ofMinutes(minutes)));
    }

    /**
     * Deliver over the instance's channels, record the confirmed count, and
     * announce it on the dashboard relay unless the dashboard channel already did.
     */
    private void deliverAndAnnounce(AlertInstance instance) {
        DeliveryReport report;
        try {
            report = dispatcher.deliver(instance);
        } catch (RuntimeException e) {
            log.error("[ALERT] Delivery of alert {} failed", instance.getId(), e);
            report = new DeliveryReport(0, 0, false);
        }
        notificationsSent.addAndGet(report.confirmed());

        if (report.confirmed() > 0) {
            synchronized (instance) {
                instance.setNotificationCount(instance.getNotificationCount() + report.confirmed());
                try {
                    repository.save(instance);
                } catch (DataAccessException e) {
                    log.warn("[ALERT] Could not record notification count for {}: {}", instance.getId(), e.getMessage());
                }
            }
        }
        if (!report.dashboardDelivered()) {
            publisher.publishAlert(instance);
        }
    }

    private HighPriorityStatus lookupHighPriority(String personId) {
        if (personId == null) {
            return HighPriorityStatus.notHighPriority(null);
        }
        try {
            return recordStoreClient.checkHighPriority(personId);
        } catch (UpstreamUnavailableException | RecordStoreException e) {
            log.warn("[ALERT] High-priority check for {} failed, treating as normal: {}", personId, e.getMessage());
            return HighPriorityStatus.notHighPriority(personId);
        }
    }

    private AlertInstance find(String alertId) {
        AlertInstance active = activeInstances.get(alertId);
        if (active != null) {
            return active;
        }
        AlertInstance stored = repository.findById(alertId)
                .orElseThrow(() -> new AlertInstanceNotFoundException(alertId));
        if (stored.getStatus() != AlertStatus.TRIGGERED) {
            return stored;
        }
        AlertInstance existing = activeInstances.putIfAbsent(alertId, stored);
        return existing != null ? existing : stored;
    }

    private static String pairKey(String ruleId, String subject) {
        return ruleId + "|" + subjectLabel(subject);
    }

    private static String subjectLabel(String subject) {
        return subject != null ? subject : UNKNOWN_SUBJECT;
    }
}
