package com.shlawgathon.faceguard.backend.service;

import com.shlawgathon.faceguard.backend.client.RecordStoreClient;
import com.shlawgathon.faceguard.backend.client.RecordStoreException;
import com.shlawgathon.faceguard.backend.client.UpstreamUnavailableException;
import com.shlawgathon.faceguard.backend.delivery.DeliveryResult;
import com.shlawgathon.faceguard.backend.delivery.NotificationSender;
import com.shlawgathon.faceguard.backend.delivery.OutboundNotification;
import com.shlawgathon.faceguard.backend.model.AlertInstance;
import com.shlawgathon.faceguard.backend.model.ChannelType;
import com.shlawgathon.faceguard.backend.model.NotificationChannel;
import com.shlawgathon.faceguard.backend.model.NotificationContact;
import com.shlawgathon.faceguard.backend.model.NotificationLogEntry;
import jakarta.annotation.PreDestroy;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Service;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.EnumMap;
import java.util.HashMap;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.RejectedExecutionException;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicLong;

/**
 * Delivers one alert over each of its targets. Targets are isolated from each
 * other: a failing, rate-limited or circuit-broken channel never stops the rest.
 */
@Service
public class NotificationDispatcher {

    private static final Logger log = LoggerFactory.getLogger(NotificationDispatcher.class);

    private final Map<ChannelType, NotificationSender> senders = new EnumMap<>(ChannelType.class);
    private final Map<ChannelType, CircuitBreaker> breakers = new EnumMap<>(ChannelType.class);
    private final SlidingWindowRateLimiter rateLimiter = new SlidingWindowRateLimiter(Duration.ofMinutes(1));
    private final RecordStoreClient recordStoreClient;
    private final Clock clock;
    private final int defaultRateLimitPerMinute;
    private final ExecutorService logExecutor;

    private final AtomicLong sent = new AtomicLong();
    private final AtomicLong failed = new AtomicLong();
    private final AtomicLong rateLimited = new AtomicLong();
    private final AtomicLong circuitOpen = new AtomicLong();

    public NotificationDispatcher(List<NotificationSender> senderBeans,
            RecordStoreClient recordStoreClient,
            Clock clock,
            @Value("${faceguard.delivery.rate-limit-per-minute:60}") int defaultRateLimitPerMinute,
            @Value("${faceguard.delivery.circuit-breaker.failure-threshold:5}") int failureThreshold,
            @Value("${faceguard.delivery.circuit-breaker.open-duration:PT5M}") Duration openDuration) {
        for (NotificationSender sender : senderBeans) {
            senders.put(sender.channelType(), sender);
        }
        for (ChannelType type : ChannelType.values()) {
            breakers.put(type, new CircuitBreaker(failureThreshold, openDuration));
        }
        this.recordStoreClient = recordStoreClient;
        this.clock = clock;
        this.defaultRateLimitPerMinute = defaultRateLimitPerMinute;
        this.logExecutor = Executors.newSingleThreadExecutor(r -> {
            Thread t = new Thread(r, "notification-log");
            t.setDaemon(true);
            return t;
        });
    }

    @PreDestroy
    public void shutdown() {
        logExecutor.shutdown();
        try {
            if (!logExecutor.awaitTermination(5, TimeUnit.SECONDS)) {
                logExecutor.shutdownNow();
            }
        } catch (InterruptedException e) {
            logExecutor.shutdownNow();
            Thread.currentThread().interrupt();
        }
    }

    /**
     * Deliver an alert to every target resolved from its channels, plus the
     * subject's personal contacts when the subject is high priority.
     */
    public DeliveryReport deliver(AlertInstance alert) {
        List<DeliveryTarget> targets = resolveTargets(alert);
        int confirmed = 0;
        boolean dashboardDelivered = false;

        for (DeliveryTarget target : targets) {
            if (deliverTo(alert, target)) {
                confirmed++;
                if (target.type() == ChannelType.DASHBOARD) {
                    dashboardDelivered = true;
                }
            }
        }
        log.info("[DELIVERY] Alert {} delivered on {}/{} targets", alert.getId(), confirmed, targets.size());
        return new DeliveryReport(targets.size(), confirmed, dashboardDelivered);
    }

    public CircuitBreaker.State breakerState(ChannelType type) {
        return breakers.get(type).getState();
    }

    public Map<String, Object> stats() {
        Map<String, Object> stats = new LinkedHashMap<>();
        stats.put("notificationsSent", sent.get());
        stats.put("notificationsFailed", failed.get());
        stats.put("rateLimited", rateLimited.get());
        stats.put("circuitOpenSkips", circuitOpen.get());
        Map<String, String> states = new LinkedHashMap<>();
        breakers.forEach((type, breaker) -> states.put(type.getValue(), breaker.getState().name()));
        stats.put("circuitBreakers", states);
        return stats;
    }

    private boolean deliverTo(AlertInstance alert, DeliveryTarget target) {
        Instant now = clock.instant();
        CircuitBreaker breaker = breakers.get(target.type());
        if (!breaker.allowRequest(now)) {
            circuitOpen.incrementAndGet();
            log.warn("[DELIVERY] {} circuit open, skipping {} for alert {}", target.type(), target.channelId(), alert.getId());
            return false;
        }
        if (!rateLimiter.tryAcquire(target.channelId(), target.rateLimitPerMinute(), now)) {
            rateLimited.incrementAndGet();
            log.warn("[DELIVERY] Channel {} over {}/min, skipping alert {}", target.channelId(),
                    target.rateLimitPerMinute(), alert.getId());
            return false;
        }

        NotificationSender sender = senders.get(target.type());
        OutboundNotification notification = new OutboundNotification(alert, target.recipient(),
                target.configuration(), subjectLine(alert), target.message());
        DeliveryResult result;
        if (sender == null) {
            result = DeliveryResult.failed("no sender for " + target.type().getValue());
        } else {
            try {
                result = sender.send(notification);
            } catch (RuntimeException e) {
                log.error("[DELIVERY] {} sender threw for alert {}", target.type(), alert.getId(), e);
                result = DeliveryResult.failed(e.getMessage());
            }
        }

        if (result.success()) {
            breaker.recordSuccess();
            sent.incrementAndGet();
        } else {
            breaker.recordFailure(clock.instant());
            failed.incrementAndGet();
            log.warn("[DELIVERY] {} delivery of alert {} to {} failed: {}", target.type(), alert.getId(),
                    target.channelId(), result.error());
        }
        appendLog(alert, target, notification, result);
        return result.success();
    }

    private List<DeliveryTarget> resolveTargets(AlertInstance alert) {
        Map<String, DeliveryTarget> targets = new LinkedHashMap<>();
        List<NotificationChannel> channels = null;

        for (String reference : alert.getNotificationChannels()) {
            Optional<ChannelType> byType = ChannelType.parse(reference);
            if (byType.isPresent() && byType.get() == ChannelType.DASHBOARD) {
                addTarget(targets, new DeliveryTarget("dashboard", ChannelType.DASHBOARD, null, Map.of(),
                        Integer.MAX_VALUE, alert.getMessage()));
                continue;
            }
            if (channels == null) {
                channels = loadChannels();
            }
            if (byType.isPresent()) {
                List<NotificationChannel> ofType = channels.stream()
                        .filter(NotificationChannel::isActive)
                        .filter(c -> c.getType().filter(byType.get()::equals).isPresent())
                        .toList();
                if (ofType.isEmpty()) {
                    // no configured target; the sender reports it as a failed attempt
                    addTarget(targets, new DeliveryTarget(byType.get().getValue(), byType.get(), null, Map.of(),
                            defaultRateLimitPerMinute, alert.getMessage()));
                }
                ofType.forEach(channel -> toTarget(channel, alert).ifPresent(t -> addTarget(targets, t)));
            } else {
                Optional<NotificationChannel> channel = channels.stream()
                        .filter(c -> reference.equals(c.getId()))
                        .findFirst();
                if (channel.isEmpty()) {
                    log.warn("[DELIVERY] Alert {} references unknown channel {}", alert.getId(), reference);
                } else if (channel.get().isActive()) {
                    toTarget(channel.get(), alert).ifPresent(t -> addTarget(targets, t));
                }
            }
        }

        if (alert.isHighPrioritySubject() && alert.getSubjectPersonId() != null) {
            for (NotificationContact contact : loadContacts(alert.getSubjectPersonId())) {
                Optional<ChannelType> type = ChannelType.parse(contact.getContactType());
                if (type.isEmpty() || type.get() == ChannelType.DASHBOARD) {
                    continue;
                }
                String message = contact.getCustomMessageTemplate() != null
                        ? MessageTemplates.render(contact.getCustomMessageTemplate(), alert.getTriggerPayload())
                        : alert.getMessage();
                addTarget(targets, new DeliveryTarget("contact:" + contact.getId(), type.get(),
                        contact.getContactValue(), Map.of(), defaultRateLimitPerMinute, message));
            }
        }
        return new ArrayList<>(targets.values());
    }

    private Optional<DeliveryTarget> toTarget(NotificationChannel channel, AlertInstance alert) {
        Optional<ChannelType> type = channel.getType();
        if (type.isEmpty()) {
            log.debug("[DELIVERY] Channel {} has unsupported type {}", channel.getId(), channel.getChannelType());
            return Optional.empty();
        }
        String recipient = switch (type.get()) {
            case EMAIL -> firstNonNull(channel.configValue("email_address"), channel.configValue("email"));
            case SMS -> firstNonNull(channel.configValue("phone_number"), channel.configValue("phone"));
            case WEBHOOK -> firstNonNull(channel.configValue("url"), channel.configValue("webhook_url"));
            case DASHBOARD -> null;
        };
        int limit = channel.getRateLimitPerMinute() > 0 ? channel.getRateLimitPerMinute() : defaultRateLimitPerMinute;
        Map<String, Object> configuration = channel.getConfiguration() != null ? channel.getConfiguration() : new HashMap<>();
        return Optional.of(new DeliveryTarget(channel.getId(), type.get(), recipient, configuration, limit,
                alert.getMessage()));
    }

    private static void addTarget(Map<String, DeliveryTarget> targets, DeliveryTarget target) {
        targets.putIfAbsent(target.type().getValue() + "|" + target.recipient(), target);
    }

    private List<NotificationChannel> loadChannels() {
        try {
            return recordStoreClient.listChannels();
        } catch (UpstreamUnavailableException | RecordStoreException e) {
            log.warn("[DELIVERY] Could not load notification channels: {}", e.getMessage());
            return List.of();
        }
    }

    private List<NotificationContact> loadContacts(String personId) {
        try {
            return recordStoreClient.getNotificationContacts(personId);
        } catch (UpstreamUnavailableException | RecordStoreException e) {
            log.warn("[DELIVERY] Could not load notification contacts for {}: {}", personId, e.getMessage());
            return List.of();
        }
    }

    private void appendLog(AlertInstance alert, DeliveryTarget target, OutboundNotification notification,
            DeliveryResult result) {
        Map<String, Object> options = new HashMap<>();
        options.put("channel_type", target.type().getValue());
        options.put("success", result.success());
        if (result.error() != null) {
            options.put("error", result.error());
        }
        NotificationLogEntry entry = NotificationLogEntry.builder()
                .alertId(alert.getId())
                .channelId(target.channelId())
                .subject(notification.subject())
                .message(notification.body())
                .recipient(target.recipient())
                .priority(alert.getPriority().getValue())
                .deliveryId(result.deliveryId())
                .deliveryOptions(options)
                .build();
        try {
            logExecutor.execute(() -> {
                try {
                    recordStoreClient.appendNotificationLog(entry);
                } catch (RuntimeException e) {
                    log.debug("[DELIVERY] Notification log append failed for alert {}: {}", alert.getId(), e.getMessage());
                }
            });
        } catch (RejectedExecutionException e) {
            log.debug("[DELIVERY] Notification log executor shut down, dropping entry for {}", alert.getId());
        }
    }

    private static String subjectLine(AlertInstance alert) {
        return "[" + alert.getPriority().name() + "] " + alert.getRuleName();
    }

    private static String firstNonNull(String a, String b) {
        return a != null ? a : b;
    }

    private record DeliveryTarget(String channelId, ChannelType type, String recipient,
            Map<String, Object> configuration, int rateLimitPerMinute, String message) {
    }
}
