package com.shlawgathon.faceguard.backend.service;

import com.shlawgathon.faceguard.backend.dto.HealthResponse;
import com.shlawgathon.faceguard.backend.websocket.RealtimeHub;
import com.shlawgathon.faceguard.backend.websocket.RealtimeTopic;
import com.shlawgathon.faceguard.backend.websocket.SystemStatusMessage;
import org.springframework.scheduling.annotation.Scheduled;
import org.springframework.stereotype.Service;

import java.time.Clock;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Aggregated health of the index, rule cache, alert engine and realtime hub.
 */
@Service
public class SystemStatusService {

    private final EmbeddingIndexService indexService;
    private final AlertRuleCache ruleCache;
    private final AlertDecisionEngine alertDecisionEngine;
    private final NotificationDispatcher dispatcher;
    private final RealtimeHub hub;
    private final Clock clock;

    public SystemStatusService(EmbeddingIndexService indexService,
            AlertRuleCache ruleCache,
            AlertDecisionEngine alertDecisionEngine,
            NotificationDispatcher dispatcher,
            RealtimeHub hub,
            Clock clock) {
        this.indexService = indexService;
        this.ruleCache = ruleCache;
        this.alertDecisionEngine = alertDecisionEngine;
        this.dispatcher = dispatcher;
        this.hub = hub;
        this.clock = clock;
    }

    public HealthResponse health() {
        Map<String, String> components = new LinkedHashMap<>();
        components.put("index", indexService.isDegraded() ? HealthResponse.DEGRADED : HealthResponse.HEALTHY);
        components.put("alertRules", ruleCache.isDegraded() ? HealthResponse.DEGRADED : HealthResponse.HEALTHY);
        boolean healthy = components.values().stream().allMatch(HealthResponse.HEALTHY::equals);
        return HealthResponse.builder()
                .status(healthy ? HealthResponse.HEALTHY : HealthResponse.DEGRADED)
                .timestamp(clock.instant())
                .components(components)
                .build();
    }

    public SystemStatusMessage currentStatus() {
        Map<String, Object> status = new LinkedHashMap<>();
        status.put("health", health());
        status.put("index", indexService.status());
        status.put("alerts", alertDecisionEngine.stats());
        status.put("delivery", dispatcher.stats());
        status.put("realtime", hub.stats());
        return SystemStatusMessage.builder().status(status).build();
    }

    /**
     * Periodic push of this node's status to its own dashboards on the system topic.
     */
    @Scheduled(fixedDelayString = "${faceguard.realtime.status-broadcast-interval:PT30S}")
    public void broadcastStatus() {
        if (hub.activeConnections() > 0) {
            hub.broadcast(currentStatus(), RealtimeTopic.SYSTEM);
        }
    }
}
