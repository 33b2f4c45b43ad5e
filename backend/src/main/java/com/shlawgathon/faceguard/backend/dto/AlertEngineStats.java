package com.shlawgathon.faceguard.backend.dto;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.time.Instant;

@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class AlertEngineStats {

    private long sightingsProcessed;
    private long rulesEvaluated;
    private long alertsTriggered;
    private long suppressedByCooldown;
    private long rateLimited;
    private long escalations;
    private long autoResolved;
    private long notificationsSent;
    private long ruleStoreFailures;
    private long ruleEvaluationErrors;
    private int activeAlerts;
    private int pendingEscalations;
    private int cachedRules;
    private Instant rulesRefreshedAt;
}
