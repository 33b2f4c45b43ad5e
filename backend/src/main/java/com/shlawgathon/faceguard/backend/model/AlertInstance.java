package com.shlawgathon.faceguard.backend.model;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;
import org.springframework.data.annotation.Id;
import org.springframework.data.mongodb.core.index.CompoundIndex;
import org.springframework.data.mongodb.core.index.Indexed;
import org.springframework.data.mongodb.core.mapping.Document;

import java.time.Instant;
import java.util.ArrayList;
import java.util.HashMap;
import java.util.List;
import java.util.Map;

/**
 * A fired alert. Instances are never deleted; they only move forward through
 * TRIGGERED, ACKNOWLEDGED and RESOLVED.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
@Document(collection = "alert_instances")
@CompoundIndex(name = "rule_subject_triggered", def = "{'ruleId': 1, 'subjectPersonId': 1, 'triggeredAt': -1}")
public class AlertInstance {

    @Id
    private String id;

    @Indexed
    private String ruleId;

    private String ruleName;

    // null for an unknown face
    private String subjectPersonId;

    private AlertPriority priority;

    @Indexed
    @Builder.Default
    private AlertStatus status = AlertStatus.TRIGGERED;

    private String message;

    @Builder.Default
    private Map<String, Object> triggerPayload = new HashMap<>();

    @Builder.Default
    private List<String> notificationChannels = new ArrayList<>();

    // Lifecycle
    private Instant triggeredAt;
    private Instant acknowledgedAt;
    private String acknowledgedBy;
    private Instant resolvedAt;
    private String resolvedBy;

    @Builder.Default
    private int notificationCount = 0;

    // subject was on the high-priority list when the alert fired
    @Builder.Default
    private boolean highPrioritySubject = false;

    // Escalation
    private Integer escalationMinutes;
    private Integer autoResolveMinutes;

    @Builder.Default
    private boolean escalated = false;

    private String escalatedFromId;
}
