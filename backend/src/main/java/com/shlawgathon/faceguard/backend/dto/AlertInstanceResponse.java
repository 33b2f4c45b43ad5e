package com.shlawgathon.faceguard.backend.dto;

import com.shlawgathon.faceguard.backend.model.AlertPriority;
import com.shlawgathon.faceguard.backend.model.AlertStatus;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.time.Instant;
import java.util.List;
import java.util.Map;

@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class AlertInstanceResponse {

    private String id;
    private String ruleId;
    private String ruleName;
    private String subjectPersonId;
    private AlertPriority priority;
    private AlertStatus status;
    private String message;
    private Map<String, Object> triggerPayload;
    private List<String> notificationChannels;
    private Instant triggeredAt;
    private Instant acknowledgedAt;
    private String acknowledgedBy;
    private Instant resolvedAt;
    private String resolvedBy;
    private int notificationCount;
    private boolean escalated;
    private String escalatedFromId;
}
