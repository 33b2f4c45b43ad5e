package com.shlawgathon.faceguard.backend.websocket;

import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.databind.PropertyNamingStrategies;
import com.fasterxml.jackson.databind.annotation.JsonNaming;
import com.shlawgathon.faceguard.backend.model.AlertInstance;
import com.shlawgathon.faceguard.backend.model.AlertStatus;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.time.Instant;

/**
 * {@code alert_acknowledged} or {@code alert_resolved}.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
@JsonInclude(JsonInclude.Include.NON_NULL)
@JsonNaming(PropertyNamingStrategies.SnakeCaseStrategy.class)
public class AlertStatusMessage implements RealtimeMessage {

    private String type;
    private String alertId;
    private AlertStatus status;
    private Instant acknowledgedAt;
    private String acknowledgedBy;
    private Instant resolvedAt;
    private String resolvedBy;

    public static AlertStatusMessage acknowledged(AlertInstance instance) {
        return AlertStatusMessage.builder()
                .type("alert_acknowledged")
                .alertId(instance.getId())
                .status(instance.getStatus())
                .acknowledgedAt(instance.getAcknowledgedAt())
                .acknowledgedBy(instance.getAcknowledgedBy())
                .build();
    }

    public static AlertStatusMessage resolved(AlertInstance instance) {
        return AlertStatusMessage.builder()
                .type("alert_resolved")
                .alertId(instance.getId())
                .status(instance.getStatus())
                .resolvedAt(instance.getResolvedAt())
                .resolvedBy(instance.getResolvedBy())
                .build();
    }
}
