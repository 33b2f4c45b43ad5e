package com.shlawgathon.faceguard.backend.websocket;

import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.databind.PropertyNamingStrategies;
import com.fasterxml.jackson.databind.annotation.JsonNaming;
import com.shlawgathon.faceguard.backend.model.AlertInstance;
import com.shlawgathon.faceguard.backend.model.AlertPriority;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.time.Instant;
import java.util.List;
import java.util.Map;

/**
 * A newly triggered (or escalated) alert, with rendering hints for the dashboard.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
@JsonNaming(PropertyNamingStrategies.SnakeCaseStrategy.class)
public class AlertNotificationMessage implements RealtimeMessage {

    @Builder.Default
    private String type = "alert_notification";

    private AlertPayload alert;
    private DashboardDisplay dashboardDisplay;

    public static AlertNotificationMessage from(AlertInstance instance) {
        Map<String, Object> payload = instance.getTriggerPayload();
        return AlertNotificationMessage.builder()
                .alert(AlertPayload.builder()
                        .id(instance.getId())
                        .ruleId(instance.getRuleId())
                        .ruleName(instance.getRuleName())
                        .personId(instance.getSubjectPersonId())
                        .cameraId(text(payload, "camera_id"))
                        .confidenceScore(number(payload, "confidence"))
                        .priority(instance.getPriority())
                        .alertType(instance.getEscalatedFromId() != null ? "escalation" : "rule_match")
                        .triggeredAt(instance.getTriggeredAt())
                        .message(instance.getMessage())
                        .notificationChannels(instance.getNotificationChannels())
                        .escalatedFromId(instance.getEscalatedFromId())
                        .metadata(payload)
                        .build())
                .dashboardDisplay(DashboardDisplay.forPriority(instance.getPriority()))
                .build();
    }

    private static String text(Map<String, Object> payload, String key) {
        Object value = payload != null ? payload.get(key) : null;
        return value != null ? value.toString() : null;
    }

    private static Number number(Map<String, Object> payload, String key) {
        Object value = payload != null ? payload.get(key) : null;
        return value instanceof Number n ? n : null;
    }

    @Data
    @Builder
    @NoArgsConstructor
    @AllArgsConstructor
    @JsonInclude(JsonInclude.Include.NON_NULL)
    @JsonNaming(PropertyNamingStrategies.SnakeCaseStrategy.class)
    public static class AlertPayload {
        private String id;
        private String ruleId;
        private String ruleName;
        private String personId;
        private String cameraId;
        private Number confidenceScore;
        private AlertPriority priority;
        private String alertType;
        private Instant triggeredAt;
        private String message;
        private List<String> notificationChannels;
        private String escalatedFromId;
        private Map<String, Object> metadata;
    }

    @Data
    @Builder
    @NoArgsConstructor
    @AllArgsConstructor
    @JsonNaming(PropertyNamingStrategies.SnakeCaseStrategy.class)
    public static class DashboardDisplay {
        private boolean showPopup;
        private int autoDismissSeconds;
        private boolean soundAlert;
        private String badgeColor;

        public static DashboardDisplay forPriority(AlertPriority priority) {
            return DashboardDisplay.builder()
                    .showPopup(priority == AlertPriority.HIGH || priority == AlertPriority.CRITICAL)
                    .autoDismissSeconds(priority == AlertPriority.LOW ? 30 : 0)
                    .soundAlert(priority == AlertPriority.CRITICAL)
                    .badgeColor(badgeColor(priority))
                    .build();
        }

        static String badgeColor(AlertPriority priority) {
            if (priority == null) {
                return "#6c757d";
            }
            return switch (priority) {
                case LOW -> "#28a745";
                case MEDIUM -> "#ffc107";
                case HIGH -> "#fd7e14";
                case CRITICAL -> "#dc3545";
            };
        }
    }
}
