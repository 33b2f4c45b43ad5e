package com.shlawgathon.faceguard.backend.model;

import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.databind.PropertyNamingStrategies;
import com.fasterxml.jackson.databind.annotation.JsonNaming;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.Map;

/**
 * One delivery attempt, appended to the record store's notification log.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
@JsonInclude(JsonInclude.Include.NON_NULL)
@JsonNaming(PropertyNamingStrategies.SnakeCaseStrategy.class)
public class NotificationLogEntry {

    private String alertId;
    private String channelId;
    private String subject;
    private String message;
    private String recipient;
    private String priority;
    private String deliveryId;
    private Map<String, Object> deliveryOptions;
}
