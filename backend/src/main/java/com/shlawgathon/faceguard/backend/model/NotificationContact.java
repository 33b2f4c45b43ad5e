package com.shlawgathon.faceguard.backend.model;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.databind.PropertyNamingStrategies;
import com.fasterxml.jackson.databind.annotation.JsonNaming;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

/**
 * Person-specific contact for a high-priority subject.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
@JsonIgnoreProperties(ignoreUnknown = true)
@JsonNaming(PropertyNamingStrategies.SnakeCaseStrategy.class)
public class NotificationContact {

    private String id;
    private String contactName;
    // email, sms, webhook
    private String contactType;
    private String contactValue;
    private String priorityOverride;
    private Integer escalationDelayMinutes;
    private String customMessageTemplate;
}
