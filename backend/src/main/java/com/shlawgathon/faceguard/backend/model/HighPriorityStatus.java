package com.shlawgathon.faceguard.backend.model;

import com.fasterxml.jackson.annotation.JsonIgnore;
import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonProperty;
import com.fasterxml.jackson.databind.PropertyNamingStrategies;
import com.fasterxml.jackson.databind.annotation.JsonNaming;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

/**
 * Answer of the record store's high-priority person check.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
@JsonIgnoreProperties(ignoreUnknown = true)
@JsonNaming(PropertyNamingStrategies.SnakeCaseStrategy.class)
public class HighPriorityStatus {

    private String personId;

    @JsonProperty("is_high_priority")
    private boolean highPriority;

    private String priorityLevel;
    private String alertReason;
    private String escalationChannels;

    public static HighPriorityStatus notHighPriority(String personId) {
        return HighPriorityStatus.builder().personId(personId).highPriority(false).build();
    }

    @JsonIgnore
    public AlertPriority getPriority() {
        return AlertPriority.parseOrDefault(priorityLevel, AlertPriority.HIGH);
    }
}
