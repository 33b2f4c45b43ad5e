package com.shlawgathon.faceguard.backend.model;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonProperty;
import com.fasterxml.jackson.databind.PropertyNamingStrategies;
import com.fasterxml.jackson.databind.annotation.JsonNaming;
import jakarta.validation.Valid;
import jakarta.validation.constraints.Max;
import jakarta.validation.constraints.Min;
import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.NotNull;
import jakarta.validation.constraints.Size;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.ArrayList;
import java.util.List;

/**
 * Alert rule as stored by the record store.
 * <p>
 * {@code notificationChannels} holds channel IDs from the record store or
 * channel type names ({@code email}, {@code sms}, {@code webhook},
 * {@code dashboard}).
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
@JsonInclude(JsonInclude.Include.NON_NULL)
@JsonIgnoreProperties(ignoreUnknown = true)
@JsonNaming(PropertyNamingStrategies.SnakeCaseStrategy.class)
public class AlertRule {

    private String id;

    @NotBlank
    @Size(max = 200)
    private String ruleName;

    @Size(max = 500)
    private String description;

    @JsonProperty("is_active")
    @Builder.Default
    private boolean active = true;

    @NotNull
    @Builder.Default
    private AlertPriority priority = AlertPriority.MEDIUM;

    @Valid
    @NotNull
    @Builder.Default
    private TriggerConditions triggerConditions = new TriggerConditions();

    @Min(0)
    @Max(1440)
    private Integer cooldownMinutes;

    @Min(1)
    private Integer escalationMinutes;

    @Min(1)
    private Integer autoResolveMinutes;

    @Builder.Default
    private List<String> notificationChannels = new ArrayList<>();

    @Size(max = 1000)
    private String notificationTemplate;

    // kept verbatim, the record store emits zone-less timestamps
    private String createdAt;
    private String updatedAt;
}
