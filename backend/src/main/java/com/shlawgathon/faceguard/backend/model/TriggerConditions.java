package com.shlawgathon.faceguard.backend.model;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.databind.PropertyNamingStrategies;
import com.fasterxml.jackson.databind.annotation.JsonNaming;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.ArrayList;
import java.util.List;

/**
 * Conditions an alert rule places on a sighting. Every condition that is set
 * must hold; unset conditions are ignored.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
@JsonInclude(JsonInclude.Include.NON_NULL)
@JsonIgnoreProperties(ignoreUnknown = true)
@JsonNaming(PropertyNamingStrategies.SnakeCaseStrategy.class)
public class TriggerConditions {

    // Subject filters
    @Builder.Default
    private List<String> personIds = new ArrayList<>();

    @Builder.Default
    private List<String> excludedPersons = new ArrayList<>();

    private Boolean anyPerson;
    private Boolean unknownPerson;
    private Boolean highPriorityOnly;

    // Where
    @Builder.Default
    private List<String> cameraIds = new ArrayList<>();

    @Builder.Default
    private List<String> locationIds = new ArrayList<>();

    // Match strength
    private Double confidenceMin;
    private Double confidenceMax;
    private Integer minMatchingEmbeddings;
    private Double minAvgSimilarity;

    // When
    @Builder.Default
    private List<TimeRange> timeRanges = new ArrayList<>();
}
