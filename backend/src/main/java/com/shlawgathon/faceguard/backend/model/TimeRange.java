package com.shlawgathon.faceguard.backend.model;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.databind.PropertyNamingStrategies;
import com.fasterxml.jackson.databind.annotation.JsonNaming;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

/**
 * Hour-of-day window in UTC with both ends inclusive. A window whose end is
 * before its start wraps past midnight.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
@JsonIgnoreProperties(ignoreUnknown = true)
@JsonNaming(PropertyNamingStrategies.SnakeCaseStrategy.class)
public class TimeRange {

    private int startHour;

    @Builder.Default
    private int endHour = 23;

    public boolean contains(int hour) {
        if (startHour <= endHour) {
            return hour >= startHour && hour <= endHour;
        }
        return hour >= startHour || hour <= endHour;
    }
}
