package com.shlawgathon.faceguard.backend.dto;

import com.fasterxml.jackson.annotation.JsonIgnore;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.time.Instant;
import java.util.LinkedHashMap;
import java.util.Map;

@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class HealthResponse {

    public static final String HEALTHY = "healthy";
    public static final String DEGRADED = "degraded";

    private String status;
    private Instant timestamp;

    // component name -> healthy/degraded
    @Builder.Default
    private Map<String, String> components = new LinkedHashMap<>();

    @JsonIgnore
    public boolean isHealthy() {
        return HEALTHY.equals(status);
    }
}
