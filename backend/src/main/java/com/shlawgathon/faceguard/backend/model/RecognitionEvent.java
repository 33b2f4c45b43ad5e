package com.shlawgathon.faceguard.backend.model;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.time.Instant;
import java.util.HashMap;
import java.util.Map;

/**
 * One sighting after identity resolution, as seen by the alert engine.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class RecognitionEvent {

    private String sightingId;
    private String cameraId;
    private String locationId;
    private Instant observedAt;

    // null when the face did not match anyone
    private PersonMatch match;

    // match similarity for a known face, detector confidence otherwise
    private double confidence;

    @Builder.Default
    private Map<String, Object> metadata = new HashMap<>();

    public boolean isUnknown() {
        return match == null;
    }

    public String getSubjectPersonId() {
        return match != null ? match.getPersonId() : null;
    }
}
