package com.shlawgathon.faceguard.backend.websocket;

import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.databind.PropertyNamingStrategies;
import com.fasterxml.jackson.databind.annotation.JsonNaming;
import com.shlawgathon.faceguard.backend.model.RecognitionEvent;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.time.Instant;
import java.util.Map;

@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
@JsonNaming(PropertyNamingStrategies.SnakeCaseStrategy.class)
public class PersonSightingMessage implements RealtimeMessage {

    @Builder.Default
    private String type = "person_sighting";

    private Sighting sighting;

    public static PersonSightingMessage from(RecognitionEvent event) {
        return PersonSightingMessage.builder()
                .sighting(Sighting.builder()
                        .sightingId(event.getSightingId())
                        .personId(event.getSubjectPersonId())
                        .known(!event.isUnknown())
                        .cameraId(event.getCameraId())
                        .locationId(event.getLocationId())
                        .confidenceScore(event.getConfidence())
                        .matchingEmbeddings(event.isUnknown() ? null : event.getMatch().getMatchingEmbeddingCount())
                        .observedAt(event.getObservedAt())
                        .metadata(event.getMetadata())
                        .build())
                .build();
    }

    @Data
    @Builder
    @NoArgsConstructor
    @AllArgsConstructor
    @JsonInclude(JsonInclude.Include.NON_NULL)
    @JsonNaming(PropertyNamingStrategies.SnakeCaseStrategy.class)
    public static class Sighting {
        private String sightingId;
        private String personId;
        private boolean known;
        private String cameraId;
        private String locationId;
        private double confidenceScore;
        private Integer matchingEmbeddings;
        private Instant observedAt;
        private Map<String, Object> metadata;
    }
}
