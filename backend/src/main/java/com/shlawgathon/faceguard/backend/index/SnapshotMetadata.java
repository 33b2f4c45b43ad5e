package com.shlawgathon.faceguard.backend.index;

import com.fasterxml.jackson.databind.PropertyNamingStrategies;
import com.fasterxml.jackson.databind.annotation.JsonNaming;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.time.Instant;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Sidecar document written next to the vector blob.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
@JsonNaming(PropertyNamingStrategies.SnakeCaseStrategy.class)
public class SnapshotMetadata {

    private int dimension;
    private int totalVectors;

    // position -> owner
    @Builder.Default
    private Map<String, EntryRef> idMap = new LinkedHashMap<>();

    @Builder.Default
    private Map<String, List<Integer>> personEmbeddings = new LinkedHashMap<>();

    @Builder.Default
    private List<Integer> inactivePositions = new ArrayList<>();

    @Builder.Default
    private List<Integer> zeroPositions = new ArrayList<>();

    private Instant createdAt;

    @Data
    @NoArgsConstructor
    @AllArgsConstructor
    @JsonNaming(PropertyNamingStrategies.SnakeCaseStrategy.class)
    public static class EntryRef {
        private String personId;
        private String embeddingId;
    }
}
