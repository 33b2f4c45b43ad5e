package com.shlawgathon.faceguard.backend.dto;

import com.shlawgathon.faceguard.backend.service.EmbeddingIndexService.SnapshotState;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.time.Instant;

/**
 * Index statistics plus snapshot health.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class IndexStatusResponse {

    private int dimension;
    private int indexSize;
    private int activeSize;
    private int uniquePersons;
    private int zeroVectors;
    private SnapshotState snapshotState;
    private Instant lastSnapshotAt;
    private String snapshotDir;
}
