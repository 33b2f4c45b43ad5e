package com.shlawgathon.faceguard.backend.dto;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class BatchAddEmbeddingsResponse {

    private int requested;
    private int added;
    private int skipped;
    private boolean snapshotSaved;
}
