package com.shlawgathon.faceguard.backend.model;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.ArrayList;
import java.util.List;

/**
 * Identity decision for one query: the winning person and how strongly their
 * embeddings matched.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class PersonMatch {

    private String personId;
    private double maxSimilarity;
    private double avgSimilarity;
    private int matchingEmbeddingCount;
    private int totalEmbeddingCount;

    @Builder.Default
    private List<String> embeddingIds = new ArrayList<>();
}
