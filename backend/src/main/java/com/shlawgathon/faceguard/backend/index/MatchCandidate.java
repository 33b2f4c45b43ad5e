package com.shlawgathon.faceguard.backend.index;

/**
 * A single embedding hit from a similarity search. Similarity is clamped to [0, 1].
 */
public record MatchCandidate(String ownerPersonId, String embeddingId, int position, double similarity) {
}
