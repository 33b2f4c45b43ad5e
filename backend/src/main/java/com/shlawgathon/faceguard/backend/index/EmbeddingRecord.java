package com.shlawgathon.faceguard.backend.index;

public record EmbeddingRecord(String ownerPersonId, String embeddingId, float[] vector) {
}
