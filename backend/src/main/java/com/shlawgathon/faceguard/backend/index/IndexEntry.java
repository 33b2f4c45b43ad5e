package com.shlawgathon.faceguard.backend.index;

/**
 * One slot in the index. Positions are assigned in insertion order and never reused.
 */
public record IndexEntry(int position, String embeddingId, String ownerPersonId) {
}
