package com.shlawgathon.faceguard.backend.index;

public record IndexStats(int dimension, int indexSize, int activeSize, int uniquePersons, int zeroVectors) {
}
