package com.shlawgathon.faceguard.backend.index;

import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

class VectorIndexTest {

    private VectorIndex index;

    @BeforeEach
    void setUp() {
        index = new VectorIndex(4);
    }

    @Test
    void shouldStoreUnitLengthVectors() {
        // Given
        int position = index.add("p1", "e1", new float[] {3f, 4f, 0f, 0f});

        // When
        float[] stored = index.vectorAt(position);

        // Then
        double norm = Math.sqrt(stored[0] * stored[0] + stored[1] * stored[1] + stored[2] * stored[2]
                + stored[3] * stored[3]);
        assertEquals(1.0, norm, 1e-6);
        assertEquals(0.6f, stored[0], 1e-6);
        assertEquals(0.8f, stored[1], 1e-6);
    }

    @Test
    void shouldAssignSequentialPositions() {
        assertEquals(0, index.add("p1", "e1", new float[] {1f, 0f, 0f, 0f}));
        assertEquals(1, index.add("p1", "e2", new float[] {0f, 1f, 0f, 0f}));
        assertEquals(2, index.add("p2", "e3", new float[] {0f, 0f, 1f, 0f}));
    }

    @Test
    void shouldRejectWrongDimensionOnAdd() {
        DimensionMismatchException e = assertThrows(DimensionMismatchException.class,
                () -> index.add("p1", "e1", new float[] {1f, 0f, 0f}));
        assertEquals(0, index.stats().indexSize());
        assertTrue(e.getMessage().contains("4"));
    }

    @Test
    void shouldRejectWrongDimensionOnSearch() {
        index.add("p1", "e1", new float[] {1f, 0f, 0f, 0f});
        assertThrows(DimensionMismatchException.class, () -> index.search(new float[] {1f, 0f}, 5, 0.0));
    }

    @Test
    void shouldRejectNonFiniteComponentOnAdd() {
        // Given
        index.add("good", "e1", new float[] {1f, 0f, 0f, 0f});

        // When
        InvalidVectorException e = assertThrows(InvalidVectorException.class,
                () -> index.add("poison", "e2", new float[] {Float.POSITIVE_INFINITY, 0f, 0f, 0f}));

        // Then
        assertEquals(0, e.getComponent());
        assertThrows(InvalidVectorException.class,
                () -> index.add("poison", "e3", new float[] {0f, Float.NaN, 0f, 0f}));
        assertEquals(1, index.stats().indexSize());
        assertEquals(0, index.totalEmbeddingCount("poison"));
        assertTrue(index.search(new float[] {0f, 0f, 1f, 0f}, 5, 0.9).isEmpty());
    }

    @Test
    void shouldRejectNonFiniteQuery() {
        index.add("p1", "e1", new float[] {1f, 0f, 0f, 0f});
        assertThrows(InvalidVectorException.class,
                () -> index.search(new float[] {Float.NEGATIVE_INFINITY, 0f, 0f, 0f}, 5, 0.0));
        assertThrows(InvalidVectorException.class,
                () -> index.search(new float[] {Float.NaN, 0f, 0f, 0f}, 5, 0.0));
    }

    @Test
    void shouldSkipNonFiniteRecordsInBatch() {
        // Given
        List<EmbeddingRecord> records = List.of(
                new EmbeddingRecord("good", "e1", new float[] {1f, 0f, 0f, 0f}),
                new EmbeddingRecord("poison", "e2", new float[] {Float.POSITIVE_INFINITY, 0f, 0f, 0f}));

        // When
        int added = index.addAll(records);

        // Then
        assertEquals(1, added);
        assertEquals(0, index.totalEmbeddingCount("poison"));
    }

    @Test
    void shouldRejectSnapshotHoldingNonFiniteVector() {
        // Given
        index.add("p1", "e1", new float[] {1f, 0f, 0f, 0f});
        IndexSnapshot good = index.snapshot();
        float[] vectors = good.vectors().clone();
        vectors[1] = Float.NaN;
        IndexSnapshot poisoned = new IndexSnapshot(good.dimension(), vectors, good.entries(),
                good.personPositions(), good.inactivePositions(), good.zeroPositions());
        VectorIndex fresh = new VectorIndex(4);

        // When / Then
        assertThrows(CorruptIndexException.class, () -> fresh.restore(poisoned));
        assertEquals(0, fresh.stats().indexSize());
    }

    @Test
    void shouldRejectNonPositiveK() {
        assertThrows(IllegalArgumentException.class, () -> index.search(new float[] {1f, 0f, 0f, 0f}, 0, 0.0));
    }

    @Test
    void shouldReturnEmptyForEmptyIndex() {
        assertTrue(index.search(new float[] {1f, 0f, 0f, 0f}, 5, 0.0).isEmpty());
    }

    @Test
    void shouldOnlyReturnCandidatesAtOrAboveThreshold() {
        // Given
        index.add("p1", "e1", new float[] {1f, 0f, 0f, 0f});
        index.add("p2", "e2", new float[] {1f, 1f, 0f, 0f});
        index.add("p3", "e3", new float[] {0f, 1f, 0f, 0f});

        // When
        List<MatchCandidate> result = index.search(new float[] {1f, 0f, 0f, 0f}, 10, 0.7);

        // Then
        assertEquals(2, result.size());
        assertTrue(result.stream().allMatch(c -> c.similarity() >= 0.7));
        assertEquals("e1", result.get(0).embeddingId());
        assertEquals(1.0, result.get(0).similarity(), 1e-6);
        assertEquals(Math.sqrt(0.5), result.get(1).similarity(), 1e-6);
    }

    @Test
    void shouldClampNegativeSimilarityToZero() {
        index.add("p1", "e1", new float[] {-1f, 0f, 0f, 0f});

        List<MatchCandidate> result = index.search(new float[] {1f, 0f, 0f, 0f}, 5, 0.0);

        assertEquals(1, result.size());
        assertEquals(0.0, result.get(0).similarity());
    }

    @Test
    void shouldBreakTiesByAscendingPosition() {
        // Given
        index.add("p2", "e-late", new float[] {0f, 1f, 0f, 0f});
        index.add("p1", "e-a", new float[] {1f, 0f, 0f, 0f});
        index.add("p3", "e-b", new float[] {2f, 0f, 0f, 0f});

        // When
        List<MatchCandidate> result = index.search(new float[] {1f, 0f, 0f, 0f}, 2, 0.5);

        // Then
        assertEquals(List.of(1, 2), result.stream().map(MatchCandidate::position).toList());
    }

    @Test
    void shouldKeepOnlyTopK() {
        for (int i = 0; i < 20; i++) {
            index.add("p" + i, "e" + i, new float[] {1f, i / 10f, 0f, 0f});
        }

        List<MatchCandidate> result = index.search(new float[] {1f, 0f, 0f, 0f}, 3, 0.0);

        assertEquals(3, result.size());
        assertEquals(List.of("e0", "e1", "e2"), result.stream().map(MatchCandidate::embeddingId).toList());
    }

    @Test
    void shouldStoreZeroVectorAndNeverMatchIt() {
        // Given
        index.add("p1", "zero", new float[] {0f, 0f, 0f, 0f});

        // When
        List<MatchCandidate> result = index.search(new float[] {1f, 0f, 0f, 0f}, 5, 0.1);

        // Then
        assertTrue(result.isEmpty());
        assertEquals(1, index.stats().zeroVectors());
        assertEquals(1, index.stats().indexSize());
    }

    @Test
    void shouldHideDeactivatedPersonFromSearch() {
        // Given
        index.add("p1", "e1", new float[] {1f, 0f, 0f, 0f});
        index.add("p1", "e2", new float[] {1f, 0.1f, 0f, 0f});
        index.add("p2", "e3", new float[] {1f, 0.2f, 0f, 0f});

        // When
        boolean changed = index.deactivatePerson("p1");

        // Then
        assertTrue(changed);
        List<MatchCandidate> result = index.search(new float[] {1f, 0f, 0f, 0f}, 10, 0.0);
        assertEquals(List.of("p2"), result.stream().map(MatchCandidate::ownerPersonId).toList());
        assertEquals(0, index.totalEmbeddingCount("p1"));
        IndexStats stats = index.stats();
        assertEquals(3, stats.indexSize());
        assertEquals(1, stats.activeSize());
        assertEquals(1, stats.uniquePersons());
    }

    @Test
    void shouldReportFalseWhenDeactivatingUnknownOrInactivePerson() {
        index.add("p1", "e1", new float[] {1f, 0f, 0f, 0f});

        assertFalse(index.deactivatePerson("nobody"));
        assertTrue(index.deactivatePerson("p1"));
        assertFalse(index.deactivatePerson("p1"));
    }

    @Test
    void shouldSkipInvalidRecordsInBatch() {
        // Given
        List<EmbeddingRecord> records = List.of(
                new EmbeddingRecord("p1", "e1", new float[] {1f, 0f, 0f, 0f}),
                new EmbeddingRecord("p1", "bad", new float[] {1f, 0f}),
                new EmbeddingRecord("p2", "e2", new float[] {0f, 1f, 0f, 0f}));

        // When
        int added = index.addAll(records);

        // Then
        assertEquals(2, added);
        assertEquals(2, index.stats().indexSize());
    }

    @Test
    void shouldRestoreSnapshotIntoFreshIndex() {
        // Given
        index.add("p1", "e1", new float[] {1f, 0f, 0f, 0f});
        index.add("p2", "e2", new float[] {0f, 1f, 0f, 0f});
        index.add("p2", "e3", new float[] {0f, 0f, 0f, 0f});
        index.deactivatePerson("p1");
        IndexSnapshot snapshot = index.snapshot();

        // When
        VectorIndex restored = new VectorIndex(4);
        restored.restore(snapshot);

        // Then
        assertEquals(index.stats(), restored.stats());
        float[] query = {0.3f, 0.9f, 0f, 0f};
        assertEquals(index.search(query, 5, 0.0), restored.search(query, 5, 0.0));
        assertEquals(3, restored.add("p3", "e4", new float[] {0f, 0f, 1f, 0f}));
    }

    @Test
    void shouldRejectSnapshotWithMismatchedDimensionAndKeepState() {
        // Given
        index.add("p1", "e1", new float[] {1f, 0f, 0f, 0f});
        VectorIndex other = new VectorIndex(3);
        other.add("p9", "e9", new float[] {1f, 0f, 0f});

        // When / Then
        assertThrows(CorruptIndexException.class, () -> index.restore(other.snapshot()));
        assertEquals(1, index.stats().indexSize());
        assertEquals("p1", index.search(new float[] {1f, 0f, 0f, 0f}, 1, 0.0).get(0).ownerPersonId());
    }

    @Test
    void shouldRejectSnapshotWithShortVectorBlob() {
        index.add("p1", "e1", new float[] {1f, 0f, 0f, 0f});
        IndexSnapshot good = index.snapshot();
        IndexSnapshot truncated = new IndexSnapshot(4, new float[2], good.entries(), good.personPositions(),
                good.inactivePositions(), good.zeroPositions());

        assertThrows(CorruptIndexException.class, () -> new VectorIndex(4).restore(truncated));
    }

    @Test
    void shouldPreferClosestPersonInTwoPersonScenario() {
        // Given
        index.add("p1", "p1-a", new float[] {1f, 0f, 0f, 0f});
        index.add("p1", "p1-b", new float[] {0.9f, 0.1f, 0f, 0f});
        index.add("p2", "p2-a", new float[] {0f, 1f, 0f, 0f});

        // When
        List<MatchCandidate> result = index.search(new float[] {0.95f, 0.05f, 0f, 0f}, 10, 0.5);

        // Then
        assertEquals(2, result.size());
        assertTrue(result.stream().allMatch(c -> c.ownerPersonId().equals("p1")));
    }
}
