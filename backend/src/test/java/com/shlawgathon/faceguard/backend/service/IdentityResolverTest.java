package com.shlawgathon.faceguard.backend.service;

import com.shlawgathon.faceguard.backend.index.MatchCandidate;
import com.shlawgathon.faceguard.backend.index.VectorIndex;
import com.shlawgathon.faceguard.backend.model.PersonMatch;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.util.List;
import java.util.Optional;
import java.util.Random;

import static org.junit.jupiter.api.Assertions.*;

class IdentityResolverTest {

    private VectorIndex index;
    private IdentityResolver resolver;

    @BeforeEach
    void setUp() {
        index = new VectorIndex(4);
        resolver = new IdentityResolver(index, 100);
    }

    @Test
    void shouldReturnEmptyWhenNobodyClearsThreshold() {
        index.add("p1", "e1", new float[] {0f, 1f, 0f, 0f});

        assertEquals(Optional.empty(), resolver.resolve(new float[] {1f, 0f, 0f, 0f}, 0.6));
    }

    @Test
    void shouldAggregateMatchesPerPerson() {
        // Given
        index.add("p1", "p1-a", new float[] {1f, 0f, 0f, 0f});
        index.add("p1", "p1-b", new float[] {1f, 1f, 0f, 0f});
        index.add("p1", "p1-c", new float[] {0f, 0f, 1f, 0f});

        // When
        PersonMatch match = resolver.resolve(new float[] {1f, 0f, 0f, 0f}, 0.6).orElseThrow();

        // Then
        assertEquals("p1", match.getPersonId());
        assertEquals(1.0, match.getMaxSimilarity(), 1e-6);
        assertEquals((1.0 + Math.sqrt(0.5)) / 2, match.getAvgSimilarity(), 1e-6);
        assertEquals(2, match.getMatchingEmbeddingCount());
        assertEquals(3, match.getTotalEmbeddingCount());
        assertEquals(List.of("p1-a", "p1-b"), match.getEmbeddingIds());
        assertTrue(match.getAvgSimilarity() <= match.getMaxSimilarity());
    }

    @Test
    void shouldPickPersonWithHighestMaxOverHigherAverage() {
        // Given: p2 has the single best hit, p1 has more and steadier hits
        index.add("p1", "p1-a", new float[] {1f, 0.3f, 0f, 0f});
        index.add("p1", "p1-b", new float[] {1f, 0.3f, 0f, 0f});
        index.add("p1", "p1-c", new float[] {1f, 0.3f, 0f, 0f});
        index.add("p2", "p2-a", new float[] {1f, 0f, 0f, 0f});
        index.add("p2", "p2-b", new float[] {1f, 1.5f, 0f, 0f});

        // When
        PersonMatch match = resolver.resolve(new float[] {1f, 0f, 0f, 0f}, 0.5).orElseThrow();

        // Then
        assertEquals("p2", match.getPersonId());
    }

    @Test
    void shouldBreakMaxTieByMatchingCountThenPersonId() {
        // Given
        index.add("p-b", "b1", new float[] {1f, 0f, 0f, 0f});
        index.add("p-c", "c1", new float[] {1f, 0f, 0f, 0f});
        index.add("p-c", "c2", new float[] {1f, 0.2f, 0f, 0f});
        index.add("p-a", "a1", new float[] {1f, 0f, 0f, 0f});

        // When
        PersonMatch byCount = resolver.resolve(new float[] {1f, 0f, 0f, 0f}, 0.5).orElseThrow();

        // Then
        assertEquals("p-c", byCount.getPersonId());

        // Given
        index.deactivatePerson("p-c");

        // When
        PersonMatch byId = resolver.resolve(new float[] {1f, 0f, 0f, 0f}, 0.5).orElseThrow();

        // Then
        assertEquals("p-a", byId.getPersonId());
    }

    @Test
    void shouldResolveCloserOfTwoPersons() {
        // Given
        index.add("p1", "p1-a", new float[] {1f, 0f, 0f, 0f});
        index.add("p2", "p2-a", new float[] {0f, 1f, 0f, 0f});

        // When
        Optional<PersonMatch> nearP2 = resolver.resolve(new float[] {0.1f, 0.9f, 0f, 0f}, 0.6);
        Optional<PersonMatch> between = resolver.resolve(new float[] {1f, 1f, 0f, 0f}, 0.75);

        // Then
        assertEquals("p2", nearP2.orElseThrow().getPersonId());
        assertTrue(between.isEmpty());
    }

    @Test
    void shouldResolveThreeIdenticalEnrollmentsOverNearbyPersonAt512Dimensions() {
        // Given
        int dimension = 512;
        VectorIndex faces = new VectorIndex(dimension);
        IdentityResolver faceResolver = new IdentityResolver(faces, 10);
        Random random = new Random(42);
        double[] e1 = unit(randomVector(random, dimension));
        double[] other = randomVector(random, dimension);
        double along = dot(other, e1);
        for (int i = 0; i < dimension; i++) {
            other[i] -= along * e1[i];
        }
        double[] orthogonal = unit(other);
        double[] nearby = new double[dimension];
        for (int i = 0; i < dimension; i++) {
            nearby[i] = 0.65 * e1[i] + Math.sqrt(1 - 0.65 * 0.65) * orthogonal[i];
        }
        faces.add("p1", "p1-a", toFloats(e1));
        faces.add("p1", "p1-b", toFloats(e1));
        faces.add("p1", "p1-c", toFloats(e1));
        faces.add("p2", "p2-a", toFloats(nearby));

        // When
        PersonMatch match = faceResolver.resolve(toFloats(e1), 0.6).orElseThrow();
        List<MatchCandidate> candidates = faceResolver.search(toFloats(e1), 10, 0.6);

        // Then
        assertEquals("p1", match.getPersonId());
        assertEquals(1.0, match.getMaxSimilarity(), 1e-5);
        assertEquals(3, match.getMatchingEmbeddingCount());
        assertEquals(3, match.getTotalEmbeddingCount());
        assertEquals(4, candidates.size());
        assertEquals("p2", candidates.get(3).ownerPersonId());
        assertEquals(0.65, candidates.get(3).similarity(), 1e-4);
        assertTrue(candidates.subList(0, 3).stream().allMatch(c -> "p1".equals(c.ownerPersonId())));
    }

    private static double[] randomVector(Random random, int dimension) {
        double[] vector = new double[dimension];
        for (int i = 0; i < dimension; i++) {
            vector[i] = random.nextGaussian();
        }
        return vector;
    }

    private static double[] unit(double[] vector) {
        double norm = Math.sqrt(dot(vector, vector));
        double[] scaled = new double[vector.length];
        for (int i = 0; i < vector.length; i++) {
            scaled[i] = vector[i] / norm;
        }
        return scaled;
    }

    private static double dot(double[] a, double[] b) {
        double sum = 0.0;
        for (int i = 0; i < a.length; i++) {
            sum += a[i] * b[i];
        }
        return sum;
    }

    private static float[] toFloats(double[] vector) {
        float[] floats = new float[vector.length];
        for (int i = 0; i < vector.length; i++) {
            floats[i] = (float) vector[i];
        }
        return floats;
    }
}
