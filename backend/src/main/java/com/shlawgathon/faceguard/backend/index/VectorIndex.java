package com.shlawgathon.faceguard.backend.index;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.BitSet;
import java.util.Comparator;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.PriorityQueue;
import java.util.concurrent.locks.ReentrantReadWriteLock;

/**
 * In-memory exact cosine similarity index over face embeddings.
 * <p>
 * Vectors are L2-normalized on insert and kept in a single dense row-major
 * float array, so a search is one inner product per active slot. Positions are
 * append-only: deactivating a person only hides its slots from search.
 * <p>
 * Writers (add, deactivate, restore) take the write lock; searches and
 * snapshots share the read lock.
 */
public class VectorIndex {

    private static final Logger log = LoggerFactory.getLogger(VectorIndex.class);

    private static final int INITIAL_CAPACITY = 1024;

    static final Comparator<MatchCandidate> BEST_FIRST = Comparator
            .comparingDouble(MatchCandidate::similarity).reversed()
            .thenComparingInt(MatchCandidate::position);

    private final int dimension;
    private final ReentrantReadWriteLock lock = new ReentrantReadWriteLock();

    private float[] vectors;
    private final List<IndexEntry> entries = new ArrayList<>();
    private final Map<String, List<Integer>> personPositions = new HashMap<>();
    private final BitSet inactive = new BitSet();
    private final BitSet zeroVectors = new BitSet();

    public VectorIndex(int dimension) {
        if (dimension < 1) {
            throw new IllegalArgumentException("Index dimension must be positive: " + dimension);
        }
        this.dimension = dimension;
        this.vectors = new float[INITIAL_CAPACITY * dimension];
    }

    public int getDimension() {
        return dimension;
    }

    /**
     * Add one embedding and return its position.
     */
    public int add(String ownerPersonId, String embeddingId, float[] vector) {
        Objects.requireNonNull(ownerPersonId, "ownerPersonId");
        Objects.requireNonNull(embeddingId, "embeddingId");
        Objects.requireNonNull(vector, "vector");
        if (vector.length != dimension) {
            throw new DimensionMismatchException(dimension, vector.length);
        }
        VectorMath.requireFinite(vector);

        float[] normalized = vector.clone();
        boolean zero = !VectorMath.normalize(normalized);

        lock.writeLock().lock();
        try {
            int position = entries.size();
            ensureCapacity(position + 1);
            System.arraycopy(normalized, 0, vectors, position * dimension, dimension);
            entries.add(new IndexEntry(position, embeddingId, ownerPersonId));
            personPositions.computeIfAbsent(ownerPersonId, k -> new ArrayList<>()).add(position);
            if (zero) {
                zeroVectors.set(position);
                log.warn("[INDEX] Zero-magnitude embedding {} for person {} stored at position {}",
                        embeddingId, ownerPersonId, position);
            }
            return position;
        } finally {
            lock.writeLock().unlock();
        }
    }

    /**
     * Add a batch of embeddings. Records that fail validation are skipped.
     *
     * @return number of records actually added
     */
    public int addAll(List<EmbeddingRecord> records) {
        int added = 0;
        for (EmbeddingRecord record : records) {
            try {
                add(record.ownerPersonId(), record.embeddingId(), record.vector());
                added++;
            } catch (DimensionMismatchException | InvalidVectorException | NullPointerException e) {
                log.warn("[INDEX] Skipping embedding {} in batch: {}",
                        record != null ? record.embeddingId() : null, e.getMessage());
            }
        }
        return added;
    }

    /**
     * Top-k search over active embeddings.
     *
     * @param query     raw query vector, normalized internally
     * @param k         maximum number of candidates, at least 1
     * @param threshold minimum similarity for a candidate to be returned
     * @return candidates ordered by descending similarity, ties by ascending position
     */
    public List<MatchCandidate> search(float[] query, int k, double threshold) {
        if (k < 1) {
            throw new IllegalArgumentException("k must be at least 1: " + k);
        }
        Objects.requireNonNull(query, "query");
        if (query.length != dimension) {
            throw new DimensionMismatchException(dimension, query.length);
        }
        VectorMath.requireFinite(query);

        float[] normalized = query.clone();
        VectorMath.normalize(normalized);

        lock.readLock().lock();
        try {
            int size = entries.size();
            if (size == 0) {
                return List.of();
            }

            PriorityQueue<MatchCandidate> heap = new PriorityQueue<>(Math.min(k, size) + 1, BEST_FIRST.reversed());
            for (int position = inactive.nextClearBit(0); position < size;
                 position = inactive.nextClearBit(position + 1)) {
                double similarity = clamp(VectorMath.dot(normalized, vectors, position * dimension, dimension));
                if (Double.isNaN(similarity) || similarity < threshold) {
                    continue;
                }
                IndexEntry entry = entries.get(position);
                MatchCandidate candidate = new MatchCandidate(
                        entry.ownerPersonId(), entry.embeddingId(), position, similarity);
                if (heap.size() < k) {
                    heap.add(candidate);
                } else if (BEST_FIRST.compare(candidate, heap.peek()) < 0) {
                    heap.poll();
                    heap.add(candidate);
                }
            }

            List<MatchCandidate> result = new ArrayList<>(heap);
            result.sort(BEST_FIRST);
            return result;
        } finally {
            lock.readLock().unlock();
        }
    }

    /**
     * Hide every embedding of a person from search.
     *
     * @return false when the person is unknown or has no active embeddings left
     */
    public boolean deactivatePerson(String personId) {
        lock.writeLock().lock();
        try {
            List<Integer> positions = personPositions.get(personId);
            if (positions == null) {
                return false;
            }
            boolean changed = false;
            for (int position : positions) {
                if (!inactive.get(position)) {
                    inactive.set(position);
                    changed = true;
                }
            }
            if (changed) {
                log.info("[INDEX] Deactivated {} embeddings for person {}", positions.size(), personId);
            }
            return changed;
        } finally {
            lock.writeLock().unlock();
        }
    }

    public int totalEmbeddingCount(String personId) {
        lock.readLock().lock();
        try {
            List<Integer> positions = personPositions.get(personId);
            if (positions == null) {
                return 0;
            }
            int count = 0;
            for (int position : positions) {
                if (!inactive.get(position)) {
                    count++;
                }
            }
            return count;
        } finally {
            lock.readLock().unlock();
        }
    }

    /**
     * Copy of the stored (normalized) vector at a position.
     */
    public float[] vectorAt(int position) {
        lock.readLock().lock();
        try {
            Objects.checkIndex(position, entries.size());
            return Arrays.copyOfRange(vectors, position * dimension, (position + 1) * dimension);
        } finally {
            lock.readLock().unlock();
        }
    }

    public IndexSnapshot snapshot() {
        lock.readLock().lock();
        try {
            int size = entries.size();
            Map<String, List<Integer>> positions = new HashMap<>();
            personPositions.forEach((person, list) -> positions.put(person, List.copyOf(list)));
            return new IndexSnapshot(
                    dimension,
                    Arrays.copyOf(vectors, size * dimension),
                    List.copyOf(entries),
                    positions,
                    inactive.stream().boxed().toList(),
                    zeroVectors.stream().boxed().toList());
        } finally {
            lock.readLock().unlock();
        }
    }

    /**
     * Replace the whole index state with a snapshot. The snapshot is validated
     * first; on failure the current state is left untouched.
     */
    public void restore(IndexSnapshot snapshot) {
        validate(snapshot);

        int size = snapshot.entries().size();
        float[] restored = new float[Math.max(INITIAL_CAPACITY, size) * dimension];
        System.arraycopy(snapshot.vectors(), 0, restored, 0, size * dimension);

        lock.writeLock().lock();
        try {
            vectors = restored;
            entries.clear();
            entries.addAll(snapshot.entries());
            personPositions.clear();
            snapshot.personPositions().forEach((person, list) -> personPositions.put(person, new ArrayList<>(list)));
            inactive.clear();
            snapshot.inactivePositions().forEach(inactive::set);
            zeroVectors.clear();
            snapshot.zeroPositions().forEach(zeroVectors::set);
        } finally {
            lock.writeLock().unlock();
        }
        log.info("[INDEX] Restored {} embeddings for {} persons", size, snapshot.personPositions().size());
    }

    public IndexStats stats() {
        lock.readLock().lock();
        try {
            int size = entries.size();
            int activeSize = size - inactive.cardinality();
            int uniquePersons = 0;
            for (List<Integer> positions : personPositions.values()) {
                for (int position : positions) {
                    if (!inactive.get(position)) {
                        uniquePersons++;
                        break;
                    }
                }
            }
            return new IndexStats(dimension, size, activeSize, uniquePersons, zeroVectors.cardinality());
        } finally {
            lock.readLock().unlock();
        }
    }

    private void validate(IndexSnapshot snapshot) {
        if (snapshot == null) {
            throw new CorruptIndexException("Snapshot is missing");
        }
        if (snapshot.dimension() != dimension) {
            throw new CorruptIndexException("Snapshot dimension " + snapshot.dimension()
                    + " does not match index dimension " + dimension);
        }
        if (snapshot.entries() == null || snapshot.personPositions() == null
                || snapshot.inactivePositions() == null || snapshot.zeroPositions() == null) {
            throw new CorruptIndexException("Snapshot is missing sections");
        }
        List<IndexEntry> snapshotEntries = snapshot.entries();
        int size = snapshotEntries.size();
        if (snapshot.vectors() == null || (long) snapshot.vectors().length != (long) size * dimension) {
            throw new CorruptIndexException("Snapshot vector blob does not hold " + size + " vectors");
        }
        for (int i = 0; i < snapshot.vectors().length; i++) {
            if (!Float.isFinite(snapshot.vectors()[i])) {
                throw new CorruptIndexException("Snapshot vector at position " + i / dimension
                        + " has a non-finite component");
            }
        }
        for (int i = 0; i < size; i++) {
            IndexEntry entry = snapshotEntries.get(i);
            if (entry == null || entry.position() != i || entry.ownerPersonId() == null) {
                throw new CorruptIndexException("Snapshot entry at position " + i + " is inconsistent");
            }
        }

        BitSet seen = new BitSet(size);
        for (Map.Entry<String, List<Integer>> person : snapshot.personPositions().entrySet()) {
            if (person.getKey() == null || person.getValue() == null) {
                throw new CorruptIndexException("Person " + person.getKey() + " has no position list");
            }
            for (Integer position : person.getValue()) {
                if (position == null || position < 0 || position >= size) {
                    throw new CorruptIndexException("Person " + person.getKey()
                            + " references unknown position " + position);
                }
                if (!person.getKey().equals(snapshotEntries.get(position).ownerPersonId()) || seen.get(position)) {
                    throw new CorruptIndexException("Position map disagrees with entries at " + position);
                }
                seen.set(position);
            }
        }
        if (seen.cardinality() != size) {
            throw new CorruptIndexException("Position map covers " + seen.cardinality() + " of " + size + " entries");
        }
        checkPositions(snapshot.inactivePositions(), size, "inactive");
        checkPositions(snapshot.zeroPositions(), size, "zero");
    }

    private static void checkPositions(List<Integer> positions, int size, String kind) {
        for (Integer position : positions) {
            if (position == null || position < 0 || position >= size) {
                throw new CorruptIndexException("Snapshot " + kind + " position out of range: " + position);
            }
        }
    }

    private void ensureCapacity(int slots) {
        long required = (long) slots * dimension;
        if (required > Integer.MAX_VALUE - 8) {
            throw new IllegalStateException("Index capacity exhausted at " + entries.size() + " embeddings");
        }
        if (required <= vectors.length) {
            return;
        }
        long grown = Math.max(required, (long) vectors.length * 2);
        vectors = Arrays.copyOf(vectors, (int) Math.min(grown, Integer.MAX_VALUE - 8));
    }

    private static double clamp(double similarity) {
        if (similarity < 0.0) {
            return 0.0;
        }
        return Math.min(similarity, 1.0);
    }
}
