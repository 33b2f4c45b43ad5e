package com.shlawgathon.faceguard.backend.service;

import com.shlawgathon.faceguard.backend.dto.AddEmbeddingRequest;
import com.shlawgathon.faceguard.backend.dto.BatchAddEmbeddingsResponse;
import com.shlawgathon.faceguard.backend.dto.IndexStatusResponse;
import com.shlawgathon.faceguard.backend.index.CorruptIndexException;
import com.shlawgathon.faceguard.backend.index.EmbeddingRecord;
import com.shlawgathon.faceguard.backend.index.IndexSnapshot;
import com.shlawgathon.faceguard.backend.index.IndexStats;
import com.shlawgathon.faceguard.backend.index.SnapshotStore;
import com.shlawgathon.faceguard.backend.index.VectorIndex;
import jakarta.annotation.PostConstruct;
import jakarta.annotation.PreDestroy;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.scheduling.annotation.Scheduled;
import org.springframework.stereotype.Service;

import java.io.IOException;
import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.Optional;
import java.util.concurrent.Callable;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;
import java.util.concurrent.atomic.AtomicBoolean;

/**
 * Owns the lifecycle of the vector index: enrollment, deactivation and
 * snapshot persistence. The snapshot is loaded once at startup and written
 * after batch enrollment, periodically while dirty, and on shutdown.
 */
@Service
public class EmbeddingIndexService {

    private static final Logger log = LoggerFactory.getLogger(EmbeddingIndexService.class);

    public enum SnapshotState {
        NONE, LOADED, SAVED, CORRUPT
    }

    private final VectorIndex index;
    private final SnapshotStore snapshotStore;
    private final Duration snapshotTimeout;
    private final double minQualityScore;
    private final Clock clock;

    private final ExecutorService snapshotExecutor = Executors.newSingleThreadExecutor(r -> {
        Thread thread = new Thread(r, "index-snapshot-io");
        thread.setDaemon(true);
        return thread;
    });
    private final AtomicBoolean dirty = new AtomicBoolean(false);

    private volatile SnapshotState snapshotState = SnapshotState.NONE;
    private volatile Instant lastSnapshotAt;

    public EmbeddingIndexService(VectorIndex index,
            SnapshotStore snapshotStore,
            Clock clock,
            @Value("${faceguard.index.snapshot-timeout:PT10S}") Duration snapshotTimeout,
            @Value("${faceguard.index.min-quality-score:0.0}") double minQualityScore) {
        this.index = index;
        this.snapshotStore = snapshotStore;
        this.clock = clock;
        this.snapshotTimeout = snapshotTimeout;
        this.minQualityScore = minQualityScore;
    }

    @PostConstruct
    public void loadSnapshot() {
        try {
            Optional<IndexSnapshot> snapshot = runWithTimeout(snapshotStore::load);
            if (snapshot.isEmpty()) {
                log.info("[INDEX] No snapshot in {}, starting with an empty index", snapshotStore.getDirectory());
                snapshotState = SnapshotState.NONE;
                return;
            }
            index.restore(snapshot.get());
            snapshotState = SnapshotState.LOADED;
            lastSnapshotAt = clock.instant();
        } catch (CorruptIndexException | IOException e) {
            snapshotState = SnapshotState.CORRUPT;
            log.error("[INDEX] Snapshot in {} could not be loaded, starting with an empty index: {}",
                    snapshotStore.getDirectory(), e.getMessage());
        }
    }

    @PreDestroy
    public void shutdown() {
        if (dirty.get()) {
            saveSnapshot();
        }
        snapshotExecutor.shutdown();
    }

    public int addEmbedding(AddEmbeddingRequest request) {
        checkQuality(request);
        int position = index.add(request.getPersonId(), request.getEmbeddingId(), request.getVector());
        dirty.set(true);
        log.debug("[INDEX] Added embedding {} for person {} at position {}",
                request.getEmbeddingId(), request.getPersonId(), position);
        return position;
    }

    /**
     * Add a batch of embeddings, skipping invalid ones, then persist a snapshot.
     */
    public BatchAddEmbeddingsResponse addEmbeddings(List<AddEmbeddingRequest> requests) {
        List<EmbeddingRecord> records = new ArrayList<>(requests.size());
        for (AddEmbeddingRequest request : requests) {
            if (request.getQualityScore() != null && request.getQualityScore() < minQualityScore) {
                log.warn("[INDEX] Skipping embedding {}: quality {} below {}",
                        request.getEmbeddingId(), request.getQualityScore(), minQualityScore);
                continue;
            }
            records.add(new EmbeddingRecord(request.getPersonId(), request.getEmbeddingId(), request.getVector()));
        }

        int added = index.addAll(records);
        boolean saved = false;
        if (added > 0) {
            dirty.set(true);
            saved = saveSnapshot();
        }
        log.info("[INDEX] Batch enrollment: {} of {} embeddings added", added, requests.size());

        return BatchAddEmbeddingsResponse.builder()
                .requested(requests.size())
                .added(added)
                .skipped(requests.size() - added)
                .snapshotSaved(saved)
                .build();
    }

    public boolean deactivatePerson(String personId) {
        boolean changed = index.deactivatePerson(personId);
        if (changed) {
            dirty.set(true);
        }
        return changed;
    }

    /**
     * Persist the current index state.
     *
     * @return true when both snapshot files were written
     */
    public boolean saveSnapshot() {
        dirty.set(false);
        IndexSnapshot snapshot = index.snapshot();
        try {
            runWithTimeout(() -> {
                snapshotStore.save(snapshot);
                return null;
            });
            snapshotState = SnapshotState.SAVED;
            lastSnapshotAt = clock.instant();
            return true;
        } catch (IOException | RuntimeException e) {
            dirty.set(true);
            log.error("[INDEX] Failed to save snapshot to {}: {}", snapshotStore.getDirectory(), e.getMessage(), e);
            return false;
        }
    }

    @Scheduled(fixedDelayString = "${faceguard.index.snapshot-interval:PT5M}",
            initialDelayString = "${faceguard.index.snapshot-interval:PT5M}")
    public void saveSnapshotIfDirty() {
        if (dirty.get()) {
            saveSnapshot();
        }
    }

    public boolean isDegraded() {
        return snapshotState == SnapshotState.CORRUPT;
    }

    public IndexStatusResponse status() {
        IndexStats stats = index.stats();
        return IndexStatusResponse.builder()
                .dimension(stats.dimension())
                .indexSize(stats.indexSize())
                .activeSize(stats.activeSize())
                .uniquePersons(stats.uniquePersons())
                .zeroVectors(stats.zeroVectors())
                .snapshotState(snapshotState)
                .lastSnapshotAt(lastSnapshotAt)
                .snapshotDir(snapshotStore.getDirectory().toString())
                .build();
    }

    private void checkQuality(AddEmbeddingRequest request) {
        if (request.getQualityScore() != null && request.getQualityScore() < minQualityScore) {
            throw new IllegalArgumentException("Embedding quality " + request.getQualityScore()
                    + " is below the minimum " + minQualityScore);
        }
    }

    private <T> T runWithTimeout(Callable<T> task) throws IOException {
        Future<T> future = snapshotExecutor.submit(task);
        try {
            return future.get(snapshotTimeout.toMillis(), TimeUnit.MILLISECONDS);
        } catch (TimeoutException e) {
            future.cancel(true);
            throw new IOException("Snapshot I/O timed out after " + snapshotTimeout);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new IOException("Interrupted during snapshot I/O", e);
        } catch (ExecutionException e) {
            Throwable cause = e.getCause();
            if (cause instanceof RuntimeException runtimeException) {
                throw runtimeException;
            }
            if (cause instanceof IOException ioException) {
                throw ioException;
            }
            throw new IOException(cause);
        }
    }
}
