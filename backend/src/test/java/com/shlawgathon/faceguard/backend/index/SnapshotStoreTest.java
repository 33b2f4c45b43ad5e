package com.shlawgathon.faceguard.backend.index;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.ObjectNode;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.Optional;

import static org.junit.jupiter.api.Assertions.*;

class SnapshotStoreTest {

    @TempDir
    Path directory;

    private SnapshotStore store;
    private VectorIndex index;

    @BeforeEach
    void setUp() {
        store = new SnapshotStore(directory, new ObjectMapper().findAndRegisterModules());
        index = new VectorIndex(4);
        index.add("p1", "e1", new float[] {1f, 0f, 0f, 0f});
        index.add("p1", "e2", new float[] {1f, 1f, 0f, 0f});
        index.add("p2", "e3", new float[] {0f, 0f, 1f, 0f});
        index.add("p3", "e4", new float[] {0f, 0f, 0f, 0f});
        index.deactivatePerson("p2");
    }

    @Test
    void shouldReturnEmptyWhenNothingSaved() {
        assertEquals(Optional.empty(), store.load());
    }

    @Test
    void shouldRoundTripIndexState() throws IOException {
        // Given
        store.save(index.snapshot());

        // When
        IndexSnapshot loaded = store.load().orElseThrow();
        VectorIndex restored = new VectorIndex(4);
        restored.restore(loaded);

        // Then
        assertTrue(Files.exists(directory.resolve(SnapshotStore.BLOB_FILE)));
        assertTrue(Files.exists(directory.resolve(SnapshotStore.METADATA_FILE)));
        assertEquals(index.stats(), restored.stats());
        for (float[] query : new float[][] {{1f, 0f, 0f, 0f}, {0f, 0f, 1f, 0f}, {0.2f, 0.7f, 0.1f, 0f}}) {
            assertEquals(index.search(query, 10, 0.0), restored.search(query, 10, 0.0));
        }
        assertEquals(2, restored.totalEmbeddingCount("p1"));
        assertEquals(0, restored.totalEmbeddingCount("p2"));
    }

    @Test
    void shouldRejectPairWhenOnlyOneFileExists() throws IOException {
        // Given
        store.save(index.snapshot());
        Files.delete(directory.resolve(SnapshotStore.METADATA_FILE));

        // When / Then
        assertThrows(CorruptIndexException.class, () -> store.load());
    }

    @Test
    void shouldRejectPairWhenBlobAndMetadataDisagree() throws IOException {
        // Given
        store.save(index.snapshot());
        byte[] blob = Files.readAllBytes(directory.resolve(SnapshotStore.BLOB_FILE));
        VectorIndex smaller = new VectorIndex(4);
        smaller.add("p1", "e1", new float[] {1f, 0f, 0f, 0f});
        store.save(smaller.snapshot());
        Files.write(directory.resolve(SnapshotStore.BLOB_FILE), blob);

        // When / Then
        assertThrows(CorruptIndexException.class, () -> store.load());
    }

    @Test
    void shouldRejectBlobWithWrongMagic() throws IOException {
        // Given
        store.save(index.snapshot());
        Path blobPath = directory.resolve(SnapshotStore.BLOB_FILE);
        byte[] blob = Files.readAllBytes(blobPath);
        blob[0] = 'X';
        Files.write(blobPath, blob);

        // When / Then
        assertThrows(CorruptIndexException.class, () -> store.load());
    }

    @Test
    void shouldRejectTruncatedBlob() throws IOException {
        // Given
        store.save(index.snapshot());
        Path blobPath = directory.resolve(SnapshotStore.BLOB_FILE);
        byte[] blob = Files.readAllBytes(blobPath);
        byte[] truncated = new byte[blob.length - 4];
        System.arraycopy(blob, 0, truncated, 0, truncated.length);
        Files.write(blobPath, truncated);

        // When / Then
        assertThrows(CorruptIndexException.class, () -> store.load());
    }

    @Test
    void shouldRejectMetadataWithNullSection() throws IOException {
        // Given
        store.save(index.snapshot());
        Path metadataPath = directory.resolve(SnapshotStore.METADATA_FILE);
        ObjectMapper mapper = new ObjectMapper();
        ObjectNode metadata = (ObjectNode) mapper.readTree(metadataPath.toFile());
        metadata.putNull("id_map");
        mapper.writeValue(metadataPath.toFile(), metadata);

        // When / Then
        CorruptIndexException e = assertThrows(CorruptIndexException.class, () -> store.load());
        assertTrue(e.getMessage().contains("id_map"));
    }

    @Test
    void shouldRejectNullMetadataDocument() throws IOException {
        // Given
        store.save(index.snapshot());
        Files.writeString(directory.resolve(SnapshotStore.METADATA_FILE), "null");

        // When / Then
        assertThrows(CorruptIndexException.class, () -> store.load());
    }

    @Test
    void shouldRejectPersonWithNullPositionList() throws IOException {
        // Given
        store.save(index.snapshot());
        Path metadataPath = directory.resolve(SnapshotStore.METADATA_FILE);
        ObjectMapper mapper = new ObjectMapper();
        ObjectNode metadata = (ObjectNode) mapper.readTree(metadataPath.toFile());
        ((ObjectNode) metadata.get("person_embeddings")).putNull("p1");
        mapper.writeValue(metadataPath.toFile(), metadata);
        IndexSnapshot loaded = store.load().orElseThrow();
        VectorIndex fresh = new VectorIndex(4);

        // When / Then
        assertThrows(CorruptIndexException.class, () -> fresh.restore(loaded));
        assertEquals(0, fresh.stats().indexSize());
    }

    @Test
    void shouldNotLeaveTempFilesBehind() throws IOException {
        store.save(index.snapshot());

        try (var files = Files.list(directory)) {
            assertTrue(files.noneMatch(p -> p.getFileName().toString().endsWith(".tmp")));
        }
    }
}
