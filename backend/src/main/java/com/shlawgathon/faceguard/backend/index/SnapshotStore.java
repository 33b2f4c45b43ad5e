package com.shlawgathon.faceguard.backend.index;

import com.fasterxml.jackson.databind.ObjectMapper;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.nio.ByteBuffer;
import java.nio.ByteOrder;
import java.nio.charset.StandardCharsets;
import java.nio.file.AtomicMoveNotSupportedException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.StandardCopyOption;
import java.time.Instant;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * Reads and writes index snapshots as a pair of files in one directory:
 * {@code index.bin} holding the vectors and {@code metadata.json} holding the
 * position map. Both are written to temp files first and moved into place.
 */
public class SnapshotStore {

    private static final Logger log = LoggerFactory.getLogger(SnapshotStore.class);

    static final String BLOB_FILE = "index.bin";
    static final String METADATA_FILE = "metadata.json";

    private static final byte[] MAGIC = "FGIX".getBytes(StandardCharsets.US_ASCII);
    private static final int FORMAT_VERSION = 1;
    private static final int HEADER_BYTES = MAGIC.length + 3 * Integer.BYTES;

    private final Path directory;
    private final ObjectMapper objectMapper;

    public SnapshotStore(Path directory, ObjectMapper objectMapper) {
        this.directory = directory;
        this.objectMapper = objectMapper;
    }

    public Path getDirectory() {
        return directory;
    }

    public void save(IndexSnapshot snapshot) throws IOException {
        Files.createDirectories(directory);

        int count = snapshot.entries().size();
        ByteBuffer buffer = ByteBuffer.allocate(HEADER_BYTES + snapshot.vectors().length * Float.BYTES)
                .order(ByteOrder.LITTLE_ENDIAN);
        buffer.put(MAGIC);
        buffer.putInt(FORMAT_VERSION);
        buffer.putInt(snapshot.dimension());
        buffer.putInt(count);
        buffer.asFloatBuffer().put(snapshot.vectors());

        SnapshotMetadata metadata = toMetadata(snapshot);

        Path blobTemp = directory.resolve(BLOB_FILE + ".tmp");
        Path metadataTemp = directory.resolve(METADATA_FILE + ".tmp");
        Files.write(blobTemp, buffer.array());
        objectMapper.writeValue(metadataTemp.toFile(), metadata);

        move(blobTemp, directory.resolve(BLOB_FILE));
        move(metadataTemp, directory.resolve(METADATA_FILE));

        log.info("[INDEX] Snapshot saved to {} ({} vectors)", directory, count);
    }

    /**
     * Load the snapshot pair.
     *
     * @return empty when no snapshot has been written yet
     * @throws CorruptIndexException when only one file exists or the two disagree
     */
    public Optional<IndexSnapshot> load() {
        Path blobPath = directory.resolve(BLOB_FILE);
        Path metadataPath = directory.resolve(METADATA_FILE);
        boolean hasBlob = Files.exists(blobPath);
        boolean hasMetadata = Files.exists(metadataPath);

        if (!hasBlob && !hasMetadata) {
            return Optional.empty();
        }
        if (hasBlob != hasMetadata) {
            throw new CorruptIndexException("Incomplete snapshot in " + directory
                    + ": found " + (hasBlob ? BLOB_FILE : METADATA_FILE) + " only");
        }

        SnapshotMetadata metadata;
        byte[] blob;
        try {
            metadata = objectMapper.readValue(metadataPath.toFile(), SnapshotMetadata.class);
            blob = Files.readAllBytes(blobPath);
        } catch (IOException e) {
            throw new CorruptIndexException("Unreadable snapshot in " + directory + ": " + e.getMessage(), e);
        }

        return Optional.of(decode(blob, metadata));
    }

    private IndexSnapshot decode(byte[] blob, SnapshotMetadata metadata) {
        if (metadata == null) {
            throw new CorruptIndexException("Snapshot metadata document is empty");
        }
        requireSection(metadata.getIdMap(), "id_map");
        requireSection(metadata.getPersonEmbeddings(), "person_embeddings");
        requireSection(metadata.getInactivePositions(), "inactive_positions");
        requireSection(metadata.getZeroPositions(), "zero_positions");
        if (blob.length < HEADER_BYTES) {
            throw new CorruptIndexException("Snapshot blob truncated: " + blob.length + " bytes");
        }
        ByteBuffer buffer = ByteBuffer.wrap(blob).order(ByteOrder.LITTLE_ENDIAN);
        byte[] magic = new byte[MAGIC.length];
        buffer.get(magic);
        if (!Arrays.equals(MAGIC, magic)) {
            throw new CorruptIndexException("Snapshot blob has wrong magic header");
        }
        int version = buffer.getInt();
        if (version != FORMAT_VERSION) {
            throw new CorruptIndexException("Unsupported snapshot version " + version);
        }
        int dimension = buffer.getInt();
        int count = buffer.getInt();

        if (dimension != metadata.getDimension() || count != metadata.getTotalVectors()) {
            throw new CorruptIndexException("Snapshot blob (" + count + "x" + dimension
                    + ") disagrees with metadata (" + metadata.getTotalVectors() + "x" + metadata.getDimension() + ")");
        }
        long expectedBytes = (long) count * dimension * Float.BYTES;
        if (dimension < 1 || count < 0 || buffer.remaining() != expectedBytes) {
            throw new CorruptIndexException("Snapshot blob holds " + buffer.remaining()
                    + " vector bytes, expected " + expectedBytes);
        }
        float[] vectors = new float[count * dimension];
        buffer.asFloatBuffer().get(vectors);

        List<IndexEntry> entries = new ArrayList<>(count);
        for (int position = 0; position < count; position++) {
            SnapshotMetadata.EntryRef ref = metadata.getIdMap().get(String.valueOf(position));
            if (ref == null) {
                throw new CorruptIndexException("Snapshot metadata has no entry for position " + position);
            }
            entries.add(new IndexEntry(position, ref.getEmbeddingId(), ref.getPersonId()));
        }
        if (metadata.getIdMap().size() != count) {
            throw new CorruptIndexException("Snapshot metadata maps " + metadata.getIdMap().size()
                    + " positions, blob holds " + count);
        }

        return new IndexSnapshot(dimension, vectors, entries,
                metadata.getPersonEmbeddings(),
                metadata.getInactivePositions(),
                metadata.getZeroPositions());
    }

    private static void requireSection(Object section, String name) {
        if (section == null) {
            throw new CorruptIndexException("Snapshot metadata section " + name + " is missing");
        }
    }

    private SnapshotMetadata toMetadata(IndexSnapshot snapshot) {
        Map<String, SnapshotMetadata.EntryRef> idMap = new LinkedHashMap<>();
        for (IndexEntry entry : snapshot.entries()) {
            idMap.put(String.valueOf(entry.position()),
                    new SnapshotMetadata.EntryRef(entry.ownerPersonId(), entry.embeddingId()));
        }
        return SnapshotMetadata.builder()
                .dimension(snapshot.dimension())
                .totalVectors(snapshot.entries().size())
                .idMap(idMap)
                .personEmbeddings(new LinkedHashMap<>(snapshot.personPositions()))
                .inactivePositions(new ArrayList<>(snapshot.inactivePositions()))
                .zeroPositions(new ArrayList<>(snapshot.zeroPositions()))
                .createdAt(Instant.now())
                .build();
    }

    private static void move(Path source, Path target) throws IOException {
        try {
            Files.move(source, target, StandardCopyOption.ATOMIC_MOVE, StandardCopyOption.REPLACE_EXISTING);
        } catch (AtomicMoveNotSupportedException e) {
            log.debug("[INDEX] Atomic move not supported for {}, replacing in place", target);
            Files.move(source, target, StandardCopyOption.REPLACE_EXISTING);
        }
    }
}
