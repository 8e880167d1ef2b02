package io.vulnscan.index;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.ObjectMapper;
import io.vulnscan.UnsupportedFormatException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.*;
import java.nio.charset.StandardCharsets;
import java.nio.file.AtomicMoveNotSupportedException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.StandardCopyOption;
import java.util.*;

/**
 * Reads and writes the index file pair.
 *
 * <p>Index file layout: magic {@code VIDX}, format version, kind, metric,
 * dimensions, record count, model id, then {@code count * dimensions} floats,
 * then kind-specific payload. The metadata table is a JSON array in id order.</p>
 *
 * <p>Both files are written to temporaries and moved into place metadata first,
 * index last. Because the index is append-only, a crash between the two moves
 * leaves a metadata table that is a superset of the index; the loader truncates
 * it back to the index count.</p>
 */
final class IndexPersistence {

    private static final Logger log = LoggerFactory.getLogger(IndexPersistence.class);

    private static final byte[] MAGIC = "VIDX".getBytes(StandardCharsets.US_ASCII);
    private static final short FORMAT_VERSION = 1;
    private static final ObjectMapper MAPPER = new ObjectMapper();
    private static final TypeReference<List<Map<String, Object>>> METADATA_TYPE = new TypeReference<>() { };

    private IndexPersistence() {
    }

    // ==================== Save ====================

    static void save(AbstractVectorIndex index, IndexFiles files) throws IOException {
        IndexConfig config = index.config();
        List<float[]> vectors = index.vectorsView();
        List<Map<String, Object>> metadata = index.metadataView();

        Path dir = files.indexFile().toAbsolutePath().getParent();
        if (dir != null) {
            Files.createDirectories(dir);
        }
        Path tmpMetadata = temporarySibling(files.metadataFile());
        Path tmpIndex = temporarySibling(files.indexFile());

        try {
            MAPPER.writeValue(tmpMetadata.toFile(), metadata);

            try (DataOutputStream out = new DataOutputStream(
                    new BufferedOutputStream(Files.newOutputStream(tmpIndex)))) {
                out.write(MAGIC);
                out.writeShort(FORMAT_VERSION);
                out.writeByte(config.kind().ordinal());
                out.writeByte(config.metric().ordinal());
                out.writeInt(config.dimensions());
                out.writeInt(vectors.size());
                out.writeUTF(config.modelId());
                for (float[] vector : vectors) {
                    for (float v : vector) {
                        out.writeFloat(v);
                    }
                }
                index.writePayload(out);
            }

            move(tmpMetadata, files.metadataFile());
            move(tmpIndex, files.indexFile());
        } finally {
            Files.deleteIfExists(tmpMetadata);
            Files.deleteIfExists(tmpIndex);
        }
    }

    private static Path temporarySibling(Path target) {
        return target.resolveSibling(target.getFileName() + ".tmp");
    }

    private static void move(Path source, Path target) throws IOException {
        try {
            Files.move(source, target, StandardCopyOption.REPLACE_EXISTING, StandardCopyOption.ATOMIC_MOVE);
        } catch (AtomicMoveNotSupportedException e) {
            Files.move(source, target, StandardCopyOption.REPLACE_EXISTING);
        }
    }

    // ==================== Load ====================

    static Optional<VectorIndex> load(IndexFiles files) throws IOException {
        if (!files.isPresent()) {
            log.debug("No index at {}", files.indexFile());
            return Optional.empty();
        }

        List<Map<String, Object>> metadata;
        try {
            metadata = MAPPER.readValue(files.metadataFile().toFile(), METADATA_TYPE);
        } catch (JsonProcessingException e) {
            log.warn("Metadata table {} is unreadable; treating index as absent: {}",
                files.metadataFile(), e.getOriginalMessage());
            return Optional.empty();
        }
        long indexBytes = Files.size(files.indexFile());

        try (DataInputStream in = new DataInputStream(
                new BufferedInputStream(Files.newInputStream(files.indexFile())))) {
            byte[] magic = new byte[MAGIC.length];
            in.readFully(magic);
            if (!Arrays.equals(magic, MAGIC)) {
                log.warn("{} is not a vector index (magic: {}); treating index as absent",
                    files.indexFile(), new String(magic, StandardCharsets.US_ASCII));
                return Optional.empty();
            }
            short version = in.readShort();
            if (version != FORMAT_VERSION) {
                throw new UnsupportedFormatException(version);
            }

            int kindOrdinal = in.readUnsignedByte();
            int metricOrdinal = in.readUnsignedByte();
            int dimensions = in.readInt();
            int count = in.readInt();
            String modelId = in.readUTF();

            if (kindOrdinal >= IndexKind.values().length || metricOrdinal >= Metric.values().length
                    || dimensions <= 0 || count < 0
                    || (long) count * dimensions * Float.BYTES > indexBytes) {
                log.warn("Index header in {} is corrupt (kind {}, metric {}, {}d, {} vectors); treating index as absent",
                    files.indexFile(), kindOrdinal, metricOrdinal, dimensions, count);
                return Optional.empty();
            }
            IndexKind kind = IndexKind.values()[kindOrdinal];
            Metric metric = Metric.values()[metricOrdinal];

            if (metadata.size() < count) {
                log.warn("Metadata table at {} has {} entries for {} vectors; treating index as absent",
                    files.metadataFile(), metadata.size(), count);
                return Optional.empty();
            }
            if (metadata.size() > count) {
                log.warn("Dropping {} metadata entries beyond the last saved vector", metadata.size() - count);
                metadata = metadata.subList(0, count);
            }

            List<float[]> vectors = new ArrayList<>(count);
            for (int i = 0; i < count; i++) {
                float[] vector = new float[dimensions];
                for (int d = 0; d < dimensions; d++) {
                    vector[d] = in.readFloat();
                }
                vectors.add(vector);
            }

            IndexConfig config = IndexConfig.forModel(modelId, dimensions)
                .withMetric(metric)
                .withKind(kind)
                .withHnswMaxItems(Math.max(count * 2, 100_000));
            AbstractVectorIndex index = (AbstractVectorIndex) VectorIndex.create(config, files);
            index.restore(vectors, metadata);
            if (index instanceof HnswVectorIndex hnsw) {
                hnsw.readPayload(in);
            }

            log.info("Loaded index: {} records ({}, {}d, {})", count, modelId, dimensions, metric);
            return Optional.of(index);
        } catch (EOFException | UTFDataFormatException e) {
            log.warn("Index file {} is truncated; treating index as absent", files.indexFile());
            return Optional.empty();
        }
    }
}
