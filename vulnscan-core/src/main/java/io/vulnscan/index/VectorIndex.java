package io.vulnscan.index;

import java.io.IOException;
import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * Append-only nearest-neighbor index over fixed-width vectors with a parallel
 * metadata table.
 *
 * <p>Every record gets a sequential id equal to its insertion position. Ids are
 * never reused or reassigned. The dimension and metric are fixed at creation.</p>
 *
 * <h2>Usage Example</h2>
 * <pre>{@code
 * IndexFiles files = IndexFiles.in(Path.of("indexes/abc123"));
 * VectorIndex index = VectorIndex.create(IndexConfig.forModel("voyage-code-3", 1024), files);
 *
 * List<Integer> ids = index.add(vectors, metadata);
 * index.save();
 *
 * VectorIndex loaded = VectorIndex.load(files).orElseThrow();
 * List<SearchHit> hits = loaded.search(queryVector, 10);
 * }</pre>
 */
public interface VectorIndex extends AutoCloseable {

    // ==================== Factory Methods ====================

    /**
     * Creates a new empty, unpersisted index.
     */
    static VectorIndex create(IndexConfig config) {
        return create(config, null);
    }

    /**
     * Creates a new empty index bound to a file pair. Nothing is written until
     * {@link #save()} or the first checkpoint.
     */
    static VectorIndex create(IndexConfig config, IndexFiles files) {
        return switch (config.kind()) {
            case FLAT -> new FlatVectorIndex(config, files);
            case HNSW -> new HnswVectorIndex(config, files);
        };
    }

    /**
     * Loads a persisted index.
     *
     * <p>A missing file, a zero-length index file, or a metadata table shorter
     * than the index all mean "no index" and yield an empty result.</p>
     *
     * @throws IOException if the files exist but cannot be read
     * @throws io.vulnscan.UnsupportedFormatException if the format version is unknown
     */
    static Optional<VectorIndex> load(IndexFiles files) throws IOException {
        return IndexPersistence.load(files);
    }

    // ==================== Modification ====================

    /**
     * Appends vectors with one metadata entry each.
     *
     * @return the assigned ids, contiguous and starting at the pre-insert size
     * @throws IllegalArgumentException if the counts differ or a vector has the wrong width
     */
    List<Integer> add(List<float[]> vectors, List<Map<String, Object>> metadata);

    // ==================== Search ====================

    /**
     * Returns up to {@code topK} nearest records, best first. An empty index
     * yields an empty list; {@code topK} is capped at the index size.
     */
    List<SearchHit> search(float[] queryVector, int topK);

    /**
     * Returns the record with the given id.
     *
     * @throws IndexOutOfBoundsException if no such record exists
     */
    VectorRecord get(int id);

    /**
     * Returns a snapshot of all metadata entries in id order.
     */
    List<Map<String, Object>> metadata();

    // ==================== Persistence ====================

    /**
     * Writes the index and its metadata table as one pair.
     *
     * @throws IllegalStateException if the index is not bound to files
     */
    void save() throws IOException;

    /**
     * Returns the file pair this index persists to, if any.
     */
    Optional<IndexFiles> files();

    // ==================== Metadata ====================

    IndexConfig config();

    default String modelId() {
        return config().modelId();
    }

    default int dimensions() {
        return config().dimensions();
    }

    default Metric metric() {
        return config().metric();
    }

    int size();

    default boolean isEmpty() {
        return size() == 0;
    }

    @Override
    void close();
}
