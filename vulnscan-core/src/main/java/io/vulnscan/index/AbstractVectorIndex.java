package io.vulnscan.index;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.DataOutputStream;
import java.io.IOException;
import java.util.*;
import java.util.concurrent.locks.Lock;
import java.util.concurrent.locks.ReadWriteLock;
import java.util.concurrent.locks.ReentrantLock;
import java.util.concurrent.locks.ReentrantReadWriteLock;

/**
 * Shared bookkeeping for index implementations: validation, id assignment,
 * the metadata table, checkpointing and locking.
 */
abstract class AbstractVectorIndex implements VectorIndex {

    private static final Logger log = LoggerFactory.getLogger(AbstractVectorIndex.class);

    protected final IndexConfig config;
    protected final List<float[]> vectors = new ArrayList<>();
    protected final List<Map<String, Object>> metadata = new ArrayList<>();
    protected final ReadWriteLock lock = new ReentrantReadWriteLock();

    private final IndexFiles files;
    // one writer at a time; saves share temporary file names
    private final Lock saveLock = new ReentrantLock();
    private volatile int checkpointedSize;

    protected AbstractVectorIndex(IndexConfig config, IndexFiles files) {
        this.config = Objects.requireNonNull(config, "config cannot be null");
        this.files = files;
    }

    /**
     * Called under the write lock after validation. Positions
     * {@code [firstId, firstId + added.size())} are already in {@link #vectors}.
     */
    protected abstract void onAdded(int firstId, List<float[]> added);

    /**
     * Called under the read lock with {@code 0 < topK <= size()}.
     */
    protected abstract List<SearchHit> nearest(float[] queryVector, int topK);

    // ==================== Modification ====================

    @Override
    public List<Integer> add(List<float[]> newVectors, List<Map<String, Object>> newMetadata) {
        Objects.requireNonNull(newVectors, "vectors cannot be null");
        Objects.requireNonNull(newMetadata, "metadata cannot be null");
        if (newVectors.size() != newMetadata.size()) {
            throw new IllegalArgumentException(String.format(
                "Metadata count mismatch: %d vectors but %d metadata entries",
                newVectors.size(), newMetadata.size()
            ));
        }
        for (float[] vector : newVectors) {
            checkWidth(vector, "Embedding");
        }
        if (newVectors.isEmpty()) {
            return List.of();
        }

        List<Integer> ids = new ArrayList<>(newVectors.size());
        int total;
        lock.writeLock().lock();
        try {
            int firstId = vectors.size();
            List<float[]> copies = new ArrayList<>(newVectors.size());
            for (int i = 0; i < newVectors.size(); i++) {
                float[] copy = newVectors.get(i).clone();
                copies.add(copy);
                vectors.add(copy);
                Map<String, Object> entry = newMetadata.get(i);
                metadata.add(Collections.unmodifiableMap(
                    entry != null ? new LinkedHashMap<>(entry) : new LinkedHashMap<>()));
                ids.add(firstId + i);
            }
            onAdded(firstId, copies);
            total = vectors.size();
        } finally {
            lock.writeLock().unlock();
        }

        log.debug("Added {} records (size={})", ids.size(), total);
        maybeCheckpoint(total);
        return ids;
    }

    // ==================== Search ====================

    @Override
    public List<SearchHit> search(float[] queryVector, int topK) {
        checkWidth(queryVector, "Query");
        lock.readLock().lock();
        try {
            if (vectors.isEmpty() || topK <= 0) {
                return List.of();
            }
            return nearest(queryVector, Math.min(topK, vectors.size()));
        } finally {
            lock.readLock().unlock();
        }
    }

    @Override
    public VectorRecord get(int id) {
        lock.readLock().lock();
        try {
            return new VectorRecord(id, vectors.get(id).clone(), metadata.get(id));
        } finally {
            lock.readLock().unlock();
        }
    }

    @Override
    public List<Map<String, Object>> metadata() {
        lock.readLock().lock();
        try {
            return List.copyOf(metadata);
        } finally {
            lock.readLock().unlock();
        }
    }

    protected SearchHit hit(int id, float score) {
        return new SearchHit(id, score, config.metric(), metadata.get(id));
    }

    protected float score(float[] query, float[] candidate) {
        return switch (config.metric()) {
            case INNER_PRODUCT -> Vectors.dot(query, candidate);
            case L2 -> Vectors.l2Distance(query, candidate);
        };
    }

    // ==================== Persistence ====================

    @Override
    public void save() throws IOException {
        if (files == null) {
            throw new IllegalStateException("Index is not bound to files; nothing to save to");
        }
        int saved;
        saveLock.lock();
        try {
            lock.readLock().lock();
            try {
                IndexPersistence.save(this, files);
                saved = vectors.size();
                checkpointedSize = saved;
            } finally {
                lock.readLock().unlock();
            }
        } finally {
            saveLock.unlock();
        }
        log.info("Saved index: {} records to {}", saved, files.indexFile());
    }

    @Override
    public Optional<IndexFiles> files() {
        return Optional.ofNullable(files);
    }

    /**
     * Writes kind-specific data after the shared header and vectors.
     * Called under the read lock.
     */
    protected void writePayload(DataOutputStream out) throws IOException {
    }

    private void maybeCheckpoint(int total) {
        int interval = config.checkpointInterval();
        if (files == null || interval == 0) {
            return;
        }
        if (total / interval > checkpointedSize / interval) {
            try {
                save();
            } catch (IOException e) {
                log.warn("Checkpoint of {} failed, continuing in memory: {}", files.indexFile(), e.getMessage());
            }
        }
    }

    // ==================== Metadata ====================

    @Override
    public IndexConfig config() {
        return config;
    }

    @Override
    public int size() {
        lock.readLock().lock();
        try {
            return vectors.size();
        } finally {
            lock.readLock().unlock();
        }
    }

    @Override
    public void close() {
        // In-memory structures only
    }

    /**
     * Bulk restore used by the loader; bypasses checkpointing.
     */
    void restore(List<float[]> loadedVectors, List<Map<String, Object>> loadedMetadata) {
        lock.writeLock().lock();
        try {
            vectors.addAll(loadedVectors);
            for (Map<String, Object> entry : loadedMetadata) {
                metadata.add(Collections.unmodifiableMap(new LinkedHashMap<>(entry)));
            }
            checkpointedSize = vectors.size();
        } finally {
            lock.writeLock().unlock();
        }
    }

    List<float[]> vectorsView() {
        return vectors;
    }

    List<Map<String, Object>> metadataView() {
        return metadata;
    }

    private void checkWidth(float[] vector, String what) {
        Objects.requireNonNull(vector, what + " vector cannot be null");
        if (vector.length != config.dimensions()) {
            throw new IllegalArgumentException(String.format(
                "%s dimension mismatch: expected %d, got %d",
                what, config.dimensions(), vector.length
            ));
        }
    }
}
