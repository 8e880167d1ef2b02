package io.vulnscan.index;

import com.github.jelmerk.knn.DistanceFunction;
import com.github.jelmerk.knn.DistanceFunctions;
import com.github.jelmerk.knn.Item;
import com.github.jelmerk.knn.hnsw.HnswIndex;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.*;
import java.util.ArrayList;
import java.util.List;
import java.util.stream.Collectors;

/**
 * HNSW-based index for fast approximate nearest neighbor search.
 *
 * <p>Uses the Hierarchical Navigable Small World algorithm, O(log n) per query
 * instead of a full scan. Recommended for more than 10,000 vectors, e.g. a
 * local vulnerability-record corpus.</p>
 */
public class HnswVectorIndex extends AbstractVectorIndex {

    private static final Logger log = LoggerFactory.getLogger(HnswVectorIndex.class);

    private HnswIndex<Integer, float[], IndexedVector, Float> graph;
    private int capacity;

    public HnswVectorIndex(IndexConfig config) {
        this(config, null);
    }

    public HnswVectorIndex(IndexConfig config, IndexFiles files) {
        super(config, files);
        this.capacity = Math.max(config.hnswMaxItems(), 1);
        this.graph = newGraph(capacity);
        log.info("Created HNSW index: dims={}, metric={}, maxItems={}",
            config.dimensions(), config.metric(), capacity);
    }

    private HnswIndex<Integer, float[], IndexedVector, Float> newGraph(int maxItems) {
        return HnswIndex.newBuilder(config.dimensions(), distanceFunction(config.metric()), maxItems)
            .withM(config.hnswM())
            .withEfConstruction(config.hnswEfConstruction())
            .withEf(config.hnswEfSearch())
            .build();
    }

    private static DistanceFunction<float[], Float> distanceFunction(Metric metric) {
        return switch (metric) {
            case INNER_PRODUCT -> DistanceFunctions.FLOAT_INNER_PRODUCT;
            case L2 -> DistanceFunctions.FLOAT_EUCLIDEAN_DISTANCE;
        };
    }

    // ==================== Modification ====================

    @Override
    protected void onAdded(int firstId, List<float[]> added) {
        if (vectors.size() > capacity) {
            grow(Math.max(capacity * 2, vectors.size()));
            return;
        }
        List<IndexedVector> items = new ArrayList<>(added.size());
        for (int i = 0; i < added.size(); i++) {
            items.add(new IndexedVector(firstId + i, added.get(i)));
        }
        insert(graph, items);
    }

    private void grow(int newCapacity) {
        log.info("Growing HNSW index from {} to {} items", capacity, newCapacity);
        HnswIndex<Integer, float[], IndexedVector, Float> larger = newGraph(newCapacity);
        List<IndexedVector> items = new ArrayList<>(vectors.size());
        for (int id = 0; id < vectors.size(); id++) {
            items.add(new IndexedVector(id, vectors.get(id)));
        }
        insert(larger, items);
        this.graph = larger;
        this.capacity = newCapacity;
    }

    private static void insert(HnswIndex<Integer, float[], IndexedVector, Float> target, List<IndexedVector> items) {
        try {
            target.addAll(items);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new IllegalStateException("Interrupted while adding items to HNSW index", e);
        }
    }

    // ==================== Search ====================

    @Override
    protected List<SearchHit> nearest(float[] queryVector, int topK) {
        return graph.findNearest(queryVector, topK).stream()
            .map(r -> hit(r.item().id(), toScore(r.distance())))
            .sorted()
            .collect(Collectors.toList());
    }

    private float toScore(float distance) {
        // hnswlib reports inner product as 1 - dot
        return config.metric() == Metric.INNER_PRODUCT ? 1.0f - distance : distance;
    }

    // ==================== Persistence ====================

    @Override
    protected void writePayload(DataOutputStream out) throws IOException {
        ByteArrayOutputStream graphBytes = new ByteArrayOutputStream();
        graph.save(graphBytes);
        byte[] data = graphBytes.toByteArray();
        out.writeInt(capacity);
        out.writeInt(data.length);
        out.write(data);
    }

    /**
     * Restores the graph written by {@link #writePayload}. If the graph cannot
     * be read it is rebuilt from the already-restored vectors.
     */
    void readPayload(DataInputStream in) {
        try {
            int savedCapacity = in.readInt();
            byte[] data = new byte[in.readInt()];
            in.readFully(data);
            this.graph = HnswIndex.load(new ByteArrayInputStream(data));
            this.capacity = savedCapacity;
        } catch (IOException | RuntimeException e) {
            log.warn("Could not restore HNSW graph, rebuilding from {} vectors: {}", vectors.size(), e.getMessage());
            grow(Math.max(capacity, vectors.size() * 2));
        }
    }

    // ==================== HNSW Item Implementation ====================

    /**
     * Item wrapper for the HNSW graph; the id is the record's insertion position.
     */
    static final class IndexedVector implements Item<Integer, float[]>, Serializable {
        private static final long serialVersionUID = 1L;

        private final int id;
        private final float[] vector;

        IndexedVector(int id, float[] vector) {
            this.id = id;
            this.vector = vector;
        }

        @Override
        public Integer id() {
            return id;
        }

        @Override
        public float[] vector() {
            return vector;
        }

        @Override
        public int dimensions() {
            return vector.length;
        }
    }
}
