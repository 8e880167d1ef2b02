package io.vulnscan.index;

/**
 * Configuration for creating a VectorIndex.
 */
public record IndexConfig(
    /** Embedding model identifier */
    String modelId,

    /** Vector dimensions */
    int dimensions,

    /** Scoring function */
    Metric metric,

    /** Search structure */
    IndexKind kind,

    /** Save automatically after this many inserted records (0 = never) */
    int checkpointInterval,

    /** HNSW M parameter (max connections) */
    int hnswM,

    /** HNSW efConstruction parameter */
    int hnswEfConstruction,

    /** HNSW efSearch parameter */
    int hnswEfSearch,

    /** Initial HNSW capacity; the graph is rebuilt larger when exceeded */
    int hnswMaxItems
) {
    public static final int DEFAULT_CHECKPOINT_INTERVAL = 100;

    public IndexConfig {
        if (modelId == null || modelId.isBlank()) throw new IllegalArgumentException("modelId is required");
        if (dimensions < 1) throw new IllegalArgumentException("dimensions must be >= 1");
        if (metric == null) metric = Metric.INNER_PRODUCT;
        if (kind == null) kind = IndexKind.FLAT;
        if (checkpointInterval < 0) throw new IllegalArgumentException("checkpointInterval must be >= 0");
    }

    public static IndexConfig forModel(String modelId, int dimensions) {
        return new IndexConfig(modelId, dimensions, Metric.INNER_PRODUCT, IndexKind.FLAT,
            DEFAULT_CHECKPOINT_INTERVAL, 16, 200, 50, 100_000);
    }

    public IndexConfig withMetric(Metric metric) {
        return new IndexConfig(modelId, dimensions, metric, kind, checkpointInterval,
            hnswM, hnswEfConstruction, hnswEfSearch, hnswMaxItems);
    }

    public IndexConfig withKind(IndexKind kind) {
        return new IndexConfig(modelId, dimensions, metric, kind, checkpointInterval,
            hnswM, hnswEfConstruction, hnswEfSearch, hnswMaxItems);
    }

    public IndexConfig withCheckpointInterval(int checkpointInterval) {
        return new IndexConfig(modelId, dimensions, metric, kind, checkpointInterval,
            hnswM, hnswEfConstruction, hnswEfSearch, hnswMaxItems);
    }

    public IndexConfig withHnswMaxItems(int hnswMaxItems) {
        return new IndexConfig(modelId, dimensions, metric, kind, checkpointInterval,
            hnswM, hnswEfConstruction, hnswEfSearch, hnswMaxItems);
    }
}
