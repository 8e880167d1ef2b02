package io.vulnscan.index;

/**
 * Search structure backing a vector index.
 */
public enum IndexKind {
    /** Exact brute-force scan; best for repository-sized indexes */
    FLAT,

    /** Approximate HNSW graph; for large corpora such as vulnerability records */
    HNSW
}
