package io.vulnscan.index;

/**
 * Scoring function of a vector index, fixed for the index's lifetime.
 */
public enum Metric {

    /** Dot product over length-normalized vectors; higher is closer */
    INNER_PRODUCT,

    /** Euclidean distance; lower is closer */
    L2;

    /**
     * Converts a raw score into a similarity where higher is always closer.
     */
    public float toSimilarity(float score) {
        return switch (this) {
            case INNER_PRODUCT -> score;
            case L2 -> 1.0f / (1.0f + score);
        };
    }
}
