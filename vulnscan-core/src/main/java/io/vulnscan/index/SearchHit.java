package io.vulnscan.index;

import java.util.Map;

/**
 * A single nearest-neighbor match.
 *
 * <p>{@code score} is the raw metric value: a dot product for
 * {@link Metric#INNER_PRODUCT}, a distance for {@link Metric#L2}.</p>
 */
public record SearchHit(int id, float score, Metric metric, Map<String, Object> metadata)
        implements Comparable<SearchHit> {

    /**
     * Score on a higher-is-closer scale regardless of metric.
     */
    public float similarity() {
        return metric.toSimilarity(score);
    }

    /**
     * Best match first.
     */
    @Override
    public int compareTo(SearchHit other) {
        int byScore = Float.compare(other.similarity(), similarity());
        return byScore != 0 ? byScore : Integer.compare(id, other.id);
    }
}
