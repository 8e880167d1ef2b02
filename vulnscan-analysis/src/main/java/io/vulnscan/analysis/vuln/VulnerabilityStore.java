package io.vulnscan.analysis.vuln;

import java.util.List;

/**
 * A vector store of known vulnerability records.
 */
public interface VulnerabilityStore {

    /**
     * Returns up to {@code limit} records with similarity at least {@code threshold}, best first.
     *
     * @param vector query vector of exactly {@link #dimensions()} entries
     */
    List<VulnerabilityMatch> similaritySearch(float[] vector, int limit, double threshold);

    /**
     * Width of the vectors this store holds.
     */
    int dimensions();

    /**
     * Human-readable location, for logs.
     */
    String describe();
}
