package io.vulnscan.analysis.vuln;

import io.vulnscan.index.SearchHit;
import io.vulnscan.index.VectorIndex;

import java.util.ArrayList;
import java.util.List;

/**
 * Vulnerability store backed by a local vector index built with
 * {@link VulnerabilityIndexBuilder}.
 */
public class IndexedVulnerabilityStore implements VulnerabilityStore {

    private final VectorIndex index;

    public IndexedVulnerabilityStore(VectorIndex index) {
        this.index = index;
    }

    @Override
    public List<VulnerabilityMatch> similaritySearch(float[] vector, int limit, double threshold) {
        List<VulnerabilityMatch> matches = new ArrayList<>();
        for (SearchHit hit : index.search(vector, limit)) {
            if (hit.similarity() >= threshold) {
                matches.add(VulnerabilityMatch.firstPass(VulnerabilityRecord.fromMetadata(hit.metadata()), hit.similarity()));
            }
        }
        return matches;
    }

    @Override
    public int dimensions() {
        return index.dimensions();
    }

    @Override
    public String describe() {
        return index.files().map(f -> f.indexFile().toString()).orElse("in-memory") + " (" + index.size() + " records)";
    }

    public VectorIndex getIndex() {
        return index;
    }
}
