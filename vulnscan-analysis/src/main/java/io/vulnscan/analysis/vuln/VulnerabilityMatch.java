package io.vulnscan.analysis.vuln;

/**
 * A vulnerability candidate for the repository under analysis.
 *
 * @param record the vulnerability
 * @param similarity first-pass vector similarity
 * @param relevance reranker relevance, or the similarity when reranking was unavailable
 */
public record VulnerabilityMatch(VulnerabilityRecord record, float similarity, float relevance)
        implements Comparable<VulnerabilityMatch> {

    public static VulnerabilityMatch firstPass(VulnerabilityRecord record, float similarity) {
        return new VulnerabilityMatch(record, similarity, similarity);
    }

    public VulnerabilityMatch withRelevance(float relevance) {
        return new VulnerabilityMatch(record, similarity, relevance);
    }

    public String id() {
        return record.id();
    }

    @Override
    public int compareTo(VulnerabilityMatch other) {
        int byRelevance = Float.compare(other.relevance, relevance);
        return byRelevance != 0 ? byRelevance : record.id().compareTo(other.record.id());
    }
}
