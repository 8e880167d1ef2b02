package io.vulnscan.providers.rerank;

/**
 * Relevance of one document, identified by its position in the request.
 */
public record RerankResult(int index, float score) implements Comparable<RerankResult> {

    @Override
    public int compareTo(RerankResult other) {
        int byScore = Float.compare(other.score, score);
        return byScore != 0 ? byScore : Integer.compare(index, other.index);
    }
}
