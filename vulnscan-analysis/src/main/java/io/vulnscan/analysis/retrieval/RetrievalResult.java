package io.vulnscan.analysis.retrieval;

import java.util.Map;

/**
 * One code chunk returned by a search, with the query that found it.
 *
 * @param recordId id of the chunk's record in the codebase index
 * @param score similarity, higher is better
 * @param query the query that produced this score
 * @param metadata the chunk's stored metadata
 */
public record RetrievalResult(int recordId, float score, String query, Map<String, Object> metadata)
        implements Comparable<RetrievalResult> {

    public String file() {
        return String.valueOf(metadata.get(CodebaseIndexer.FILE));
    }

    public int startLine() {
        return intValue(CodebaseIndexer.START_LINE);
    }

    public int endLine() {
        return intValue(CodebaseIndexer.END_LINE);
    }

    public String text() {
        Object text = metadata.get(CodebaseIndexer.TEXT);
        return text != null ? text.toString() : "";
    }

    public String language() {
        return String.valueOf(metadata.get(CodebaseIndexer.LANGUAGE));
    }

    private int intValue(String key) {
        Object value = metadata.get(key);
        return value instanceof Number n ? n.intValue() : 0;
    }

    @Override
    public int compareTo(RetrievalResult other) {
        int byScore = Float.compare(other.score, score);
        return byScore != 0 ? byScore : Integer.compare(recordId, other.recordId);
    }
}
