package io.vulnscan.analysis.retrieval;

import io.vulnscan.PermanentInputException;
import io.vulnscan.ProgressCallback;
import io.vulnscan.TransientProviderException;
import io.vulnscan.analysis.run.CancellationToken;
import io.vulnscan.index.Metric;
import io.vulnscan.index.SearchHit;
import io.vulnscan.index.VectorIndex;
import io.vulnscan.index.Vectors;
import io.vulnscan.providers.embedding.EmbeddingModel;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.*;

/**
 * Semantic search over a codebase index.
 */
public class Retriever {

    private static final Logger log = LoggerFactory.getLogger(Retriever.class);

    private final EmbeddingModel embeddings;
    private final VectorIndex index;

    public Retriever(EmbeddingModel embeddings, VectorIndex index) {
        CodebaseIndexer.requireCompatible(index, embeddings);
        this.embeddings = embeddings;
        this.index = index;
    }

    /**
     * Returns up to {@code topK} chunks whose similarity is at least {@code threshold}, best first.
     */
    public List<RetrievalResult> search(String query, int topK, double threshold) {
        if (index.isEmpty() || topK <= 0) {
            return List.of();
        }
        float[] vector = embeddings.embedQuery(query);
        if (index.metric() == Metric.INNER_PRODUCT) {
            vector = Vectors.normalized(vector);
        }

        List<RetrievalResult> results = new ArrayList<>();
        for (SearchHit hit : index.search(vector, topK)) {
            float similarity = hit.similarity();
            if (similarity >= threshold) {
                results.add(new RetrievalResult(hit.id(), similarity, query, hit.metadata()));
            }
        }
        log.debug("Query '{}' matched {} chunks", query, results.size());
        return results;
    }

    public List<RetrievalResult> searchMultiple(List<String> queries, int topKPerQuery, double threshold) {
        return searchMultiple(queries, topKPerQuery, threshold, ProgressCallback.NONE, CancellationToken.NONE);
    }

    /**
     * Runs one search per query and merges by record, keeping each record's
     * highest score and the query that produced it.
     *
     * <p>A query that fails is logged and skipped; if every query fails the
     * last failure is rethrown.</p>
     */
    public List<RetrievalResult> searchMultiple(List<String> queries, int topKPerQuery, double threshold,
                                                ProgressCallback progress, CancellationToken cancellation) {
        Map<Integer, RetrievalResult> best = new HashMap<>();
        int failed = 0;
        RuntimeException lastFailure = null;

        for (int i = 0; i < queries.size(); i++) {
            cancellation.throwIfCancelled();
            String query = queries.get(i);
            try {
                for (RetrievalResult result : search(query, topKPerQuery, threshold)) {
                    best.merge(result.recordId(), result,
                        (existing, candidate) -> candidate.score() > existing.score() ? candidate : existing);
                }
            } catch (TransientProviderException | PermanentInputException e) {
                failed++;
                lastFailure = e;
                log.warn("Query '{}' failed, skipping: {}", query, e.getMessage());
            }
            progress.onProgress(i + 1, queries.size());
        }

        if (!queries.isEmpty() && failed == queries.size()) {
            throw lastFailure;
        }
        List<RetrievalResult> merged = new ArrayList<>(best.values());
        Collections.sort(merged);
        return merged;
    }

    public VectorIndex getIndex() {
        return index;
    }
}
