package io.vulnscan.analysis.vuln;

import io.vulnscan.PermanentInputException;
import io.vulnscan.TransientProviderException;
import io.vulnscan.analysis.config.RetrievalSettings;
import io.vulnscan.analysis.retrieval.QueryDecomposer;
import io.vulnscan.analysis.config.WidthPolicy;
import io.vulnscan.index.Vectors;
import io.vulnscan.providers.embedding.EmbeddingModel;
import io.vulnscan.providers.rerank.RerankModel;
import io.vulnscan.providers.rerank.RerankResult;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Two-pass vulnerability candidate search: vector similarity against the
 * store, then reranking of {@code "{id}: {summary}"} documents.
 *
 * <p>Only reranked candidates at or above the rerank threshold are kept. If the
 * reranker fails after retries, the first-pass order and scores are used.</p>
 */
public class VulnerabilityRetriever {

    private static final Logger log = LoggerFactory.getLogger(VulnerabilityRetriever.class);

    private final EmbeddingModel embeddings;
    private final VulnerabilityStore store;
    private final RerankModel reranker;
    private final RetrievalSettings settings;

    public VulnerabilityRetriever(EmbeddingModel embeddings, VulnerabilityStore store,
                                  RerankModel reranker, RetrievalSettings settings) {
        this.embeddings = embeddings;
        this.store = store;
        this.reranker = reranker;
        this.settings = settings;
    }

    /**
     * @param candidates first-pass results fetched from the store
     * @param rerankTopN results kept after reranking
     */
    public List<VulnerabilityMatch> search(String query, int candidates, int rerankTopN) {
        return search(query, candidates, rerankTopN, false);
    }

    /**
     * @param expand also search keyword expansions of the query and keep each
     *               record's best first-pass similarity
     */
    public List<VulnerabilityMatch> search(String query, int candidates, int rerankTopN, boolean expand) {
        List<String> queries = expand ? QueryDecomposer.expand(query) : List.of(query);
        Map<String, VulnerabilityMatch> best = new LinkedHashMap<>();
        for (String q : queries) {
            float[] vector = queryVector(q);
            if (Vectors.dot(vector, vector) == 0f) {
                log.warn("Query '{}' embeds to a zero vector, skipping it", q);
                continue;
            }
            for (VulnerabilityMatch match : store.similaritySearch(vector, candidates, settings.vulnerabilityThreshold())) {
                best.merge(match.id(), match, (a, b) -> b.similarity() > a.similarity() ? b : a);
            }
        }
        List<VulnerabilityMatch> firstPass = new ArrayList<>(best.values());
        Collections.sort(firstPass);
        if (firstPass.size() > candidates) {
            firstPass = firstPass.subList(0, candidates);
        }
        log.info("First pass found {} vulnerability candidates in {}", firstPass.size(), store.describe());
        if (firstPass.isEmpty()) {
            return List.of();
        }
        return rerank(query, firstPass, rerankTopN);
    }

    List<VulnerabilityMatch> rerank(String query, List<VulnerabilityMatch> firstPass, int topN) {
        if (reranker == null) {
            return firstPass.subList(0, Math.min(topN, firstPass.size()));
        }
        List<String> documents = new ArrayList<>(firstPass.size());
        for (VulnerabilityMatch match : firstPass) {
            documents.add(match.record().document());
        }

        List<RerankResult> results;
        try {
            results = reranker.rerank(query, documents, topN);
        } catch (TransientProviderException | PermanentInputException e) {
            log.warn("Rerank failed, using first-pass scores: {}", e.getMessage());
            return firstPass.subList(0, Math.min(topN, firstPass.size()));
        }

        List<VulnerabilityMatch> promoted = new ArrayList<>();
        for (RerankResult result : results) {
            if (result.score() >= settings.rerankThreshold()) {
                promoted.add(firstPass.get(result.index()).withRelevance(result.score()));
            }
        }
        log.info("Reranking kept {} of {} candidates (threshold {})",
            promoted.size(), firstPass.size(), settings.rerankThreshold());
        return promoted;
    }

    private float[] queryVector(String query) {
        float[] vector = Vectors.normalized(embeddings.embedQuery(query));
        int width = store.dimensions();
        if (vector.length == width) {
            return vector;
        }
        if (settings.widthPolicy() == WidthPolicy.STRICT) {
            throw new PermanentInputException(PermanentInputException.Reason.WIDTH_MISMATCH, String.format(
                "Embedding dimension mismatch: expected %d, got %d", width, vector.length));
        }
        log.warn("Fitting {}-wide query vector to {}-wide vulnerability store; similarity precision is reduced",
            vector.length, width);
        return Vectors.normalized(Vectors.fitToWidth(vector, width));
    }
}
