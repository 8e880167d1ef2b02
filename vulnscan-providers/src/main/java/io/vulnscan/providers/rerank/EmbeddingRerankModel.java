package io.vulnscan.providers.rerank;

import io.vulnscan.index.Vectors;
import io.vulnscan.providers.InputKind;
import io.vulnscan.providers.embedding.EmbeddingModel;

import java.util.ArrayList;
import java.util.List;
import java.util.stream.Collectors;

/**
 * Reranks by cosine similarity between query and document embeddings.
 * Used when no dedicated rerank endpoint is configured; negative similarities
 * score zero.
 */
public class EmbeddingRerankModel implements RerankModel {

    private final EmbeddingModel embeddings;

    public EmbeddingRerankModel(EmbeddingModel embeddings) {
        this.embeddings = embeddings;
    }

    @Override
    public List<RerankResult> rerank(String query, List<String> documents, int topN) {
        if (documents.isEmpty() || topN <= 0) {
            return List.of();
        }
        float[] queryVector = embeddings.embedQuery(query);
        List<float[]> documentVectors = embeddings.embed(documents, InputKind.DOCUMENT);

        List<RerankResult> results = new ArrayList<>(documents.size());
        for (int i = 0; i < documentVectors.size(); i++) {
            float score = Math.max(0f, Vectors.cosine(queryVector, documentVectors.get(i)));
            results.add(new RerankResult(i, score));
        }
        return results.stream().sorted().limit(topN).collect(Collectors.toList());
    }

    @Override
    public String getModelId() {
        return "embedding:" + embeddings.getModelId();
    }
}
