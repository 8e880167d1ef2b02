package io.vulnscan.providers.rerank;

import java.util.List;

/**
 * Second-pass relevance scoring of a small candidate set.
 */
public interface RerankModel {

    /**
     * Scores documents against a query.
     *
     * @param topN maximum results to return
     * @return at most {@code topN} results, best first; indices refer to {@code documents}
     */
    List<RerankResult> rerank(String query, List<String> documents, int topN);

    String getModelId();
}
