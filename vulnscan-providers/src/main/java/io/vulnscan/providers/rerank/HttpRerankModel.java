package io.vulnscan.providers.rerank;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonProperty;
import io.vulnscan.TransientProviderException;
import io.vulnscan.providers.JsonHttpClient;
import io.vulnscan.providers.ProviderEndpoint;
import io.vulnscan.providers.RetryPolicy;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.*;
import java.util.stream.Collectors;

/**
 * Cohere-compatible rerank endpoint.
 *
 * <p>Request: {@code {"model", "query", "documents", "top_n"}}.
 * Response: {@code {"results": [{"index", "relevance_score"}]}}.</p>
 */
public class HttpRerankModel implements RerankModel {

    private static final Logger log = LoggerFactory.getLogger(HttpRerankModel.class);

    private final ProviderEndpoint endpoint;
    private final RetryPolicy retry;
    private final JsonHttpClient http;

    public HttpRerankModel(ProviderEndpoint endpoint, RetryPolicy retry, JsonHttpClient http) {
        this.endpoint = endpoint;
        this.retry = retry;
        this.http = http;
        log.info("Initialized rerank model: {} at {}", endpoint.model(), endpoint.url());
    }

    @Override
    public List<RerankResult> rerank(String query, List<String> documents, int topN) {
        if (documents.isEmpty() || topN <= 0) {
            return List.of();
        }
        Map<String, Object> request = new LinkedHashMap<>();
        request.put("model", endpoint.model());
        request.put("query", query);
        request.put("documents", documents);
        request.put("top_n", Math.min(topN, documents.size()));

        RerankResponse response = retry.execute("Rerank request",
            () -> http.post(endpoint.url(), endpoint.apiKey(), request, RerankResponse.class));
        if (response.results == null) {
            throw new TransientProviderException(TransientProviderException.Reason.SERVICE_ERROR,
                "Rerank response has no results");
        }
        return response.results.stream()
            .filter(r -> r.index >= 0 && r.index < documents.size())
            .map(r -> new RerankResult(r.index, r.relevanceScore))
            .sorted()
            .limit(topN)
            .collect(Collectors.toList());
    }

    @Override
    public String getModelId() {
        return endpoint.model();
    }

    // ==================== Response DTOs ====================

    @JsonIgnoreProperties(ignoreUnknown = true)
    static class RerankResponse {
        @JsonProperty("results")
        public List<ResultItem> results;
    }

    @JsonIgnoreProperties(ignoreUnknown = true)
    static class ResultItem {
        @JsonProperty("index")
        public int index;

        @JsonProperty("relevance_score")
        public float relevanceScore;
    }
}
