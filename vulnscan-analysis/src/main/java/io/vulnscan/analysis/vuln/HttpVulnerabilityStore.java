package io.vulnscan.analysis.vuln;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonProperty;
import io.vulnscan.PermanentInputException;
import io.vulnscan.TransientProviderException;
import io.vulnscan.providers.JsonHttpClient;
import io.vulnscan.providers.ProviderEndpoint;
import io.vulnscan.providers.RetryPolicy;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.Collections;
import java.util.HashSet;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Set;

/**
 * Remote vulnerability store reached over REST.
 *
 * <p>Request: {@code POST {url}/search} with {@code {"vector", "top_k", "similarity_threshold"}}.
 * Response: {@code {"results": [...]}} (or {@code "data"}), each item carrying
 * {@code cve_id}, {@code summary}, {@code cvss_score} and one of {@code score},
 * {@code similarity_score} or {@code distance}. A body with
 * {@code "success": false} is a service error.</p>
 */
public class HttpVulnerabilityStore implements VulnerabilityStore {

    private static final Logger log = LoggerFactory.getLogger(HttpVulnerabilityStore.class);

    private final ProviderEndpoint endpoint;
    private final int dimensions;
    private final RetryPolicy retry;
    private final JsonHttpClient http;

    public HttpVulnerabilityStore(ProviderEndpoint endpoint, int dimensions, RetryPolicy retry, JsonHttpClient http) {
        if (dimensions < 1) throw new IllegalArgumentException("dimensions must be >= 1");
        this.endpoint = endpoint;
        this.dimensions = dimensions;
        this.retry = retry;
        this.http = http;
    }

    @Override
    public List<VulnerabilityMatch> similaritySearch(float[] vector, int limit, double threshold) {
        if (vector.length != dimensions) {
            throw new PermanentInputException(PermanentInputException.Reason.WIDTH_MISMATCH, String.format(
                "Vulnerability store dimension mismatch: expected %d, got %d", dimensions, vector.length));
        }
        Map<String, Object> request = new LinkedHashMap<>();
        request.put("vector", vector);
        request.put("top_k", limit);
        request.put("similarity_threshold", threshold);

        SearchResponse response = retry.execute("Vulnerability search",
            () -> http.post(endpoint.resolve("/search"), endpoint.apiKey(), request, SearchResponse.class));
        if (Boolean.FALSE.equals(response.success)) {
            throw new TransientProviderException(TransientProviderException.Reason.SERVICE_ERROR,
                "Vulnerability store error: " + (response.error != null ? response.error : "unknown"));
        }

        List<Item> items = response.results != null ? response.results
            : response.data != null ? response.data : List.of();
        List<VulnerabilityMatch> matches = new ArrayList<>();
        Set<String> seen = new HashSet<>();
        for (Item item : items) {
            if (item.cveId == null || !seen.add(item.cveId)) {
                continue;
            }
            float score = item.score();
            if (score < threshold) {
                continue;
            }
            VulnerabilityRecord record = new VulnerabilityRecord(item.cveId,
                item.summary != null ? item.summary : item.description, item.cvssScore, item.cvssVector);
            matches.add(VulnerabilityMatch.firstPass(record, score));
        }
        Collections.sort(matches);
        log.debug("Vulnerability store returned {} matches", matches.size());
        return matches.size() > limit ? matches.subList(0, limit) : matches;
    }

    @Override
    public int dimensions() {
        return dimensions;
    }

    @Override
    public String describe() {
        return endpoint.url().toString();
    }

    // ==================== Response DTOs ====================

    @JsonIgnoreProperties(ignoreUnknown = true)
    static class SearchResponse {
        @JsonProperty("success")
        public Boolean success;

        @JsonProperty("error")
        public String error;

        @JsonProperty("results")
        public List<Item> results;

        @JsonProperty("data")
        public List<Item> data;
    }

    @JsonIgnoreProperties(ignoreUnknown = true)
    static class Item {
        @JsonProperty("cve_id")
        public String cveId;

        @JsonProperty("summary")
        public String summary;

        @JsonProperty("description")
        public String description;

        @JsonProperty("cvss_score")
        public Double cvssScore;

        @JsonProperty("cvss_vector")
        public String cvssVector;

        @JsonProperty("score")
        public Double score;

        @JsonProperty("similarity_score")
        public Double similarityScore;

        @JsonProperty("distance")
        public Double distance;

        float score() {
            if (score != null) return score.floatValue();
            if (similarityScore != null) return similarityScore.floatValue();
            if (distance != null) return (float) (1.0 - distance);
            return 0f;
        }
    }
}
