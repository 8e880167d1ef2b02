package io.vulnscan.providers.embedding;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonProperty;
import io.vulnscan.PermanentInputException;
import io.vulnscan.TransientProviderException;
import io.vulnscan.providers.InputKind;
import io.vulnscan.providers.JsonHttpClient;
import io.vulnscan.providers.ProviderEndpoint;
import io.vulnscan.providers.RetryPolicy;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.*;

/**
 * Embedding model behind an OpenAI/Voyage-compatible REST endpoint.
 *
 * <p>Request: {@code {"input": [...], "model": ..., "input_type": "document"|"query"}}.
 * Response: {@code {"data": [{"index": i, "embedding": [...]}, ...]}}.</p>
 *
 * <p>Texts are sent in batches of {@link EmbeddingConfig#batchSize()}; each batch
 * is retried independently on transient failures.</p>
 *
 * @see <a href="https://docs.voyageai.com/docs/embeddings">Voyage AI Embeddings</a>
 */
public class HttpEmbeddingModel implements EmbeddingModel {

    private static final Logger log = LoggerFactory.getLogger(HttpEmbeddingModel.class);

    private final ProviderEndpoint endpoint;
    private final String modelId;
    private final int dimensions;
    private final int batchSize;
    private final RetryPolicy retry;
    private final JsonHttpClient http;

    public HttpEmbeddingModel(EmbeddingConfig config) {
        this(config, new JsonHttpClient(config.timeout()));
    }

    public HttpEmbeddingModel(EmbeddingConfig config, JsonHttpClient http) {
        this.endpoint = Objects.requireNonNull(config.endpoint(), "HTTP embedding backend needs an endpoint");
        this.modelId = config.modelId();
        this.dimensions = config.dimensions();
        this.batchSize = config.batchSize();
        this.retry = config.retry();
        this.http = http;

        log.info("Initialized HTTP embedding model: {} ({}D) at {}", modelId, dimensions, endpoint.url());
    }

    @Override
    public List<float[]> embed(List<String> texts, InputKind kind) {
        List<float[]> all = new ArrayList<>(texts.size());
        for (int i = 0; i < texts.size(); i += batchSize) {
            List<String> batch = texts.subList(i, Math.min(i + batchSize, texts.size()));
            all.addAll(retry.execute("Embedding request", () -> embedOnce(batch, kind)));
        }
        return all;
    }

    private List<float[]> embedOnce(List<String> texts, InputKind kind) {
        Map<String, Object> request = new LinkedHashMap<>();
        request.put("input", texts);
        request.put("model", modelId);
        request.put("input_type", kind.wireName());

        EmbeddingResponse response = http.post(endpoint.url(), endpoint.apiKey(), request, EmbeddingResponse.class);
        if (response.data == null || response.data.size() != texts.size()) {
            throw new TransientProviderException(TransientProviderException.Reason.SERVICE_ERROR, String.format(
                "Embedding provider returned %d vectors for %d inputs",
                response.data == null ? 0 : response.data.size(), texts.size()));
        }

        float[][] ordered = new float[texts.size()][];
        for (EmbeddingData d : response.data) {
            if (d.embedding == null || d.embedding.length != dimensions) {
                throw new PermanentInputException(PermanentInputException.Reason.WIDTH_MISMATCH, String.format(
                    "Embedding dimension mismatch: expected %d, got %d",
                    dimensions, d.embedding == null ? 0 : d.embedding.length));
            }
            if (d.index < 0 || d.index >= ordered.length) {
                throw new TransientProviderException(TransientProviderException.Reason.SERVICE_ERROR,
                    "Embedding provider returned out-of-range index " + d.index);
            }
            ordered[d.index] = d.embedding;
        }
        return Arrays.asList(ordered);
    }

    @Override
    public String getModelId() {
        return modelId;
    }

    @Override
    public int getDimensions() {
        return dimensions;
    }

    @Override
    public void close() {
        // HttpClient doesn't need explicit closing on JDK 17
    }

    // ==================== Response DTOs ====================

    @JsonIgnoreProperties(ignoreUnknown = true)
    static class EmbeddingResponse {
        @JsonProperty("data")
        public List<EmbeddingData> data;
    }

    @JsonIgnoreProperties(ignoreUnknown = true)
    static class EmbeddingData {
        @JsonProperty("embedding")
        public float[] embedding;

        @JsonProperty("index")
        public int index;
    }
}
