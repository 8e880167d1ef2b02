package io.vulnscan.providers.embedding;

import io.vulnscan.providers.ProviderEndpoint;
import io.vulnscan.providers.RetryPolicy;

import java.time.Duration;

/**
 * Configuration for embedding models.
 */
public record EmbeddingConfig(
    /** Backend to use for embedding generation */
    EmbeddingBackend backend,

    /** Model identifier sent to the provider and used in cache keys */
    String modelId,

    /** Output dimensions */
    int dimensions,

    /** REST endpoint (HTTP backend only) */
    ProviderEndpoint endpoint,

    /** Texts per upstream request */
    int batchSize,

    /** Per-request timeout */
    Duration timeout,

    /** Retry behavior for transient failures */
    RetryPolicy retry
) {
    public static final String DEFAULT_HASHING_MODEL = "hashing-v1";

    public EmbeddingConfig {
        if (dimensions < 1) throw new IllegalArgumentException("dimensions must be >= 1");
        if (batchSize < 1) throw new IllegalArgumentException("batchSize must be >= 1");
        if (retry == null) retry = RetryPolicy.defaults();
        if (timeout == null) timeout = Duration.ofSeconds(60);
    }

    /**
     * Offline hashing model; no network access.
     */
    public static EmbeddingConfig defaults() {
        return new EmbeddingConfig(EmbeddingBackend.HASHING, DEFAULT_HASHING_MODEL, 384, null, 128, null, null);
    }

    /**
     * REST provider, e.g. {@code https://api.voyageai.com/v1/embeddings} with model {@code voyage-code-3}.
     */
    public static EmbeddingConfig http(ProviderEndpoint endpoint, int dimensions) {
        return new EmbeddingConfig(EmbeddingBackend.HTTP, endpoint.model(), dimensions, endpoint, 128, null, null);
    }

    public EmbeddingConfig withBatchSize(int batchSize) {
        return new EmbeddingConfig(backend, modelId, dimensions, endpoint, batchSize, timeout, retry);
    }

    public EmbeddingConfig withDimensions(int dimensions) {
        return new EmbeddingConfig(backend, modelId, dimensions, endpoint, batchSize, timeout, retry);
    }

    public EmbeddingConfig withRetry(RetryPolicy retry) {
        return new EmbeddingConfig(backend, modelId, dimensions, endpoint, batchSize, timeout, retry);
    }
}
