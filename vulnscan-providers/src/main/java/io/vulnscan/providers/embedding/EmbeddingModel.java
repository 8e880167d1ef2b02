package io.vulnscan.providers.embedding;

import io.vulnscan.providers.InputKind;

import java.io.Closeable;
import java.util.List;

/**
 * Interface for generating text embeddings.
 *
 * <p>Implementations can call remote APIs or compute vectors locally. Every
 * vector an implementation returns has exactly {@link #getDimensions()} entries.</p>
 */
public interface EmbeddingModel extends Closeable {

    /**
     * Embeds texts, one vector per text in the same order.
     *
     * @throws io.vulnscan.TransientProviderException when the provider is
     *         temporarily unavailable after retries
     * @throws io.vulnscan.PermanentInputException when the provider rejects the request
     */
    List<float[]> embed(List<String> texts, InputKind kind);

    default float[] embed(String text, InputKind kind) {
        return embed(List.of(text), kind).get(0);
    }

    /**
     * Embeds stored documents.
     */
    default List<float[]> embedBatch(List<String> texts) {
        return embed(texts, InputKind.DOCUMENT);
    }

    /**
     * Embeds a search query.
     */
    default float[] embedQuery(String query) {
        return embed(query, InputKind.QUERY);
    }

    /**
     * Returns the model identifier (e.g., "voyage-code-3").
     */
    String getModelId();

    /**
     * Returns the embedding dimensions.
     */
    int getDimensions();

    @Override
    void close();

    /**
     * Creates the model described by a configuration.
     */
    static EmbeddingModel load(EmbeddingConfig config) {
        return switch (config.backend()) {
            case HTTP -> new HttpEmbeddingModel(config);
            case HASHING -> new HashingEmbeddingModel(config.modelId(), config.dimensions());
        };
    }
}
