package io.vulnscan.providers.embedding;

import io.vulnscan.index.Vectors;
import io.vulnscan.providers.InputKind;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.List;
import java.util.Locale;
import java.util.regex.Pattern;

/**
 * Local embedding model based on token feature hashing.
 *
 * <p>Text is split into lower-cased identifier parts (camelCase and snake_case
 * are split too); each token adds a signed count to one hashed bucket; the
 * result is L2-normalized. Texts that share vocabulary get high cosine
 * similarity, so retrieval works offline, but there is no semantic
 * understanding beyond shared tokens.</p>
 */
public class HashingEmbeddingModel implements EmbeddingModel {

    private static final Logger log = LoggerFactory.getLogger(HashingEmbeddingModel.class);

    private static final Pattern NON_WORD = Pattern.compile("[^A-Za-z0-9]+");
    private static final Pattern CAMEL_BOUNDARY = Pattern.compile("(?<=[a-z0-9])(?=[A-Z])|(?<=[A-Z])(?=[A-Z][a-z])");

    private final String modelId;
    private final int dimensions;

    public HashingEmbeddingModel(String modelId, int dimensions) {
        if (dimensions < 1) throw new IllegalArgumentException("dimensions must be >= 1");
        this.modelId = modelId;
        this.dimensions = dimensions;
        log.info("Initialized hashing embedding model: {} ({}d)", modelId, dimensions);
    }

    @Override
    public List<float[]> embed(List<String> texts, InputKind kind) {
        List<float[]> embeddings = new ArrayList<>(texts.size());
        for (String text : texts) {
            embeddings.add(embedText(text));
        }
        return embeddings;
    }

    private float[] embedText(String text) {
        float[] vector = new float[dimensions];
        for (String token : tokenize(text)) {
            int hash = mix(token.hashCode());
            int bucket = Math.floorMod(hash, dimensions);
            vector[bucket] += (hash & 0x40000000) == 0 ? 1f : -1f;
        }
        return Vectors.normalized(vector);
    }

    static List<String> tokenize(String text) {
        List<String> tokens = new ArrayList<>();
        for (String word : NON_WORD.split(text)) {
            if (word.isEmpty()) {
                continue;
            }
            for (String part : CAMEL_BOUNDARY.split(word)) {
                if (part.length() > 1) {
                    tokens.add(part.toLowerCase(Locale.ROOT));
                }
            }
        }
        return tokens;
    }

    /**
     * Murmur3 finalizer; spreads String.hashCode over all bits.
     */
    private static int mix(int h) {
        h ^= h >>> 16;
        h *= 0x85ebca6b;
        h ^= h >>> 13;
        h *= 0xc2b2ae35;
        h ^= h >>> 16;
        return h;
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
        // Nothing to close
    }
}
