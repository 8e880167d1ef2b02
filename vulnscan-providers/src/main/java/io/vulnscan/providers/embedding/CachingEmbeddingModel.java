package io.vulnscan.providers.embedding;

import io.vulnscan.cache.EmbeddingCache;
import io.vulnscan.providers.InputKind;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.*;

/**
 * Embedding model decorator that consults an {@link EmbeddingCache} first.
 *
 * <p>For each call, cached texts are served locally and exactly one upstream
 * request is issued for the distinct texts that missed. Query embeddings are
 * cached under the model id suffixed with {@code #query} so document and
 * query vectors never collide.</p>
 */
public class CachingEmbeddingModel implements EmbeddingModel {

    private static final Logger log = LoggerFactory.getLogger(CachingEmbeddingModel.class);

    private final EmbeddingModel delegate;
    private final EmbeddingCache cache;

    public CachingEmbeddingModel(EmbeddingModel delegate, EmbeddingCache cache) {
        this.delegate = delegate;
        this.cache = cache;
    }

    @Override
    public List<float[]> embed(List<String> texts, InputKind kind) {
        String cacheModel = cacheModel(kind);
        EmbeddingCache.BatchLookup lookup = cache.getBatch(cacheModel, texts);
        List<float[]> results = new ArrayList<>(lookup.vectors());
        if (lookup.isComplete()) {
            return results;
        }

        // Distinct missing texts, each mapped to every position it occupies
        Map<String, List<Integer>> positions = new LinkedHashMap<>();
        for (int index : lookup.missingIndices()) {
            positions.computeIfAbsent(texts.get(index), t -> new ArrayList<>()).add(index);
        }
        List<String> missing = new ArrayList<>(positions.keySet());

        log.debug("Embedding {} of {} texts upstream ({} cached)",
            missing.size(), texts.size(), texts.size() - lookup.missingIndices().size());
        List<float[]> computed = delegate.embed(missing, kind);
        cache.setBatch(cacheModel, missing, computed);

        for (int i = 0; i < missing.size(); i++) {
            for (int index : positions.get(missing.get(i))) {
                results.set(index, computed.get(i));
            }
        }
        return results;
    }

    private String cacheModel(InputKind kind) {
        return kind == InputKind.QUERY ? delegate.getModelId() + "#query" : delegate.getModelId();
    }

    public EmbeddingModel getDelegate() {
        return delegate;
    }

    @Override
    public String getModelId() {
        return delegate.getModelId();
    }

    @Override
    public int getDimensions() {
        return delegate.getDimensions();
    }

    @Override
    public void close() {
        delegate.close();
    }
}
