package io.vulnscan.analysis;

import io.vulnscan.TransientProviderException;
import io.vulnscan.providers.InputKind;
import io.vulnscan.providers.embedding.EmbeddingModel;
import io.vulnscan.providers.embedding.HashingEmbeddingModel;

import java.util.List;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.function.Predicate;

/**
 * Hashing embeddings that count upstream calls and can be told to fail.
 */
public class FakeEmbeddingModel implements EmbeddingModel {

    private final HashingEmbeddingModel delegate;
    private final AtomicInteger calls = new AtomicInteger();
    private final AtomicInteger texts = new AtomicInteger();
    private volatile Predicate<String> failWhen = text -> false;

    public FakeEmbeddingModel() {
        this("fake-embed", 64);
    }

    public FakeEmbeddingModel(String modelId, int dimensions) {
        this.delegate = new HashingEmbeddingModel(modelId, dimensions);
    }

    /**
     * Any request containing a matching text fails with a transient error.
     */
    public FakeEmbeddingModel failWhen(Predicate<String> failWhen) {
        this.failWhen = failWhen;
        return this;
    }

    public int calls() {
        return calls.get();
    }

    public int textsEmbedded() {
        return texts.get();
    }

    @Override
    public List<float[]> embed(List<String> input, InputKind kind) {
        calls.incrementAndGet();
        for (String text : input) {
            if (failWhen.test(text)) {
                throw new TransientProviderException(TransientProviderException.Reason.SERVICE_ERROR,
                    "scripted failure for '" + text + "'");
            }
        }
        texts.addAndGet(input.size());
        return delegate.embed(input, kind);
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
