package io.vulnscan.analysis.retrieval;

import io.vulnscan.CodeChunk;
import io.vulnscan.IncompatibleModelException;
import io.vulnscan.PermanentInputException;
import io.vulnscan.ProgressCallback;
import io.vulnscan.TransientProviderException;
import io.vulnscan.analysis.run.CancellationToken;
import io.vulnscan.index.Metric;
import io.vulnscan.index.VectorIndex;
import io.vulnscan.index.Vectors;
import io.vulnscan.providers.embedding.EmbeddingModel;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Embeds code chunks and appends them to a codebase index.
 *
 * <p>Chunks are embedded in small batches. A batch that fails is logged and
 * skipped; only when every batch fails does indexing fail. Each record's
 * metadata carries the chunk location and full text so search results can be
 * reported without the source tree.</p>
 */
public class CodebaseIndexer {

    private static final Logger log = LoggerFactory.getLogger(CodebaseIndexer.class);

    public static final int DEFAULT_BATCH_SIZE = 10;

    static final String FILE = "file";
    static final String START_LINE = "start_line";
    static final String END_LINE = "end_line";
    static final String LANGUAGE = "language";
    static final String STRATEGY = "strategy";
    static final String SYMBOL = "symbol";
    static final String TEXT = "text";

    private final EmbeddingModel embeddings;
    private final int batchSize;

    public CodebaseIndexer(EmbeddingModel embeddings) {
        this(embeddings, DEFAULT_BATCH_SIZE);
    }

    public CodebaseIndexer(EmbeddingModel embeddings, int batchSize) {
        if (batchSize < 1) throw new IllegalArgumentException("batchSize must be >= 1");
        this.embeddings = embeddings;
        this.batchSize = batchSize;
    }

    /**
     * Embeds and appends {@code chunks}, then saves the index if it is bound to files.
     *
     * @return number of chunks indexed
     * @throws TransientProviderException or {@link PermanentInputException} from the
     *         last batch if every batch failed
     */
    public int index(List<CodeChunk> chunks, VectorIndex index, ProgressCallback progress,
                     CancellationToken cancellation) throws IOException {
        requireCompatible(index, embeddings);
        if (chunks.isEmpty()) {
            return 0;
        }

        int indexed = 0;
        int failedBatches = 0;
        int totalBatches = (chunks.size() + batchSize - 1) / batchSize;
        RuntimeException lastFailure = null;

        for (int start = 0; start < chunks.size(); start += batchSize) {
            cancellation.throwIfCancelled();
            List<CodeChunk> batch = chunks.subList(start, Math.min(start + batchSize, chunks.size()));
            try {
                List<String> texts = new ArrayList<>(batch.size());
                for (CodeChunk chunk : batch) {
                    texts.add(chunk.embeddingText());
                }
                List<float[]> vectors = new ArrayList<>(embeddings.embedBatch(texts));
                if (index.metric() == Metric.INNER_PRODUCT) {
                    vectors.replaceAll(Vectors::normalized);
                }
                List<Map<String, Object>> metadata = new ArrayList<>(batch.size());
                for (CodeChunk chunk : batch) {
                    metadata.add(metadata(chunk));
                }
                index.add(vectors, metadata);
                indexed += batch.size();
            } catch (TransientProviderException | PermanentInputException e) {
                failedBatches++;
                lastFailure = e;
                log.warn("Skipping chunks {}-{}: {}", start, start + batch.size() - 1, e.getMessage());
            }
            progress.onProgress(Math.min(start + batchSize, chunks.size()), chunks.size());
        }

        if (failedBatches == totalBatches) {
            log.error("All {} embedding batches failed", totalBatches);
            throw lastFailure;
        }
        if (index.files().isPresent()) {
            index.save();
        }
        log.info("Indexed {} of {} chunks ({} batches failed)", indexed, chunks.size(), failedBatches);
        return indexed;
    }

    static Map<String, Object> metadata(CodeChunk chunk) {
        Map<String, Object> metadata = new LinkedHashMap<>();
        metadata.put(FILE, chunk.file());
        metadata.put(START_LINE, chunk.startLine());
        metadata.put(END_LINE, chunk.endLine());
        metadata.put(LANGUAGE, chunk.language());
        metadata.put(STRATEGY, chunk.strategy().name());
        if (chunk.symbol() != null) {
            metadata.put(SYMBOL, chunk.symbol());
        }
        metadata.put(TEXT, chunk.text());
        return metadata;
    }

    /**
     * @throws IncompatibleModelException if the index was built by another model or width
     */
    public static void requireCompatible(VectorIndex index, EmbeddingModel embeddings) {
        if (!index.modelId().equals(embeddings.getModelId()) || index.dimensions() != embeddings.getDimensions()) {
            throw new IncompatibleModelException(embeddings.getModelId(), embeddings.getDimensions(),
                index.modelId(), index.dimensions());
        }
    }
}
