package io.vulnscan.analysis.vuln;

import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.ObjectMapper;
import io.vulnscan.ProgressCallback;
import io.vulnscan.index.IndexConfig;
import io.vulnscan.index.IndexFiles;
import io.vulnscan.index.IndexKind;
import io.vulnscan.index.VectorIndex;
import io.vulnscan.index.Vectors;
import io.vulnscan.providers.embedding.EmbeddingModel;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.nio.file.Path;
import java.util.*;

/**
 * Builds the local vulnerability index from a JSON array of records.
 *
 * <p>Each record is embedded as {@code "{id}: {summary}"}. Records with a
 * duplicate id keep the first occurrence. The new index replaces any previous
 * one only when it is complete.</p>
 */
public class VulnerabilityIndexBuilder {

    private static final Logger log = LoggerFactory.getLogger(VulnerabilityIndexBuilder.class);

    private static final int BATCH_SIZE = 64;
    private static final TypeReference<List<VulnerabilityRecord>> RECORDS = new TypeReference<>() { };

    private final EmbeddingModel embeddings;
    private final ObjectMapper mapper;
    private final IndexKind kind;

    public VulnerabilityIndexBuilder(EmbeddingModel embeddings) {
        this(embeddings, new ObjectMapper(), IndexKind.FLAT);
    }

    public VulnerabilityIndexBuilder(EmbeddingModel embeddings, ObjectMapper mapper, IndexKind kind) {
        this.embeddings = embeddings;
        this.mapper = mapper;
        this.kind = kind;
    }

    public List<VulnerabilityRecord> read(Path jsonFile) throws IOException {
        return mapper.readValue(jsonFile.toFile(), RECORDS);
    }

    /**
     * Reads records from {@code jsonFile} and writes the index into {@code targetDir}.
     *
     * @return number of records indexed
     */
    public int ingest(Path jsonFile, Path targetDir, ProgressCallback progress) throws IOException {
        return build(read(jsonFile), targetDir, progress);
    }

    public int build(List<VulnerabilityRecord> records, Path targetDir, ProgressCallback progress) throws IOException {
        Map<String, VulnerabilityRecord> unique = new LinkedHashMap<>();
        for (VulnerabilityRecord record : records) {
            unique.putIfAbsent(record.id(), record);
        }
        List<VulnerabilityRecord> ordered = new ArrayList<>(unique.values());
        if (ordered.size() < records.size()) {
            log.info("Dropped {} duplicate vulnerability records", records.size() - ordered.size());
        }

        IndexConfig config = IndexConfig.forModel(embeddings.getModelId(), embeddings.getDimensions())
            .withKind(kind)
            .withCheckpointInterval(0)
            .withHnswMaxItems(Math.max(ordered.size(), 1));
        try (VectorIndex index = VectorIndex.create(config, IndexFiles.in(targetDir))) {
            for (int start = 0; start < ordered.size(); start += BATCH_SIZE) {
                List<VulnerabilityRecord> batch = ordered.subList(start, Math.min(start + BATCH_SIZE, ordered.size()));
                List<String> documents = new ArrayList<>(batch.size());
                List<Map<String, Object>> metadata = new ArrayList<>(batch.size());
                for (VulnerabilityRecord record : batch) {
                    documents.add(record.document());
                    metadata.add(record.toMetadata());
                }
                List<float[]> vectors = new ArrayList<>(embeddings.embedBatch(documents));
                vectors.replaceAll(Vectors::normalized);
                index.add(vectors, metadata);
                progress.onProgress(start + batch.size(), ordered.size());
            }
            index.save();
            log.info("Indexed {} vulnerability records into {}", index.size(), targetDir);
            return index.size();
        }
    }

    /**
     * Opens the local store in {@code dir}, if one has been built.
     */
    public static Optional<IndexedVulnerabilityStore> open(Path dir) throws IOException {
        return VectorIndex.load(IndexFiles.in(dir)).map(IndexedVulnerabilityStore::new);
    }
}
