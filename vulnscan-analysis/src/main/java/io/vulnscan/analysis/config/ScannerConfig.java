package io.vulnscan.analysis.config;

import io.vulnscan.chunk.ChunkerConfig;
import io.vulnscan.index.IndexKind;
import io.vulnscan.providers.ProviderEndpoint;
import io.vulnscan.providers.RetryPolicy;
import io.vulnscan.providers.embedding.EmbeddingConfig;

import java.nio.file.Path;
import java.time.Duration;
import java.util.Map;
import java.util.Objects;

/**
 * Process-wide scanner configuration.
 *
 * <p>Optional endpoints are {@code null} when not configured: no rerank endpoint
 * falls back to embedding-similarity reranking, no chat endpoint disables
 * decomposition, validation and investigation, and no vulnerability store URL
 * selects the local index under {@link #vulnerabilityIndexDir()}.</p>
 */
public record ScannerConfig(
    /** Root of all persisted state */
    Path dataDir,

    /** Embedding provider */
    EmbeddingConfig embedding,

    /** Rerank endpoint, or null */
    ProviderEndpoint rerank,

    /** Chat-completion endpoint, or null */
    ProviderEndpoint chat,

    /** Remote vulnerability store, or null */
    ProviderEndpoint vulnerabilityStore,

    /** Vector width of the remote store (0 = same as the embedding width) */
    int vulnerabilityStoreDimensions,

    /** Local vulnerability index directory, or null for {@code <dataDir>/vulnerabilities} */
    Path vulnerabilityIndex,

    /** Search structure for codebase indexes */
    IndexKind indexKind,

    /** Chunking parameters */
    ChunkerConfig chunker,

    /** Retrieval thresholds */
    RetrievalSettings retrieval,

    /** Retry policy for rerank, chat and store calls */
    RetryPolicy retry,

    /** Per-request timeout for provider calls */
    Duration requestTimeout,

    /** Keep clones in the repository cache instead of disposable temp directories */
    boolean cacheClones
) {
    public static final String DEFAULT_DATA_DIR = ".vulnscan";

    public ScannerConfig {
        Objects.requireNonNull(dataDir, "dataDir cannot be null");
        if (embedding == null) embedding = EmbeddingConfig.defaults();
        if (indexKind == null) indexKind = IndexKind.FLAT;
        if (chunker == null) chunker = ChunkerConfig.defaults();
        if (retrieval == null) retrieval = RetrievalSettings.defaults();
        if (retry == null) retry = RetryPolicy.defaults();
        if (requestTimeout == null) requestTimeout = Duration.ofSeconds(60);
        if (vulnerabilityStoreDimensions < 0) throw new IllegalArgumentException("vulnerabilityStoreDimensions must be >= 0");
    }

    /**
     * Offline configuration: hashing embeddings, no remote providers.
     */
    public static ScannerConfig defaults(Path dataDir) {
        return new ScannerConfig(dataDir, null, null, null, null, 0, null, null, null, null, null, null, true);
    }

    /**
     * Reads configuration from environment variables.
     *
     * <table>
     *   <caption>Recognized variables</caption>
     *   <tr><td>VULNSCAN_DATA_DIR</td><td>data directory (default {@code .vulnscan})</td></tr>
     *   <tr><td>EMBEDDING_URL, EMBEDDING_API_KEY, EMBEDDING_MODEL, EMBEDDING_DIMENSIONS</td>
     *       <td>REST embedding provider; without a URL the offline hashing model is used</td></tr>
     *   <tr><td>RERANK_URL, RERANK_API_KEY, RERANK_MODEL</td><td>rerank provider</td></tr>
     *   <tr><td>CHAT_URL, CHAT_API_KEY, CHAT_MODEL</td><td>chat-completion provider</td></tr>
     *   <tr><td>VULN_STORE_URL, VULN_STORE_API_KEY, VULN_STORE_DIMENSIONS</td><td>remote vulnerability store</td></tr>
     *   <tr><td>VULN_INDEX_DIR</td><td>local vulnerability index</td></tr>
     * </table>
     */
    public static ScannerConfig fromEnvironment(Map<String, String> env) {
        Path dataDir = Path.of(env.getOrDefault("VULNSCAN_DATA_DIR", DEFAULT_DATA_DIR));

        EmbeddingConfig embedding = EmbeddingConfig.defaults();
        String embeddingUrl = blankToNull(env.get("EMBEDDING_URL"));
        if (embeddingUrl != null) {
            ProviderEndpoint endpoint = ProviderEndpoint.of(embeddingUrl, env.get("EMBEDDING_API_KEY"),
                env.getOrDefault("EMBEDDING_MODEL", "voyage-code-3"));
            embedding = EmbeddingConfig.http(endpoint, intValue(env, "EMBEDDING_DIMENSIONS", 1024));
        } else if (env.containsKey("EMBEDDING_DIMENSIONS")) {
            embedding = embedding.withDimensions(intValue(env, "EMBEDDING_DIMENSIONS", 384));
        }

        String vulnIndex = blankToNull(env.get("VULN_INDEX_DIR"));
        return new ScannerConfig(
            dataDir,
            embedding,
            endpoint(env, "RERANK", "rerank-2"),
            endpoint(env, "CHAT", "gpt-4o-mini"),
            endpoint(env, "VULN_STORE", null),
            intValue(env, "VULN_STORE_DIMENSIONS", 0),
            vulnIndex != null ? Path.of(vulnIndex) : null,
            null, null, null, null, null, true);
    }

    private static ProviderEndpoint endpoint(Map<String, String> env, String prefix, String defaultModel) {
        String url = blankToNull(env.get(prefix + "_URL"));
        if (url == null) {
            return null;
        }
        return ProviderEndpoint.of(url, env.get(prefix + "_API_KEY"), env.getOrDefault(prefix + "_MODEL", defaultModel));
    }

    private static int intValue(Map<String, String> env, String name, int defaultValue) {
        String value = blankToNull(env.get(name));
        if (value == null) {
            return defaultValue;
        }
        try {
            return Integer.parseInt(value.trim());
        } catch (NumberFormatException e) {
            throw new IllegalArgumentException(name + " must be an integer, got '" + value + "'", e);
        }
    }

    private static String blankToNull(String value) {
        return value == null || value.isBlank() ? null : value;
    }

    // ==================== Layout ====================

    public Path embeddingCacheDir() {
        return dataDir.resolve("cache").resolve("embeddings");
    }

    public Path repositoryCacheDir() {
        return dataDir.resolve("cache").resolve("repositories");
    }

    public Path indexDir() {
        return dataDir.resolve("indexes");
    }

    public Path cloneDir() {
        return dataDir.resolve("repos");
    }

    public Path runsDir() {
        return dataDir.resolve("runs");
    }

    public Path reportsDir() {
        return dataDir.resolve("reports");
    }

    public Path vulnerabilityIndexDir() {
        return vulnerabilityIndex != null ? vulnerabilityIndex : dataDir.resolve("vulnerabilities");
    }

    // ==================== Copies ====================

    public ScannerConfig withEmbedding(EmbeddingConfig embedding) {
        return new ScannerConfig(dataDir, embedding, rerank, chat, vulnerabilityStore, vulnerabilityStoreDimensions,
            vulnerabilityIndex, indexKind, chunker, retrieval, retry, requestTimeout, cacheClones);
    }

    public ScannerConfig withRetrieval(RetrievalSettings retrieval) {
        return new ScannerConfig(dataDir, embedding, rerank, chat, vulnerabilityStore, vulnerabilityStoreDimensions,
            vulnerabilityIndex, indexKind, chunker, retrieval, retry, requestTimeout, cacheClones);
    }

    public ScannerConfig withIndexKind(IndexKind indexKind) {
        return new ScannerConfig(dataDir, embedding, rerank, chat, vulnerabilityStore, vulnerabilityStoreDimensions,
            vulnerabilityIndex, indexKind, chunker, retrieval, retry, requestTimeout, cacheClones);
    }

    public ScannerConfig withChat(ProviderEndpoint chat) {
        return new ScannerConfig(dataDir, embedding, rerank, chat, vulnerabilityStore, vulnerabilityStoreDimensions,
            vulnerabilityIndex, indexKind, chunker, retrieval, retry, requestTimeout, cacheClones);
    }

    public ScannerConfig withVulnerabilityIndex(Path vulnerabilityIndex) {
        return new ScannerConfig(dataDir, embedding, rerank, chat, vulnerabilityStore, vulnerabilityStoreDimensions,
            vulnerabilityIndex, indexKind, chunker, retrieval, retry, requestTimeout, cacheClones);
    }

    public ScannerConfig withCacheClones(boolean cacheClones) {
        return new ScannerConfig(dataDir, embedding, rerank, chat, vulnerabilityStore, vulnerabilityStoreDimensions,
            vulnerabilityIndex, indexKind, chunker, retrieval, retry, requestTimeout, cacheClones);
    }
}
