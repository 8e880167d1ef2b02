package io.vulnscan.analysis;

import io.vulnscan.analysis.config.RetrievalSettings;
import io.vulnscan.analysis.config.ScannerConfig;
import io.vulnscan.analysis.finding.FindingValidator;
import io.vulnscan.analysis.investigate.CompletionInvestigationPolicy;
import io.vulnscan.analysis.investigate.InvestigationPolicy;
import io.vulnscan.analysis.progress.ProgressPublisher;
import io.vulnscan.analysis.repo.RepositoryProfiler;
import io.vulnscan.analysis.report.JsonReportWriter;
import io.vulnscan.analysis.retrieval.QueryDecomposer;
import io.vulnscan.analysis.run.JsonFileRunStore;
import io.vulnscan.analysis.run.RunStore;
import io.vulnscan.analysis.vcs.JGitVcsClient;
import io.vulnscan.analysis.vcs.VcsClient;
import io.vulnscan.analysis.vuln.HttpVulnerabilityStore;
import io.vulnscan.analysis.vuln.IndexedVulnerabilityStore;
import io.vulnscan.analysis.vuln.VulnerabilityIndexBuilder;
import io.vulnscan.analysis.vuln.VulnerabilityRetriever;
import io.vulnscan.analysis.vuln.VulnerabilityStore;
import io.vulnscan.cache.CacheManager;
import io.vulnscan.cache.EmbeddingCache;
import io.vulnscan.cache.IndexReuseCache;
import io.vulnscan.cache.RepositoryMetadataCache;
import io.vulnscan.chunk.Chunker;
import io.vulnscan.chunk.SourceChunker;
import io.vulnscan.fingerprint.ContentFingerprint;
import io.vulnscan.index.IndexConfig;
import io.vulnscan.providers.JsonHttpClient;
import io.vulnscan.providers.completion.CompletionModel;
import io.vulnscan.providers.completion.HttpCompletionModel;
import io.vulnscan.providers.embedding.CachingEmbeddingModel;
import io.vulnscan.providers.embedding.EmbeddingModel;
import io.vulnscan.providers.rerank.HttpRerankModel;
import io.vulnscan.providers.rerank.RerankModel;
import io.vulnscan.providers.validation.CompletionValidationModel;
import io.vulnscan.providers.validation.ValidationModel;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.time.Clock;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.ThreadFactory;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicInteger;

/**
 * Everything a run needs, constructed once per process and passed to the
 * orchestrator and its stages.
 *
 * <p>Nothing here is global: two contexts over different data directories are
 * fully isolated, and two contexts over the same data directory share only
 * what is on disk.</p>
 *
 * <h2>Usage Example</h2>
 * <pre>{@code
 * ServiceContext context = ServiceContext.fromConfig(ScannerConfig.fromEnvironment(System.getenv()));
 * try (AnalysisOrchestrator orchestrator = new AnalysisOrchestrator(context)) {
 *     RunRecord result = orchestrator.submit(AnalysisRequest.of(url, AnalysisTier.MEDIUM)).await();
 * }
 * }</pre>
 */
public final class ServiceContext implements AutoCloseable {

    private static final Logger log = LoggerFactory.getLogger(ServiceContext.class);

    public static final int DEFAULT_CONCURRENT_RUNS = 4;

    private final ScannerConfig config;
    private final EmbeddingModel embeddings;
    private final CacheManager caches;
    private final ContentFingerprint fingerprint;
    private final Chunker chunker;
    private final VcsClient vcs;
    private final VulnerabilityStore vulnerabilityStore;
    private final RerankModel reranker;
    private final CompletionModel completion;
    private final ValidationModel validation;
    private final InvestigationPolicy investigationPolicy;
    private final RunStore runStore;
    private final JsonReportWriter reportWriter;
    private final ProgressPublisher progress;
    private final ExecutorService executor;
    private final Clock clock;

    private ServiceContext(Builder builder) {
        this.config = builder.config;
        this.embeddings = builder.embeddings;
        this.caches = builder.caches;
        this.fingerprint = builder.fingerprint;
        this.chunker = builder.chunker;
        this.vcs = builder.vcs;
        this.vulnerabilityStore = builder.vulnerabilityStore;
        this.reranker = builder.reranker;
        this.completion = builder.completion;
        this.validation = builder.validation;
        this.investigationPolicy = builder.investigationPolicy;
        this.runStore = builder.runStore;
        this.reportWriter = builder.reportWriter;
        this.progress = builder.progress;
        this.executor = builder.executor;
        this.clock = builder.clock;
    }

    public static ServiceContext fromConfig(ScannerConfig config) throws IOException {
        return builder(config).build();
    }

    public static Builder builder(ScannerConfig config) {
        return new Builder(config);
    }

    // ==================== Derived Components ====================

    /**
     * Template for new codebase indexes, matching the configured embedding model.
     */
    public IndexConfig indexConfig() {
        return IndexConfig.forModel(embeddings.getModelId(), embeddings.getDimensions())
            .withKind(config.indexKind());
    }

    public RetrievalSettings retrievalSettings() {
        return config.retrieval();
    }

    /**
     * Returns null when no vulnerability store is available.
     */
    public VulnerabilityRetriever vulnerabilityRetriever() {
        if (vulnerabilityStore == null) {
            return null;
        }
        return new VulnerabilityRetriever(embeddings, vulnerabilityStore, reranker, config.retrieval());
    }

    public QueryDecomposer queryDecomposer() {
        return new QueryDecomposer(completion);
    }

    /**
     * Returns null when no validation model is configured.
     */
    public FindingValidator findingValidator() {
        return validation != null ? new FindingValidator(validation) : null;
    }

    public RepositoryProfiler repositoryProfiler() {
        return new RepositoryProfiler(caches.repositories(), fingerprint);
    }

    // ==================== Accessors ====================

    public ScannerConfig config() {
        return config;
    }

    public EmbeddingModel embeddings() {
        return embeddings;
    }

    public CacheManager caches() {
        return caches;
    }

    public IndexReuseCache indexes() {
        return caches.indexes();
    }

    public Chunker chunker() {
        return chunker;
    }

    public VcsClient vcs() {
        return vcs;
    }

    public VulnerabilityStore vulnerabilityStore() {
        return vulnerabilityStore;
    }

    public RerankModel reranker() {
        return reranker;
    }

    public CompletionModel completion() {
        return completion;
    }

    public InvestigationPolicy investigationPolicy() {
        return investigationPolicy;
    }

    public RunStore runStore() {
        return runStore;
    }

    public JsonReportWriter reportWriter() {
        return reportWriter;
    }

    public ProgressPublisher progress() {
        return progress;
    }

    public ExecutorService executor() {
        return executor;
    }

    public Clock clock() {
        return clock;
    }

    @Override
    public void close() {
        executor.shutdown();
        try {
            if (!executor.awaitTermination(30, TimeUnit.SECONDS)) {
                log.warn("Runs still active after 30s, interrupting");
                executor.shutdownNow();
            }
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            executor.shutdownNow();
        }
        progress.close();
        embeddings.close();
        if (vulnerabilityStore instanceof IndexedVulnerabilityStore indexed) {
            indexed.getIndex().close();
        }
    }

    /**
     * Builds a context from configuration. Every component can be replaced,
     * which is how tests substitute fakes for providers and the VCS.
     */
    public static final class Builder {

        private final ScannerConfig config;
        private EmbeddingModel upstreamEmbeddings;
        private EmbeddingModel embeddings;
        private CacheManager caches;
        private ContentFingerprint fingerprint;
        private Chunker chunker;
        private VcsClient vcs;
        private VulnerabilityStore vulnerabilityStore;
        private boolean vulnerabilityStoreSet;
        private RerankModel reranker;
        private boolean rerankerSet;
        private CompletionModel completion;
        private boolean completionSet;
        private ValidationModel validation;
        private boolean validationSet;
        private InvestigationPolicy investigationPolicy;
        private boolean investigationPolicySet;
        private RunStore runStore;
        private JsonReportWriter reportWriter;
        private ProgressPublisher progress;
        private ExecutorService executor;
        private Clock clock;
        private JsonHttpClient http;

        private Builder(ScannerConfig config) {
            this.config = config;
        }

        /**
         * Upstream embedding model. It is always wrapped in the disk-backed embedding cache.
         */
        public Builder embeddingModel(EmbeddingModel model) {
            this.upstreamEmbeddings = model;
            return this;
        }

        public Builder chunker(Chunker chunker) {
            this.chunker = chunker;
            return this;
        }

        public Builder vcs(VcsClient vcs) {
            this.vcs = vcs;
            return this;
        }

        /**
         * @param store the store, or null to run without vulnerability search
         */
        public Builder vulnerabilityStore(VulnerabilityStore store) {
            this.vulnerabilityStore = store;
            this.vulnerabilityStoreSet = true;
            return this;
        }

        public Builder reranker(RerankModel reranker) {
            this.reranker = reranker;
            this.rerankerSet = true;
            return this;
        }

        public Builder completion(CompletionModel completion) {
            this.completion = completion;
            this.completionSet = true;
            return this;
        }

        public Builder validation(ValidationModel validation) {
            this.validation = validation;
            this.validationSet = true;
            return this;
        }

        public Builder investigationPolicy(InvestigationPolicy policy) {
            this.investigationPolicy = policy;
            this.investigationPolicySet = true;
            return this;
        }

        public Builder runStore(RunStore runStore) {
            this.runStore = runStore;
            return this;
        }

        public Builder executor(ExecutorService executor) {
            this.executor = executor;
            return this;
        }

        public Builder clock(Clock clock) {
            this.clock = clock;
            return this;
        }

        /**
         * Opens caches and stores under the data directory and creates any
         * component that was not supplied.
         *
         * @throws IOException if the local vulnerability index exists but cannot be read
         */
        public ServiceContext build() throws IOException {
            if (clock == null) {
                clock = Clock.systemUTC();
            }
            http = new JsonHttpClient(config.requestTimeout());

            fingerprint = new ContentFingerprint(config.chunker().ignoredDirectories());
            EmbeddingCache embeddingCache = new EmbeddingCache(config.embeddingCacheDir());
            caches = new CacheManager(embeddingCache,
                new RepositoryMetadataCache(config.repositoryCacheDir()),
                new IndexReuseCache(config.indexDir(), fingerprint));

            if (upstreamEmbeddings == null) {
                upstreamEmbeddings = EmbeddingModel.load(config.embedding());
            }
            embeddings = new CachingEmbeddingModel(upstreamEmbeddings, embeddingCache);

            if (chunker == null) {
                chunker = new SourceChunker(config.chunker());
            }
            if (vcs == null) {
                vcs = new JGitVcsClient(config.cloneDir(), config.cacheClones());
            }
            if (!rerankerSet && config.rerank() != null) {
                reranker = new HttpRerankModel(config.rerank(), config.retry(), http);
            }
            if (!completionSet && config.chat() != null) {
                completion = new HttpCompletionModel(config.chat(), config.retry(), http);
            }
            if (!validationSet && completion != null) {
                validation = new CompletionValidationModel(completion);
            }
            if (!investigationPolicySet && completion != null) {
                investigationPolicy = new CompletionInvestigationPolicy(completion);
            }
            if (!vulnerabilityStoreSet) {
                vulnerabilityStore = openVulnerabilityStore();
            }
            if (runStore == null) {
                runStore = new JsonFileRunStore(config.runsDir());
            }
            reportWriter = new JsonReportWriter(config.reportsDir());
            progress = new ProgressPublisher();
            if (executor == null) {
                executor = Executors.newFixedThreadPool(DEFAULT_CONCURRENT_RUNS, runThreads());
            }

            log.info("Service context ready: embeddings={}, rerank={}, chat={}, vulnerabilities={}",
                embeddings.getModelId(),
                reranker != null ? reranker.getModelId() : "none",
                completion != null ? completion.getModelId() : "none",
                vulnerabilityStore != null ? vulnerabilityStore.describe() : "none");
            return new ServiceContext(this);
        }

        private VulnerabilityStore openVulnerabilityStore() throws IOException {
            if (config.vulnerabilityStore() != null) {
                int width = config.vulnerabilityStoreDimensions() > 0
                    ? config.vulnerabilityStoreDimensions()
                    : embeddings.getDimensions();
                return new HttpVulnerabilityStore(config.vulnerabilityStore(), width, config.retry(), http);
            }
            VulnerabilityStore local = VulnerabilityIndexBuilder.open(config.vulnerabilityIndexDir()).orElse(null);
            if (local == null) {
                log.warn("No vulnerability store configured and no local index at {}", config.vulnerabilityIndexDir());
            }
            return local;
        }

        private static ThreadFactory runThreads() {
            AtomicInteger counter = new AtomicInteger();
            return runnable -> {
                Thread thread = new Thread(runnable, "vulnscan-run-" + counter.incrementAndGet());
                thread.setDaemon(true);
                return thread;
            };
        }
    }
}
