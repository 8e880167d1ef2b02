package io.vulnscan.cli;

import io.vulnscan.CodeChunk;
import io.vulnscan.analysis.AnalysisOrchestrator;
import io.vulnscan.analysis.ServiceContext;
import io.vulnscan.analysis.config.AnalysisTier;
import io.vulnscan.analysis.config.ScannerConfig;
import io.vulnscan.analysis.config.TierSettings;
import io.vulnscan.analysis.retrieval.CodebaseIndexer;
import io.vulnscan.analysis.retrieval.RetrievalResult;
import io.vulnscan.analysis.retrieval.Retriever;
import io.vulnscan.analysis.run.AnalysisHandle;
import io.vulnscan.analysis.run.AnalysisRequest;
import io.vulnscan.analysis.run.CancellationToken;
import io.vulnscan.analysis.run.RunRecord;
import io.vulnscan.analysis.run.RunStatus;
import io.vulnscan.analysis.vuln.VulnerabilityIndexBuilder;
import io.vulnscan.cache.CacheStats;
import io.vulnscan.cache.EmbeddingCache;
import io.vulnscan.cache.IndexLocation;
import io.vulnscan.cache.IndexReuseCache;
import io.vulnscan.cache.RepositoryMetadataCache;
import io.vulnscan.index.IndexKind;
import io.vulnscan.index.VectorIndex;
import picocli.CommandLine;
import picocli.CommandLine.*;

import java.io.IOException;
import java.io.PrintStream;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.HashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.Callable;
import java.util.stream.Stream;

/**
 * Command-line interface for the vulnerability scanner.
 *
 * <p>Provider endpoints come from the environment (see
 * {@link ScannerConfig#fromEnvironment}); options given here override them.</p>
 */
@Command(
    name = "vulnscan",
    mixinStandardHelpOptions = true,
    version = "vulnscan 1.0.0",
    description = "Find known vulnerabilities in source repositories",
    subcommands = {
        VulnScanCli.AnalyzeCommand.class,
        VulnScanCli.IndexCommand.class,
        VulnScanCli.SearchCommand.class,
        VulnScanCli.IngestCommand.class,
        VulnScanCli.CacheCleanCommand.class,
        VulnScanCli.StatsCommand.class
    }
)
public class VulnScanCli implements Callable<Integer> {

    public static void main(String[] args) {
        int exitCode = new CommandLine(new VulnScanCli()).execute(args);
        System.exit(exitCode);
    }

    @Override
    public Integer call() {
        CommandLine.usage(this, System.out);
        return 0;
    }

    /**
     * Options shared by every command.
     */
    static class CommonOptions {

        @Option(names = {"-d", "--data-dir"}, description = "Data directory (default: $VULNSCAN_DATA_DIR or .vulnscan)")
        Path dataDir;

        @Option(names = {"--index-kind"}, description = "Codebase index kind: ${COMPLETION-CANDIDATES}")
        IndexKind indexKind;

        ScannerConfig config() {
            return config(System.getenv());
        }

        ScannerConfig config(Map<String, String> environment) {
            Map<String, String> env = new HashMap<>(environment);
            if (dataDir != null) {
                env.put("VULNSCAN_DATA_DIR", dataDir.toString());
            }
            ScannerConfig config = ScannerConfig.fromEnvironment(env);
            return indexKind != null ? config.withIndexKind(indexKind) : config;
        }
    }

    /**
     * Run a full analysis.
     */
    @Command(
        name = "analyze",
        description = "Analyze a Git repository or local directory for known vulnerabilities"
    )
    static class AnalyzeCommand implements Callable<Integer> {

        @Mixin
        CommonOptions common;

        @Parameters(index = "0", description = "Git URL or local directory")
        String repository;

        @Option(names = {"-b", "--branch"}, description = "Branch to analyze (default: remote default)")
        String branch;

        @Option(names = {"-t", "--tier"}, description = "Analysis depth: SHORT, MEDIUM, HARD", defaultValue = "MEDIUM")
        String tier;

        @Option(names = {"--no-validation"}, description = "Skip validation of findings")
        boolean noValidation;

        @Option(names = {"--steps"}, description = "Investigation step budget (overrides the tier)")
        Integer steps;

        @Option(names = {"--no-clone-cache"}, description = "Clone into a temporary directory that is deleted afterwards")
        boolean noCloneCache;

        @Override
        public Integer call() throws Exception {
            AnalysisTier analysisTier = AnalysisTier.parse(tier);
            TierSettings settings = analysisTier.settings();
            if (noValidation) {
                settings = settings.withValidation(false);
            }
            if (steps != null) {
                settings = settings.withInvestigationSteps(steps);
            }
            AnalysisRequest request = new AnalysisRequest(repository, branch, analysisTier, settings);

            ScannerConfig config = common.config();
            if (noCloneCache) {
                config = config.withCacheClones(false);
            }

            System.out.println("Analyzing: " + repository + " (" + analysisTier + ")");
            try (AnalysisOrchestrator orchestrator = new AnalysisOrchestrator(ServiceContext.fromConfig(config))) {
                orchestrator.context().progress().addListener(event ->
                    System.out.printf("[%3d%%] %-14s %s%n", event.percent(), event.stage().label(), event.message()));

                AnalysisHandle handle = orchestrator.submit(request);
                // Ctrl-C cancels the run; the hook is a no-op once it has finished
                Runtime.getRuntime().addShutdownHook(new Thread(handle::cancel, "vulnscan-cancel"));
                RunRecord record = handle.await();
                printRun(System.out, record);
                return record.status() == RunStatus.COMPLETED ? 0 : 1;
            }
        }
    }

    /**
     * Build (or confirm) the reusable index for a local tree.
     */
    @Command(
        name = "index",
        description = "Chunk and embed a local source tree into the reusable index"
    )
    static class IndexCommand implements Callable<Integer> {

        @Mixin
        CommonOptions common;

        @Parameters(index = "0", description = "Path to source tree")
        Path projectPath;

        @Override
        public Integer call() throws Exception {
            Path root = projectPath.toAbsolutePath().normalize();
            if (!Files.isDirectory(root)) {
                System.err.println("Not a directory: " + projectPath);
                return 2;
            }

            try (ServiceContext context = ServiceContext.fromConfig(common.config())) {
                IndexReuseCache indexes = context.indexes();
                IndexLocation location = indexes.resolve(root.toString(), root);
                try (IndexReuseCache.KeyLock lock = indexes.lock(location.key())) {
                    location = indexes.refresh(location);
                    if (location.valid()) {
                        System.out.println("Index is up to date: " + location.indexPath().getParent());
                        return 0;
                    }

                    System.out.println("Indexing project: " + root);
                    List<CodeChunk> chunks = context.chunker().process(root);
                    System.out.println("Found " + chunks.size() + " code chunks");
                    if (chunks.isEmpty()) {
                        System.out.println("No supported source files to index");
                        return 1;
                    }

                    System.out.println("Using model: " + context.embeddings().getModelId());
                    try (VectorIndex index = VectorIndex.create(context.indexConfig(), location.files())) {
                        int indexed = new CodebaseIndexer(context.embeddings()).index(chunks, index,
                            (current, total) -> System.out.printf("\rEmbedded %d/%d chunks", current, total),
                            CancellationToken.NONE);
                        System.out.println();
                        System.out.println("Indexed " + indexed + " chunks into " + location.indexPath().getParent());
                    } catch (IOException | RuntimeException e) {
                        indexes.invalidate(location);
                        throw e;
                    }
                }
            }
            return 0;
        }
    }

    /**
     * Query the reusable index of a local tree.
     */
    @Command(
        name = "search",
        description = "Search an indexed source tree for code matching a query"
    )
    static class SearchCommand implements Callable<Integer> {

        @Mixin
        CommonOptions common;

        @Parameters(index = "0", description = "Path to an indexed source tree")
        Path projectPath;

        @Parameters(index = "1", description = "Search query")
        String query;

        @Option(names = {"-n", "--top"}, description = "Number of results", defaultValue = "10")
        int topK;

        @Option(names = {"--threshold"}, description = "Minimum similarity", defaultValue = "0.0")
        double threshold;

        @Option(names = {"--show-code"}, description = "Show code snippets", defaultValue = "true", negatable = true)
        boolean showCode;

        @Override
        public Integer call() throws Exception {
            Path root = projectPath.toAbsolutePath().normalize();
            try (ServiceContext context = ServiceContext.fromConfig(common.config())) {
                IndexLocation location = context.indexes().resolve(root.toString(), root);
                Optional<VectorIndex> loaded = location.valid() ? VectorIndex.load(location.files()) : Optional.empty();
                if (loaded.isEmpty()) {
                    System.err.println("No index for " + root + " (run 'vulnscan index' first)");
                    return 1;
                }

                try (VectorIndex index = loaded.get()) {
                    System.out.println("Searching for: " + query);
                    List<RetrievalResult> results = new Retriever(context.embeddings(), index)
                        .search(query, topK, threshold);

                    System.out.println();
                    System.out.println("Found " + results.size() + " results:");
                    System.out.println("=".repeat(60));
                    int rank = 1;
                    for (RetrievalResult result : results) {
                        printResult(rank++, result, showCode);
                    }
                }
            }
            return 0;
        }

        private void printResult(int rank, RetrievalResult result, boolean showCode) {
            System.out.println();
            System.out.printf(Locale.ROOT, "#%d [%.1f%%] %s:%d-%d%n", rank, result.score() * 100,
                result.file(), result.startLine(), result.endLine());
            if (showCode && result.text() != null) {
                System.out.println("    " + "-".repeat(50));
                String text = result.text();
                String preview = text.length() > 200 ? text.substring(0, 200) + "..." : text;
                for (String line : preview.split("\n")) {
                    System.out.println("    " + line);
                }
            }
        }
    }

    /**
     * Build the local vulnerability index.
     */
    @Command(
        name = "ingest",
        description = "Embed a JSON array of vulnerability records into the local vulnerability index"
    )
    static class IngestCommand implements Callable<Integer> {

        @Mixin
        CommonOptions common;

        @Parameters(index = "0", description = "JSON file with records (cve_id, summary, cvss_score, cvss_vector)")
        Path recordsFile;

        @Option(names = {"-o", "--output"}, description = "Target directory (default: <data-dir>/vulnerabilities)")
        Path output;

        @Override
        public Integer call() throws Exception {
            if (!Files.isRegularFile(recordsFile)) {
                System.err.println("No such file: " + recordsFile);
                return 2;
            }
            ScannerConfig config = common.config();
            Path target = output != null ? output : config.vulnerabilityIndexDir();

            try (ServiceContext context = ServiceContext.builder(config).vulnerabilityStore(null).build()) {
                System.out.println("Ingesting " + recordsFile + " with " + context.embeddings().getModelId());
                int count = new VulnerabilityIndexBuilder(context.embeddings())
                    .ingest(recordsFile, target, (current, total) ->
                        System.out.printf("\rEmbedded %d/%d records", current, total));
                System.out.println();
                System.out.println("Stored " + count + " records in " + target);
            }
            return 0;
        }
    }

    /**
     * Remove stale cache entries.
     */
    @Command(
        name = "cache-clean",
        description = "Delete cached embeddings and repository profiles older than the given age"
    )
    static class CacheCleanCommand implements Callable<Integer> {

        @Mixin
        CommonOptions common;

        @Option(names = {"--embedding-days"}, description = "Maximum embedding age in days",
            defaultValue = "" + EmbeddingCache.DEFAULT_MAX_AGE_DAYS)
        int embeddingDays;

        @Option(names = {"--metadata-days"}, description = "Maximum repository profile age in days",
            defaultValue = "" + RepositoryMetadataCache.DEFAULT_MAX_AGE_DAYS)
        int metadataDays;

        @Override
        public Integer call() throws Exception {
            try (ServiceContext context = ServiceContext.builder(common.config()).vulnerabilityStore(null).build()) {
                int removed = context.caches().clearOld(embeddingDays, metadataDays);
                System.out.println("Removed " + removed + " cache entries");
            }
            return 0;
        }
    }

    /**
     * Show cache and run statistics.
     */
    @Command(
        name = "stats",
        description = "Display cache, index and run statistics"
    )
    static class StatsCommand implements Callable<Integer> {

        @Mixin
        CommonOptions common;

        @Option(names = {"--runs"}, description = "Number of recent runs to list", defaultValue = "10")
        int runs;

        @Override
        public Integer call() throws Exception {
            ScannerConfig config = common.config();
            try (ServiceContext context = ServiceContext.builder(config).vulnerabilityStore(null).build()) {
                CacheStats embeddings = context.caches().embeddings().stats();

                System.out.println();
                System.out.println("VulnScan Statistics");
                System.out.println("=".repeat(40));
                System.out.println("Data directory: " + config.dataDir().toAbsolutePath());
                System.out.println("Embedding model: " + context.embeddings().getModelId()
                    + " (" + context.embeddings().getDimensions() + " dimensions)");
                System.out.println("Embedding cache: " + embeddings.diskEntries() + " on disk");
                System.out.println("Repository profiles: " + context.caches().repositories().size());
                System.out.println("Codebase indexes: " + countIndexes(context.indexes().getBaseDirectory()));

                List<RunRecord> history = context.runStore().list();
                System.out.println();
                System.out.println("Runs: " + history.size());
                history.stream().limit(runs).forEach(record -> System.out.printf("  %s %-9s %3d%% %s%n",
                    record.id(), record.status(), record.progress(), record.repository()));
            }
            return 0;
        }

        private static long countIndexes(Path baseDirectory) throws IOException {
            if (!Files.isDirectory(baseDirectory)) {
                return 0;
            }
            try (Stream<Path> dirs = Files.list(baseDirectory)) {
                return dirs.filter(dir -> Files.isRegularFile(dir.resolve("codebase.vidx"))).count();
            }
        }
    }

    // ==================== Output ====================

    static void printRun(PrintStream out, RunRecord record) {
        out.println();
        out.println("=".repeat(60));
        out.println("Run: " + record.id());
        out.println("Status: " + record.status());
        if (record.status() == RunStatus.FAILED) {
            out.println("Error: " + record.errorMessage());
        } else {
            out.println("Files analyzed: " + record.totalFiles());
            out.println("Chunks analyzed: " + record.totalChunks());
            out.println("Index reused: " + record.indexReused());
            out.println("Findings: " + record.totalFindings());
            if (record.reportPath() != null) {
                out.println("Report: " + record.reportPath());
            }
        }
    }
}
