package io.vulnscan.analysis;

import io.vulnscan.CodeChunk;
import io.vulnscan.IncompatibleModelException;
import io.vulnscan.PermanentInputException;
import io.vulnscan.ProgressCallback;
import io.vulnscan.TransientProviderException;
import io.vulnscan.UnsupportedFormatException;
import io.vulnscan.analysis.config.RetrievalSettings;
import io.vulnscan.analysis.config.TierSettings;
import io.vulnscan.analysis.finding.Finding;
import io.vulnscan.analysis.finding.FindingAssembler;
import io.vulnscan.analysis.finding.FindingValidator;
import io.vulnscan.analysis.investigate.InvestigationState;
import io.vulnscan.analysis.investigate.InvestigationToolbox;
import io.vulnscan.analysis.investigate.Investigator;
import io.vulnscan.analysis.progress.ProgressEvent;
import io.vulnscan.analysis.repo.RepositoryProfile;
import io.vulnscan.analysis.report.AnalysisReport;
import io.vulnscan.analysis.retrieval.CodebaseIndexer;
import io.vulnscan.analysis.retrieval.RetrievalResult;
import io.vulnscan.analysis.retrieval.Retriever;
import io.vulnscan.analysis.retrieval.SubQuery;
import io.vulnscan.analysis.run.AnalysisHandle;
import io.vulnscan.analysis.run.AnalysisRequest;
import io.vulnscan.analysis.run.AnalysisRun;
import io.vulnscan.analysis.run.CancellationToken;
import io.vulnscan.analysis.run.RunRecord;
import io.vulnscan.analysis.run.Stage;
import io.vulnscan.analysis.vcs.WorkingCopy;
import io.vulnscan.analysis.vuln.VulnerabilityMatch;
import io.vulnscan.analysis.vuln.VulnerabilityRetriever;
import io.vulnscan.cache.IndexLocation;
import io.vulnscan.cache.IndexReuseCache;
import io.vulnscan.index.VectorIndex;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.InvalidPathException;
import java.nio.file.Path;
import java.util.*;
import java.util.concurrent.CancellationException;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.FutureTask;

/**
 * Drives one analysis run through its stages.
 *
 * <p>Runs move {@code PENDING -> RUNNING -> COMPLETED | FAILED}. Inside
 * {@code RUNNING} the stages execute in order and progress only increases. An
 * exception in any stage fails the run with its message and skips the remaining
 * stages; cleanup always runs and only ever deletes disposable working copies.</p>
 *
 * <p>Each run executes once on the context's executor. The only state runs
 * share is the cache layer; index builds are serialized per reuse key so that
 * concurrent runs over the same tree build once and reuse afterwards.</p>
 */
public class AnalysisOrchestrator implements AutoCloseable {

    private static final Logger log = LoggerFactory.getLogger(AnalysisOrchestrator.class);

    private final ServiceContext context;
    private final FindingAssembler assembler = new FindingAssembler();
    private final Map<String, AnalysisHandle> active = new ConcurrentHashMap<>();

    public AnalysisOrchestrator(ServiceContext context) {
        this.context = context;
    }

    // ==================== Submission ====================

    /**
     * Creates a run with a fresh id and schedules it.
     */
    public AnalysisHandle submit(AnalysisRequest request) {
        AnalysisRun run = newRun(request);
        CancellationToken cancellation = new CancellationToken();
        FutureTask<RunRecord> result = new FutureTask<>(() -> {
            try {
                return execute(request, run, cancellation);
            } finally {
                active.remove(run.id());
            }
        });
        AnalysisHandle handle = new AnalysisHandle(run, result, cancellation);
        active.put(run.id(), handle);
        context.executor().execute(result);
        log.info("Submitted run {} for {} ({})", run.id(), request.repository(), request.tier());
        return handle;
    }

    /**
     * Executes a run on the calling thread.
     */
    public RunRecord run(AnalysisRequest request, CancellationToken cancellation) {
        return execute(request, newRun(request), cancellation);
    }

    /**
     * Live state of an active run, or the last persisted snapshot.
     */
    public Optional<RunRecord> status(String runId) {
        AnalysisHandle handle = active.get(runId);
        if (handle != null) {
            return Optional.of(handle.snapshot());
        }
        return context.runStore().find(runId);
    }

    public List<RunRecord> history() {
        return context.runStore().list();
    }

    public ServiceContext context() {
        return context;
    }

    private AnalysisRun newRun(AnalysisRequest request) {
        AnalysisRun run = new AnalysisRun(UUID.randomUUID().toString(), request.repository(), request.branch(),
            request.tier(), context.clock());
        persist(run);
        return run;
    }

    // ==================== Run ====================

    RunRecord execute(AnalysisRequest request, AnalysisRun run, CancellationToken cancellation) {
        TierSettings settings = request.settings();
        WorkingCopy copy = null;
        VectorIndex index = null;
        try {
            run.start();
            persist(run);

            // acquire
            cancellation.throwIfCancelled();
            advance(run, Stage.ACQUIRE, Stage.ACQUIRE.startPercent(), "Acquiring " + request.repository());
            Path local = localDirectory(request.repository());
            String repoKey;
            if (local != null) {
                copy = WorkingCopy.local(local);
                repoKey = local.toString();
            } else {
                copy = context.vcs().checkout(request.repository(), request.branch());
                repoKey = request.repository();
            }
            advance(run, Stage.ACQUIRE, Stage.ACQUIRE.endPercent(), "Repository ready at " + copy.path());

            // resolve or build the codebase index
            cancellation.throwIfCancelled();
            index = resolveIndex(repoKey, copy, settings, run, cancellation);
            if (index == null) {
                return finish(run, List.of(), "No supported source files found");
            }
            Retriever retriever = new Retriever(context.embeddings(), index);

            // candidate vulnerabilities
            cancellation.throwIfCancelled();
            advance(run, Stage.VULNERABILITY_SEARCH, Stage.VULNERABILITY_SEARCH.startPercent(),
                "Searching known vulnerabilities");
            VulnerabilityRetriever vulnerabilities = context.vulnerabilityRetriever();
            if (vulnerabilities == null) {
                log.warn("Run {} has no vulnerability store; nothing to match", run.id());
                return finish(run, List.of(), "No vulnerability store available");
            }
            RepositoryProfile profile = context.repositoryProfiler().profile(repoKey, copy.path());
            String query = profile.initialQuery();
            List<VulnerabilityMatch> candidates = vulnerabilities.search(query,
                settings.vulnerabilityCandidates(), settings.rerankTopN());
            advance(run, Stage.VULNERABILITY_SEARCH, Stage.VULNERABILITY_SEARCH.endPercent(),
                "Found " + candidates.size() + " candidate vulnerabilities");
            if (candidates.isEmpty()) {
                return finish(run, List.of(), "No relevant vulnerabilities found");
            }

            // decomposition
            cancellation.throwIfCancelled();
            advance(run, Stage.DECOMPOSITION, Stage.DECOMPOSITION.startPercent(), "Decomposing candidates");
            List<SubQuery> plan = context.queryDecomposer().plan(candidates, settings.candidatesToAnalyze(),
                settings.queriesPerCandidate(), stageProgress(run, Stage.DECOMPOSITION), cancellation);

            // code search
            cancellation.throwIfCancelled();
            RetrievalSettings retrieval = context.retrievalSettings();
            advance(run, Stage.CODE_SEARCH, Stage.CODE_SEARCH.startPercent(),
                "Searching code with " + plan.size() + " queries");
            List<String> queries = plan.stream().map(SubQuery::text).distinct().toList();
            List<RetrievalResult> matches = retriever.searchMultiple(queries, settings.matchesPerQuery(),
                retrieval.codeThreshold(), stageProgress(run, Stage.CODE_SEARCH), cancellation);

            // matching
            cancellation.throwIfCancelled();
            advance(run, Stage.MATCHING, Stage.MATCHING.startPercent(), "Matching " + matches.size() + " code regions");
            List<Finding> findings = assembler.assemble(matches, plan);
            advance(run, Stage.MATCHING, Stage.MATCHING.endPercent(), findings.size() + " potential findings");

            // validation
            FindingValidator validator = context.findingValidator();
            if (settings.validationEnabled() && validator != null && !findings.isEmpty()) {
                cancellation.throwIfCancelled();
                advance(run, Stage.VALIDATE, Stage.VALIDATE.startPercent(), "Validating " + findings.size() + " findings");
                findings = validator.validateAll(findings, stageProgress(run, Stage.VALIDATE), cancellation);
            }

            // investigation
            if (settings.investigationSteps() > 0 && context.investigationPolicy() != null) {
                cancellation.throwIfCancelled();
                advance(run, Stage.INVESTIGATE, Stage.INVESTIGATE.startPercent(), "Investigating");
                findings = investigate(copy, profile, retriever, vulnerabilities, validator, candidates, findings,
                    settings, run, cancellation);
            }

            return finish(run, findings, "Analysis completed");
        } catch (CancellationException e) {
            log.info("Run {} cancelled", run.id());
            return failed(run, "Cancelled");
        } catch (PermanentInputException | TransientProviderException e) {
            log.error("Run {} failed: {}", run.id(), e.getMessage());
            return failed(run, e.getMessage());
        } catch (IOException | RuntimeException e) {
            log.error("Run {} failed", run.id(), e);
            return failed(run, e.getMessage() != null ? e.getMessage() : e.getClass().getSimpleName());
        } finally {
            if (index != null) {
                index.close();
            }
            if (copy != null) {
                context.vcs().release(copy);
            }
        }
    }

    // ==================== Index ====================

    /**
     * Loads the reusable index for this tree or builds it under the key's lock.
     *
     * @return the index, or null when the tree has no supported files
     */
    private VectorIndex resolveIndex(String repoKey, WorkingCopy copy, TierSettings settings, AnalysisRun run,
                                     CancellationToken cancellation) throws IOException {
        IndexReuseCache indexes = context.indexes();
        IndexLocation location = indexes.resolve(repoKey, copy.path());

        try (IndexReuseCache.KeyLock lock = indexes.lock(location.key())) {
            // another run may have built it while we waited
            location = indexes.refresh(location);
            if (location.valid()) {
                Optional<VectorIndex> reused = loadReusable(location);
                if (reused.isPresent()) {
                    VectorIndex index = reused.get();
                    run.recordChunking(countFiles(index.metadata()), index.size());
                    run.recordIndexReused(index.size());
                    advance(run, Stage.EMBED, Stage.EMBED.endPercent(), "Reusing index with " + index.size() + " chunks");
                    return index;
                }
            }

            cancellation.throwIfCancelled();
            advance(run, Stage.CHUNK, Stage.CHUNK.startPercent(), "Chunking source files");
            List<CodeChunk> chunks = context.chunker().process(copy.path(), settings.chunkLimits(),
                stageProgress(run, Stage.CHUNK));
            int files = (int) chunks.stream().map(CodeChunk::file).distinct().count();
            run.recordChunking(files, chunks.size());
            advance(run, Stage.CHUNK, Stage.CHUNK.endPercent(), "Created " + chunks.size() + " chunks from " + files + " files");
            if (chunks.isEmpty()) {
                return null;
            }

            cancellation.throwIfCancelled();
            advance(run, Stage.EMBED, Stage.EMBED.startPercent(), "Embedding " + chunks.size() + " chunks");
            VectorIndex index = VectorIndex.create(context.indexConfig(), location.files());
            try {
                new CodebaseIndexer(context.embeddings()).index(chunks, index,
                    stageProgress(run, Stage.EMBED), cancellation);
            } catch (IOException | RuntimeException e) {
                // a partial checkpoint must not be mistaken for a complete index
                index.close();
                indexes.invalidate(location);
                throw e;
            }
            advance(run, Stage.EMBED, Stage.EMBED.endPercent(), "Indexed " + index.size() + " chunks");
            return index;
        }
    }

    private Optional<VectorIndex> loadReusable(IndexLocation location) throws IOException {
        Optional<VectorIndex> loaded;
        try {
            loaded = VectorIndex.load(location.files());
        } catch (UnsupportedFormatException | IOException e) {
            log.warn("Discarding index {}: {}", location.key(), e.getMessage());
            context.indexes().invalidate(location);
            return Optional.empty();
        }
        if (loaded.isEmpty()) {
            log.warn("Index {} is incomplete, rebuilding", location.key());
            context.indexes().invalidate(location);
            return Optional.empty();
        }
        try {
            CodebaseIndexer.requireCompatible(loaded.get(), context.embeddings());
        } catch (IncompatibleModelException e) {
            log.warn("Discarding index {}: {}", location.key(), e.getMessage());
            loaded.get().close();
            context.indexes().invalidate(location);
            return Optional.empty();
        }
        return loaded;
    }

    private static int countFiles(List<Map<String, Object>> metadata) {
        Set<Object> files = new HashSet<>();
        for (Map<String, Object> entry : metadata) {
            files.add(entry.get("file"));
        }
        return files.size();
    }

    // ==================== Investigation ====================

    private List<Finding> investigate(WorkingCopy copy, RepositoryProfile profile, Retriever retriever,
                                      VulnerabilityRetriever vulnerabilities, FindingValidator validator,
                                      List<VulnerabilityMatch> candidates, List<Finding> findings,
                                      TierSettings settings, AnalysisRun run, CancellationToken cancellation) {
        InvestigationToolbox toolbox = new InvestigationToolbox(copy.path(), profile, retriever, vulnerabilities,
            validator, context.retrievalSettings().codeThreshold());
        InvestigationState state = new InvestigationState(run.snapshot().repository(), settings.investigationSteps(),
            candidates, findings);
        Investigator.Outcome outcome = new Investigator(context.investigationPolicy(), toolbox)
            .investigate(state, (steps, budget) -> advance(run, Stage.INVESTIGATE,
                Stage.INVESTIGATE.percent(steps, budget), "Investigation step " + steps), cancellation);

        if (outcome.findings().isEmpty()) {
            return findings;
        }
        List<Finding> combined = new ArrayList<>(findings);
        combined.addAll(outcome.findings());
        return combined;
    }

    // ==================== Completion ====================

    private RunRecord finish(AnalysisRun run, List<Finding> findings, String message) throws IOException {
        advance(run, Stage.REPORT, Stage.REPORT.startPercent(), "Writing report");
        run.recordFindings(findings.size());
        Path reportFile = context.reportWriter().write(
            AnalysisReport.of(context.clock().instant(), run.snapshot(), findings));
        run.recordReport(reportFile.toString());
        advance(run, Stage.REPORT, Stage.REPORT.endPercent(), "Report written to " + reportFile);

        run.complete(message);
        RunRecord record = run.snapshot();
        persist(run);
        publish(record, message);
        log.info("Run {} completed: {} findings, index reused: {}", run.id(), findings.size(), record.indexReused());
        return record;
    }

    private RunRecord failed(AnalysisRun run, String message) {
        run.fail(message);
        RunRecord record = run.snapshot();
        persist(run);
        publish(record, "Failed: " + message);
        return record;
    }

    // ==================== Progress ====================

    private void advance(AnalysisRun run, Stage stage, int percent, String message) {
        run.advance(stage, percent);
        RunRecord record = run.snapshot();
        persist(run);
        publish(record, message);
        log.debug("Run {} [{}%] {}: {}", run.id(), record.progress(), stage.label(), message);
    }

    private ProgressCallback stageProgress(AnalysisRun run, Stage stage) {
        return (current, total) -> {
            run.advance(stage, stage.percent(current, total));
            RunRecord record = run.snapshot();
            publish(record, stage.label() + " " + current + "/" + total);
        };
    }

    private void publish(RunRecord record, String message) {
        context.progress().publish(new ProgressEvent(record.id(), record.progress(), record.stage(), message,
            context.clock().instant()));
    }

    private void persist(AnalysisRun run) {
        try {
            context.runStore().save(run.snapshot());
        } catch (IOException e) {
            log.warn("Cannot persist run {}: {}", run.id(), e.getMessage());
        }
    }

    private static Path localDirectory(String repository) {
        try {
            Path path = Path.of(repository);
            if (Files.isDirectory(path)) {
                return path.toAbsolutePath().normalize();
            }
        } catch (InvalidPathException e) {
            log.debug("'{}' is not a local path: {}", repository, e.getMessage());
        }
        return null;
    }

    /**
     * Cancels active runs and shuts the context down.
     */
    @Override
    public void close() {
        for (AnalysisHandle handle : active.values()) {
            handle.cancel();
        }
        context.close();
    }
}
