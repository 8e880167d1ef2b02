package io.vulnscan.analysis.run;

import io.vulnscan.analysis.config.AnalysisTier;

import java.time.Clock;
import java.time.Instant;
import java.util.Objects;

/**
 * Mutable state of one run, owned by the orchestrator.
 *
 * <p>Status only moves forward and progress never decreases. Once the run is
 * terminal every mutator is rejected.</p>
 */
public final class AnalysisRun {

    private final String id;
    private final String repository;
    private final String branch;
    private final AnalysisTier tier;
    private final Clock clock;

    private RunStatus status = RunStatus.PENDING;
    private Stage stage = Stage.PENDING;
    private int progress;
    private int totalFiles;
    private int totalChunks;
    private int totalFindings;
    private boolean indexReused;
    private Instant startTime;
    private Instant endTime;
    private String errorMessage;
    private String message;
    private String reportPath;

    public AnalysisRun(String id, String repository, String branch, AnalysisTier tier, Clock clock) {
        this.id = Objects.requireNonNull(id, "id cannot be null");
        this.repository = Objects.requireNonNull(repository, "repository cannot be null");
        this.branch = branch;
        this.tier = Objects.requireNonNull(tier, "tier cannot be null");
        this.clock = clock;
    }

    public String id() {
        return id;
    }

    public synchronized RunStatus status() {
        return status;
    }

    public synchronized int progress() {
        return progress;
    }

    public synchronized void start() {
        transition(RunStatus.RUNNING);
        startTime = clock.instant();
    }

    /**
     * Records the current stage and percentage.
     *
     * @return the effective percentage, never lower than any earlier one
     */
    public synchronized int advance(Stage stage, int percent) {
        requireRunning();
        this.stage = stage;
        progress = Math.max(progress, Math.min(100, percent));
        return progress;
    }

    public synchronized void recordChunking(int files, int chunks) {
        requireRunning();
        totalFiles = files;
        totalChunks = chunks;
    }

    public synchronized void recordIndexReused(int chunks) {
        requireRunning();
        indexReused = true;
        totalChunks = chunks;
    }

    public synchronized void recordFindings(int findings) {
        requireRunning();
        totalFindings = findings;
    }

    public synchronized void recordReport(String path) {
        requireRunning();
        reportPath = path;
    }

    public synchronized void complete(String message) {
        transition(RunStatus.COMPLETED);
        stage = Stage.FINALIZE;
        progress = 100;
        this.message = message;
        endTime = clock.instant();
    }

    public synchronized void fail(String errorMessage) {
        transition(RunStatus.FAILED);
        this.errorMessage = errorMessage != null ? errorMessage : "Unknown error";
        endTime = clock.instant();
    }

    public synchronized RunRecord snapshot() {
        return new RunRecord(id, repository, branch, tier, status, stage, progress, totalFiles, totalChunks,
            totalFindings, indexReused, startTime, endTime, errorMessage, message, reportPath);
    }

    private void transition(RunStatus next) {
        if (!status.canMoveTo(next)) {
            throw new IllegalStateException("Run " + id + " cannot move from " + status + " to " + next);
        }
        status = next;
    }

    private void requireRunning() {
        if (status != RunStatus.RUNNING) {
            throw new IllegalStateException("Run " + id + " is " + status);
        }
    }
}
