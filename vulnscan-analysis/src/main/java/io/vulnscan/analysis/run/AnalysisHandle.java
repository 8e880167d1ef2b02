package io.vulnscan.analysis.run;

import java.time.Duration;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.Future;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;

/**
 * A submitted run: its live state, its result and its cancellation switch.
 */
public final class AnalysisHandle {

    private final AnalysisRun run;
    private final Future<RunRecord> result;
    private final CancellationToken cancellation;

    public AnalysisHandle(AnalysisRun run, Future<RunRecord> result, CancellationToken cancellation) {
        this.run = run;
        this.result = result;
        this.cancellation = cancellation;
    }

    public String runId() {
        return run.id();
    }

    public RunRecord snapshot() {
        return run.snapshot();
    }

    /**
     * Requests cancellation. The run stops before its next stage or item and ends as failed.
     */
    public void cancel() {
        cancellation.cancel();
    }

    /**
     * Waits for the run to reach a terminal status.
     */
    public RunRecord await() throws InterruptedException {
        try {
            return result.get();
        } catch (ExecutionException e) {
            throw new IllegalStateException("Run " + run.id() + " crashed", e.getCause());
        }
    }

    public RunRecord await(Duration timeout) throws InterruptedException, TimeoutException {
        try {
            return result.get(timeout.toMillis(), TimeUnit.MILLISECONDS);
        } catch (ExecutionException e) {
            throw new IllegalStateException("Run " + run.id() + " crashed", e.getCause());
        }
    }
}
