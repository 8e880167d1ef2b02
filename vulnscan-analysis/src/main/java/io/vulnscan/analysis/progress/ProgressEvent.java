package io.vulnscan.analysis.progress;

import io.vulnscan.analysis.run.Stage;

import java.time.Instant;

/**
 * One progress notification.
 */
public record ProgressEvent(String runId, int percent, Stage stage, String message, Instant timestamp) {
}
