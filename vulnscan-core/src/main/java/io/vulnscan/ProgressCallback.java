package io.vulnscan;

/**
 * Receives coarse progress from long-running loops (files chunked, batches embedded).
 */
@FunctionalInterface
public interface ProgressCallback {

    ProgressCallback NONE = (current, total) -> { };

    void onProgress(int current, int total);
}
