package io.vulnscan.analysis.progress;

/**
 * Receives progress events. Called on the publisher's own thread, never on a stage thread.
 */
@FunctionalInterface
public interface ProgressListener {

    void onProgress(ProgressEvent event);
}
