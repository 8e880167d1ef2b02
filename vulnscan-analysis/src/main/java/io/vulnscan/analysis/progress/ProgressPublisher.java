package io.vulnscan.analysis.progress;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.List;
import java.util.concurrent.ArrayBlockingQueue;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.ThreadPoolExecutor;
import java.util.concurrent.TimeUnit;

/**
 * Fire-and-forget delivery of progress events.
 *
 * <p>{@link #publish} never blocks: events go to a bounded queue drained by one
 * daemon thread, and when the queue is full the oldest pending event is
 * dropped. A listener that throws is logged and does not affect other
 * listeners or the run.</p>
 */
public class ProgressPublisher implements AutoCloseable {

    private static final Logger log = LoggerFactory.getLogger(ProgressPublisher.class);

    public static final int DEFAULT_QUEUE_CAPACITY = 256;

    private final List<ProgressListener> listeners = new CopyOnWriteArrayList<>();
    private final ExecutorService executor;

    public ProgressPublisher() {
        this(DEFAULT_QUEUE_CAPACITY);
    }

    public ProgressPublisher(int queueCapacity) {
        this.executor = new ThreadPoolExecutor(1, 1, 0L, TimeUnit.MILLISECONDS,
            new ArrayBlockingQueue<>(queueCapacity),
            runnable -> {
                Thread thread = new Thread(runnable, "vulnscan-progress");
                thread.setDaemon(true);
                return thread;
            },
            new ThreadPoolExecutor.DiscardOldestPolicy());
    }

    public void addListener(ProgressListener listener) {
        listeners.add(listener);
    }

    public void removeListener(ProgressListener listener) {
        listeners.remove(listener);
    }

    public void publish(ProgressEvent event) {
        if (listeners.isEmpty() || executor.isShutdown()) {
            return;
        }
        executor.execute(() -> deliver(event));
    }

    private void deliver(ProgressEvent event) {
        for (ProgressListener listener : listeners) {
            try {
                listener.onProgress(event);
            } catch (RuntimeException e) {
                log.warn("Progress listener failed for run {}: {}", event.runId(), e.getMessage());
            }
        }
    }

    /**
     * Stops accepting events and waits briefly for queued ones to be delivered.
     */
    @Override
    public void close() {
        executor.shutdown();
        try {
            if (!executor.awaitTermination(5, TimeUnit.SECONDS)) {
                executor.shutdownNow();
            }
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            executor.shutdownNow();
        }
    }
}
