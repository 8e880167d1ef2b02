package io.vulnscan.analysis.progress;

import io.vulnscan.analysis.run.Stage;
import org.junit.jupiter.api.Test;

import java.time.Instant;
import java.util.List;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.TimeUnit;

import static org.junit.jupiter.api.Assertions.*;

class ProgressPublisherTest {

    @Test
    void testDeliversInOrder() throws Exception {
        List<Integer> seen = new CopyOnWriteArrayList<>();
        try (ProgressPublisher publisher = new ProgressPublisher()) {
            publisher.addListener(event -> seen.add(event.percent()));
            for (int i = 0; i <= 10; i++) {
                publisher.publish(event(i * 10));
            }
        }
        assertEquals(List.of(0, 10, 20, 30, 40, 50, 60, 70, 80, 90, 100), seen);
    }

    @Test
    void testThrowingListenerDoesNotAffectOthers() throws Exception {
        List<Integer> seen = new CopyOnWriteArrayList<>();
        try (ProgressPublisher publisher = new ProgressPublisher()) {
            publisher.addListener(event -> {
                throw new IllegalStateException("listener bug");
            });
            publisher.addListener(event -> seen.add(event.percent()));
            publisher.publish(event(5));
            publisher.publish(event(6));
        }
        assertEquals(List.of(5, 6), seen);
    }

    @Test
    void testSlowListenerNeverBlocksPublisher() throws Exception {
        CountDownLatch release = new CountDownLatch(1);
        try (ProgressPublisher publisher = new ProgressPublisher(4)) {
            publisher.addListener(event -> {
                try {
                    release.await(5, TimeUnit.SECONDS);
                } catch (InterruptedException e) {
                    Thread.currentThread().interrupt();
                }
            });

            long start = System.nanoTime();
            for (int i = 0; i < 1000; i++) {
                publisher.publish(event(i % 100));
            }
            long elapsedMillis = TimeUnit.NANOSECONDS.toMillis(System.nanoTime() - start);

            assertTrue(elapsedMillis < 2000, "publishing took " + elapsedMillis + "ms");
            release.countDown();
        }
    }

    @Test
    void testNoListenersIsANoOp() {
        try (ProgressPublisher publisher = new ProgressPublisher()) {
            assertDoesNotThrow(() -> publisher.publish(event(1)));
        }
    }

    private static ProgressEvent event(int percent) {
        return new ProgressEvent("run", percent, Stage.EMBED, "step", Instant.now());
    }
}
