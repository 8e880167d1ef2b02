package io.vulnscan.analysis.run;

import io.vulnscan.analysis.config.AnalysisTier;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.time.Clock;
import java.time.Instant;
import java.time.ZoneOffset;

import static org.junit.jupiter.api.Assertions.*;

class AnalysisRunTest {

    private AnalysisRun run;

    @BeforeEach
    void setUp() {
        Clock clock = Clock.fixed(Instant.parse("2026-01-01T00:00:00Z"), ZoneOffset.UTC);
        run = new AnalysisRun("run-1", "https://example.com/repo.git", null, AnalysisTier.SHORT, clock);
    }

    @Test
    void testHappyPath() {
        assertEquals(RunStatus.PENDING, run.status());
        run.start();
        run.advance(Stage.CHUNK, 15);
        run.recordChunking(3, 12);
        run.complete("done");

        RunRecord record = run.snapshot();
        assertEquals(RunStatus.COMPLETED, record.status());
        assertEquals(100, record.progress());
        assertEquals(Stage.FINALIZE, record.stage());
        assertEquals(3, record.totalFiles());
        assertEquals(12, record.totalChunks());
        assertNotNull(record.startTime());
        assertNotNull(record.endTime());
    }

    @Test
    void testProgressNeverDecreases() {
        run.start();
        assertEquals(40, run.advance(Stage.VULNERABILITY_SEARCH, 40));
        assertEquals(40, run.advance(Stage.CHUNK, 12));
        assertEquals(100, run.advance(Stage.REPORT, 250));
    }

    @Test
    void testTerminalRunRejectsChanges() {
        run.start();
        run.fail("boom");

        assertThrows(IllegalStateException.class, () -> run.advance(Stage.EMBED, 30));
        assertThrows(IllegalStateException.class, () -> run.complete("late"));
        assertThrows(IllegalStateException.class, () -> run.fail("again"));
        assertEquals("boom", run.snapshot().errorMessage());
    }

    @Test
    void testMustStartBeforeAdvancing() {
        assertThrows(IllegalStateException.class, () -> run.advance(Stage.ACQUIRE, 5));
        assertThrows(IllegalStateException.class, () -> run.complete("skipped"));
    }

    @Test
    void testStatusTransitions() {
        assertTrue(RunStatus.PENDING.canMoveTo(RunStatus.RUNNING));
        assertFalse(RunStatus.PENDING.canMoveTo(RunStatus.COMPLETED));
        assertFalse(RunStatus.COMPLETED.canMoveTo(RunStatus.RUNNING));
        assertTrue(RunStatus.FAILED.isTerminal());
        assertFalse(RunStatus.RUNNING.isTerminal());
    }

    @Test
    void testStageBands() {
        assertEquals(20, Stage.EMBED.percent(0, 10));
        assertEquals(27, Stage.EMBED.percent(5, 10));
        assertEquals(35, Stage.EMBED.percent(10, 10));
        assertEquals(35, Stage.EMBED.percent(99, 10));
        assertEquals(Stage.VALIDATE.startPercent(), Stage.VALIDATE.percent(3, 0));
    }
}
