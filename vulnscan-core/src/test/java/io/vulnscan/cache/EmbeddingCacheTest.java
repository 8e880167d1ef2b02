package io.vulnscan.cache;

import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.attribute.FileTime;
import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.List;
import java.util.stream.Stream;

import static org.junit.jupiter.api.Assertions.*;

class EmbeddingCacheTest {

    private static final String MODEL = "test-model";

    @TempDir
    Path tempDir;

    private EmbeddingCache cache;

    @BeforeEach
    void setUp() {
        cache = new EmbeddingCache(tempDir);
    }

    @Test
    void testUnknownKeyIsAbsent() {
        assertTrue(cache.get(MODEL, "never stored").isEmpty());
    }

    @Test
    void testSetTwiceKeepsOneEntry() throws IOException {
        cache.set(MODEL, "text", new float[]{1f, 2f});
        cache.set(MODEL, "text", new float[]{1f, 2f});

        assertArrayEquals(new float[]{1f, 2f}, cache.get(MODEL, "text").orElseThrow());
        assertEquals(1, countFiles());
    }

    @Test
    void testLastWriterWins() {
        cache.set(MODEL, "text", new float[]{1f});
        cache.set(MODEL, "text", new float[]{2f});

        assertArrayEquals(new float[]{2f}, cache.get(MODEL, "text").orElseThrow());
        assertArrayEquals(new float[]{2f}, new EmbeddingCache(tempDir).get(MODEL, "text").orElseThrow());
    }

    @Test
    void testModelIsPartOfKey() {
        cache.set("model-a", "text", new float[]{1f});

        assertTrue(cache.get("model-b", "text").isEmpty());
    }

    @Test
    void testBatchRoundTrip() {
        cache.set(MODEL, "b", new float[]{2f});
        List<String> texts = List.of("a", "b", "c");

        EmbeddingCache.BatchLookup first = cache.getBatch(MODEL, texts);
        assertEquals(List.of(0, 2), first.missingIndices());
        assertNull(first.vectors().get(0));
        assertArrayEquals(new float[]{2f}, first.vectors().get(1));

        cache.setBatch(MODEL, List.of("a", "c"), List.of(new float[]{1f}, new float[]{3f}));

        EmbeddingCache.BatchLookup second = cache.getBatch(MODEL, texts);
        assertTrue(second.isComplete());
        assertArrayEquals(new float[]{3f}, second.vectors().get(2));
    }

    @Test
    void testFullMemoryTierRejectsButDiskKeeps() {
        EmbeddingCache small = new EmbeddingCache(tempDir, 2, Clock.systemUTC());
        small.set(MODEL, "a", new float[]{1f});
        small.set(MODEL, "b", new float[]{2f});
        small.set(MODEL, "c", new float[]{3f});

        assertEquals(2, small.stats().memoryEntries());
        assertEquals(3, small.stats().diskEntries());
        assertArrayEquals(new float[]{3f}, small.get(MODEL, "c").orElseThrow());
    }

    @Test
    void testDiskTierSurvivesNewInstance() {
        cache.set(MODEL, "persisted", new float[]{0.5f, 0.25f});

        EmbeddingCache reopened = new EmbeddingCache(tempDir);

        assertArrayEquals(new float[]{0.5f, 0.25f}, reopened.get(MODEL, "persisted").orElseThrow());
    }

    @Test
    void testCorruptFileIsAMiss() throws IOException {
        Files.write(tempDir.resolve(EmbeddingCache.key(MODEL, "broken") + ".vec"), new byte[]{1, 2});

        assertTrue(cache.get(MODEL, "broken").isEmpty());
    }

    @Test
    void testImplausibleLengthPrefixIsAMiss() throws IOException {
        Files.write(tempDir.resolve(EmbeddingCache.key(MODEL, "negative") + ".vec"),
            new byte[]{(byte) 0xFF, (byte) 0xFF, (byte) 0xFF, (byte) 0xFF});
        Files.write(tempDir.resolve(EmbeddingCache.key(MODEL, "huge") + ".vec"),
            new byte[]{0x7F, (byte) 0xFF, (byte) 0xFF, (byte) 0xFF, 0, 0, 0, 0});

        assertTrue(cache.get(MODEL, "negative").isEmpty());
        assertTrue(cache.get(MODEL, "huge").isEmpty());
        assertEquals(2, cache.getBatch(MODEL, List.of("negative", "huge")).missingIndices().size());
    }

    @Test
    void testClearOlderThan() throws IOException {
        cache.set(MODEL, "old", new float[]{1f});
        cache.set(MODEL, "new", new float[]{2f});
        Path oldFile = tempDir.resolve(EmbeddingCache.key(MODEL, "old") + ".vec");
        Files.setLastModifiedTime(oldFile, FileTime.from(Instant.now().minus(Duration.ofDays(40))));

        assertEquals(1, cache.clearOlderThan(30));
        assertFalse(Files.exists(oldFile));
        assertEquals(1, countFiles());
    }

    private long countFiles() throws IOException {
        try (Stream<Path> files = Files.list(tempDir)) {
            return files.filter(p -> p.toString().endsWith(".vec")).count();
        }
    }
}
