package io.vulnscan.index;

import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.*;
import java.util.concurrent.*;
import java.util.stream.Stream;

import static org.junit.jupiter.api.Assertions.*;

/**
 * Tests for FlatVectorIndex - exact search, append-only ids and persistence.
 */
class FlatVectorIndexTest {

    private static final int DIMENSIONS = 16;
    private static final String MODEL_ID = "test-model";

    @TempDir
    Path tempDir;

    private IndexConfig config;
    private Random random;

    @BeforeEach
    void setUp() {
        config = IndexConfig.forModel(MODEL_ID, DIMENSIONS).withCheckpointInterval(0);
        random = new Random(42);
    }

    // ==================== Add Tests ====================

    @Test
    void testIdsAreSequentialAcrossBatches() {
        VectorIndex index = VectorIndex.create(config);

        assertEquals(List.of(0, 1, 2), index.add(randomVectors(3), metadata(3)));
        assertEquals(List.of(3, 4), index.add(randomVectors(2), metadata(2)));
        assertEquals(5, index.size());
        assertEquals("item-1", index.get(4).metadata().get("name"));
    }

    @Test
    void testMetadataCountMismatchRejected() {
        VectorIndex index = VectorIndex.create(config);

        assertThrows(IllegalArgumentException.class, () -> index.add(randomVectors(3), metadata(2)));
        assertEquals(0, index.size());
    }

    @Test
    void testWrongWidthRejected() {
        VectorIndex index = VectorIndex.create(config);
        List<float[]> vectors = List.of(randomVector(), new float[DIMENSIONS + 1]);

        IllegalArgumentException e = assertThrows(IllegalArgumentException.class,
            () -> index.add(vectors, metadata(2)));
        assertTrue(e.getMessage().contains("expected 16, got 17"));
        assertEquals(0, index.size());
    }

    @Test
    void testStoredVectorIsACopy() {
        VectorIndex index = VectorIndex.create(config);
        float[] vector = randomVector();
        index.add(List.of(vector), metadata(1));

        vector[0] = 99f;

        assertNotEquals(99f, index.get(0).vector()[0]);
    }

    // ==================== Search Tests ====================

    @Test
    void testSearchOnEmptyIndexReturnsEmpty() {
        VectorIndex index = VectorIndex.create(config);

        assertTrue(index.search(randomVector(), 5).isEmpty());
    }

    @Test
    void testTopKCappedAtSize() {
        VectorIndex index = VectorIndex.create(config);
        index.add(randomVectors(3), metadata(3));

        assertEquals(3, index.search(randomVector(), 50).size());
    }

    @Test
    void testInnerProductRanksExactMatchFirst() {
        VectorIndex index = VectorIndex.create(config);
        List<float[]> vectors = new ArrayList<>();
        for (int i = 0; i < 20; i++) {
            vectors.add(Vectors.normalized(randomVector()));
        }
        index.add(vectors, metadata(20));

        List<SearchHit> hits = index.search(vectors.get(7), 5);

        assertEquals(7, hits.get(0).id());
        assertEquals(1.0f, hits.get(0).score(), 1e-5);
        for (int i = 1; i < hits.size(); i++) {
            assertTrue(hits.get(i - 1).score() >= hits.get(i).score());
        }
    }

    @Test
    void testL2RanksByAscendingDistance() {
        VectorIndex index = VectorIndex.create(config.withMetric(Metric.L2));
        float[] origin = new float[DIMENSIONS];
        float[] near = new float[DIMENSIONS];
        float[] far = new float[DIMENSIONS];
        near[0] = 1f;
        far[0] = 5f;
        index.add(List.of(far, near), metadata(2));

        List<SearchHit> hits = index.search(origin, 2);

        assertEquals(1, hits.get(0).id());
        assertEquals(1f, hits.get(0).score(), 1e-6);
        assertEquals(5f, hits.get(1).score(), 1e-6);
        assertTrue(hits.get(0).similarity() > hits.get(1).similarity());
    }

    @Test
    void testQueryWidthChecked() {
        VectorIndex index = VectorIndex.create(config);
        index.add(randomVectors(1), metadata(1));

        assertThrows(IllegalArgumentException.class, () -> index.search(new float[3], 1));
    }

    // ==================== Persistence Tests ====================

    @Test
    void testSaveAndLoad() throws IOException {
        IndexFiles files = IndexFiles.in(tempDir.resolve("idx"));
        VectorIndex index = VectorIndex.create(config, files);
        List<float[]> vectors = randomVectors(10);
        index.add(vectors, metadata(10));
        index.save();

        VectorIndex loaded = VectorIndex.load(files).orElseThrow();

        assertEquals(10, loaded.size());
        assertEquals(MODEL_ID, loaded.modelId());
        assertEquals(DIMENSIONS, loaded.dimensions());
        assertArrayEquals(vectors.get(3), loaded.get(3).vector());
        assertEquals("item-3", loaded.get(3).metadata().get("name"));
        assertEquals(List.of(10), loaded.add(randomVectors(1), metadata(1)));
    }

    @Test
    void testMissingFilesMeanNoIndex() throws IOException {
        assertTrue(VectorIndex.load(IndexFiles.in(tempDir.resolve("nothing"))).isEmpty());
    }

    @Test
    void testZeroLengthIndexFileMeansNoIndex() throws IOException {
        IndexFiles files = IndexFiles.in(tempDir);
        Files.writeString(files.metadataFile(), "[]");
        Files.createFile(files.indexFile());

        assertFalse(files.isPresent());
        assertTrue(VectorIndex.load(files).isEmpty());
    }

    @Test
    void testExtraMetadataTruncatedToIndexCount() throws IOException {
        IndexFiles files = IndexFiles.in(tempDir);
        VectorIndex index = VectorIndex.create(config, files);
        index.add(randomVectors(2), metadata(2));
        index.save();
        Files.writeString(files.metadataFile(),
            "[{\"name\":\"a\"},{\"name\":\"b\"},{\"name\":\"orphan\"}]");

        VectorIndex loaded = VectorIndex.load(files).orElseThrow();

        assertEquals(2, loaded.size());
        assertEquals(2, loaded.metadata().size());
    }

    @Test
    void testShortMetadataMeansNoIndex() throws IOException {
        IndexFiles files = IndexFiles.in(tempDir);
        VectorIndex index = VectorIndex.create(config, files);
        index.add(randomVectors(2), metadata(2));
        index.save();
        Files.writeString(files.metadataFile(), "[{\"name\":\"a\"}]");

        assertTrue(VectorIndex.load(files).isEmpty());
    }

    @Test
    void testEmptyOrGarbledMetadataMeansNoIndex() throws IOException {
        IndexFiles files = savedIndex(1);

        Files.write(files.metadataFile(), new byte[0]);
        assertFalse(files.isPresent());
        assertTrue(VectorIndex.load(files).isEmpty());

        Files.writeString(files.metadataFile(), "{not json");
        assertTrue(VectorIndex.load(files).isEmpty());
    }

    @Test
    void testCorruptHeaderMeansNoIndex() throws IOException {
        IndexFiles files = savedIndex(2);
        byte[] original = Files.readAllBytes(files.indexFile());

        byte[] badMagic = original.clone();
        badMagic[0] = 'X';
        Files.write(files.indexFile(), badMagic);
        assertTrue(VectorIndex.load(files).isEmpty());

        // kind byte follows the magic and the format version
        byte[] badKind = original.clone();
        badKind[6] = (byte) 0xEE;
        Files.write(files.indexFile(), badKind);
        assertTrue(VectorIndex.load(files).isEmpty());

        // dimensions far larger than the file can hold
        byte[] badWidth = original.clone();
        badWidth[8] = 0x7F;
        Files.write(files.indexFile(), badWidth);
        assertTrue(VectorIndex.load(files).isEmpty());
    }

    @Test
    void testAutoCheckpoint() throws IOException {
        IndexFiles files = IndexFiles.in(tempDir);
        VectorIndex index = VectorIndex.create(config.withCheckpointInterval(5), files);

        index.add(randomVectors(4), metadata(4));
        assertFalse(files.isPresent());

        index.add(randomVectors(3), metadata(3));
        assertTrue(files.isPresent());
        assertEquals(7, VectorIndex.load(files).orElseThrow().size());
    }

    @Test
    void testConcurrentCheckpointsLeaveConsistentFiles() throws Exception {
        IndexFiles files = IndexFiles.in(tempDir);
        VectorIndex index = VectorIndex.create(config.withCheckpointInterval(1), files);
        int threads = 8;
        int perThread = 25;
        List<List<float[]>> batches = new ArrayList<>();
        for (int t = 0; t < threads; t++) {
            batches.add(randomVectors(perThread));
        }
        ExecutorService executor = Executors.newFixedThreadPool(threads);
        CountDownLatch start = new CountDownLatch(1);
        List<Future<?>> futures = new ArrayList<>();
        try {
            for (List<float[]> batch : batches) {
                futures.add(executor.submit(() -> {
                    start.await();
                    for (float[] vector : batch) {
                        index.add(List.of(vector), metadata(1));
                    }
                    return null;
                }));
            }
            start.countDown();
            for (Future<?> future : futures) {
                future.get(30, TimeUnit.SECONDS);
            }
        } finally {
            executor.shutdownNow();
        }

        VectorIndex loaded = VectorIndex.load(files).orElseThrow();
        assertEquals(threads * perThread, loaded.size());
        try (Stream<Path> listing = Files.list(tempDir)) {
            assertTrue(listing.noneMatch(p -> p.getFileName().toString().endsWith(".tmp")));
        }
    }

    @Test
    void testSaveWithoutFilesFails() {
        VectorIndex index = VectorIndex.create(config);

        assertThrows(IllegalStateException.class, index::save);
    }

    // ==================== Helper Methods ====================

    private IndexFiles savedIndex(int count) throws IOException {
        IndexFiles files = IndexFiles.in(tempDir);
        VectorIndex index = VectorIndex.create(config, files);
        index.add(randomVectors(count), metadata(count));
        index.save();
        return files;
    }

    private float[] randomVector() {
        float[] v = new float[DIMENSIONS];
        for (int i = 0; i < DIMENSIONS; i++) {
            v[i] = (float) random.nextGaussian();
        }
        return v;
    }

    private List<float[]> randomVectors(int count) {
        List<float[]> vectors = new ArrayList<>();
        for (int i = 0; i < count; i++) {
            vectors.add(randomVector());
        }
        return vectors;
    }

    private static List<Map<String, Object>> metadata(int count) {
        List<Map<String, Object>> entries = new ArrayList<>();
        for (int i = 0; i < count; i++) {
            entries.add(Map.of("name", "item-" + i, "line", i + 1));
        }
        return entries;
    }
}
