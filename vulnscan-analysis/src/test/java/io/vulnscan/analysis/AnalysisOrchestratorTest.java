package io.vulnscan.analysis;

import io.vulnscan.CodeChunk;
import io.vulnscan.PermanentInputException;
import io.vulnscan.ProgressCallback;
import io.vulnscan.analysis.config.AnalysisTier;
import io.vulnscan.analysis.config.RetrievalSettings;
import io.vulnscan.analysis.config.ScannerConfig;
import io.vulnscan.analysis.finding.Finding;
import io.vulnscan.analysis.report.AnalysisReport;
import io.vulnscan.analysis.run.AnalysisHandle;
import io.vulnscan.analysis.run.AnalysisRequest;
import io.vulnscan.analysis.run.CancellationToken;
import io.vulnscan.analysis.run.RunRecord;
import io.vulnscan.analysis.run.RunStatus;
import io.vulnscan.analysis.vcs.VcsClient;
import io.vulnscan.analysis.vcs.WorkingCopy;
import io.vulnscan.analysis.vuln.VulnerabilityMatch;
import io.vulnscan.analysis.vuln.VulnerabilityRecord;
import io.vulnscan.analysis.vuln.VulnerabilityStore;
import io.vulnscan.chunk.ChunkLimits;
import io.vulnscan.chunk.Chunker;
import io.vulnscan.chunk.ChunkerConfig;
import io.vulnscan.chunk.SourceChunker;
import io.vulnscan.index.IndexFiles;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Duration;
import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.stream.Stream;

import static org.junit.jupiter.api.Assertions.*;

class AnalysisOrchestratorTest {

    private static final String SQL_INJECTION =
        "SQL injection in jdbc query built by string concatenation of the user name";

    @TempDir
    Path tempDir;

    private Path dataDir;
    private Path repo;
    private ScannerConfig config;

    @BeforeEach
    void setUp() throws Exception {
        dataDir = tempDir.resolve("data");
        repo = Files.createDirectories(tempDir.resolve("repo"));
        Files.createDirectories(repo.resolve("src"));
        Files.writeString(repo.resolve("src/UserDao.java"), String.join("\n",
            "public class UserDao {",
            "    public User findByName(String name) {",
            "        return jdbc.query(\"SELECT * FROM users WHERE name = '\" + name + \"'\");",
            "    }",
            "}"));
        Files.writeString(repo.resolve("pom.xml"), "<project/>");
        config = ScannerConfig.defaults(dataDir)
            .withRetrieval(RetrievalSettings.defaults().withCodeThreshold(0.0));
    }

    @Test
    void testFindingReachesReport() throws Exception {
        try (AnalysisOrchestrator orchestrator = new AnalysisOrchestrator(context(new FakeEmbeddingModel()).build())) {
            RunRecord record = orchestrator.run(AnalysisRequest.of(repo.toString(), AnalysisTier.SHORT),
                CancellationToken.NONE);

            assertEquals(RunStatus.COMPLETED, record.status(), record.errorMessage());
            assertEquals(100, record.progress());
            assertTrue(record.totalFiles() >= 1);
            assertFalse(record.indexReused());
            assertTrue(record.totalFindings() > 0);

            AnalysisReport report = orchestrator.context().reportWriter().read(Path.of(record.reportPath()));
            Finding top = report.findings().get(0);
            assertEquals("CVE-2024-0001", top.vulnerabilityId());
            assertEquals("src/UserDao.java", top.file());
            assertTrue(top.snippet().contains("jdbc.query"));
            assertEquals(record.totalFindings(), report.findings().size());

            assertEquals(RunStatus.COMPLETED, orchestrator.status(record.id()).orElseThrow().status());
            assertTrue(Files.exists(repo.resolve("src/UserDao.java")));
        }
    }

    @Test
    void testSecondRunReusesIndexWithoutEmbeddingCalls() throws Exception {
        FakeEmbeddingModel first = new FakeEmbeddingModel();
        try (AnalysisOrchestrator orchestrator = new AnalysisOrchestrator(context(first).build())) {
            RunRecord record = orchestrator.run(AnalysisRequest.of(repo.toString(), AnalysisTier.SHORT),
                CancellationToken.NONE);
            assertEquals(RunStatus.COMPLETED, record.status(), record.errorMessage());
        }
        assertTrue(first.calls() > 0);

        FakeEmbeddingModel second = new FakeEmbeddingModel();
        try (AnalysisOrchestrator orchestrator = new AnalysisOrchestrator(context(second).build())) {
            RunRecord record = orchestrator.run(AnalysisRequest.of(repo.toString(), AnalysisTier.SHORT),
                CancellationToken.NONE);

            assertEquals(RunStatus.COMPLETED, record.status(), record.errorMessage());
            assertTrue(record.indexReused());
            assertTrue(record.totalChunks() > 0);
        }
        assertEquals(0, second.calls());
    }

    @Test
    void testChangedTreeIsRebuilt() throws Exception {
        try (AnalysisOrchestrator orchestrator = new AnalysisOrchestrator(context(new FakeEmbeddingModel()).build())) {
            orchestrator.run(AnalysisRequest.of(repo.toString(), AnalysisTier.SHORT), CancellationToken.NONE);
            Files.writeString(repo.resolve("src/Other.java"), "class Other { void run() { } }");

            RunRecord record = orchestrator.run(AnalysisRequest.of(repo.toString(), AnalysisTier.SHORT),
                CancellationToken.NONE);

            assertEquals(RunStatus.COMPLETED, record.status());
            assertFalse(record.indexReused());
        }
    }

    @Test
    void testCorruptPersistedIndexIsRebuilt() throws Exception {
        try (AnalysisOrchestrator orchestrator = new AnalysisOrchestrator(context(new FakeEmbeddingModel()).build())) {
            AnalysisRequest request = AnalysisRequest.of(repo.toString(), AnalysisTier.SHORT);
            assertEquals(RunStatus.COMPLETED, orchestrator.run(request, CancellationToken.NONE).status());

            Path metadata = persisted(IndexFiles.METADATA_FILE_NAME);
            Files.write(metadata, new byte[0]);
            RunRecord afterEmptyMetadata = orchestrator.run(request, CancellationToken.NONE);
            assertEquals(RunStatus.COMPLETED, afterEmptyMetadata.status(), afterEmptyMetadata.errorMessage());
            assertFalse(afterEmptyMetadata.indexReused());

            Path index = persisted(IndexFiles.INDEX_FILE_NAME);
            byte[] bytes = Files.readAllBytes(index);
            bytes[0] = 'X';
            Files.write(index, bytes);
            RunRecord afterBadHeader = orchestrator.run(request, CancellationToken.NONE);
            assertEquals(RunStatus.COMPLETED, afterBadHeader.status(), afterBadHeader.errorMessage());
            assertFalse(afterBadHeader.indexReused());

            RunRecord reused = orchestrator.run(request, CancellationToken.NONE);
            assertTrue(reused.indexReused());
            assertTrue(reused.totalChunks() > 0);
        }
    }

    @Test
    void testEmptyRepositoryCompletesWithoutFindings() throws Exception {
        Path empty = Files.createDirectories(tempDir.resolve("empty"));
        Files.writeString(empty.resolve("README"), "nothing to see");

        try (AnalysisOrchestrator orchestrator = new AnalysisOrchestrator(context(new FakeEmbeddingModel()).build())) {
            RunRecord record = orchestrator.run(AnalysisRequest.of(empty.toString(), AnalysisTier.SHORT),
                CancellationToken.NONE);

            assertEquals(RunStatus.COMPLETED, record.status());
            assertEquals(0, record.totalFindings());
            assertEquals(0, record.totalChunks());
            assertNotNull(record.reportPath());
        }
    }

    @Test
    void testMissingVulnerabilityStoreCompletesWithoutFindings() throws Exception {
        ServiceContext.Builder builder = ServiceContext.builder(config)
            .embeddingModel(new FakeEmbeddingModel())
            .vulnerabilityStore(null);

        try (AnalysisOrchestrator orchestrator = new AnalysisOrchestrator(builder.build())) {
            RunRecord record = orchestrator.run(AnalysisRequest.of(repo.toString(), AnalysisTier.SHORT),
                CancellationToken.NONE);

            assertEquals(RunStatus.COMPLETED, record.status());
            assertEquals(0, record.totalFindings());
            assertEquals("No vulnerability store available", record.message());
        }
    }

    @Test
    void testUnknownRepositoryFails() throws Exception {
        VcsClient missing = new VcsClient() {
            @Override
            public WorkingCopy checkout(String url, String branch) {
                throw new PermanentInputException(PermanentInputException.Reason.NOT_FOUND, "Repository not found: " + url);
            }

            @Override
            public void release(WorkingCopy copy) {
                fail("nothing was checked out");
            }
        };

        try (AnalysisOrchestrator orchestrator = new AnalysisOrchestrator(
                context(new FakeEmbeddingModel()).vcs(missing).build())) {
            RunRecord record = orchestrator.run(
                AnalysisRequest.of("https://example.com/missing.git", AnalysisTier.SHORT), CancellationToken.NONE);

            assertEquals(RunStatus.FAILED, record.status());
            assertEquals("Repository not found: https://example.com/missing.git", record.errorMessage());
            assertEquals(RunStatus.FAILED, orchestrator.status(record.id()).orElseThrow().status());
        }
    }

    @Test
    void testDisposableCopyIsReleased() throws Exception {
        CopyingVcsClient vcs = new CopyingVcsClient(repo, tempDir.resolve("checkouts"));

        try (AnalysisOrchestrator orchestrator = new AnalysisOrchestrator(
                context(new FakeEmbeddingModel()).vcs(vcs).build())) {
            RunRecord record = orchestrator.run(
                AnalysisRequest.of("https://example.com/app.git", AnalysisTier.SHORT), CancellationToken.NONE);

            assertEquals(RunStatus.COMPLETED, record.status(), record.errorMessage());
            assertEquals(1, vcs.released.size());
            assertFalse(Files.exists(vcs.released.get(0)));
        }
    }

    @Test
    void testCancelledRunFails() throws Exception {
        CancellationToken token = new CancellationToken();
        token.cancel();

        try (AnalysisOrchestrator orchestrator = new AnalysisOrchestrator(context(new FakeEmbeddingModel()).build())) {
            RunRecord record = orchestrator.run(AnalysisRequest.of(repo.toString(), AnalysisTier.SHORT), token);

            assertEquals(RunStatus.FAILED, record.status());
            assertEquals("Cancelled", record.errorMessage());
        }
        assertTrue(Files.exists(repo.resolve("src/UserDao.java")));
    }

    @Test
    void testProgressIsMonotonic() throws Exception {
        List<Integer> seen = new CopyOnWriteArrayList<>();
        AnalysisOrchestrator orchestrator = new AnalysisOrchestrator(context(new FakeEmbeddingModel()).build());
        orchestrator.context().progress().addListener(event -> seen.add(event.percent()));

        RunRecord record = orchestrator.run(AnalysisRequest.of(repo.toString(), AnalysisTier.SHORT),
            CancellationToken.NONE);
        orchestrator.close();

        assertEquals(RunStatus.COMPLETED, record.status());
        assertFalse(seen.isEmpty());
        for (int i = 1; i < seen.size(); i++) {
            assertTrue(seen.get(i) >= seen.get(i - 1), "progress went back at event " + i + ": " + seen);
        }
        assertEquals(100, seen.get(seen.size() - 1));
    }

    @Test
    void testConcurrentRunsBuildIndexOnce() throws Exception {
        CountingChunker chunker = new CountingChunker(new SourceChunker(ChunkerConfig.defaults()));

        try (AnalysisOrchestrator orchestrator = new AnalysisOrchestrator(
                context(new FakeEmbeddingModel()).chunker(chunker).build())) {
            List<AnalysisHandle> handles = new ArrayList<>();
            for (int i = 0; i < 3; i++) {
                handles.add(orchestrator.submit(AnalysisRequest.of(repo.toString(), AnalysisTier.SHORT)));
            }

            int reused = 0;
            for (AnalysisHandle handle : handles) {
                RunRecord record = handle.await(Duration.ofSeconds(60));
                assertEquals(RunStatus.COMPLETED, record.status(), record.errorMessage());
                if (record.indexReused()) {
                    reused++;
                }
            }

            assertEquals(1, chunker.calls.get());
            assertEquals(2, reused);
            assertEquals(3, orchestrator.history().size());
        }
    }

    // ==================== Fixtures ====================

    private ServiceContext.Builder context(FakeEmbeddingModel embeddings) {
        VulnerabilityRecord record = new VulnerabilityRecord("CVE-2024-0001", SQL_INJECTION, 9.1, null);
        return ServiceContext.builder(config)
            .embeddingModel(embeddings)
            .vulnerabilityStore(new FixedStore(embeddings.getDimensions(), List.of(record)));
    }

    /**
     * Returns the same records for every query.
     */
    static class FixedStore implements VulnerabilityStore {
        private final int dimensions;
        private final List<VulnerabilityRecord> records;

        FixedStore(int dimensions, List<VulnerabilityRecord> records) {
            this.dimensions = dimensions;
            this.records = records;
        }

        @Override
        public List<VulnerabilityMatch> similaritySearch(float[] vector, int limit, double threshold) {
            List<VulnerabilityMatch> matches = new ArrayList<>();
            for (VulnerabilityRecord record : records.subList(0, Math.min(limit, records.size()))) {
                matches.add(VulnerabilityMatch.firstPass(record, 0.9f));
            }
            return matches;
        }

        @Override
        public int dimensions() {
            return dimensions;
        }

        @Override
        public String describe() {
            return "fixed(" + records.size() + ")";
        }
    }

    /**
     * Hands out fresh disposable copies of a template tree.
     */
    static class CopyingVcsClient implements VcsClient {
        private final Path template;
        private final Path workDir;
        private final List<Path> released = new CopyOnWriteArrayList<>();
        private final AtomicInteger counter = new AtomicInteger();

        CopyingVcsClient(Path template, Path workDir) {
            this.template = template;
            this.workDir = workDir;
        }

        @Override
        public WorkingCopy checkout(String url, String branch) {
            Path target = workDir.resolve("copy-" + counter.incrementAndGet());
            try (var paths = Files.walk(template)) {
                for (Path source : (Iterable<Path>) paths::iterator) {
                    Path dest = target.resolve(template.relativize(source).toString());
                    if (Files.isDirectory(source)) {
                        Files.createDirectories(dest);
                    } else {
                        Files.copy(source, dest);
                    }
                }
            } catch (IOException e) {
                throw new IllegalStateException(e);
            }
            return new WorkingCopy(target, true);
        }

        @Override
        public void release(WorkingCopy copy) {
            released.add(copy.path());
            try (var paths = Files.walk(copy.path())) {
                for (Path path : (Iterable<Path>) paths.sorted((a, b) -> b.compareTo(a))::iterator) {
                    Files.deleteIfExists(path);
                }
            } catch (IOException e) {
                throw new IllegalStateException(e);
            }
        }
    }

    static class CountingChunker implements Chunker {
        private final Chunker delegate;
        private final AtomicInteger calls = new AtomicInteger();

        CountingChunker(Chunker delegate) {
            this.delegate = delegate;
        }

        @Override
        public List<CodeChunk> process(Path repoPath, ChunkLimits limits, ProgressCallback progress) throws IOException {
            calls.incrementAndGet();
            return delegate.process(repoPath, limits, progress);
        }
    }

    private Path persisted(String fileName) throws IOException {
        try (Stream<Path> paths = Files.walk(dataDir)) {
            return paths.filter(p -> p.getFileName().toString().equals(fileName))
                .findFirst()
                .orElseThrow(() -> new AssertionError("no " + fileName + " under " + dataDir));
        }
    }
}
