package io.vulnscan.cli;

import io.vulnscan.analysis.config.ScannerConfig;
import io.vulnscan.analysis.run.RunRecord;
import io.vulnscan.analysis.run.RunStatus;
import io.vulnscan.index.IndexKind;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;
import picocli.CommandLine;

import java.io.ByteArrayOutputStream;
import java.io.PrintStream;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Instant;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.*;

class VulnScanCliTest {

    @TempDir
    Path tempDir;

    private Path dataDir;
    private Path project;

    @BeforeEach
    void setUp() throws Exception {
        dataDir = tempDir.resolve("data");
        project = Files.createDirectories(tempDir.resolve("project"));
        Files.writeString(project.resolve("Login.java"), String.join("\n",
            "public class Login {",
            "    boolean check(String user, String password) {",
            "        return db.query(\"SELECT 1 FROM users WHERE user='\" + user + \"'\") != null;",
            "    }",
            "}"));
    }

    @Test
    void testIndexThenSearch() {
        assertEquals(0, execute("index", "-d", dataDir.toString(), project.toString()));
        assertEquals(0, execute("index", "-d", dataDir.toString(), project.toString()));

        assertEquals(0, execute("search", "-d", dataDir.toString(), project.toString(), "users query", "-n", "3"));
    }

    @Test
    void testSearchWithoutIndexFails() {
        assertEquals(1, execute("search", "-d", dataDir.toString(), project.toString(), "anything"));
    }

    @Test
    void testIndexRejectsMissingDirectory() {
        assertEquals(2, execute("index", "-d", dataDir.toString(), tempDir.resolve("nope").toString()));
    }

    @Test
    void testIngestBuildsVulnerabilityIndex() throws Exception {
        Path records = tempDir.resolve("records.json");
        Files.writeString(records, """
            [
              {"cve_id": "CVE-2023-0001", "summary": "SQL injection in login query", "cvss_score": 9.8},
              {"cve_id": "CVE-2023-0002", "summary": "Cross-site scripting in search page"}
            ]
            """);

        assertEquals(0, execute("ingest", "-d", dataDir.toString(), records.toString()));

        assertTrue(Files.exists(dataDir.resolve("vulnerabilities").resolve("codebase.vidx")));
    }

    @Test
    void testCacheCleanAndStats() {
        execute("index", "-d", dataDir.toString(), project.toString());

        assertEquals(0, execute("cache-clean", "-d", dataDir.toString(), "--embedding-days", "0"));
        assertEquals(0, execute("stats", "-d", dataDir.toString()));
    }

    @Test
    void testUnknownTierIsRejected() {
        assertNotEquals(0, execute("analyze", "-d", dataDir.toString(), "-t", "extreme", project.toString()));
    }

    @Test
    void testCommonOptionsOverrideEnvironment() {
        VulnScanCli.CommonOptions options = new VulnScanCli.CommonOptions();
        options.dataDir = dataDir;
        options.indexKind = IndexKind.HNSW;

        ScannerConfig config = options.config(Map.of("VULNSCAN_DATA_DIR", "/elsewhere"));

        assertEquals(dataDir, config.dataDir());
        assertEquals(IndexKind.HNSW, config.indexKind());
        assertEquals(Path.of("/elsewhere"),
            new VulnScanCli.CommonOptions().config(Map.of("VULNSCAN_DATA_DIR", "/elsewhere")).dataDir());
    }

    @Test
    void testPrintRun() {
        RunRecord failed = new RunRecord("r1", "https://example.com/x.git", null, null, RunStatus.FAILED, null, 10,
            0, 0, 0, false, Instant.EPOCH, Instant.EPOCH, "Repository not found", null, null);
        ByteArrayOutputStream buffer = new ByteArrayOutputStream();

        VulnScanCli.printRun(new PrintStream(buffer, true, StandardCharsets.UTF_8), failed);

        String out = buffer.toString(StandardCharsets.UTF_8);
        assertTrue(out.contains("Status: FAILED"));
        assertTrue(out.contains("Error: Repository not found"));
    }

    private static int execute(String... args) {
        return new CommandLine(new VulnScanCli()).execute(args);
    }
}
