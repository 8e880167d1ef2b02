package io.vulnscan.analysis.finding;

import io.vulnscan.analysis.retrieval.RetrievalResult;
import io.vulnscan.analysis.retrieval.SubQuery;
import io.vulnscan.analysis.vuln.VulnerabilityMatch;
import io.vulnscan.analysis.vuln.VulnerabilityRecord;
import io.vulnscan.providers.validation.Severity;
import org.junit.jupiter.api.Test;

import java.util.ArrayList;
import java.util.List;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.*;

class FindingAssemblerTest {

    private final FindingAssembler assembler = new FindingAssembler();

    @Test
    void testConfidenceIsSimilarityTimesRelevance() {
        VulnerabilityMatch candidate = new VulnerabilityMatch(
            new VulnerabilityRecord("CVE-1", "SQL injection", 9.8, null), 0.6f, 0.8f);
        List<SubQuery> plan = List.of(new SubQuery("sql concatenation", candidate));

        List<Finding> findings = assembler.assemble(List.of(result(7, 0.5f, "sql concatenation")), plan);

        assertEquals(1, findings.size());
        Finding finding = findings.get(0);
        assertEquals("CVE-1", finding.vulnerabilityId());
        assertEquals(0.4, finding.confidence(), 1e-6);
        assertEquals(Severity.CRITICAL, finding.severity());
        assertEquals("src/Dao.java", finding.file());
        assertEquals("src/Dao.java:10-30", finding.location());
        assertEquals(ValidationStatus.PENDING, finding.validationStatus());
        assertEquals(FindingSource.PIPELINE, finding.source());
    }

    @Test
    void testOnlyCandidatesOfMatchingQueryAreAttributed() {
        VulnerabilityMatch sqli = VulnerabilityMatch.firstPass(new VulnerabilityRecord("CVE-SQL", "sqli", null, null), 0.9f);
        VulnerabilityMatch xss = VulnerabilityMatch.firstPass(new VulnerabilityRecord("CVE-XSS", "xss", null, null), 0.9f);
        List<SubQuery> plan = List.of(new SubQuery("query for sql", sqli), new SubQuery("query for xss", xss));

        List<Finding> findings = assembler.assemble(List.of(result(1, 0.9f, "query for xss")), plan);

        assertEquals(List.of("CVE-XSS"), findings.stream().map(Finding::vulnerabilityId).toList());
    }

    @Test
    void testSharedQueryAttributesEveryOwner() {
        VulnerabilityMatch a = VulnerabilityMatch.firstPass(new VulnerabilityRecord("CVE-A", "a", null, null), 0.9f);
        VulnerabilityMatch b = VulnerabilityMatch.firstPass(new VulnerabilityRecord("CVE-B", "b", null, null), 0.8f);
        List<SubQuery> plan = List.of(new SubQuery("deserialization", a), new SubQuery("deserialization", b));

        List<Finding> findings = assembler.assemble(List.of(result(3, 0.7f, "deserialization")), plan);

        assertEquals(List.of("CVE-A", "CVE-B"), findings.stream().map(Finding::vulnerabilityId).toList());
    }

    @Test
    void testAtMostThreeFindingsPerChunk() {
        List<SubQuery> plan = new ArrayList<>();
        for (int i = 0; i < 5; i++) {
            plan.add(new SubQuery("shared", VulnerabilityMatch.firstPass(
                new VulnerabilityRecord("CVE-" + i, "s", null, null), 0.9f)));
        }

        List<Finding> findings = assembler.assemble(
            List.of(result(1, 0.9f, "shared", 10), result(2, 0.8f, "shared", 40)), plan);

        assertEquals(6, findings.size());
        assertEquals(3, findings.stream().filter(f -> f.startLine() == 10).count());
        assertEquals(3, findings.stream().filter(f -> f.startLine() == 40).count());
    }

    @Test
    void testUnknownQueryYieldsNothing() {
        assertTrue(assembler.assemble(List.of(result(1, 0.9f, "orphan")), List.of()).isEmpty());
    }

    private static RetrievalResult result(int id, float score, String query) {
        return result(id, score, query, 10);
    }

    private static RetrievalResult result(int id, float score, String query, int startLine) {
        return new RetrievalResult(id, score, query, Map.of(
            "file", "src/Dao.java", "start_line", startLine, "end_line", startLine + 20,
            "text", "stmt.execute(sql + input)",
            "language", "java"));
    }
}
