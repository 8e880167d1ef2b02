package io.vulnscan.analysis.report;

import com.fasterxml.jackson.annotation.JsonProperty;
import io.vulnscan.analysis.finding.Finding;
import io.vulnscan.providers.validation.Severity;

import java.util.EnumMap;
import java.util.List;
import java.util.Map;

/**
 * Aggregate counts of a report.
 */
public record ReportSummary(
    @JsonProperty("total_files_analyzed") int totalFilesAnalyzed,
    @JsonProperty("total_chunks_analyzed") int totalChunksAnalyzed,
    @JsonProperty("total_findings") int totalFindings,
    @JsonProperty("confirmed_vulnerabilities") int confirmedVulnerabilities,
    @JsonProperty("severity_breakdown") Map<Severity, Integer> severityBreakdown
) {
    public static ReportSummary of(int files, int chunks, List<Finding> findings) {
        Map<Severity, Integer> breakdown = new EnumMap<>(Severity.class);
        for (Severity severity : Severity.values()) {
            breakdown.put(severity, 0);
        }
        int confirmed = 0;
        for (Finding finding : findings) {
            breakdown.merge(finding.severity(), 1, Integer::sum);
            if (finding.isConfirmed()) {
                confirmed++;
            }
        }
        return new ReportSummary(files, chunks, findings.size(), confirmed, breakdown);
    }
}
