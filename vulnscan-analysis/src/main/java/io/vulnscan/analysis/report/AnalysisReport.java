package io.vulnscan.analysis.report;

import com.fasterxml.jackson.annotation.JsonProperty;
import io.vulnscan.analysis.finding.Finding;
import io.vulnscan.analysis.run.RunRecord;

import java.time.Instant;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;

/**
 * Machine-readable analysis result: the run, summary counts and ranked findings.
 */
public record AnalysisReport(
    @JsonProperty("generated_at") Instant generatedAt,
    @JsonProperty("analysis") RunRecord run,
    @JsonProperty("summary") ReportSummary summary,
    @JsonProperty("findings") List<Finding> findings
) {
    /**
     * Builds a report with findings sorted by confidence, highest first.
     */
    public static AnalysisReport of(Instant generatedAt, RunRecord run, List<Finding> findings) {
        List<Finding> ranked = new ArrayList<>(findings);
        ranked.sort(Comparator.comparingDouble(Finding::confidence).reversed());
        return new AnalysisReport(generatedAt, run,
            ReportSummary.of(run.totalFiles(), run.totalChunks(), ranked), List.copyOf(ranked));
    }
}
