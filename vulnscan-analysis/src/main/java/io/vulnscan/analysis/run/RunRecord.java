package io.vulnscan.analysis.run;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonProperty;
import io.vulnscan.analysis.config.AnalysisTier;

import java.time.Instant;

/**
 * Immutable snapshot of an analysis run, as persisted and reported.
 */
@JsonIgnoreProperties(ignoreUnknown = true)
@JsonInclude(JsonInclude.Include.NON_NULL)
public record RunRecord(
    @JsonProperty("analysis_id") String id,
    @JsonProperty("repo_url") String repository,
    @JsonProperty("branch") String branch,
    @JsonProperty("analysis_type") AnalysisTier tier,
    @JsonProperty("status") RunStatus status,
    @JsonProperty("stage") Stage stage,
    @JsonProperty("progress") int progress,
    @JsonProperty("total_files") int totalFiles,
    @JsonProperty("total_chunks") int totalChunks,
    @JsonProperty("total_findings") int totalFindings,
    @JsonProperty("index_reused") boolean indexReused,
    @JsonProperty("start_time") Instant startTime,
    @JsonProperty("end_time") Instant endTime,
    @JsonProperty("error_message") String errorMessage,
    @JsonProperty("message") String message,
    @JsonProperty("report_path") String reportPath
) {
}
