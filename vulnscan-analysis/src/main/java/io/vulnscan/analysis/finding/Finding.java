package io.vulnscan.analysis.finding;

import com.fasterxml.jackson.annotation.JsonIgnore;
import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonProperty;
import io.vulnscan.providers.validation.Severity;

import java.util.Objects;

/**
 * A (vulnerability, code location) pair reported by an analysis.
 */
@JsonIgnoreProperties(ignoreUnknown = true)
public record Finding(
    @JsonProperty("vulnerability_id") String vulnerabilityId,
    @JsonProperty("description") String description,
    @JsonProperty("file_path") String file,
    @JsonProperty("start_line") int startLine,
    @JsonProperty("end_line") int endLine,
    @JsonProperty("code_snippet") String snippet,
    @JsonProperty("confidence_score") double confidence,
    @JsonProperty("severity") Severity severity,
    @JsonProperty("cvss_score") Double cvssScore,
    @JsonProperty("validation_status") ValidationStatus validationStatus,
    @JsonProperty("validation_explanation") String validationExplanation,
    @JsonProperty("source") FindingSource source
) {
    public Finding {
        Objects.requireNonNull(vulnerabilityId, "vulnerabilityId cannot be null");
        Objects.requireNonNull(file, "file cannot be null");
        if (severity == null) severity = Severity.UNKNOWN;
        if (validationStatus == null) validationStatus = ValidationStatus.PENDING;
        if (source == null) source = FindingSource.PIPELINE;
        description = description != null ? description : "";
        snippet = snippet != null ? snippet : "";
        validationExplanation = validationExplanation != null ? validationExplanation : "";
    }

    public String location() {
        return file + ":" + startLine + "-" + endLine;
    }

    @JsonIgnore
    public boolean isConfirmed() {
        return validationStatus == ValidationStatus.CONFIRMED;
    }

    public Finding withValidation(ValidationStatus status, Severity severity, String explanation) {
        return new Finding(vulnerabilityId, description, file, startLine, endLine, snippet, confidence,
            severity, cvssScore, status, explanation, source);
    }
}
