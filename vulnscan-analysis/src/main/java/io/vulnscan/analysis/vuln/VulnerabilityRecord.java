package io.vulnscan.analysis.vuln;

import com.fasterxml.jackson.annotation.JsonAlias;
import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonProperty;
import io.vulnscan.providers.validation.Severity;

import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Objects;

/**
 * A known vulnerability, e.g. one CVE entry.
 */
@JsonIgnoreProperties(ignoreUnknown = true)
@JsonInclude(JsonInclude.Include.NON_NULL)
public record VulnerabilityRecord(
    @JsonProperty("cve_id") @JsonAlias({"id"}) String id,
    @JsonProperty("summary") @JsonAlias({"description"}) String summary,
    @JsonProperty("cvss_score") Double cvssScore,
    @JsonProperty("cvss_vector") String cvssVector
) {
    static final String ID = "cve_id";
    static final String SUMMARY = "summary";
    static final String CVSS_SCORE = "cvss_score";
    static final String CVSS_VECTOR = "cvss_vector";

    public VulnerabilityRecord {
        Objects.requireNonNull(id, "id cannot be null");
        summary = summary != null ? summary : "";
    }

    public Severity severity() {
        return Severity.fromCvss(cvssScore);
    }

    /**
     * Text embedded for the local store and shown to the reranker.
     */
    public String document() {
        return id + ": " + summary;
    }

    Map<String, Object> toMetadata() {
        Map<String, Object> metadata = new LinkedHashMap<>();
        metadata.put(ID, id);
        metadata.put(SUMMARY, summary);
        if (cvssScore != null) {
            metadata.put(CVSS_SCORE, cvssScore);
        }
        if (cvssVector != null) {
            metadata.put(CVSS_VECTOR, cvssVector);
        }
        return metadata;
    }

    static VulnerabilityRecord fromMetadata(Map<String, Object> metadata) {
        Object score = metadata.get(CVSS_SCORE);
        Object vector = metadata.get(CVSS_VECTOR);
        return new VulnerabilityRecord(
            String.valueOf(metadata.get(ID)),
            (String) metadata.get(SUMMARY),
            score instanceof Number n ? n.doubleValue() : null,
            vector != null ? vector.toString() : null);
    }
}
