package io.vulnscan.providers.validation;

import java.util.Objects;

/**
 * A validation provider's judgement on one candidate finding.
 */
public record Verdict(boolean vulnerable, Severity severity, String rationale) {

    public Verdict {
        Objects.requireNonNull(severity, "severity cannot be null");
        rationale = rationale != null ? rationale : "";
    }
}
