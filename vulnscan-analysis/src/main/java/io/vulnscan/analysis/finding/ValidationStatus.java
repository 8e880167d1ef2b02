package io.vulnscan.analysis.finding;

public enum ValidationStatus {
    /** Not sent to validation */
    PENDING,
    CONFIRMED,
    FALSE_POSITIVE,
    /** Validation was attempted but failed for this finding */
    NEEDS_REVIEW
}
