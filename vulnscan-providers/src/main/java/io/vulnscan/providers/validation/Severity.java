package io.vulnscan.providers.validation;

import java.util.Locale;

/**
 * Severity of a vulnerability finding.
 */
public enum Severity {
    CRITICAL,
    HIGH,
    MEDIUM,
    LOW,
    UNKNOWN;

    public static Severity parse(String text) {
        if (text == null) {
            return UNKNOWN;
        }
        try {
            return valueOf(text.trim().toUpperCase(Locale.ROOT));
        } catch (IllegalArgumentException e) {
            return UNKNOWN;
        }
    }

    /**
     * CVSS v3 qualitative rating.
     */
    public static Severity fromCvss(Double score) {
        if (score == null) {
            return UNKNOWN;
        }
        if (score >= 9.0) return CRITICAL;
        if (score >= 7.0) return HIGH;
        if (score >= 4.0) return MEDIUM;
        if (score > 0.0) return LOW;
        return UNKNOWN;
    }
}
