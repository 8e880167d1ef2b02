package io.vulnscan.analysis.config;

/**
 * What to do when a query vector's width differs from a vulnerability store's width.
 */
public enum WidthPolicy {
    /** Fail with a WIDTH_MISMATCH error */
    STRICT,
    /** Zero-pad or truncate the query vector; loses precision */
    PAD_OR_TRUNCATE
}
