package io.vulnscan.analysis.config;

/**
 * Score thresholds used during retrieval.
 */
public record RetrievalSettings(
    /** Minimum similarity for a code match */
    double codeThreshold,

    /** Minimum first-pass similarity for a vulnerability candidate */
    double vulnerabilityThreshold,

    /** Minimum rerank relevance for a candidate to be promoted */
    double rerankThreshold,

    /** Query width handling against external vulnerability stores */
    WidthPolicy widthPolicy
) {
    public static final double DEFAULT_CODE_THRESHOLD = 0.5;
    public static final double DEFAULT_VULNERABILITY_THRESHOLD = 0.0;
    public static final double DEFAULT_RERANK_THRESHOLD = 0.7;

    public RetrievalSettings {
        if (widthPolicy == null) widthPolicy = WidthPolicy.STRICT;
    }

    public static RetrievalSettings defaults() {
        return new RetrievalSettings(DEFAULT_CODE_THRESHOLD, DEFAULT_VULNERABILITY_THRESHOLD,
            DEFAULT_RERANK_THRESHOLD, WidthPolicy.STRICT);
    }

    public RetrievalSettings withCodeThreshold(double codeThreshold) {
        return new RetrievalSettings(codeThreshold, vulnerabilityThreshold, rerankThreshold, widthPolicy);
    }

    public RetrievalSettings withRerankThreshold(double rerankThreshold) {
        return new RetrievalSettings(codeThreshold, vulnerabilityThreshold, rerankThreshold, widthPolicy);
    }

    public RetrievalSettings withWidthPolicy(WidthPolicy widthPolicy) {
        return new RetrievalSettings(codeThreshold, vulnerabilityThreshold, rerankThreshold, widthPolicy);
    }
}
