package io.vulnscan.analysis.run;

/**
 * Ordered analysis stages with the progress band each one covers.
 */
public enum Stage {
    PENDING("pending", 0, 0),
    ACQUIRE("cloning", 0, 10),
    CHUNK("chunking", 10, 20),
    EMBED("indexing", 20, 35),
    VULNERABILITY_SEARCH("cve_search", 35, 45),
    DECOMPOSITION("decomposition", 45, 50),
    CODE_SEARCH("code_search", 50, 70),
    MATCHING("matching", 70, 75),
    VALIDATE("validating", 75, 90),
    INVESTIGATE("investigating", 90, 95),
    REPORT("reporting", 95, 99),
    FINALIZE("finalizing", 100, 100);

    private final String label;
    private final int startPercent;
    private final int endPercent;

    Stage(String label, int startPercent, int endPercent) {
        this.label = label;
        this.startPercent = startPercent;
        this.endPercent = endPercent;
    }

    public String label() {
        return label;
    }

    public int startPercent() {
        return startPercent;
    }

    public int endPercent() {
        return endPercent;
    }

    /**
     * Maps (current, total) onto this stage's band.
     */
    public int percent(int current, int total) {
        if (total <= 0) {
            return startPercent;
        }
        int clamped = Math.max(0, Math.min(current, total));
        return startPercent + (int) ((long) (endPercent - startPercent) * clamped / total);
    }
}
