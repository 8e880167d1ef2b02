package io.vulnscan.analysis.config;

import java.util.Locale;

/**
 * Predefined analysis depths.
 */
public enum AnalysisTier {
    SHORT(new TierSettings(500, 20, 30, 5, false, 10, 5, 2, 3, 0)),
    MEDIUM(new TierSettings(2000, 50, 50, 10, true, 20, 10, 3, 5, 0)),
    HARD(new TierSettings(0, 0, 100, 20, true, 30, 20, 5, 10, 12));

    private final TierSettings settings;

    AnalysisTier(TierSettings settings) {
        this.settings = settings;
    }

    public TierSettings settings() {
        return settings;
    }

    /**
     * Parses a tier name case-insensitively.
     *
     * @throws IllegalArgumentException for unknown names
     */
    public static AnalysisTier parse(String name) {
        try {
            return valueOf(name.trim().toUpperCase(Locale.ROOT));
        } catch (IllegalArgumentException e) {
            throw new IllegalArgumentException("Unknown analysis tier: " + name + " (expected SHORT, MEDIUM or HARD)", e);
        }
    }
}
