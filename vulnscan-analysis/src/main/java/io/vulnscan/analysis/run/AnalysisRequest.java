package io.vulnscan.analysis.run;

import io.vulnscan.analysis.config.AnalysisTier;
import io.vulnscan.analysis.config.TierSettings;

import java.util.Objects;

/**
 * What to analyze and how deeply.
 *
 * @param repository a Git URL, or a path to a local directory that is analyzed in place
 * @param branch branch to check out, or null for the default
 * @param tier named depth
 * @param settings effective depth settings, normally {@code tier.settings()}
 */
public record AnalysisRequest(String repository, String branch, AnalysisTier tier, TierSettings settings) {

    public AnalysisRequest {
        Objects.requireNonNull(repository, "repository cannot be null");
        if (repository.isBlank()) {
            throw new IllegalArgumentException("repository cannot be blank");
        }
        if (tier == null) tier = AnalysisTier.MEDIUM;
        if (settings == null) settings = tier.settings();
    }

    public static AnalysisRequest of(String repository, AnalysisTier tier) {
        return new AnalysisRequest(repository, null, tier, null);
    }

    public AnalysisRequest withBranch(String branch) {
        return new AnalysisRequest(repository, branch, tier, settings);
    }

    public AnalysisRequest withSettings(TierSettings settings) {
        return new AnalysisRequest(repository, branch, tier, settings);
    }
}
