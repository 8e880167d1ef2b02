package io.vulnscan.analysis.config;

import io.vulnscan.chunk.ChunkLimits;

/**
 * Depth settings of one analysis tier. Zero caps mean unlimited.
 */
public record TierSettings(
    /** Files scanned by the chunker (0 = unlimited) */
    int maxFiles,

    /** Chunks kept per file (0 = unlimited) */
    int maxChunksPerFile,

    /** First-pass vulnerability candidates fetched before reranking */
    int vulnerabilityCandidates,

    /** Candidates kept by the reranker */
    int rerankTopN,

    /** Whether findings are sent to the validation provider */
    boolean validationEnabled,

    /** Candidates kept from the initial vulnerability search */
    int cveTopK,

    /** Candidates decomposed into code-search queries */
    int candidatesToAnalyze,

    /** Sub-queries per decomposed candidate */
    int queriesPerCandidate,

    /** Code matches per sub-query */
    int matchesPerQuery,

    /** Investigation step budget (0 = no investigation) */
    int investigationSteps
) {
    public TierSettings {
        if (maxFiles < 0 || maxChunksPerFile < 0) throw new IllegalArgumentException("caps must be >= 0");
        if (vulnerabilityCandidates < 1) throw new IllegalArgumentException("vulnerabilityCandidates must be >= 1");
        if (rerankTopN < 1) throw new IllegalArgumentException("rerankTopN must be >= 1");
        if (candidatesToAnalyze < 1 || queriesPerCandidate < 1 || matchesPerQuery < 1) {
            throw new IllegalArgumentException("search budgets must be >= 1");
        }
        if (investigationSteps < 0) throw new IllegalArgumentException("investigationSteps must be >= 0");
    }

    public ChunkLimits chunkLimits() {
        return new ChunkLimits(maxFiles, maxChunksPerFile);
    }

    /**
     * Hard cap on sub-queries issued during decomposition.
     */
    public int decompositionBudget() {
        return candidatesToAnalyze * queriesPerCandidate;
    }

    public TierSettings withValidation(boolean validationEnabled) {
        return new TierSettings(maxFiles, maxChunksPerFile, vulnerabilityCandidates, rerankTopN, validationEnabled,
            cveTopK, candidatesToAnalyze, queriesPerCandidate, matchesPerQuery, investigationSteps);
    }

    public TierSettings withInvestigationSteps(int investigationSteps) {
        return new TierSettings(maxFiles, maxChunksPerFile, vulnerabilityCandidates, rerankTopN, validationEnabled,
            cveTopK, candidatesToAnalyze, queriesPerCandidate, matchesPerQuery, investigationSteps);
    }
}
