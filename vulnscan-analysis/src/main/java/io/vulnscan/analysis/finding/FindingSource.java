package io.vulnscan.analysis.finding;

/**
 * Which part of the analysis produced a finding.
 */
public enum FindingSource {
    PIPELINE,
    INVESTIGATION
}
