package io.vulnscan.analysis.retrieval;

import io.vulnscan.analysis.vuln.VulnerabilityMatch;

/**
 * A narrow code-search query derived from one vulnerability candidate.
 */
public record SubQuery(String text, VulnerabilityMatch candidate) {
}
