package io.vulnscan.analysis.finding;

import io.vulnscan.analysis.retrieval.RetrievalResult;
import io.vulnscan.analysis.retrieval.SubQuery;
import io.vulnscan.analysis.vuln.VulnerabilityMatch;
import io.vulnscan.analysis.vuln.VulnerabilityRecord;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.*;

/**
 * Turns code matches into findings.
 *
 * <p>A code match is attributed to the candidates whose sub-query produced it.
 * Confidence is the code similarity times the candidate's relevance. Each
 * (chunk, vulnerability) pair yields at most one finding and each chunk at
 * most {@link #MAX_FINDINGS_PER_CHUNK}.</p>
 */
public class FindingAssembler {

    private static final Logger log = LoggerFactory.getLogger(FindingAssembler.class);

    public static final int MAX_FINDINGS_PER_CHUNK = 3;

    public List<Finding> assemble(List<RetrievalResult> matches, List<SubQuery> plan) {
        Map<String, List<VulnerabilityMatch>> candidatesByQuery = new HashMap<>();
        for (SubQuery subQuery : plan) {
            candidatesByQuery.computeIfAbsent(subQuery.text(), q -> new ArrayList<>()).add(subQuery.candidate());
        }

        List<Finding> findings = new ArrayList<>();
        Set<String> pairs = new HashSet<>();
        Map<Integer, Integer> perChunk = new HashMap<>();

        for (RetrievalResult match : matches) {
            for (VulnerabilityMatch candidate : candidatesByQuery.getOrDefault(match.query(), List.of())) {
                if (perChunk.getOrDefault(match.recordId(), 0) >= MAX_FINDINGS_PER_CHUNK) {
                    break;
                }
                if (!pairs.add(match.recordId() + "|" + candidate.id())) {
                    continue;
                }
                VulnerabilityRecord record = candidate.record();
                findings.add(new Finding(
                    record.id(), record.summary(),
                    match.file(), match.startLine(), match.endLine(), match.text(),
                    (double) match.score() * candidate.relevance(),
                    record.severity(), record.cvssScore(),
                    ValidationStatus.PENDING, null, FindingSource.PIPELINE));
                perChunk.merge(match.recordId(), 1, Integer::sum);
            }
        }
        log.info("Created {} findings from {} code matches", findings.size(), matches.size());
        return findings;
    }
}
