package io.vulnscan.analysis.retrieval;

import io.vulnscan.PermanentInputException;
import io.vulnscan.ProgressCallback;
import io.vulnscan.TransientProviderException;
import io.vulnscan.analysis.run.CancellationToken;
import io.vulnscan.analysis.vuln.VulnerabilityMatch;
import io.vulnscan.analysis.vuln.VulnerabilityRecord;
import io.vulnscan.providers.completion.CompletionModel;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.*;
import java.util.regex.Pattern;

/**
 * Expands broad vulnerability descriptions into narrower code-search queries.
 *
 * <p>Decomposition asks a completion model for one query per line. Without a
 * model, or when the model fails or returns nothing usable, the candidate's
 * summary is the only query.</p>
 */
public class QueryDecomposer {

    private static final Logger log = LoggerFactory.getLogger(QueryDecomposer.class);

    private static final Pattern LIST_MARKER = Pattern.compile("^\\s*(?:[-*•]|\\d+[.)])\\s*");

    private static final Map<String, List<String>> SECURITY_TERMS = new LinkedHashMap<>();

    static {
        SECURITY_TERMS.put("buffer overflow", List.of("buffer overrun", "stack overflow", "heap overflow"));
        SECURITY_TERMS.put("sql injection", List.of("sqli", "database injection", "sql attack"));
        SECURITY_TERMS.put("xss", List.of("cross-site scripting", "script injection"));
        SECURITY_TERMS.put("csrf", List.of("cross-site request forgery", "session riding"));
        SECURITY_TERMS.put("rce", List.of("remote code execution", "code injection"));
    }

    static final String SYSTEM_PROMPT = "You are a security expert analyzing code vulnerabilities.";

    private final CompletionModel completion;

    /**
     * @param completion completion model, or null to search with summaries only
     */
    public QueryDecomposer(CompletionModel completion) {
        this.completion = completion;
    }

    /**
     * Returns between 1 and {@code numQueries} queries for a vulnerability.
     */
    public List<String> decompose(VulnerabilityRecord record, int numQueries) {
        List<String> fallback = List.of(record.summary().isBlank() ? record.id() : record.summary());
        if (completion == null || numQueries < 1) {
            return fallback;
        }

        String prompt = "CVE: " + record.id() + "\n"
            + "Description: " + record.summary() + "\n\n"
            + "Generate " + numQueries + " diverse search queries to find code patterns related to this vulnerability.\n"
            + "Each query should focus on a different aspect: vulnerable code patterns, the functions or methods\n"
            + "involved, related data structures, library or framework usage, and security-sensitive operations.\n"
            + "Describe what vulnerable code would look like.\n\n"
            + "Return ONLY the queries, one per line, without numbering or explanation.";
        try {
            List<String> queries = parseLines(completion.complete(SYSTEM_PROMPT, prompt));
            if (queries.isEmpty()) {
                return fallback;
            }
            List<String> limited = queries.subList(0, Math.min(numQueries, queries.size()));
            log.debug("Decomposed {} into {} queries", record.id(), limited.size());
            return limited;
        } catch (TransientProviderException | PermanentInputException e) {
            log.warn("Failed to decompose {}, using its summary: {}", record.id(), e.getMessage());
            return fallback;
        }
    }

    /**
     * Decomposes the best {@code candidatesToAnalyze} candidates. The total number
     * of sub-queries never exceeds {@code candidatesToAnalyze * queriesPerCandidate}.
     */
    public List<SubQuery> plan(List<VulnerabilityMatch> candidates, int candidatesToAnalyze, int queriesPerCandidate,
                               ProgressCallback progress, CancellationToken cancellation) {
        int budget = candidatesToAnalyze * queriesPerCandidate;
        List<VulnerabilityMatch> selected = candidates.subList(0, Math.min(candidatesToAnalyze, candidates.size()));
        List<SubQuery> plan = new ArrayList<>();
        for (int i = 0; i < selected.size() && plan.size() < budget; i++) {
            cancellation.throwIfCancelled();
            VulnerabilityMatch candidate = selected.get(i);
            for (String query : decompose(candidate.record(), queriesPerCandidate)) {
                if (plan.size() >= budget) {
                    break;
                }
                plan.add(new SubQuery(query, candidate));
            }
            progress.onProgress(i + 1, selected.size());
        }
        log.info("Decomposed {} candidates into {} queries (budget {})", selected.size(), plan.size(), budget);
        return plan;
    }

    static List<String> parseLines(String response) {
        List<String> lines = new ArrayList<>();
        for (String line : response.split("\r?\n")) {
            String cleaned = LIST_MARKER.matcher(line).replaceFirst("").trim();
            if (!cleaned.isEmpty()) {
                lines.add(cleaned);
            }
        }
        return lines;
    }

    /**
     * Keyword expansion without a model: the original query first, then
     * variants with known security synonyms substituted, or generic security
     * phrasings when no keyword matches. At most three queries.
     */
    public static List<String> expand(String query) {
        List<String> expansions = new ArrayList<>();
        expansions.add(query);
        String lower = query.toLowerCase(Locale.ROOT);
        for (Map.Entry<String, List<String>> term : SECURITY_TERMS.entrySet()) {
            int at = lower.indexOf(term.getKey());
            if (at >= 0) {
                String matched = query.substring(at, at + term.getKey().length());
                for (String variation : term.getValue()) {
                    expansions.add(query.replace(matched, variation));
                }
            }
        }
        if (expansions.size() == 1) {
            expansions.add("security vulnerability " + query);
            expansions.add(query + " exploit");
        }
        return List.copyOf(expansions.subList(0, Math.min(3, expansions.size())));
    }
}
