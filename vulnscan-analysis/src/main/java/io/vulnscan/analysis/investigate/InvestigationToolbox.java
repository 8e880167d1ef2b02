package io.vulnscan.analysis.investigate;

import io.vulnscan.PermanentInputException;
import io.vulnscan.TransientProviderException;
import io.vulnscan.analysis.finding.Finding;
import io.vulnscan.analysis.finding.FindingSource;
import io.vulnscan.analysis.finding.FindingValidator;
import io.vulnscan.analysis.finding.ValidationStatus;
import io.vulnscan.analysis.repo.RepositoryProfile;
import io.vulnscan.analysis.retrieval.RetrievalResult;
import io.vulnscan.analysis.retrieval.Retriever;
import io.vulnscan.analysis.vuln.VulnerabilityMatch;
import io.vulnscan.analysis.vuln.VulnerabilityRetriever;
import io.vulnscan.chunk.ChunkerConfig;
import io.vulnscan.providers.validation.Severity;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.*;
import java.util.stream.Stream;

import static io.vulnscan.analysis.investigate.InvestigationAction.*;

/**
 * Executes investigation actions against one working copy.
 *
 * <p>Every path is resolved against the repository root and rejected if it
 * leaves it. Failures become error observations for the policy to react to.</p>
 */
public class InvestigationToolbox {

    private static final Logger log = LoggerFactory.getLogger(InvestigationToolbox.class);

    static final int DEFAULT_MAX_LINES = 500;
    static final int MAX_LISTED_ENTRIES = 200;
    static final int MAX_LIST_DEPTH = 2;
    static final int MAX_SEARCH_RESULTS = 20;

    private final Path root;
    private final RepositoryProfile profile;
    private final Retriever retriever;
    private final VulnerabilityRetriever vulnerabilities;
    private final FindingValidator validator;
    private final double codeThreshold;
    private final Set<String> confirmed = new HashSet<>();

    /**
     * @param vulnerabilities null disables {@code vulnerability_search}
     * @param validator null disables {@code validate}
     */
    public InvestigationToolbox(Path root, RepositoryProfile profile, Retriever retriever,
                                VulnerabilityRetriever vulnerabilities, FindingValidator validator,
                                double codeThreshold) {
        this.root = root.toAbsolutePath().normalize();
        this.profile = profile;
        this.retriever = retriever;
        this.vulnerabilities = vulnerabilities;
        this.validator = validator;
        this.codeThreshold = codeThreshold;
    }

    public Observation execute(InvestigationAction action, InvestigationState state) {
        try {
            if (action instanceof InspectStructure) {
                return Observation.ok(action, describe(profile));
            }
            if (action instanceof ReadFile read) {
                return readFile(read);
            }
            if (action instanceof ListDirectory list) {
                return listDirectory(list);
            }
            if (action instanceof SemanticSearch search) {
                return semanticSearch(search);
            }
            if (action instanceof VulnerabilitySearch search) {
                return vulnerabilitySearch(search);
            }
            if (action instanceof Validate validate) {
                return validate(validate);
            }
            if (action instanceof RecordFinding record) {
                return recordFinding(record, state);
            }
            return Observation.error(action, "Unsupported action " + action.name());
        } catch (IOException | TransientProviderException | PermanentInputException | IllegalArgumentException e) {
            log.debug("Action {} failed: {}", action.name(), e.getMessage());
            return Observation.error(action, e.getMessage());
        }
    }

    // ==================== Actions ====================

    private Observation readFile(ReadFile read) throws IOException {
        Path file = resolve(read.path());
        if (!Files.isRegularFile(file)) {
            return Observation.error(read, "File does not exist: " + read.path());
        }
        int maxLines = read.maxLines() > 0 ? read.maxLines() : DEFAULT_MAX_LINES;
        List<String> lines = readLines(file);
        boolean truncated = lines.size() > maxLines;
        String content = String.join("\n", lines.subList(0, Math.min(maxLines, lines.size())));
        return Observation.ok(read, content + (truncated ? "\n[truncated after " + maxLines + " lines]" : ""));
    }

    private Observation listDirectory(ListDirectory list) throws IOException {
        Path dir = resolve(list.path() == null || list.path().isBlank() ? "." : list.path());
        if (!Files.isDirectory(dir)) {
            return Observation.error(list, "Not a directory: " + list.path());
        }
        int depth = list.recursive() ? MAX_LIST_DEPTH : 1;
        List<String> entries = new ArrayList<>();
        try (Stream<Path> paths = Files.walk(dir, depth)) {
            paths.filter(p -> !p.equals(dir))
                .filter(p -> !isHidden(dir.relativize(p)))
                .sorted()
                .limit(MAX_LISTED_ENTRIES)
                .forEach(p -> entries.add(relative(p) + (Files.isDirectory(p) ? "/" : "")));
        }
        return Observation.ok(list, String.join("\n", entries));
    }

    private Observation semanticSearch(SemanticSearch search) {
        int topK = Math.max(1, Math.min(search.topK(), MAX_SEARCH_RESULTS));
        StringBuilder out = new StringBuilder();
        for (RetrievalResult result : retriever.search(search.query(), topK, codeThreshold)) {
            out.append(String.format(Locale.ROOT, "%s:%d-%d (%.3f)%n", result.file(), result.startLine(),
                result.endLine(), result.score()));
        }
        return Observation.ok(search, out.length() == 0 ? "No matches" : out.toString().trim());
    }

    private Observation vulnerabilitySearch(VulnerabilitySearch search) {
        if (vulnerabilities == null) {
            return Observation.error(search, "No vulnerability store configured");
        }
        int limit = Math.max(1, Math.min(search.limit(), MAX_SEARCH_RESULTS));
        StringBuilder out = new StringBuilder();
        for (VulnerabilityMatch match : vulnerabilities.search(search.query(), limit * 2, limit, search.expand())) {
            out.append(String.format(Locale.ROOT, "%s (%.3f): %s%n", match.id(), match.relevance(),
                match.record().summary()));
        }
        return Observation.ok(search, out.length() == 0 ? "No matches" : out.toString().trim());
    }

    private Observation validate(Validate validate) throws IOException {
        if (validator == null) {
            return Observation.error(validate, "Validation is not available");
        }
        Finding candidate = draft(validate.vulnerabilityId(), validate.description(), validate.path(),
            validate.startLine(), validate.endLine(), Severity.UNKNOWN, 0.0, null);
        Finding verdict = validator.validate(candidate);
        if (verdict.isConfirmed()) {
            confirmed.add(validate.vulnerabilityId() + "|" + candidate.file());
        }
        return Observation.ok(validate, "VULNERABLE: " + (verdict.isConfirmed() ? "YES" : "NO")
            + "\nSEVERITY: " + verdict.severity() + "\nEXPLANATION: " + verdict.validationExplanation());
    }

    private Observation recordFinding(RecordFinding record, InvestigationState state) throws IOException {
        Finding finding = draft(record.vulnerabilityId(), record.description(), record.path(),
            record.startLine(), record.endLine(), record.severity(), record.confidence(), record.explanation());
        if (confirmed.contains(record.vulnerabilityId() + "|" + finding.file())) {
            finding = finding.withValidation(ValidationStatus.CONFIRMED, finding.severity(),
                finding.validationExplanation());
        }
        state.record(finding);
        log.info("Investigation recorded {} at {}", finding.vulnerabilityId(), finding.location());
        return Observation.ok(record, "Recorded " + finding.vulnerabilityId() + " in " + finding.location());
    }

    // ==================== Helpers ====================

    private Finding draft(String vulnerabilityId, String description, String path, int startLine, int endLine,
                          Severity severity, double confidence, String explanation) throws IOException {
        Path file = resolve(path);
        if (!Files.isRegularFile(file)) {
            throw new IllegalArgumentException("File does not exist: " + path);
        }
        List<String> lines = readLines(file);
        int start = Math.max(1, startLine);
        int end = endLine >= start ? Math.min(endLine, lines.size()) : lines.size();
        String snippet = start <= end ? String.join("\n", lines.subList(start - 1, end)) : "";
        return new Finding(vulnerabilityId, description, relative(file), start, Math.max(start, end), snippet,
            Math.max(0.0, Math.min(1.0, confidence)), severity, null, ValidationStatus.PENDING, explanation,
            FindingSource.INVESTIGATION);
    }

    /**
     * Resolves a repository-relative path, rejecting anything outside the root.
     */
    Path resolve(String path) throws IOException {
        if (path == null) {
            throw new IllegalArgumentException("path is required");
        }
        String relative = path.startsWith("/") ? path.substring(1) : path;
        Path resolved = root.resolve(relative).normalize();
        if (!resolved.startsWith(root)) {
            throw new IllegalArgumentException("Path is outside the repository: " + path);
        }
        if (Files.exists(resolved) && !resolved.toRealPath().startsWith(root.toRealPath())) {
            throw new IllegalArgumentException("Path is outside the repository: " + path);
        }
        return resolved;
    }

    private String relative(Path path) {
        return root.relativize(path).toString().replace('\\', '/');
    }

    private static boolean isHidden(Path relative) {
        for (Path part : relative) {
            String name = part.toString();
            if (name.startsWith(".") || ChunkerConfig.DEFAULT_IGNORED_DIRECTORIES.contains(name)) {
                return true;
            }
        }
        return false;
    }

    private static List<String> readLines(Path file) throws IOException {
        return Arrays.asList(new String(Files.readAllBytes(file), StandardCharsets.UTF_8).split("\r?\n", -1));
    }

    static String describe(RepositoryProfile profile) {
        return "Total files: " + profile.totalFiles()
            + "\nFile types: " + profile.extensionCounts()
            + "\nFrameworks: " + profile.frameworks()
            + "\nRoot manifests: " + profile.rootManifests();
    }
}
