package io.vulnscan.analysis.repo;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonProperty;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Structural summary of a repository: file counts per extension, detected
 * build systems, and the manifest files found at the root.
 */
@JsonIgnoreProperties(ignoreUnknown = true)
public record RepositoryProfile(
    @JsonProperty("total_files") int totalFiles,
    @JsonProperty("languages") Map<String, Integer> extensionCounts,
    @JsonProperty("frameworks_detected") List<String> frameworks,
    @JsonProperty("root_manifests") List<String> rootManifests
) {
    static final String GENERIC_QUERY = "Common web application security vulnerabilities including "
        + "injection attacks authentication issues and data exposure";

    private static final Map<String, String> QUERY_BY_MANIFEST = new LinkedHashMap<>();

    static {
        QUERY_BY_MANIFEST.put("package.json", "JavaScript Node.js web application vulnerabilities");
        QUERY_BY_MANIFEST.put("requirements.txt", "Python application security vulnerabilities");
        QUERY_BY_MANIFEST.put("pom.xml", "Java application security vulnerabilities");
        QUERY_BY_MANIFEST.put("build.gradle", "Java application security vulnerabilities");
        QUERY_BY_MANIFEST.put("go.mod", "Go application security vulnerabilities");
        QUERY_BY_MANIFEST.put("Gemfile", "Ruby application security vulnerabilities");
        QUERY_BY_MANIFEST.put("Cargo.toml", "Rust application security vulnerabilities");
    }

    public RepositoryProfile {
        extensionCounts = extensionCounts != null ? Map.copyOf(extensionCounts) : Map.of();
        frameworks = frameworks != null ? List.copyOf(frameworks) : List.of();
        rootManifests = rootManifests != null ? List.copyOf(rootManifests) : List.of();
    }

    /**
     * Builds the first vulnerability-store query from the root manifests.
     */
    public String initialQuery() {
        List<String> parts = new ArrayList<>();
        for (Map.Entry<String, String> entry : QUERY_BY_MANIFEST.entrySet()) {
            if (rootManifests.contains(entry.getKey()) && !parts.contains(entry.getValue())) {
                parts.add(entry.getValue());
            }
        }
        return parts.isEmpty() ? GENERIC_QUERY : String.join(" ", parts);
    }
}
