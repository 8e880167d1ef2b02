package io.vulnscan.analysis.investigate;

import io.vulnscan.providers.validation.Severity;

/**
 * The next step chosen by an {@link InvestigationPolicy}. One record per capability.
 */
public interface InvestigationAction {

    /**
     * Wire name used by policies, e.g. {@code read_file}.
     */
    String name();

    record InspectStructure() implements InvestigationAction {
        public String name() {
            return "inspect_structure";
        }
    }

    record ReadFile(String path, int maxLines) implements InvestigationAction {
        public String name() {
            return "read_file";
        }
    }

    record ListDirectory(String path, boolean recursive) implements InvestigationAction {
        public String name() {
            return "list_directory";
        }
    }

    record SemanticSearch(String query, int topK) implements InvestigationAction {
        public String name() {
            return "semantic_search";
        }
    }

    record VulnerabilitySearch(String query, int limit, boolean expand) implements InvestigationAction {
        public String name() {
            return "vulnerability_search";
        }
    }

    record Validate(String vulnerabilityId, String description, String path, int startLine, int endLine)
            implements InvestigationAction {
        public String name() {
            return "validate";
        }
    }

    record RecordFinding(String vulnerabilityId, String description, String path, int startLine, int endLine,
                         Severity severity, double confidence, String explanation) implements InvestigationAction {
        public String name() {
            return "record_finding";
        }
    }

    record Finish(String reason) implements InvestigationAction {
        public String name() {
            return "finish";
        }
    }
}
