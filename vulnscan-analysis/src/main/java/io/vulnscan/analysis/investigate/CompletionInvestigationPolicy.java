package io.vulnscan.analysis.investigate;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import io.vulnscan.analysis.finding.Finding;
import io.vulnscan.analysis.vuln.VulnerabilityMatch;
import io.vulnscan.providers.completion.CompletionModel;
import io.vulnscan.providers.validation.Severity;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import static io.vulnscan.analysis.investigate.InvestigationAction.*;

/**
 * Policy that asks a completion model for the next action as one JSON object,
 * e.g. {@code {"action": "read_file", "path": "src/App.java"}}.
 *
 * <p>A reply that is not a recognizable action ends the investigation.</p>
 */
public class CompletionInvestigationPolicy implements InvestigationPolicy {

    private static final Logger log = LoggerFactory.getLogger(CompletionInvestigationPolicy.class);

    private static final int MAX_OBSERVATION_CHARS = 1500;
    private static final int MAX_HISTORY = 8;

    static final String SYSTEM_PROMPT = """
        You are a security analyst investigating a source repository for known vulnerabilities.
        Reply with exactly one JSON object choosing the next action:
        {"action":"inspect_structure"}
        {"action":"read_file","path":"...","max_lines":200}
        {"action":"list_directory","path":"...","recursive":false}
        {"action":"semantic_search","query":"...","top_k":5}
        {"action":"vulnerability_search","query":"...","limit":5,"expand":false}
        {"action":"validate","vulnerability_id":"...","description":"...","path":"...","start_line":1,"end_line":40}
        {"action":"record_finding","vulnerability_id":"...","description":"...","path":"...","start_line":1,
         "end_line":40,"severity":"HIGH","confidence":0.8,"explanation":"..."}
        {"action":"finish","reason":"..."}
        Paths are relative to the repository root. Record a finding only after validating it.""";

    private final CompletionModel completion;
    private final ObjectMapper mapper;

    public CompletionInvestigationPolicy(CompletionModel completion) {
        this(completion, new ObjectMapper());
    }

    public CompletionInvestigationPolicy(CompletionModel completion, ObjectMapper mapper) {
        this.completion = completion;
        this.mapper = mapper;
    }

    @Override
    public InvestigationAction next(InvestigationState state) {
        String reply = completion.complete(SYSTEM_PROMPT, prompt(state));
        return parse(reply);
    }

    String prompt(InvestigationState state) {
        StringBuilder prompt = new StringBuilder();
        prompt.append("Repository: ").append(state.repository()).append('\n');
        prompt.append("Steps remaining: ").append(state.stepsRemaining()).append("\n\n");
        if (!state.candidates().isEmpty()) {
            prompt.append("Candidate vulnerabilities:\n");
            for (VulnerabilityMatch candidate : state.candidates()) {
                prompt.append("- ").append(candidate.record().document()).append('\n');
            }
            prompt.append('\n');
        }
        if (!state.existingFindings().isEmpty()) {
            prompt.append("Findings so far:\n");
            for (Finding finding : state.existingFindings()) {
                prompt.append("- ").append(finding.vulnerabilityId()).append(" at ").append(finding.location())
                    .append(" (").append(finding.validationStatus()).append(")\n");
            }
            prompt.append('\n');
        }
        int from = Math.max(0, state.history().size() - MAX_HISTORY);
        for (Observation observation : state.history().subList(from, state.history().size())) {
            String content = observation.content();
            if (content.length() > MAX_OBSERVATION_CHARS) {
                content = content.substring(0, MAX_OBSERVATION_CHARS) + "...";
            }
            prompt.append("[").append(observation.action()).append(observation.success() ? "" : " failed")
                .append("]\n").append(content).append("\n\n");
        }
        prompt.append("Next action:");
        return prompt.toString();
    }

    InvestigationAction parse(String reply) {
        int start = reply.indexOf('{');
        int end = reply.lastIndexOf('}');
        if (start < 0 || end < start) {
            log.warn("Policy reply has no JSON object, finishing");
            return new Finish("unparseable policy reply");
        }
        JsonNode node;
        try {
            node = mapper.readTree(reply.substring(start, end + 1));
        } catch (JsonProcessingException e) {
            log.warn("Policy reply is not valid JSON, finishing: {}", e.getOriginalMessage());
            return new Finish("unparseable policy reply");
        }

        String action = node.path("action").asText("");
        return switch (action) {
            case "inspect_structure" -> new InspectStructure();
            case "read_file" -> new ReadFile(node.path("path").asText(null), node.path("max_lines").asInt(0));
            case "list_directory" -> new ListDirectory(node.path("path").asText("."), node.path("recursive").asBoolean(false));
            case "semantic_search" -> new SemanticSearch(node.path("query").asText(""), node.path("top_k").asInt(5));
            case "vulnerability_search" -> new VulnerabilitySearch(node.path("query").asText(""),
                node.path("limit").asInt(5), node.path("expand").asBoolean(false));
            case "validate" -> new Validate(node.path("vulnerability_id").asText(""),
                node.path("description").asText(""), node.path("path").asText(null),
                node.path("start_line").asInt(1), node.path("end_line").asInt(0));
            case "record_finding" -> new RecordFinding(node.path("vulnerability_id").asText(""),
                node.path("description").asText(""), node.path("path").asText(null),
                node.path("start_line").asInt(1), node.path("end_line").asInt(0),
                Severity.parse(node.path("severity").asText(null)), node.path("confidence").asDouble(0.5),
                node.path("explanation").asText(""));
            case "finish" -> new Finish(node.path("reason").asText("done"));
            default -> {
                log.warn("Unknown policy action '{}', finishing", action);
                yield new Finish("unknown action " + action);
            }
        };
    }
}
