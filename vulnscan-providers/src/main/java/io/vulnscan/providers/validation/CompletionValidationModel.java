package io.vulnscan.providers.validation;

import io.vulnscan.PermanentInputException;
import io.vulnscan.providers.completion.CompletionModel;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.Locale;

/**
 * Validation through a chat-completion model.
 *
 * <p>The model is asked to answer in three labelled lines:</p>
 * <pre>
 * VULNERABLE: YES|NO
 * SEVERITY: CRITICAL|HIGH|MEDIUM|LOW
 * EXPLANATION: free text, may continue on following lines
 * </pre>
 */
public class CompletionValidationModel implements ValidationModel {

    private static final Logger log = LoggerFactory.getLogger(CompletionValidationModel.class);

    private static final int MAX_SNIPPET_CHARS = 4000;

    static final String SYSTEM_PROMPT = """
        You are a security reviewer. Decide whether the code exhibits the described vulnerability.
        Answer in exactly this format:
        VULNERABLE: YES or NO
        SEVERITY: CRITICAL, HIGH, MEDIUM or LOW
        EXPLANATION: one short paragraph""";

    private final CompletionModel completion;

    public CompletionValidationModel(CompletionModel completion) {
        this.completion = completion;
    }

    @Override
    public Verdict validate(String candidateDescription, String codeSnippet) {
        String snippet = codeSnippet.length() > MAX_SNIPPET_CHARS
            ? codeSnippet.substring(0, MAX_SNIPPET_CHARS)
            : codeSnippet;
        String prompt = "Vulnerability:\n" + candidateDescription + "\n\nCode:\n```\n" + snippet + "\n```";
        String reply = completion.complete(SYSTEM_PROMPT, prompt);
        return parse(reply);
    }

    /**
     * Parses the labelled reply format.
     *
     * @throws PermanentInputException if no VULNERABLE line is present
     */
    static Verdict parse(String reply) {
        Boolean vulnerable = null;
        Severity severity = Severity.UNKNOWN;
        StringBuilder explanation = new StringBuilder();
        boolean inExplanation = false;

        for (String raw : reply.split("\r?\n")) {
            String line = raw.trim().replace("**", "");
            String upper = line.toUpperCase(Locale.ROOT);
            if (upper.startsWith("VULNERABLE:")) {
                vulnerable = upper.substring("VULNERABLE:".length()).trim().startsWith("YES");
                inExplanation = false;
            } else if (upper.startsWith("SEVERITY:")) {
                severity = Severity.parse(line.substring("SEVERITY:".length()));
                inExplanation = false;
            } else if (upper.startsWith("EXPLANATION:")) {
                explanation.append(line.substring("EXPLANATION:".length()).trim());
                inExplanation = true;
            } else if (inExplanation && !line.isEmpty()) {
                explanation.append(' ').append(line);
            }
        }

        if (vulnerable == null) {
            log.debug("Unparseable validation reply: {}", reply);
            throw new PermanentInputException(PermanentInputException.Reason.INVALID_INPUT,
                "Validation reply has no VULNERABLE line");
        }
        return new Verdict(vulnerable, severity, explanation.toString());
    }
}
