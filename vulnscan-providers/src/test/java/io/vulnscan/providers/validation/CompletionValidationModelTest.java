package io.vulnscan.providers.validation;

import io.vulnscan.PermanentInputException;
import io.vulnscan.providers.completion.CompletionModel;
import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.*;

class CompletionValidationModelTest {

    @Test
    void testParsesVulnerableReply() {
        Verdict verdict = CompletionValidationModel.parse("""
            VULNERABLE: YES
            SEVERITY: HIGH
            EXPLANATION: User input reaches the query
            without parameterization.""");

        assertTrue(verdict.vulnerable());
        assertEquals(Severity.HIGH, verdict.severity());
        assertEquals("User input reaches the query without parameterization.", verdict.rationale());
    }

    @Test
    void testParsesMarkdownDecoratedReply() {
        Verdict verdict = CompletionValidationModel.parse("**VULNERABLE:** no\n**SEVERITY:** low\n");

        assertFalse(verdict.vulnerable());
        assertEquals(Severity.LOW, verdict.severity());
    }

    @Test
    void testUnknownSeverity() {
        Verdict verdict = CompletionValidationModel.parse("VULNERABLE: YES\nSEVERITY: catastrophic");
        assertEquals(Severity.UNKNOWN, verdict.severity());
    }

    @Test
    void testUnparseableReplyIsRejected() {
        PermanentInputException e = assertThrows(PermanentInputException.class,
            () -> CompletionValidationModel.parse("I think it might be fine."));
        assertEquals(PermanentInputException.Reason.INVALID_INPUT, e.getReason());
    }

    @Test
    void testPromptCarriesDescriptionAndCode() {
        StringBuilder seen = new StringBuilder();
        CompletionModel completion = new CompletionModel() {
            @Override
            public String complete(String systemPrompt, String userPrompt) {
                seen.append(userPrompt);
                return "VULNERABLE: NO\nSEVERITY: LOW\nEXPLANATION: safe";
            }

            @Override
            public String getModelId() {
                return "fake";
            }
        };

        Verdict verdict = new CompletionValidationModel(completion)
            .validate("CVE-2021-44228: JNDI lookup", "logger.info(userInput);");

        assertFalse(verdict.vulnerable());
        assertTrue(seen.toString().contains("JNDI lookup"));
        assertTrue(seen.toString().contains("logger.info(userInput);"));
    }

    @Test
    void testSeverityFromCvss() {
        assertEquals(Severity.CRITICAL, Severity.fromCvss(9.8));
        assertEquals(Severity.HIGH, Severity.fromCvss(7.5));
        assertEquals(Severity.MEDIUM, Severity.fromCvss(5.0));
        assertEquals(Severity.LOW, Severity.fromCvss(2.1));
        assertEquals(Severity.UNKNOWN, Severity.fromCvss(null));
    }
}
