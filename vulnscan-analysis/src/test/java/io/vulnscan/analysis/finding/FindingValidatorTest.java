package io.vulnscan.analysis.finding;

import io.vulnscan.PermanentInputException;
import io.vulnscan.TransientProviderException;
import io.vulnscan.analysis.run.CancellationToken;
import io.vulnscan.providers.validation.Severity;
import io.vulnscan.providers.validation.ValidationModel;
import io.vulnscan.providers.validation.Verdict;
import org.junit.jupiter.api.Test;

import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.CancellationException;

import static org.junit.jupiter.api.Assertions.*;

class FindingValidatorTest {

    @Test
    void testVerdictsBecomeStatuses() {
        ValidationModel model = (description, snippet) -> snippet.contains("input")
            ? new Verdict(true, Severity.HIGH, "concatenates user input")
            : new Verdict(false, Severity.UNKNOWN, "constant query");

        List<Finding> validated = new FindingValidator(model).validateAll(
            List.of(finding("CVE-1", "stmt.execute(sql + input)"), finding("CVE-2", "stmt.execute(\"SELECT 1\")")),
            (c, t) -> { }, CancellationToken.NONE);

        assertEquals(ValidationStatus.CONFIRMED, validated.get(0).validationStatus());
        assertEquals(Severity.HIGH, validated.get(0).severity());
        assertEquals("concatenates user input", validated.get(0).validationExplanation());
        assertEquals(ValidationStatus.FALSE_POSITIVE, validated.get(1).validationStatus());
        assertEquals(Severity.MEDIUM, validated.get(1).severity());
    }

    @Test
    void testPromptIncludesIdAndDescription() {
        List<String> descriptions = new ArrayList<>();
        ValidationModel model = (description, snippet) -> {
            descriptions.add(description);
            return new Verdict(false, Severity.UNKNOWN, "");
        };

        new FindingValidator(model).validate(finding("CVE-7", "code"));

        assertEquals(List.of("CVE-7: description of CVE-7"), descriptions);
    }

    @Test
    void testFailedItemNeedsReview() {
        ValidationModel model = (description, snippet) -> {
            if (description.startsWith("CVE-1")) {
                throw new TransientProviderException(TransientProviderException.Reason.TIMEOUT, "timed out");
            }
            return new Verdict(true, Severity.LOW, "ok");
        };

        List<Finding> validated = new FindingValidator(model).validateAll(
            List.of(finding("CVE-1", "a"), finding("CVE-2", "b")), (c, t) -> { }, CancellationToken.NONE);

        assertEquals(ValidationStatus.NEEDS_REVIEW, validated.get(0).validationStatus());
        assertEquals("timed out", validated.get(0).validationExplanation());
        assertEquals(ValidationStatus.CONFIRMED, validated.get(1).validationStatus());
    }

    @Test
    void testEveryItemFailingRethrows() {
        ValidationModel model = (description, snippet) -> {
            throw new PermanentInputException(PermanentInputException.Reason.AUTH_REQUIRED, "bad key");
        };

        assertThrows(PermanentInputException.class, () -> new FindingValidator(model).validateAll(
            List.of(finding("CVE-1", "a")), (c, t) -> { }, CancellationToken.NONE));
    }

    @Test
    void testCancellationStopsLoop() {
        CancellationToken token = new CancellationToken();
        ValidationModel model = (description, snippet) -> {
            token.cancel();
            return new Verdict(true, Severity.LOW, "");
        };

        assertThrows(CancellationException.class, () -> new FindingValidator(model).validateAll(
            List.of(finding("CVE-1", "a"), finding("CVE-2", "b")), (c, t) -> { }, token));
    }

    static Finding finding(String id, String snippet) {
        return new Finding(id, "description of " + id, "src/A.java", 1, 10, snippet, 0.5, Severity.MEDIUM, 5.0,
            ValidationStatus.PENDING, null, FindingSource.PIPELINE);
    }
}
