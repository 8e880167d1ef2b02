package io.vulnscan.analysis.finding;

import io.vulnscan.PermanentInputException;
import io.vulnscan.ProgressCallback;
import io.vulnscan.TransientProviderException;
import io.vulnscan.analysis.run.CancellationToken;
import io.vulnscan.providers.validation.Severity;
import io.vulnscan.providers.validation.ValidationModel;
import io.vulnscan.providers.validation.Verdict;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.List;

/**
 * Sends findings to a {@link ValidationModel}.
 *
 * <p>A finding whose validation fails is kept as {@link ValidationStatus#NEEDS_REVIEW};
 * if every validation fails the last error is rethrown.</p>
 */
public class FindingValidator {

    private static final Logger log = LoggerFactory.getLogger(FindingValidator.class);

    private final ValidationModel model;

    public FindingValidator(ValidationModel model) {
        this.model = model;
    }

    public Finding validate(Finding finding) {
        String description = finding.vulnerabilityId() + ": " + finding.description();
        Verdict verdict = model.validate(description, finding.snippet());
        Severity severity = verdict.severity() != Severity.UNKNOWN ? verdict.severity() : finding.severity();
        return finding.withValidation(
            verdict.vulnerable() ? ValidationStatus.CONFIRMED : ValidationStatus.FALSE_POSITIVE,
            severity, verdict.rationale());
    }

    public List<Finding> validateAll(List<Finding> findings, ProgressCallback progress, CancellationToken cancellation) {
        List<Finding> validated = new ArrayList<>(findings.size());
        int failed = 0;
        RuntimeException lastFailure = null;

        for (int i = 0; i < findings.size(); i++) {
            cancellation.throwIfCancelled();
            Finding finding = findings.get(i);
            try {
                validated.add(validate(finding));
            } catch (TransientProviderException | PermanentInputException e) {
                failed++;
                lastFailure = e;
                log.warn("Validation of {} at {} failed: {}", finding.vulnerabilityId(), finding.location(), e.getMessage());
                validated.add(finding.withValidation(ValidationStatus.NEEDS_REVIEW, finding.severity(), e.getMessage()));
            }
            progress.onProgress(i + 1, findings.size());
        }

        if (!findings.isEmpty() && failed == findings.size()) {
            throw lastFailure;
        }
        long confirmed = validated.stream().filter(Finding::isConfirmed).count();
        log.info("Validated {} findings: {} confirmed, {} need review", findings.size(), confirmed, failed);
        return validated;
    }
}
