package io.vulnscan.analysis.investigate;

import io.vulnscan.PermanentInputException;
import io.vulnscan.TransientProviderException;
import io.vulnscan.analysis.finding.Finding;
import io.vulnscan.analysis.run.CancellationToken;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.List;

/**
 * Interpreter loop for the bounded investigation.
 *
 * <p>Each step asks the policy for one action and executes it with the
 * toolbox. The loop ends when the policy finishes, when a finding has been
 * recorded, or when the step budget is used up. A policy provider failure
 * ends the loop early and keeps what was recorded.</p>
 */
public class Investigator {

    private static final Logger log = LoggerFactory.getLogger(Investigator.class);

    /**
     * Why and with what the loop ended.
     */
    public record Outcome(List<Finding> findings, int steps, String reason) {
    }

    private final InvestigationPolicy policy;
    private final InvestigationToolbox toolbox;

    public Investigator(InvestigationPolicy policy, InvestigationToolbox toolbox) {
        this.policy = policy;
        this.toolbox = toolbox;
    }

    public Outcome investigate(InvestigationState state, StepListener listener, CancellationToken cancellation) {
        String reason = "step budget exhausted";
        while (state.stepsRemaining() > 0) {
            cancellation.throwIfCancelled();

            InvestigationAction action;
            try {
                action = policy.next(state);
            } catch (TransientProviderException | PermanentInputException e) {
                log.warn("Investigation policy failed after {} steps: {}", state.stepsTaken(), e.getMessage());
                reason = "policy failed: " + e.getMessage();
                break;
            }
            if (action instanceof InvestigationAction.Finish finish) {
                reason = finish.reason();
                break;
            }

            Observation observation = toolbox.execute(action, state);
            state.observe(observation);
            log.debug("Investigation step {}: {} ({})", state.stepsTaken(), action.name(),
                observation.success() ? "ok" : "failed");
            listener.onStep(state.stepsTaken(), state.budget());

            if (action instanceof InvestigationAction.RecordFinding && observation.success()) {
                reason = "finding recorded";
                break;
            }
        }
        log.info("Investigation ended after {} steps: {}", state.stepsTaken(), reason);
        return new Outcome(List.copyOf(state.recorded()), state.stepsTaken(), reason);
    }

    /**
     * Receives (steps taken, budget) after each executed step.
     */
    @FunctionalInterface
    public interface StepListener {
        void onStep(int steps, int budget);
    }
}
