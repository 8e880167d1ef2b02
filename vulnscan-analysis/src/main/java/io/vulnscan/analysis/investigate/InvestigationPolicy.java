package io.vulnscan.analysis.investigate;

/**
 * Chooses the next investigation action from the current state.
 */
@FunctionalInterface
public interface InvestigationPolicy {

    InvestigationAction next(InvestigationState state);
}
