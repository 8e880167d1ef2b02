package io.vulnscan.analysis.investigate;

/**
 * Result of executing one action, fed back to the policy.
 */
public record Observation(String action, boolean success, String content) {

    public static Observation ok(InvestigationAction action, String content) {
        return new Observation(action.name(), true, content);
    }

    public static Observation error(InvestigationAction action, String message) {
        return new Observation(action.name(), false, message);
    }
}
