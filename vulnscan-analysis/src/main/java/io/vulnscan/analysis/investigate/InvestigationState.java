package io.vulnscan.analysis.investigate;

import io.vulnscan.analysis.finding.Finding;
import io.vulnscan.analysis.vuln.VulnerabilityMatch;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

/**
 * What the policy knows when choosing the next action.
 */
public final class InvestigationState {

    private final String repository;
    private final int budget;
    private final List<VulnerabilityMatch> candidates;
    private final List<Finding> existingFindings;
    private final List<Observation> history = new ArrayList<>();
    private final List<Finding> recorded = new ArrayList<>();

    public InvestigationState(String repository, int budget, List<VulnerabilityMatch> candidates,
                              List<Finding> existingFindings) {
        this.repository = repository;
        this.budget = budget;
        this.candidates = List.copyOf(candidates);
        this.existingFindings = List.copyOf(existingFindings);
    }

    public String repository() {
        return repository;
    }

    public int budget() {
        return budget;
    }

    public int stepsTaken() {
        return history.size();
    }

    public int stepsRemaining() {
        return budget - history.size();
    }

    public List<VulnerabilityMatch> candidates() {
        return candidates;
    }

    public List<Finding> existingFindings() {
        return existingFindings;
    }

    public List<Observation> history() {
        return Collections.unmodifiableList(history);
    }

    public List<Finding> recorded() {
        return Collections.unmodifiableList(recorded);
    }

    void observe(Observation observation) {
        history.add(observation);
    }

    void record(Finding finding) {
        recorded.add(finding);
    }
}
