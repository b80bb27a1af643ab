package com.causal.dag.confounder;

import java.util.List;

/**
 * @param candidates common parents, by minimum cycle length then id.
 */
public record ConfounderReport(String exposure, String outcome, List<ConfounderCandidate> candidates) {

    public ConfounderReport {
        candidates = List.copyOf(candidates);
    }

    /** Candidates without a feedback loop, in report order. */
    public List<String> validForAdjustment() {
        return candidates.stream().filter(ConfounderCandidate::validForAdjustment)
                .map(ConfounderCandidate::node).toList();
    }

    public List<ConfounderCandidate> withClass(FeedbackClass c) {
        return candidates.stream().filter(x -> x.classification() == c).toList();
    }
}
