package com.causal.dag.cycle;

/**
 * Whole-graph statistics and exposure/outcome connectivity.
 *
 * @param density                 {@code edges / (nodes * (nodes - 1))}.
 * @param components              number of strongly connected components.
 * @param exposureOutcomeDistance shortest directed path length from exposure
 *                                to outcome, -1 if there is none.
 */
public record GraphStatistics(
        int nodes,
        int edges,
        double density,
        boolean weaklyConnected,
        boolean stronglyConnected,
        boolean acyclic,
        int components,
        boolean exposureReachesOutcome,
        boolean outcomeReachesExposure,
        int exposureOutcomeDistance) {
}
