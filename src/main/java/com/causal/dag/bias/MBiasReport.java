package com.causal.dag.bias;

import com.causal.dag.api.StopReason;
import com.causal.dag.graph.AdjustmentSet;

import java.util.List;

/**
 * @param structures          M-bias nodes, by id.
 * @param minimalSets         minimal backdoor adjustment sets.
 * @param chosenAdjustmentSet smallest minimal set, empty if there is none.
 * @param pathLengthCapped    true if some exposure/outcome path exceeds
 *                            {@code maxPathLength} and was not examined; a
 *                            node lying only on such paths is not reported.
 * @param completed           false if the set search or the path
 *                            enumeration stopped early, or paths were
 *                            skipped for length.
 */
public record MBiasReport(List<MBiasStructure> structures, List<AdjustmentSet> minimalSets,
        AdjustmentSet chosenAdjustmentSet, PathVerification verification, boolean pathLengthCapped,
        boolean completed,
        StopReason stopReason) {

    public MBiasReport {
        structures = List.copyOf(structures);
        minimalSets = List.copyOf(minimalSets);
    }

    public boolean hasMBias() {
        return !structures.isEmpty();
    }
}
