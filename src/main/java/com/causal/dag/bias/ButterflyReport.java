package com.causal.dag.bias;

import com.causal.dag.api.StopReason;
import com.causal.dag.graph.AdjustmentSet;

import java.util.List;

/**
 * @param structures              butterfly nodes with their confounder
 *                                parents, by node id.
 * @param nonButterflyConfounders confounders that are neither butterfly nodes
 *                                nor their confounder parents; part of every
 *                                valid set.
 * @param validSets               deduplicated adjustment sets, in enumeration
 *                                order.
 * @param completed               false if the enumeration stopped early.
 */
public record ButterflyReport(List<ButterflyStructure> structures, List<String> nonButterflyConfounders,
        List<AdjustmentSet> validSets, boolean completed, StopReason stopReason) {

    public ButterflyReport {
        structures = List.copyOf(structures);
        nonButterflyConfounders = List.copyOf(nonButterflyConfounders);
        validSets = List.copyOf(validSets);
    }

    public boolean hasButterflyBias() {
        return !structures.isEmpty();
    }
}
