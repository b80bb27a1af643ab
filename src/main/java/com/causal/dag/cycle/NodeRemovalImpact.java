package com.causal.dag.cycle;

import java.util.List;

/**
 * Effect on the cycle count of removing single nodes, one at a time.
 *
 * @param baselineCycles cycles in the unmodified graph.
 * @param baseline       component profile of the unmodified graph.
 * @param entries        one entry per candidate present in the graph, in the
 *                       order given.
 * @param notInGraph     candidates absent from the graph.
 * @param protectedNodes candidates skipped because they are exposure or
 *                       outcome.
 * @param completed      false if any enumeration stopped early.
 */
public record NodeRemovalImpact(long baselineCycles, SccSummary baseline, List<Entry> entries,
        List<String> notInGraph, List<String> protectedNodes, boolean completed) {

    public record Entry(String node, long cyclesAfter, double reductionPercent, SccSummary after) {
    }

    public NodeRemovalImpact {
        entries = List.copyOf(entries);
        notInGraph = List.copyOf(notInGraph);
        protectedNodes = List.copyOf(protectedNodes);
    }
}
