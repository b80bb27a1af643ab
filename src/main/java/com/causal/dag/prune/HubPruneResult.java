package com.causal.dag.prune;

import com.causal.dag.graph.CausalGraph;

import java.util.List;

/**
 * Result of generic-hub pruning.
 *
 * @param graph      graph without the pruned hubs.
 * @param pruned     generic nodes removed, ascending.
 * @param notInGraph configured generic names absent from the graph.
 * @param topNodes   the top-N degree table the decision was based on.
 */
public record HubPruneResult(CausalGraph graph, List<String> pruned, List<String> notInGraph,
        List<DegreeCentrality> topNodes) {

    public HubPruneResult {
        pruned = List.copyOf(pruned);
        notInGraph = List.copyOf(notInGraph);
        topNodes = List.copyOf(topNodes);
    }
}
