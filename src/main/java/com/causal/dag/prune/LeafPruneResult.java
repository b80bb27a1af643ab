package com.causal.dag.prune;

import com.causal.dag.graph.CausalGraph;

import java.util.List;

/**
 * Result of iterative leaf pruning.
 *
 * @param graph          the pruned graph.
 * @param iterations     passes that removed at least one node.
 * @param removedPerPass nodes removed by each such pass, ascending.
 */
public record LeafPruneResult(CausalGraph graph, int iterations, List<List<String>> removedPerPass) {

    public LeafPruneResult {
        removedPerPass = removedPerPass.stream().map(List::copyOf).toList();
    }

    public int totalRemoved() {
        int total = 0;
        for (List<String> pass : removedPerPass)
            total += pass.size();
        return total;
    }
}
