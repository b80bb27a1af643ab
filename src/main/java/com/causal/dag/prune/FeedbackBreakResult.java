package com.causal.dag.prune;

import com.causal.dag.graph.CausalGraph;
import com.causal.dag.graph.Edge;

import java.util.List;

/**
 * @param graph      graph without the feedback edges.
 * @param removed    edges deleted, in the order they were found.
 * @param notInGraph configured names absent from the graph.
 */
public record FeedbackBreakResult(CausalGraph graph, List<Edge> removed, List<String> notInGraph) {

    public FeedbackBreakResult {
        removed = List.copyOf(removed);
        notInGraph = List.copyOf(notInGraph);
    }
}
