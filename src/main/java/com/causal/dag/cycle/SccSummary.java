package com.causal.dag.cycle;

import java.util.List;

/**
 * Size profile of the cyclic part of a graph.
 *
 * @param cyclicComponents        components with more than one node.
 * @param nodesInCyclicComponents nodes that lie on at least one cycle.
 * @param largestComponentSize    size of the largest component (1 if acyclic).
 * @param cyclicSizes             sizes of the cyclic components, descending.
 */
public record SccSummary(int cyclicComponents, int nodesInCyclicComponents, int largestComponentSize,
        List<Integer> cyclicSizes) {

    public SccSummary {
        cyclicSizes = List.copyOf(cyclicSizes);
    }

    public boolean isAcyclic() {
        return cyclicComponents == 0;
    }
}
