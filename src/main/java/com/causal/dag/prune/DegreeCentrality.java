package com.causal.dag.prune;

import java.util.Comparator;

/**
 * Centrality of one node.
 *
 * @param betweenness           directed shortest-path betweenness (Brandes).
 * @param normalizedBetweenness betweenness divided by {@code (n-1)(n-2)}.
 */
public record DegreeCentrality(String node, int inDegree, int outDegree, double betweenness,
        double normalizedBetweenness) {

    /** Total degree descending, then node id. */
    public static final Comparator<DegreeCentrality> BY_DEGREE = Comparator
            .comparingInt(DegreeCentrality::totalDegree).reversed()
            .thenComparing(DegreeCentrality::node);

    /** Betweenness descending, then node id. */
    public static final Comparator<DegreeCentrality> BY_BETWEENNESS = Comparator
            .comparingDouble(DegreeCentrality::betweenness).reversed()
            .thenComparing(DegreeCentrality::node);

    public int totalDegree() {
        return inDegree + outDegree;
    }
}
