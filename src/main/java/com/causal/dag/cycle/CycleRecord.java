package com.causal.dag.cycle;

import java.util.List;

/**
 * One elementary cycle. {@code nodes} lists the cycle once, starting at its
 * smallest node; the closing edge runs from the last node back to the first.
 */
public record CycleRecord(int sccId, List<String> nodes) {

    public CycleRecord {
        nodes = List.copyOf(nodes);
    }

    public int length() {
        return nodes.size();
    }

    @Override
    public String toString() {
        return String.join(" -> ", nodes) + " -> " + nodes.get(0);
    }
}
