package com.causal.dag.bias;

import com.causal.dag.graph.Path;

import java.util.List;

/**
 * A node with two or more parents that lies on an exposure/outcome path but
 * belongs to no minimal adjustment set. Conditioning on it opens the path it
 * sits on as a collider.
 *
 * @param offendingPaths enumerated exposure/outcome paths through the node.
 */
public record MBiasStructure(String node, List<String> parents, List<Path> offendingPaths) {

    public MBiasStructure {
        parents = List.copyOf(parents);
        offendingPaths = List.copyOf(offendingPaths);
    }
}
