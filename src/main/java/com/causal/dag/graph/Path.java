package com.causal.dag.graph;

import java.util.List;

/**
 * A simple walk between two nodes with the orientation of each step.
 * {@code steps.get(i)} describes the edge between {@code nodes.get(i)} and
 * {@code nodes.get(i + 1)}.
 */
public record Path(List<String> nodes, List<Step> steps) {

    /** Orientation of one step relative to the walking direction. */
    public enum Step {
        /** {@code a -> b} */
        FORWARD,
        /** {@code a <- b} */
        BACKWARD
    }

    public Path {
        nodes = List.copyOf(nodes);
        steps = List.copyOf(steps);
        if (nodes.size() < 2 || steps.size() != nodes.size() - 1)
            throw new IllegalArgumentException("Path needs n >= 2 nodes and n - 1 steps: " + nodes + " " + steps);
    }

    public String start() {
        return nodes.get(0);
    }

    public String end() {
        return nodes.get(nodes.size() - 1);
    }

    /** Number of edges. */
    public int length() {
        return steps.size();
    }

    public boolean contains(String node) {
        return nodes.contains(node);
    }

    /** True if the interior node at {@code i} has both path edges pointing into it. */
    public boolean isColliderAt(int i) {
        if (i <= 0 || i >= nodes.size() - 1)
            return false;
        return steps.get(i - 1) == Step.FORWARD && steps.get(i) == Step.BACKWARD;
    }

    /** True if the first edge points into the start node. */
    public boolean isBackdoor() {
        return steps.get(0) == Step.BACKWARD;
    }

    public boolean isDirected() {
        for (Step s : steps)
            if (s != Step.FORWARD)
                return false;
        return true;
    }

    @Override
    public String toString() {
        StringBuilder sb = new StringBuilder(nodes.get(0));
        for (int i = 0; i < steps.size(); i++)
            sb.append(steps.get(i) == Step.FORWARD ? " -> " : " <- ").append(nodes.get(i + 1));
        return sb.toString();
    }
}
