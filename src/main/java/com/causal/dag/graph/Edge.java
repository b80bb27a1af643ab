package com.causal.dag.graph;

import java.util.Comparator;
import java.util.Objects;

/** A directed edge {@code from -> to} between two node ids. */
public record Edge(String from, String to) implements Comparable<Edge> {
    private static final Comparator<Edge> ORDER = Comparator.comparing(Edge::from).thenComparing(Edge::to);

    public Edge {
        Objects.requireNonNull(from, "from");
        Objects.requireNonNull(to, "to");
    }

    public static Edge of(String from, String to) {
        return new Edge(from, to);
    }

    public boolean isSelfLoop() {
        return from.equals(to);
    }

    @Override
    public int compareTo(Edge other) {
        return ORDER.compare(this, other);
    }

    @Override
    public String toString() {
        return from + " -> " + to;
    }
}
