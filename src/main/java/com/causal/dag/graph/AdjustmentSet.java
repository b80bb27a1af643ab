package com.causal.dag.graph;

import com.fasterxml.jackson.annotation.JsonValue;

import java.util.Collection;
import java.util.List;
import java.util.TreeSet;

/**
 * A set of node ids proposed for conditioning, held in ascending order.
 * Ordered by size first, then lexicographically over the sorted members.
 */
public record AdjustmentSet(List<String> members) implements Comparable<AdjustmentSet> {
    public static final AdjustmentSet EMPTY = new AdjustmentSet(List.of());

    public AdjustmentSet {
        members = List.copyOf(new TreeSet<>(members));
    }

    public static AdjustmentSet of(String... members) {
        return new AdjustmentSet(List.of(members));
    }

    public static AdjustmentSet of(Collection<String> members) {
        return new AdjustmentSet(List.copyOf(members));
    }

    public int size() {
        return members.size();
    }

    public boolean isEmpty() {
        return members.isEmpty();
    }

    public boolean contains(String node) {
        return members.contains(node);
    }

    public boolean containsAll(AdjustmentSet other) {
        return members.containsAll(other.members);
    }

    @Override
    public int compareTo(AdjustmentSet other) {
        int c = Integer.compare(members.size(), other.members.size());
        for (int i = 0; c == 0 && i < members.size(); i++)
            c = members.get(i).compareTo(other.members.get(i));
        return c;
    }

    @JsonValue
    public List<String> toJson() {
        return members;
    }

    @Override
    public String toString() {
        return "{" + String.join(", ", members) + "}";
    }
}
