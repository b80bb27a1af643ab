package com.causal.dag.cycle;

import java.util.List;

/**
 * One strongly connected component.
 *
 * @param id      position in the component list, ordered by smallest member.
 * @param members member ids, ascending.
 */
public record StronglyConnectedComponent(int id, List<String> members) {

    public StronglyConnectedComponent {
        members = List.copyOf(members);
    }

    public int size() {
        return members.size();
    }

    /** A component with more than one node contains at least one cycle. */
    public boolean isCyclic() {
        return members.size() > 1;
    }
}
