package com.causal.dag.bias;

import com.causal.dag.graph.AdjustmentSet;

import java.util.ArrayList;
import java.util.List;
import java.util.Set;
import java.util.TreeSet;

/**
 * A confounder with at least two confounder parents. Adjusting for it opens
 * the collider path between its parents, so a valid set either adjusts for
 * all parents, or for the node itself plus a non-empty proper subset of them.
 *
 * @param node              the butterfly node.
 * @param confounderParents its parents that are themselves confounders,
 *                          ascending.
 */
public record ButterflyStructure(String node, List<String> confounderParents) {

    public ButterflyStructure {
        confounderParents = List.copyOf(new TreeSet<>(confounderParents));
        if (confounderParents.size() < 2)
            throw new IllegalArgumentException("A butterfly node needs at least two confounder parents: " + node);
    }

    /** {@code 1 + (2^k - 2)} for k parents, saturating at Long.MAX_VALUE. */
    public long optionCount() {
        int k = confounderParents.size();
        if (k >= Long.SIZE - 1)
            return Long.MAX_VALUE;
        return (1L << k) - 1;
    }

    /**
     * The local options in (size, lexicographic) order: all parents, or the
     * node together with each non-empty proper subset of its parents.
     */
    public List<AdjustmentSet> localOptions() {
        int k = confounderParents.size();
        if (k >= Integer.SIZE - 1)
            throw new IllegalStateException("Too many confounder parents to enumerate: " + k);
        List<AdjustmentSet> out = new ArrayList<>();
        out.add(AdjustmentSet.of(confounderParents));
        for (int mask = 1; mask < (1 << k) - 1; mask++) {
            Set<String> members = new TreeSet<>();
            members.add(node);
            for (int i = 0; i < k; i++)
                if ((mask & (1 << i)) != 0)
                    members.add(confounderParents.get(i));
            out.add(AdjustmentSet.of(members));
        }
        out.sort(null);
        return out;
    }
}
