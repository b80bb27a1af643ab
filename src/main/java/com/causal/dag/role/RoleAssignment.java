package com.causal.dag.role;

import com.causal.dag.api.StopReason;

import java.util.*;

/**
 * Role of every node other than exposure and outcome, with the intermediate
 * sets the labels were derived from. All sets are sorted.
 *
 * @param completed false if the adjustment-set search behind
 *                  {@code confounders} stopped early.
 */
public record RoleAssignment(
        String exposure,
        String outcome,
        SortedMap<String, CausalRole> roles,
        SortedSet<String> rawMediators,
        SortedSet<String> rawColliders,
        SortedSet<String> rawConfounders,
        SortedSet<String> instrumentalVariables,
        SortedSet<String> precisionVariables,
        SortedSet<String> confounders,
        SortedSet<String> pureMediators,
        SortedSet<String> pureColliders,
        boolean completed,
        StopReason stopReason) {

    public RoleAssignment {
        roles = Collections.unmodifiableSortedMap(new TreeMap<>(roles));
        rawMediators = freeze(rawMediators);
        rawColliders = freeze(rawColliders);
        rawConfounders = freeze(rawConfounders);
        instrumentalVariables = freeze(instrumentalVariables);
        precisionVariables = freeze(precisionVariables);
        confounders = freeze(confounders);
        pureMediators = freeze(pureMediators);
        pureColliders = freeze(pureColliders);
    }

    private static SortedSet<String> freeze(Set<String> s) {
        return Collections.unmodifiableSortedSet(new TreeSet<>(s));
    }

    public CausalRole roleOf(String node) {
        CausalRole r = roles.get(node);
        if (r == null)
            throw new IllegalArgumentException("No role for node: " + node);
        return r;
    }

    /** Nodes labelled {@code role}, ascending. */
    public SortedSet<String> nodesWith(CausalRole role) {
        TreeSet<String> out = new TreeSet<>();
        roles.forEach((n, r) -> {
            if (r == role)
                out.add(n);
        });
        return Collections.unmodifiableSortedSet(out);
    }

    /** Number of nodes per role, in enum order, roles without nodes omitted. */
    public Map<CausalRole, Integer> counts() {
        Map<CausalRole, Integer> out = new EnumMap<>(CausalRole.class);
        for (CausalRole r : roles.values())
            out.merge(r, 1, Integer::sum);
        return out;
    }
}
