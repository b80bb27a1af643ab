package com.causal.dag.role;

import com.causal.dag.api.MissingExposureOutcomeException;
import com.causal.dag.api.StopReason;
import com.causal.dag.engine.SearchBudget;
import com.causal.dag.engine.SearchLimits;
import com.causal.dag.graph.AdjustmentSearchResult;
import com.causal.dag.graph.AdjustmentSet;
import com.causal.dag.graph.AdjustmentSetSearch;
import com.causal.dag.graph.CausalGraph;

import java.util.*;

import lombok.extern.log4j.Log4j2;

/**
 * Labels every node with its causal role relative to an exposure/outcome
 * pair.
 *
 * Derivation:
 * 1. Closures: ancestors and descendants of exposure and outcome.
 * 2. Raw sets: mediators lie between exposure and outcome, colliders below
 * both, raw confounders above both.
 * 3. Instrumental variables: ancestors of the exposure connected to the
 * outcome only through the exposure (structural test on the skeleton).
 * 4. Confounders: raw confounders that are not instruments and that appear in
 * some valid backdoor adjustment set.
 * 5. Labels: combined and pure confounder/mediator/collider categories, then
 * instruments, then precision variables; everything else is unclassified.
 */
@Log4j2
public final class RoleClassifier {
    private final SearchLimits limits;
    private final SearchBudget budget;

    public RoleClassifier(SearchLimits limits, SearchBudget budget) {
        this.limits = limits;
        this.budget = budget;
    }

    /** Classifies relative to the graph's own exposure and outcome. */
    public RoleAssignment classify(CausalGraph graph) {
        return classify(graph, graph.exposure(), graph.outcome());
    }

    /**
     * @throws MissingExposureOutcomeException if {@code exposure} or
     *                                         {@code outcome} is not a node of
     *                                         the graph, or both are equal.
     */
    public RoleAssignment classify(CausalGraph graph, String exposure, String outcome) {
        if (exposure == null || !graph.contains(exposure))
            throw new MissingExposureOutcomeException("Exposure '" + exposure + "' is not in the graph");
        if (outcome == null || !graph.contains(outcome))
            throw new MissingExposureOutcomeException("Outcome '" + outcome + "' is not in the graph");
        if (exposure.equals(outcome))
            throw new MissingExposureOutcomeException("Exposure and outcome are the same node: " + exposure);

        Set<String> ends = Set.of(exposure, outcome);
        TreeSet<String> expAnc = new TreeSet<>(graph.ancestors(exposure));
        expAnc.remove(exposure);
        TreeSet<String> outAnc = new TreeSet<>(graph.ancestors(outcome));
        outAnc.remove(outcome);
        Set<String> expDesc = graph.descendants(exposure);
        Set<String> outDesc = graph.descendants(outcome);

        TreeSet<String> rawMediators = intersect(expDesc, outAnc);
        rawMediators.removeAll(ends);

        TreeSet<String> instruments = new TreeSet<>();
        for (String v : expAnc)
            if (isInstrument(graph, v, exposure, outcome))
                instruments.add(v);

        TreeSet<String> precision = new TreeSet<>(outAnc);
        precision.removeAll(expAnc);
        precision.removeAll(ends);
        precision.removeAll(rawMediators);

        TreeSet<String> rawConfounders = intersect(expAnc, outAnc);

        AdjustmentSetSearch search = new AdjustmentSetSearch(graph, exposure, outcome, limits, budget);
        AdjustmentSearchResult all = search.search(AdjustmentSetSearch.Kind.ALL);
        Set<String> adjustable = new HashSet<>();
        for (AdjustmentSet s : all.sets())
            adjustable.addAll(s.members());
        // a size-limited search means the full candidate set is valid, and it
        // contains every candidate
        boolean sizeLimited = all.stopReason() == StopReason.SIZE_LIMIT;
        if (sizeLimited)
            adjustable.addAll(search.candidates());
        TreeSet<String> confounders = new TreeSet<>(rawConfounders);
        confounders.removeAll(instruments);
        confounders.retainAll(adjustable);

        TreeSet<String> rawColliders = intersect(expDesc, outDesc);
        rawColliders.removeAll(ends);

        TreeSet<String> pureColliders = new TreeSet<>(rawColliders);
        pureColliders.removeAll(rawMediators);
        pureColliders.removeAll(confounders);
        TreeSet<String> pureMediators = new TreeSet<>(rawMediators);
        pureMediators.removeAll(rawColliders);
        pureMediators.removeAll(confounders);

        SortedMap<String, CausalRole> roles = new TreeMap<>();
        for (String n : graph.nodes()) {
            if (ends.contains(n))
                continue;
            roles.put(n, label(n, confounders, rawMediators, rawColliders, instruments, precision));
        }

        RoleAssignment result = new RoleAssignment(exposure, outcome, roles, rawMediators, rawColliders,
                rawConfounders, instruments, precision, confounders, pureMediators, pureColliders,
                all.completed() || sizeLimited, sizeLimited ? StopReason.NONE : all.stopReason());
        log.info("Classified {} nodes for {} -> {}: {}", roles.size(), exposure, outcome, result.counts());
        return result;
    }

    private static CausalRole label(String n, Set<String> conf, Set<String> med, Set<String> coll,
            Set<String> instruments, Set<String> precision) {
        boolean c = conf.contains(n), m = med.contains(n), k = coll.contains(n);
        if (c && m && k)
            return CausalRole.CONFOUNDER_MEDIATOR_COLLIDER;
        if (c && m)
            return CausalRole.CONFOUNDER_MEDIATOR;
        if (c && k)
            return CausalRole.CONFOUNDER_COLLIDER;
        if (m && k)
            return CausalRole.MEDIATOR_COLLIDER;
        if (c)
            return CausalRole.CONFOUNDER;
        if (m)
            return CausalRole.MEDIATOR;
        if (k)
            return CausalRole.COLLIDER;
        if (instruments.contains(n))
            return CausalRole.INSTRUMENTAL_VARIABLE;
        if (precision.contains(n))
            return CausalRole.PRECISION_VARIABLE;
        return CausalRole.UNCLASSIFIED;
    }

    /**
     * True if {@code v} reaches the outcome in the skeleton, but no longer
     * does once the exposure is removed: every path from {@code v} to the
     * outcome passes through the exposure.
     */
    static boolean isInstrument(CausalGraph graph, String v, String exposure, String outcome) {
        int from = graph.index(v), to = graph.index(outcome), x = graph.index(exposure);
        return connected(graph, from, to, -1) && !connected(graph, from, to, x);
    }

    private static boolean connected(CausalGraph g, int from, int to, int excluded) {
        BitSet seen = new BitSet(g.nodeCount());
        ArrayDeque<Integer> queue = new ArrayDeque<>();
        seen.set(from);
        queue.add(from);
        while (!queue.isEmpty()) {
            int v = queue.poll();
            if (v == to)
                return true;
            for (int k = 0; k < g.childCount(v); k++)
                visit(g.child(v, k), excluded, seen, queue);
            for (int k = 0; k < g.parentCount(v); k++)
                visit(g.parent(v, k), excluded, seen, queue);
        }
        return false;
    }

    private static void visit(int w, int excluded, BitSet seen, ArrayDeque<Integer> queue) {
        if (w != excluded && !seen.get(w)) {
            seen.set(w);
            queue.add(w);
        }
    }

    private static TreeSet<String> intersect(Set<String> a, Set<String> b) {
        TreeSet<String> out = new TreeSet<>(a);
        out.retainAll(b);
        return out;
    }
}
