package com.causal.dag.graph;

import com.causal.dag.api.GraphTooLargeException;
import com.causal.dag.api.StopReason;
import com.causal.dag.engine.SearchBudget;
import com.causal.dag.engine.SearchLimits;

import java.util.*;

import lombok.extern.log4j.Log4j2;

/**
 * Backdoor adjustment-set search for one exposure/outcome pair.
 *
 * Candidates are the ancestors of exposure or outcome that are not
 * descendants of the exposure. Candidate subsets are tested in (size,
 * lexicographic) order; a subset is valid iff it d-separates exposure and
 * outcome once the exposure's outgoing edges are removed. Because candidates
 * exclude the exposure's descendants, a valid set never blocks a causal path.
 */
@Log4j2
public final class AdjustmentSetSearch {

    public enum Kind {
        /** Valid sets none of whose proper subsets is valid. */
        MINIMAL,
        /** Every valid set up to the size bound. */
        ALL
    }

    private final CausalGraph graph;
    private final String exposure;
    private final String outcome;
    private final SearchLimits limits;
    private final SearchBudget budget;
    private final List<String> candidates;
    private final BitSet exposureDescendants;

    public AdjustmentSetSearch(CausalGraph graph, SearchLimits limits, SearchBudget budget) {
        this(graph, graph.exposure(), graph.outcome(), limits, budget);
    }

    public AdjustmentSetSearch(CausalGraph graph, String exposure, String outcome, SearchLimits limits,
            SearchBudget budget) {
        this.graph = graph;
        this.exposure = exposure;
        this.outcome = outcome;
        this.limits = limits;
        this.budget = budget;
        int x = graph.index(exposure), y = graph.index(outcome);
        this.exposureDescendants = graph.descendantMask(x);
        BitSet cand = (BitSet) graph.ancestorMask(x).clone();
        cand.or(graph.ancestorMask(y));
        cand.andNot(exposureDescendants);
        cand.clear(x);
        cand.clear(y);
        this.candidates = List.copyOf(graph.names(cand));
    }

    /** Sorted candidate nodes for adjustment. */
    public List<String> candidates() {
        return candidates;
    }

    /** Candidate subsets in (size, lexicographic) order up to the size bound. */
    public Iterable<AdjustmentSet> subsets() {
        return new Subsets(candidates, limits.maxAdjustmentSetSize());
    }

    /** Whether {@code z} satisfies the backdoor criterion for this pair. */
    public boolean isValid(Collection<String> z) {
        for (String n : z) {
            if (n.equals(outcome) || exposureDescendants.get(graph.index(n)))
                return false;
        }
        return graph.dSeparated(exposure, outcome, z, exposure);
    }

    /**
     * Runs the search.
     *
     * @throws GraphTooLargeException if more than {@code maxAdjustmentSubsets}
     *                                subsets would have to be examined.
     */
    public AdjustmentSearchResult search(Kind kind) {
        int x = graph.index(exposure);
        if (graph.parentCount(x) == 0) {
            log.debug("Exposure '{}' has no parents; no backdoor path to block", exposure);
            return new AdjustmentSearchResult(kind, List.of(), true, StopReason.NONE,
                    AdjustmentSearchResult.EmptyReason.NO_BACKDOOR_PATHS, candidates.size(), 0);
        }

        // the full candidate set is valid iff any valid set exists
        if (!isValid(candidates)) {
            log.debug("No set of {} candidates blocks every backdoor path {} -> {}", candidates.size(), exposure,
                    outcome);
            return new AdjustmentSearchResult(kind, List.of(), true, StopReason.NONE,
                    AdjustmentSearchResult.EmptyReason.NO_VALID_SET, candidates.size(), 1);
        }

        long subsetCount = Subsets.count(candidates.size(), limits.maxAdjustmentSetSize());
        if (subsetCount > limits.maxAdjustmentSubsets()) {
            Map<String, Object> stats = new LinkedHashMap<>();
            stats.put("candidates", candidates.size());
            stats.put("maxAdjustmentSetSize", limits.maxAdjustmentSetSize());
            throw new GraphTooLargeException("adjustment-set search", subsetCount, limits.maxAdjustmentSubsets(),
                    stats);
        }

        budget.beginStage("adjustment-sets-" + kind.name().toLowerCase(Locale.ROOT));
        List<AdjustmentSet> found = new ArrayList<>();
        long examined = 0;
        for (AdjustmentSet subset : subsets()) {
            if (!budget.checkpoint(found.size()))
                break;
            examined++;
            if (kind == Kind.MINIMAL && containsFound(subset, found))
                continue;
            if (!isValid(subset.members()))
                continue;
            found.add(subset);
            if (found.size() >= limits.maxAdjustmentSets()) {
                budget.stopOnResultLimit();
                break;
            }
            // the empty set is valid, so it is the only minimal set
            if (kind == Kind.MINIMAL && subset.isEmpty())
                break;
        }
        StopReason stop = budget.endStage();
        if (stop.completed() && truncated(kind, found)) {
            stop = StopReason.SIZE_LIMIT;
            log.warn("{} adjustment sets for {} -> {}: {} candidates exceed maxAdjustmentSetSize {}, {} sets found",
                    kind, exposure, outcome, candidates.size(), limits.maxAdjustmentSetSize(), found.size());
        }
        log.debug("{} adjustment sets for {} -> {}: {} found, {} subsets examined", kind, exposure, outcome,
                found.size(), examined);
        return new AdjustmentSearchResult(kind, found, stop.completed(), stop,
                found.isEmpty() && stop.completed() ? AdjustmentSearchResult.EmptyReason.NO_VALID_SET : null,
                candidates.size(), examined);
    }

    /** Whether valid sets larger than the size bound were left unexamined. */
    private boolean truncated(Kind kind, List<AdjustmentSet> found) {
        if (candidates.size() <= limits.maxAdjustmentSetSize())
            return false;
        return kind == Kind.ALL || found.isEmpty() || !found.get(0).isEmpty();
    }

    private static boolean containsFound(AdjustmentSet subset, List<AdjustmentSet> found) {
        for (AdjustmentSet m : found)
            if (subset.containsAll(m))
                return true;
        return false;
    }
}
