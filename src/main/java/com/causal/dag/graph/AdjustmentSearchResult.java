package com.causal.dag.graph;

import com.causal.dag.api.StopReason;

import java.util.List;

/**
 * Outcome of one backdoor adjustment-set search.
 *
 * @param kind             which sets were searched for.
 * @param sets             valid sets in (size, lexicographic) order.
 * @param completed        false if the search stopped early or valid sets
 *                         may exist beyond the size bound; {@code sets} is
 *                         then a prefix of the full answer.
 * @param stopReason       why the search stopped, NONE if it completed.
 * @param reason           reason code when {@code sets} is legitimately
 *                         empty, else null.
 * @param candidateCount   number of candidate nodes.
 * @param subsetsExamined  how many candidate subsets were tested.
 */
public record AdjustmentSearchResult(
        AdjustmentSetSearch.Kind kind,
        List<AdjustmentSet> sets,
        boolean completed,
        StopReason stopReason,
        EmptyReason reason,
        int candidateCount,
        long subsetsExamined) {

    /** Why a search legitimately produced no set. */
    public enum EmptyReason {
        /** The exposure has no parents, so no backdoor path exists. */
        NO_BACKDOOR_PATHS,
        /** Backdoor paths exist but no candidate subset blocks them all. */
        NO_VALID_SET
    }

    public AdjustmentSearchResult {
        sets = List.copyOf(sets);
    }

    public boolean isEmpty() {
        return sets.isEmpty();
    }
}
