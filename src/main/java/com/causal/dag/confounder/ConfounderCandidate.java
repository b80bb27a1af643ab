package com.causal.dag.confounder;

/**
 * A common parent of exposure and outcome. Distances and cycle lengths are
 * {@link #UNREACHABLE} when there is no directed return path.
 *
 * @param distFromExposure   shortest directed path exposure to node, in edges.
 * @param distFromOutcome    shortest directed path outcome to node.
 * @param cycleLenExposure   length of the loop node, exposure, ..., node.
 * @param cycleLenOutcome    length of the loop through the outcome.
 * @param minCycleLength     shorter of the two loops.
 * @param childOfExposure    whether the edge exposure to node exists.
 * @param childOfOutcome     whether the edge outcome to node exists.
 */
public record ConfounderCandidate(
        String node,
        int distFromExposure,
        int distFromOutcome,
        int cycleLenExposure,
        int cycleLenOutcome,
        int minCycleLength,
        boolean childOfExposure,
        boolean childOfOutcome,
        FeedbackClass classification) {

    public static final int UNREACHABLE = Integer.MAX_VALUE;

    public boolean validForAdjustment() {
        return classification == FeedbackClass.PURE_CONFOUNDER;
    }
}
