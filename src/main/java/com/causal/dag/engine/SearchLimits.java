package com.causal.dag.engine;

/**
 * Numeric caps applied by the prechecks and search loops of the exponential
 * operations.
 *
 * @param maxAdjustmentSetSize largest adjustment set the subset search builds.
 * @param maxAdjustmentSubsets precheck cap on the number of candidate subsets.
 * @param maxAdjustmentSets    result cap on valid sets collected by one search.
 * @param maxButterflyOptions  precheck cap on the butterfly option product.
 * @param maxPathLength        longest exposure/outcome path (in edges)
 *                             enumerated for M-bias analysis.
 * @param maxPaths             result cap on enumerated paths.
 * @param maxCycleSccNodes     precheck cap on nodes per SCC for cycle
 *                             enumeration.
 * @param maxCycleSccEdges     precheck cap on edges per SCC for cycle
 *                             enumeration.
 * @param maxCyclesToSample    how many cycle records a cycle report keeps.
 */
public record SearchLimits(
        int maxAdjustmentSetSize,
        long maxAdjustmentSubsets,
        int maxAdjustmentSets,
        long maxButterflyOptions,
        int maxPathLength,
        int maxPaths,
        int maxCycleSccNodes,
        int maxCycleSccEdges,
        int maxCyclesToSample) {

    public SearchLimits {
        requirePositive("maxAdjustmentSetSize", maxAdjustmentSetSize);
        requirePositive("maxAdjustmentSubsets", maxAdjustmentSubsets);
        requirePositive("maxAdjustmentSets", maxAdjustmentSets);
        requirePositive("maxButterflyOptions", maxButterflyOptions);
        requirePositive("maxPathLength", maxPathLength);
        requirePositive("maxPaths", maxPaths);
        requirePositive("maxCycleSccNodes", maxCycleSccNodes);
        requirePositive("maxCycleSccEdges", maxCycleSccEdges);
        if (maxCyclesToSample < 0)
            throw new IllegalArgumentException("maxCyclesToSample must be >= 0: " + maxCyclesToSample);
    }

    public static SearchLimits defaults() {
        return new SearchLimits(8, 5_000_000L, 10_000, 1_000_000L, 12, 100_000, 500, 5_000, 50);
    }

    public SearchLimits withMaxAdjustmentSetSize(int value) {
        return new SearchLimits(value, maxAdjustmentSubsets, maxAdjustmentSets, maxButterflyOptions, maxPathLength,
                maxPaths, maxCycleSccNodes, maxCycleSccEdges, maxCyclesToSample);
    }

    public SearchLimits withMaxAdjustmentSubsets(long value) {
        return new SearchLimits(maxAdjustmentSetSize, value, maxAdjustmentSets, maxButterflyOptions, maxPathLength,
                maxPaths, maxCycleSccNodes, maxCycleSccEdges, maxCyclesToSample);
    }

    public SearchLimits withMaxButterflyOptions(long value) {
        return new SearchLimits(maxAdjustmentSetSize, maxAdjustmentSubsets, maxAdjustmentSets, value, maxPathLength,
                maxPaths, maxCycleSccNodes, maxCycleSccEdges, maxCyclesToSample);
    }

    public SearchLimits withMaxCycleSccNodes(int value) {
        return new SearchLimits(maxAdjustmentSetSize, maxAdjustmentSubsets, maxAdjustmentSets, maxButterflyOptions,
                maxPathLength, maxPaths, value, maxCycleSccEdges, maxCyclesToSample);
    }

    public SearchLimits withMaxCyclesToSample(int value) {
        return new SearchLimits(maxAdjustmentSetSize, maxAdjustmentSubsets, maxAdjustmentSets, maxButterflyOptions,
                maxPathLength, maxPaths, maxCycleSccNodes, maxCycleSccEdges, value);
    }

    private static void requirePositive(String name, long value) {
        if (value <= 0)
            throw new IllegalArgumentException(name + " must be positive: " + value);
    }
}
