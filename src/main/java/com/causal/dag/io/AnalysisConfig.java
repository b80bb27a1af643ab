package com.causal.dag.io;

import com.causal.dag.api.AnalysisListener;
import com.causal.dag.engine.SearchBudget;
import com.causal.dag.engine.SearchLimits;

import java.util.ArrayList;
import java.util.List;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;

import lombok.Data;

/**
 * Settings of one analysis run. Bound from JSON; every field has a default.
 */
@Data
@JsonIgnoreProperties(ignoreUnknown = true)
public final class AnalysisConfig {
    /** Overly broad concepts pruned when they rank among the top hubs. */
    private List<String> genericNodes = new ArrayList<>();
    private int topNCentrality = 150;
    /** Known confounders whose feedback edges from exposure/outcome are cut. */
    private List<String> strongConfounders = new ArrayList<>();
    private boolean leafPruning = true;
    /** Nodes leaf pruning never removes, besides exposure and outcome. */
    private List<String> protectedNodes = new ArrayList<>();
    private boolean cycleAnalysis = true;

    // Caps
    private int maxAdjustmentSetSize = 8;
    private long maxAdjustmentSubsets = 5_000_000L;
    private int maxAdjustmentSets = 10_000;
    private long maxButterflyOptions = 1_000_000L;
    private int maxPathLength = 12;
    private int maxPaths = 100_000;
    private int maxCycleSccNodes = 500;
    private int maxCycleSccEdges = 5_000;
    private int maxCyclesToSample = 50;
    private int tightFeedbackMaxLength = 3;

    // Budget
    private long timeoutMillis = 0;
    private long maxStepsPerStage = 0;
    private long progressInterval = 100_000;

    /**
     * @throws IllegalArgumentException naming the first invalid setting.
     */
    public AnalysisConfig validate() {
        toLimits();
        if (topNCentrality < 0)
            throw new IllegalArgumentException("topNCentrality must be >= 0: " + topNCentrality);
        if (tightFeedbackMaxLength < 2)
            throw new IllegalArgumentException("tightFeedbackMaxLength must be >= 2: " + tightFeedbackMaxLength);
        if (timeoutMillis < 0 || maxStepsPerStage < 0 || progressInterval < 0)
            throw new IllegalArgumentException("timeoutMillis, maxStepsPerStage and progressInterval must be >= 0");
        return this;
    }

    public SearchLimits toLimits() {
        return new SearchLimits(maxAdjustmentSetSize, maxAdjustmentSubsets, maxAdjustmentSets, maxButterflyOptions,
                maxPathLength, maxPaths, maxCycleSccNodes, maxCycleSccEdges, maxCyclesToSample);
    }

    /** A fresh budget for one run; the deadline starts now. */
    public SearchBudget toBudget(AnalysisListener listener) {
        return SearchBudget.builder()
                .timeoutMillis(timeoutMillis)
                .maxStepsPerStage(maxStepsPerStage)
                .progressInterval(progressInterval)
                .listener(listener)
                .build();
    }
}
