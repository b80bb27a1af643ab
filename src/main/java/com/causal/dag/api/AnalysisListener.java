package com.causal.dag.api;

/**
 * Observability interface for long-running analysis stages.
 *
 * Implementations are registered on a {@code SearchBudget} and receive
 * callbacks while the exponential searches (cycle enumeration, adjustment-set
 * search, butterfly options, path enumeration) run. This is the mechanism an
 * interactive host uses to:
 *
 * - Show progress: how many search steps have been taken and how many results
 * were found so far.
 * - Diagnose: which stage stopped early and why.
 *
 * Callbacks run on the analysis thread, inside the search loops. They must be
 * cheap; blocking here slows the search down by the same amount.
 */
public interface AnalysisListener {

    /**
     * Called when a stage begins.
     *
     * @param stage Human-readable stage name, e.g. "elementary-cycles".
     */
    void onStageStart(String stage);

    /**
     * Called every {@code progressInterval} search steps.
     *
     * @param stage Current stage.
     * @param steps Steps taken in this stage so far.
     * @param found Results found in this stage so far.
     */
    void onProgress(String stage, long steps, long found);

    /**
     * Called when a stage finishes, normally or early.
     *
     * @param stage      Current stage.
     * @param steps      Total steps taken in the stage.
     * @param stopReason {@link StopReason#NONE} if the stage ran to completion.
     */
    void onStageEnd(String stage, long steps, StopReason stopReason);
}
