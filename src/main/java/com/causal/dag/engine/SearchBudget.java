package com.causal.dag.engine;

import com.causal.dag.api.AnalysisListener;
import com.causal.dag.api.StopReason;

import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;

/**
 * Cooperative budget shared by the exponential searches of one analysis run.
 *
 * Every recursive step of a search calls {@link #checkpoint(long)}. The call
 * is cheap on the happy path (a counter increment and a volatile read) and
 * returns false once the search must stop:
 *
 * 1. Cancel: {@link #cancel()} was called, possibly from another thread.
 * 2. Deadline: the wall-clock budget of the whole run has elapsed. The clock
 * is sampled every 256 steps.
 * 3. Step cap: the current stage has taken {@code maxStepsPerStage} steps.
 *
 * A search that stops returns whatever it gathered together with
 * {@code completed=false}; nothing it already produced is invalidated.
 *
 * Cancellation and the deadline are sticky for the whole run, so later stages
 * stop at their first checkpoint. A step cap or a result cap only ends the
 * stage that hit it.
 *
 * Progress is reported to the {@link AnalysisListener} every
 * {@code progressInterval} steps.
 */
public final class SearchBudget {
    private static final Logger log = LogManager.getLogger(SearchBudget.class);
    private static final int CLOCK_MASK = 0xFF;

    private final long deadlineNanos;
    private final long maxStepsPerStage;
    private final long progressInterval;
    private final AnalysisListener listener;

    private volatile boolean cancelled;
    private boolean timedOut;

    // Per-stage state
    private String stage = "idle";
    private long steps;
    private long found;
    private StopReason stopReason = StopReason.NONE;

    private SearchBudget(long timeoutMillis, long maxStepsPerStage, long progressInterval, AnalysisListener listener) {
        this.deadlineNanos = timeoutMillis > 0 ? System.nanoTime() + timeoutMillis * 1_000_000L : Long.MAX_VALUE;
        this.maxStepsPerStage = maxStepsPerStage > 0 ? maxStepsPerStage : Long.MAX_VALUE;
        this.progressInterval = progressInterval > 0 ? progressInterval : Long.MAX_VALUE;
        this.listener = listener;
    }

    /** A budget that never stops a search and reports to nobody. */
    public static SearchBudget unlimited() {
        return new SearchBudget(0, 0, 0, null);
    }

    public static Builder builder() {
        return new Builder();
    }

    /** Requests every running and future stage of this run to stop. */
    public void cancel() {
        cancelled = true;
    }

    public boolean isCancelled() {
        return cancelled;
    }

    /**
     * Starts a new stage: resets the step counter and the stage stop reason.
     */
    public void beginStage(String stageName) {
        this.stage = stageName;
        this.steps = 0;
        this.found = 0;
        this.stopReason = StopReason.NONE;
        if (System.nanoTime() > deadlineNanos)
            timedOut = true;
        if (listener != null)
            listener.onStageStart(stageName);
        log.debug("Stage '{}' started", stageName);
    }

    /**
     * Records one search step.
     *
     * @param foundSoFar Results produced by the stage so far (progress only).
     * @return true if the search may continue; false if it must stop now.
     */
    public boolean checkpoint(long foundSoFar) {
        if (stopReason != StopReason.NONE)
            return false;
        steps++;
        found = foundSoFar;
        if (cancelled) {
            stopReason = StopReason.CANCELLED;
            return false;
        }
        if (timedOut || ((steps & CLOCK_MASK) == 0 && System.nanoTime() > deadlineNanos)) {
            timedOut = true;
            stopReason = StopReason.TIMED_OUT;
            return false;
        }
        if (steps >= maxStepsPerStage) {
            stopReason = StopReason.STEP_LIMIT;
            return false;
        }
        if (listener != null && steps % progressInterval == 0)
            listener.onProgress(stage, steps, foundSoFar);
        return true;
    }

    /** Records one search step without a result count. */
    public boolean checkpoint() {
        return checkpoint(found);
    }

    /**
     * Ends the current stage early because a result cap was reached.
     */
    public void stopOnResultLimit() {
        if (stopReason == StopReason.NONE)
            stopReason = StopReason.RESULT_LIMIT;
    }

    /**
     * Finishes the current stage and notifies the listener.
     *
     * @return the reason the stage stopped, {@link StopReason#NONE} if it
     *         completed.
     */
    public StopReason endStage() {
        StopReason reason = stopReason;
        if (reason != StopReason.NONE)
            log.warn("Stage '{}' stopped early after {} steps: {}", stage, steps, reason);
        else
            log.debug("Stage '{}' completed in {} steps", stage, steps);
        if (listener != null)
            listener.onStageEnd(stage, steps, reason);
        return reason;
    }

    public String stage() {
        return stage;
    }

    public long steps() {
        return steps;
    }

    public StopReason stopReason() {
        return stopReason;
    }

    /** Fluent construction of a budget. */
    public static final class Builder {
        private long timeoutMillis;
        private long maxStepsPerStage;
        private long progressInterval = 100_000;
        private AnalysisListener listener;

        /** Wall-clock budget for the whole run; 0 disables the deadline. */
        public Builder timeoutMillis(long timeoutMillis) {
            this.timeoutMillis = timeoutMillis;
            return this;
        }

        /** Step cap per stage; 0 disables it. */
        public Builder maxStepsPerStage(long maxStepsPerStage) {
            this.maxStepsPerStage = maxStepsPerStage;
            return this;
        }

        public Builder progressInterval(long progressInterval) {
            this.progressInterval = progressInterval;
            return this;
        }

        public Builder listener(AnalysisListener listener) {
            this.listener = listener;
            return this;
        }

        public SearchBudget build() {
            return new SearchBudget(timeoutMillis, maxStepsPerStage, progressInterval, listener);
        }
    }
}
