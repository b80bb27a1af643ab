package com.causal.dag.engine;

import com.causal.dag.api.AnalysisListener;
import com.causal.dag.api.StopReason;
import com.causal.dag.util.LogRateLimiter;

import java.util.LinkedHashMap;
import java.util.Map;

import lombok.extern.log4j.Log4j2;

/**
 * A listener that logs stage progress and keeps per-stage timing.
 *
 * <p>
 * Captures:
 * <ul>
 * <li><b>Duration:</b> wall-clock time of the last run of each stage.</li>
 * <li><b>Work:</b> number of search steps taken by each stage.</li>
 * <li><b>Outcome:</b> the stop reason of each stage.</li>
 * </ul>
 *
 * <p>
 * Progress lines are throttled to one per second so that a long enumeration
 * does not flood the log.
 */
@Log4j2
public final class LoggingAnalysisListener implements AnalysisListener {

    /** Timing and outcome of one stage run. */
    public record StageStats(String stage, long steps, long durationNanos, StopReason stopReason) {
        public double durationMillis() {
            return durationNanos / 1_000_000.0;
        }
    }

    private final LogRateLimiter progressLimiter = new LogRateLimiter(log, 1000);
    private final Map<String, Long> startNanos = new LinkedHashMap<>();
    private final Map<String, StageStats> stats = new LinkedHashMap<>();

    @Override
    public void onStageStart(String stage) {
        startNanos.put(stage, System.nanoTime());
    }

    @Override
    public void onProgress(String stage, long steps, long found) {
        progressLimiter.info("Stage '{}': {} steps, {} found", stage, steps, found);
    }

    @Override
    public void onStageEnd(String stage, long steps, StopReason stopReason) {
        Long start = startNanos.remove(stage);
        long duration = start == null ? 0 : System.nanoTime() - start;
        StageStats s = new StageStats(stage, steps, duration, stopReason);
        stats.put(stage, s);
        log.info(String.format("Stage '%s' finished: %d steps in %.3f ms (%s)",
                stage, steps, s.durationMillis(), stopReason));
    }

    /** Returns the stats of the last run of each stage, in first-run order. */
    public Map<String, StageStats> stats() {
        return Map.copyOf(stats);
    }

    public StageStats stats(String stage) {
        return stats.get(stage);
    }
}
