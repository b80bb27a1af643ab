package com.causal.dag.engine;

import com.causal.dag.api.AnalysisListener;
import com.causal.dag.api.StopReason;

import java.util.Arrays;

/**
 * Fans {@link AnalysisListener} callbacks out to several listeners, in
 * registration order.
 */
public class CompositeAnalysisListener implements AnalysisListener {
    private AnalysisListener[] listeners = new AnalysisListener[0];

    public CompositeAnalysisListener add(AnalysisListener listener) {
        AnalysisListener[] old = listeners;
        AnalysisListener[] next = Arrays.copyOf(old, old.length + 1);
        next[old.length] = listener;
        listeners = next;
        return this;
    }

    public int size() {
        return listeners.length;
    }

    @Override
    public void onStageStart(String stage) {
        for (AnalysisListener l : listeners)
            l.onStageStart(stage);
    }

    @Override
    public void onProgress(String stage, long steps, long found) {
        for (AnalysisListener l : listeners)
            l.onProgress(stage, steps, found);
    }

    @Override
    public void onStageEnd(String stage, long steps, StopReason stopReason) {
        for (AnalysisListener l : listeners)
            l.onStageEnd(stage, steps, stopReason);
    }
}
