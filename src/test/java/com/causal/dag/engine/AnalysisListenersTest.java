package com.causal.dag.engine;

import com.causal.dag.api.StopReason;
import org.junit.Test;

import java.util.List;

import static org.junit.Assert.*;

public class AnalysisListenersTest {

    @Test
    public void testCompositeFansOutInOrder() {
        SearchBudgetTest.RecordingListener a = new SearchBudgetTest.RecordingListener();
        SearchBudgetTest.RecordingListener b = new SearchBudgetTest.RecordingListener();
        CompositeAnalysisListener composite = new CompositeAnalysisListener().add(a).add(b);
        assertEquals(2, composite.size());

        composite.onStageStart("s");
        composite.onProgress("s", 1, 0);
        composite.onStageEnd("s", 1, StopReason.NONE);

        List<String> expected = List.of("start:s", "progress:s:1:0", "end:s:1:NONE");
        assertEquals(expected, a.events);
        assertEquals(expected, b.events);
    }

    @Test
    public void testLoggingListenerKeepsStageStats() {
        LoggingAnalysisListener listener = new LoggingAnalysisListener();
        SearchBudget budget = SearchBudget.builder().maxStepsPerStage(4).progressInterval(1).listener(listener)
                .build();
        budget.beginStage("enumerate");
        while (budget.checkpoint())
            ;
        budget.endStage();

        LoggingAnalysisListener.StageStats stats = listener.stats("enumerate");
        assertNotNull(stats);
        assertEquals(4, stats.steps());
        assertEquals(StopReason.STEP_LIMIT, stats.stopReason());
        assertTrue(stats.durationNanos() >= 0);
        assertEquals(1, listener.stats().size());
        assertNull(listener.stats("other"));
    }
}
