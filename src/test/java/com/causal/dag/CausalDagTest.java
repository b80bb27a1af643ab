package com.causal.dag;

import com.causal.dag.engine.LoggingAnalysisListener;
import com.causal.dag.engine.SearchBudget;
import com.causal.dag.graph.AdjustmentSet;
import com.causal.dag.graph.CausalGraph;
import com.causal.dag.io.AnalysisConfig;
import com.causal.dag.io.AnalysisConfigLoader;
import com.causal.dag.role.CausalRole;
import org.junit.Test;

import java.util.List;
import java.util.Set;

import static org.junit.Assert.*;

public class CausalDagTest {

    @Test
    public void testButterflyPipeline() {
        LoggingAnalysisListener listener = new LoggingAnalysisListener();
        CausalAnalysis a = new CausalDag().addListener(listener).analyze(TestGraphs.butterfly());

        assertTrue(a.completed());
        assertEquals(Set.of("B", "C1", "C2"), a.roles().confounders());
        assertEquals(3, a.butterfly().validSets().size());
        assertEquals(0, a.cycles().totalCycles());
        assertTrue(a.statistics().acyclic());
        assertEquals(5, a.statistics().nodes());
        assertTrue(a.confounders().validForAdjustment().containsAll(List.of("B", "C1", "C2")));
        assertNotNull(listener.stats("adjustment-sets-all"));
        assertNotNull(listener.stats("butterfly-sets"));
        assertNotNull(listener.stats("elementary-cycles"));
        assertNotNull(listener.stats("exposure-outcome-paths"));
    }

    @Test
    public void testPruningRunsBeforeAnalysis() {
        CausalGraph g = TestGraphs.graph("X", "Y", "X->Y", "Z->X", "Z->Y", "Leaf->Z",
                "Hub->X", "Hub->Y", "Hub->Z", "Hub->Q", "Q->Y", "X->Z");
        AnalysisConfig config = new AnalysisConfig();
        config.setGenericNodes(List.of("Hub"));
        config.setTopNCentrality(2);
        config.setStrongConfounders(List.of("Z"));

        CausalAnalysis a = new CausalDag(config).analyze(g);
        assertEquals(List.of("Hub"), a.hubs().pruned());
        assertEquals(List.of(List.of("Leaf", "Q")), a.leaves().removedPerPass());
        assertFalse(a.analyzed().hasEdge("X", "Z"));
        assertEquals(List.of("X", "Y", "Z"), a.analyzed().nodes());
        assertEquals(CausalRole.CONFOUNDER, a.roles().roleOf("Z"));
        assertEquals(List.of(AdjustmentSet.of("Z")), a.mBias().minimalSets());
        assertEquals(10, a.input().edgeCount());
    }

    @Test
    public void testCancelledRunIsPartial() {
        CausalDag dag = new CausalDag();
        SearchBudget budget = dag.newBudget();
        budget.cancel();
        CausalAnalysis a = dag.analyze(TestGraphs.mBias(), budget);
        assertFalse(a.completed());
        assertFalse(a.roles().completed());
    }

    @Test
    public void testCycleAnalysisCanBeDisabled() {
        AnalysisConfig config = AnalysisConfigLoader.parse("{\"cycleAnalysis\": false, \"leafPruning\": false}");
        CausalAnalysis a = new CausalDag(config).analyze(TestGraphs.cyclic());
        assertNull(a.cycles());
        assertNull(a.leaves());
        assertTrue(a.completed());
    }

    @Test
    public void testAnalyzeDefinition() {
        CausalAnalysis a = new CausalDag()
                .analyze(AnalysisConfigLoader.loadGraphResource("m-bias-graph.json"));
        assertTrue(a.mBias().hasMBias());
        assertEquals("C", a.mBias().structures().get(0).node());
    }
}
