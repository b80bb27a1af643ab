package com.causal.dag.cycle;

import com.causal.dag.TestGraphs;
import com.causal.dag.api.GraphTooLargeException;
import com.causal.dag.api.StopReason;
import com.causal.dag.engine.SearchBudget;
import com.causal.dag.engine.SearchLimits;
import com.causal.dag.graph.CausalGraph;
import org.junit.Test;

import java.util.ArrayList;
import java.util.List;
import java.util.Map;

import static org.junit.Assert.*;

public class CycleEngineTest {
    private static final SearchLimits LIMITS = SearchLimits.defaults();

    @Test
    public void testStronglyConnectedComponents() {
        List<StronglyConnectedComponent> sccs = CycleEngine.stronglyConnectedComponents(TestGraphs.cyclic());
        assertEquals(3, sccs.size());
        assertEquals(List.of("A", "B", "C", "D"), sccs.get(0).members());
        assertTrue(sccs.get(0).isCyclic());
        assertEquals(0, sccs.get(0).id());
        assertEquals(List.of("X"), sccs.get(1).members());
        assertEquals(List.of("Y"), sccs.get(2).members());
        assertFalse(sccs.get(2).isCyclic());
    }

    @Test
    public void testSccSummary() {
        SccSummary s = CycleEngine.sccSummary(TestGraphs.cyclic());
        assertEquals(1, s.cyclicComponents());
        assertEquals(4, s.nodesInCyclicComponents());
        assertEquals(4, s.largestComponentSize());
        assertEquals(List.of(4), s.cyclicSizes());
        assertTrue(CycleEngine.sccSummary(TestGraphs.butterfly()).isAcyclic());
    }

    @Test
    public void testElementaryCycles() {
        List<CycleRecord> streamed = new ArrayList<>();
        CycleReport r = CycleEngine.enumerateElementaryCycles(TestGraphs.cyclic(), LIMITS,
                SearchBudget.unlimited(), streamed::add);

        assertTrue(r.completed());
        assertEquals(StopReason.NONE, r.stopReason());
        assertEquals(2, r.totalCycles());
        assertEquals(List.of(List.of("A", "B", "C"), List.of("C", "D")),
                r.sampledCycles().stream().map(CycleRecord::nodes).toList());
        assertEquals(r.sampledCycles(), streamed);
        assertEquals(Map.of(2, 1L, 3, 1L), r.lengthHistogram());

        assertEquals(List.of("C", "A", "B", "D"), r.ranking().stream().map(CycleReport.NodeParticipation::node)
                .toList());
        assertEquals(2, r.participation("C"));
        assertEquals(1, r.participation("D"));
        assertEquals(0, r.participation("X"));
        assertEquals("A -> B -> C -> A", r.sampledCycles().get(0).toString());
    }

    @Test
    public void testEnumerationIsIdempotent() {
        CausalGraph g = TestGraphs.graph("X", "Y", "X->A", "A->B", "B->A", "B->C", "C->A", "A->C", "C->Y");
        CycleReport first = CycleEngine.enumerateElementaryCycles(g, LIMITS, SearchBudget.unlimited());
        CycleReport second = CycleEngine.enumerateElementaryCycles(g, LIMITS, SearchBudget.unlimited());
        assertEquals(first.ranking(), second.ranking());
        assertEquals(first.lengthHistogram(), second.lengthHistogram());
        // A<->B, A<->C, A->B->C->A
        assertEquals(3, first.totalCycles());
    }

    @Test
    public void testTwoCycleBetweenExposureAndOutcome() {
        CycleReport r = CycleEngine.enumerateElementaryCycles(TestGraphs.graph("X", "Y", "X->Y", "Y->X"), LIMITS,
                SearchBudget.unlimited());
        assertEquals(1, r.totalCycles());
        assertEquals(List.of("X", "Y"), r.sampledCycles().get(0).nodes());
    }

    @Test
    public void testSampleCap() {
        CycleReport r = CycleEngine.enumerateElementaryCycles(TestGraphs.cyclic(),
                LIMITS.withMaxCyclesToSample(1), SearchBudget.unlimited());
        assertEquals(2, r.totalCycles());
        assertEquals(1, r.sampledCycles().size());
    }

    @Test
    public void testAcyclicGraph() {
        CycleReport r = CycleEngine.enumerateElementaryCycles(TestGraphs.butterfly(), LIMITS,
                SearchBudget.unlimited());
        assertEquals(0, r.totalCycles());
        assertTrue(r.ranking().isEmpty());
        assertTrue(r.completed());
    }

    @Test
    public void testPrecheckRefusesLargeComponent() {
        try {
            CycleEngine.enumerateElementaryCycles(TestGraphs.cyclic(), LIMITS.withMaxCycleSccNodes(3),
                    SearchBudget.unlimited());
            fail("Expected GraphTooLargeException");
        } catch (GraphTooLargeException e) {
            assertEquals(4, e.measured());
            assertEquals(3, e.limit());
            assertEquals(List.of(4), e.statistics().get("cyclicSccSizes"));
        }
    }

    @Test
    public void testCancelledEnumerationIsPartial() {
        SearchBudget budget = SearchBudget.unlimited();
        budget.cancel();
        CycleReport r = CycleEngine.enumerateElementaryCycles(TestGraphs.cyclic(), LIMITS, budget);
        assertFalse(r.completed());
        assertEquals(StopReason.CANCELLED, r.stopReason());
        assertEquals(0, r.totalCycles());
        assertEquals(4, r.sccSummary().nodesInCyclicComponents());
    }

    @Test
    public void testShortestDistances() {
        Map<String, Integer> d = CycleEngine.shortestDistancesFrom(TestGraphs.cyclic(), "X");
        assertEquals(Integer.valueOf(0), d.get("X"));
        assertEquals(Integer.valueOf(1), d.get("A"));
        assertEquals(Integer.valueOf(3), d.get("C"));
        assertEquals(Integer.valueOf(4), d.get("Y"));
        assertFalse(CycleEngine.shortestDistancesFrom(TestGraphs.cyclic(), "Y").containsKey("X"));
    }

    @Test
    public void testNodeRemovalImpact() {
        NodeRemovalImpact impact = CycleEngine.nodeRemovalImpact(TestGraphs.cyclic(), List.of("C", "B", "Q", "X"),
                LIMITS, SearchBudget.unlimited());
        assertEquals(2, impact.baselineCycles());
        assertEquals(2, impact.entries().size());

        NodeRemovalImpact.Entry c = impact.entries().get(0);
        assertEquals("C", c.node());
        assertEquals(0, c.cyclesAfter());
        assertEquals(100.0, c.reductionPercent(), 1e-9);
        assertTrue(c.after().isAcyclic());

        NodeRemovalImpact.Entry b = impact.entries().get(1);
        assertEquals(1, b.cyclesAfter());
        assertEquals(50.0, b.reductionPercent(), 1e-9);

        assertEquals(List.of("Q"), impact.notInGraph());
        assertEquals(List.of("X"), impact.protectedNodes());
        assertTrue(impact.completed());
    }

    @Test
    public void testGraphStatisticsAcyclic() {
        GraphStatistics s = CycleEngine.graphStatistics(TestGraphs.twoRoute());
        assertEquals(4, s.nodes());
        assertEquals(4, s.edges());
        assertEquals(1.0 / 3, s.density(), 1e-9);
        assertTrue(s.weaklyConnected());
        assertFalse(s.stronglyConnected());
        assertTrue(s.acyclic());
        assertEquals(4, s.components());
        assertTrue(s.exposureReachesOutcome());
        assertEquals(1, s.exposureOutcomeDistance());
        assertFalse(s.outcomeReachesExposure());
    }

    @Test
    public void testGraphStatisticsCyclic() {
        GraphStatistics s = CycleEngine.graphStatistics(TestGraphs.cyclic());
        assertFalse(s.acyclic());
        assertEquals(3, s.components());
        assertEquals(4, s.exposureOutcomeDistance());

        GraphStatistics loop = CycleEngine.graphStatistics(TestGraphs.graph("X", "Y", "X->Y", "Y->X"));
        assertTrue(loop.stronglyConnected());
        assertTrue(loop.outcomeReachesExposure());
        assertEquals(1.0, loop.density(), 1e-9);
    }

    @Test
    public void testGraphStatisticsDisconnected() {
        GraphStatistics s = CycleEngine.graphStatistics(TestGraphs.graph("X", "Y", "Y->P", "Q->X"));
        assertFalse(s.weaklyConnected());
        assertFalse(s.exposureReachesOutcome());
        assertEquals(-1, s.exposureOutcomeDistance());
    }
}
