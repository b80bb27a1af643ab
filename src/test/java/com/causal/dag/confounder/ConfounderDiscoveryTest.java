package com.causal.dag.confounder;

import com.causal.dag.TestGraphs;
import com.causal.dag.graph.CausalGraph;
import org.junit.Test;

import java.util.List;

import static org.junit.Assert.*;

public class ConfounderDiscoveryTest {

    /** C1 is clean, C2 closes a 2-edge loop with X, C3 a 5-edge loop with Y. */
    private static CausalGraph feedbackGraph() {
        return TestGraphs.graph("X", "Y", "X->Y",
                "C1->X", "C1->Y",
                "C2->X", "C2->Y", "X->C2",
                "C3->X", "C3->Y", "Y->M1", "M1->M2", "M2->M3", "M3->C3");
    }

    @Test
    public void testClassificationAndOrder() {
        ConfounderReport r = new ConfounderDiscovery().discover(feedbackGraph());
        assertEquals(List.of("C2", "C3", "C1"), r.candidates().stream().map(ConfounderCandidate::node).toList());

        ConfounderCandidate c2 = r.candidates().get(0);
        assertEquals(FeedbackClass.TIGHT_FEEDBACK, c2.classification());
        assertEquals(1, c2.distFromExposure());
        assertEquals(2, c2.cycleLenExposure());
        assertEquals(2, c2.minCycleLength());
        assertTrue(c2.childOfExposure());
        assertFalse(c2.childOfOutcome());

        ConfounderCandidate c3 = r.candidates().get(1);
        assertEquals(FeedbackClass.LONG_FEEDBACK, c3.classification());
        assertEquals(4, c3.distFromOutcome());
        assertEquals(5, c3.minCycleLength());

        ConfounderCandidate c1 = r.candidates().get(2);
        assertEquals(FeedbackClass.PURE_CONFOUNDER, c1.classification());
        assertEquals(ConfounderCandidate.UNREACHABLE, c1.distFromExposure());
        assertEquals(ConfounderCandidate.UNREACHABLE, c1.minCycleLength());

        assertEquals(List.of("C1"), r.validForAdjustment());
        assertEquals(1, r.withClass(FeedbackClass.LONG_FEEDBACK).size());
    }

    @Test
    public void testTightThresholdIsConfigurable() {
        ConfounderReport r = new ConfounderDiscovery(5).discover(feedbackGraph());
        assertEquals(FeedbackClass.TIGHT_FEEDBACK, r.candidates().get(1).classification());
    }

    @Test
    public void testBoundary() {
        ConfounderDiscovery d = new ConfounderDiscovery();
        assertEquals(FeedbackClass.TIGHT_FEEDBACK, d.classify(2));
        assertEquals(FeedbackClass.TIGHT_FEEDBACK, d.classify(3));
        assertEquals(FeedbackClass.LONG_FEEDBACK, d.classify(4));
        assertEquals(FeedbackClass.PURE_CONFOUNDER, d.classify(ConfounderCandidate.UNREACHABLE));
    }

    @Test
    public void testNoCommonParents() {
        assertTrue(new ConfounderDiscovery().discover(TestGraphs.noBackdoor()).candidates().isEmpty());
    }

    @Test
    public void testCandidateSubgraph() {
        CausalGraph sub = new ConfounderDiscovery().candidateSubgraph(feedbackGraph(), "C3");
        assertEquals(List.of("C3", "M1", "M2", "M3", "X", "Y"), sub.nodes());
        assertTrue(sub.hasEdge("M3", "C3"));
        assertTrue(sub.hasEdge("C3", "X"));
        assertFalse(sub.contains("C1"));
    }

    @Test
    public void testShortestPath() {
        assertEquals(List.of("Y", "M1", "M2", "M3", "C3"),
                ConfounderDiscovery.shortestPath(feedbackGraph(), "Y", "C3"));
        assertTrue(ConfounderDiscovery.shortestPath(feedbackGraph(), "X", "C1").isEmpty());
    }

    @Test(expected = IllegalArgumentException.class)
    public void testRejectsLoopLengthBelowTwo() {
        new ConfounderDiscovery(1);
    }
}
