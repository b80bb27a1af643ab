package com.causal.dag.bias;

import com.causal.dag.TestGraphs;
import com.causal.dag.api.GraphTooLargeException;
import com.causal.dag.api.StopReason;
import com.causal.dag.engine.SearchBudget;
import com.causal.dag.engine.SearchLimits;
import com.causal.dag.graph.AdjustmentSet;
import com.causal.dag.graph.CausalGraph;
import org.junit.Test;

import java.util.ArrayList;
import java.util.List;
import java.util.Set;

import static org.junit.Assert.*;

public class ButterflyBiasAnalyzerTest {
    private static final Set<String> CONFOUNDERS = Set.of("B", "C1", "C2");

    private static ButterflyBiasAnalyzer analyzer() {
        return new ButterflyBiasAnalyzer(SearchLimits.defaults(), SearchBudget.unlimited());
    }

    @Test
    public void testDetectsButterflyNode() {
        List<ButterflyStructure> found = analyzer().detect(TestGraphs.butterfly(), CONFOUNDERS);
        assertEquals(1, found.size());
        assertEquals("B", found.get(0).node());
        assertEquals(List.of("C1", "C2"), found.get(0).confounderParents());
        assertEquals(3, found.get(0).optionCount());
    }

    @Test
    public void testButterflyValidSetsExactly() {
        ButterflyReport r = analyzer().analyze(TestGraphs.butterfly(), CONFOUNDERS);
        assertTrue(r.hasButterflyBias());
        assertTrue(r.completed());
        assertTrue(r.nonButterflyConfounders().isEmpty());
        assertEquals(Set.of(AdjustmentSet.of("C1", "C2"), AdjustmentSet.of("B", "C1"), AdjustmentSet.of("B", "C2")),
                Set.copyOf(r.validSets()));
        assertEquals(3, r.validSets().size());
        assertFalse(r.validSets().contains(AdjustmentSet.of("B", "C1", "C2")));
    }

    @Test
    public void testNonButterflyConfoundersJoinEverySet() {
        CausalGraph g = TestGraphs.butterfly().toBuilder().addNode("W").addEdge("W", "A").addEdge("W", "Y").build();
        ButterflyReport r = analyzer().analyze(g, Set.of("B", "C1", "C2", "W"));
        assertEquals(List.of("W"), r.nonButterflyConfounders());
        assertEquals(3, r.validSets().size());
        for (AdjustmentSet s : r.validSets())
            assertTrue(s.contains("W"));
    }

    @Test
    public void testWithoutButterflySingleSortedSet() {
        ButterflyReport r = analyzer().analyze(TestGraphs.twoRoute(), Set.of("Z2", "Z1"));
        assertFalse(r.hasButterflyBias());
        assertEquals(List.of(AdjustmentSet.of("Z1", "Z2")), r.validSets());

        ButterflyReport none = analyzer().analyze(TestGraphs.noBackdoor(), Set.of());
        assertEquals(List.of(AdjustmentSet.EMPTY), none.validSets());
    }

    @Test
    public void testLocalOptionsForThreeParents() {
        ButterflyStructure s = new ButterflyStructure("B", List.of("P3", "P1", "P2"));
        List<AdjustmentSet> options = s.localOptions();
        assertEquals(7, s.optionCount());
        assertEquals(7, options.size());
        assertTrue(options.contains(AdjustmentSet.of("P1", "P2", "P3")));
        assertFalse(options.contains(AdjustmentSet.of("B", "P1", "P2", "P3")));
        assertFalse(options.contains(AdjustmentSet.of("B")));
        assertEquals(AdjustmentSet.of("B", "P1"), options.get(0));
    }

    @Test
    public void testValidSetsAreRestartable() {
        Iterable<AdjustmentSet> sets = analyzer().validSets(TestGraphs.butterfly(), CONFOUNDERS);
        List<AdjustmentSet> first = new ArrayList<>(), second = new ArrayList<>();
        sets.forEach(first::add);
        sets.forEach(second::add);
        assertEquals(first, second);
        assertEquals(3, first.size());
    }

    @Test
    public void testOptionPrecheck() {
        ButterflyBiasAnalyzer a = new ButterflyBiasAnalyzer(SearchLimits.defaults().withMaxButterflyOptions(2),
                SearchBudget.unlimited());
        try {
            a.analyze(TestGraphs.butterfly(), CONFOUNDERS);
            fail("Expected GraphTooLargeException");
        } catch (GraphTooLargeException e) {
            assertEquals(3, e.measured());
            assertEquals(List.of("B"), e.statistics().get("butterflyNodes"));
        }
    }

    @Test
    public void testCancelledEnumeration() {
        SearchBudget budget = SearchBudget.unlimited();
        budget.cancel();
        ButterflyReport r = new ButterflyBiasAnalyzer(SearchLimits.defaults(), budget)
                .analyze(TestGraphs.butterfly(), CONFOUNDERS);
        assertFalse(r.completed());
        assertEquals(StopReason.CANCELLED, r.stopReason());
        assertTrue(r.validSets().isEmpty());
    }

    @Test(expected = IllegalArgumentException.class)
    public void testStructureNeedsTwoParents() {
        new ButterflyStructure("B", List.of("P1"));
    }
}
