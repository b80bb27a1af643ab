package com.causal.dag.graph;

import com.causal.dag.TestGraphs;
import com.causal.dag.api.GraphTooLargeException;
import com.causal.dag.api.StopReason;
import com.causal.dag.engine.SearchBudget;
import com.causal.dag.engine.SearchLimits;
import org.junit.Test;

import java.util.List;

import static com.causal.dag.graph.AdjustmentSetSearch.Kind.ALL;
import static com.causal.dag.graph.AdjustmentSetSearch.Kind.MINIMAL;
import static org.junit.Assert.*;

public class AdjustmentSetSearchTest {

    private static AdjustmentSetSearch search(CausalGraph g) {
        return new AdjustmentSetSearch(g, SearchLimits.defaults(), SearchBudget.unlimited());
    }

    @Test
    public void testNoBackdoorPaths() {
        AdjustmentSearchResult r = search(TestGraphs.noBackdoor()).search(MINIMAL);
        assertTrue(r.isEmpty());
        assertTrue(r.completed());
        assertEquals(AdjustmentSearchResult.EmptyReason.NO_BACKDOOR_PATHS, r.reason());
    }

    @Test
    public void testSingleConfounder() {
        CausalGraph g = TestGraphs.graph("X", "Y", "Z->X", "Z->Y", "X->Y");
        assertEquals(List.of(AdjustmentSet.of("Z")), search(g).search(MINIMAL).sets());
        assertEquals(List.of(AdjustmentSet.of("Z")), search(g).search(ALL).sets());
    }

    @Test
    public void testCandidatesExcludeExposureDescendants() {
        CausalGraph g = TestGraphs.graph("X", "Y", "Z->X", "Z->Y", "X->M", "M->Y");
        AdjustmentSetSearch s = search(g);
        assertEquals(List.of("Z"), s.candidates());
        assertFalse(s.isValid(List.of("Z", "M")));
        assertTrue(s.isValid(List.of("Z")));
    }

    @Test
    public void testTwoRouteMinimalAndAll() {
        AdjustmentSetSearch s = search(TestGraphs.twoRoute());
        assertEquals(List.of(AdjustmentSet.of("Z1"), AdjustmentSet.of("Z2")), s.search(MINIMAL).sets());
        AdjustmentSearchResult all = s.search(ALL);
        assertEquals(List.of(AdjustmentSet.of("Z1"), AdjustmentSet.of("Z2"), AdjustmentSet.of("Z1", "Z2")),
                all.sets());
        assertEquals(2, all.candidateCount());
        assertEquals(4, all.subsetsExamined());
    }

    @Test
    public void testMinimalSetsAreSubsetMinimal() {
        for (CausalGraph g : List.of(TestGraphs.twoRoute(), TestGraphs.butterfly(), TestGraphs.mBias())) {
            AdjustmentSetSearch s = search(g);
            List<AdjustmentSet> all = s.search(ALL).sets();
            for (AdjustmentSet m : s.search(MINIMAL).sets()) {
                assertTrue(all.contains(m));
                for (AdjustmentSet other : all)
                    assertFalse(other + " is a proper subset of " + m,
                            !other.equals(m) && m.containsAll(other));
            }
        }
    }

    @Test
    public void testButterflyNeedsAllThree() {
        AdjustmentSearchResult r = search(TestGraphs.butterfly()).search(ALL);
        assertEquals(List.of(AdjustmentSet.of("B", "C1", "C2")), r.sets());
    }

    @Test
    public void testMBiasEmptySetIsMinimal() {
        AdjustmentSearchResult r = search(TestGraphs.mBias()).search(MINIMAL);
        assertEquals(List.of(AdjustmentSet.EMPTY), r.sets());
        assertNull(r.reason());
    }

    @Test
    public void testValidSetBeyondSizeBoundIsReportedIncomplete() {
        AdjustmentSetSearch s = new AdjustmentSetSearch(TestGraphs.butterfly(),
                SearchLimits.defaults().withMaxAdjustmentSetSize(2), SearchBudget.unlimited());
        for (AdjustmentSetSearch.Kind kind : AdjustmentSetSearch.Kind.values()) {
            AdjustmentSearchResult r = s.search(kind);
            assertTrue(r.isEmpty());
            assertFalse(r.completed());
            assertEquals(StopReason.SIZE_LIMIT, r.stopReason());
            assertNull(r.reason());
        }
    }

    @Test
    public void testManyConfoundersExceedDefaultSizeBound() {
        CausalGraph.Builder b = CausalGraph.builder().addNode("A").addNode("Y").addEdge("A", "Y");
        for (int i = 1; i <= 9; i++)
            b.addNode("C" + i).addEdge("C" + i, "A").addEdge("C" + i, "Y");
        CausalGraph g = b.exposure("A").outcome("Y").build();

        AdjustmentSetSearch s = new AdjustmentSetSearch(g, SearchLimits.defaults(), SearchBudget.unlimited());
        assertTrue(s.isValid(s.candidates()));
        AdjustmentSearchResult all = s.search(ALL);
        assertTrue(all.isEmpty());
        assertFalse(all.completed());
        assertEquals(StopReason.SIZE_LIMIT, all.stopReason());
        assertNull(all.reason());
    }

    @Test
    public void testNoValidSetWhenBackdoorRunsThroughDescendant() {
        // Z is both a parent and a descendant of X, so X <- Z -> Y cannot be blocked
        CausalGraph g = TestGraphs.graph("X", "Y", "X->Z", "Z->X", "Z->Y", "X->Y");
        AdjustmentSearchResult r = new AdjustmentSetSearch(g, SearchLimits.defaults(), SearchBudget.unlimited())
                .search(MINIMAL);
        assertTrue(r.isEmpty());
        assertTrue(r.completed());
        assertEquals(AdjustmentSearchResult.EmptyReason.NO_VALID_SET, r.reason());
        assertEquals(0, r.candidateCount());
    }

    @Test
    public void testPrecheckRefusesLargeSearch() {
        AdjustmentSetSearch s = new AdjustmentSetSearch(TestGraphs.butterfly(),
                SearchLimits.defaults().withMaxAdjustmentSubsets(5), SearchBudget.unlimited());
        try {
            s.search(ALL);
            fail("Expected GraphTooLargeException");
        } catch (GraphTooLargeException e) {
            assertEquals(8, e.measured());
            assertEquals(5, e.limit());
            assertEquals(3, e.statistics().get("candidates"));
        }
    }

    @Test
    public void testCancelledSearchIsPartial() {
        SearchBudget budget = SearchBudget.unlimited();
        budget.cancel();
        AdjustmentSearchResult r = new AdjustmentSetSearch(TestGraphs.twoRoute(), SearchLimits.defaults(), budget)
                .search(ALL);
        assertFalse(r.completed());
        assertEquals(StopReason.CANCELLED, r.stopReason());
        assertTrue(r.sets().isEmpty());
    }

    @Test
    public void testStepLimitStopsSearch() {
        SearchBudget budget = SearchBudget.builder().maxStepsPerStage(3).build();
        AdjustmentSearchResult r = new AdjustmentSetSearch(TestGraphs.twoRoute(), SearchLimits.defaults(), budget)
                .search(ALL);
        assertFalse(r.completed());
        assertEquals(StopReason.STEP_LIMIT, r.stopReason());
        assertEquals(List.of(AdjustmentSet.of("Z1")), r.sets());
    }

    @Test
    public void testExplicitExposureOutcomePair() {
        CausalGraph g = TestGraphs.twoRoute();
        AdjustmentSetSearch s = new AdjustmentSetSearch(g, "Z2", "Y", SearchLimits.defaults(),
                SearchBudget.unlimited());
        // Z2 <- Z1 -> X -> Y is a backdoor path for Z2
        assertEquals(List.of("X", "Z1"), s.candidates());
        assertEquals(List.of(AdjustmentSet.of("X"), AdjustmentSet.of("Z1")), s.search(MINIMAL).sets());
    }
}
