package com.causal.dag.util;

import com.causal.dag.CausalAnalysis;
import com.causal.dag.CausalDag;
import com.causal.dag.TestGraphs;
import com.causal.dag.cycle.CycleEngine;
import com.causal.dag.engine.SearchBudget;
import com.causal.dag.engine.SearchLimits;
import com.causal.dag.prune.PruningPipeline;
import com.causal.dag.role.RoleClassifier;
import org.junit.Test;

import static org.junit.Assert.*;

public class CausalExplainTest {

    @Test
    public void testExplainNode() {
        String text = CausalExplain.explainNode(TestGraphs.butterfly(), "B");
        assertTrue(text.contains("Parents (2): C1, C2"));
        assertTrue(text.contains("Children (2): A, Y"));
    }

    @Test
    public void testDumpTopology() {
        String text = CausalExplain.dumpTopology(TestGraphs.mBias());
        assertTrue(text.startsWith("Graph (5 nodes, 5 edges):"));
        assertTrue(text.contains("A (EXPOSURE) -> Y"));
        assertTrue(text.contains("U1 -> A, C"));
    }

    @Test
    public void testRoleTable() {
        String text = CausalExplain.roleTable(new RoleClassifier(SearchLimits.defaults(), SearchBudget.unlimited())
                .classify(TestGraphs.mBias()));
        assertTrue(text.contains("Confounder (1): U1"));
        assertTrue(text.contains("Unclassified (1): C"));
    }

    @Test
    public void testSummary() {
        CausalAnalysis a = new CausalDag().analyze(TestGraphs.butterfly());
        String text = CausalExplain.summarize(a);
        assertTrue(text.contains("B <- [C1, C2]"));
        assertTrue(text.contains("-- M-bias --"));
        assertTrue(text.contains("-- Statistics --"));
        assertFalse(text.contains("WARNING"));
    }

    @Test
    public void testStatisticsAndCentrality() {
        String stats = CausalExplain.statistics(CycleEngine.graphStatistics(TestGraphs.twoRoute()));
        assertTrue(stats.contains("Density: 0.333333"));
        assertTrue(stats.contains("Exposure reaches outcome: true (distance 1)"));
        assertTrue(stats.contains("Strongly connected: false"));

        String table = CausalExplain.centralityTable(PruningPipeline.degreeCentrality(TestGraphs.twoRoute()));
        assertTrue(table.contains("X\t1\t1\t2\t0.0833"));
    }
}
