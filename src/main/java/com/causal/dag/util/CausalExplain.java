package com.causal.dag.util;

import com.causal.dag.CausalAnalysis;
import com.causal.dag.bias.ButterflyStructure;
import com.causal.dag.bias.MBiasStructure;
import com.causal.dag.bias.PathVerification;
import com.causal.dag.confounder.ConfounderCandidate;
import com.causal.dag.cycle.CycleReport;
import com.causal.dag.cycle.GraphStatistics;
import com.causal.dag.graph.CausalGraph;
import com.causal.dag.prune.DegreeCentrality;
import com.causal.dag.role.CausalRole;
import com.causal.dag.role.RoleAssignment;

import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.SortedSet;

/**
 * Diagnostic utility for inspecting a graph and an analysis.
 *
 * <p>
 * Generates human-readable text: a node's neighbourhood, the topology, the
 * role table and a full analysis summary.
 *
 * <p>
 * <b>Usage:</b> intended for logs and debugging sessions. Allocates strings
 * and walks whole collections.
 */
public final class CausalExplain {
    private static final int MAX_RANKED = 10;

    private CausalExplain() {
    }

    /**
     * Dumps the neighbourhood of a single node.
     */
    public static String explainNode(CausalGraph graph, String node) {
        StringBuilder sb = new StringBuilder(256);
        sb.append("Node: ").append(node).append('\n')
                .append("  Index: ").append(graph.index(node)).append('\n')
                .append("  Exposure: ").append(node.equals(graph.exposure())).append('\n')
                .append("  Outcome: ").append(node.equals(graph.outcome())).append('\n')
                .append("  Parents (").append(graph.inDegree(node)).append("): ")
                .append(String.join(", ", graph.parents(node))).append('\n')
                .append("  Children (").append(graph.outDegree(node)).append("): ")
                .append(String.join(", ", graph.children(node))).append('\n');
        return sb.toString();
    }

    /**
     * Dumps the entire topology, one line per node.
     */
    public static String dumpTopology(CausalGraph graph) {
        StringBuilder sb = new StringBuilder(1024);
        sb.append("Graph (").append(graph.nodeCount()).append(" nodes, ").append(graph.edgeCount())
                .append(" edges):\n");
        for (String n : graph.nodes()) {
            sb.append("  ").append(n);
            if (n.equals(graph.exposure()))
                sb.append(" (EXPOSURE)");
            if (n.equals(graph.outcome()))
                sb.append(" (OUTCOME)");
            if (graph.outDegree(n) > 0)
                sb.append(" -> ").append(String.join(", ", graph.children(n)));
            sb.append('\n');
        }
        return sb.toString();
    }

    /** Size, density and connectivity lines. */
    public static String statistics(GraphStatistics s) {
        StringBuilder sb = new StringBuilder(256);
        sb.append("Nodes: ").append(s.nodes()).append('\n')
                .append("Edges: ").append(s.edges()).append('\n')
                .append("Density: ").append(String.format(Locale.ROOT, "%.6f", s.density())).append('\n')
                .append("Weakly connected: ").append(s.weaklyConnected()).append('\n')
                .append("Strongly connected: ").append(s.stronglyConnected()).append('\n')
                .append("Acyclic: ").append(s.acyclic()).append(" (").append(s.components())
                .append(" components)\n")
                .append("Exposure reaches outcome: ").append(s.exposureReachesOutcome());
        if (s.exposureReachesOutcome())
            sb.append(" (distance ").append(s.exposureOutcomeDistance()).append(')');
        sb.append('\n').append("Outcome reaches exposure: ").append(s.outcomeReachesExposure()).append('\n');
        return sb.toString();
    }

    /** One line per row: degrees and normalized betweenness. */
    public static String centralityTable(List<DegreeCentrality> rows) {
        StringBuilder sb = new StringBuilder(64 * rows.size() + 32);
        sb.append("node\tin\tout\ttotal\tbetweenness\n");
        for (DegreeCentrality d : rows)
            sb.append(d.node()).append('\t').append(d.inDegree()).append('\t').append(d.outDegree()).append('\t')
                    .append(d.totalDegree()).append('\t')
                    .append(String.format(Locale.ROOT, "%.4f", d.normalizedBetweenness())).append('\n');
        return sb.toString();
    }

    /** Nodes grouped by role, roles without nodes omitted. */
    public static String roleTable(RoleAssignment roles) {
        StringBuilder sb = new StringBuilder(512);
        sb.append("Roles for ").append(roles.exposure()).append(" -> ").append(roles.outcome()).append(":\n");
        for (CausalRole role : CausalRole.values()) {
            SortedSet<String> nodes = roles.nodesWith(role);
            if (!nodes.isEmpty())
                sb.append("  ").append(role.label()).append(" (").append(nodes.size()).append("): ")
                        .append(String.join(", ", nodes)).append('\n');
        }
        if (!roles.completed())
            sb.append("  (adjustment search stopped early: ").append(roles.stopReason()).append(")\n");
        return sb.toString();
    }

    /**
     * Full text summary of an analysis run.
     */
    public static String summarize(CausalAnalysis a) {
        StringBuilder sb = new StringBuilder(2048);
        CausalGraph in = a.input(), g = a.analyzed();
        sb.append("=== Causal analysis: ").append(g.exposure()).append(" -> ").append(g.outcome()).append(" ===\n");
        sb.append("Graph: ").append(in.nodeCount()).append(" nodes / ").append(in.edgeCount())
                .append(" edges, analyzed ").append(g.nodeCount()).append(" / ").append(g.edgeCount()).append('\n');

        sb.append("\n-- Statistics --\n").append(statistics(a.statistics()));

        sb.append("\n-- Pruning --\n");
        sb.append("Generic hubs removed: ").append(a.hubs().pruned()).append('\n');
        if (a.leaves() != null)
            sb.append("Leaves removed: ").append(a.leaves().totalRemoved()).append(" in ")
                    .append(a.leaves().iterations()).append(" passes\n");
        sb.append("Feedback edges removed: ").append(a.feedback().removed()).append('\n');

        CycleReport cycles = a.cycles();
        if (cycles != null) {
            sb.append("\n-- Cycles --\n");
            sb.append("Elementary cycles: ").append(cycles.totalCycles())
                    .append(cycles.completed() ? "" : " (lower bound, " + cycles.stopReason() + ")").append('\n');
            sb.append("Cyclic SCCs: ").append(cycles.sccSummary().cyclicSizes()).append('\n');
            for (Map.Entry<Integer, Long> e : cycles.lengthHistogram().entrySet())
                sb.append("  length ").append(e.getKey()).append(": ").append(e.getValue()).append('\n');
            int shown = 0;
            for (CycleReport.NodeParticipation p : cycles.ranking()) {
                if (shown++ == MAX_RANKED)
                    break;
                sb.append("  ").append(p.node()).append(": ").append(p.cycles()).append(" cycles\n");
            }
        }

        sb.append("\n-- Roles --\n").append(roleTable(a.roles()));

        sb.append("\n-- Butterfly bias --\n");
        if (!a.butterfly().hasButterflyBias())
            sb.append("None\n");
        for (ButterflyStructure s : a.butterfly().structures())
            sb.append("  ").append(s.node()).append(" <- ").append(s.confounderParents()).append('\n');
        sb.append("Valid sets: ").append(a.butterfly().validSets()).append('\n');

        sb.append("\n-- M-bias --\n");
        if (!a.mBias().hasMBias())
            sb.append("None\n");
        for (MBiasStructure s : a.mBias().structures())
            sb.append("  ").append(s.node()).append(" <- ").append(s.parents()).append(", on ")
                    .append(s.offendingPaths().size()).append(" paths\n");
        PathVerification v = a.mBias().verification();
        sb.append("Chosen set: ").append(a.mBias().chosenAdjustmentSet()).append('\n');
        sb.append("Open paths: ").append(v.openUnconditioned()).append('/').append(v.totalPaths())
                .append(" unconditioned, ").append(v.openWithChosen()).append(" with chosen set");
        if (v.addedNode() != null)
            sb.append(", ").append(v.openWithMBiasNode()).append(" adding ").append(v.addedNode());
        sb.append('\n');
        if (a.mBias().pathLengthCapped())
            sb.append("Some paths exceed the length bound and were not examined\n");

        sb.append("\n-- Confounder candidates --\n");
        for (ConfounderCandidate c : a.confounders().candidates()) {
            sb.append("  ").append(c.node()).append(": ").append(c.classification());
            if (c.minCycleLength() != ConfounderCandidate.UNREACHABLE)
                sb.append(" (loop length ").append(c.minCycleLength()).append(')');
            sb.append('\n');
        }
        if (!a.completed())
            sb.append("\nWARNING: some searches stopped early; results are partial.\n");
        return sb.toString();
    }
}
