package com.causal.dag;

import com.causal.dag.bias.ButterflyReport;
import com.causal.dag.bias.MBiasReport;
import com.causal.dag.confounder.ConfounderReport;
import com.causal.dag.cycle.CycleReport;
import com.causal.dag.cycle.GraphStatistics;
import com.causal.dag.graph.CausalGraph;
import com.causal.dag.prune.FeedbackBreakResult;
import com.causal.dag.prune.HubPruneResult;
import com.causal.dag.prune.LeafPruneResult;
import com.causal.dag.role.RoleAssignment;

/**
 * Everything one {@link CausalDag} run produced.
 *
 * @param input    the graph as handed in.
 * @param analyzed the graph after pruning, which every later stage used.
 * @param statistics size and connectivity of {@code analyzed}.
 * @param leaves   null when leaf pruning is disabled.
 * @param cycles   null when cycle analysis is disabled.
 */
public record CausalAnalysis(
        CausalGraph input,
        CausalGraph analyzed,
        GraphStatistics statistics,
        HubPruneResult hubs,
        LeafPruneResult leaves,
        FeedbackBreakResult feedback,
        CycleReport cycles,
        RoleAssignment roles,
        ButterflyReport butterfly,
        MBiasReport mBias,
        ConfounderReport confounders) {

    /** False if any budgeted search stopped early. */
    public boolean completed() {
        return (cycles == null || cycles.completed()) && roles.completed() && butterfly.completed()
                && mBias.completed();
    }
}
