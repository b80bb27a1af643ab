package com.causal.dag.bias;

import com.causal.dag.api.StopReason;
import com.causal.dag.engine.SearchBudget;
import com.causal.dag.engine.SearchLimits;
import com.causal.dag.graph.AdjustmentSearchResult;
import com.causal.dag.graph.AdjustmentSet;
import com.causal.dag.graph.AdjustmentSetSearch;
import com.causal.dag.graph.CausalGraph;
import com.causal.dag.graph.Path;
import com.causal.dag.graph.SimplePaths;

import java.util.*;

import lombok.extern.log4j.Log4j2;

/**
 * Detects M-bias: nodes that a minimal adjustment strategy leaves out because
 * conditioning on them would open a collider path between exposure and
 * outcome.
 */
@Log4j2
public final class MBiasAnalyzer {
    static final String PATH_STAGE = "exposure-outcome-paths";

    private final SearchLimits limits;
    private final SearchBudget budget;

    public MBiasAnalyzer(SearchLimits limits, SearchBudget budget) {
        this.limits = limits;
        this.budget = budget;
    }

    public MBiasReport analyze(CausalGraph graph) {
        AdjustmentSearchResult minimal = new AdjustmentSetSearch(graph, limits, budget)
                .search(AdjustmentSetSearch.Kind.MINIMAL);
        Set<String> inMinimal = new HashSet<>();
        for (AdjustmentSet s : minimal.sets())
            inMinimal.addAll(s.members());

        budget.beginStage(PATH_STAGE);
        List<Path> paths = new ArrayList<>();
        SimplePaths.Cursor cursor = graph.allSimplePaths(graph.exposure(), graph.outcome(), limits.maxPathLength())
                .iterator();
        while (cursor.hasNext()) {
            Path p = cursor.next();
            if (!budget.checkpoint(paths.size()))
                break;
            paths.add(p);
            if (paths.size() >= limits.maxPaths()) {
                budget.stopOnResultLimit();
                break;
            }
        }
        StopReason pathStop = budget.endStage();
        boolean lengthCapped = pathStop.completed() && cursor.lengthCapped();
        if (lengthCapped) {
            pathStop = StopReason.SIZE_LIMIT;
            log.warn("Exposure/outcome paths longer than {} edges were not examined for M-bias",
                    limits.maxPathLength());
        }

        List<MBiasStructure> structures = new ArrayList<>();
        for (String v : graph.nodes()) {
            if (v.equals(graph.exposure()) || v.equals(graph.outcome()) || inMinimal.contains(v))
                continue;
            List<String> parents = graph.parents(v);
            if (parents.size() < 2)
                continue;
            List<Path> through = new ArrayList<>();
            for (Path p : paths)
                if (p.contains(v))
                    through.add(p);
            if (!through.isEmpty())
                structures.add(new MBiasStructure(v, parents, through));
        }

        AdjustmentSet chosen = minimal.sets().isEmpty() ? AdjustmentSet.EMPTY
                : Collections.min(minimal.sets());
        PathVerification verification = verify(graph, paths, chosen, structures);

        StopReason stop = minimal.stopReason().completed() ? pathStop : minimal.stopReason();
        if (!structures.isEmpty())
            log.info("M-bias: {} structures; open paths {} -> {} (chosen {}) -> {} (with {})", structures.size(),
                    verification.openUnconditioned(), verification.openWithChosen(), chosen,
                    verification.openWithMBiasNode(), verification.addedNode());
        return new MBiasReport(structures, minimal.sets(), chosen, verification, lengthCapped, stop.completed(),
                stop);
    }

    private static PathVerification verify(CausalGraph graph, List<Path> paths, AdjustmentSet chosen,
            List<MBiasStructure> structures) {
        Set<String> none = Set.of();
        Set<String> withChosen = new HashSet<>(chosen.members());
        int open0 = countOpen(graph, paths, none);
        int open1 = countOpen(graph, paths, withChosen);
        // a structure below the exposure sits on a causal path; conditioning
        // on it would block rather than open
        Set<String> belowExposure = graph.descendants(graph.exposure());
        String added = null;
        for (MBiasStructure s : structures) {
            if (!belowExposure.contains(s.node())) {
                added = s.node();
                break;
            }
        }
        if (added == null)
            return new PathVerification(paths.size(), open0, open1, open1, null);
        Set<String> withMBias = new HashSet<>(withChosen);
        withMBias.add(added);
        return new PathVerification(paths.size(), open0, open1, countOpen(graph, paths, withMBias), added);
    }

    private static int countOpen(CausalGraph graph, List<Path> paths, Set<String> z) {
        int open = 0;
        for (Path p : paths)
            if (graph.isPathOpen(p, z))
                open++;
        return open;
    }
}
