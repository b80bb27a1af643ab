package com.causal.dag.bias;

import com.causal.dag.api.GraphTooLargeException;
import com.causal.dag.api.StopReason;
import com.causal.dag.engine.SearchBudget;
import com.causal.dag.engine.SearchLimits;
import com.causal.dag.graph.AdjustmentSet;
import com.causal.dag.graph.CausalGraph;

import java.util.*;

import lombok.extern.log4j.Log4j2;

/**
 * Detects butterfly bias among a set of confounders and enumerates the
 * adjustment sets that avoid it.
 */
@Log4j2
public final class ButterflyBiasAnalyzer {
    static final String STAGE = "butterfly-sets";

    private final SearchLimits limits;
    private final SearchBudget budget;

    public ButterflyBiasAnalyzer(SearchLimits limits, SearchBudget budget) {
        this.limits = limits;
        this.budget = budget;
    }

    /** Confounders with at least two confounder parents, by node id. */
    public List<ButterflyStructure> detect(CausalGraph graph, Collection<String> confounders) {
        Set<String> conf = new TreeSet<>(confounders);
        List<ButterflyStructure> out = new ArrayList<>();
        for (String v : conf) {
            List<String> confParents = new ArrayList<>();
            for (String p : graph.parents(v))
                if (conf.contains(p))
                    confParents.add(p);
            if (confParents.size() >= 2)
                out.add(new ButterflyStructure(v, confParents));
        }
        return out;
    }

    /**
     * Lazy sequence of deduplicated valid sets.
     *
     * @throws GraphTooLargeException if the option product exceeds
     *                                {@code maxButterflyOptions}.
     */
    public Iterable<AdjustmentSet> validSets(CausalGraph graph, Collection<String> confounders) {
        List<ButterflyStructure> structures = detect(graph, confounders);
        return options(structures, nonButterfly(confounders, structures));
    }

    public ButterflyReport analyze(CausalGraph graph, Collection<String> confounders) {
        List<ButterflyStructure> structures = detect(graph, confounders);
        List<String> fixed = nonButterfly(confounders, structures);
        Iterable<AdjustmentSet> sets = options(structures, fixed);

        budget.beginStage(STAGE);
        List<AdjustmentSet> found = new ArrayList<>();
        for (AdjustmentSet s : sets) {
            if (!budget.checkpoint(found.size()))
                break;
            found.add(s);
        }
        StopReason stop = budget.endStage();
        if (!structures.isEmpty())
            log.info("Butterfly bias: {} structures, {} adjustment sets", structures.size(), found.size());
        return new ButterflyReport(structures, fixed, found, stop.completed(), stop);
    }

    private static List<String> nonButterfly(Collection<String> confounders, List<ButterflyStructure> structures) {
        Set<String> out = new TreeSet<>(confounders);
        for (ButterflyStructure s : structures) {
            out.remove(s.node());
            out.removeAll(s.confounderParents());
        }
        return new ArrayList<>(out);
    }

    private Iterable<AdjustmentSet> options(List<ButterflyStructure> structures, List<String> fixed) {
        long product = 1;
        for (ButterflyStructure s : structures) {
            long c = s.optionCount();
            product = c > Long.MAX_VALUE / product ? Long.MAX_VALUE : product * c;
        }
        if (product > limits.maxButterflyOptions()) {
            Map<String, Object> stats = new LinkedHashMap<>();
            stats.put("butterflyNodes", structures.stream().map(ButterflyStructure::node).toList());
            stats.put("optionCounts", structures.stream().map(ButterflyStructure::optionCount).toList());
            throw new GraphTooLargeException("butterfly option enumeration", product, limits.maxButterflyOptions(),
                    stats);
        }
        List<List<AdjustmentSet>> local = new ArrayList<>();
        for (ButterflyStructure s : structures)
            local.add(s.localOptions());
        return new ButterflyOptions(local, fixed);
    }
}
