package com.causal.dag;

import com.causal.dag.api.AnalysisListener;
import com.causal.dag.bias.ButterflyBiasAnalyzer;
import com.causal.dag.bias.ButterflyReport;
import com.causal.dag.bias.MBiasAnalyzer;
import com.causal.dag.bias.MBiasReport;
import com.causal.dag.confounder.ConfounderDiscovery;
import com.causal.dag.confounder.ConfounderReport;
import com.causal.dag.cycle.CycleEngine;
import com.causal.dag.cycle.CycleReport;
import com.causal.dag.cycle.GraphStatistics;
import com.causal.dag.engine.CompositeAnalysisListener;
import com.causal.dag.engine.SearchBudget;
import com.causal.dag.engine.SearchLimits;
import com.causal.dag.graph.CausalGraph;
import com.causal.dag.io.AnalysisConfig;
import com.causal.dag.io.AnalysisConfigLoader;
import com.causal.dag.io.GraphDefinition;
import com.causal.dag.prune.FeedbackBreakResult;
import com.causal.dag.prune.HubPruneResult;
import com.causal.dag.prune.LeafPruneResult;
import com.causal.dag.prune.PruningPipeline;
import com.causal.dag.role.RoleAssignment;
import com.causal.dag.role.RoleClassifier;

import java.nio.file.Path;

import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;

/**
 * Runs the whole analysis for one exposure/outcome query.
 * <p>
 * Stages, in order:
 * <ul>
 * <li>Pruning: generic hubs, then leaves, then confounder feedback edges</li>
 * <li>Graph statistics and cycle analysis of the pruned graph</li>
 * <li>Role classification</li>
 * <li>Butterfly bias and M-bias detection</li>
 * <li>Common-parent confounder discovery</li>
 * </ul>
 * Each run gets a fresh {@link SearchBudget} built from the configuration,
 * unless the caller supplies one (for example to cancel from another thread).
 */
public class CausalDag {
    private static final Logger log = LogManager.getLogger(CausalDag.class);

    private final AnalysisConfig config;
    private final SearchLimits limits;
    private final CompositeAnalysisListener listeners = new CompositeAnalysisListener();

    public CausalDag(AnalysisConfig config) {
        this.config = config.validate();
        this.limits = config.toLimits();
    }

    public CausalDag() {
        this(new AnalysisConfig());
    }

    /** Creates an engine from a JSON configuration file. */
    public static CausalDag fromConfig(Path configPath) {
        return new CausalDag(AnalysisConfigLoader.load(configPath));
    }

    public CausalDag addListener(AnalysisListener listener) {
        listeners.add(listener);
        return this;
    }

    public AnalysisConfig config() {
        return config;
    }

    /** A budget for one run, reporting to this engine's listeners. */
    public SearchBudget newBudget() {
        return config.toBudget(listeners.size() == 0 ? null : listeners);
    }

    public CausalAnalysis analyze(GraphDefinition definition) {
        return analyze(definition.toGraph());
    }

    public CausalAnalysis analyze(CausalGraph graph) {
        return analyze(graph, newBudget());
    }

    public CausalAnalysis analyze(CausalGraph graph, SearchBudget budget) {
        log.info("Analyzing {} -> {} ({} nodes, {} edges)", graph.exposure(), graph.outcome(), graph.nodeCount(),
                graph.edgeCount());

        // 1. Pruning
        HubPruneResult hubs = PruningPipeline.pruneGenericHubs(graph, config.getGenericNodes(),
                config.getTopNCentrality());
        CausalGraph g = hubs.graph();
        LeafPruneResult leaves = null;
        if (config.isLeafPruning()) {
            leaves = PruningPipeline.iterativeLeafPrune(g, config.getProtectedNodes());
            g = leaves.graph();
        }
        FeedbackBreakResult feedback = PruningPipeline.breakConfounderFeedback(g, config.getStrongConfounders());
        g = feedback.graph();

        // 2. Statistics and cycles
        GraphStatistics statistics = CycleEngine.graphStatistics(g);
        CycleReport cycles = config.isCycleAnalysis() ? CycleEngine.enumerateElementaryCycles(g, limits, budget)
                : null;

        // 3. Roles and bias structures
        RoleAssignment roles = new RoleClassifier(limits, budget).classify(g);
        ButterflyReport butterfly = new ButterflyBiasAnalyzer(limits, budget).analyze(g, roles.confounders());
        MBiasReport mBias = new MBiasAnalyzer(limits, budget).analyze(g);

        // 4. Confounder candidates
        ConfounderReport confounders = new ConfounderDiscovery(config.getTightFeedbackMaxLength()).discover(g);

        CausalAnalysis analysis = new CausalAnalysis(graph, g, statistics, hubs, leaves, feedback, cycles, roles, butterfly,
                mBias, confounders);
        log.info("Analysis of {} -> {} finished: {} nodes analyzed, completed={}", graph.exposure(),
                graph.outcome(), g.nodeCount(), analysis.completed());
        return analysis;
    }
}
