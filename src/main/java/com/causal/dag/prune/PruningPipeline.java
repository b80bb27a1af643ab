package com.causal.dag.prune;

import com.causal.dag.api.InvalidGraphException;
import com.causal.dag.graph.CausalGraph;
import com.causal.dag.graph.Edge;

import java.util.*;

import lombok.extern.log4j.Log4j2;

/**
 * Graph reductions used to make literature-derived graphs analyzable. Every
 * operation returns a new graph; the input is never modified. The exposure
 * and the outcome are never removed.
 */
@Log4j2
public final class PruningPipeline {

    private PruningPipeline() {
    }

    /**
     * Removes {@code nodes} and their incident edges.
     *
     * @throws InvalidGraphException for an unknown id, or an attempt to remove
     *                               the exposure or the outcome.
     */
    public static CausalGraph removeNodes(CausalGraph graph, Collection<String> nodes) {
        CausalGraph.Builder b = graph.toBuilder();
        for (String n : nodes) {
            if (!graph.contains(n))
                throw new InvalidGraphException("Cannot remove unknown node: " + n);
            if (n.equals(graph.exposure()) || n.equals(graph.outcome()))
                throw new InvalidGraphException("Cannot remove exposure/outcome node: " + n);
            b.removeNode(n);
        }
        return b.build();
    }

    /**
     * Repeatedly removes every node of total degree 1 that is not protected,
     * recomputing degrees after each pass, until none is left.
     */
    public static LeafPruneResult iterativeLeafPrune(CausalGraph graph, Collection<String> protectedNodes) {
        Set<String> keep = new HashSet<>(protectedNodes);
        keep.add(graph.exposure());
        keep.add(graph.outcome());

        CausalGraph current = graph;
        List<List<String>> passes = new ArrayList<>();
        while (true) {
            List<String> leaves = new ArrayList<>();
            for (String n : current.nodes())
                if (current.degree(n) == 1 && !keep.contains(n))
                    leaves.add(n);
            if (leaves.isEmpty())
                break;
            log.debug("Leaf pruning pass {}: removing {}", passes.size() + 1, leaves);
            current = removeNodes(current, leaves);
            passes.add(leaves);
        }
        log.info("Leaf pruning removed {} nodes in {} passes ({} -> {} nodes)",
                graph.nodeCount() - current.nodeCount(), passes.size(), graph.nodeCount(), current.nodeCount());
        return new LeafPruneResult(current, passes.size(), passes);
    }

    /**
     * For each named confounder present in the graph, deletes the edges
     * {@code exposure -> name} and {@code outcome -> name}. Edges out of the
     * confounder are kept.
     */
    public static FeedbackBreakResult breakConfounderFeedback(CausalGraph graph, Collection<String> names) {
        CausalGraph.Builder b = graph.toBuilder();
        List<Edge> removed = new ArrayList<>();
        List<String> missing = new ArrayList<>();
        for (String name : names) {
            if (!graph.contains(name)) {
                missing.add(name);
                continue;
            }
            for (String source : List.of(graph.exposure(), graph.outcome())) {
                if (!source.equals(name) && b.removeEdge(source, name))
                    removed.add(new Edge(source, name));
            }
        }
        if (!missing.isEmpty())
            log.warn("Feedback breaking: {} configured confounders not in graph: {}", missing.size(), missing);
        log.info("Feedback breaking removed {} edges: {}", removed.size(), removed);
        return new FeedbackBreakResult(b.build(), removed, missing);
    }

    /**
     * Degree and betweenness table of every node, by total degree descending
     * then id.
     */
    public static List<DegreeCentrality> degreeCentrality(CausalGraph graph) {
        int n = graph.nodeCount();
        double[] between = betweenness(graph);
        double scale = n > 2 ? (double) (n - 1) * (n - 2) : 0;
        List<DegreeCentrality> rows = new ArrayList<>(n);
        for (int i = 0; i < n; i++) {
            String id = graph.id(i);
            rows.add(new DegreeCentrality(id, graph.inDegree(id), graph.outDegree(id), between[i],
                    scale == 0 ? 0 : between[i] / scale));
        }
        rows.sort(DegreeCentrality.BY_DEGREE);
        return rows;
    }

    /** The {@code topN} nodes by betweenness, ties by id. */
    public static List<DegreeCentrality> topByBetweenness(CausalGraph graph, int topN) {
        List<DegreeCentrality> rows = degreeCentrality(graph);
        rows.sort(DegreeCentrality.BY_BETWEENNESS);
        return rows.subList(0, Math.min(Math.max(topN, 0), rows.size()));
    }

    /**
     * Brandes' algorithm over directed edges, unweighted. Indexed by node
     * index; endpoints of a path are not credited.
     */
    static double[] betweenness(CausalGraph graph) {
        int n = graph.nodeCount();
        double[] cb = new double[n];
        int[] order = new int[n];
        int[] queue = new int[n];
        int[] dist = new int[n];
        double[] sigma = new double[n];
        double[] delta = new double[n];
        for (int s = 0; s < n; s++) {
            Arrays.fill(dist, -1);
            Arrays.fill(sigma, 0);
            Arrays.fill(delta, 0);
            dist[s] = 0;
            sigma[s] = 1;
            int head = 0, tail = 0, visited = 0;
            queue[tail++] = s;
            while (head < tail) {
                int v = queue[head++];
                order[visited++] = v;
                for (int k = 0; k < graph.childCount(v); k++) {
                    int w = graph.child(v, k);
                    if (dist[w] < 0) {
                        dist[w] = dist[v] + 1;
                        queue[tail++] = w;
                    }
                    if (dist[w] == dist[v] + 1)
                        sigma[w] += sigma[v];
                }
            }
            // predecessors are the parents one level closer to s
            for (int i = visited - 1; i > 0; i--) {
                int w = order[i];
                for (int k = 0; k < graph.parentCount(w); k++) {
                    int v = graph.parent(w, k);
                    if (dist[v] >= 0 && dist[v] == dist[w] - 1)
                        delta[v] += sigma[v] / sigma[w] * (1 + delta[w]);
                }
                cb[w] += delta[w];
            }
        }
        return cb;
    }

    /**
     * Removes the generic (overly broad) concepts that rank among the
     * {@code topN} nodes by total degree.
     */
    public static HubPruneResult pruneGenericHubs(CausalGraph graph, Collection<String> genericNames, int topN) {
        if (topN < 0)
            throw new IllegalArgumentException("topN must be >= 0: " + topN);
        List<DegreeCentrality> all = degreeCentrality(graph);
        List<DegreeCentrality> top = all.subList(0, Math.min(topN, all.size()));
        Set<String> topIds = new HashSet<>();
        for (DegreeCentrality d : top)
            topIds.add(d.node());

        Set<String> generic = new TreeSet<>(genericNames);
        List<String> missing = new ArrayList<>();
        List<String> prune = new ArrayList<>();
        for (String name : generic) {
            if (!graph.contains(name))
                missing.add(name);
            else if (topIds.contains(name) && !name.equals(graph.exposure()) && !name.equals(graph.outcome()))
                prune.add(name);
        }
        if (!missing.isEmpty())
            log.warn("Hub pruning: {} generic names not in graph: {}", missing.size(), missing);
        log.info("Hub pruning removed {} of {} generic nodes in the top {}", prune.size(), generic.size(), topN);
        return new HubPruneResult(removeNodes(graph, prune), prune, missing, top);
    }
}
