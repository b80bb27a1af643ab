package com.causal.dag.cycle;

import com.causal.dag.api.GraphTooLargeException;
import com.causal.dag.api.StopReason;
import com.causal.dag.engine.SearchBudget;
import com.causal.dag.engine.SearchLimits;
import com.causal.dag.graph.CausalGraph;

import java.util.*;
import java.util.function.Consumer;

import lombok.extern.log4j.Log4j2;

/**
 * Cycle analysis of a causal graph: strongly connected components, exhaustive
 * elementary-cycle enumeration, shortest directed distances and the effect of
 * removing single nodes on the cycle count.
 *
 * Cycle enumeration is exponential in the worst case. It is guarded by a
 * precheck on component sizes and by the {@link SearchBudget}, which is
 * checked at every DFS step.
 */
@Log4j2
public final class CycleEngine {
    static final String STAGE = "elementary-cycles";

    private CycleEngine() {
    }

    /**
     * Tarjan's algorithm with an explicit call stack. Components are returned
     * ordered by their smallest member, members ascending.
     */
    public static List<StronglyConnectedComponent> stronglyConnectedComponents(CausalGraph graph) {
        List<int[]> raw = tarjan(graph);
        raw.sort(Comparator.comparingInt(c -> c[0]));
        List<StronglyConnectedComponent> out = new ArrayList<>(raw.size());
        for (int[] comp : raw) {
            List<String> members = new ArrayList<>(comp.length);
            for (int i : comp)
                members.add(graph.id(i));
            out.add(new StronglyConnectedComponent(out.size(), members));
        }
        return out;
    }

    public static SccSummary sccSummary(CausalGraph graph) {
        return summarize(stronglyConnectedComponents(graph));
    }

    static SccSummary summarize(List<StronglyConnectedComponent> components) {
        List<Integer> sizes = new ArrayList<>();
        int nodes = 0, largest = 0;
        for (StronglyConnectedComponent c : components) {
            largest = Math.max(largest, c.size());
            if (c.isCyclic()) {
                sizes.add(c.size());
                nodes += c.size();
            }
        }
        sizes.sort(Comparator.reverseOrder());
        return new SccSummary(sizes.size(), nodes, largest, sizes);
    }

    private static List<int[]> tarjan(CausalGraph g) {
        int n = g.nodeCount();
        int[] index = new int[n];
        int[] low = new int[n];
        Arrays.fill(index, -1);
        boolean[] onStack = new boolean[n];
        int[] stack = new int[n];
        int sp = 0;
        int[] callNode = new int[n];
        int[] callCursor = new int[n];
        int counter = 0;
        List<int[]> components = new ArrayList<>();

        for (int s = 0; s < n; s++) {
            if (index[s] != -1)
                continue;
            int top = 0;
            callNode[0] = s;
            callCursor[0] = 0;
            index[s] = low[s] = counter++;
            stack[sp++] = s;
            onStack[s] = true;

            while (top >= 0) {
                int v = callNode[top];
                int k = callCursor[top];
                if (k < g.childCount(v)) {
                    callCursor[top]++;
                    int w = g.child(v, k);
                    if (index[w] == -1) {
                        index[w] = low[w] = counter++;
                        stack[sp++] = w;
                        onStack[w] = true;
                        top++;
                        callNode[top] = w;
                        callCursor[top] = 0;
                    } else if (onStack[w]) {
                        low[v] = Math.min(low[v], index[w]);
                    }
                    continue;
                }
                top--;
                if (top >= 0) {
                    int u = callNode[top];
                    low[u] = Math.min(low[u], low[v]);
                }
                if (low[v] == index[v]) {
                    int end = sp;
                    do {
                        onStack[stack[--sp]] = false;
                    } while (stack[sp] != v);
                    int[] comp = Arrays.copyOfRange(stack, sp, end);
                    Arrays.sort(comp);
                    components.add(comp);
                }
            }
        }
        return components;
    }

    public static CycleReport enumerateElementaryCycles(CausalGraph graph, SearchLimits limits,
            SearchBudget budget) {
        return enumerateElementaryCycles(graph, limits, budget, null);
    }

    /**
     * Enumerates every elementary cycle once, per cyclic component.
     *
     * @param consumer receives each record as it is found; may be null.
     * @throws GraphTooLargeException if a component exceeds
     *                                {@code maxCycleSccNodes} nodes or
     *                                {@code maxCycleSccEdges} edges.
     */
    public static CycleReport enumerateElementaryCycles(CausalGraph graph, SearchLimits limits,
            SearchBudget budget, Consumer<CycleRecord> consumer) {
        List<StronglyConnectedComponent> components = stronglyConnectedComponents(graph);
        SccSummary summary = summarize(components);

        List<StronglyConnectedComponent> cyclic = new ArrayList<>();
        List<int[][]> adjacency = new ArrayList<>();
        List<Integer> edgeCounts = new ArrayList<>();
        for (StronglyConnectedComponent c : components) {
            if (!c.isCyclic())
                continue;
            int[][] adj = localAdjacency(graph, c);
            int edges = 0;
            for (int[] row : adj)
                edges += row.length;
            cyclic.add(c);
            adjacency.add(adj);
            edgeCounts.add(edges);
        }
        precheck(summary, cyclic, edgeCounts, limits);

        long[] participation = new long[graph.nodeCount()];
        TreeMap<Integer, Long> histogram = new TreeMap<>();
        List<CycleRecord> samples = new ArrayList<>();
        long total = 0;

        budget.beginStage(STAGE);
        search: for (int ci = 0; ci < cyclic.size(); ci++) {
            StronglyConnectedComponent comp = cyclic.get(ci);
            int[][] adj = adjacency.get(ci);
            int m = adj.length;
            int[] path = new int[m];
            int[] cursor = new int[m];
            BitSet onPath = new BitSet(m);

            for (int s = 0; s < m; s++) {
                int depth = 0;
                path[0] = s;
                cursor[0] = 0;
                onPath.set(s);
                while (depth >= 0) {
                    if (!budget.checkpoint(total))
                        break search;
                    int u = path[depth];
                    int k = cursor[depth]++;
                    if (k >= adj[u].length) {
                        onPath.clear(u);
                        depth--;
                        continue;
                    }
                    int w = adj[u][k];
                    if (w == s) {
                        if (depth >= 1) {
                            List<String> nodes = new ArrayList<>(depth + 1);
                            for (int i = 0; i <= depth; i++) {
                                String id = comp.members().get(path[i]);
                                nodes.add(id);
                                participation[graph.index(id)]++;
                            }
                            CycleRecord record = new CycleRecord(comp.id(), nodes);
                            total++;
                            histogram.merge(record.length(), 1L, Long::sum);
                            if (samples.size() < limits.maxCyclesToSample())
                                samples.add(record);
                            if (consumer != null)
                                consumer.accept(record);
                        }
                        continue;
                    }
                    if (w < s || onPath.get(w))
                        continue;
                    depth++;
                    path[depth] = w;
                    cursor[depth] = 0;
                    onPath.set(w);
                }
            }
        }
        StopReason stop = budget.endStage();

        List<CycleReport.NodeParticipation> ranking = new ArrayList<>();
        for (int i = 0; i < participation.length; i++)
            if (participation[i] > 0)
                ranking.add(new CycleReport.NodeParticipation(graph.id(i), participation[i]));
        ranking.sort(Comparator.comparingLong(CycleReport.NodeParticipation::cycles).reversed()
                .thenComparing(CycleReport.NodeParticipation::node));

        log.info("Found {} elementary cycles in {} cyclic components ({} nodes){}", total, cyclic.size(),
                summary.nodesInCyclicComponents(), stop.completed() ? "" : ", stopped early: " + stop);
        return new CycleReport(total, ranking, histogram, samples, summary, stop.completed(), stop);
    }

    /** Children of each member restricted to the component, as local indices. */
    private static int[][] localAdjacency(CausalGraph graph, StronglyConnectedComponent comp) {
        Map<Integer, Integer> local = new HashMap<>();
        for (String id : comp.members())
            local.put(graph.index(id), local.size());
        int[][] adj = new int[comp.size()][];
        for (String id : comp.members()) {
            int g = graph.index(id);
            int[] row = new int[graph.childCount(g)];
            int len = 0;
            for (int k = 0; k < graph.childCount(g); k++) {
                Integer w = local.get(graph.child(g, k));
                if (w != null)
                    row[len++] = w;
            }
            adj[local.get(g)] = Arrays.copyOf(row, len);
        }
        return adj;
    }

    private static void precheck(SccSummary summary, List<StronglyConnectedComponent> cyclic,
            List<Integer> edgeCounts, SearchLimits limits) {
        for (int i = 0; i < cyclic.size(); i++) {
            int nodes = cyclic.get(i).size();
            int edges = edgeCounts.get(i);
            if (nodes > limits.maxCycleSccNodes() || edges > limits.maxCycleSccEdges()) {
                Map<String, Object> stats = new LinkedHashMap<>();
                stats.put("cyclicSccSizes", summary.cyclicSizes());
                stats.put("sccNodes", nodes);
                stats.put("sccEdges", edges);
                if (nodes > limits.maxCycleSccNodes())
                    throw new GraphTooLargeException("elementary-cycle enumeration", nodes,
                            limits.maxCycleSccNodes(), stats);
                throw new GraphTooLargeException("elementary-cycle enumeration", edges, limits.maxCycleSccEdges(),
                        stats);
            }
        }
    }

    /** Size, density, connectivity and exposure/outcome reachability. */
    public static GraphStatistics graphStatistics(CausalGraph graph) {
        int n = graph.nodeCount(), e = graph.edgeCount();
        List<StronglyConnectedComponent> components = stronglyConnectedComponents(graph);
        SccSummary summary = summarize(components);
        double density = n > 1 ? (double) e / ((double) n * (n - 1)) : 0;
        Map<String, Integer> fromExposure = shortestDistancesFrom(graph, graph.exposure());
        Integer distance = fromExposure.get(graph.outcome());
        return new GraphStatistics(n, e, density, weaklyConnected(graph), components.size() == 1,
                summary.isAcyclic(), components.size(), distance != null,
                graph.descendants(graph.outcome()).contains(graph.exposure()), distance == null ? -1 : distance);
    }

    private static boolean weaklyConnected(CausalGraph graph) {
        int n = graph.nodeCount();
        boolean[] seen = new boolean[n];
        int[] queue = new int[n];
        int head = 0, tail = 0;
        queue[tail++] = 0;
        seen[0] = true;
        while (head < tail) {
            int v = queue[head++];
            int cc = graph.childCount(v);
            for (int k = 0; k < cc + graph.parentCount(v); k++) {
                int w = k < cc ? graph.child(v, k) : graph.parent(v, k - cc);
                if (!seen[w]) {
                    seen[w] = true;
                    queue[tail++] = w;
                }
            }
        }
        return tail == n;
    }

    /**
     * Directed BFS distances (edge counts) from {@code source}. Only reachable
     * nodes appear, the source with distance 0.
     */
    public static Map<String, Integer> shortestDistancesFrom(CausalGraph graph, String source) {
        int n = graph.nodeCount();
        int[] dist = new int[n];
        Arrays.fill(dist, -1);
        int[] queue = new int[n];
        int head = 0, tail = 0;
        int s = graph.index(source);
        dist[s] = 0;
        queue[tail++] = s;
        while (head < tail) {
            int v = queue[head++];
            for (int k = 0; k < graph.childCount(v); k++) {
                int w = graph.child(v, k);
                if (dist[w] == -1) {
                    dist[w] = dist[v] + 1;
                    queue[tail++] = w;
                }
            }
        }
        Map<String, Integer> out = new TreeMap<>();
        for (int i = 0; i < n; i++)
            if (dist[i] >= 0)
                out.put(graph.id(i), dist[i]);
        return out;
    }

    /**
     * Counts cycles after removing each candidate on its own.
     */
    public static NodeRemovalImpact nodeRemovalImpact(CausalGraph graph, Collection<String> candidates,
            SearchLimits limits, SearchBudget budget) {
        CycleReport base = enumerateElementaryCycles(graph, limits, budget);
        boolean completed = base.completed();
        List<NodeRemovalImpact.Entry> entries = new ArrayList<>();
        List<String> missing = new ArrayList<>();
        List<String> skipped = new ArrayList<>();
        for (String node : candidates) {
            if (!graph.contains(node)) {
                log.warn("Node removal impact: '{}' is not in the graph", node);
                missing.add(node);
                continue;
            }
            if (node.equals(graph.exposure()) || node.equals(graph.outcome())) {
                skipped.add(node);
                continue;
            }
            CausalGraph reduced = graph.toBuilder().removeNode(node).build();
            CycleReport after = enumerateElementaryCycles(reduced, limits, budget);
            completed &= after.completed();
            double reduction = base.totalCycles() == 0 ? 0.0
                    : 100.0 * (base.totalCycles() - after.totalCycles()) / base.totalCycles();
            entries.add(new NodeRemovalImpact.Entry(node, after.totalCycles(), reduction, after.sccSummary()));
        }
        return new NodeRemovalImpact(base.totalCycles(), base.sccSummary(), entries, missing, skipped, completed);
    }
}
