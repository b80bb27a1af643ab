package com.causal.dag.graph;

import com.causal.dag.api.InvalidGraphException;
import com.fasterxml.jackson.annotation.JsonValue;

import java.util.*;
import java.util.concurrent.ConcurrentHashMap;

import lombok.extern.log4j.Log4j2;

/**
 * Immutable directed causal graph with one exposure and one outcome node.
 *
 * Data layout:
 * Node ids are sorted ascending and addressed by their position in that order
 * (the node index). Adjacency is stored in compressed sparse row form, once
 * for children and once for parents:
 * - childrenOffset[i] .. childrenOffset[i+1] delimits node i's children in
 * childrenList (likewise for parents).
 * - Neighbour lists are sorted by index, so every traversal visits nodes in id
 * order and every derived report is deterministic.
 *
 * parents(n) and children(n) are O(1) lookups after an O(V+E) build.
 *
 * Ancestor and descendant closures are memoized per node in maps owned by this
 * instance. A graph never changes after construction; every structural edit
 * goes through {@link #toBuilder()} and yields a new instance with an empty
 * memo.
 *
 * Normalization: self-loop edges are dropped while building (one WARN line
 * per loop, count exposed by {@link #droppedSelfLoops()}); duplicate edges
 * collapse because the edge list is a set.
 */
@Log4j2
public final class CausalGraph {
    private final String[] ids;
    private final Map<String, Integer> index;
    private final List<String> nodeList;

    private final int[] childrenOffset;
    private final int[] childrenList;
    private final int[] parentsOffset;
    private final int[] parentsList;

    private final int exposure;
    private final int outcome;
    private final int droppedSelfLoops;

    private final Map<Integer, BitSet> ancestorMemo = new ConcurrentHashMap<>();
    private final Map<Integer, BitSet> descendantMemo = new ConcurrentHashMap<>();

    private CausalGraph(String[] ids, Map<String, Integer> index, int[] childrenOffset, int[] childrenList,
            int[] parentsOffset, int[] parentsList, int exposure, int outcome, int droppedSelfLoops) {
        this.ids = ids;
        this.index = index;
        this.nodeList = List.of(ids);
        this.childrenOffset = childrenOffset;
        this.childrenList = childrenList;
        this.parentsOffset = parentsOffset;
        this.parentsList = parentsList;
        this.exposure = exposure;
        this.outcome = outcome;
        this.droppedSelfLoops = droppedSelfLoops;
    }

    /**
     * Builds a graph from node ids, directed edges and the exposure/outcome
     * designation.
     *
     * @throws InvalidGraphException if the graph is empty, an edge names an
     *                               unknown node, or exposure/outcome are
     *                               missing, equal or not nodes of the graph.
     */
    public static CausalGraph build(Collection<String> nodes, Collection<Edge> edges, String exposure,
            String outcome) {
        return builder().addNodes(nodes).addEdges(edges).exposure(exposure).outcome(outcome).build();
    }

    public static Builder builder() {
        return new Builder();
    }

    /** Returns a builder seeded with this graph's nodes, edges and designation. */
    public Builder toBuilder() {
        Builder b = new Builder().addNodes(nodeList);
        for (int i = 0; i < ids.length; i++)
            for (int k = childrenOffset[i]; k < childrenOffset[i + 1]; k++)
                b.addEdge(ids[i], ids[childrenList[k]]);
        return b.exposure(exposure()).outcome(outcome());
    }

    // ── Identity and size ────────────────────────────────────────

    public int nodeCount() {
        return ids.length;
    }

    public int edgeCount() {
        return childrenList.length;
    }

    /** All node ids, ascending. */
    public List<String> nodes() {
        return nodeList;
    }

    /** All edges, ordered by source then target id. */
    public List<Edge> edges() {
        List<Edge> edges = new ArrayList<>(childrenList.length);
        for (int i = 0; i < ids.length; i++)
            for (int k = childrenOffset[i]; k < childrenOffset[i + 1]; k++)
                edges.add(new Edge(ids[i], ids[childrenList[k]]));
        return edges;
    }

    public String exposure() {
        return ids[exposure];
    }

    public String outcome() {
        return ids[outcome];
    }

    /** Number of self-loop edges dropped while this graph was built. */
    public int droppedSelfLoops() {
        return droppedSelfLoops;
    }

    public boolean contains(String node) {
        return index.containsKey(node);
    }

    public boolean hasEdge(String from, String to) {
        Integer f = index.get(from), t = index.get(to);
        if (f == null || t == null)
            return false;
        return Arrays.binarySearch(childrenList, childrenOffset[f], childrenOffset[f + 1], t) >= 0;
    }

    // ── Index-level access (hot paths of the search algorithms) ──

    /** Resolves a node id to its index. */
    public int index(String node) {
        Integer idx = index.get(node);
        if (idx == null)
            throw new InvalidGraphException("Unknown node: " + node);
        return idx;
    }

    public String id(int idx) {
        return ids[idx];
    }

    public int childCount(int idx) {
        return childrenOffset[idx + 1] - childrenOffset[idx];
    }

    public int child(int idx, int k) {
        return childrenList[childrenOffset[idx] + k];
    }

    public int parentCount(int idx) {
        return parentsOffset[idx + 1] - parentsOffset[idx];
    }

    public int parent(int idx, int k) {
        return parentsList[parentsOffset[idx] + k];
    }

    // ── Adjacency ────────────────────────────────────────────────

    public List<String> parents(String node) {
        int i = index(node);
        List<String> out = new ArrayList<>(parentCount(i));
        for (int k = parentsOffset[i]; k < parentsOffset[i + 1]; k++)
            out.add(ids[parentsList[k]]);
        return out;
    }

    public List<String> children(String node) {
        int i = index(node);
        List<String> out = new ArrayList<>(childCount(i));
        for (int k = childrenOffset[i]; k < childrenOffset[i + 1]; k++)
            out.add(ids[childrenList[k]]);
        return out;
    }

    public int inDegree(String node) {
        return parentCount(index(node));
    }

    public int outDegree(String node) {
        return childCount(index(node));
    }

    /** Total degree: in-degree plus out-degree. */
    public int degree(String node) {
        int i = index(node);
        return parentCount(i) + childCount(i);
    }

    // ── Reachability closures ────────────────────────────────────

    /** Ancestors of {@code node}, including the node itself, ascending. */
    public SortedSet<String> ancestors(String node) {
        return names(ancestorMask(index(node)));
    }

    /** Descendants of {@code node}, including the node itself, ascending. */
    public SortedSet<String> descendants(String node) {
        return names(descendantMask(index(node)));
    }

    /**
     * Memoized ancestor closure as a bit mask over node indices. Shared with
     * the memo: callers must not modify it.
     */
    BitSet ancestorMask(int idx) {
        return ancestorMemo.computeIfAbsent(idx, i -> closure(i, parentsOffset, parentsList));
    }

    /** Memoized descendant closure; see {@link #ancestorMask(int)}. */
    BitSet descendantMask(int idx) {
        return descendantMemo.computeIfAbsent(idx, i -> closure(i, childrenOffset, childrenList));
    }

    private BitSet closure(int start, int[] offset, int[] list) {
        BitSet seen = new BitSet(ids.length);
        int[] queue = new int[ids.length];
        int head = 0, tail = 0;
        seen.set(start);
        queue[tail++] = start;
        while (head < tail) {
            int curr = queue[head++];
            for (int k = offset[curr]; k < offset[curr + 1]; k++) {
                int next = list[k];
                if (!seen.get(next)) {
                    seen.set(next);
                    queue[tail++] = next;
                }
            }
        }
        return seen;
    }

    SortedSet<String> names(BitSet mask) {
        TreeSet<String> out = new TreeSet<>();
        for (int i = mask.nextSetBit(0); i >= 0; i = mask.nextSetBit(i + 1))
            out.add(ids[i]);
        return Collections.unmodifiableSortedSet(out);
    }

    // ── Paths and blocking ───────────────────────────────────────

    /**
     * All simple paths between two nodes in the skeleton (edge direction is
     * recorded on each step, not followed). The returned sequence is lazy and
     * restartable: each call to {@code iterator()} starts a fresh search.
     * Exponential in the worst case; bound it with {@code maxLength}.
     *
     * @param maxLength longest path in edges; 0 or less means unbounded.
     */
    public SimplePaths allSimplePaths(String from, String to, int maxLength) {
        return new SimplePaths(this, index(from), index(to), maxLength, false);
    }

    /** Like {@link #allSimplePaths} but following edge direction only. */
    public SimplePaths directedPaths(String from, String to, int maxLength) {
        return new SimplePaths(this, index(from), index(to), maxLength, true);
    }

    /**
     * Whether {@code path} is open given conditioning set {@code z}. A
     * non-collider interior node blocks the path iff it is in {@code z}; a
     * collider blocks it iff neither it nor any of its descendants is in
     * {@code z}.
     */
    public boolean isPathOpen(Path path, Collection<String> z) {
        Set<String> conditioned = z instanceof Set<String> s ? s : new HashSet<>(z);
        List<String> nodes = path.nodes();
        for (int i = 1; i < nodes.size() - 1; i++) {
            String v = nodes.get(i);
            if (path.isColliderAt(i)) {
                if (!conditioned.contains(v) && !anyIn(descendantMask(index(v)), conditioned))
                    return false;
            } else if (conditioned.contains(v)) {
                return false;
            }
        }
        return true;
    }

    private boolean anyIn(BitSet mask, Set<String> nodes) {
        for (String n : nodes) {
            Integer i = index.get(n);
            if (i != null && mask.get(i))
                return true;
        }
        return false;
    }

    /** Whether {@code x} and {@code y} are d-separated given {@code z}. */
    public boolean dSeparated(String x, String y, Collection<String> z) {
        return DSeparation.separated(this, index(x), index(y), mask(z), -1);
    }

    /**
     * Whether {@code x} and {@code y} are d-separated given {@code z} in the
     * graph with every edge leaving {@code ignoreOutgoingOf} removed. With
     * {@code ignoreOutgoingOf = x} this is the backdoor test: only paths that
     * start with an edge into {@code x} remain.
     */
    public boolean dSeparated(String x, String y, Collection<String> z, String ignoreOutgoingOf) {
        return DSeparation.separated(this, index(x), index(y), mask(z), index(ignoreOutgoingOf));
    }

    BitSet mask(Collection<String> nodes) {
        BitSet mask = new BitSet(ids.length);
        for (String n : nodes)
            mask.set(index(n));
        return mask;
    }

    // ── Derived graphs ───────────────────────────────────────────

    /**
     * The subgraph induced by {@code keep}. It must contain the exposure and
     * the outcome.
     */
    public CausalGraph inducedSubgraph(Collection<String> keep) {
        Set<String> kept = new HashSet<>(keep);
        for (String n : kept)
            index(n);
        Builder b = builder().addNodes(new TreeSet<>(kept)).exposure(exposure()).outcome(outcome());
        for (Edge e : edges())
            if (kept.contains(e.from()) && kept.contains(e.to()))
                b.addEdge(e);
        return b.build();
    }

    @JsonValue
    public Map<String, Object> toMap() {
        Map<String, Object> m = new LinkedHashMap<>();
        m.put("exposure", exposure());
        m.put("outcome", outcome());
        m.put("nodes", nodeList);
        m.put("edges", edges());
        return m;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o)
            return true;
        if (!(o instanceof CausalGraph other))
            return false;
        return exposure == other.exposure && outcome == other.outcome
                && Arrays.equals(ids, other.ids)
                && Arrays.equals(childrenOffset, other.childrenOffset)
                && Arrays.equals(childrenList, other.childrenList);
    }

    @Override
    public int hashCode() {
        return Objects.hash(Arrays.hashCode(ids), Arrays.hashCode(childrenList), exposure, outcome);
    }

    @Override
    public String toString() {
        return "CausalGraph(" + ids.length + " nodes, " + childrenList.length + " edges, exposure="
                + exposure() + ", outcome=" + outcome() + ")";
    }

    /**
     * Builder for constructing a CausalGraph.
     * Handles normalization and validation.
     */
    public static final class Builder {
        private final Set<String> nodes = new LinkedHashSet<>();
        private final Set<Edge> edges = new LinkedHashSet<>();
        private String exposure;
        private String outcome;
        private int droppedSelfLoops;

        public Builder addNode(String node) {
            nodes.add(Objects.requireNonNull(node, "node"));
            return this;
        }

        public Builder addNodes(Collection<String> ids) {
            for (String id : ids)
                addNode(id);
            return this;
        }

        public Builder addEdge(String from, String to) {
            return addEdge(new Edge(from, to));
        }

        public Builder addEdge(Edge edge) {
            if (edge.isSelfLoop()) {
                log.warn("Dropping self-loop edge {}", edge);
                droppedSelfLoops++;
                return this;
            }
            edges.add(edge);
            return this;
        }

        public Builder addEdges(Collection<Edge> list) {
            for (Edge e : list)
                addEdge(e);
            return this;
        }

        /** Removes a node and every edge incident to it. */
        public Builder removeNode(String node) {
            nodes.remove(node);
            edges.removeIf(e -> e.from().equals(node) || e.to().equals(node));
            return this;
        }

        /** Removes an edge; returns whether it was present. */
        public boolean removeEdge(String from, String to) {
            return edges.remove(new Edge(from, to));
        }

        public boolean hasEdge(String from, String to) {
            return edges.contains(new Edge(from, to));
        }

        public Builder exposure(String node) {
            if (exposure != null && !exposure.equals(node))
                throw new InvalidGraphException("Exposure already designated as '" + exposure + "', got '" + node + "'");
            this.exposure = node;
            return this;
        }

        public Builder outcome(String node) {
            if (outcome != null && !outcome.equals(node))
                throw new InvalidGraphException("Outcome already designated as '" + outcome + "', got '" + node + "'");
            this.outcome = node;
            return this;
        }

        /**
         * Validates and compiles the graph.
         */
        public CausalGraph build() {
            if (nodes.isEmpty())
                throw new InvalidGraphException("Graph is empty");
            if (exposure == null)
                throw new InvalidGraphException("No exposure node designated");
            if (outcome == null)
                throw new InvalidGraphException("No outcome node designated");
            if (exposure.equals(outcome))
                throw new InvalidGraphException("Exposure and outcome must differ: " + exposure);
            if (!nodes.contains(exposure))
                throw new InvalidGraphException("Exposure '" + exposure + "' is not a node of the graph");
            if (!nodes.contains(outcome))
                throw new InvalidGraphException("Outcome '" + outcome + "' is not a node of the graph");

            // 1. Assign indices in id order
            String[] sorted = nodes.toArray(new String[0]);
            Arrays.sort(sorted);
            int n = sorted.length;
            Map<String, Integer> idx = new HashMap<>(n * 2);
            for (int i = 0; i < n; i++)
                idx.put(sorted[i], i);

            // 2. Count degrees
            int[] outDeg = new int[n], inDeg = new int[n];
            int[][] resolved = new int[edges.size()][];
            int e = 0;
            for (Edge edge : edges) {
                Integer f = idx.get(edge.from()), t = idx.get(edge.to());
                if (f == null)
                    throw new InvalidGraphException("Edge " + edge + " references unknown node '" + edge.from() + "'");
                if (t == null)
                    throw new InvalidGraphException("Edge " + edge + " references unknown node '" + edge.to() + "'");
                resolved[e++] = new int[] { f, t };
                outDeg[f]++;
                inDeg[t]++;
            }

            // 3. Build CSR structures, neighbours sorted by index
            int[] cOff = new int[n + 1], pOff = new int[n + 1];
            for (int i = 0; i < n; i++) {
                cOff[i + 1] = cOff[i] + outDeg[i];
                pOff[i + 1] = pOff[i] + inDeg[i];
            }
            int[] cList = new int[resolved.length], pList = new int[resolved.length];
            int[] cFill = Arrays.copyOf(cOff, n), pFill = Arrays.copyOf(pOff, n);
            for (int[] r : resolved) {
                cList[cFill[r[0]]++] = r[1];
                pList[pFill[r[1]]++] = r[0];
            }
            for (int i = 0; i < n; i++) {
                Arrays.sort(cList, cOff[i], cOff[i + 1]);
                Arrays.sort(pList, pOff[i], pOff[i + 1]);
            }
            return new CausalGraph(sorted, idx, cOff, cList, pOff, pList, idx.get(exposure), idx.get(outcome),
                    droppedSelfLoops);
        }
    }
}
