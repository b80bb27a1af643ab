package com.causal.dag.graph;

import java.util.ArrayList;
import java.util.BitSet;
import java.util.Iterator;
import java.util.List;
import java.util.NoSuchElementException;

/**
 * Lazy simple-path enumeration by explicit-stack DFS.
 * Each {@link #iterator()} call restarts the search from scratch.
 */
public final class SimplePaths implements Iterable<Path> {
    private final CausalGraph graph;
    private final int from;
    private final int to;
    private final int maxLength;
    private final boolean directed;

    SimplePaths(CausalGraph graph, int from, int to, int maxLength, boolean directed) {
        this.graph = graph;
        this.from = from;
        this.to = to;
        this.maxLength = maxLength > 0 ? maxLength : Integer.MAX_VALUE;
        this.directed = directed;
    }

    @Override
    public Cursor iterator() {
        return new Cursor();
    }

    /** Iterator that also reports whether the length bound hid any path. */
    public final class Cursor implements Iterator<Path> {
        private final int n = graph.nodeCount();
        private final int[] stack = new int[n];
        private final int[] cursor = new int[n];
        private final boolean[] forward = new boolean[n];
        private final BitSet onPath = new BitSet(n);
        private int depth;
        private Path next;

        private boolean lengthCapped;

        private Cursor() {
            if (from == to) {
                depth = -1;
            } else {
                stack[0] = from;
                onPath.set(from);
            }
        }

        @Override
        public boolean hasNext() {
            if (next == null)
                next = advance();
            return next != null;
        }

        @Override
        public Path next() {
            if (!hasNext())
                throw new NoSuchElementException();
            Path p = next;
            next = null;
            return p;
        }

        private Path advance() {
            while (depth >= 0) {
                int u = stack[depth];
                int k = cursor[depth]++;
                int cc = graph.childCount(u);
                int total = directed ? cc : cc + graph.parentCount(u);
                if (k >= total) {
                    onPath.clear(u);
                    depth--;
                    continue;
                }
                boolean fwd = k < cc;
                int w = fwd ? graph.child(u, k) : graph.parent(u, k - cc);
                if (onPath.get(w))
                    continue;
                // depth edges so far, the step to w makes depth + 1
                if (w == to) {
                    if (depth + 1 <= maxLength)
                        return emit(w, fwd);
                    lengthCapped = true;
                    continue;
                }
                if (depth + 2 > maxLength) {
                    if (!lengthCapped && reachesTargetOffPath(w))
                        lengthCapped = true;
                    continue;
                }
                forward[depth] = fwd;
                depth++;
                stack[depth] = w;
                cursor[depth] = 0;
                onPath.set(w);
            }
            return null;
        }

        /**
         * True once the search has skipped a path to the target because it
         * exceeds the length bound. Final only after the iterator is
         * exhausted.
         */
        public boolean lengthCapped() {
            return lengthCapped;
        }

        // BFS from w to the target avoiding the current path
        private boolean reachesTargetOffPath(int w) {
            int[] queue = new int[n];
            BitSet seen = (BitSet) onPath.clone();
            int head = 0, tail = 0;
            queue[tail++] = w;
            seen.set(w);
            while (head < tail) {
                int u = queue[head++];
                if (u == to)
                    return true;
                int cc = graph.childCount(u);
                int total = directed ? cc : cc + graph.parentCount(u);
                for (int k = 0; k < total; k++) {
                    int v = k < cc ? graph.child(u, k) : graph.parent(u, k - cc);
                    if (!seen.get(v)) {
                        seen.set(v);
                        queue[tail++] = v;
                    }
                }
            }
            return false;
        }

        private Path emit(int last, boolean lastForward) {
            List<String> nodes = new ArrayList<>(depth + 2);
            List<Path.Step> steps = new ArrayList<>(depth + 1);
            for (int i = 0; i <= depth; i++) {
                nodes.add(graph.id(stack[i]));
                if (i < depth)
                    steps.add(forward[i] ? Path.Step.FORWARD : Path.Step.BACKWARD);
            }
            nodes.add(graph.id(last));
            steps.add(lastForward ? Path.Step.FORWARD : Path.Step.BACKWARD);
            return new Path(nodes, steps);
        }
    }
}
