package com.causal.dag.graph;

import java.util.BitSet;

/**
 * Reachability ("Bayes ball") d-separation.
 *
 * The walk moves over (node, direction) states: UP means the node was entered
 * from one of its children, DOWN from one of its parents. An unconditioned
 * node passes the walk on in every direction it may continue; a conditioned
 * node only bounces a DOWN walk back up to its parents, and only if it is an
 * ancestor of the conditioning set (the collider rule).
 */
final class DSeparation {
    private DSeparation() {
    }

    /**
     * @param ignore index of a node whose outgoing edges are treated as
     *               absent, or -1.
     */
    static boolean separated(CausalGraph g, int x, int y, BitSet z, int ignore) {
        int n = g.nodeCount();
        BitSet ancestorsOfZ = ancestorsOf(g, z, ignore);
        BitSet seenUp = new BitSet(n);
        BitSet seenDown = new BitSet(n);
        // encoded as node * 2 + (1 if DOWN)
        int[] queue = new int[2 * n];
        int head = 0, tail = 0;
        queue[tail++] = x * 2;
        seenUp.set(x);
        while (head < tail) {
            int state = queue[head++];
            int v = state >>> 1;
            boolean down = (state & 1) == 1;
            boolean inZ = z.get(v);
            if (v == y && !inZ)
                return false;
            if (!down) {
                if (inZ)
                    continue;
                for (int k = 0; k < g.parentCount(v); k++) {
                    int p = g.parent(v, k);
                    if (p != ignore && !seenUp.get(p)) {
                        seenUp.set(p);
                        queue[tail++] = p * 2;
                    }
                }
                if (v != ignore)
                    tail = pushChildren(g, v, seenDown, queue, tail);
            } else {
                if (!inZ && v != ignore)
                    tail = pushChildren(g, v, seenDown, queue, tail);
                if (ancestorsOfZ.get(v)) {
                    for (int k = 0; k < g.parentCount(v); k++) {
                        int p = g.parent(v, k);
                        if (p != ignore && !seenUp.get(p)) {
                            seenUp.set(p);
                            queue[tail++] = p * 2;
                        }
                    }
                }
            }
        }
        return true;
    }

    private static int pushChildren(CausalGraph g, int v, BitSet seenDown, int[] queue, int tail) {
        for (int k = 0; k < g.childCount(v); k++) {
            int c = g.child(v, k);
            if (!seenDown.get(c)) {
                seenDown.set(c);
                queue[tail++] = c * 2 + 1;
            }
        }
        return tail;
    }

    private static BitSet ancestorsOf(CausalGraph g, BitSet z, int ignore) {
        BitSet seen = (BitSet) z.clone();
        int[] queue = new int[g.nodeCount()];
        int head = 0, tail = 0;
        for (int i = z.nextSetBit(0); i >= 0; i = z.nextSetBit(i + 1))
            queue[tail++] = i;
        while (head < tail) {
            int v = queue[head++];
            for (int k = 0; k < g.parentCount(v); k++) {
                int p = g.parent(v, k);
                if (p != ignore && !seen.get(p)) {
                    seen.set(p);
                    queue[tail++] = p;
                }
            }
        }
        return seen;
    }
}
