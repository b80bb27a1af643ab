package com.causal.dag.confounder;

import com.causal.dag.cycle.CycleEngine;
import com.causal.dag.graph.CausalGraph;

import java.util.*;

import lombok.extern.log4j.Log4j2;

/**
 * Finds the common parents of exposure and outcome and classifies each by the
 * feedback loops it closes. A parent that exposure or outcome can reach back
 * through a directed path is not a clean confounder: adjusting for it
 * conditions on a consequence of the treatment or of the outcome.
 */
@Log4j2
public final class ConfounderDiscovery {
    public static final int DEFAULT_TIGHT_FEEDBACK_MAX_LENGTH = 3;

    private final int tightFeedbackMaxLength;

    public ConfounderDiscovery() {
        this(DEFAULT_TIGHT_FEEDBACK_MAX_LENGTH);
    }

    public ConfounderDiscovery(int tightFeedbackMaxLength) {
        if (tightFeedbackMaxLength < 2)
            throw new IllegalArgumentException("tightFeedbackMaxLength must be >= 2: " + tightFeedbackMaxLength);
        this.tightFeedbackMaxLength = tightFeedbackMaxLength;
    }

    public ConfounderReport discover(CausalGraph graph) {
        String x = graph.exposure(), y = graph.outcome();
        Set<String> common = new TreeSet<>(graph.parents(x));
        common.retainAll(graph.parents(y));

        Map<String, Integer> fromX = CycleEngine.shortestDistancesFrom(graph, x);
        Map<String, Integer> fromY = CycleEngine.shortestDistancesFrom(graph, y);

        List<ConfounderCandidate> out = new ArrayList<>();
        for (String c : common) {
            int distA = fromX.getOrDefault(c, ConfounderCandidate.UNREACHABLE);
            int distY = fromY.getOrDefault(c, ConfounderCandidate.UNREACHABLE);
            int lenA = loopLength(distA), lenY = loopLength(distY);
            int minLen = Math.min(lenA, lenY);
            out.add(new ConfounderCandidate(c, distA, distY, lenA, lenY, minLen, graph.hasEdge(x, c),
                    graph.hasEdge(y, c), classify(minLen)));
        }
        out.sort(Comparator.comparingInt(ConfounderCandidate::minCycleLength)
                .thenComparing(ConfounderCandidate::node));

        ConfounderReport report = new ConfounderReport(x, y, out);
        log.info("Confounder discovery for {} -> {}: {} common parents, {} valid for adjustment", x, y,
                out.size(), report.validForAdjustment().size());
        return report;
    }

    FeedbackClass classify(int minCycleLength) {
        if (minCycleLength == ConfounderCandidate.UNREACHABLE)
            return FeedbackClass.PURE_CONFOUNDER;
        if (minCycleLength <= tightFeedbackMaxLength)
            return FeedbackClass.TIGHT_FEEDBACK;
        return FeedbackClass.LONG_FEEDBACK;
    }

    private static int loopLength(int dist) {
        return dist == ConfounderCandidate.UNREACHABLE ? ConfounderCandidate.UNREACHABLE : dist + 1;
    }

    /**
     * The subgraph induced by {@code candidate}, exposure, outcome and the
     * nodes on one shortest directed return path from exposure and from
     * outcome to the candidate.
     */
    public CausalGraph candidateSubgraph(CausalGraph graph, String candidate) {
        Set<String> keep = new TreeSet<>();
        keep.add(candidate);
        keep.add(graph.exposure());
        keep.add(graph.outcome());
        keep.addAll(shortestPath(graph, graph.exposure(), candidate));
        keep.addAll(shortestPath(graph, graph.outcome(), candidate));
        return graph.inducedSubgraph(keep);
    }

    /** One shortest directed path, smallest ids preferred; empty if none. */
    static List<String> shortestPath(CausalGraph graph, String from, String to) {
        int n = graph.nodeCount();
        int s = graph.index(from), t = graph.index(to);
        int[] pred = new int[n];
        Arrays.fill(pred, -2);
        pred[s] = -1;
        ArrayDeque<Integer> queue = new ArrayDeque<>();
        queue.add(s);
        while (!queue.isEmpty() && pred[t] == -2) {
            int v = queue.poll();
            for (int k = 0; k < graph.childCount(v); k++) {
                int w = graph.child(v, k);
                if (pred[w] == -2) {
                    pred[w] = v;
                    queue.add(w);
                }
            }
        }
        if (pred[t] == -2)
            return List.of();
        LinkedList<String> path = new LinkedList<>();
        for (int v = t; v != -1; v = pred[v])
            path.addFirst(graph.id(v));
        return path;
    }
}
