package com.causal.dag.cycle;

import com.causal.dag.api.StopReason;

import java.util.Collections;
import java.util.List;
import java.util.SortedMap;
import java.util.TreeMap;

/**
 * Aggregated result of elementary-cycle enumeration.
 *
 * @param totalCycles     number of cycles found.
 * @param ranking         nodes on at least one cycle, by participation
 *                        descending then id.
 * @param lengthHistogram cycle length to number of cycles.
 * @param sampledCycles   the first cycles found, up to the sample cap.
 * @param sccSummary      component profile of the analyzed graph.
 * @param completed       false if the enumeration stopped early; counts are
 *                        then lower bounds.
 */
public record CycleReport(
        long totalCycles,
        List<NodeParticipation> ranking,
        SortedMap<Integer, Long> lengthHistogram,
        List<CycleRecord> sampledCycles,
        SccSummary sccSummary,
        boolean completed,
        StopReason stopReason) {

    /** How many cycles pass through one node. */
    public record NodeParticipation(String node, long cycles) {
    }

    public CycleReport {
        ranking = List.copyOf(ranking);
        lengthHistogram = Collections.unmodifiableSortedMap(new TreeMap<>(lengthHistogram));
        sampledCycles = List.copyOf(sampledCycles);
    }

    /** Number of cycles through {@code node}, 0 if none. */
    public long participation(String node) {
        for (NodeParticipation p : ranking)
            if (p.node().equals(node))
                return p.cycles();
        return 0;
    }
}
