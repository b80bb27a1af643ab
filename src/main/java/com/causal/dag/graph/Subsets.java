package com.causal.dag.graph;

import java.util.ArrayList;
import java.util.Iterator;
import java.util.List;
import java.util.NoSuchElementException;

/**
 * Subsets of a sorted candidate list in (size, lexicographic) order, up to a
 * maximum size. Lazy and restartable.
 */
final class Subsets implements Iterable<AdjustmentSet> {
    private final List<String> candidates;
    private final int maxSize;

    Subsets(List<String> candidates, int maxSize) {
        this.candidates = List.copyOf(candidates);
        this.maxSize = Math.min(maxSize, candidates.size());
    }

    /**
     * Number of subsets of size 0..maxSize, saturating at Long.MAX_VALUE.
     */
    static long count(int n, int maxSize) {
        long total = 0;
        long binom = 1;
        for (int k = 0; k <= Math.min(n, maxSize); k++) {
            if (k > 0) {
                // C(n,k) = C(n,k-1) * (n-k+1) / k, exact at every step
                long num = n - k + 1;
                if (binom > Long.MAX_VALUE / num)
                    return Long.MAX_VALUE;
                binom = binom * num / k;
            }
            if (total > Long.MAX_VALUE - binom)
                return Long.MAX_VALUE;
            total += binom;
        }
        return total;
    }

    @Override
    public Iterator<AdjustmentSet> iterator() {
        return new Iterator<>() {
            private int size = 0;
            private int[] idx = new int[0];
            private boolean exhausted = false;

            @Override
            public boolean hasNext() {
                return !exhausted;
            }

            @Override
            public AdjustmentSet next() {
                if (exhausted)
                    throw new NoSuchElementException();
                List<String> members = new ArrayList<>(size);
                for (int i : idx)
                    members.add(candidates.get(i));
                AdjustmentSet out = AdjustmentSet.of(members);
                step();
                return out;
            }

            private void step() {
                int n = candidates.size();
                int i = size - 1;
                while (i >= 0 && idx[i] == n - size + i)
                    i--;
                if (i >= 0) {
                    idx[i]++;
                    for (int j = i + 1; j < size; j++)
                        idx[j] = idx[j - 1] + 1;
                    return;
                }
                size++;
                if (size > maxSize) {
                    exhausted = true;
                    return;
                }
                idx = new int[size];
                for (int j = 0; j < size; j++)
                    idx[j] = j;
            }
        };
    }
}
