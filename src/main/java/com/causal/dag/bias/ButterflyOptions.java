package com.causal.dag.bias;

import com.causal.dag.graph.AdjustmentSet;

import java.util.*;

/**
 * Cartesian product of the local options of each butterfly node, each
 * combination unioned with the fixed confounders. Odometer order over the
 * option lists; repeated sets are skipped. Lazy and restartable.
 */
final class ButterflyOptions implements Iterable<AdjustmentSet> {
    private final List<List<AdjustmentSet>> options;
    private final List<String> fixed;

    ButterflyOptions(List<List<AdjustmentSet>> options, List<String> fixed) {
        this.options = List.copyOf(options);
        this.fixed = List.copyOf(fixed);
    }

    @Override
    public Iterator<AdjustmentSet> iterator() {
        return new Iterator<>() {
            private final int[] digits = new int[options.size()];
            private final Set<AdjustmentSet> seen = new HashSet<>();
            private boolean exhausted;
            private AdjustmentSet next;

            @Override
            public boolean hasNext() {
                while (next == null && !exhausted) {
                    AdjustmentSet candidate = current();
                    increment();
                    if (seen.add(candidate))
                        next = candidate;
                }
                return next != null;
            }

            @Override
            public AdjustmentSet next() {
                if (!hasNext())
                    throw new NoSuchElementException();
                AdjustmentSet out = next;
                next = null;
                return out;
            }

            private AdjustmentSet current() {
                Set<String> members = new TreeSet<>(fixed);
                for (int i = 0; i < digits.length; i++)
                    members.addAll(options.get(i).get(digits[i]).members());
                return AdjustmentSet.of(members);
            }

            private void increment() {
                for (int i = digits.length - 1; i >= 0; i--) {
                    if (++digits[i] < options.get(i).size())
                        return;
                    digits[i] = 0;
                }
                exhausted = true;
            }
        };
    }
}
