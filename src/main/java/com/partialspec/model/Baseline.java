package com.partialspec.model;

import java.util.Collections;
import java.util.Set;
import java.util.SortedSet;
import java.util.TreeSet;

/**
 * The set of legacy operations. Changes to these are left out of the partial spec.
 *
 * @param operations The legacy operation keys, sorted and unmodifiable.
 * @param present    Whether the baseline artifact existed. An absent artifact yields an
 *                   empty set, which makes every changed operation strictly checked.
 */
public record Baseline(SortedSet<OperationKey> operations, boolean present) {

    public Baseline {
        operations = Collections.unmodifiableSortedSet(new TreeSet<>(operations));
    }

    public static Baseline of(Set<OperationKey> operations) {
        return new Baseline(new TreeSet<>(operations), true);
    }

    public static Baseline missing() {
        return new Baseline(new TreeSet<>(), false);
    }

    public boolean contains(OperationKey key) {
        return operations.contains(key);
    }

    public int size() {
        return operations.size();
    }
}
