package com.structural.cbr.api;

import java.util.ArrayList;
import java.util.Collection;
import java.util.Collections;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.Set;

/**
 * Ordered, duplicate-free sequence of DOF keys paired with their matrix
 * positions.
 *
 * Position {@code i} in this set is row/column {@code i} of every matrix that
 * travels with it. The set is immutable; operations that drop DOFs return a
 * new set with the surviving keys in their original relative order.
 */
public final class DofSet {
    private final List<DofKey> keys;
    private final Map<DofKey, Integer> indexByKey;

    private DofSet(List<DofKey> keys, Map<DofKey, Integer> indexByKey) {
        this.keys = keys;
        this.indexByKey = indexByKey;
    }

    public static DofSet of(Collection<DofKey> keys) {
        List<DofKey> ordered = new ArrayList<>(keys.size());
        Map<DofKey, Integer> index = new HashMap<>(keys.size() * 2);
        for (DofKey key : keys) {
            if (index.putIfAbsent(key, ordered.size()) != null)
                throw new IllegalArgumentException("Duplicate DOF in set: " + key);
            ordered.add(key);
        }
        return new DofSet(Collections.unmodifiableList(ordered), Collections.unmodifiableMap(index));
    }

    public static DofSet of(DofKey... keys) {
        return of(List.of(keys));
    }

    /** Decodes a sequence of packed labels, keeping their order. */
    public static DofSet fromLabels(long[] labels) {
        List<DofKey> keys = new ArrayList<>(labels.length);
        for (long label : labels)
            keys.add(DofKey.decode(label));
        return of(keys);
    }

    public int size() {
        return keys.size();
    }

    public DofKey key(int index) {
        return keys.get(index);
    }

    /** Returns the matrix position of {@code key}, or -1 if it is absent. */
    public int indexOf(DofKey key) {
        Integer idx = indexByKey.get(key);
        return idx == null ? -1 : idx;
    }

    public int indexOf(int nodeId, DofComponent component) {
        return indexOf(DofKey.of(nodeId, component));
    }

    public boolean contains(DofKey key) {
        return indexByKey.containsKey(key);
    }

    public List<DofKey> keys() {
        return keys;
    }

    public long[] labels() {
        long[] out = new long[keys.size()];
        for (int i = 0; i < out.length; i++)
            out[i] = keys.get(i).encode();
        return out;
    }

    /** Returns a new set without {@code removed}, preserving order. */
    public DofSet without(Set<DofKey> removed) {
        List<DofKey> kept = new ArrayList<>(keys.size());
        for (DofKey key : keys)
            if (!removed.contains(key))
                kept.add(key);
        return of(kept);
    }

    /** Keys at the given positions, in the given order. */
    public List<DofKey> select(int[] indices) {
        List<DofKey> out = new ArrayList<>(indices.length);
        for (int i : indices)
            out.add(keys.get(i));
        return Collections.unmodifiableList(out);
    }

    @Override
    public boolean equals(Object o) {
        return o instanceof DofSet other && keys.equals(other.keys);
    }

    @Override
    public int hashCode() {
        return keys.hashCode();
    }

    @Override
    public String toString() {
        return "DofSet" + keys;
    }
}
