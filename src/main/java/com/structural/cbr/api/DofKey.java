package com.structural.cbr.api;

import java.util.Comparator;

/**
 * Identity of one degree of freedom: a (node, component) pair.
 *
 * <p>
 * Keys order by node ID first and component code second, which is also the
 * order in which an assembler lays out DOFs for a node. Equality is exact
 * integer equality.
 *
 * <p>
 * A key can be packed into a single {@code long} label
 * ({@code nodeId * 10 + code}) for compact storage or export; the label
 * decodes back to the identical key.
 */
public record DofKey(int nodeId, DofComponent component) implements Comparable<DofKey> {

    private static final Comparator<DofKey> ORDER = Comparator
            .comparingInt(DofKey::nodeId)
            .thenComparingInt(k -> k.component().code());

    public DofKey {
        if (nodeId <= 0)
            throw new IllegalArgumentException("Node ID must be positive: " + nodeId);
        if (component == null)
            throw new IllegalArgumentException("DOF component must not be null");
    }

    public static DofKey of(int nodeId, DofComponent component) {
        return new DofKey(nodeId, component);
    }

    public static DofKey of(int nodeId, int componentCode) {
        return new DofKey(nodeId, DofComponent.fromCode(componentCode));
    }

    /** Packs this key into a single integral label. */
    public long encode() {
        return (long) nodeId * 10 + component.code();
    }

    /** Inverse of {@link #encode()}. */
    public static DofKey decode(long label) {
        if (label <= 0)
            throw new IllegalArgumentException("Invalid DOF label: " + label);
        long node = label / 10;
        if (node > Integer.MAX_VALUE)
            throw new IllegalArgumentException("DOF label out of range: " + label);
        return of((int) node, (int) (label % 10));
    }

    @Override
    public int compareTo(DofKey other) {
        return ORDER.compare(this, other);
    }

    @Override
    public String toString() {
        return nodeId + "." + component;
    }
}
