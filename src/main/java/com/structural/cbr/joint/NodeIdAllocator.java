package com.structural.cbr.joint;

import java.util.Collection;

import com.structural.cbr.model.Node;

/**
 * Hands out node IDs that cannot collide with any existing node.
 *
 * IDs are issued sequentially starting right above the largest ID in the seed
 * table, so the sequence depends only on the seed and on the order of
 * {@link #allocate()} calls.
 */
public final class NodeIdAllocator {
    private int next;

    private NodeIdAllocator(int next) {
        this.next = next;
    }

    /** Allocator whose first ID is {@code max(existing) + 1}. */
    public static NodeIdAllocator above(Collection<Node> existing) {
        int max = 0;
        for (Node n : existing)
            max = Math.max(max, n.id());
        return new NodeIdAllocator(max + 1);
    }

    public static NodeIdAllocator startingAt(int first) {
        if (first <= 0)
            throw new IllegalArgumentException("First node ID must be positive: " + first);
        return new NodeIdAllocator(first);
    }

    public int allocate() {
        if (next <= 0)
            throw new IllegalStateException("Node ID space exhausted");
        return next++;
    }

    /** The ID the next call to {@link #allocate()} will return. */
    public int peek() {
        return next;
    }
}
