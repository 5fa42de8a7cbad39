package com.structural.cbr.model;

import java.util.Arrays;

/**
 * An element row: ID, type/section/material references and up to three node
 * slots. A zero slot is empty. For beams, slots 1 and 2 are the end nodes and
 * slot 3 is the orientation reference node.
 */
public final class Element {
    public static final int NODE_SLOTS = 3;
    /** Slots that connect to the structure; the rest are reference nodes. */
    public static final int END_SLOTS = 2;

    private final int id;
    private final int typeId;
    private final int sectionId;
    private final int materialId;
    private final int[] nodeIds;

    public Element(int id, int typeId, int sectionId, int materialId, int... nodeIds) {
        if (nodeIds.length > NODE_SLOTS)
            throw new IllegalArgumentException("Element " + id + " has more than " + NODE_SLOTS + " node slots");
        this.id = id;
        this.typeId = typeId;
        this.sectionId = sectionId;
        this.materialId = materialId;
        this.nodeIds = Arrays.copyOf(nodeIds, NODE_SLOTS);
    }

    public int id() {
        return id;
    }

    public int typeId() {
        return typeId;
    }

    public int sectionId() {
        return sectionId;
    }

    public int materialId() {
        return materialId;
    }

    public int nodeId(int slot) {
        return nodeIds[slot];
    }

    public int[] nodeIds() {
        return nodeIds.clone();
    }

    /** True if {@code nodeId} sits in one of the end slots. */
    public boolean connects(int nodeId) {
        for (int i = 0; i < END_SLOTS; i++)
            if (nodeIds[i] == nodeId)
                return true;
        return false;
    }

    /** Copy of this element with {@code from} replaced by {@code to} in the end slots. */
    public Element withEndNodeReplaced(int from, int to) {
        int[] slots = nodeIds.clone();
        for (int i = 0; i < END_SLOTS; i++)
            if (slots[i] == from)
                slots[i] = to;
        return new Element(id, typeId, sectionId, materialId, slots);
    }

    @Override
    public boolean equals(Object o) {
        if (this == o)
            return true;
        if (!(o instanceof Element e))
            return false;
        return id == e.id && typeId == e.typeId && sectionId == e.sectionId
                && materialId == e.materialId && Arrays.equals(nodeIds, e.nodeIds);
    }

    @Override
    public int hashCode() {
        return 31 * (31 * (31 * (31 * id + typeId) + sectionId) + materialId) + Arrays.hashCode(nodeIds);
    }

    @Override
    public String toString() {
        return "Element[" + id + " type=" + typeId + " sec=" + sectionId + " mat=" + materialId
                + " nodes=" + Arrays.toString(nodeIds) + "]";
    }
}
