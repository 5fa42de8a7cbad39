package com.structural.cbr.model;

/** A model node: positive integer ID and a 3D coordinate. */
public record Node(int id, double x, double y, double z) {

    /** A new node at this node's position carrying a different ID. */
    public Node duplicate(int newId) {
        return new Node(newId, x, y, z);
    }

    public double[] coordinates() {
        return new double[] { x, y, z };
    }
}
