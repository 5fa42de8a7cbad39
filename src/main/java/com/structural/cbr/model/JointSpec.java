package com.structural.cbr.model;

/** A joint declaration on one physical node. */
public record JointSpec(int id, int nodeId, JointType type) {

    public static JointSpec revolute(int id, int nodeId) {
        return new JointSpec(id, nodeId, JointType.REVOLUTE);
    }
}
