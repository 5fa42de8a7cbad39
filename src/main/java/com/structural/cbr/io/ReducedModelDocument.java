package com.structural.cbr.io;

import java.util.List;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonInclude;

import lombok.Data;

/**
 * Serialized form of a reduced model. DOFs are written as labels
 * ({@code nodeId * 10 + component}).
 */
@Data
@JsonIgnoreProperties(ignoreUnknown = true)
@JsonInclude(JsonInclude.Include.NON_NULL)
public final class ReducedModelDocument {
    private String name;
    private Statistics statistics;
    private long[] dofLabels;
    private long[] rowLabels;
    private int[] masterIndices;
    private int[] slaveIndices;
    private List<InterfaceNodeDef> interfaceNodes;
    private double[] frequencies;
    private String modalOutcome;
    private double[][] stiffness;
    private double[][] mass;
    private double[][] transformation;
    private double[][] guyanStiffness;
    private double[][] guyanMass;
    private double[][] guyanTransformation;
    private List<String> warnings;

    @Data
    @JsonIgnoreProperties(ignoreUnknown = true)
    public static final class Statistics {
        private int originalSize;
        private int reducedSize;
        private int masterCount;
        private int slaveCount;
        private int modeCount;
        private double reductionRatio;
        private double stiffnessRcond;
        private boolean pseudoInverseUsed;
    }

    @Data
    @JsonIgnoreProperties(ignoreUnknown = true)
    public static final class InterfaceNodeDef {
        private int id;
        private double x, y, z;
        private int dofCount;
    }
}
