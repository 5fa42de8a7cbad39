package com.structural.cbr.io;

import java.util.List;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonInclude;

import lombok.Data;

/**
 * POJO representation of a beam model file.
 *
 * <pre>
 * {
 *   "name": "frame",
 *   "nodes":     [[id, x, y, z], ...],
 *   "types":     [{"id": 1, "name": "beam"}],
 *   "sections":  [{"id": 1, "area": ..., "ky": "Infinity", ...}],
 *   "materials": [{"id": 1, "e": ..., "nu": ..., "rho": ...}],
 *   "elements":  [{"id": 1, "type": 1, "section": 1, "material": 1, "nodes": [1, 2, 10]}],
 *   "joints":    [{"id": 1, "node": 4, "type": "revolute"}],
 *   "reduction": {"interfaceNodes": [1, 7], "modeCount": 4}
 * }
 * </pre>
 */
@Data
@JsonIgnoreProperties(ignoreUnknown = true)
@JsonInclude(JsonInclude.Include.NON_EMPTY)
public final class ModelDefinition {
    private String name;
    private List<double[]> nodes;
    private List<TypeDef> types;
    private List<SectionDef> sections;
    private List<MaterialDef> materials;
    private List<ElementDef> elements;
    private List<JointDef> joints;
    private ReductionDef reduction;

    @Data
    @JsonIgnoreProperties(ignoreUnknown = true)
    public static final class TypeDef {
        private int id;
        private String name;
    }

    /** Shear factors default to infinity (no shear deformation). */
    @Data
    @JsonIgnoreProperties(ignoreUnknown = true)
    public static final class SectionDef {
        private int id;
        private double area;
        private double ky = Double.POSITIVE_INFINITY;
        private double kz = Double.POSITIVE_INFINITY;
        private double ixx, iyy, izz;
        private double yt, yb, zt, zb;
    }

    @Data
    @JsonIgnoreProperties(ignoreUnknown = true)
    public static final class MaterialDef {
        private int id;
        private double e, nu, rho;
    }

    @Data
    @JsonIgnoreProperties(ignoreUnknown = true)
    public static final class ElementDef {
        private int id, type, section, material;
        private int[] nodes;
    }

    @Data
    @JsonIgnoreProperties(ignoreUnknown = true)
    public static final class JointDef {
        private int id, node;
        private String type;
    }

    /** Optional reduction settings; absent fields keep their defaults. */
    @Data
    @JsonIgnoreProperties(ignoreUnknown = true)
    @JsonInclude(JsonInclude.Include.NON_NULL)
    public static final class ReductionDef {
        private List<Integer> interfaceNodes;
        private Integer modeCount;
        private Double autoModeFraction;
        private Integer maxAutoModes;
        private Double rcondThreshold;
        private Double massRegularization;
        private Double inputSymmetryTolerance;
        private Double blockSymmetryTolerance;
        private Integer denseConditionLimit;
    }
}
