package com.structural.cbr.model;

import java.util.HashSet;
import java.util.Set;

import lombok.extern.log4j.Log4j2;

/**
 * Checks the model tables before any matrix work.
 *
 * Every check throws {@link ModelValidationException} on the first violation.
 * Shear factors {@code ky}/{@code kz} are the only properties allowed to be
 * infinite (rigid in shear).
 */
@Log4j2
public final class ModelValidator {

    private ModelValidator() {
        // Utility class
    }

    public static void validate(FeModel model) {
        validateNodes(model);
        validateTypes(model);
        validateSections(model);
        validateMaterials(model);
        validateElements(model);
        validateJoints(model);
        log.debug("Model validated: {} nodes, {} elements, {} joints",
                model.nodes().size(), model.elements().size(), model.joints().size());
    }

    static void validateNodes(FeModel model) {
        if (model.nodes().isEmpty())
            throw new ModelValidationException("At least one node must be defined");
        Set<Integer> ids = new HashSet<>();
        for (Node n : model.nodes()) {
            requirePositiveId("Node", n.id());
            if (!ids.add(n.id()))
                throw new ModelValidationException("Duplicate node ID " + n.id());
            if (!Double.isFinite(n.x()) || !Double.isFinite(n.y()) || !Double.isFinite(n.z()))
                throw new ModelValidationException("Node " + n.id() + " has non-finite coordinates");
        }
    }

    static void validateTypes(FeModel model) {
        if (model.types().isEmpty())
            throw new ModelValidationException("At least one element type must be defined");
        Set<Integer> ids = new HashSet<>();
        for (ElementType t : model.types()) {
            requirePositiveId("Element type", t.id());
            if (!ids.add(t.id()))
                throw new ModelValidationException("Duplicate element type ID " + t.id());
            if (t.name() == null || t.name().isBlank())
                throw new ModelValidationException("Element type " + t.id() + " has an empty name");
        }
    }

    static void validateSections(FeModel model) {
        if (model.sections().isEmpty())
            throw new ModelValidationException("At least one section must be defined");
        Set<Integer> ids = new HashSet<>();
        for (Section s : model.sections()) {
            requirePositiveId("Section", s.id());
            if (!ids.add(s.id()))
                throw new ModelValidationException("Duplicate section ID " + s.id());
            double[] finite = { s.area(), s.ixx(), s.iyy(), s.izz(), s.yt(), s.yb(), s.zt(), s.zb() };
            for (double v : finite)
                if (!Double.isFinite(v))
                    throw new ModelValidationException("Section " + s.id() + " has non-finite properties");
            if (Double.isNaN(s.ky()) || Double.isNaN(s.kz()))
                throw new ModelValidationException("Section " + s.id() + " has NaN shear factors");
            if (s.area() <= 0)
                throw new ModelValidationException("Section " + s.id() + " area must be positive");
            if (s.izz() < 0)
                throw new ModelValidationException("Section " + s.id() + " moment of inertia must not be negative");
        }
    }

    static void validateMaterials(FeModel model) {
        if (model.materials().isEmpty())
            throw new ModelValidationException("At least one material must be defined");
        Set<Integer> ids = new HashSet<>();
        for (Material m : model.materials()) {
            requirePositiveId("Material", m.id());
            if (!ids.add(m.id()))
                throw new ModelValidationException("Duplicate material ID " + m.id());
            if (!Double.isFinite(m.youngsModulus()) || !Double.isFinite(m.poissonRatio())
                    || !Double.isFinite(m.density()))
                throw new ModelValidationException("Material " + m.id() + " has non-finite properties");
            if (m.youngsModulus() <= 0)
                throw new ModelValidationException("Material " + m.id() + " Young's modulus must be positive");
            if (m.poissonRatio() <= -1 || m.poissonRatio() >= 0.5)
                throw new ModelValidationException("Material " + m.id() + " Poisson ratio must lie in (-1, 0.5)");
            if (m.density() <= 0)
                throw new ModelValidationException("Material " + m.id() + " density must be positive");
        }
    }

    static void validateElements(FeModel model) {
        if (model.elements().isEmpty())
            throw new ModelValidationException("At least one element must be defined");
        Set<Integer> ids = new HashSet<>();
        for (Element e : model.elements()) {
            requirePositiveId("Element", e.id());
            if (!ids.add(e.id()))
                throw new ModelValidationException("Duplicate element ID " + e.id());
            ElementType type = model.type(e.typeId());
            if (type == null)
                throw new ModelValidationException("Element " + e.id() + ": type " + e.typeId() + " is not defined");
            if (!type.isBeam())
                throw new ModelValidationException("Element " + e.id() + ": unsupported element type " + type.name()
                        + ", only beam elements are supported");
            if (model.section(e.sectionId()) == null)
                throw new ModelValidationException(
                        "Element " + e.id() + ": section " + e.sectionId() + " is not defined");
            if (model.material(e.materialId()) == null)
                throw new ModelValidationException(
                        "Element " + e.id() + ": material " + e.materialId() + " is not defined");
            int used = 0;
            for (int slot = 0; slot < Element.NODE_SLOTS; slot++) {
                int n = e.nodeId(slot);
                if (n == 0)
                    continue;
                if (!model.hasNode(n))
                    throw new ModelValidationException("Element " + e.id() + ": node " + n + " is not defined");
                used++;
            }
            if (used < 2)
                throw new ModelValidationException("Element " + e.id() + " must reference at least 2 nodes");
            validateEnds(model, e);
        }
    }

    private static void validateEnds(FeModel model, Element e) {
        if (e.nodeId(0) == 0 || e.nodeId(1) == 0)
            throw new ModelValidationException("Element " + e.id() + ": both end node slots must be set");
        Node a = model.node(e.nodeId(0));
        Node b = model.node(e.nodeId(1));
        if (!(Math.hypot(b.x() - a.x(), b.y() - a.y()) > 0))
            throw new ModelValidationException("Element " + e.id() + " has zero length in the XY plane");
    }

    static void validateJoints(FeModel model) {
        Set<Integer> ids = new HashSet<>();
        for (JointSpec j : model.joints()) {
            requirePositiveId("Joint", j.id());
            if (!ids.add(j.id()))
                throw new ModelValidationException("Duplicate joint ID " + j.id());
            if (!model.hasNode(j.nodeId()))
                throw new ModelValidationException("Joint " + j.id() + ": node " + j.nodeId() + " is not defined");
            if (j.type() != JointType.REVOLUTE)
                throw new ModelValidationException("Joint " + j.id() + ": only revolute joints are supported");
        }
    }

    private static void requirePositiveId(String what, int id) {
        if (id <= 0)
            throw new ModelValidationException(what + " ID must be a positive integer, got " + id);
    }
}
