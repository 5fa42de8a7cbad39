package com.structural.cbr.model;

import java.util.ArrayList;
import java.util.HashMap;
import java.util.List;
import java.util.Map;

/**
 * Immutable bundle of the model tables: nodes, elements, element types,
 * sections, materials and joint declarations.
 *
 * Table order is the input order and is preserved by every transformation.
 * Lookups by ID assume IDs are unique, which {@link ModelValidator} enforces.
 */
public final class FeModel {
    private final List<Node> nodes;
    private final List<Element> elements;
    private final List<ElementType> types;
    private final List<Section> sections;
    private final List<Material> materials;
    private final List<JointSpec> joints;

    private final Map<Integer, Node> nodesById;
    private final Map<Integer, ElementType> typesById;
    private final Map<Integer, Section> sectionsById;
    private final Map<Integer, Material> materialsById;

    private FeModel(List<Node> nodes, List<Element> elements, List<ElementType> types,
            List<Section> sections, List<Material> materials, List<JointSpec> joints) {
        this.nodes = List.copyOf(nodes);
        this.elements = List.copyOf(elements);
        this.types = List.copyOf(types);
        this.sections = List.copyOf(sections);
        this.materials = List.copyOf(materials);
        this.joints = List.copyOf(joints);

        this.nodesById = new HashMap<>(nodes.size() * 2);
        for (Node n : nodes)
            nodesById.put(n.id(), n);
        this.typesById = new HashMap<>();
        for (ElementType t : types)
            typesById.put(t.id(), t);
        this.sectionsById = new HashMap<>();
        for (Section s : sections)
            sectionsById.put(s.id(), s);
        this.materialsById = new HashMap<>();
        for (Material m : materials)
            materialsById.put(m.id(), m);
    }

    public List<Node> nodes() {
        return nodes;
    }

    public List<Element> elements() {
        return elements;
    }

    public List<ElementType> types() {
        return types;
    }

    public List<Section> sections() {
        return sections;
    }

    public List<Material> materials() {
        return materials;
    }

    public List<JointSpec> joints() {
        return joints;
    }

    /** Returns the node with {@code id}, or null. */
    public Node node(int id) {
        return nodesById.get(id);
    }

    public boolean hasNode(int id) {
        return nodesById.containsKey(id);
    }

    public ElementType type(int id) {
        return typesById.get(id);
    }

    public Section section(int id) {
        return sectionsById.get(id);
    }

    public Material material(int id) {
        return materialsById.get(id);
    }

    public Map<Integer, Node> nodesById() {
        return Map.copyOf(nodesById);
    }

    /** Same property tables and joints over a new topology. */
    public FeModel withTopology(List<Node> newNodes, List<Element> newElements) {
        return new FeModel(newNodes, newElements, types, sections, materials, joints);
    }

    public static Builder builder() {
        return new Builder();
    }

    /** Collects table rows in input order. */
    public static final class Builder {
        private final List<Node> nodes = new ArrayList<>();
        private final List<Element> elements = new ArrayList<>();
        private final List<ElementType> types = new ArrayList<>();
        private final List<Section> sections = new ArrayList<>();
        private final List<Material> materials = new ArrayList<>();
        private final List<JointSpec> joints = new ArrayList<>();

        public Builder node(int id, double x, double y, double z) {
            nodes.add(new Node(id, x, y, z));
            return this;
        }

        public Builder node(Node node) {
            nodes.add(node);
            return this;
        }

        public Builder element(Element element) {
            elements.add(element);
            return this;
        }

        public Builder element(int id, int typeId, int sectionId, int materialId, int... nodeIds) {
            return element(new Element(id, typeId, sectionId, materialId, nodeIds));
        }

        public Builder type(int id, String name) {
            types.add(new ElementType(id, name));
            return this;
        }

        public Builder section(Section section) {
            sections.add(section);
            return this;
        }

        public Builder material(int id, double e, double nu, double rho) {
            materials.add(new Material(id, e, nu, rho));
            return this;
        }

        public Builder joint(JointSpec joint) {
            joints.add(joint);
            return this;
        }

        public Builder revolute(int id, int nodeId) {
            return joint(JointSpec.revolute(id, nodeId));
        }

        public FeModel build() {
            return new FeModel(nodes, elements, types, sections, materials, joints);
        }
    }
}
