package com.structural.cbr.joint;

import java.util.ArrayList;
import java.util.HashMap;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;

import com.structural.cbr.api.DofComponent;
import com.structural.cbr.api.DofKey;
import com.structural.cbr.api.ReductionListener;
import com.structural.cbr.api.ReductionWarning;
import com.structural.cbr.model.Element;
import com.structural.cbr.model.EqualityConstraint;
import com.structural.cbr.model.FeModel;
import com.structural.cbr.model.JointSpec;
import com.structural.cbr.model.JointType;
import com.structural.cbr.model.ModelValidationException;
import com.structural.cbr.model.Node;

/**
 * Expands revolute joints into duplicated nodes tied by equality constraints.
 *
 * <p>
 * For a joint on node {@code n}, the first element (in table order) that has
 * {@code n} as an end node keeps it. Every other such element gets its own
 * copy of {@code n} at the same position, and the copy's Ux and Uy are tied to
 * the original's. Rz is left free, which is what makes the connection a pin.
 * Elements that only use {@code n} as their orientation node are not incident
 * to the joint and keep pointing at the original.
 *
 * <p>
 * Joints are processed in declaration order against the topology produced by
 * the previous joints, so a second pass over an already expanded model finds
 * at most one element per joint node and does nothing. The input model is
 * never modified.
 */
public final class RevoluteJointPreprocessor {
    private static final Logger log = LogManager.getLogger(RevoluteJointPreprocessor.class);

    private final ReductionListener listener;

    public RevoluteJointPreprocessor() {
        this(ReductionListener.NONE);
    }

    public RevoluteJointPreprocessor(ReductionListener listener) {
        this.listener = listener;
    }

    /** Expands every joint declared on {@code model}. */
    public PreprocessedModel process(FeModel model) {
        return process(model, model.joints());
    }

    /**
     * Expands {@code joints} against {@code model}'s topology.
     *
     * @throws ModelValidationException for a non-revolute joint or a joint on an
     *                                  undefined node.
     */
    public PreprocessedModel process(FeModel model, List<JointSpec> joints) {
        List<Node> nodes = new ArrayList<>(model.nodes());
        List<Element> elements = new ArrayList<>(model.elements());
        Map<Integer, Node> nodesById = new HashMap<>(model.nodesById());
        NodeIdAllocator ids = NodeIdAllocator.above(nodes);

        List<EqualityConstraint> constraints = new ArrayList<>(joints.size() * 4);
        Map<Integer, List<Integer>> duplicates = new LinkedHashMap<>();
        List<ReductionWarning> warnings = new ArrayList<>();

        for (JointSpec joint : joints) {
            if (joint.type() != JointType.REVOLUTE)
                throw new ModelValidationException("Joint " + joint.id() + ": unsupported joint type " + joint.type());
            int nodeId = joint.nodeId();
            Node original = nodesById.get(nodeId);
            if (original == null)
                throw new ModelValidationException("Joint " + joint.id() + ": node " + nodeId + " is not defined");

            List<Integer> users = elementsReferencing(elements, nodeId);
            if (users.size() < 2) {
                ReductionWarning w = new ReductionWarning(ReductionWarning.Kind.VACUOUS_JOINT,
                        "Node " + nodeId + " is used by " + users.size()
                                + " element(s); a revolute joint needs at least 2, joint " + joint.id()
                                + " skipped");
                log.warn(w.message());
                warnings.add(w);
                listener.onWarning(w);
                continue;
            }

            List<Integer> created = new ArrayList<>(users.size() - 1);
            for (int i = 1; i < users.size(); i++) {
                int pos = users.get(i);
                int newId = ids.allocate();
                Node copy = original.duplicate(newId);
                nodes.add(copy);
                nodesById.put(newId, copy);
                elements.set(pos, elements.get(pos).withEndNodeReplaced(nodeId, newId));
                created.add(newId);
            }
            for (int dup : created) {
                constraints.add(EqualityConstraint.tie(DofKey.of(nodeId, DofComponent.UX), DofKey.of(dup, DofComponent.UX)));
                constraints.add(EqualityConstraint.tie(DofKey.of(nodeId, DofComponent.UY), DofKey.of(dup, DofComponent.UY)));
            }
            duplicates.computeIfAbsent(nodeId, k -> new ArrayList<>()).addAll(created);
            log.info("Revolute joint {} on node {}: {} duplicate node(s) {}, {} constraint(s)",
                    joint.id(), nodeId, created.size(), created, created.size() * 2);
        }

        return new PreprocessedModel(model.withTopology(nodes, elements), constraints, duplicates, warnings);
    }

    /** Table positions of the elements with {@code nodeId} as an end node, in table order. */
    static List<Integer> elementsReferencing(List<Element> elements, int nodeId) {
        List<Integer> out = new ArrayList<>();
        for (int i = 0; i < elements.size(); i++)
            if (elements.get(i).connects(nodeId))
                out.add(i);
        return out;
    }
}
