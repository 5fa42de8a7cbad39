package com.structural.cbr.reduction;

import java.util.ArrayList;
import java.util.HashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;

import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;

import com.structural.cbr.api.DofComponent;
import com.structural.cbr.api.DofSet;
import com.structural.cbr.api.ReductionListener;
import com.structural.cbr.api.ReductionWarning;
import com.structural.cbr.model.Node;

/**
 * Splits a DOF set into interface (master) and internal (slave) DOFs.
 *
 * Each interface node contributes its Ux, Uy and Rz DOFs, in that order, as far
 * as they exist in the set. Everything else is a slave.
 */
public final class DofPartitioner {
    private static final Logger log = LogManager.getLogger(DofPartitioner.class);
    private static final DofComponent[] INTERFACE_COMPONENTS = { DofComponent.UX, DofComponent.UY, DofComponent.RZ };

    private final ReductionListener listener;

    public DofPartitioner(ReductionListener listener) {
        this.listener = listener;
    }

    /**
     * @param dofs           The (constraint-reduced) DOF set.
     * @param interfaceNodes Interface node IDs in the order the consumer expects.
     * @param nodes          Node table used to resolve interface coordinates.
     * @throws ReductionException if an interface node is repeated or not in the
     *                            node table, or if either side of the split is
     *                            empty.
     */
    public DofPartition partition(DofSet dofs, List<Integer> interfaceNodes, Map<Integer, Node> nodes) {
        List<Integer> masters = new ArrayList<>(interfaceNodes.size() * 3);
        List<InterfaceNode> located = new ArrayList<>(interfaceNodes.size());
        Set<Integer> seen = new HashSet<>();

        for (int nodeId : interfaceNodes) {
            if (!seen.add(nodeId))
                throw new ReductionException("Interface node " + nodeId + " is listed more than once");
            Node node = nodes.get(nodeId);
            if (node == null)
                throw new ReductionException("Interface node " + nodeId + " is not in the node table");

            int found = 0;
            for (DofComponent c : INTERFACE_COMPONENTS) {
                int idx = dofs.indexOf(nodeId, c);
                if (idx >= 0) {
                    masters.add(idx);
                    found++;
                }
            }
            if (found == 0) {
                warn(ReductionWarning.Kind.INTERFACE_NODE_WITHOUT_DOFS,
                        "Interface node " + nodeId + " has no DOFs in the model and is skipped");
            } else if (found < INTERFACE_COMPONENTS.length) {
                warn(ReductionWarning.Kind.PARTIAL_INTERFACE_NODE, "Interface node " + nodeId + " keeps only "
                        + found + " of its " + INTERFACE_COMPONENTS.length + " planar DOFs");
            }
            located.add(new InterfaceNode(nodeId, node.x(), node.y(), node.z(), found));
        }

        if (masters.isEmpty())
            throw new ReductionException("No master DOFs found for interface nodes " + interfaceNodes);

        boolean[] isMaster = new boolean[dofs.size()];
        for (int idx : masters)
            isMaster[idx] = true;
        int[] slaves = new int[dofs.size() - masters.size()];
        for (int i = 0, s = 0; i < dofs.size(); i++)
            if (!isMaster[i])
                slaves[s++] = i;
        if (slaves.length == 0)
            throw new ReductionException("No slave DOFs left: every DOF belongs to the interface");

        int[] masterArr = masters.stream().mapToInt(Integer::intValue).toArray();
        log.info("Partitioned {} DOFs: {} master, {} slave", dofs.size(), masterArr.length, slaves.length);
        return new DofPartition(dofs, masterArr, slaves, located);
    }

    private void warn(ReductionWarning.Kind kind, String message) {
        log.warn(message);
        listener.onWarning(new ReductionWarning(kind, message));
    }
}
