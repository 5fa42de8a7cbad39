package com.structural.cbr.reduction;

import java.util.List;

import com.structural.cbr.api.DofKey;
import com.structural.cbr.api.DofSet;
import com.structural.cbr.util.MatrixOps;

/**
 * Disjoint, exhaustive master/slave split of a DOF set.
 *
 * Indices are positions in {@link #dofs()}. Masters are ordered by interface
 * node (caller order) and then Ux, Uy, Rz; slaves are ascending.
 */
public final class DofPartition {
    private final DofSet dofs;
    private final int[] masters;
    private final int[] slaves;
    private final List<InterfaceNode> interfaceNodes;

    DofPartition(DofSet dofs, int[] masters, int[] slaves, List<InterfaceNode> interfaceNodes) {
        this.dofs = dofs;
        this.masters = masters.clone();
        this.slaves = slaves.clone();
        this.interfaceNodes = List.copyOf(interfaceNodes);
    }

    public DofSet dofs() {
        return dofs;
    }

    public int[] masters() {
        return masters.clone();
    }

    public int[] slaves() {
        return slaves.clone();
    }

    public int masterCount() {
        return masters.length;
    }

    public int slaveCount() {
        return slaves.length;
    }

    /** Masters followed by slaves: the row order of every partitioned matrix. */
    public int[] order() {
        return MatrixOps.concat(masters, slaves);
    }

    public List<DofKey> masterKeys() {
        return dofs.select(masters);
    }

    public List<DofKey> slaveKeys() {
        return dofs.select(slaves);
    }

    public List<InterfaceNode> interfaceNodes() {
        return interfaceNodes;
    }
}
