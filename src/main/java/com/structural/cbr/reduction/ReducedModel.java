package com.structural.cbr.reduction;

import java.util.ArrayList;
import java.util.List;

import org.ejml.data.DMatrixRMaj;

import com.structural.cbr.api.DofKey;
import com.structural.cbr.api.DofSet;
import com.structural.cbr.api.ReductionWarning;

/**
 * Everything a downstream flexible-body component needs from one reduction.
 *
 * <p>
 * The reduced coordinates are the master DOFs (in {@link #masterKeys()} order)
 * followed by {@link #modeCount()} modal amplitudes. Rows of
 * {@link #transformation()} follow {@link #rowDofs()}: masters first, then
 * slaves. {@link #transformationInDofOrder()} gives the same matrix with rows
 * in the order of the input DOF set.
 *
 * <p>
 * Instances are immutable; matrix accessors return copies.
 */
public final class ReducedModel {
    private final DofSet dofs;
    private final int[] masters;
    private final int[] slaves;
    private final List<InterfaceNode> interfaceNodes;

    private final DMatrixRMaj stiffness;
    private final DMatrixRMaj mass;
    private final DMatrixRMaj transformation;
    private final DMatrixRMaj guyanStiffness;
    private final DMatrixRMaj guyanMass;
    private final DMatrixRMaj guyanTransformation;

    private final ModalSolution modes;
    private final double stiffnessRcond;
    private final boolean pseudoInverseUsed;
    private final List<ReductionWarning> warnings;

    private ReducedModel(Builder b) {
        this.dofs = b.partition.dofs();
        this.masters = b.partition.masters();
        this.slaves = b.partition.slaves();
        this.interfaceNodes = b.partition.interfaceNodes();
        this.stiffness = b.stiffness.copy();
        this.mass = b.mass.copy();
        this.transformation = b.transformation.copy();
        this.guyanStiffness = b.guyan.stiffness().copy();
        this.guyanMass = b.guyan.mass().copy();
        this.guyanTransformation = b.guyan.transformation().copy();
        this.modes = b.modes;
        this.stiffnessRcond = b.guyan.stiffnessRcond();
        this.pseudoInverseUsed = b.guyan.pseudoInverseUsed();
        this.warnings = List.copyOf(b.warnings);
    }

    static Builder builder() {
        return new Builder();
    }

    public DMatrixRMaj stiffness() {
        return stiffness.copy();
    }

    public DMatrixRMaj mass() {
        return mass.copy();
    }

    /** {@code T_CB}, rows in {@link #rowDofs()} order. */
    public DMatrixRMaj transformation() {
        return transformation.copy();
    }

    /** {@code T_CB} with rows reordered to the input DOF set. */
    public DMatrixRMaj transformationInDofOrder() {
        int[] order = rowOrder();
        DMatrixRMaj out = new DMatrixRMaj(transformation.numRows, transformation.numCols);
        int cols = transformation.numCols;
        for (int i = 0; i < order.length; i++)
            System.arraycopy(transformation.data, i * cols, out.data, order[i] * cols, cols);
        return out;
    }

    public DMatrixRMaj guyanStiffness() {
        return guyanStiffness.copy();
    }

    public DMatrixRMaj guyanMass() {
        return guyanMass.copy();
    }

    public DMatrixRMaj guyanTransformation() {
        return guyanTransformation.copy();
    }

    /** DOF set the reduction ran on. */
    public DofSet dofs() {
        return dofs;
    }

    /** Master positions in {@link #dofs()}. */
    public int[] masterIndices() {
        return masters.clone();
    }

    /** Slave positions in {@link #dofs()}, ascending. */
    public int[] slaveIndices() {
        return slaves.clone();
    }

    public List<DofKey> masterKeys() {
        return dofs.select(masters);
    }

    /** DOF labelling each row of {@link #transformation()}. */
    public List<DofKey> rowDofs() {
        return dofs.select(rowOrder());
    }

    public List<InterfaceNode> interfaceNodes() {
        return interfaceNodes;
    }

    public ModalSolution modes() {
        return modes;
    }

    public int modeCount() {
        return modes.modeCount();
    }

    /** Fixed-interface natural frequencies in Hz, ascending. */
    public double[] frequencies() {
        return modes.frequencies();
    }

    public double stiffnessRcond() {
        return stiffnessRcond;
    }

    public boolean isPseudoInverseUsed() {
        return pseudoInverseUsed;
    }

    public int originalSize() {
        return dofs.size();
    }

    public int masterCount() {
        return masters.length;
    }

    public int slaveCount() {
        return slaves.length;
    }

    public int reducedSize() {
        return stiffness.numRows;
    }

    /** {@code reducedSize / originalSize}. */
    public double reductionRatio() {
        return (double) reducedSize() / originalSize();
    }

    public List<ReductionWarning> warnings() {
        return warnings;
    }

    public boolean hasWarnings() {
        return !warnings.isEmpty();
    }

    private int[] rowOrder() {
        int[] order = new int[masters.length + slaves.length];
        System.arraycopy(masters, 0, order, 0, masters.length);
        System.arraycopy(slaves, 0, order, masters.length, slaves.length);
        return order;
    }

    /** Multi-line report of sizes, ratio, interface and modes. */
    public String summary() {
        StringBuilder sb = new StringBuilder();
        sb.append(String.format("Original DOFs      : %d\n", originalSize()));
        sb.append(String.format("Reduced DOFs       : %d (%d interface + %d modal)\n", reducedSize(), masterCount(),
                modeCount()));
        sb.append(String.format("Reduction ratio    : %.4f\n", reductionRatio()));
        sb.append(String.format("Interface nodes    : %d\n", interfaceNodes.size()));
        for (InterfaceNode n : interfaceNodes)
            sb.append(String.format("  node %-6d (%.4f, %.4f, %.4f) %d DOFs\n", n.nodeId(), n.x(), n.y(), n.z(),
                    n.dofCount()));
        sb.append(String.format("Modal solve        : %s\n", modes.outcome()));
        double[] f = frequencies();
        if (f.length > 0)
            sb.append(String.format("Frequency range    : %.4f - %.4f Hz\n", f[0], f[f.length - 1]));
        sb.append(String.format("Warnings           : %d\n", warnings.size()));
        for (ReductionWarning w : warnings)
            sb.append("  ").append(w).append('\n');
        return sb.toString();
    }

    @Override
    public String toString() {
        return "ReducedModel[" + originalSize() + " -> " + reducedSize() + ", modes=" + modeCount() + "]";
    }

    static final class Builder {
        private DofPartition partition;
        private GuyanReduction guyan;
        private ModalSolution modes;
        private DMatrixRMaj stiffness;
        private DMatrixRMaj mass;
        private DMatrixRMaj transformation;
        private final List<ReductionWarning> warnings = new ArrayList<>();

        Builder partition(DofPartition partition) {
            this.partition = partition;
            return this;
        }

        Builder guyan(GuyanReduction guyan) {
            this.guyan = guyan;
            return this;
        }

        Builder modes(ModalSolution modes) {
            this.modes = modes;
            return this;
        }

        Builder craigBampton(CraigBamptonAssembler.Result result) {
            this.stiffness = result.stiffness();
            this.mass = result.mass();
            this.transformation = result.transformation();
            return this;
        }

        Builder warnings(List<ReductionWarning> list) {
            warnings.addAll(list);
            return this;
        }

        ReducedModel build() {
            if (partition == null || guyan == null || modes == null || transformation == null)
                throw new IllegalStateException("Reduced model is incomplete");
            return new ReducedModel(this);
        }
    }
}
