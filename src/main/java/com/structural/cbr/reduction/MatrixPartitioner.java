package com.structural.cbr.reduction;

import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;
import org.ejml.data.DMatrixRMaj;

import com.structural.cbr.api.ReductionListener;
import com.structural.cbr.api.ReductionWarning;
import com.structural.cbr.assembly.AssembledSystem;
import com.structural.cbr.util.MatrixOps;

/**
 * Slices K and M into master/slave blocks by index selection.
 *
 * Checks that {@code Kmm} and {@code Kss} are symmetric and that {@code Kms}
 * matches {@code Ksmᵗ}; a mismatch means the model was not consistent and is
 * reported as a warning.
 */
public final class MatrixPartitioner {
    private static final Logger log = LogManager.getLogger(MatrixPartitioner.class);

    private final ReductionListener listener;
    private final double tolerance;

    public MatrixPartitioner(ReductionListener listener, double tolerance) {
        this.listener = listener;
        this.tolerance = tolerance;
    }

    public PartitionedSystem partition(AssembledSystem system, DofPartition partition) {
        int[] m = partition.masters();
        int[] s = partition.slaves();
        int[] order = partition.order();
        DMatrixRMaj k = system.stiffness();
        DMatrixRMaj mass = system.mass();

        PartitionedSystem p = new PartitionedSystem(
                MatrixOps.slice(k, m, m), MatrixOps.slice(k, m, s),
                MatrixOps.slice(k, s, m), MatrixOps.slice(k, s, s),
                MatrixOps.slice(mass, m, m), MatrixOps.slice(mass, m, s),
                MatrixOps.slice(mass, s, m), MatrixOps.slice(mass, s, s),
                MatrixOps.slice(k, order, order), MatrixOps.slice(mass, order, order));

        check("Kmm", MatrixOps.relativeAsymmetry(p.kmm()));
        check("Kss", MatrixOps.relativeAsymmetry(p.kss()));
        check("Kms/Ksm", MatrixOps.relativeTransposeMismatch(p.kms(), p.ksm()));
        log.debug("Blocks: Kmm {}x{}, Kss {}x{}", p.kmm().numRows, p.kmm().numCols, p.kss().numRows, p.kss().numCols);
        return p;
    }

    private void check(String block, double asymmetry) {
        if (asymmetry > tolerance) {
            String msg = String.format("Block %s is not symmetric (relative deviation %.3e)", block, asymmetry);
            log.warn(msg);
            listener.onWarning(new ReductionWarning(ReductionWarning.Kind.ASYMMETRIC_BLOCK, msg));
        }
    }
}
