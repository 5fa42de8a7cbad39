package com.structural.cbr.reduction;

import org.ejml.data.DMatrixRMaj;
import org.ejml.dense.row.CommonOps_DDRM;

import com.structural.cbr.util.MatrixOps;

/**
 * Combines the static and modal bases.
 *
 * <pre>
 *          | I    0 |   master rows
 * T_CB  =  |        |
 *          | R    φ |   slave rows,  R = −Kss⁻¹·Ksm
 * </pre>
 *
 * With no modes the Guyan transformation and matrices are returned as they
 * are, so a zero-mode reduction is bit-identical to static condensation.
 */
public final class CraigBamptonAssembler {

    /** Transformation and reduced pair. */
    public record Result(DMatrixRMaj transformation, DMatrixRMaj stiffness, DMatrixRMaj mass) {
    }

    public Result assemble(PartitionedSystem p, GuyanReduction guyan, ModalSolution modes) {
        if (!modes.hasModes())
            return new Result(guyan.transformation(), guyan.stiffness(), guyan.mass());

        int m = p.masterCount();
        int s = p.slaveCount();
        int k = modes.modeCount();

        DMatrixRMaj t = new DMatrixRMaj(m + s, m + k);
        CommonOps_DDRM.insert(guyan.transformation(), t, 0, 0);
        CommonOps_DDRM.insert(modes.modeShapes(), t, m, m);

        DMatrixRMaj kcb = MatrixOps.congruence(t, p.kp());
        DMatrixRMaj mcb = MatrixOps.congruence(t, p.mp());
        return new Result(t, kcb, mcb);
    }
}
