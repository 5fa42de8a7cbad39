package com.structural.cbr.reduction;

import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;
import org.ejml.data.DMatrixRMaj;
import org.ejml.dense.row.CommonOps_DDRM;
import org.ejml.dense.row.MatrixFeatures_DDRM;
import org.ejml.dense.row.factory.LinearSolverFactory_DDRM;
import org.ejml.interfaces.linsol.LinearSolverDense;

import com.structural.cbr.api.ReductionListener;
import com.structural.cbr.api.ReductionWarning;
import com.structural.cbr.util.MatrixOps;

/**
 * Guyan static condensation.
 *
 * <p>
 * Slave inertia is neglected, so slave displacements follow the masters
 * through {@code us = −Kss⁻¹·Ksm·um}. {@code Kss·X = Ksm} is solved with an LU
 * factorization; the explicit inverse is never formed.
 *
 * <p>
 * When {@code Kss} is near-singular (reciprocal condition below the configured
 * threshold, or the factorization fails) the Moore-Penrose pseudo-inverse is
 * used instead and a warning is raised. This happens legitimately near
 * mechanisms and is not an error.
 */
public final class GuyanReducer {
    private static final Logger log = LogManager.getLogger(GuyanReducer.class);

    private final ReductionListener listener;
    private final ReductionOptions options;

    public GuyanReducer(ReductionListener listener, ReductionOptions options) {
        this.listener = listener;
        this.options = options;
    }

    public GuyanReduction reduce(PartitionedSystem p) {
        int m = p.masterCount();
        int s = p.slaveCount();

        double rcond = ConditionEstimator.reciprocalCondition(p.kss(), options.getDenseConditionLimit());
        DMatrixRMaj x = null;
        boolean pinv = rcond < options.getRcondThreshold();
        if (pinv) {
            warn(String.format("Kss is ill-conditioned (rcond ~ %.2e), using pseudo-inverse", rcond));
        } else {
            x = solve(p.kss(), p.ksm());
            if (x == null) {
                pinv = true;
                warn(String.format("Kss factorization failed (rcond ~ %.2e), using pseudo-inverse", rcond));
            }
        }
        if (pinv)
            x = solvePseudoInverse(p.kss(), p.ksm());

        DMatrixRMaj recovery = x.copy();
        CommonOps_DDRM.changeSign(recovery);

        DMatrixRMaj t = new DMatrixRMaj(m + s, m);
        for (int i = 0; i < m; i++)
            t.set(i, i, 1.0);
        CommonOps_DDRM.insert(recovery, t, m, 0);

        DMatrixRMaj kg = MatrixOps.congruence(t, p.kp());
        DMatrixRMaj mg = MatrixOps.congruence(t, p.mp());
        log.info("Guyan condensation: {}x{} -> {}x{} (Kss rcond {})", m + s, m + s, m, m, rcond);
        return new GuyanReduction(recovery, t, kg, mg, rcond, pinv);
    }

    /** LU solve of {@code A·X = B}; null if the factorization or result is unusable. */
    private static DMatrixRMaj solve(DMatrixRMaj a, DMatrixRMaj b) {
        LinearSolverDense<DMatrixRMaj> solver = LinearSolverFactory_DDRM.lu(a.numRows);
        if (!solver.setA(a.copy()))
            return null;
        DMatrixRMaj x = new DMatrixRMaj(a.numCols, b.numCols);
        solver.solve(b.copy(), x);
        return MatrixFeatures_DDRM.hasUncountable(x) ? null : x;
    }

    private static DMatrixRMaj solvePseudoInverse(DMatrixRMaj a, DMatrixRMaj b) {
        DMatrixRMaj inv = new DMatrixRMaj(a.numCols, a.numRows);
        CommonOps_DDRM.pinv(a.copy(), inv);
        DMatrixRMaj x = new DMatrixRMaj(a.numCols, b.numCols);
        CommonOps_DDRM.mult(inv, b, x);
        return x;
    }

    private void warn(String message) {
        log.warn(message);
        listener.onWarning(new ReductionWarning(ReductionWarning.Kind.ILL_CONDITIONED_STIFFNESS, message));
    }
}
