package com.structural.cbr.reduction;

import java.util.Arrays;
import java.util.Comparator;
import java.util.stream.IntStream;

import org.ejml.data.DMatrixRMaj;
import org.ejml.dense.row.CommonOps_DDRM;
import org.ejml.dense.row.MatrixFeatures_DDRM;
import org.ejml.dense.row.factory.DecompositionFactory_DDRM;
import org.ejml.interfaces.decomposition.CholeskyDecomposition_F64;
import org.ejml.interfaces.decomposition.EigenDecomposition_F64;

import com.structural.cbr.api.ReductionListener;
import com.structural.cbr.api.ReductionWarning;

import lombok.extern.log4j.Log4j2;

/**
 * Fixed-interface normal modes: {@code Kss·φ = λ·Mss·φ}.
 *
 * <p>
 * The generalized problem is brought to standard symmetric form with the
 * Cholesky factor of the mass block, {@code Mss = L·Lᵗ}:
 * {@code (L⁻¹·Kss·L⁻ᵗ)·y = λ·y}, {@code φ = L⁻ᵗ·y}. The resulting shapes are
 * mass-normalized ({@code φᵗ·Mss·φ = I}).
 *
 * <p>
 * The modes with the smallest {@code |λ|} are kept and returned in ascending
 * order of {@code λ}. A failed factorization or eigensolve is not an error:
 * the solution comes back {@link ModalSolution.Outcome#DEGRADED} with no
 * modes.
 */
@Log4j2
public final class ModalSolver {
    private final ReductionListener listener;
    private final ReductionOptions options;

    public ModalSolver(ReductionListener listener, ReductionOptions options) {
        this.listener = listener;
        this.options = options;
    }

    /** Number of modes to compute for {@code slaveCount} slave DOFs. */
    public int modeCount(int slaveCount) {
        int requested = options.isAutoModeCount() ? options.autoModeCount(slaveCount) : options.getModeCount();
        if (requested > slaveCount)
            log.info("Requested {} modes but only {} slave DOFs exist, clamping", requested, slaveCount);
        return Math.min(requested, slaveCount);
    }

    public ModalSolution solve(PartitionedSystem p) {
        int ns = p.slaveCount();
        int count = modeCount(ns);
        if (count == 0) {
            log.info("No fixed-interface modes requested");
            return ModalSolution.notRequested(ns);
        }

        DMatrixRMaj mss = p.mss().copy();
        double rcond = ConditionEstimator.reciprocalCondition(mss, options.getDenseConditionLimit());
        if (rcond < options.getRcondThreshold()) {
            String msg = String.format("Mss is ill-conditioned (rcond ~ %.2e), adding %.1e * I", rcond,
                    options.getMassRegularization());
            log.warn(msg);
            listener.onWarning(new ReductionWarning(ReductionWarning.Kind.ILL_CONDITIONED_MASS, msg));
            for (int i = 0; i < ns; i++)
                mss.add(i, i, options.getMassRegularization());
        }

        try {
            return decompose(p.kss(), mss, count);
        } catch (RuntimeException e) {
            return degraded(ns, count, "eigensolver error: " + e.getMessage());
        }
    }

    private ModalSolution decompose(DMatrixRMaj kss, DMatrixRMaj mss, int count) {
        int ns = kss.numRows;

        CholeskyDecomposition_F64<DMatrixRMaj> chol = DecompositionFactory_DDRM.chol(ns, true);
        if (!chol.decompose(mss.copy()))
            return degraded(ns, count, "mass block is not positive definite");
        DMatrixRMaj lower = chol.getT(null);
        DMatrixRMaj lowerInv = new DMatrixRMaj(ns, ns);
        if (!CommonOps_DDRM.invert(lower, lowerInv))
            return degraded(ns, count, "Cholesky factor is singular");

        DMatrixRMaj tmp = new DMatrixRMaj(ns, ns);
        CommonOps_DDRM.mult(lowerInv, kss, tmp);
        DMatrixRMaj standard = new DMatrixRMaj(ns, ns);
        CommonOps_DDRM.multTransB(tmp, lowerInv, standard);
        DMatrixRMaj sym = CommonOps_DDRM.transpose(standard, null);
        CommonOps_DDRM.addEquals(sym, standard);
        CommonOps_DDRM.scale(0.5, sym);

        EigenDecomposition_F64<DMatrixRMaj> eig = DecompositionFactory_DDRM.eig(ns, true, true);
        if (!eig.decompose(sym))
            return degraded(ns, count, "eigendecomposition did not converge");

        double[] values = new double[eig.getNumberOfEigenvalues()];
        for (int i = 0; i < values.length; i++)
            values[i] = eig.getEigenvalue(i).getReal();

        Integer[] byMagnitude = IntStream.range(0, values.length).boxed().toArray(Integer[]::new);
        Arrays.sort(byMagnitude, Comparator.comparingDouble(i -> Math.abs(values[i])));
        Integer[] kept = Arrays.copyOf(byMagnitude, count);
        Arrays.sort(kept, Comparator.comparingDouble(i -> values[i]));

        DMatrixRMaj y = new DMatrixRMaj(ns, count);
        double[] lambda = new double[count];
        for (int j = 0; j < count; j++) {
            DMatrixRMaj v = eig.getEigenVector(kept[j]);
            if (v == null)
                return degraded(ns, count, "missing eigenvector for mode " + (j + 1));
            lambda[j] = values[kept[j]];
            CommonOps_DDRM.insert(v, y, 0, j);
        }

        DMatrixRMaj shapes = new DMatrixRMaj(ns, count);
        CommonOps_DDRM.multTransA(lowerInv, y, shapes);
        if (MatrixFeatures_DDRM.hasUncountable(shapes) || Arrays.stream(lambda).anyMatch(v -> !Double.isFinite(v)))
            return degraded(ns, count, "non-finite modes");

        ModalSolution solution = ModalSolution.converged(count, shapes, lambda);
        double[] f = solution.frequencies();
        log.info("{} fixed-interface modes, {} - {} Hz", count, String.format("%.3f", f[0]),
                String.format("%.3f", f[count - 1]));
        return solution;
    }

    private ModalSolution degraded(int ns, int count, String reason) {
        String msg = "Modal solve failed (" + reason + "), continuing with Guyan condensation only";
        log.warn(msg);
        listener.onWarning(new ReductionWarning(ReductionWarning.Kind.EIGENSOLVE_FAILED, msg));
        return ModalSolution.degraded(ns, count, reason);
    }
}
