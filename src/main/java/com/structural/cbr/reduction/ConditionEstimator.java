package com.structural.cbr.reduction;

import org.ejml.data.DMatrixRMaj;
import org.ejml.dense.row.CommonOps_DDRM;
import org.ejml.dense.row.MatrixFeatures_DDRM;
import org.ejml.dense.row.NormOps_DDRM;
import org.ejml.dense.row.factory.LinearSolverFactory_DDRM;
import org.ejml.interfaces.linsol.LinearSolverDense;

/**
 * Reciprocal condition number of a square matrix.
 *
 * <p>
 * Up to {@code denseLimit} rows the exact 2-norm value {@code σmin/σmax} is
 * taken from an SVD. Larger matrices use Hager's 1-norm estimator on an LU
 * factorization, which needs only a handful of solves.
 *
 * <p>
 * Singular or non-finite matrices report 0.
 */
public final class ConditionEstimator {
    private static final int HAGER_MAX_ITERATIONS = 5;

    private ConditionEstimator() {
        // Utility class
    }

    public static double reciprocalCondition(DMatrixRMaj a, int denseLimit) {
        if (a.numRows != a.numCols)
            throw new IllegalArgumentException("Matrix is not square: " + a.numRows + "x" + a.numCols);
        if (a.numRows == 0)
            return 1;
        if (MatrixFeatures_DDRM.hasUncountable(a))
            return 0;
        return a.numRows <= denseLimit ? exact(a) : estimate(a);
    }

    static double exact(DMatrixRMaj a) {
        double cond = NormOps_DDRM.conditionP2(a.copy());
        return Double.isFinite(cond) && cond > 0 ? 1.0 / cond : 0;
    }

    static double estimate(DMatrixRMaj a) {
        int n = a.numRows;
        double normA = NormOps_DDRM.normP1(a);
        if (normA == 0)
            return 0;

        LinearSolverDense<DMatrixRMaj> lu = LinearSolverFactory_DDRM.lu(n);
        LinearSolverDense<DMatrixRMaj> luT = LinearSolverFactory_DDRM.lu(n);
        if (!lu.setA(a.copy()) || !luT.setA(CommonOps_DDRM.transpose(a, null)))
            return 0;

        DMatrixRMaj x = new DMatrixRMaj(n, 1);
        CommonOps_DDRM.fill(x, 1.0 / n);
        DMatrixRMaj y = new DMatrixRMaj(n, 1);
        DMatrixRMaj z = new DMatrixRMaj(n, 1);
        DMatrixRMaj sign = new DMatrixRMaj(n, 1);
        double invNorm = 0;

        for (int iter = 0; iter < HAGER_MAX_ITERATIONS; iter++) {
            lu.solve(x, y);
            if (MatrixFeatures_DDRM.hasUncountable(y))
                return 0;
            invNorm = CommonOps_DDRM.elementSumAbs(y);
            for (int i = 0; i < n; i++)
                sign.data[i] = y.data[i] >= 0 ? 1 : -1;
            luT.solve(sign, z);
            if (MatrixFeatures_DDRM.hasUncountable(z))
                return 0;

            int j = 0;
            for (int i = 1; i < n; i++)
                if (Math.abs(z.data[i]) > Math.abs(z.data[j]))
                    j = i;
            double zx = 0;
            for (int i = 0; i < n; i++)
                zx += z.data[i] * x.data[i];
            if (Math.abs(z.data[j]) <= zx)
                break;
            x.zero();
            x.data[j] = 1;
        }
        double rcond = 1.0 / (normA * invNorm);
        return Double.isFinite(rcond) ? rcond : 0;
    }
}
