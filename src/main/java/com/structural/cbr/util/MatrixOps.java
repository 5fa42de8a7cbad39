package com.structural.cbr.util;

import org.ejml.data.DMatrixRMaj;
import org.ejml.dense.row.CommonOps_DDRM;
import org.ejml.dense.row.NormOps_DDRM;

/**
 * Small dense helpers shared by the pipeline stages. None of them modify
 * their arguments.
 */
public final class MatrixOps {

    private MatrixOps() {
        // Utility class
    }

    /** Returns {@code Tᵗ · A · T}. */
    public static DMatrixRMaj congruence(DMatrixRMaj t, DMatrixRMaj a) {
        DMatrixRMaj at = new DMatrixRMaj(t.numCols, a.numCols);
        CommonOps_DDRM.multTransA(t, a, at);
        DMatrixRMaj out = new DMatrixRMaj(t.numCols, t.numCols);
        CommonOps_DDRM.mult(at, t, out);
        return out;
    }

    /** {@code ‖A − Aᵗ‖_F / ‖A‖_F}, or 0 for a zero matrix. */
    public static double relativeAsymmetry(DMatrixRMaj a) {
        if (a.numRows != a.numCols)
            throw new IllegalArgumentException("Matrix is not square: " + a.numRows + "x" + a.numCols);
        DMatrixRMaj diff = CommonOps_DDRM.transpose(a, null);
        CommonOps_DDRM.subtractEquals(diff, a);
        double norm = NormOps_DDRM.normF(a);
        return norm == 0 ? 0 : NormOps_DDRM.normF(diff) / norm;
    }

    /** {@code ‖A − Bᵗ‖_F / max(‖A‖_F, ‖B‖_F)}, or 0 when both are zero. */
    public static double relativeTransposeMismatch(DMatrixRMaj a, DMatrixRMaj b) {
        if (a.numRows != b.numCols || a.numCols != b.numRows)
            throw new IllegalArgumentException("Shapes are not transposes of each other");
        DMatrixRMaj diff = CommonOps_DDRM.transpose(b, null);
        CommonOps_DDRM.subtractEquals(diff, a);
        double norm = Math.max(NormOps_DDRM.normF(a), NormOps_DDRM.normF(b));
        return norm == 0 ? 0 : NormOps_DDRM.normF(diff) / norm;
    }

    /** Rows {@code rows} and columns {@code cols} of {@code src}, in the given order. */
    public static DMatrixRMaj slice(DMatrixRMaj src, int[] rows, int[] cols) {
        DMatrixRMaj out = new DMatrixRMaj(rows.length, cols.length);
        for (int i = 0; i < rows.length; i++) {
            int base = rows[i] * src.numCols;
            for (int j = 0; j < cols.length; j++)
                out.data[i * cols.length + j] = src.data[base + cols[j]];
        }
        return out;
    }

    /** Copy of {@code a} as a plain {@code double[][]}, for export. */
    public static double[][] toArray(DMatrixRMaj a) {
        double[][] out = new double[a.numRows][a.numCols];
        for (int i = 0; i < a.numRows; i++)
            System.arraycopy(a.data, i * a.numCols, out[i], 0, a.numCols);
        return out;
    }

    public static int[] concat(int[] a, int[] b) {
        int[] out = new int[a.length + b.length];
        System.arraycopy(a, 0, out, 0, a.length);
        System.arraycopy(b, 0, out, a.length, b.length);
        return out;
    }
}
