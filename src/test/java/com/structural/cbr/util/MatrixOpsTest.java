package com.structural.cbr.util;

import org.ejml.data.DMatrixRMaj;
import org.junit.Test;

import static org.junit.Assert.*;

public class MatrixOpsTest {

    @Test
    public void testCongruence() {
        DMatrixRMaj t = new DMatrixRMaj(new double[][] { { 1, 0 }, { 1, 0 }, { 0, 1 } });
        DMatrixRMaj a = new DMatrixRMaj(new double[][] { { 1, 2, 0 }, { 2, 3, 0 }, { 0, 0, 5 } });
        DMatrixRMaj out = MatrixOps.congruence(t, a);
        assertEquals(8, out.get(0, 0), 0);
        assertEquals(0, out.get(0, 1), 0);
        assertEquals(5, out.get(1, 1), 0);
    }

    @Test
    public void testSliceKeepsRequestedOrder() {
        DMatrixRMaj a = new DMatrixRMaj(new double[][] { { 1, 2, 3 }, { 4, 5, 6 }, { 7, 8, 9 } });
        DMatrixRMaj s = MatrixOps.slice(a, new int[] { 2, 0 }, new int[] { 1 });
        assertEquals(2, s.numRows);
        assertEquals(1, s.numCols);
        assertEquals(8, s.get(0, 0), 0);
        assertEquals(2, s.get(1, 0), 0);
    }

    @Test
    public void testAsymmetryMeasures() {
        DMatrixRMaj sym = new DMatrixRMaj(new double[][] { { 2, 1 }, { 1, 2 } });
        assertEquals(0, MatrixOps.relativeAsymmetry(sym), 0);
        assertEquals(0, MatrixOps.relativeAsymmetry(new DMatrixRMaj(2, 2)), 0);

        DMatrixRMaj skew = new DMatrixRMaj(new double[][] { { 0, 1 }, { -1, 0 } });
        assertEquals(2, MatrixOps.relativeAsymmetry(skew), 1e-15);

        DMatrixRMaj row = new DMatrixRMaj(new double[][] { { 1, 2, 3 } });
        DMatrixRMaj col = new DMatrixRMaj(new double[][] { { 1 }, { 2 }, { 3 } });
        assertEquals(0, MatrixOps.relativeTransposeMismatch(row, col), 0);
    }

    @Test
    public void testToArrayAndConcat() {
        DMatrixRMaj a = new DMatrixRMaj(new double[][] { { 1, 2 }, { 3, 4 } });
        assertArrayEquals(new double[] { 3, 4 }, MatrixOps.toArray(a)[1], 0);
        assertArrayEquals(new int[] { 1, 2, 3 }, MatrixOps.concat(new int[] { 1 }, new int[] { 2, 3 }));
    }
}
