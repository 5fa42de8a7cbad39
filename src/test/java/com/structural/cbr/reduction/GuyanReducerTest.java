package com.structural.cbr.reduction;

import java.util.ArrayList;
import java.util.List;

import org.ejml.data.DMatrixRMaj;
import org.ejml.dense.row.CommonOps_DDRM;
import org.ejml.dense.row.MatrixFeatures_DDRM;
import org.junit.Test;

import com.structural.cbr.BeamModels;
import com.structural.cbr.api.DofSet;
import com.structural.cbr.api.ReductionListener;
import com.structural.cbr.api.ReductionWarning;
import com.structural.cbr.assembly.AssembledSystem;
import com.structural.cbr.assembly.Beam2dAssembler;
import com.structural.cbr.model.FeModel;
import com.structural.cbr.util.MatrixOps;

import static org.junit.Assert.*;

public class GuyanReducerTest {
    private final List<ReductionWarning> warnings = new ArrayList<>();
    private final ReductionListener collector = new ReductionListener() {
        @Override
        public void onWarning(ReductionWarning warning) {
            warnings.add(warning);
        }
    };

    private PartitionedSystem chainBlocks(int n, List<Integer> interfaceNodes) {
        FeModel chain = BeamModels.chain(n);
        AssembledSystem sys = new Beam2dAssembler().assemble(chain);
        DofPartition dp = new DofPartitioner(collector).partition(sys.dofs(), interfaceNodes, chain.nodesById());
        return new MatrixPartitioner(collector, 1e-10).partition(sys, dp);
    }

    @Test
    public void testShapeAndIdentityBlock() {
        PartitionedSystem p = chainBlocks(3, List.of(1, 3));
        GuyanReduction g = new GuyanReducer(collector, ReductionOptions.builder(1, 3).build()).reduce(p);

        assertEquals(9, g.transformation().numRows);
        assertEquals(6, g.transformation().numCols);
        assertEquals(3, g.recovery().numRows);
        assertEquals(6, g.recovery().numCols);
        DMatrixRMaj top = CommonOps_DDRM.extract(g.transformation(), 0, 6, 0, 6);
        assertTrue(MatrixFeatures_DDRM.isIdentity(top, 0));
        assertEquals(6, g.stiffness().numRows);
        assertEquals(6, g.mass().numRows);
        assertFalse(g.pseudoInverseUsed());
        assertTrue(warnings.isEmpty());
    }

    @Test
    public void testReducedPairIsSymmetric() {
        PartitionedSystem p = chainBlocks(6, List.of(1, 6));
        GuyanReduction g = new GuyanReducer(collector, ReductionOptions.builder(1, 6).build()).reduce(p);
        assertEquals(0.0, MatrixOps.relativeAsymmetry(g.stiffness()), 1e-10);
        assertEquals(0.0, MatrixOps.relativeAsymmetry(g.mass()), 1e-10);
    }

    @Test
    public void testCondensationOfTwoElementsIsOneLongElement() {
        PartitionedSystem p = chainBlocks(3, List.of(1, 3));
        DMatrixRMaj k = new GuyanReducer(collector, ReductionOptions.builder(1, 3).build()).reduce(p).stiffness();

        double l = 2.0;
        double ea = BeamModels.E * BeamModels.AREA;
        double ei = BeamModels.E * BeamModels.IZZ;
        assertEquals(ea / l, k.get(0, 0), 1e-8 * ea);
        assertEquals(-ea / l, k.get(0, 3), 1e-8 * ea);
        assertEquals(12 * ei / (l * l * l), k.get(1, 1), 1e-6 * ei);
        assertEquals(6 * ei / (l * l), k.get(1, 2), 1e-6 * ei);
        assertEquals(4 * ei / l, k.get(2, 2), 1e-6 * ei);
        assertEquals(2 * ei / l, k.get(2, 5), 1e-6 * ei);
        assertEquals(-12 * ei / (l * l * l), k.get(1, 4), 1e-6 * ei);
    }

    @Test
    public void testSingularSlaveBlockUsesPseudoInverse() {
        // spring between DOF 0 and 1 only; DOF 2 is disconnected
        DMatrixRMaj k = new DMatrixRMaj(new double[][] { { 1, -1, 0 }, { -1, 1, 0 }, { 0, 0, 0 } });
        AssembledSystem sys = new AssembledSystem(DofSet.fromLabels(new long[] { 11, 21, 31 }), k,
                CommonOps_DDRM.identity(3));
        DofPartition dp = new DofPartition(sys.dofs(), new int[] { 0 }, new int[] { 1, 2 }, List.of());
        PartitionedSystem p = new MatrixPartitioner(collector, 1e-10).partition(sys, dp);

        GuyanReduction g = new GuyanReducer(collector, ReductionOptions.builder(1).build()).reduce(p);

        assertTrue(g.pseudoInverseUsed());
        assertEquals(1, warnings.size());
        assertEquals(ReductionWarning.Kind.ILL_CONDITIONED_STIFFNESS, warnings.get(0).kind());
        assertEquals(1.0, g.recovery().get(0, 0), 1e-12);
        assertEquals(0.0, g.recovery().get(1, 0), 1e-12);
        assertEquals(0.0, g.stiffness().get(0, 0), 1e-12);
        assertFalse(MatrixFeatures_DDRM.hasUncountable(g.mass()));
    }
}
