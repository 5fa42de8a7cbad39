package com.structural.cbr;

import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;

import org.ejml.data.DMatrixRMaj;
import org.junit.Test;

import com.structural.cbr.api.ReductionListener;
import com.structural.cbr.api.ReductionWarning;
import com.structural.cbr.io.ModelDefinitionCompiler;
import com.structural.cbr.io.ModelDefinitionParser;
import com.structural.cbr.model.FeModel;
import com.structural.cbr.model.ModelValidationException;
import com.structural.cbr.reduction.ModalSolution;
import com.structural.cbr.reduction.ReducedModel;
import com.structural.cbr.reduction.ReductionOptions;
import com.structural.cbr.util.MatrixOps;

import static org.junit.Assert.*;

public class BeamReducerTest {

    @Test
    public void testThreeNodeChain() {
        ReductionRun run = new BeamReducer()
                .reduce(BeamModels.chain(3), ReductionOptions.builder(1, 3).modeCount(0).build());
        ReducedModel r = run.reduced();

        assertEquals(9, run.assembled().size());
        assertSame(run.assembled(), run.constrained());
        assertEquals(6, r.stiffness().numRows);
        assertEquals(6, r.mass().numCols);
        DMatrixRMaj t = r.transformation();
        assertEquals(9, t.numRows);
        assertEquals(6, t.numCols);
        assertTrue(run.warnings().isEmpty());
    }

    @Test
    public void testRevoluteJointScenario() {
        ReductionRun run = new BeamReducer()
                .reduce(BeamModels.hinged(), ReductionOptions.builder(1, 3).modeCount(2).build());

        assertEquals(1, run.preprocessed().duplicateCount());
        assertEquals(2, run.preprocessed().constraints().size());
        assertEquals(12, run.assembled().size());
        assertEquals(10, run.constrained().size());

        ReducedModel r = run.reduced();
        assertEquals(10, r.originalSize());
        assertEquals(6, r.masterCount());
        assertEquals(4, r.slaveCount());
        assertEquals(8, r.reducedSize());
        assertEquals(ModalSolution.Outcome.CONVERGED, r.modes().outcome());
        assertEquals(0.0, MatrixOps.relativeAsymmetry(r.stiffness()), 1e-10);
    }

    @Test
    public void testHingeSoftensEndRotation() {
        // end rotation of two unit elements: 4EI/2 when continuous, 1.5EI with a pin in the middle
        double ei = BeamModels.E * BeamModels.IZZ;
        ReducedModel pinned = new BeamReducer()
                .reduce(BeamModels.hinged(), ReductionOptions.builder(1, 3).modeCount(0).build()).reduced();
        ReducedModel rigid = new BeamReducer()
                .reduce(BeamModels.chain(3), ReductionOptions.builder(1, 3).modeCount(0).build()).reduced();

        assertEquals(2.0 * ei, rigid.stiffness().get(2, 2), 1e-6 * ei);
        assertEquals(1.5 * ei, pinned.stiffness().get(2, 2), 1e-6 * ei);
    }

    @Test
    public void testOverRequestedModesClampWithoutError() {
        ReducedModel r = new BeamReducer()
                .reduce(BeamModels.chain(4), ReductionOptions.builder(1, 4).modeCount(100).build()).reduced();
        assertEquals(r.slaveCount(), r.modeCount());
        assertEquals(1.0, r.reductionRatio(), 0);
    }

    @Test
    public void testFrameExample() throws Exception {
        ModelDefinitionCompiler.CompiledModel compiled = new ModelDefinitionCompiler()
                .compile(ModelDefinitionParser.parseResource("frame_example.json"));
        ReductionRun run = new BeamReducer().reduce(compiled.model(), compiled.options());

        assertEquals(List.of(11, 12, 13), run.preprocessed().duplicateNodeIds());
        assertEquals(6, run.preprocessed().constraints().size());
        assertEquals(36, run.assembled().size());
        assertEquals(30, run.constrained().size());

        ReducedModel r = run.reduced();
        assertEquals(6, r.masterCount());
        assertEquals(10, r.modeCount());
        assertEquals(16, r.reducedSize());
        assertEquals(16.0 / 30.0, r.reductionRatio(), 1e-15);
        double[] f = r.frequencies();
        for (int i = 1; i < f.length; i++)
            assertTrue(f[i] >= f[i - 1]);
        assertTrue(f[0] > 0);
        assertEquals(7, r.interfaceNodes().get(1).nodeId());
        assertEquals(5.4142, r.interfaceNodes().get(1).x(), 0);
    }

    @Test
    public void testReduceFromFile() throws Exception {
        ReductionRun run = new BeamReducer().reduce(Path.of("src/test/resources/models/hinged.json"));
        assertEquals(8, run.reduced().reducedSize());
    }

    @Test
    public void testJointOnOrientationNodeOnly() {
        FeModel model = BeamModels.tables()
                .node(1, 0, 0, 0)
                .node(2, 1, 0, 0)
                .node(3, 2, 0, 0)
                .node(4, 1, 1, 0)
                .element(1, 1, 1, 1, 1, 2, 4)
                .element(2, 1, 1, 1, 2, 3, 4)
                .element(3, 1, 1, 1, 2, 4)
                .revolute(1, 4)
                .build();
        ReductionRun run = new BeamReducer().reduce(model, ReductionOptions.builder(1, 3).modeCount(1).build());

        assertTrue(run.preprocessed().duplicateNodeIds().isEmpty());
        assertTrue(run.preprocessed().constraints().isEmpty());
        assertEquals(12, run.constrained().size());
        assertEquals(7, run.reduced().reducedSize());
        assertEquals(1, run.warnings().size());
        assertEquals(ReductionWarning.Kind.VACUOUS_JOINT, run.warnings().get(0).kind());
    }

    @Test
    public void testZeroLengthElementStopsBeforeAssembly() {
        FeModel broken = BeamModels.tables()
                .node(1, 0, 0, 0).node(2, 1, 0, 0).node(3, 1, 0, 0)
                .element(1, 1, 1, 1, 1, 2)
                .element(2, 1, 1, 1, 2, 3)
                .build();
        List<String> stages = new ArrayList<>();
        BeamReducer reducer = new BeamReducer().addListener(new ReductionListener() {
            @Override
            public void onStageStart(String stage) {
                stages.add(stage);
            }
        });
        try {
            reducer.reduce(broken, ReductionOptions.builder(1).build());
            fail();
        } catch (ModelValidationException e) {
            assertTrue(e.getMessage().contains("zero length"));
            assertEquals(List.of(BeamReducer.STAGE_VALIDATE), stages);
        }
    }

    @Test
    public void testInvalidModelStopsBeforeAssembly() {
        FeModel broken = BeamModels.tables()
                .node(1, 0, 0, 0).node(2, 1, 0, 0)
                .element(1, 1, 1, 1, 1, 3)
                .build();
        List<String> stages = new ArrayList<>();
        BeamReducer reducer = new BeamReducer().addListener(new ReductionListener() {
            @Override
            public void onStageStart(String stage) {
                stages.add(stage);
            }
        });
        try {
            reducer.reduce(broken, ReductionOptions.builder(1).build());
            fail();
        } catch (ModelValidationException e) {
            assertEquals(List.of(BeamReducer.STAGE_VALIDATE), stages);
        }
    }
}
