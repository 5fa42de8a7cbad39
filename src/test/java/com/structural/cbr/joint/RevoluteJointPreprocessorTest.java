package com.structural.cbr.joint;

import java.util.ArrayList;
import java.util.List;

import org.junit.Test;

import com.structural.cbr.BeamModels;
import com.structural.cbr.api.DofComponent;
import com.structural.cbr.api.DofKey;
import com.structural.cbr.api.ReductionListener;
import com.structural.cbr.api.ReductionWarning;
import com.structural.cbr.model.Element;
import com.structural.cbr.model.EqualityConstraint;
import com.structural.cbr.model.FeModel;
import com.structural.cbr.model.JointSpec;
import com.structural.cbr.model.ModelValidationException;
import com.structural.cbr.model.Node;

import static org.junit.Assert.*;

public class RevoluteJointPreprocessorTest {

    @Test
    public void testTwoElementJointCreatesOneDuplicate() {
        PreprocessedModel out = new RevoluteJointPreprocessor().process(BeamModels.hinged());

        assertEquals(List.of(4), out.duplicateNodeIds());
        assertEquals(4, out.model().nodes().size());
        Node dup = out.model().node(4);
        assertEquals(1.0, dup.x(), 0);
        assertEquals(0.0, dup.y(), 0);

        // first user keeps the original node, the second is rewired
        assertArrayEquals(new int[] { 1, 2, 0 }, out.model().elements().get(0).nodeIds());
        assertArrayEquals(new int[] { 4, 3, 0 }, out.model().elements().get(1).nodeIds());

        assertEquals(2, out.constraints().size());
        assertEquals(EqualityConstraint.tie(DofKey.of(2, DofComponent.UX), DofKey.of(4, DofComponent.UX)),
                out.constraints().get(0));
        assertArrayEquals(new double[] { 0, 1, 22, -1, 42 }, out.constraints().get(1).toRow(), 0);
        assertTrue(out.warnings().isEmpty());
    }

    @Test
    public void testKUsersGiveKMinusOneDuplicates() {
        PreprocessedModel out = new RevoluteJointPreprocessor().process(BeamModels.star());

        assertEquals(2, out.duplicateCount());
        assertEquals(List.of(5, 6), out.duplicates().get(1));
        assertEquals(4, out.constraints().size());
        for (EqualityConstraint c : out.constraints()) {
            assertEquals(1, c.master().nodeId());
            assertEquals(0.0, c.rhs(), 0);
            assertNotEquals(DofComponent.RZ, c.slave().component());
        }
        // the original node is referenced by exactly one element afterwards
        assertEquals(1, RevoluteJointPreprocessor.elementsReferencing(out.model().elements(), 1).size());
    }

    @Test
    public void testSecondPassAddsNothing() {
        RevoluteJointPreprocessor pre = new RevoluteJointPreprocessor();
        PreprocessedModel first = pre.process(BeamModels.star());
        PreprocessedModel second = pre.process(first.model());

        assertEquals(0, second.duplicateCount());
        assertTrue(second.constraints().isEmpty());
        assertEquals(first.model().nodes(), second.model().nodes());
        assertEquals(first.model().elements(), second.model().elements());
    }

    @Test
    public void testDeterministic() {
        PreprocessedModel a = new RevoluteJointPreprocessor().process(BeamModels.star());
        PreprocessedModel b = new RevoluteJointPreprocessor().process(BeamModels.star());
        assertEquals(a.model().nodes(), b.model().nodes());
        assertEquals(a.model().elements(), b.model().elements());
        assertEquals(a.constraints(), b.constraints());
    }

    @Test
    public void testVacuousJointWarnsAndSkips() {
        FeModel model = BeamModels.tables()
                .node(1, 0, 0, 0).node(2, 1, 0, 0)
                .element(1, 1, 1, 1, 1, 2)
                .revolute(1, 2)
                .build();
        List<ReductionWarning> seen = new ArrayList<>();
        PreprocessedModel out = new RevoluteJointPreprocessor(new ReductionListener() {
            @Override
            public void onWarning(ReductionWarning warning) {
                seen.add(warning);
            }
        }).process(model);

        assertEquals(0, out.duplicateCount());
        assertTrue(out.constraints().isEmpty());
        assertEquals(1, out.warnings().size());
        assertEquals(ReductionWarning.Kind.VACUOUS_JOINT, out.warnings().get(0).kind());
        assertEquals(out.warnings(), seen);
    }

    @Test
    public void testOrientationNodeIsNotIncident() {
        FeModel model = BeamModels.tables()
                .node(1, 0, 0, 0)
                .node(2, 1, 0, 0)
                .node(3, 2, 0, 0)
                .node(4, 1, 1, 0)
                .node(5, 1, 2, 0)
                .element(1, 1, 1, 1, 1, 2, 4)
                .element(2, 1, 1, 1, 2, 3, 4)
                .element(3, 1, 1, 1, 4, 5)
                .revolute(1, 4)
                .build();
        PreprocessedModel out = new RevoluteJointPreprocessor().process(model);

        assertEquals(0, out.duplicateCount());
        assertTrue(out.constraints().isEmpty());
        assertEquals(1, out.warnings().size());
        assertEquals(ReductionWarning.Kind.VACUOUS_JOINT, out.warnings().get(0).kind());
        assertArrayEquals(new int[] { 1, 2, 4 }, out.model().elements().get(0).nodeIds());
    }

    @Test
    public void testDuplicateLeavesOrientationSlot() {
        FeModel model = BeamModels.tables()
                .node(1, 0, 0, 0)
                .node(2, 1, 0, 0)
                .node(3, 2, 0, 0)
                .node(4, 3, 1, 0)
                .element(1, 1, 1, 1, 1, 2)
                .element(2, 1, 1, 1, 2, 3)
                .element(3, 1, 1, 1, 3, 4, 2)
                .revolute(1, 2)
                .build();
        PreprocessedModel out = new RevoluteJointPreprocessor().process(model);

        assertEquals(List.of(5), out.duplicateNodeIds());
        assertArrayEquals(new int[] { 5, 3, 0 }, out.model().elements().get(1).nodeIds());
        assertArrayEquals(new int[] { 3, 4, 2 }, out.model().elements().get(2).nodeIds());
        assertEquals(2, out.constraints().size());
    }

    @Test
    public void testInputModelUntouched() {
        FeModel model = BeamModels.hinged();
        List<Element> before = List.copyOf(model.elements());
        new RevoluteJointPreprocessor().process(model);
        assertEquals(3, model.nodes().size());
        assertEquals(before, model.elements());
        assertArrayEquals(new int[] { 2, 3, 0 }, model.elements().get(1).nodeIds());
    }

    @Test(expected = ModelValidationException.class)
    public void testJointOnMissingNode() {
        new RevoluteJointPreprocessor().process(BeamModels.chain(3), List.of(JointSpec.revolute(1, 42)));
    }

    @Test
    public void testAllocatorStartsAboveMax() {
        NodeIdAllocator ids = NodeIdAllocator.above(List.of(new Node(3, 0, 0, 0), new Node(17, 0, 0, 0)));
        assertEquals(18, ids.peek());
        assertEquals(18, ids.allocate());
        assertEquals(19, ids.allocate());
        assertEquals(5, NodeIdAllocator.startingAt(5).allocate());
    }
}
