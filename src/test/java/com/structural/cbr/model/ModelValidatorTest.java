package com.structural.cbr.model;

import org.junit.Test;

import com.structural.cbr.BeamModels;

import static org.junit.Assert.*;

public class ModelValidatorTest {

    private static void assertRejected(FeModel model, String fragment) {
        try {
            ModelValidator.validate(model);
            fail("Expected validation to fail with '" + fragment + "'");
        } catch (ModelValidationException e) {
            assertTrue(e.getMessage(), e.getMessage().contains(fragment));
        }
    }

    @Test
    public void testValidModelsPass() {
        ModelValidator.validate(BeamModels.chain(4));
        ModelValidator.validate(BeamModels.hinged());
        ModelValidator.validate(BeamModels.star());
    }

    @Test
    public void testDuplicateNodeId() {
        FeModel m = BeamModels.tables()
                .node(1, 0, 0, 0).node(1, 1, 0, 0)
                .element(1, 1, 1, 1, 1, 1)
                .build();
        assertRejected(m, "Duplicate node ID 1");
    }

    @Test
    public void testNonFiniteCoordinate() {
        FeModel m = BeamModels.tables()
                .node(1, 0, 0, 0).node(2, Double.NaN, 0, 0)
                .element(1, 1, 1, 1, 1, 2)
                .build();
        assertRejected(m, "non-finite coordinates");
    }

    @Test
    public void testDanglingElementReferences() {
        assertRejected(BeamModels.tables().node(1, 0, 0, 0).node(2, 1, 0, 0)
                .element(1, 1, 1, 1, 1, 5).build(), "node 5 is not defined");
        assertRejected(BeamModels.tables().node(1, 0, 0, 0).node(2, 1, 0, 0)
                .element(1, 9, 1, 1, 1, 2).build(), "type 9 is not defined");
        assertRejected(BeamModels.tables().node(1, 0, 0, 0).node(2, 1, 0, 0)
                .element(1, 1, 9, 1, 1, 2).build(), "section 9 is not defined");
        assertRejected(BeamModels.tables().node(1, 0, 0, 0).node(2, 1, 0, 0)
                .element(1, 1, 1, 9, 1, 2).build(), "material 9 is not defined");
    }

    @Test
    public void testElementNeedsTwoNodes() {
        FeModel m = BeamModels.tables().node(1, 0, 0, 0).element(1, 1, 1, 1, 1).build();
        assertRejected(m, "at least 2 nodes");
    }

    @Test
    public void testNonBeamTypeRejected() {
        FeModel m = FeModel.builder().type(1, "truss").section(BeamModels.section())
                .material(1, BeamModels.E, BeamModels.NU, BeamModels.RHO)
                .node(1, 0, 0, 0).node(2, 1, 0, 0).element(1, 1, 1, 1, 1, 2).build();
        assertRejected(m, "unsupported element type truss");
    }

    @Test
    public void testZeroLengthElementRejected() {
        FeModel m = BeamModels.tables().node(1, 0, 0, 0).node(2, 0, 0, 3)
                .element(1, 1, 1, 1, 1, 2).build();
        assertRejected(m, "zero length");
    }

    @Test
    public void testEmptyEndSlotRejected() {
        FeModel m = BeamModels.tables().node(1, 0, 0, 0).node(2, 1, 0, 0)
                .element(1, 1, 1, 1, 1, 0, 2).build();
        assertRejected(m, "both end node slots");
    }

    @Test
    public void testSectionProperties() {
        FeModel zeroArea = FeModel.builder().type(1, "beam").material(1, 1e9, 0.3, 1000)
                .section(new Section(1, 0, 1, 1, 0, 0, 1e-6, 0, 0, 0, 0))
                .node(1, 0, 0, 0).node(2, 1, 0, 0).element(1, 1, 1, 1, 1, 2).build();
        assertRejected(zeroArea, "area must be positive");

        FeModel infiniteIzz = FeModel.builder().type(1, "beam").material(1, 1e9, 0.3, 1000)
                .section(new Section(1, 1, 1, 1, 0, 0, Double.POSITIVE_INFINITY, 0, 0, 0, 0))
                .node(1, 0, 0, 0).node(2, 1, 0, 0).element(1, 1, 1, 1, 1, 2).build();
        assertRejected(infiniteIzz, "non-finite properties");
    }

    @Test
    public void testInfiniteShearFactorsAllowed() {
        Section s = BeamModels.section();
        assertTrue(Double.isInfinite(s.ky()));
        ModelValidator.validateSections(BeamModels.chain(2));
    }

    @Test
    public void testMaterialProperties() {
        assertRejected(FeModel.builder().type(1, "beam").section(BeamModels.section()).material(1, -1, 0.3, 1)
                .node(1, 0, 0, 0).node(2, 1, 0, 0).element(1, 1, 1, 1, 1, 2).build(), "Young's modulus");
        assertRejected(FeModel.builder().type(1, "beam").section(BeamModels.section()).material(1, 1, 0.5, 1)
                .node(1, 0, 0, 0).node(2, 1, 0, 0).element(1, 1, 1, 1, 1, 2).build(), "Poisson ratio");
        assertRejected(FeModel.builder().type(1, "beam").section(BeamModels.section()).material(1, 1, 0.3, 0)
                .node(1, 0, 0, 0).node(2, 1, 0, 0).element(1, 1, 1, 1, 1, 2).build(), "density");
    }

    @Test
    public void testJointOnUnknownNode() {
        FeModel m = BeamModels.tables().node(1, 0, 0, 0).node(2, 1, 0, 0)
                .element(1, 1, 1, 1, 1, 2).revolute(1, 7).build();
        assertRejected(m, "node 7 is not defined");
    }

    @Test
    public void testJointTypeParsing() {
        assertEquals(JointType.REVOLUTE, JointType.fromString(" Revolute "));
        try {
            JointType.fromString("prismatic");
            fail();
        } catch (ModelValidationException e) {
            assertTrue(e.getMessage().contains("prismatic"));
        }
    }

    @Test
    public void testEmptyTables() {
        assertRejected(FeModel.builder().build(), "At least one node");
    }
}
