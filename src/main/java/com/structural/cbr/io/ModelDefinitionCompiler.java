package com.structural.cbr.io;

import java.util.List;

import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;

import com.structural.cbr.model.FeModel;
import com.structural.cbr.model.JointSpec;
import com.structural.cbr.model.JointType;
import com.structural.cbr.model.ModelValidationException;
import com.structural.cbr.model.Section;
import com.structural.cbr.reduction.ReductionOptions;

/**
 * Turns a parsed {@link ModelDefinition} into an {@link FeModel} and, when the
 * file carries a {@code reduction} block, {@link ReductionOptions}.
 *
 * Only the document shape is checked here; table contents are checked by the
 * model validator.
 */
public final class ModelDefinitionCompiler {
    private static final Logger log = LogManager.getLogger(ModelDefinitionCompiler.class);

    /** Compilation result. {@code options} is null when the file has no reduction block. */
    public record CompiledModel(String name, FeModel model, ReductionOptions options) {
        public boolean hasOptions() {
            return options != null;
        }
    }

    public CompiledModel compile(ModelDefinition def) {
        FeModel.Builder b = FeModel.builder();

        for (double[] row : nonNull(def.getNodes())) {
            if (row == null || row.length != 4)
                throw new ModelValidationException("Node rows must be [id, x, y, z]");
            if (row[0] != Math.rint(row[0]))
                throw new ModelValidationException("Node ID must be an integer: " + row[0]);
            b.node((int) row[0], row[1], row[2], row[3]);
        }
        for (ModelDefinition.TypeDef t : nonNull(def.getTypes()))
            b.type(t.getId(), t.getName());
        for (ModelDefinition.SectionDef s : nonNull(def.getSections()))
            b.section(new Section(s.getId(), s.getArea(), s.getKy(), s.getKz(), s.getIxx(), s.getIyy(), s.getIzz(),
                    s.getYt(), s.getYb(), s.getZt(), s.getZb()));
        for (ModelDefinition.MaterialDef m : nonNull(def.getMaterials()))
            b.material(m.getId(), m.getE(), m.getNu(), m.getRho());
        for (ModelDefinition.ElementDef e : nonNull(def.getElements())) {
            int[] nodes = e.getNodes() == null ? new int[0] : e.getNodes();
            if (nodes.length > 3)
                throw new ModelValidationException("Element " + e.getId() + " lists more than 3 nodes");
            b.element(e.getId(), e.getType(), e.getSection(), e.getMaterial(), nodes);
        }
        for (ModelDefinition.JointDef j : nonNull(def.getJoints()))
            b.joint(new JointSpec(j.getId(), j.getNode(), JointType.fromString(j.getType())));

        FeModel model = b.build();
        ReductionOptions options = def.getReduction() == null ? null : options(def.getReduction());
        log.info("Compiled model '{}': {} nodes, {} elements, {} joints", def.getName(), model.nodes().size(),
                model.elements().size(), model.joints().size());
        return new CompiledModel(def.getName(), model, options);
    }

    static ReductionOptions options(ModelDefinition.ReductionDef r) {
        ReductionOptions.Builder b = ReductionOptions.builder()
                .interfaceNodes(nonNull(r.getInterfaceNodes()))
                .modeCount(r.getModeCount());
        if (r.getAutoModeFraction() != null)
            b.autoModeFraction(r.getAutoModeFraction());
        if (r.getMaxAutoModes() != null)
            b.maxAutoModes(r.getMaxAutoModes());
        if (r.getRcondThreshold() != null)
            b.rcondThreshold(r.getRcondThreshold());
        if (r.getMassRegularization() != null)
            b.massRegularization(r.getMassRegularization());
        if (r.getInputSymmetryTolerance() != null)
            b.inputSymmetryTolerance(r.getInputSymmetryTolerance());
        if (r.getBlockSymmetryTolerance() != null)
            b.blockSymmetryTolerance(r.getBlockSymmetryTolerance());
        if (r.getDenseConditionLimit() != null)
            b.denseConditionLimit(r.getDenseConditionLimit());
        return b.build();
    }

    private static <T> List<T> nonNull(List<T> list) {
        return list == null ? List.of() : list;
    }
}
