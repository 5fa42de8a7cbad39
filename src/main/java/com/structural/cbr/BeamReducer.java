package com.structural.cbr;

import java.io.IOException;
import java.nio.file.Path;
import java.util.function.Supplier;

import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;

import com.structural.cbr.api.ReductionListener;
import com.structural.cbr.assembly.AssembledSystem;
import com.structural.cbr.assembly.Beam2dAssembler;
import com.structural.cbr.assembly.ConstraintEliminator;
import com.structural.cbr.assembly.FeAssembler;
import com.structural.cbr.io.ModelDefinitionCompiler;
import com.structural.cbr.io.ModelDefinitionParser;
import com.structural.cbr.joint.PreprocessedModel;
import com.structural.cbr.joint.RevoluteJointPreprocessor;
import com.structural.cbr.model.FeModel;
import com.structural.cbr.model.ModelValidationException;
import com.structural.cbr.model.ModelValidator;
import com.structural.cbr.reduction.CraigBamptonReducer;
import com.structural.cbr.reduction.ReducedModel;
import com.structural.cbr.reduction.ReductionOptions;
import com.structural.cbr.util.CompositeReductionListener;

/**
 * Model-level entry point.
 * <p>
 * Runs the whole pipeline for one model:
 * <ul>
 * <li>validating the tables</li>
 * <li>expanding revolute joints</li>
 * <li>assembling K and M with the configured {@link FeAssembler}</li>
 * <li>eliminating the joint constraints</li>
 * <li>Craig-Bampton reduction onto the interface nodes</li>
 * </ul>
 * The call is all-or-nothing: any validation or structural error propagates
 * and no partial result is returned.
 */
public class BeamReducer {
    private static final Logger log = LogManager.getLogger(BeamReducer.class);

    public static final String STAGE_VALIDATE = "validate";
    public static final String STAGE_JOINTS = "revolute-joints";
    public static final String STAGE_ASSEMBLE = "assemble";
    public static final String STAGE_CONSTRAINTS = "constraints";

    private final FeAssembler assembler;
    private final ConstraintEliminator eliminator = new ConstraintEliminator();
    private final CompositeReductionListener listeners = new CompositeReductionListener();

    public BeamReducer() {
        this(new Beam2dAssembler());
    }

    public BeamReducer(FeAssembler assembler) {
        this.assembler = assembler;
    }

    public BeamReducer addListener(ReductionListener listener) {
        listeners.add(listener);
        return this;
    }

    /**
     * Loads a JSON model file and reduces it with the options in its
     * {@code reduction} block.
     *
     * @throws ModelValidationException if the file has no reduction block.
     */
    public ReductionRun reduce(Path jsonPath) throws IOException {
        var compiled = new ModelDefinitionCompiler().compile(ModelDefinitionParser.parseFile(jsonPath));
        if (!compiled.hasOptions())
            throw new ModelValidationException("Model file " + jsonPath + " has no 'reduction' block");
        return reduce(compiled.model(), compiled.options());
    }

    public ReductionRun reduce(FeModel model, ReductionOptions options) {
        long start = System.nanoTime();

        stage(STAGE_VALIDATE, () -> {
            ModelValidator.validate(model);
            return model;
        });
        PreprocessedModel pre = stage(STAGE_JOINTS, () -> new RevoluteJointPreprocessor(listeners).process(model));
        AssembledSystem assembled = stage(STAGE_ASSEMBLE, () -> assembler.assemble(pre.model()));
        AssembledSystem constrained = stage(STAGE_CONSTRAINTS,
                () -> eliminator.eliminate(assembled, pre.constraints()));

        ReducedModel reduced = new CraigBamptonReducer(options)
                .addListener(listeners)
                .reduce(constrained, pre.model().nodesById());

        ReductionRun run = new ReductionRun(pre, assembled, constrained, reduced);
        log.info("Reduction finished in {} ms\n{}", String.format("%.1f", (System.nanoTime() - start) / 1e6),
                reduced.summary());
        return run;
    }

    private <T> T stage(String name, Supplier<T> body) {
        listeners.onStageStart(name);
        long t0 = System.nanoTime();
        T result = body.get();
        listeners.onStageEnd(name, System.nanoTime() - t0);
        return result;
    }
}
