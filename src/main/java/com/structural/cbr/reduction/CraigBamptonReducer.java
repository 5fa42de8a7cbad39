package com.structural.cbr.reduction;

import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.function.Supplier;

import org.ejml.dense.row.MatrixFeatures_DDRM;

import com.structural.cbr.api.ReductionListener;
import com.structural.cbr.api.ReductionWarning;
import com.structural.cbr.assembly.AssembledSystem;
import com.structural.cbr.model.ModelValidationException;
import com.structural.cbr.model.Node;
import com.structural.cbr.util.CompositeReductionListener;

import lombok.extern.log4j.Log4j2;

/**
 * Runs the reduction core on an assembled, constraint-free system.
 *
 * <pre>
 * DOF partition -> matrix partition -> Guyan condensation
 *               -> fixed-interface modes -> Craig-Bampton assembly
 * </pre>
 *
 * <p>
 * Each stage consumes the previous stage's output and produces new matrices;
 * the input system is never modified. A call either returns a complete
 * {@link ReducedModel} or throws, in which case nothing is returned.
 * Numerical problems that have a fallback are logged, reported to the
 * listeners and collected on the result.
 *
 * <p>
 * Instances hold no per-call state and may be reused. Listeners are invoked on
 * the calling thread.
 */
@Log4j2
public final class CraigBamptonReducer {
    public static final String STAGE_DOF_PARTITION = "dof-partition";
    public static final String STAGE_MATRIX_PARTITION = "matrix-partition";
    public static final String STAGE_GUYAN = "guyan-condensation";
    public static final String STAGE_MODES = "fixed-interface-modes";
    public static final String STAGE_CRAIG_BAMPTON = "craig-bampton-assembly";

    private final ReductionOptions options;
    private final CompositeReductionListener listeners = new CompositeReductionListener();

    public CraigBamptonReducer(ReductionOptions options) {
        this.options = options;
    }

    public CraigBamptonReducer addListener(ReductionListener listener) {
        listeners.add(listener);
        return this;
    }

    public ReductionOptions options() {
        return options;
    }

    /**
     * @param system DOF set with its K and M, taken as-is.
     * @param nodes  Node table for resolving interface coordinates.
     * @throws ModelValidationException if K or M is non-finite or not symmetric.
     * @throws ReductionException       if the interface cannot be resolved or the
     *                                  master/slave split is degenerate.
     */
    public ReducedModel reduce(AssembledSystem system, Map<Integer, Node> nodes) {
        validate(system);

        List<ReductionWarning> warnings = new ArrayList<>();
        CompositeReductionListener run = new CompositeReductionListener(listeners, new ReductionListener() {
            @Override
            public void onWarning(ReductionWarning warning) {
                warnings.add(warning);
            }
        });

        log.info("Reducing {} DOFs onto {} interface node(s)", system.size(), options.getInterfaceNodes().size());

        DofPartition partition = stage(run, STAGE_DOF_PARTITION,
                () -> new DofPartitioner(run).partition(system.dofs(), options.getInterfaceNodes(), nodes));
        PartitionedSystem blocks = stage(run, STAGE_MATRIX_PARTITION,
                () -> new MatrixPartitioner(run, options.getBlockSymmetryTolerance()).partition(system, partition));
        GuyanReduction guyan = stage(run, STAGE_GUYAN, () -> new GuyanReducer(run, options).reduce(blocks));
        ModalSolution modes = stage(run, STAGE_MODES, () -> new ModalSolver(run, options).solve(blocks));
        CraigBamptonAssembler.Result cb = stage(run, STAGE_CRAIG_BAMPTON,
                () -> new CraigBamptonAssembler().assemble(blocks, guyan, modes));

        ReducedModel reduced = ReducedModel.builder()
                .partition(partition)
                .guyan(guyan)
                .modes(modes)
                .craigBampton(cb)
                .warnings(warnings)
                .build();
        log.info("Reduced {} -> {} DOFs (ratio {}), {} mode(s), {} warning(s)", reduced.originalSize(),
                reduced.reducedSize(), String.format("%.4f", reduced.reductionRatio()), reduced.modeCount(),
                warnings.size());
        return reduced;
    }

    private void validate(AssembledSystem system) {
        if (MatrixFeatures_DDRM.hasUncountable(system.stiffness()))
            throw new ModelValidationException("K contains NaN or infinite entries");
        if (MatrixFeatures_DDRM.hasUncountable(system.mass()))
            throw new ModelValidationException("M contains NaN or infinite entries");
        system.requireSymmetric(options.getInputSymmetryTolerance());
    }

    private static <T> T stage(ReductionListener listener, String name, Supplier<T> body) {
        listener.onStageStart(name);
        long start = System.nanoTime();
        T result = body.get();
        listener.onStageEnd(name, System.nanoTime() - start);
        return result;
    }
}
