package com.structural.cbr;

import java.util.ArrayList;
import java.util.List;

import com.structural.cbr.api.ReductionWarning;
import com.structural.cbr.assembly.AssembledSystem;
import com.structural.cbr.joint.PreprocessedModel;
import com.structural.cbr.reduction.ReducedModel;

/**
 * Intermediate and final products of one {@link BeamReducer} call.
 *
 * @param preprocessed Model after revolute joint expansion, with its constraints.
 * @param assembled    Unconstrained K and M.
 * @param constrained  K and M after constraint elimination; the reduction input.
 * @param reduced      The reduced model.
 */
public record ReductionRun(PreprocessedModel preprocessed, AssembledSystem assembled,
        AssembledSystem constrained, ReducedModel reduced) {

    /** Preprocessing warnings followed by reduction warnings. */
    public List<ReductionWarning> warnings() {
        List<ReductionWarning> all = new ArrayList<>(preprocessed.warnings());
        all.addAll(reduced.warnings());
        return List.copyOf(all);
    }
}
