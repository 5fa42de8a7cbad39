package com.structural.cbr.joint;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

import com.structural.cbr.api.ReductionWarning;
import com.structural.cbr.model.EqualityConstraint;
import com.structural.cbr.model.FeModel;

/**
 * Output of revolute joint preprocessing.
 *
 * @param model          The model over the augmented node table and rewritten
 *                       elements.
 * @param constraints    Equality constraints for all joints, in joint order.
 * @param duplicates     Duplicate node IDs created per joint node, in joint
 *                       order.
 * @param warnings       Joints that were skipped.
 */
public record PreprocessedModel(FeModel model, List<EqualityConstraint> constraints,
        Map<Integer, List<Integer>> duplicates, List<ReductionWarning> warnings) {

    public PreprocessedModel {
        constraints = List.copyOf(constraints);
        duplicates = Collections.unmodifiableMap(new LinkedHashMap<>(duplicates));
        warnings = List.copyOf(warnings);
    }

    /** All duplicate node IDs, ordered by creation. */
    public List<Integer> duplicateNodeIds() {
        return duplicates.values().stream()
                .flatMap(List::stream)
                .toList();
    }

    public int duplicateCount() {
        return duplicates.values().stream().mapToInt(List::size).sum();
    }
}
