package com.structural.cbr.reduction;

import java.util.ArrayList;
import java.util.List;

import com.structural.cbr.model.ModelValidationException;

import lombok.Getter;

/**
 * Settings for one reduction run.
 *
 * Only the interface node list is mandatory. A {@code null} mode count means
 * "choose automatically": {@code round(autoModeFraction * slaveCount)}, at
 * least 1, at most {@code maxAutoModes}.
 */
@Getter
public final class ReductionOptions {
    public static final double DEFAULT_AUTO_MODE_FRACTION = 0.1;
    public static final int DEFAULT_MAX_AUTO_MODES = 20;
    public static final double DEFAULT_RCOND_THRESHOLD = 1e-12;
    public static final double DEFAULT_MASS_REGULARIZATION = 1e-10;
    public static final double DEFAULT_INPUT_SYMMETRY_TOLERANCE = 1e-8;
    public static final double DEFAULT_BLOCK_SYMMETRY_TOLERANCE = 1e-10;
    public static final int DEFAULT_DENSE_CONDITION_LIMIT = 200;

    private final List<Integer> interfaceNodes;
    private final Integer modeCount;
    private final double autoModeFraction;
    private final int maxAutoModes;
    private final double rcondThreshold;
    private final double massRegularization;
    private final double inputSymmetryTolerance;
    private final double blockSymmetryTolerance;
    private final int denseConditionLimit;

    private ReductionOptions(Builder b) {
        this.interfaceNodes = List.copyOf(b.interfaceNodes);
        this.modeCount = b.modeCount;
        this.autoModeFraction = b.autoModeFraction;
        this.maxAutoModes = b.maxAutoModes;
        this.rcondThreshold = b.rcondThreshold;
        this.massRegularization = b.massRegularization;
        this.inputSymmetryTolerance = b.inputSymmetryTolerance;
        this.blockSymmetryTolerance = b.blockSymmetryTolerance;
        this.denseConditionLimit = b.denseConditionLimit;
    }

    /** True when the caller left the mode count to the automatic rule. */
    public boolean isAutoModeCount() {
        return modeCount == null;
    }

    /** Automatic mode count for {@code slaveCount} internal DOFs. */
    public int autoModeCount(int slaveCount) {
        int n = (int) Math.round(slaveCount * autoModeFraction);
        return Math.max(Math.min(n, maxAutoModes), 1);
    }

    public static Builder builder() {
        return new Builder();
    }

    public static Builder builder(int... interfaceNodes) {
        Builder b = new Builder();
        for (int n : interfaceNodes)
            b.interfaceNode(n);
        return b;
    }

    public static final class Builder {
        private final List<Integer> interfaceNodes = new ArrayList<>();
        private Integer modeCount;
        private double autoModeFraction = DEFAULT_AUTO_MODE_FRACTION;
        private int maxAutoModes = DEFAULT_MAX_AUTO_MODES;
        private double rcondThreshold = DEFAULT_RCOND_THRESHOLD;
        private double massRegularization = DEFAULT_MASS_REGULARIZATION;
        private double inputSymmetryTolerance = DEFAULT_INPUT_SYMMETRY_TOLERANCE;
        private double blockSymmetryTolerance = DEFAULT_BLOCK_SYMMETRY_TOLERANCE;
        private int denseConditionLimit = DEFAULT_DENSE_CONDITION_LIMIT;

        public Builder interfaceNode(int nodeId) {
            interfaceNodes.add(nodeId);
            return this;
        }

        public Builder interfaceNodes(List<Integer> nodeIds) {
            interfaceNodes.addAll(nodeIds);
            return this;
        }

        /** Fixed number of fixed-interface modes; {@code null} selects the automatic rule. */
        public Builder modeCount(Integer count) {
            this.modeCount = count;
            return this;
        }

        public Builder autoModeFraction(double fraction) {
            this.autoModeFraction = fraction;
            return this;
        }

        public Builder maxAutoModes(int max) {
            this.maxAutoModes = max;
            return this;
        }

        public Builder rcondThreshold(double threshold) {
            this.rcondThreshold = threshold;
            return this;
        }

        public Builder massRegularization(double shift) {
            this.massRegularization = shift;
            return this;
        }

        public Builder inputSymmetryTolerance(double tolerance) {
            this.inputSymmetryTolerance = tolerance;
            return this;
        }

        public Builder blockSymmetryTolerance(double tolerance) {
            this.blockSymmetryTolerance = tolerance;
            return this;
        }

        public Builder denseConditionLimit(int limit) {
            this.denseConditionLimit = limit;
            return this;
        }

        public ReductionOptions build() {
            if (interfaceNodes.isEmpty())
                throw new ModelValidationException("At least one interface node is required");
            if (interfaceNodes.stream().distinct().count() != interfaceNodes.size())
                throw new ModelValidationException("Interface nodes must be distinct: " + interfaceNodes);
            if (modeCount != null && modeCount < 0)
                throw new ModelValidationException("Mode count must not be negative: " + modeCount);
            if (!(autoModeFraction > 0) || maxAutoModes < 1)
                throw new ModelValidationException("Automatic mode rule needs a positive fraction and cap");
            if (!(rcondThreshold >= 0) || !(massRegularization >= 0))
                throw new ModelValidationException("Conditioning thresholds must not be negative");
            if (!(inputSymmetryTolerance >= 0) || !(blockSymmetryTolerance >= 0))
                throw new ModelValidationException("Symmetry tolerances must not be negative");
            return new ReductionOptions(this);
        }
    }
}
