package com.structural.cbr.reduction;

import org.ejml.data.DMatrixRMaj;

/**
 * Fixed-interface modes of the slave block, or the reason there are none.
 *
 * <ul>
 * <li>{@link Outcome#CONVERGED}: {@link #modeCount()} modes, ascending.</li>
 * <li>{@link Outcome#NOT_REQUESTED}: zero modes were asked for.</li>
 * <li>{@link Outcome#DEGRADED}: the eigensolve failed; the reduction continues
 * as pure Guyan condensation.</li>
 * </ul>
 */
public final class ModalSolution {

    public enum Outcome {
        CONVERGED,
        NOT_REQUESTED,
        DEGRADED
    }

    private final Outcome outcome;
    private final int requestedCount;
    private final DMatrixRMaj modeShapes;
    private final double[] eigenvalues;
    private final double[] frequencies;
    private final String failureReason;

    private ModalSolution(Outcome outcome, int requestedCount, DMatrixRMaj modeShapes,
            double[] eigenvalues, String failureReason) {
        this.outcome = outcome;
        this.requestedCount = requestedCount;
        this.modeShapes = modeShapes;
        this.eigenvalues = eigenvalues;
        this.frequencies = new double[eigenvalues.length];
        for (int i = 0; i < eigenvalues.length; i++)
            frequencies[i] = frequencyHz(eigenvalues[i]);
        this.failureReason = failureReason;
    }

    static ModalSolution converged(int requested, DMatrixRMaj shapes, double[] eigenvalues) {
        return new ModalSolution(Outcome.CONVERGED, requested, shapes, eigenvalues.clone(), null);
    }

    static ModalSolution notRequested(int slaveCount) {
        return new ModalSolution(Outcome.NOT_REQUESTED, 0, new DMatrixRMaj(slaveCount, 0), new double[0], null);
    }

    static ModalSolution degraded(int slaveCount, int requested, String reason) {
        return new ModalSolution(Outcome.DEGRADED, requested, new DMatrixRMaj(slaveCount, 0), new double[0], reason);
    }

    /** Natural frequency in Hz of eigenvalue {@code λ}: {@code sqrt(|λ|) / 2π}. */
    public static double frequencyHz(double lambda) {
        return Math.sqrt(Math.abs(lambda)) / (2 * Math.PI);
    }

    public Outcome outcome() {
        return outcome;
    }

    public boolean hasModes() {
        return modeCount() > 0;
    }

    public boolean isDegraded() {
        return outcome == Outcome.DEGRADED;
    }

    /** Mode count after clamping to the slave count. */
    public int requestedCount() {
        return requestedCount;
    }

    public int modeCount() {
        return eigenvalues.length;
    }

    /** Mass-normalized mode shapes as columns, slave rows. */
    public DMatrixRMaj modeShapes() {
        return modeShapes.copy();
    }

    public double[] eigenvalues() {
        return eigenvalues.clone();
    }

    public double[] frequencies() {
        return frequencies.clone();
    }

    /** Why the solve degraded, or null. */
    public String failureReason() {
        return failureReason;
    }
}
