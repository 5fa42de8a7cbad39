package com.structural.cbr.api;

/**
 * A non-fatal condition raised somewhere in the pipeline.
 *
 * Warnings never stop a run; they are logged where they arise and collected on
 * the result so callers can tell a degraded reduction from a clean one without
 * parsing log text.
 */
public record ReductionWarning(Kind kind, String message) {

    public enum Kind {
        /** A revolute joint touched fewer than two elements and was skipped. */
        VACUOUS_JOINT,
        /** A named interface node has no DOFs in the assembled set. */
        INTERFACE_NODE_WITHOUT_DOFS,
        /** A named interface node has some but not all of Ux, Uy and Rz. */
        PARTIAL_INTERFACE_NODE,
        /** A partitioned block failed the symmetry consistency check. */
        ASYMMETRIC_BLOCK,
        /** Kss was near-singular; a pseudo-inverse was used. */
        ILL_CONDITIONED_STIFFNESS,
        /** Mss was near-singular; it was regularized before the eigensolve. */
        ILL_CONDITIONED_MASS,
        /** The eigensolve failed; the reduction fell back to Guyan only. */
        EIGENSOLVE_FAILED
    }

    @Override
    public String toString() {
        return kind + ": " + message;
    }
}
