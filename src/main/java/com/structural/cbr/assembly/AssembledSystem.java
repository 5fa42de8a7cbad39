package com.structural.cbr.assembly;

import org.ejml.data.DMatrixRMaj;

import com.structural.cbr.api.DofSet;
import com.structural.cbr.model.ModelValidationException;
import com.structural.cbr.util.MatrixOps;

/**
 * Stiffness and mass matrices paired with the DOF set that labels their rows
 * and columns.
 *
 * The three parts always travel together; construction checks that both
 * matrices are square and sized to the DOF set. Accessors hand out copies, so
 * an instance never changes after construction.
 */
public final class AssembledSystem {
    private final DofSet dofs;
    private final DMatrixRMaj stiffness;
    private final DMatrixRMaj mass;

    public AssembledSystem(DofSet dofs, DMatrixRMaj stiffness, DMatrixRMaj mass) {
        requireShape("K", stiffness, dofs.size());
        requireShape("M", mass, dofs.size());
        this.dofs = dofs;
        this.stiffness = stiffness.copy();
        this.mass = mass.copy();
    }

    private static void requireShape(String name, DMatrixRMaj m, int n) {
        if (m.numRows != n || m.numCols != n)
            throw new ModelValidationException(name + " is " + m.numRows + "x" + m.numCols
                    + " but the DOF set has " + n + " entries");
    }

    public DofSet dofs() {
        return dofs;
    }

    public int size() {
        return dofs.size();
    }

    public DMatrixRMaj stiffness() {
        return stiffness.copy();
    }

    public DMatrixRMaj mass() {
        return mass.copy();
    }

    public double stiffnessAsymmetry() {
        return MatrixOps.relativeAsymmetry(stiffness);
    }

    public double massAsymmetry() {
        return MatrixOps.relativeAsymmetry(mass);
    }

    /**
     * Rejects matrices whose relative Frobenius asymmetry exceeds
     * {@code tolerance}.
     *
     * @throws ModelValidationException if K or M is not symmetric.
     */
    public void requireSymmetric(double tolerance) {
        double k = stiffnessAsymmetry();
        if (!(k <= tolerance))
            throw new ModelValidationException(String.format("K is not symmetric (relative asymmetry %.3e)", k));
        double m = massAsymmetry();
        if (!(m <= tolerance))
            throw new ModelValidationException(String.format("M is not symmetric (relative asymmetry %.3e)", m));
    }

    @Override
    public String toString() {
        return "AssembledSystem[" + dofs.size() + " DOFs]";
    }
}
