package com.structural.cbr.model;

import com.structural.cbr.api.DofKey;

/**
 * Two-term linear constraint {@code rhs = c1 * dof1 + c2 * dof2}.
 *
 * Joint preprocessing only produces the homogeneous form
 * {@code 0 = 1 * master - 1 * slave}, i.e. the second DOF follows the first.
 */
public record EqualityConstraint(double rhs, double coeff1, DofKey dof1, double coeff2, DofKey dof2) {

    public static EqualityConstraint tie(DofKey master, DofKey slave) {
        return new EqualityConstraint(0.0, 1.0, master, -1.0, slave);
    }

    public DofKey master() {
        return dof1;
    }

    public DofKey slave() {
        return dof2;
    }

    /** Row form {@code [rhs, c1, label1, c2, label2]}. */
    public double[] toRow() {
        return new double[] { rhs, coeff1, dof1.encode(), coeff2, dof2.encode() };
    }
}
