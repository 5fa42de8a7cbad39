package com.structural.cbr.assembly;

import java.util.HashSet;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Set;

import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;
import org.ejml.data.DMatrixRMaj;

import com.structural.cbr.api.DofKey;
import com.structural.cbr.api.DofSet;
import com.structural.cbr.model.EqualityConstraint;
import com.structural.cbr.model.ModelValidationException;
import com.structural.cbr.util.MatrixOps;

/**
 * Enforces two-term homogeneous equality constraints by eliminating the
 * constrained (second) DOF of each equation.
 *
 * <p>
 * Each constraint {@code 0 = c1·u1 + c2·u2} is rewritten as
 * {@code u2 = -(c1/c2)·u1}. Chains ({@code u3 = u2}, {@code u2 = u1}) resolve
 * to the first retained DOF. The transformation {@code T} expresses every
 * assembled DOF in terms of the retained ones, and the constrained system is
 * {@code (TᵗKT, TᵗMT)} over the retained DOFs in their assembled order.
 */
public final class ConstraintEliminator {
    private static final Logger log = LogManager.getLogger(ConstraintEliminator.class);

    private record Substitution(DofKey master, double factor) {
    }

    /**
     * @throws ModelValidationException for a non-homogeneous constraint, a zero
     *                                  slave coefficient, a self-constraint, a
     *                                  DOF outside the system, a DOF
     *                                  constrained twice or a cyclic chain.
     */
    public AssembledSystem eliminate(AssembledSystem system, List<EqualityConstraint> constraints) {
        if (constraints.isEmpty())
            return system;

        DofSet dofs = system.dofs();
        Map<DofKey, Substitution> direct = new LinkedHashMap<>();
        for (EqualityConstraint c : constraints) {
            if (c.rhs() != 0)
                throw new ModelValidationException("Only homogeneous constraints are supported: " + describe(c));
            if (c.coeff2() == 0)
                throw new ModelValidationException("Constraint has a zero coefficient on its eliminated DOF: "
                        + describe(c));
            if (c.dof1().equals(c.dof2()))
                throw new ModelValidationException("Constraint ties a DOF to itself: " + describe(c));
            if (!dofs.contains(c.dof1()) || !dofs.contains(c.dof2()))
                throw new ModelValidationException("Constraint references a DOF outside the system: " + describe(c));
            if (direct.putIfAbsent(c.dof2(), new Substitution(c.dof1(), -c.coeff1() / c.coeff2())) != null)
                throw new ModelValidationException("DOF " + c.dof2() + " is constrained more than once");
        }

        Map<DofKey, Substitution> resolved = new LinkedHashMap<>();
        for (DofKey slave : direct.keySet())
            resolved.put(slave, resolve(slave, direct));

        Set<DofKey> removed = new HashSet<>(resolved.keySet());
        DofSet retained = dofs.without(removed);

        DMatrixRMaj t = new DMatrixRMaj(dofs.size(), retained.size());
        for (int col = 0; col < retained.size(); col++)
            t.set(dofs.indexOf(retained.key(col)), col, 1.0);
        for (var entry : resolved.entrySet()) {
            Substitution s = entry.getValue();
            t.set(dofs.indexOf(entry.getKey()), retained.indexOf(s.master()), s.factor());
        }

        DMatrixRMaj k = MatrixOps.congruence(t, system.stiffness());
        DMatrixRMaj m = MatrixOps.congruence(t, system.mass());
        log.info("Applied {} constraint(s): {} -> {} DOFs", constraints.size(), dofs.size(), retained.size());
        return new AssembledSystem(retained, k, m);
    }

    private static Substitution resolve(DofKey slave, Map<DofKey, Substitution> direct) {
        Substitution s = direct.get(slave);
        DofKey master = s.master();
        double factor = s.factor();
        int hops = 0;
        while (direct.containsKey(master)) {
            if (++hops > direct.size())
                throw new ModelValidationException("Cyclic constraint chain through DOF " + slave);
            Substitution next = direct.get(master);
            factor *= next.factor();
            master = next.master();
        }
        return new Substitution(master, factor);
    }

    private static String describe(EqualityConstraint c) {
        return String.format("%g = %g*%s %+g*%s", c.rhs(), c.coeff1(), c.dof1(), c.coeff2(), c.dof2());
    }
}
