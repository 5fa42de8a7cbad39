package com.structural.cbr.reduction;

import org.ejml.data.DMatrixRMaj;

/**
 * Result of static condensation.
 *
 * @param recovery           {@code −Kss⁻¹·Ksm}, slave rows by master columns.
 * @param transformation     {@code T_G = [I; recovery]}, master-first rows.
 * @param stiffness          {@code T_Gᵗ·K·T_G}.
 * @param mass               {@code T_Gᵗ·M·T_G}.
 * @param stiffnessRcond     Reciprocal condition of {@code Kss}.
 * @param pseudoInverseUsed  Whether {@code Kss} was treated as singular.
 */
public record GuyanReduction(DMatrixRMaj recovery, DMatrixRMaj transformation,
        DMatrixRMaj stiffness, DMatrixRMaj mass, double stiffnessRcond, boolean pseudoInverseUsed) {
}
