package com.structural.cbr.reduction;

import org.ejml.data.DMatrixRMaj;

/**
 * Stiffness and mass blocks of a master/slave split, plus both matrices in
 * master-first order ({@code kp}, {@code mp}).
 *
 * Stages share these matrices and treat them as read-only.
 */
public record PartitionedSystem(
        DMatrixRMaj kmm, DMatrixRMaj kms, DMatrixRMaj ksm, DMatrixRMaj kss,
        DMatrixRMaj mmm, DMatrixRMaj mms, DMatrixRMaj msm, DMatrixRMaj mss,
        DMatrixRMaj kp, DMatrixRMaj mp) {

    public int masterCount() {
        return kmm.numRows;
    }

    public int slaveCount() {
        return kss.numRows;
    }

    public int size() {
        return kp.numRows;
    }
}
