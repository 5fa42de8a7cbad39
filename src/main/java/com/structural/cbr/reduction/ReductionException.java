package com.structural.cbr.reduction;

/**
 * Thrown when a reduction is structurally impossible: no master DOFs, no slave
 * DOFs, or an interface node that does not exist. The run produces no result.
 */
public class ReductionException extends IllegalStateException {

    public ReductionException(String message) {
        super(message);
    }
}
