package com.structural.cbr.model;

/**
 * Thrown when model input is malformed: dangling references, duplicate IDs,
 * non-physical properties, unsupported joint or element kinds, or matrices that
 * do not fit their DOF set. Raised before any matrix work starts.
 */
public class ModelValidationException extends IllegalArgumentException {

    public ModelValidationException(String message) {
        super(message);
    }

    public ModelValidationException(String message, Throwable cause) {
        super(message, cause);
    }
}
