package com.structural.cbr.model;

import java.util.Locale;

/** Supported joint kinds. */
public enum JointType {
    REVOLUTE;

    public static JointType fromString(String s) {
        if (s == null)
            throw new ModelValidationException("Joint type must not be null");
        try {
            return valueOf(s.trim().toUpperCase(Locale.ROOT));
        } catch (IllegalArgumentException e) {
            throw new ModelValidationException("Unsupported joint type '" + s + "', only revolute is supported", e);
        }
    }
}
