package com.structural.cbr.model;

/** Element type table row, e.g. {@code (1, "beam")}. */
public record ElementType(int id, String name) {

    public boolean isBeam() {
        return name != null && name.trim().equalsIgnoreCase("beam");
    }
}
