package com.structural.cbr.model;

/** Linear elastic material: Young's modulus, Poisson ratio and density. */
public record Material(int id, double youngsModulus, double poissonRatio, double density) {

    public double shearModulus() {
        return youngsModulus / (2.0 * (1.0 + poissonRatio));
    }
}
