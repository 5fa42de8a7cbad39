package com.structural.cbr.model;

/**
 * Cross-section properties.
 *
 * {@code ky}/{@code kz} are shear area factors; an infinite value means the
 * section is rigid in shear. {@code yt, yb, zt, zb} are extreme-fiber
 * distances.
 */
public record Section(int id, double area, double ky, double kz,
        double ixx, double iyy, double izz,
        double yt, double yb, double zt, double zb) {
}
