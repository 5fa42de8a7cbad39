package com.structural.cbr.api;

/**
 * Physical motion component of a degree of freedom.
 *
 * The numeric codes follow the usual FE convention (1..3 translations, 4..6
 * rotations). A 2D beam model only keeps {@link #UX}, {@link #UY} and
 * {@link #RZ}.
 */
public enum DofComponent {
    UX(1),
    UY(2),
    UZ(3),
    RX(4),
    RY(5),
    RZ(6);

    private static final DofComponent[] BY_CODE = new DofComponent[7];

    static {
        for (DofComponent c : values())
            BY_CODE[c.code] = c;
    }

    private final int code;

    DofComponent(int code) {
        this.code = code;
    }

    public int code() {
        return code;
    }

    /** True for the components that survive 2D beam assembly. */
    public boolean isPlanar() {
        return this == UX || this == UY || this == RZ;
    }

    public static DofComponent fromCode(int code) {
        if (code < 1 || code > 6)
            throw new IllegalArgumentException("Unknown DOF component code: " + code);
        return BY_CODE[code];
    }
}
