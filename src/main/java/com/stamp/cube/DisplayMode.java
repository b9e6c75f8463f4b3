package com.stamp.cube;

/**
 * Which representation of the cube is shown. This is a display-time choice: the cube always carries raw flux and the
 * reference spectrum, so either view can be derived at any time.
 */
public enum DisplayMode {

    /** Percentage deviation from the per-wavelength median. */
    VARIABILITY,

    /** Raw flux in the units of the input files. */
    FLUX;

    /** @return the matrix of displayed values for this mode. */
    public double[][] valuesOf (TimeSeriesCube cube) {
        return this == FLUX ? cube.flux : cube.variability();
    }

    public static DisplayMode fromString (String value) {
        if (value == null || value.isBlank()) return VARIABILITY;
        return "flux".equalsIgnoreCase(value.trim()) ? FLUX : VARIABILITY;
    }

}
