package com.stamp.cube;

/** An integration's flux and error after interpolation onto the common wavelength grid. */
public class RegriddedIntegration {

    /** Absolute time in days, copied from the source integration. */
    public final double time;

    public final double[] flux;

    /** Null when the source integration had no error column at all. */
    public final double[] error;

    public RegriddedIntegration (double time, double[] flux, double[] error) {
        this.time = time;
        this.flux = flux;
        this.error = error;
    }

}
