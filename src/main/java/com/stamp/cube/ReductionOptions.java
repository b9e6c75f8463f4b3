package com.stamp.cube;

/**
 * What the Reducer should do to an assembled cube before it is handed to presentation. Ranges are null when not
 * requested.
 */
public class ReductionOptions {

    /** Maximum number of time columns to emit, or 0 for no cap. */
    public int integrationCap;

    /** Standard deviation, in columns, of the Gaussian smoothing along time, or 0 for none. */
    public double smoothingSigma;

    public DisplayMode displayMode = DisplayMode.VARIABILITY;

    public AxisRange wavelengthRange;

    public AxisRange timeRange;

    /** Range over the displayed values (variability percent or flux, depending on the display mode). */
    public AxisRange valueRange;

}
