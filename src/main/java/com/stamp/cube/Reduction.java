package com.stamp.cube;

import com.google.common.collect.ImmutableList;

import java.util.List;

/** A reduced cube plus the bookkeeping the result metadata reports about the reduction. */
public class Reduction {

    public final TimeSeriesCube cube;

    /** Observed columns before capping. */
    public final int originalIntegrations;

    /** Observed columns actually emitted. */
    public final int plottedIntegrations;

    public final boolean subsampled;

    /** Human readable description of every range that was actually applied. */
    public final ImmutableList<String> appliedRanges;

    /** Bounds of the value range, after clamping, or null when none was applied. */
    public final double[] displayValueRange;

    /** For each emitted column, its index in the cube that was reduced. Increasing. */
    public final int[] keptColumns;

    public Reduction (TimeSeriesCube cube, int originalIntegrations, int plottedIntegrations, boolean subsampled,
                      List<String> appliedRanges, double[] displayValueRange, int[] keptColumns) {
        this.cube = cube;
        this.originalIntegrations = originalIntegrations;
        this.plottedIntegrations = plottedIntegrations;
        this.subsampled = subsampled;
        this.appliedRanges = ImmutableList.copyOf(appliedRanges);
        this.displayValueRange = displayValueRange;
        this.keptColumns = keptColumns;
    }

}
