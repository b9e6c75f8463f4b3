package com.stamp.cube;

/**
 * A user-requested range along one axis (or over displayed values). Either bound may be null, meaning "from the
 * start of the data" or "to the end of the data".
 */
public record AxisRange (Double min, Double max) {

    public static AxisRange of (Double min, Double max) {
        if (min == null && max == null) return null;
        return new AxisRange(min, max);
    }

    /**
     * Resolve open bounds against the extent of the data and clamp both bounds to that extent.
     * @return {min, max}, where min may not be less than max if the request did not intersect the data.
     */
    public double[] clampTo (double dataMin, double dataMax) {
        double lo = min == null ? dataMin : Math.max(min, dataMin);
        double hi = max == null ? dataMax : Math.min(max, dataMax);
        return new double[] {lo, hi};
    }

}
