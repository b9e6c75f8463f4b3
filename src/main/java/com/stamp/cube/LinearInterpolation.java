package com.stamp.cube;

import java.util.Arrays;

/**
 * Piecewise-linear interpolation that never extrapolates. Points outside the sampled domain come back as NaN rather
 * than being invented from the nearest segment, and NaN samples poison only the segments that touch them.
 */
public abstract class LinearInterpolation {

    /**
     * @param x strictly increasing sample positions
     * @param y sample values, same length as x, may contain NaN
     * @param targets positions at which to evaluate
     * @return interpolated values, NaN wherever a target lies outside [x[0], x[n-1]]
     */
    public static double[] interpolate (double[] x, double[] y, double[] targets) {
        double[] result = new double[targets.length];
        for (int i = 0; i < targets.length; i++) {
            result[i] = interpolate(x, y, targets[i]);
        }
        return result;
    }

    public static double interpolate (double[] x, double[] y, double target) {
        int n = x.length;
        if (n == 0 || !(target >= x[0]) || !(target <= x[n - 1])) {
            return Double.NaN;
        }
        int index = Arrays.binarySearch(x, target);
        if (index >= 0) {
            // Exactly on a sample. Returning it untouched keeps re-sampling onto an existing grid lossless.
            return y[index];
        }
        int upper = -index - 1;
        int lower = upper - 1;
        double fraction = (target - x[lower]) / (x[upper] - x[lower]);
        return y[lower] + (y[upper] - y[lower]) * fraction;
    }

    /** Evenly spaced values from start to end inclusive, with the last value exactly equal to end. */
    public static double[] linspace (double start, double end, int n) {
        if (n <= 0) return new double[0];
        if (n == 1) return new double[] {start};
        double[] values = new double[n];
        double step = (end - start) / (n - 1);
        for (int i = 0; i < n; i++) {
            values[i] = start + i * step;
        }
        values[n - 1] = end;
        return values;
    }

}
