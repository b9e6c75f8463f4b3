package com.stamp.cube;

import gnu.trove.list.array.TDoubleArrayList;
import org.apache.commons.math3.stat.descriptive.rank.Median;

/**
 * Computes the reference spectrum (per-wavelength median of observed flux, ignoring missing cells) and the
 * variability view derived from it. Normalizing never alters flux; it only attaches the reference spectrum.
 */
public abstract class Normalizer {

    public static TimeSeriesCube normalize (TimeSeriesCube cube) {
        return cube.withReferenceSpectrum(referenceSpectrum(cube.flux, cube.interpolated));
    }

    /**
     * Median of the finite values in each row, over observed columns only. A row with no finite observed value has a
     * NaN reference.
     */
    public static double[] referenceSpectrum (double[][] flux, boolean[] interpolated) {
        Median median = new Median();
        double[] reference = new double[flux.length];
        TDoubleArrayList finite = new TDoubleArrayList();
        for (int r = 0; r < flux.length; r++) {
            finite.resetQuick();
            for (int c = 0; c < flux[r].length; c++) {
                if (interpolated != null && interpolated[c]) continue;
                if (Double.isFinite(flux[r][c])) finite.add(flux[r][c]);
            }
            reference[r] = finite.isEmpty() ? Double.NaN : median.evaluate(finite.toArray());
        }
        return reference;
    }

    /**
     * Percentage deviation of each cell from the row's reference: 100 * (flux / reference - 1). A zero or NaN
     * reference yields NaN for the whole row, as does a NaN cell.
     */
    public static double[][] variability (double[][] flux, double[] reference) {
        double[][] result = new double[flux.length][];
        for (int r = 0; r < flux.length; r++) {
            double ref = reference[r];
            boolean usable = Double.isFinite(ref) && ref != 0;
            result[r] = new double[flux[r].length];
            for (int c = 0; c < flux[r].length; c++) {
                result[r][c] = usable ? 100 * (flux[r][c] / ref - 1) : Double.NaN;
            }
        }
        return result;
    }

}
