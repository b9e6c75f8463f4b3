package com.stamp.cube;

import java.util.Arrays;

import static com.google.common.base.Preconditions.checkArgument;
import static com.google.common.base.Preconditions.checkState;

/**
 * The assembled result: a strictly increasing wavelength axis, a non-decreasing time axis in hours since the first
 * observation, and flux (and optionally uncertainty) matrices indexed [wavelength row][time column].
 *
 * Any cell may be NaN, meaning missing data, but the axes never contain NaN. The number of matrix rows always equals
 * the length of the wavelength axis and the number of columns always equals the length of the time axis; this is
 * checked on construction so that a stage producing mismatched shapes fails immediately rather than truncating.
 *
 * Instances are not modified after construction. Stages that subset, smooth or fill produce a new cube, which means a
 * cube held in a cache can be shared safely by several jobs.
 */
public class TimeSeriesCube {

    public final double[] wavelengthAxis;

    public final double[] timeAxis;

    public final double[][] flux;

    /** Uncertainty in the same shape as flux, or null when no input file carried uncertainties. */
    public final double[][] error;

    /**
     * Per-wavelength median flux over all observed columns, or null until the cube has been normalized. This is kept
     * alongside the raw flux so the variability view can always be recomputed losslessly.
     */
    public final double[] referenceSpectrum;

    /** True for columns manufactured by gap interpolation rather than observed. */
    public final boolean[] interpolated;

    public TimeSeriesCube (double[] wavelengthAxis, double[] timeAxis, double[][] flux, double[][] error,
                           double[] referenceSpectrum, boolean[] interpolated) {
        checkArgument(flux.length == wavelengthAxis.length,
            "Flux has %s rows but the wavelength axis has %s entries.", flux.length, wavelengthAxis.length);
        for (double[] row : flux) {
            checkArgument(row.length == timeAxis.length,
                "Flux row has %s columns but the time axis has %s entries.", row.length, timeAxis.length);
        }
        if (error != null) {
            checkArgument(error.length == wavelengthAxis.length, "Error matrix row count does not match flux.");
            for (double[] row : error) {
                checkArgument(row.length == timeAxis.length, "Error matrix column count does not match flux.");
            }
        }
        checkArgument(referenceSpectrum == null || referenceSpectrum.length == wavelengthAxis.length,
            "Reference spectrum length does not match the wavelength axis.");
        checkArgument(interpolated.length == timeAxis.length, "Interpolation mask length does not match time axis.");
        this.wavelengthAxis = wavelengthAxis;
        this.timeAxis = timeAxis;
        this.flux = flux;
        this.error = error;
        this.referenceSpectrum = referenceSpectrum;
        this.interpolated = interpolated;
    }

    /** Create a cube of observed columns only, before normalization. */
    public static TimeSeriesCube observed (double[] wavelengthAxis, double[] timeAxis, double[][] flux, double[][] error) {
        return new TimeSeriesCube(wavelengthAxis, timeAxis, flux, error, null, new boolean[timeAxis.length]);
    }

    public int nWavelengths () {
        return wavelengthAxis.length;
    }

    public int nTimes () {
        return timeAxis.length;
    }

    public boolean hasError () {
        return error != null;
    }

    public boolean isNormalized () {
        return referenceSpectrum != null;
    }

    /** @return the number of columns that were actually observed rather than interpolated. */
    public int nObservedTimes () {
        int n = 0;
        for (boolean b : interpolated) {
            if (!b) n++;
        }
        return n;
    }

    /**
     * Check the axis invariants: both axes finite, wavelengths strictly increasing, times non-decreasing and starting
     * at zero. Violations are defects in an earlier stage, so this throws IllegalStateException.
     */
    public TimeSeriesCube checkAxes () {
        for (int i = 0; i < wavelengthAxis.length; i++) {
            checkState(Double.isFinite(wavelengthAxis[i]), "Wavelength axis contains a non-finite value at %s.", i);
            checkState(i == 0 || wavelengthAxis[i] > wavelengthAxis[i - 1],
                "Wavelength axis is not strictly increasing at %s.", i);
        }
        for (int i = 0; i < timeAxis.length; i++) {
            checkState(Double.isFinite(timeAxis[i]), "Time axis contains a non-finite value at %s.", i);
            checkState(i == 0 || timeAxis[i] >= timeAxis[i - 1], "Time axis is decreasing at %s.", i);
        }
        return this;
    }

    public TimeSeriesCube withReferenceSpectrum (double[] referenceSpectrum) {
        return new TimeSeriesCube(wavelengthAxis, timeAxis, flux, error, referenceSpectrum, interpolated);
    }

    public TimeSeriesCube withFlux (double[][] newFlux) {
        return new TimeSeriesCube(wavelengthAxis, timeAxis, newFlux, error, referenceSpectrum, interpolated);
    }

    /**
     * The variability view: percentage deviation of each cell from the reference spectrum.
     * @throws IllegalStateException if the cube has not been normalized.
     */
    public double[][] variability () {
        checkState(isNormalized(), "Variability requires a reference spectrum.");
        return Normalizer.variability(flux, referenceSpectrum);
    }

    /** Keep only the given time columns, in the given order. Rows and the reference spectrum are unchanged. */
    public TimeSeriesCube selectColumns (int[] columns) {
        double[] newTimes = new double[columns.length];
        boolean[] newInterpolated = new boolean[columns.length];
        for (int c = 0; c < columns.length; c++) {
            newTimes[c] = timeAxis[columns[c]];
            newInterpolated[c] = interpolated[columns[c]];
        }
        return new TimeSeriesCube(
            wavelengthAxis, newTimes, selectColumns(flux, columns), error == null ? null : selectColumns(error, columns),
            referenceSpectrum, newInterpolated
        );
    }

    /** Keep only the given wavelength rows, trimming the reference spectrum along with the axis. */
    public TimeSeriesCube selectRows (int[] rows) {
        double[] newWavelengths = new double[rows.length];
        double[] newReference = referenceSpectrum == null ? null : new double[rows.length];
        double[][] newFlux = new double[rows.length][];
        double[][] newError = error == null ? null : new double[rows.length][];
        for (int r = 0; r < rows.length; r++) {
            newWavelengths[r] = wavelengthAxis[rows[r]];
            newFlux[r] = flux[rows[r]].clone();
            if (newError != null) newError[r] = error[rows[r]].clone();
            if (newReference != null) newReference[r] = referenceSpectrum[rows[r]];
        }
        return new TimeSeriesCube(newWavelengths, timeAxis.clone(), newFlux, newError, newReference, interpolated.clone());
    }

    private static double[][] selectColumns (double[][] matrix, int[] columns) {
        double[][] result = new double[matrix.length][columns.length];
        for (int r = 0; r < matrix.length; r++) {
            for (int c = 0; c < columns.length; c++) {
                result[r][c] = matrix[r][columns[c]];
            }
        }
        return result;
    }

    /** @return a deep copy sharing no arrays with this cube. */
    public TimeSeriesCube copy () {
        return new TimeSeriesCube(
            wavelengthAxis.clone(),
            timeAxis.clone(),
            deepCopy(flux),
            error == null ? null : deepCopy(error),
            referenceSpectrum == null ? null : referenceSpectrum.clone(),
            interpolated.clone()
        );
    }

    static double[][] deepCopy (double[][] matrix) {
        double[][] copy = new double[matrix.length][];
        for (int r = 0; r < matrix.length; r++) {
            copy[r] = matrix[r].clone();
        }
        return copy;
    }

    @Override
    public boolean equals (Object other) {
        if (this == other) return true;
        if (!(other instanceof TimeSeriesCube)) return false;
        TimeSeriesCube that = (TimeSeriesCube) other;
        return Arrays.equals(wavelengthAxis, that.wavelengthAxis)
            && Arrays.equals(timeAxis, that.timeAxis)
            && Arrays.deepEquals(flux, that.flux)
            && Arrays.deepEquals(error, that.error)
            && Arrays.equals(referenceSpectrum, that.referenceSpectrum)
            && Arrays.equals(interpolated, that.interpolated);
    }

    @Override
    public int hashCode () {
        return 31 * Arrays.hashCode(wavelengthAxis) + Arrays.hashCode(timeAxis);
    }

    @Override
    public String toString () {
        return String.format("TimeSeriesCube [%d wavelengths x %d times]", nWavelengths(), nTimes());
    }

}
