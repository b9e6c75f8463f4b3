package com.stamp.cube;

import gnu.trove.list.array.TIntArrayList;

import java.util.Arrays;
import java.util.Comparator;
import java.util.stream.IntStream;

import static com.google.common.base.Preconditions.checkArgument;

/**
 * One exposure's spectrum: wavelength, flux, optional uncertainty and a timestamp. Instances are produced by the
 * format readers and are never modified afterward. The arrays are exposed directly for speed and must be treated as
 * read-only by every consumer.
 */
public class Integration {

    public final double[] wavelength;

    public final double[] flux;

    /** One standard deviation per point, or null when the source file carries no uncertainty at all. */
    public final double[] error;

    /** Absolute time in days, as stored in the file (MJD or BJD depending on the producing pipeline). */
    public final double time;

    public Integration (double[] wavelength, double[] flux, double[] error, double time) {
        checkArgument(wavelength.length == flux.length, "Wavelength and flux lengths differ.");
        checkArgument(error == null || error.length == flux.length, "Error and flux lengths differ.");
        this.wavelength = wavelength;
        this.flux = flux;
        this.error = error;
        this.time = time;
    }

    public int size () {
        return wavelength.length;
    }

    public boolean hasError () {
        return error != null;
    }

    public double minWavelength () {
        return wavelength[0];
    }

    public double maxWavelength () {
        return wavelength[wavelength.length - 1];
    }

    /**
     * Build an integration from raw arrays, keeping only points where both wavelength and flux are finite, sorted by
     * wavelength. Repeated wavelengths keep their first occurrence so the resulting domain is strictly increasing.
     * An error value may still be NaN where the flux is finite: that uncertainty is simply unknown.
     */
    public static Integration sanitized (double[] wavelength, double[] flux, double[] error, double time) {
        int n = Math.min(wavelength.length, flux.length);
        TIntArrayList keep = new TIntArrayList(n);
        for (int i = 0; i < n; i++) {
            if (Double.isFinite(wavelength[i]) && Double.isFinite(flux[i])) {
                keep.add(i);
            }
        }
        int[] order = IntStream.of(keep.toArray())
            .boxed()
            .sorted(Comparator.comparingDouble(i -> wavelength[i]))
            .mapToInt(Integer::intValue)
            .toArray();
        TIntArrayList unique = new TIntArrayList(order.length);
        for (int index : order) {
            if (unique.isEmpty() || wavelength[index] > wavelength[unique.get(unique.size() - 1)]) {
                unique.add(index);
            }
        }
        double[] w = new double[unique.size()];
        double[] f = new double[unique.size()];
        double[] e = error == null ? null : new double[unique.size()];
        for (int i = 0; i < unique.size(); i++) {
            int source = unique.get(i);
            w[i] = wavelength[source];
            f[i] = flux[source];
            if (e != null) {
                e[i] = source < error.length ? error[source] : Double.NaN;
            }
        }
        return new Integration(w, f, e, time);
    }

    @Override
    public String toString () {
        return String.format("Integration at %.6f (%d points, %s)", time, size(), hasError() ? "with error" : "no error");
    }

    @Override
    public boolean equals (Object other) {
        if (this == other) return true;
        if (!(other instanceof Integration)) return false;
        Integration that = (Integration) other;
        return Double.compare(time, that.time) == 0
            && Arrays.equals(wavelength, that.wavelength)
            && Arrays.equals(flux, that.flux)
            && Arrays.equals(error, that.error);
    }

    @Override
    public int hashCode () {
        return 31 * Double.hashCode(time) + Arrays.hashCode(wavelength);
    }

}
