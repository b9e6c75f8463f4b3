package com.stamp.cube;

import com.stamp.cube.progress.NoopProgressListener;
import com.stamp.cube.progress.ProgressListener;
import gnu.trove.list.array.TIntArrayList;
import org.apache.commons.math3.util.FastMath;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.List;

import static com.google.common.base.Preconditions.checkArgument;

/**
 * Prepares a normalized cube for presentation. Steps are applied in a fixed order: even subsampling to an integration
 * cap, Gaussian smoothing along time, then wavelength, time and value range filters. Filters drop whole rows and
 * columns rather than masking cells, and never alter the values they keep. The input cube is not modified.
 * The reduction records which input columns survive, so that facts about the full time axis (such as visits) can be
 * mapped onto the emitted one.
 */
public class Reducer {

    private static final Logger LOG = LoggerFactory.getLogger(Reducer.class);

    public Reduction reduce (TimeSeriesCube cube, ReductionOptions options) {
        return reduce(cube, options, new NoopProgressListener());
    }

    /** As reduce, stopping with CANCELLED if the listener asks for it during the expensive smoothing step. */
    public Reduction reduce (TimeSeriesCube cube, ReductionOptions options, ProgressListener progress) {
        checkArgument(cube.isNormalized(), "Only normalized cubes can be reduced.");
        int originalIntegrations = cube.nObservedTimes();
        List<String> appliedRanges = new ArrayList<>();
        int[] keptColumns = capIndices(cube.nTimes(), cube.nTimes());

        boolean subsampled = false;
        if (options.integrationCap > 0 && cube.nTimes() > options.integrationCap) {
            int nBefore = cube.nTimes();
            int[] columns = capIndices(nBefore, options.integrationCap);
            cube = cube.selectColumns(columns);
            keptColumns = compose(keptColumns, columns);
            subsampled = true;
            LOG.info("Subsampled to {} of {} time columns.", cube.nTimes(), nBefore);
        }

        if (options.smoothingSigma > 0) {
            cube = cube.withFlux(smoothAlongTime(cube.flux, options.smoothingSigma, progress));
        }

        if (options.wavelengthRange != null && cube.nWavelengths() > 0) {
            double[] bounds = options.wavelengthRange.clampTo(
                cube.wavelengthAxis[0], cube.wavelengthAxis[cube.nWavelengths() - 1]);
            if (bounds[0] < bounds[1]) {
                cube = cube.selectRows(indicesWithin(cube.wavelengthAxis, bounds));
                appliedRanges.add(String.format("Wavelength: %.3f - %.3f um", bounds[0], bounds[1]));
            } else {
                LOG.warn("Ignoring wavelength range {}: it does not intersect the data.", options.wavelengthRange);
            }
        }

        if (options.timeRange != null && cube.nTimes() > 0) {
            double[] bounds = options.timeRange.clampTo(cube.timeAxis[0], cube.timeAxis[cube.nTimes() - 1]);
            if (bounds[0] < bounds[1]) {
                int[] columns = indicesWithin(cube.timeAxis, bounds);
                cube = cube.selectColumns(columns);
                keptColumns = compose(keptColumns, columns);
                appliedRanges.add(String.format("Time: %.2f - %.2f hours", bounds[0], bounds[1]));
            } else {
                LOG.warn("Ignoring time range {}: it does not intersect the data.", options.timeRange);
            }
        }

        double[] displayValueRange = null;
        if (options.valueRange != null) {
            double[] extent = finiteExtent(options.displayMode.valuesOf(cube));
            double[] bounds = extent == null ? null : options.valueRange.clampTo(extent[0], extent[1]);
            if (bounds != null && bounds[0] < bounds[1]) {
                cube = cube.selectRows(rowsWithValueIn(cube, options.displayMode, bounds));
                int[] columns = columnsWithValueIn(cube, options.displayMode, bounds);
                cube = cube.selectColumns(columns);
                keptColumns = compose(keptColumns, columns);
                displayValueRange = bounds;
                String label = options.displayMode == DisplayMode.FLUX ? "Flux" : "Variability";
                String unit = options.displayMode == DisplayMode.FLUX ? "" : " %";
                appliedRanges.add(String.format("%s: %.3f - %.3f%s", label, bounds[0], bounds[1], unit));
            } else {
                LOG.warn("Ignoring value range {}: it does not intersect the data.", options.valueRange);
            }
        }

        return new Reduction(cube, originalIntegrations, cube.nObservedTimes(), subsampled, appliedRanges,
            displayValueRange, keptColumns);
    }

    /** Indices into the original axis of a selection made from an already selected axis. */
    private static int[] compose (int[] kept, int[] selection) {
        int[] composed = new int[selection.length];
        for (int i = 0; i < selection.length; i++) composed[i] = kept[selection[i]];
        return composed;
    }

    /** Evenly spread indices floor(i * n / cap) for i < cap. */
    public static int[] capIndices (int n, int cap) {
        if (cap >= n) {
            int[] all = new int[n];
            for (int i = 0; i < n; i++) all[i] = i;
            return all;
        }
        int[] indices = new int[cap];
        for (int i = 0; i < cap; i++) {
            indices[i] = (int) ((long) i * n / cap);
        }
        return indices;
    }

    /** Indices of the sorted axis whose values lie within the closed interval. */
    static int[] indicesWithin (double[] axis, double[] bounds) {
        TIntArrayList kept = new TIntArrayList();
        for (int i = 0; i < axis.length; i++) {
            if (axis[i] >= bounds[0] && axis[i] <= bounds[1]) kept.add(i);
        }
        return kept.toArray();
    }

    /** Drop rows, then columns, that have no finite displayed value inside the bounds. */
    static TimeSeriesCube filterByValue (TimeSeriesCube cube, DisplayMode mode, double[] bounds) {
        cube = cube.selectRows(rowsWithValueIn(cube, mode, bounds));
        return cube.selectColumns(columnsWithValueIn(cube, mode, bounds));
    }

    private static int[] rowsWithValueIn (TimeSeriesCube cube, DisplayMode mode, double[] bounds) {
        double[][] values = mode.valuesOf(cube);
        TIntArrayList rows = new TIntArrayList();
        for (int r = 0; r < values.length; r++) {
            for (double v : values[r]) {
                if (v >= bounds[0] && v <= bounds[1]) {
                    rows.add(r);
                    break;
                }
            }
        }
        return rows.toArray();
    }

    private static int[] columnsWithValueIn (TimeSeriesCube cube, DisplayMode mode, double[] bounds) {
        double[][] values = mode.valuesOf(cube);
        TIntArrayList columns = new TIntArrayList();
        for (int c = 0; c < cube.nTimes(); c++) {
            for (double[] row : values) {
                if (row[c] >= bounds[0] && row[c] <= bounds[1]) {
                    columns.add(c);
                    break;
                }
            }
        }
        return columns.toArray();
    }

    /** @return {min, max} over finite values, or null if there are none. */
    static double[] finiteExtent (double[][] values) {
        double min = Double.POSITIVE_INFINITY;
        double max = Double.NEGATIVE_INFINITY;
        for (double[] row : values) {
            for (double v : row) {
                if (Double.isFinite(v)) {
                    min = Math.min(min, v);
                    max = Math.max(max, v);
                }
            }
        }
        return min <= max ? new double[] {min, max} : null;
    }

    public static double[][] smoothAlongTime (double[][] matrix, double sigma) {
        return smoothAlongTime(matrix, sigma, new NoopProgressListener());
    }

    /**
     * Gaussian smoothing of each row along the time axis. The kernel extends round(4 sigma) columns each way, but
     * never further than the row is long, and reflects at the edges. Missing cells stay missing and carry no weight.
     * Cancellation is checked once per row.
     */
    public static double[][] smoothAlongTime (double[][] matrix, double sigma, ProgressListener progress) {
        checkArgument(Double.isFinite(sigma) && sigma > 0, "Smoothing sigma must be positive, was %s.", sigma);
        int n = matrix.length == 0 ? 0 : matrix[0].length;
        int radius = (int) Math.min(FastMath.round(4 * sigma), Math.max(0, n - 1));
        double[] kernel = new double[2 * radius + 1];
        for (int k = -radius; k <= radius; k++) {
            kernel[k + radius] = FastMath.exp(-((double) k * k) / (2 * sigma * sigma));
        }
        double[][] result = new double[matrix.length][];
        for (int r = 0; r < matrix.length; r++) {
            progress.checkCancelled();
            double[] row = matrix[r];
            checkArgument(row.length == n, "Row %s has %s columns, expected %s.", r, row.length, n);
            double[] smoothed = new double[n];
            for (int c = 0; c < n; c++) {
                if (!Double.isFinite(row[c])) {
                    smoothed[c] = row[c];
                    continue;
                }
                double sum = 0;
                double weight = 0;
                for (int k = -radius; k <= radius; k++) {
                    double value = row[reflect(c + k, n)];
                    if (Double.isFinite(value)) {
                        sum += kernel[k + radius] * value;
                        weight += kernel[k + radius];
                    }
                }
                smoothed[c] = sum / weight;
            }
            result[r] = smoothed;
        }
        return result;
    }

    /** Map an index outside [0, n) back inside by mirroring about the edges (d c b a | a b c d | d c b a). */
    static int reflect (int index, int n) {
        if (n == 1) return 0;
        int period = 2 * n;
        int i = Math.floorMod(index, period);
        return i < n ? i : period - 1 - i;
    }

}
