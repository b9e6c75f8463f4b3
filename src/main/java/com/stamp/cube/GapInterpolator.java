package com.stamp.cube;

import gnu.trove.list.array.TDoubleArrayList;
import gnu.trove.list.array.TIntArrayList;
import org.apache.commons.math3.stat.descriptive.rank.Median;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.List;

/**
 * Optionally produces a continuous surface by manufacturing evenly spaced columns strictly inside each gap between two
 * visits. Each new cell is linearly interpolated along time, per wavelength row, between the last column of the
 * earlier visit and the first column of the later one. Nothing is added before the first or after the last visit and
 * observed columns are never modified.
 *
 * A gap is only filled when both of its edge columns were observed, so applying this to an already filled cube
 * changes nothing.
 */
public class GapInterpolator {

    private static final Logger LOG = LoggerFactory.getLogger(GapInterpolator.class);

    /** Upper bound on columns added to a single gap, to keep a tiny cadence and a long gap from exploding the cube. */
    public static final int MAX_COLUMNS_PER_GAP = 2000;

    private final double gapThresholdHours;

    public GapInterpolator (double gapThresholdHours) {
        this.gapThresholdHours = gapThresholdHours;
    }

    /**
     * @param visits the visits of the cube's time axis, in order
     * @return a new cube with interpolated columns inserted, or the same cube if there was nothing to fill
     */
    public TimeSeriesCube fill (TimeSeriesCube cube, List<Visit> visits) {
        if (visits.size() < 2) return cube;
        double step = Math.min(medianCadence(cube.timeAxis, visits), gapThresholdHours);
        int nRows = cube.nWavelengths();

        // For every output column, the source columns it is drawn from and the position between them.
        TDoubleArrayList times = new TDoubleArrayList();
        TIntArrayList leftColumns = new TIntArrayList();
        TIntArrayList rightColumns = new TIntArrayList();
        TDoubleArrayList fractions = new TDoubleArrayList();
        int added = 0;
        for (int v = 0; v < visits.size(); v++) {
            Visit visit = visits.get(v);
            for (int c = visit.startIndex(); c <= visit.endIndex(); c++) {
                times.add(cube.timeAxis[c]);
                leftColumns.add(c);
                rightColumns.add(c);
                fractions.add(0);
            }
            if (v + 1 == visits.size()) break;
            int left = visit.endIndex();
            int right = visits.get(v + 1).startIndex();
            if (cube.interpolated[left] || cube.interpolated[right]) continue;
            double t0 = cube.timeAxis[left];
            double gap = cube.timeAxis[right] - t0;
            // floor(gap / step) + 1 intervals, each strictly shorter than the step.
            int nInserted = Math.min(MAX_COLUMNS_PER_GAP, (int) Math.floor(gap / step));
            for (int k = 1; k <= nInserted; k++) {
                double fraction = k / (double) (nInserted + 1);
                times.add(t0 + gap * fraction);
                leftColumns.add(left);
                rightColumns.add(right);
                fractions.add(fraction);
            }
            added += nInserted;
        }
        if (added == 0) return cube;

        int nCols = times.size();
        double[][] flux = new double[nRows][nCols];
        double[][] error = cube.hasError() ? new double[nRows][nCols] : null;
        boolean[] interpolated = new boolean[nCols];
        for (int c = 0; c < nCols; c++) {
            int left = leftColumns.get(c);
            int right = rightColumns.get(c);
            double fraction = fractions.get(c);
            interpolated[c] = left != right || cube.interpolated[left];
            for (int r = 0; r < nRows; r++) {
                flux[r][c] = left == right ? cube.flux[r][left] : lerp(cube.flux[r][left], cube.flux[r][right], fraction);
                if (error != null) {
                    error[r][c] = left == right
                        ? cube.error[r][left]
                        : lerp(cube.error[r][left], cube.error[r][right], fraction);
                }
            }
        }
        LOG.info("Filled {} inter-visit gaps with {} interpolated columns at a step of at most {} hours.",
            visits.size() - 1, added, step);
        return new TimeSeriesCube(cube.wavelengthAxis, times.toArray(), flux, error, cube.referenceSpectrum,
            interpolated);
    }

    private static double lerp (double a, double b, double fraction) {
        return a + (b - a) * fraction;
    }

    /** Median spacing between consecutive distinct times inside visits, or infinity if there are none. */
    static double medianCadence (double[] timeAxis, List<Visit> visits) {
        TDoubleArrayList steps = new TDoubleArrayList();
        for (Visit visit : visits) {
            for (int c = visit.startIndex() + 1; c <= visit.endIndex(); c++) {
                double dt = timeAxis[c] - timeAxis[c - 1];
                if (dt > 0) steps.add(dt);
            }
        }
        if (steps.isEmpty()) return Double.POSITIVE_INFINITY;
        return new Median().evaluate(steps.toArray());
    }

}
