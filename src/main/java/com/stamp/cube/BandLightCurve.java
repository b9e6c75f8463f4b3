package com.stamp.cube;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.List;

/** The time series of one wavelength band: per column, the mean of finite displayed values over the band's rows. */
public class BandLightCurve {

    private static final Logger LOG = LoggerFactory.getLogger(BandLightCurve.class);

    public final Band band;

    /** Number of wavelength rows that fall in the band. */
    public final int nWavelengths;

    /** One value per time column of the cube; NaN where no row in the band has a finite value. */
    public final double[] values;

    public BandLightCurve (Band band, int nWavelengths, double[] values) {
        this.band = band;
        this.nWavelengths = nWavelengths;
        this.values = values;
    }

    public static BandLightCurve compute (TimeSeriesCube cube, double[][] displayValues, Band band) {
        double[] sums = new double[cube.nTimes()];
        int[] counts = new int[cube.nTimes()];
        int nRows = 0;
        for (int r = 0; r < cube.nWavelengths(); r++) {
            if (!band.contains(cube.wavelengthAxis[r])) continue;
            nRows += 1;
            for (int c = 0; c < cube.nTimes(); c++) {
                double value = displayValues[r][c];
                if (Double.isFinite(value)) {
                    sums[c] += value;
                    counts[c] += 1;
                }
            }
        }
        if (nRows == 0) {
            LOG.warn("Band {} contains no wavelengths of the emitted cube.", band);
        }
        double[] means = new double[cube.nTimes()];
        for (int c = 0; c < means.length; c++) {
            means[c] = counts[c] == 0 ? Double.NaN : sums[c] / counts[c];
        }
        return new BandLightCurve(band, nRows, means);
    }

    public static List<BandLightCurve> computeAll (TimeSeriesCube cube, DisplayMode mode, List<Band> bands) {
        List<BandLightCurve> curves = new ArrayList<>(bands.size());
        if (bands.isEmpty()) return curves;
        double[][] displayValues = mode.valuesOf(cube);
        for (Band band : bands) {
            curves.add(compute(cube, displayValues, band));
        }
        return curves;
    }

}
