package com.stamp.cube;

import org.junit.jupiter.api.Test;

import java.util.List;

import static org.junit.jupiter.api.Assertions.assertArrayEquals;
import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertTrue;

class BandLightCurveTest {

    @Test
    void bandAveragesFiniteValuesOfItsRows () {
        TimeSeriesCube cube = CubeFixtures.normalized(
            new double[] {1, 2, 3},
            new double[] {0, 1},
            new double[][] {{1, 2}, {3, Double.NaN}, {100, 100}});
        List<BandLightCurve> curves = BandLightCurve.computeAll(cube, DisplayMode.FLUX,
            List.of(new Band("blue", 1, 2), new Band("empty", 5, 6)));

        BandLightCurve blue = curves.get(0);
        assertEquals(2, blue.nWavelengths);
        assertArrayEquals(new double[] {2, 2}, blue.values, 1e-12);

        BandLightCurve empty = curves.get(1);
        assertEquals(0, empty.nWavelengths);
        assertTrue(Double.isNaN(empty.values[0]));
        assertTrue(Double.isNaN(empty.values[1]));
    }

    @Test
    void variabilityBandUsesPercentages () {
        TimeSeriesCube cube = CubeFixtures.normalized(
            new double[] {1}, new double[] {0, 1, 2}, new double[][] {{1, 2, 3}});
        BandLightCurve curve = BandLightCurve.computeAll(cube, DisplayMode.VARIABILITY,
            List.of(new Band("all", 0, 10))).get(0);
        assertArrayEquals(new double[] {-50, 0, 50}, curve.values, 1e-12);
    }

}
