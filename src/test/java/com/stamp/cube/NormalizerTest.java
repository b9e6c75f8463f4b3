package com.stamp.cube;

import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.assertArrayEquals;
import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertSame;
import static org.junit.jupiter.api.Assertions.assertTrue;

class NormalizerTest {

    @Test
    void medianColumnHasZeroVariability () {
        TimeSeriesCube cube = CubeFixtures.normalized(
            new double[] {1}, new double[] {0, 1, 2, 3, 4}, new double[][] {{4, 1, 3, 5, 2}});
        assertArrayEquals(new double[] {3}, cube.referenceSpectrum);
        double[][] variability = cube.variability();
        assertEquals(0, variability[0][2], 1e-12);
        assertEquals(100 * (5.0 / 3 - 1), variability[0][3], 1e-9);
        assertEquals(100 * (1.0 / 3 - 1), variability[0][1], 1e-9);
    }

    @Test
    void missingCellsAreIgnoredByTheMedianAndStayMissing () {
        double[] reference = Normalizer.referenceSpectrum(new double[][] {{1, Double.NaN, 3}}, null);
        assertArrayEquals(new double[] {2}, reference);
        double[][] variability = Normalizer.variability(new double[][] {{1, Double.NaN, 3}}, reference);
        assertTrue(Double.isNaN(variability[0][1]));
        assertEquals(50, variability[0][2], 1e-12);
    }

    @Test
    void interpolatedColumnsDoNotInfluenceTheReference () {
        double[] reference = Normalizer.referenceSpectrum(
            new double[][] {{1, 100, 3}}, new boolean[] {false, true, false});
        assertArrayEquals(new double[] {2}, reference);
    }

    @Test
    void zeroOrMissingReferenceGivesMissingVariability () {
        double[][] variability = Normalizer.variability(
            new double[][] {{0, 0, 1}, {Double.NaN, Double.NaN, Double.NaN}},
            new double[] {0, Double.NaN});
        for (double[] row : variability) {
            for (double value : row) {
                assertTrue(Double.isNaN(value));
            }
        }
    }

    @Test
    void normalizingAttachesReferenceWithoutTouchingFlux () {
        double[][] flux = {{1, 2}, {3, 4}};
        TimeSeriesCube raw = TimeSeriesCube.observed(new double[] {1, 2}, new double[] {0, 1}, flux, null);
        TimeSeriesCube normalized = Normalizer.normalize(raw);
        assertSame(flux, normalized.flux);
        assertArrayEquals(new double[] {1, 2}, flux[0]);
        assertArrayEquals(new double[] {1.5, 3.5}, normalized.referenceSpectrum);
    }

}
