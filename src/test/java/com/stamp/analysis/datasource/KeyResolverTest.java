package com.stamp.analysis.datasource;

import com.stamp.cube.CubeAssemblyException;
import com.stamp.cube.FieldResolutionException;
import org.junit.jupiter.api.Test;

import java.util.List;

import static com.stamp.analysis.datasource.KeyResolver.Field.ERROR;
import static com.stamp.analysis.datasource.KeyResolver.Field.FLUX;
import static com.stamp.analysis.datasource.KeyResolver.Field.TIME;
import static com.stamp.analysis.datasource.KeyResolver.Field.WAVELENGTH;
import static org.junit.jupiter.api.Assertions.assertArrayEquals;
import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertSame;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

class KeyResolverTest {

    @Test
    void earliestCandidateWins () {
        ResolvedKeys keys = KeyResolver.HDF5.resolve("a.h5", List.of("optspec", "stdspec", "wave_1d", "time"));
        assertEquals("stdspec", keys.key(FLUX));
        assertEquals("wave_1d", keys.key(WAVELENGTH));
        assertEquals("time", keys.key(TIME));
        assertFalse(keys.has(ERROR));
    }

    @Test
    void missingRequiredFieldNamesTheCandidates () {
        FieldResolutionException e = assertThrows(FieldResolutionException.class,
            () -> KeyResolver.HDF5.resolve("a.h5", List.of("optspec", "time")));
        assertEquals("wavelength", e.field);
        assertEquals(CubeAssemblyException.Kind.UNSUPPORTED_STRUCTURE, e.kind);
        assertTrue(e.getMessage().startsWith("a.h5"));
        assertTrue(e.getMessage().contains("eureka_wave_1d"));
    }

    @Test
    void hierarchicalNamesAreCaseSensitive () {
        assertFalse(KeyResolver.HDF5.canResolve(List.of("OPTSPEC", "WAVE_1D", "TIME")));
    }

    @Test
    void tableColumnsMatchIgnoringCaseAndKeepTheirOwnSpelling () {
        ResolvedKeys keys = KeyResolver.FITS_SPECTRUM.resolve("x1d.fits", List.of("wavelength", "flux", "Flux_Error"));
        assertEquals("wavelength", keys.key(WAVELENGTH));
        assertEquals("Flux_Error", keys.key(ERROR));
    }

    @Test
    void varianceBecomesStandardDeviation () {
        ResolvedKeys keys = KeyResolver.HDF5.resolve("a.h5", List.of("optspec", "wave_1d", "time", "stdvar"));
        assertTrue(keys.isVariance(ERROR));
        double[] variance = {4.0, 9.0, -1.0};
        double[] sigma = keys.normalizeUnits(ERROR, variance);
        assertEquals(2.0, sigma[0]);
        assertEquals(3.0, sigma[1]);
        assertTrue(Double.isNaN(sigma[2]));
        assertArrayEquals(new double[] {4.0, 9.0, -1.0}, variance);
    }

    @Test
    void otherFieldsPassThroughUnchanged () {
        ResolvedKeys keys = KeyResolver.HDF5.resolve("a.h5", List.of("optspec", "wave_1d", "time", "error"));
        double[] error = {4.0};
        assertFalse(keys.isVariance(ERROR));
        assertSame(error, keys.normalizeUnits(ERROR, error));
    }

}
