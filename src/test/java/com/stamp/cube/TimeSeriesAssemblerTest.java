package com.stamp.cube;

import com.stamp.cube.GridReconciler.ReferenceGridPolicy;
import com.stamp.cube.progress.NoopProgressListener;
import org.junit.jupiter.api.Test;

import java.util.List;
import java.util.Map;

import static com.stamp.cube.CubeFixtures.flat;
import static org.junit.jupiter.api.Assertions.assertArrayEquals;
import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertNull;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

class TimeSeriesAssemblerTest {

    private static final double[] WAVELENGTHS = {1, 2, 3};

    private final TimeSeriesAssembler assembler =
        new TimeSeriesAssembler(new GridReconciler(ReferenceGridPolicy.MOST_INTEGRATIONS, 100));

    private static SourceFile file (String name, Integration... integrations) {
        return new SourceFile(name, SourceFormat.FITS, List.of(integrations), Map.of());
    }

    @Test
    void columnsAreSortedByTimeKeepingFileOrderForTies () {
        SourceFile a = file("a.fits", flat(WAVELENGTHS, 1, 101));
        SourceFile b = file("b.fits", flat(WAVELENGTHS, 2, 101), flat(WAVELENGTHS, 3, 100));
        TimeSeriesCube cube = assembler.assemble(List.of(a, b), null, new NoopProgressListener()).cube;
        assertArrayEquals(new double[] {0, 24, 24}, cube.timeAxis, 1e-9);
        assertArrayEquals(new double[] {3, 1, 2}, cube.flux[0]);
        assertArrayEquals(WAVELENGTHS, cube.wavelengthAxis);
        assertEquals(0, cube.nTimes() - cube.nObservedTimes());
    }

    @Test
    void fileWithoutOverlapIsExcludedAndReported () {
        SourceFile good = file("good.fits", flat(WAVELENGTHS, 1, 100), flat(WAVELENGTHS, 1, 100.01));
        SourceFile far = file("far.fits", flat(new double[] {10, 11, 12}, 1, 100.02));
        TimeSeriesAssembler.Assembly assembly = assembler.assemble(List.of(good, far), null, new NoopProgressListener());
        assertEquals(2, assembly.cube.nTimes());
        assertEquals(List.of(good), assembly.contributingFiles);
        assertEquals(1, assembly.excludedFiles.size());
        assertEquals("far.fits", assembly.excludedFiles.get(0).fileName());
        assertEquals(CubeAssemblyException.Kind.INTERPOLATION_DOMAIN_EMPTY, assembly.excludedFiles.get(0).kind());
    }

    @Test
    void fileKeepsItsOverlappingIntegrations () {
        SourceFile mixed = file("mixed.fits",
            flat(WAVELENGTHS, 1, 100), flat(new double[] {10, 11, 12}, 1, 100.01), flat(WAVELENGTHS, 1, 100.02));
        TimeSeriesAssembler.Assembly assembly = assembler.assemble(List.of(mixed), null, new NoopProgressListener());
        assertEquals(2, assembly.cube.nTimes());
        assertTrue(assembly.excludedFiles.isEmpty());
    }

    @Test
    void nothingOnTheGridIsAnEmptyResult () {
        SourceFile a = file("a.fits", flat(WAVELENGTHS, 1, 100));
        CubeAssemblyException e = assertThrows(CubeAssemblyException.class,
            () -> assembler.assemble(List.of(a), new double[] {100, 101}, new NoopProgressListener()));
        assertEquals(CubeAssemblyException.Kind.EMPTY_RESULT, e.kind);
    }

    @Test
    void errorIsMissingForFilesWithoutUncertainties () {
        Integration withError = new Integration(WAVELENGTHS, new double[] {1, 1, 1}, new double[] {0.1, 0.1, 0.1}, 100);
        SourceFile a = file("a.fits", withError);
        SourceFile b = file("b.fits", flat(WAVELENGTHS, 1, 100.01));
        TimeSeriesCube cube = assembler.assemble(List.of(a, b), null, new NoopProgressListener()).cube;
        assertEquals(0.1, cube.error[0][0]);
        assertTrue(Double.isNaN(cube.error[0][1]));

        TimeSeriesCube noErrors = assembler.assemble(List.of(b), null, new NoopProgressListener()).cube;
        assertNull(noErrors.error);
    }

    @Test
    void cancellationStopsAssembly () {
        NoopProgressListener cancelled = new NoopProgressListener() {
            @Override
            public boolean isCancelled () {
                return true;
            }
        };
        CubeAssemblyException e = assertThrows(CubeAssemblyException.class,
            () -> assembler.assemble(List.of(file("a.fits", flat(WAVELENGTHS, 1, 100))), null, cancelled));
        assertEquals(CubeAssemblyException.Kind.CANCELLED, e.kind);
    }

}
