package com.stamp.analysis.datasource;

import com.stamp.cube.CubeAssemblyException;
import com.stamp.cube.Integration;
import com.stamp.cube.SourceFile;
import com.stamp.cube.progress.NoopProgressListener;
import org.junit.jupiter.api.Test;

import java.io.File;
import java.lang.reflect.Array;
import java.util.ArrayList;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.Set;

import static org.junit.jupiter.api.Assertions.assertArrayEquals;
import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertNull;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

class Hdf5FormatReaderTest {

    private static final File FILE = new File("stage3.h5");

    /** Root-level datasets and attributes held in memory. */
    private static class MemoryHdf5 implements HierarchicalContainer {
        final Map<String, Object> datasets = new HashMap<>();
        final Map<String, String> attributes = new HashMap<>();

        @Override
        public Set<String> datasetNames () {
            return datasets.keySet();
        }

        @Override
        public Object read (String datasetName) {
            return datasets.get(datasetName);
        }

        @Override
        public int[] dimensions (String datasetName) {
            List<Integer> dims = new ArrayList<>();
            Object data = datasets.get(datasetName);
            while (data != null && data.getClass().isArray()) {
                int length = Array.getLength(data);
                dims.add(length);
                data = length > 0 ? Array.get(data, 0) : null;
            }
            return dims.stream().mapToInt(Integer::intValue).toArray();
        }

        @Override
        public String attribute (String name) {
            return attributes.get(name);
        }

        @Override
        public void close () { }
    }

    private static MemoryHdf5 threeIntegrations () {
        MemoryHdf5 hdf = new MemoryHdf5();
        float[][] flux = new float[3][5];
        double[][] variance = new double[3][5];
        for (int i = 0; i < 3; i++) {
            for (int w = 0; w < 5; w++) {
                flux[i][w] = 100 + i;
                variance[i][w] = 4.0;
            }
        }
        hdf.datasets.put("optspec", flux);
        hdf.datasets.put("stdvar", variance);
        hdf.datasets.put("wave_1d", new double[] {1, 2, 3, 4, 5});
        hdf.datasets.put("time", new double[] {59000.0, 59000.01, 59000.02});
        hdf.attributes.put("INSTRUME", "NIRSPEC");
        return hdf;
    }

    private static SourceFile read (MemoryHdf5 hdf) {
        return new Hdf5FormatReader(3, file -> hdf).read(FILE, "stage3.h5", new NoopProgressListener());
    }

    @Test
    void readsOneIntegrationPerFluxRow () {
        SourceFile sourceFile = read(threeIntegrations());
        assertEquals(3, sourceFile.integrations.size());
        Integration second = sourceFile.integrations.get(1);
        assertEquals(59000.01, second.time);
        assertArrayEquals(new double[] {1, 2, 3, 4, 5}, second.wavelength);
        assertArrayEquals(new double[] {101, 101, 101, 101, 101}, second.flux);
        assertEquals("NIRSPEC", sourceFile.header(SourceFile.INSTRUMENT));
        assertEquals(SourceFile.UNKNOWN, sourceFile.header(SourceFile.TARGET));
    }

    @Test
    void varianceIsConvertedExactlyOnce () {
        for (Integration integration : read(threeIntegrations()).integrations) {
            assertArrayEquals(new double[] {2, 2, 2, 2, 2}, integration.error);
        }
    }

    @Test
    void probeCountsRowsWithoutReadingSpectra () {
        MemoryHdf5 hdf = threeIntegrations();
        FileProbe probe = new Hdf5FormatReader(3, file -> hdf).probe(FILE, "stage3.h5");
        assertEquals(3, probe.integrationCount());
        assertEquals(59000.0, probe.firstTime());
    }

    @Test
    void singleSpectrumIsOneIntegration () {
        MemoryHdf5 hdf = new MemoryHdf5();
        hdf.datasets.put("stdspec", new double[] {1, 2, 3});
        hdf.datasets.put("wavelength", new double[] {1, 2, 3});
        hdf.datasets.put("bjd", new double[] {59000.5});
        SourceFile sourceFile = read(hdf);
        assertEquals(1, sourceFile.integrations.size());
        assertNull(sourceFile.integrations.get(0).error);
    }

    @Test
    void timeCountMismatchIsUnsupported () {
        MemoryHdf5 hdf = threeIntegrations();
        hdf.datasets.put("time", new double[] {59000.0, 59000.01});
        CubeAssemblyException e = assertThrows(CubeAssemblyException.class, () -> read(hdf));
        assertEquals(CubeAssemblyException.Kind.UNSUPPORTED_STRUCTURE, e.kind);
    }

    @Test
    void missingFluxIsUnsupported () {
        MemoryHdf5 hdf = threeIntegrations();
        hdf.datasets.remove("optspec");
        CubeAssemblyException e = assertThrows(CubeAssemblyException.class, () -> read(hdf));
        assertEquals(CubeAssemblyException.Kind.UNSUPPORTED_STRUCTURE, e.kind);
        assertTrue(e.getMessage().contains("flux"));
    }

    @Test
    void tooFewValidPointsLeavesNothingUsable () {
        MemoryHdf5 hdf = threeIntegrations();
        hdf.datasets.put("wave_1d", new double[] {1, Double.NaN, Double.NaN, Double.NaN, 5});
        CubeAssemblyException e = assertThrows(CubeAssemblyException.class, () -> read(hdf));
        assertEquals(CubeAssemblyException.Kind.UNSUPPORTED_STRUCTURE, e.kind);
    }

    @Test
    void libraryFailureIsACorruptFile () {
        Hdf5FormatReader reader = new Hdf5FormatReader(3, file -> {
            throw new IllegalStateException("bad superblock");
        });
        CubeAssemblyException e = assertThrows(CubeAssemblyException.class,
            () -> reader.read(FILE, "stage3.h5", new NoopProgressListener()));
        assertEquals(CubeAssemblyException.Kind.CORRUPT_FILE, e.kind);
        assertTrue(e.getMessage().contains("bad superblock"));
    }

}
