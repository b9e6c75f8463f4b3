package com.stamp.analysis.datasource;

import com.stamp.cube.CubeAssemblyException;
import com.stamp.cube.Integration;
import com.stamp.cube.SourceFile;
import com.stamp.cube.SourceFormat;
import com.stamp.cube.progress.ProgressListener;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.File;
import java.util.ArrayList;
import java.util.HashMap;
import java.util.List;
import java.util.Map;

import static com.stamp.analysis.datasource.KeyResolver.Field.ERROR;
import static com.stamp.analysis.datasource.KeyResolver.Field.FLUX;
import static com.stamp.analysis.datasource.KeyResolver.Field.TIME;
import static com.stamp.analysis.datasource.KeyResolver.Field.WAVELENGTH;

/**
 * Reads HDF5 files as written by common light-curve reduction pipelines. Flux is either [integration x wavelength]
 * or a single 1-D spectrum, wavelength is shared (1-D) or per integration (2-D), and time has one entry per flux row.
 */
public class Hdf5FormatReader extends FormatReader {

    private static final Logger LOG = LoggerFactory.getLogger(Hdf5FormatReader.class);

    private final ContainerOpener<HierarchicalContainer> opener;

    public Hdf5FormatReader (int minValidPoints, ContainerOpener<HierarchicalContainer> opener) {
        super(minValidPoints);
        this.opener = opener;
    }

    @Override
    public SourceFormat format () {
        return SourceFormat.HDF5;
    }

    @Override
    protected FileProbe probeFile (File file, String fileName) throws Exception {
        try (HierarchicalContainer hdf = opener.open(file)) {
            ResolvedKeys keys = KeyResolver.HDF5.resolve(fileName, hdf.datasetNames());
            int[] dims = hdf.dimensions(keys.key(FLUX));
            int n = dims.length < 2 ? 1 : dims[0];
            double[] times = ArrayConversions.toDoubleArray(hdf.read(keys.key(TIME)));
            return new FileProbe(n, times.length == 0 ? Double.NaN : times[0]);
        }
    }

    @Override
    protected SourceFile readFile (File file, String fileName, ProgressListener progressListener) throws Exception {
        try (HierarchicalContainer hdf = opener.open(file)) {
            ResolvedKeys keys = KeyResolver.HDF5.resolve(fileName, hdf.datasetNames());
            LOG.info("{}: resolved datasets {}", fileName, keys);
            double[][] flux = ArrayConversions.toDoubleMatrix(hdf.read(keys.key(FLUX)));
            Object wavelengthData = hdf.read(keys.key(WAVELENGTH));
            double[][] wavelength = ArrayConversions.rank(wavelengthData) >= 2
                ? ArrayConversions.toDoubleMatrix(wavelengthData)
                : new double[][] {ArrayConversions.toDoubleArray(wavelengthData)};
            double[] times = ArrayConversions.toDoubleArray(hdf.read(keys.key(TIME)));
            double[][] error = null;
            if (keys.has(ERROR)) {
                error = ArrayConversions.toDoubleMatrix(hdf.read(keys.key(ERROR)));
                for (int i = 0; i < error.length; i++) {
                    error[i] = keys.normalizeUnits(ERROR, error[i]);
                }
            }

            int n = flux.length;
            if (times.length != n) {
                throw CubeAssemblyException.unsupportedStructure(fileName, String.format(
                    "%s has %d entries but %s has %d rows", keys.key(TIME), times.length, keys.key(FLUX), n));
            }
            if (wavelength.length != 1 && wavelength.length != n) {
                throw CubeAssemblyException.unsupportedStructure(fileName, String.format(
                    "%s has %d rows but %s has %d", keys.key(WAVELENGTH), wavelength.length, keys.key(FLUX), n));
            }
            if (error != null && error.length != n) {
                LOG.warn("{}: {} has {} rows but flux has {}; uncertainties ignored.",
                    fileName, keys.key(ERROR), error.length, n);
                error = null;
            }

            progressListener.setMessage("Reading " + fileName);
            List<Integration> integrations = new ArrayList<>(n);
            for (int i = 0; i < n; i++) {
                progressListener.checkCancelled();
                Integration integration = sanitize(fileName, i,
                    wavelength.length == 1 ? wavelength[0] : wavelength[i],
                    flux[i],
                    error == null ? null : error[i],
                    times[i]);
                if (integration != null) integrations.add(integration);
                progressListener.increment();
            }
            return new SourceFile(fileName, SourceFormat.HDF5, integrations, headerInfo(hdf));
        }
    }

    static Map<String, String> headerInfo (HierarchicalContainer hdf) {
        Map<String, String> info = new HashMap<>();
        putFirst(info, SourceFile.INSTRUMENT, hdf, "INSTRUME", "instrument");
        putFirst(info, SourceFile.FILTER, hdf, "FILTER", "filter");
        putFirst(info, SourceFile.GRATING, hdf, "GRATING", "grating");
        putFirst(info, SourceFile.TARGET, hdf, "TARGNAME", "target");
        return info;
    }

    private static void putFirst (Map<String, String> info, String key, HierarchicalContainer hdf, String... names) {
        for (String name : names) {
            String value = hdf.attribute(name);
            if (value != null && !value.isBlank()) {
                info.put(key, value);
                return;
            }
        }
    }

}
