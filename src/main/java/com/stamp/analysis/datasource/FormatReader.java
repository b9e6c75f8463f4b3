package com.stamp.analysis.datasource;

import com.google.common.collect.ImmutableMap;
import com.stamp.cube.CubeAssemblyException;
import com.stamp.cube.Integration;
import com.stamp.cube.SourceFile;
import com.stamp.cube.SourceFormat;
import com.stamp.cube.progress.ProgressListener;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.File;
import java.util.Map;

/**
 * Logic for reading one family of observation file into integrations. Concrete subclasses deal with the container
 * format; this class classifies whatever goes wrong so that callers only ever see per-file CubeAssemblyExceptions
 * (which exclude the file) or cancellation.
 */
public abstract class FormatReader {

    private static final Logger LOG = LoggerFactory.getLogger(FormatReader.class);

    /** Integrations with fewer finite wavelength and flux points than this are skipped. */
    protected final int minValidPoints;

    protected FormatReader (int minValidPoints) {
        this.minValidPoints = minValidPoints;
    }

    public abstract SourceFormat format ();

    /**
     * Cheaply determine how many integrations the file holds and when the first was taken, without reading spectra.
     * @throws CubeAssemblyException of a per-file kind if the file is not usable.
     */
    public final FileProbe probe (File file, String fileName) {
        try {
            return probeFile(file, fileName);
        } catch (CubeAssemblyException e) {
            throw e;
        } catch (Exception e) {
            throw CubeAssemblyException.corruptFile(fileName, e);
        }
    }

    /**
     * Read all usable integrations from the file, reporting one unit of progress per integration examined.
     * @throws CubeAssemblyException of a per-file kind if the file is not usable, or CANCELLED.
     */
    public final SourceFile read (File file, String fileName, ProgressListener progressListener) {
        SourceFile sourceFile;
        try {
            sourceFile = readFile(file, fileName, progressListener);
        } catch (CubeAssemblyException e) {
            throw e;
        } catch (Exception e) {
            throw CubeAssemblyException.corruptFile(fileName, e);
        }
        if (sourceFile.integrations.isEmpty()) {
            throw CubeAssemblyException.unsupportedStructure(fileName, "no usable integrations");
        }
        return sourceFile;
    }

    protected abstract FileProbe probeFile (File file, String fileName) throws Exception;

    protected abstract SourceFile readFile (File file, String fileName, ProgressListener progressListener)
        throws Exception;

    /**
     * Sanitize one integration's raw arrays, returning null (after logging) if too few valid points remain or the
     * timestamp is unusable.
     */
    protected Integration sanitize (String fileName, int index, double[] wavelength, double[] flux, double[] error,
                                    double time) {
        if (!Double.isFinite(time)) {
            LOG.warn("{}: skipping integration {} which has no valid timestamp.", fileName, index + 1);
            return null;
        }
        Integration integration = Integration.sanitized(wavelength, flux, error, time);
        if (index < 3) {
            LOG.debug("{}: integration {} has {}/{} valid points, time={}",
                fileName, index + 1, integration.size(), flux.length, time);
        }
        if (integration.size() < minValidPoints) {
            LOG.warn("{}: skipping integration {} with only {} valid points.", fileName, index + 1, integration.size());
            return null;
        }
        return integration;
    }

    /** Factory method returning a reader for each supported format, backed by the real container libraries. */
    public static Map<SourceFormat, FormatReader> standardReaders (int minValidPoints) {
        return ImmutableMap.of(
            SourceFormat.FITS, new FitsFormatReader(minValidPoints, NomTamFitsContainer::open),
            SourceFormat.HDF5, new Hdf5FormatReader(minValidPoints, JhdfContainer::open)
        );
    }

}
