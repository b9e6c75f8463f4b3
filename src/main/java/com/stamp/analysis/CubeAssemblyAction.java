package com.stamp.analysis;

import com.stamp.analysis.components.ResultCache;
import com.stamp.analysis.datasource.ArchiveScanner;
import com.stamp.analysis.datasource.FormatReader;
import com.stamp.analysis.datasource.ScanResult;
import com.stamp.cube.BandLightCurve;
import com.stamp.cube.CubeAssemblyException;
import com.stamp.cube.CubeMetadata;
import com.stamp.cube.CubeResult;
import com.stamp.cube.ExcludedFile;
import com.stamp.cube.GapInterpolator;
import com.stamp.cube.GridReconciler;
import com.stamp.cube.GridReconciler.ReferenceGridPolicy;
import com.stamp.cube.Normalizer;
import com.stamp.cube.Reducer;
import com.stamp.cube.Reduction;
import com.stamp.cube.SourceFile;
import com.stamp.cube.SourceFormat;
import com.stamp.cube.TimeSeriesAssembler;
import com.stamp.cube.TimeSeriesCube;
import com.stamp.cube.Visit;
import com.stamp.cube.VisitSegmenter;
import com.stamp.cube.progress.JobAction;
import com.stamp.cube.progress.ProgressListener;
import com.stamp.cube.progress.Stage;
import org.apache.commons.io.FileUtils;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.File;
import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;

/**
 * Turns one uploaded archive into a CubeResult: scan, read, regrid, normalize, optionally fill gaps, then reduce for
 * display. This implements JobAction so it can run in the background without blocking the submitting thread. The
 * archive is unpacked into a private work directory that is always deleted when the action ends.
 */
public class CubeAssemblyAction implements JobAction {

    private static final Logger LOG = LoggerFactory.getLogger(CubeAssemblyAction.class);

    public interface Config {
        double gapThresholdHours ();
        int minValidPoints ();
        ReferenceGridPolicy referenceGridPolicy ();
        int commonGridPoints ();
        /** Parent directory for per-job extraction directories, empty for the system temporary directory. */
        String workDirectory ();
    }

    private final Config config;
    private final Map<SourceFormat, FormatReader> readers;
    private final ResultCache resultCache;

    /** The uploaded archive. This action reads it but never deletes it. */
    private final File archive;
    private final JobOptions options;

    public CubeAssemblyAction (Config config, Map<SourceFormat, FormatReader> readers, ResultCache resultCache,
                               File archive, JobOptions options) {
        this.config = config;
        this.readers = readers;
        this.resultCache = resultCache;
        this.archive = archive;
        this.options = options;
    }

    @Override
    public CubeResult action (ProgressListener progressListener) throws Exception {
        double gapThreshold = options.gapThresholdHours != null
            ? options.gapThresholdHours
            : config.gapThresholdHours();
        String cacheKey = resultCache.isEnabled() ? cacheKey(gapThreshold) : null;
        AssembledArchive assembled = cacheKey == null ? null : resultCache.get(cacheKey).orElse(null);
        boolean fromCache = assembled != null;
        if (fromCache) {
            progressListener.beginStage(Stage.REGRID, "Using previously assembled cube...", 1);
            progressListener.increment();
        } else {
            assembled = assemble(gapThreshold, progressListener);
            if (cacheKey != null) resultCache.put(cacheKey, assembled);
        }
        progressListener.checkCancelled();
        return finish(assembled, fromCache, gapThreshold, progressListener);
    }

    private String cacheKey (double gapThreshold) {
        try {
            return ResultCache.cacheKey(archive, options, gapThreshold, config.referenceGridPolicy());
        } catch (IOException e) {
            throw CubeAssemblyException.unreadableArchive(archive.getName(), e);
        }
    }

    private AssembledArchive assemble (double gapThreshold, ProgressListener progressListener) throws IOException {
        File workDirectory = createWorkDirectory();
        try {
            ArchiveScanner scanner = new ArchiveScanner(readers);
            ScanResult scan = scanner.scan(archive, workDirectory, progressListener);
            List<ExcludedFile> excluded = new ArrayList<>(scan.excludedFiles);
            List<SourceFile> sourceFiles = scanner.readAll(scan, excluded, progressListener);
            int totalIntegrations = sourceFiles.stream().mapToInt(f -> f.integrations.size()).sum();

            GridReconciler reconciler = new GridReconciler(config.referenceGridPolicy(), config.commonGridPoints());
            TimeSeriesAssembler.Assembly assembly = new TimeSeriesAssembler(reconciler)
                .assemble(sourceFiles, options.canonicalGrid, progressListener);
            excluded.addAll(assembly.excludedFiles);
            TimeSeriesCube cube = Normalizer.normalize(assembly.cube);

            if (options.useInterpolation) {
                progressListener.checkCancelled();
                progressListener.beginStage(Stage.INTERPOLATE, "Interpolating across time gaps...", 1);
                VisitSegmenter segmenter = new VisitSegmenter(gapThreshold);
                cube = new GapInterpolator(gapThreshold).fill(cube, segmenter.segment(cube.timeAxis));
                progressListener.increment();
            }
            return new AssembledArchive(cube, assembly.contributingFiles, excluded, totalIntegrations,
                config.referenceGridPolicy().name());
        } finally {
            try {
                FileUtils.deleteDirectory(workDirectory);
            } catch (IOException e) {
                LOG.warn("Could not delete work directory {}: {}", workDirectory, e.toString());
            }
        }
    }

    private CubeResult finish (AssembledArchive assembled, boolean fromCache, double gapThreshold,
                               ProgressListener progressListener) {
        progressListener.beginStage(Stage.FINALIZE, "Preparing cube for display...", 3);
        Reduction reduction = new Reducer()
            .reduce(assembled.cube.copy(), options.toReductionOptions(), progressListener);
        TimeSeriesCube cube = reduction.cube.checkAxes();
        progressListener.increment();

        double[][] displayValues = options.displayMode.valuesOf(cube);
        List<BandLightCurve> bandLightCurves = BandLightCurve.computeAll(cube, options.displayMode, options.bands);
        progressListener.increment();

        CubeMetadata metadata = assembled.newMetadata(fromCache);
        metadata.plottedIntegrations = reduction.plottedIntegrations;
        metadata.subsampled = reduction.subsampled;
        metadata.setAxisExtents(cube);
        metadata.userRanges = new ArrayList<>(reduction.appliedRanges);
        metadata.displayValueRange = reduction.displayValueRange;
        List<Visit> visits = new VisitSegmenter(gapThreshold).segment(assembled.cube.timeAxis);
        metadata.visits = VisitSegmenter.project(visits, reduction.keptColumns);
        metadata.interpolated = options.useInterpolation;
        metadata.gapThresholdHours = gapThreshold;
        metadata.smoothingSigma = options.smoothingSigma;
        metadata.displayMode = options.displayMode;
        progressListener.increment();
        LOG.info("Cube ready: {} from {} files, {} of {} integrations plotted.",
            cube, metadata.filesProcessed, metadata.plottedIntegrations, metadata.totalIntegrations);
        return new CubeResult(cube, displayValues, bandLightCurves, metadata);
    }

    private File createWorkDirectory () throws IOException {
        String parent = config.workDirectory();
        if (parent == null || parent.isBlank()) {
            return Files.createTempDirectory("stamp-job-").toFile();
        }
        Path parentPath = Files.createDirectories(Path.of(parent));
        return Files.createTempDirectory(parentPath, "job-").toFile();
    }

}
