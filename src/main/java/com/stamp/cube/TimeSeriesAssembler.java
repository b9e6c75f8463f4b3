package com.stamp.cube;

import com.google.common.collect.ImmutableList;
import com.stamp.cube.progress.ProgressListener;
import com.stamp.cube.progress.Stage;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.Comparator;
import java.util.List;

/**
 * Reconciles every integration of every file onto one wavelength grid and lays them out as the columns of a cube,
 * ordered by time. Column order is a stable sort by timestamp, so integrations with equal timestamps keep their
 * file-then-intra-file order. Times are converted to hours elapsed since the earliest integration.
 */
public class TimeSeriesAssembler {

    private static final Logger LOG = LoggerFactory.getLogger(TimeSeriesAssembler.class);

    public static final double HOURS_PER_DAY = 24;

    private final GridReconciler reconciler;

    public TimeSeriesAssembler (GridReconciler reconciler) {
        this.reconciler = reconciler;
    }

    /** The assembled cube together with the files that could not contribute to it. */
    public static class Assembly {
        public final TimeSeriesCube cube;
        /** Files that contributed at least one column. */
        public final ImmutableList<SourceFile> contributingFiles;
        public final ImmutableList<ExcludedFile> excludedFiles;

        public Assembly (TimeSeriesCube cube, List<SourceFile> contributingFiles, List<ExcludedFile> excludedFiles) {
            this.cube = cube;
            this.contributingFiles = ImmutableList.copyOf(contributingFiles);
            this.excludedFiles = ImmutableList.copyOf(excludedFiles);
        }
    }

    /**
     * @param files source files already in scan order (by first timestamp)
     * @param canonicalGrid optional caller-supplied wavelength grid, may be null
     * @throws CubeAssemblyException EMPTY_RESULT if no integration could be placed on the grid
     */
    public Assembly assemble (List<SourceFile> files, double[] canonicalGrid, ProgressListener progress) {
        List<Integration> all = new ArrayList<>();
        for (SourceFile file : files) all.addAll(file.integrations);
        progress.checkCancelled();
        double[] grid = reconciler.chooseReferenceGrid(all, canonicalGrid);

        progress.beginStage(Stage.REGRID, "Regridding integrations onto a common wavelength grid...", all.size());
        List<RegriddedIntegration> columns = new ArrayList<>(all.size());
        List<SourceFile> contributing = new ArrayList<>();
        List<ExcludedFile> excluded = new ArrayList<>();
        for (SourceFile file : files) {
            int placed = 0;
            CubeAssemblyException lastFailure = null;
            for (Integration integration : file.integrations) {
                progress.checkCancelled();
                try {
                    columns.add(reconciler.regrid(integration, grid, file.fileName));
                    placed += 1;
                } catch (CubeAssemblyException e) {
                    if (e.kind != CubeAssemblyException.Kind.INTERPOLATION_DOMAIN_EMPTY) throw e;
                    lastFailure = e;
                }
                progress.increment();
            }
            if (placed == 0) {
                CubeAssemblyException reason = lastFailure != null ? lastFailure
                    : CubeAssemblyException.interpolationDomainEmpty(file.fileName, "file has no integrations");
                LOG.warn("Excluding {}: {}", file.fileName, reason.getMessage());
                excluded.add(ExcludedFile.forException(file.fileName, reason));
            } else {
                if (placed < file.integrations.size()) {
                    LOG.warn("{}: {} of {} integrations do not overlap the reference grid and were dropped.",
                        file.fileName, file.integrations.size() - placed, file.integrations.size());
                }
                contributing.add(file);
            }
        }
        if (columns.isEmpty()) {
            throw CubeAssemblyException.emptyResult(
                "No integration overlaps the reference wavelength grid, so no cube can be built.");
        }

        // Sorting objects is stable, which preserves file order for equal timestamps.
        Integer[] order = new Integer[columns.size()];
        for (int i = 0; i < order.length; i++) order[i] = i;
        Arrays.sort(order, Comparator.comparingDouble(i -> columns.get(i).time));
        double t0 = columns.get(order[0]).time;

        boolean anyError = columns.stream().anyMatch(c -> c.error != null);
        int nRows = grid.length;
        int nCols = columns.size();
        double[] timeAxis = new double[nCols];
        double[][] flux = new double[nRows][nCols];
        double[][] error = anyError ? new double[nRows][nCols] : null;
        boolean anyFinite = false;
        for (int c = 0; c < nCols; c++) {
            RegriddedIntegration column = columns.get(order[c]);
            timeAxis[c] = (column.time - t0) * HOURS_PER_DAY;
            for (int r = 0; r < nRows; r++) {
                flux[r][c] = column.flux[r];
                if (Double.isFinite(column.flux[r])) anyFinite = true;
                if (error != null) error[r][c] = column.error == null ? Double.NaN : column.error[r];
            }
        }
        if (!anyFinite) {
            throw CubeAssemblyException.emptyResult("Every flux value in the assembled cube is missing.");
        }
        TimeSeriesCube cube = TimeSeriesCube.observed(grid, timeAxis, flux, error).checkAxes();
        LOG.info("Assembled cube of {} wavelengths x {} integrations spanning {} hours.",
            nRows, nCols, timeAxis[nCols - 1]);
        return new Assembly(cube, contributing, excluded);
    }

}
