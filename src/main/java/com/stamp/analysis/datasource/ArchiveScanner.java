package com.stamp.analysis.datasource;

import com.stamp.cube.CubeAssemblyException;
import com.stamp.cube.ExcludedFile;
import com.stamp.cube.SourceFile;
import com.stamp.cube.SourceFormat;
import com.stamp.cube.progress.ProgressListener;
import com.stamp.cube.progress.Stage;
import org.apache.commons.io.FilenameUtils;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.File;
import java.io.IOException;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;
import java.util.Map;
import java.util.stream.Collectors;

/**
 * Finds the observation files in an uploaded archive, classifies them by format, probes each one and orders them by
 * the timestamp of their first integration. Files are the ordering unit: integrations keep their order within a file.
 * Then reads the files, reordering them by the first integration each one actually contributes.
 */
public class ArchiveScanner {

    private static final Logger LOG = LoggerFactory.getLogger(ArchiveScanner.class);

    private final Map<SourceFormat, FormatReader> readers;

    public ArchiveScanner (Map<SourceFormat, FormatReader> readers) {
        this.readers = readers;
    }

    /**
     * Extract the archive into the work directory and probe every supported file in it.
     * @throws CubeAssemblyException NO_SUPPORTED_FILES if nothing in the archive is a supported format, or
     *         EMPTY_RESULT if every supported file failed its probe.
     */
    public ScanResult scan (File archive, File workDirectory, ProgressListener progressListener) throws IOException {
        progressListener.beginStage(Stage.SCAN, "Extracting archive...", 1);
        List<File> extracted = ArchiveUtil.extractZip(archive, workDirectory);
        progressListener.increment();

        List<File> candidates = new ArrayList<>();
        List<SourceFormat> formats = new ArrayList<>();
        for (File file : extracted) {
            String name = relativeName(workDirectory, file);
            if (ArchiveUtil.isIgnorable(name)) continue;
            SourceFormat format = ArchiveUtil.detectFormat(file);
            if (format == null || !readers.containsKey(format)) {
                LOG.debug("Ignoring unsupported archive member {}", name);
                continue;
            }
            candidates.add(file);
            formats.add(format);
        }
        if (candidates.isEmpty()) {
            throw CubeAssemblyException.noSupportedFiles(String.format(
                "No supported observation files found in %s (looked for %s and %s files among %d entries).",
                archive.getName(), SourceFormat.FITS.extensions, SourceFormat.HDF5.extensions, extracted.size()));
        }

        progressListener.beginStage(Stage.SCAN, String.format("Scanning %d files...", candidates.size()),
            candidates.size());
        List<ScannedFile> scanned = new ArrayList<>();
        List<ExcludedFile> excluded = new ArrayList<>();
        for (int i = 0; i < candidates.size(); i++) {
            progressListener.checkCancelled();
            File file = candidates.get(i);
            String name = relativeName(workDirectory, file);
            try {
                FileProbe probe = readers.get(formats.get(i)).probe(file, name);
                scanned.add(new ScannedFile(file, name, formats.get(i), probe));
            } catch (CubeAssemblyException e) {
                if (!e.kind.perFile) throw e;
                LOG.warn("Excluding {}: {}", name, e.getMessage());
                excluded.add(ExcludedFile.forException(name, e));
            }
            progressListener.increment();
        }
        if (scanned.isEmpty()) {
            throw CubeAssemblyException.emptyResult(allExcludedMessage(excluded));
        }
        // Stable sort; files whose first time is unknown go last.
        scanned.sort(Comparator.comparingDouble(f -> Double.isNaN(f.probe.firstTime())
            ? Double.POSITIVE_INFINITY : f.probe.firstTime()));
        LOG.info("Scan found {} usable files ({} excluded) holding about {} integrations.",
            scanned.size(), excluded.size(), scanned.stream().mapToInt(f -> f.probe.integrationCount()).sum());
        return new ScanResult(scanned, excluded);
    }

    /**
     * Read every scanned file in order. Files that fail are excluded and recorded; reading continues with the rest.
     * @param excluded receives an entry per file that could not be read
     * @throws CubeAssemblyException EMPTY_RESULT if no file could be read.
     */
    public List<SourceFile> readAll (ScanResult scan, List<ExcludedFile> excluded, ProgressListener progressListener) {
        progressListener.beginStage(Stage.READ,
            String.format("Reading %d files...", scan.files.size()), scan.estimatedIntegrations());
        List<SourceFile> sourceFiles = new ArrayList<>();
        for (ScannedFile scanned : scan.files) {
            progressListener.checkCancelled();
            progressListener.setMessage("Reading " + scanned.name);
            try {
                SourceFile sourceFile = readers.get(scanned.format).read(scanned.file, scanned.name, progressListener);
                LOG.info("Read {}", sourceFile);
                sourceFiles.add(sourceFile);
            } catch (CubeAssemblyException e) {
                if (!e.kind.perFile) throw e;
                LOG.warn("Excluding {}: {}", scanned.name, e.getMessage());
                excluded.add(ExcludedFile.forException(scanned.name, e));
            }
        }
        if (sourceFiles.isEmpty()) {
            throw CubeAssemblyException.emptyResult(allExcludedMessage(excluded));
        }
        // The probe saw the first raw timestamp, which may belong to an integration the reader later dropped.
        sourceFiles.sort(Comparator.comparingDouble(f -> f.integrations.get(0).time));
        return sourceFiles;
    }

    private static String allExcludedMessage (List<ExcludedFile> excluded) {
        return "None of the supported files could be used: " + excluded.stream()
            .map(e -> e.fileName() + " (" + e.reason() + ")")
            .collect(Collectors.joining("; "));
    }

    private static String relativeName (File root, File file) {
        String relative = root.toPath().toAbsolutePath().normalize()
            .relativize(file.toPath().toAbsolutePath().normalize()).toString();
        return FilenameUtils.separatorsToUnix(relative);
    }

}
