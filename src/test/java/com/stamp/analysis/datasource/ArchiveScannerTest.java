package com.stamp.analysis.datasource;

import com.stamp.cube.CubeAssemblyException;
import com.stamp.cube.ExcludedFile;
import com.stamp.cube.SourceFile;
import com.stamp.cube.SourceFormat;
import com.stamp.cube.progress.NoopProgressListener;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.io.File;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.stream.Collectors;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

class ArchiveScannerTest {

    @TempDir
    Path tempDir;

    private final ArchiveScanner scanner = new ArchiveScanner(Map.of(SourceFormat.FITS, new TextSpectrumReader(3)));

    private ScanResult scan (Map<String, String> entries) throws Exception {
        File archive = TestArchives.zip(tempDir.resolve("upload.zip").toFile(), entries);
        return scanner.scan(archive, tempDir.resolve("work").toFile(), new NoopProgressListener());
    }

    private static List<String> names (ScanResult scan) {
        return scan.files.stream().map(f -> f.name).collect(Collectors.toList());
    }

    @Test
    void filesAreOrderedByFirstTimestampAndClutterIsSkipped () throws Exception {
        Map<String, String> entries = new LinkedHashMap<>();
        entries.put("obs/later.fits", TestArchives.spectra(59001.0, 0, 0.25));
        entries.put("obs/earlier.fits", TestArchives.spectra(59000.0, 0, 0.25, 0.5));
        entries.put("__MACOSX/obs/._earlier.fits", "resource fork");
        entries.put("obs/notes.txt", "observing log");
        ScanResult scan = scan(entries);
        assertEquals(List.of("obs/earlier.fits", "obs/later.fits"), names(scan));
        assertTrue(scan.excludedFiles.isEmpty());
        assertEquals(5, scan.estimatedIntegrations());
    }

    @Test
    void unreadableFileIsExcludedWithItsReason () throws Exception {
        Map<String, String> entries = new LinkedHashMap<>();
        entries.put("broken.fits", "this is not a spectrum");
        entries.put("good.fits", TestArchives.spectra(59000.0, 0));
        ScanResult scan = scan(entries);
        assertEquals(List.of("good.fits"), names(scan));
        ExcludedFile excluded = scan.excludedFiles.get(0);
        assertEquals("broken.fits", excluded.fileName());
        assertEquals(CubeAssemblyException.Kind.CORRUPT_FILE, excluded.kind());
    }

    @Test
    void archiveWithoutObservationsHasNoSupportedFiles () {
        CubeAssemblyException e = assertThrows(CubeAssemblyException.class,
            () -> scan(Map.of("readme.txt", "nothing here")));
        assertEquals(CubeAssemblyException.Kind.NO_SUPPORTED_FILES, e.kind);
    }

    @Test
    void archiveOfBrokenFilesIsAnEmptyResult () {
        CubeAssemblyException e = assertThrows(CubeAssemblyException.class,
            () -> scan(Map.of("a.fits", "garbage", "b.fits", "more garbage")));
        assertEquals(CubeAssemblyException.Kind.EMPTY_RESULT, e.kind);
        assertTrue(e.getMessage().contains("a.fits"));
        assertTrue(e.getMessage().contains("b.fits"));
    }

    @Test
    void fileWithoutUsableIntegrationsIsExcludedWhenRead () throws Exception {
        Map<String, String> entries = new LinkedHashMap<>();
        entries.put("good.fits", TestArchives.spectra(59000.0, 0, 0.25));
        entries.put("sparse.fits", TextSpectrumReader.line(59000.5, new double[] {1, 2}, new double[] {5, 5}));
        ScanResult scan = scan(entries);
        List<ExcludedFile> excluded = new ArrayList<>(scan.excludedFiles);

        List<SourceFile> files = scanner.readAll(scan, excluded, new NoopProgressListener());

        assertEquals(1, files.size());
        assertEquals("good.fits", files.get(0).fileName);
        assertEquals(2, files.get(0).integrations.size());
        assertEquals("NIRSPEC", files.get(0).header(SourceFile.INSTRUMENT));
        assertEquals(1, excluded.size());
        assertEquals(CubeAssemblyException.Kind.UNSUPPORTED_STRUCTURE, excluded.get(0).kind());
    }

    @Test
    void filesAreReorderedByTheirFirstRetainedIntegration () throws Exception {
        double[] wavelengths = {1.0, 1.5, 2.0, 2.5, 3.0};
        double[] blank = {Double.NaN, Double.NaN, Double.NaN, Double.NaN, Double.NaN};
        Map<String, String> entries = new LinkedHashMap<>();
        // The earliest record of early.fits has no valid flux and is dropped, so its data starts two hours in.
        entries.put("early.fits", TextSpectrumReader.line(59000.0, wavelengths, blank)
            + TestArchives.spectra(59000.0, 2, 2.25));
        entries.put("middle.fits", TestArchives.spectra(59000.0, 1, 1.25));
        ScanResult scan = scan(entries);
        assertEquals(List.of("early.fits", "middle.fits"), names(scan));

        List<SourceFile> files = scanner.readAll(scan, new ArrayList<>(), new NoopProgressListener());
        assertEquals(List.of("middle.fits", "early.fits"),
            files.stream().map(f -> f.fileName).collect(Collectors.toList()));
        assertEquals(2, files.get(1).integrations.size());
    }

}
