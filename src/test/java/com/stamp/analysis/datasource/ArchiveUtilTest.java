package com.stamp.analysis.datasource;

import com.stamp.cube.CubeAssemblyException;
import com.stamp.cube.SourceFormat;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.ValueSource;

import java.io.File;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertNull;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

class ArchiveUtilTest {

    @TempDir
    Path tempDir;

    @Test
    void entriesEscapingTheTargetDirectoryAreRefused () throws Exception {
        Map<String, String> entries = new LinkedHashMap<>();
        entries.put("data/obs.fits", "spectra");
        entries.put("../escaped.txt", "should not be written");
        File archive = TestArchives.zip(tempDir.resolve("upload.zip").toFile(), entries);
        File work = tempDir.resolve("work").toFile();

        List<File> extracted = ArchiveUtil.extractZip(archive, work);

        assertEquals(1, extracted.size());
        assertEquals(new File(new File(work, "data"), "obs.fits").getAbsoluteFile(), extracted.get(0).getAbsoluteFile());
        assertEquals("spectra", Files.readString(extracted.get(0).toPath()));
        assertFalse(tempDir.resolve("escaped.txt").toFile().exists());
    }

    @Test
    void uploadThatIsNotAZipHasNoSupportedFiles () throws Exception {
        File notZip = tempDir.resolve("upload.zip").toFile();
        Files.writeString(notZip.toPath(), "this is plain text");
        CubeAssemblyException e = assertThrows(CubeAssemblyException.class,
            () -> ArchiveUtil.extractZip(notZip, tempDir.resolve("work").toFile()));
        assertEquals(CubeAssemblyException.Kind.NO_SUPPORTED_FILES, e.kind);
    }

    @ParameterizedTest
    @ValueSource(strings = {"__MACOSX/obs.fits", "data/__MACOSX/obs.fits", "data/._obs.fits", ".DS_Store"})
    void operatingSystemClutterIsIgnorable (String path) {
        assertTrue(ArchiveUtil.isIgnorable(path));
    }

    @ParameterizedTest
    @ValueSource(strings = {"obs.fits", "data/visit_1/obs.h5", "MACOSX.fits"})
    void observationFilesAreNotIgnorable (String path) {
        assertFalse(ArchiveUtil.isIgnorable(path));
    }

    @Test
    void contentSignatureBeatsTheExtension () throws Exception {
        File fits = tempDir.resolve("mislabeled.dat").toFile();
        Files.writeString(fits.toPath(), "SIMPLE  =                    T / conforms to FITS standard", StandardCharsets.US_ASCII);
        assertEquals(SourceFormat.FITS, ArchiveUtil.detectFormat(fits));

        byte[] bytes = new byte[600];
        byte[] signature = {(byte) 0x89, 'H', 'D', 'F', '\r', '\n', 0x1a, '\n'};
        System.arraycopy(signature, 0, bytes, 512, signature.length);
        File hdf5 = tempDir.resolve("userblock.bin").toFile();
        Files.write(hdf5.toPath(), bytes);
        assertEquals(SourceFormat.HDF5, ArchiveUtil.detectFormat(hdf5));
    }

    @Test
    void extensionDecidesWhenContentIsInconclusive () throws Exception {
        File h5 = tempDir.resolve("spectra.H5").toFile();
        Files.writeString(h5.toPath(), "not really hdf5");
        assertEquals(SourceFormat.HDF5, ArchiveUtil.detectFormat(h5));

        File readme = tempDir.resolve("readme.txt").toFile();
        Files.writeString(readme.toPath(), "notes");
        assertNull(ArchiveUtil.detectFormat(readme));
    }

}
