package com.stamp.analysis.datasource;

import com.stamp.cube.CubeAssemblyException;
import com.stamp.cube.SourceFormat;
import org.apache.commons.io.FilenameUtils;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import javax.annotation.Nullable;

import java.io.File;
import java.io.IOException;
import java.io.InputStream;
import java.io.RandomAccessFile;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.StandardCopyOption;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.Enumeration;
import java.util.List;
import java.util.zip.ZipEntry;
import java.util.zip.ZipException;
import java.util.zip.ZipFile;

/**
 * Static methods for unpacking uploaded archives and recognizing the observation files inside them.
 */
public abstract class ArchiveUtil {

    private static final Logger LOG = LoggerFactory.getLogger(ArchiveUtil.class);

    /** The first card of every FITS primary header starts with this keyword. */
    private static final byte[] FITS_SIGNATURE = "SIMPLE  =".getBytes(StandardCharsets.US_ASCII);

    /** HDF5 format signature, found at offset 0 or at 512 bytes times a power of two. */
    private static final byte[] HDF5_SIGNATURE = {(byte) 0x89, 'H', 'D', 'F', '\r', '\n', 0x1a, '\n'};

    /**
     * Extract every regular entry of a zip archive below the target directory, keeping relative paths. Entries
     * whose path would resolve outside the target directory are refused.
     * @return the extracted files in archive order.
     * @throws CubeAssemblyException NO_SUPPORTED_FILES if the upload is not a readable zip archive.
     */
    public static List<File> extractZip (File archive, File targetDirectory) throws IOException {
        Path root = targetDirectory.toPath().toAbsolutePath().normalize();
        List<File> extracted = new ArrayList<>();
        try (ZipFile zipFile = new ZipFile(archive)) {
            Enumeration<? extends ZipEntry> entries = zipFile.entries();
            while (entries.hasMoreElements()) {
                ZipEntry entry = entries.nextElement();
                Path target = root.resolve(entry.getName()).normalize();
                if (!target.startsWith(root)) {
                    LOG.warn("Refusing archive entry {} which resolves outside the extraction directory.",
                        entry.getName());
                    continue;
                }
                if (entry.isDirectory()) {
                    Files.createDirectories(target);
                    continue;
                }
                Files.createDirectories(target.getParent());
                try (InputStream in = zipFile.getInputStream(entry)) {
                    Files.copy(in, target, StandardCopyOption.REPLACE_EXISTING);
                }
                extracted.add(target.toFile());
            }
        } catch (ZipException e) {
            throw new CubeAssemblyException(CubeAssemblyException.Kind.NO_SUPPORTED_FILES,
                archive.getName() + " is not a readable zip archive.", e);
        }
        return extracted;
    }

    /** True for operating system clutter such as macOS resource forks, which are never observation files. */
    public static boolean isIgnorable (String relativePath) {
        String normalized = FilenameUtils.separatorsToUnix(relativePath);
        String name = FilenameUtils.getName(normalized);
        return normalized.startsWith("__MACOSX/") || normalized.contains("/__MACOSX/")
            || name.startsWith("._") || name.equals(".DS_Store");
    }

    /**
     * Classify a file by content, falling back to its extension.
     * @return the detected format, or null if the file is not a supported observation file.
     */
    public static @Nullable SourceFormat detectFormat (File file) {
        try {
            if (hasFitsSignature(file)) return SourceFormat.FITS;
            if (hasHdf5Signature(file)) return SourceFormat.HDF5;
        } catch (IOException e) {
            LOG.warn("Could not read {} to detect its format: {}", file.getName(), e.toString());
        }
        return SourceFormat.fromFilename(file.getName());
    }

    static boolean hasFitsSignature (File file) throws IOException {
        return signatureAt(file, 0, FITS_SIGNATURE);
    }

    static boolean hasHdf5Signature (File file) throws IOException {
        long length = file.length();
        if (signatureAt(file, 0, HDF5_SIGNATURE)) return true;
        for (long offset = 512; offset + HDF5_SIGNATURE.length <= length; offset *= 2) {
            if (signatureAt(file, offset, HDF5_SIGNATURE)) return true;
        }
        return false;
    }

    private static boolean signatureAt (File file, long offset, byte[] signature) throws IOException {
        if (file.length() < offset + signature.length) return false;
        byte[] buffer = new byte[signature.length];
        try (RandomAccessFile raf = new RandomAccessFile(file, "r")) {
            raf.seek(offset);
            raf.readFully(buffer);
        }
        return Arrays.equals(buffer, signature);
    }

}
