package com.stamp.cube;

import com.google.common.collect.ImmutableSet;

import java.util.Locale;

/**
 * The observation file families we know how to read. Each has a set of file extensions used for classification when
 * content sniffing is inconclusive.
 */
public enum SourceFormat {

    /** Tabular binary science format (FITS), e.g. x1dints products with EXTRACT1D and INT_TIMES extensions. */
    FITS("fits", "fit", "fts"),

    /** Hierarchical array format (HDF5), e.g. Eureka! stage outputs. */
    HDF5("h5", "hdf5", "he5");

    public final ImmutableSet<String> extensions;

    SourceFormat (String... extensions) {
        this.extensions = ImmutableSet.copyOf(extensions);
    }

    /** @return the format whose extensions include that of the given file name, or null if none match. */
    public static SourceFormat fromFilename (String filename) {
        String extension = filename.substring(filename.lastIndexOf(".") + 1).toLowerCase(Locale.ROOT);
        for (SourceFormat format : SourceFormat.values()) {
            if (format.extensions.contains(extension)) {
                return format;
            }
        }
        return null;
    }

}
