package com.stamp.analysis.datasource;

import java.io.File;
import java.io.FileOutputStream;
import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.util.Map;
import java.util.zip.ZipEntry;
import java.util.zip.ZipOutputStream;

/** Builds zip archives for tests. */
public abstract class TestArchives {

    /** Write a zip holding the given entries, in the map's iteration order. */
    public static File zip (File target, Map<String, String> entries) throws IOException {
        try (ZipOutputStream out = new ZipOutputStream(new FileOutputStream(target))) {
            for (Map.Entry<String, String> entry : entries.entrySet()) {
                out.putNextEntry(new ZipEntry(entry.getKey()));
                out.write(entry.getValue().getBytes(StandardCharsets.UTF_8));
                out.closeEntry();
            }
        }
        return target;
    }

    /**
     * Text for a file of evenly spaced integrations over five wavelengths.
     * @param startDays time of the first integration in days
     * @param hours offsets of each integration from the start, in hours
     */
    public static String spectra (double startDays, double... hours) {
        double[] wavelengths = {1.0, 1.5, 2.0, 2.5, 3.0};
        StringBuilder builder = new StringBuilder("# instrument=NIRSPEC\n# target=WASP-39\n");
        for (int i = 0; i < hours.length; i++) {
            double[] flux = new double[wavelengths.length];
            for (int w = 0; w < flux.length; w++) flux[w] = 100 + w + 0.1 * i;
            builder.append(TextSpectrumReader.line(startDays + hours[i] / 24, wavelengths, flux));
        }
        return builder.toString();
    }

}
