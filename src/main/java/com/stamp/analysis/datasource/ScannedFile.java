package com.stamp.analysis.datasource;

import com.stamp.cube.SourceFormat;

import java.io.File;

/** An archive member that was recognized and successfully probed, ready to be read. */
public class ScannedFile {

    public final File file;

    /** Path relative to the archive root, used in all messages. */
    public final String name;

    public final SourceFormat format;

    public final FileProbe probe;

    public ScannedFile (File file, String name, SourceFormat format, FileProbe probe) {
        this.file = file;
        this.name = name;
        this.format = format;
        this.probe = probe;
    }

    @Override
    public String toString () {
        return String.format("%s (%s, %d integrations from %.6f)",
            name, format, probe.integrationCount(), probe.firstTime());
    }

}
