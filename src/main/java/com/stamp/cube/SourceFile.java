package com.stamp.cube;

import com.google.common.collect.ImmutableList;
import com.google.common.collect.ImmutableMap;

import java.util.List;
import java.util.Map;

/**
 * One member of an uploaded archive, after it has been read: its format, its integrations in file order and whatever
 * descriptive header information could be found. Read-only once constructed.
 */
public class SourceFile {

    public static final String UNKNOWN = "Unknown";

    // Keys for the descriptive header information. Readers fill in whatever they can find.
    public static final String TARGET = "target";
    public static final String INSTRUMENT = "instrument";
    public static final String FILTER = "filter";
    public static final String GRATING = "grating";
    public static final String OBS_DATE = "obs_date";
    public static final String EXPOSURE_TIME = "exposure_time";
    public static final String FLUX_UNIT = "flux_unit";

    public final String fileName;

    public final SourceFormat format;

    public final ImmutableList<Integration> integrations;

    public final ImmutableMap<String, String> headerInfo;

    public SourceFile (String fileName, SourceFormat format, List<Integration> integrations, Map<String, String> headerInfo) {
        this.fileName = fileName;
        this.format = format;
        this.integrations = ImmutableList.copyOf(integrations);
        this.headerInfo = ImmutableMap.copyOf(headerInfo);
    }

    /** @return the header value for the key, or "Unknown" if the reader could not find it. */
    public String header (String key) {
        return headerInfo.getOrDefault(key, UNKNOWN);
    }

    /** @return the time of the first integration, or NaN for a file without integrations. */
    public double firstTime () {
        return integrations.isEmpty() ? Double.NaN : integrations.get(0).time;
    }

    @Override
    public String toString () {
        return String.format("%s (%s, %d integrations)", fileName, format, integrations.size());
    }

}
