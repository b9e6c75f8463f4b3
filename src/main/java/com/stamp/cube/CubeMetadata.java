package com.stamp.cube;

import java.util.ArrayList;
import java.util.List;

/**
 * Everything a presentation layer needs to know about how a cube was produced, so that any view of it can be
 * reconstructed from the same input and options. Serialized as-is with the result.
 */
public class CubeMetadata {
    public int filesProcessed;
    public List<ExcludedFile> excludedFiles = new ArrayList<>();
    /** Integrations read from all files, before any capping. */
    public int totalIntegrations;
    public int plottedIntegrations;
    public boolean subsampled;
    public double wavelengthMin;
    public double wavelengthMax;
    public String wavelengthRange;
    public double timeMin;
    public double timeMax;
    public String timeRange;
    public List<String> targets = new ArrayList<>();
    public List<String> instruments = new ArrayList<>();
    public List<String> filters = new ArrayList<>();
    public List<String> gratings = new ArrayList<>();
    public String fluxUnit;
    public List<String> userRanges = new ArrayList<>();
    /** Visits of the emitted time axis. */
    public List<Visit> visits = new ArrayList<>();
    public boolean interpolated;
    public double gapThresholdHours;
    public double smoothingSigma;
    public DisplayMode displayMode;
    public String referenceGridPolicy;
    public boolean fromCache;
    /** Clamped bounds of the requested value range, or null. */
    public double[] displayValueRange;

    /** Fill in the axis extents and their formatted forms from the emitted cube. */
    public void setAxisExtents (TimeSeriesCube cube) {
        if (cube.nWavelengths() > 0) {
            wavelengthMin = cube.wavelengthAxis[0];
            wavelengthMax = cube.wavelengthAxis[cube.nWavelengths() - 1];
            wavelengthRange = String.format("%.3f-%.3f um", wavelengthMin, wavelengthMax);
        } else {
            wavelengthMin = wavelengthMax = Double.NaN;
        }
        if (cube.nTimes() > 0) {
            timeMin = cube.timeAxis[0];
            timeMax = cube.timeAxis[cube.nTimes() - 1];
            timeRange = String.format("%.2f-%.2f hours", timeMin, timeMax);
        } else {
            timeMin = timeMax = Double.NaN;
        }
    }
}
