package com.stamp.analysis;

import com.fasterxml.jackson.core.type.TypeReference;
import com.stamp.cube.AxisRange;
import com.stamp.cube.Band;
import com.stamp.cube.CubeAssemblyException;
import com.stamp.cube.DisplayMode;
import com.stamp.cube.ReductionOptions;
import com.stamp.util.JsonUtil;

import java.util.ArrayList;
import java.util.List;
import java.util.Locale;
import java.util.Map;

/**
 * Options supplied when a job is submitted. They can be built from the string-valued form fields of an upload
 * request, in which case everything is validated up front so that a malformed request fails at submission rather
 * than in the background.
 */
public class JobOptions {

    public boolean useInterpolation;

    /** Maximum number of time columns to emit, 0 for all. */
    public int integrationCap;

    public double smoothingSigma;

    public DisplayMode displayMode = DisplayMode.VARIABILITY;

    public AxisRange wavelengthRange;

    public AxisRange timeRange;

    public AxisRange valueRange;

    public List<Band> bands = new ArrayList<>();

    /** Overrides the configured gap threshold when not null. */
    public Double gapThresholdHours;

    /** Wavelength grid to reconcile all integrations onto, overriding the configured policy. Null to use the policy. */
    public double[] canonicalGrid;

    public ReductionOptions toReductionOptions () {
        ReductionOptions reduction = new ReductionOptions();
        reduction.integrationCap = integrationCap;
        reduction.smoothingSigma = smoothingSigma;
        reduction.displayMode = displayMode;
        reduction.wavelengthRange = wavelengthRange;
        reduction.timeRange = timeRange;
        reduction.valueRange = valueRange;
        return reduction;
    }

    /**
     * Interpret upload form fields. Absent and blank fields take their defaults.
     * @throws CubeAssemblyException of kind BAD_REQUEST naming the first field that could not be interpreted.
     */
    public static JobOptions fromFormFields (Map<String, String> fields) {
        JobOptions options = new JobOptions();
        options.useInterpolation = booleanField(fields, "use_interpolation");
        Double cap = numberField(fields, "num_integrations");
        if (cap != null) {
            if (cap < 0 || cap != Math.floor(cap) || cap > Integer.MAX_VALUE) {
                throw CubeAssemblyException.badRequest("num_integrations must be a non-negative whole number.");
            }
            options.integrationCap = cap.intValue();
        }
        Double sigma = numberField(fields, "smoothing_sigma");
        if (sigma != null) {
            if (sigma < 0) throw CubeAssemblyException.badRequest("smoothing_sigma may not be negative.");
            options.smoothingSigma = sigma;
        }
        options.displayMode = DisplayMode.fromString(fields.get("z_axis_display"));
        options.wavelengthRange = rangeField(fields, "wavelength_range");
        options.timeRange = rangeField(fields, "time_range");
        options.valueRange = rangeField(fields, "variability_range");
        options.gapThresholdHours = numberField(fields, "gap_threshold_hours");
        if (options.gapThresholdHours != null && options.gapThresholdHours <= 0) {
            throw CubeAssemblyException.badRequest("gap_threshold_hours must be positive.");
        }
        options.bands = bandsField(fields, "custom_bands");
        options.canonicalGrid = gridField(fields, "canonical_grid");
        return options;
    }

    private static String field (Map<String, String> fields, String name) {
        String value = fields.get(name);
        return value == null || value.isBlank() ? null : value.trim();
    }

    private static boolean booleanField (Map<String, String> fields, String name) {
        String value = field(fields, name);
        if (value == null) return false;
        switch (value.toLowerCase(Locale.ROOT)) {
            case "true":
            case "yes":
            case "on":
            case "1":
                return true;
            case "false":
            case "no":
            case "off":
            case "0":
                return false;
            default:
                throw CubeAssemblyException.badRequest(name + " must be true or false, was '" + value + "'.");
        }
    }

    private static Double numberField (Map<String, String> fields, String name) {
        String value = field(fields, name);
        if (value == null) return null;
        try {
            double parsed = Double.parseDouble(value);
            if (!Double.isFinite(parsed)) {
                throw CubeAssemblyException.badRequest(name + " must be a finite number, was '" + value + "'.");
            }
            return parsed;
        } catch (NumberFormatException e) {
            throw CubeAssemblyException.badRequest(name + " must be a number, was '" + value + "'.");
        }
    }

    private static AxisRange rangeField (Map<String, String> fields, String prefix) {
        return AxisRange.of(numberField(fields, prefix + "_min"), numberField(fields, prefix + "_max"));
    }

    private static List<Band> bandsField (Map<String, String> fields, String name) {
        String value = field(fields, name);
        if (value == null) return new ArrayList<>();
        List<Band> bands;
        try {
            bands = JsonUtil.objectMapper.readValue(value, new TypeReference<List<Band>>() { });
        } catch (Exception e) {
            throw CubeAssemblyException.badRequest(name + " must be a JSON array of {name, start, end} objects.");
        }
        if (bands == null) return new ArrayList<>();
        for (Band band : bands) {
            if (band == null || !band.isValid()) {
                throw CubeAssemblyException.badRequest("Invalid band " + band + ": start must be less than end.");
            }
        }
        return new ArrayList<>(bands);
    }

    private static double[] gridField (Map<String, String> fields, String name) {
        String value = field(fields, name);
        if (value == null) return null;
        try {
            return JsonUtil.objectMapper.readValue(value, double[].class);
        } catch (Exception e) {
            throw CubeAssemblyException.badRequest(name + " must be a JSON array of wavelengths.");
        }
    }

}
