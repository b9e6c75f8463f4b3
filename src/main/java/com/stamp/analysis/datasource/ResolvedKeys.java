package com.stamp.analysis.datasource;

import com.google.common.collect.ImmutableMap;

import java.util.Locale;
import java.util.Map;

/** The outcome of resolving logical fields against one file: the actual name to read for each present field. */
public class ResolvedKeys {

    private final ImmutableMap<KeyResolver.Field, String> keys;

    ResolvedKeys (Map<KeyResolver.Field, String> keys) {
        this.keys = ImmutableMap.copyOf(keys);
    }

    /** @return the name holding the field, or null for an absent optional field. */
    public String key (KeyResolver.Field field) {
        return keys.get(field);
    }

    public boolean has (KeyResolver.Field field) {
        return keys.containsKey(field);
    }

    /** True if the field was found under a name marking it as a variance rather than a standard deviation. */
    public boolean isVariance (KeyResolver.Field field) {
        String key = keys.get(field);
        return key != null && key.trim().toLowerCase(Locale.ROOT).endsWith(KeyResolver.VARIANCE_SUFFIX);
    }

    /**
     * Apply unit fixes to values read for a field. Variances become standard deviations (a negative variance becomes
     * NaN). The input array is not modified.
     */
    public double[] normalizeUnits (KeyResolver.Field field, double[] values) {
        if (values == null || !isVariance(field)) return values;
        double[] result = new double[values.length];
        for (int i = 0; i < values.length; i++) {
            result[i] = Math.sqrt(values[i]);
        }
        return result;
    }

    @Override
    public String toString () {
        return keys.toString();
    }

}
