package com.stamp.analysis.datasource;

import com.google.common.collect.ImmutableList;
import com.google.common.collect.ImmutableMap;
import com.google.common.collect.ImmutableSet;
import com.stamp.cube.FieldResolutionException;

import java.util.Collection;
import java.util.EnumMap;
import java.util.Locale;
import java.util.Map;

/**
 * Maps the logical fields of a spectral record onto the names actually used in a file. Different producing pipelines
 * name the same quantity differently, so each logical field has an ordered list of acceptable names and the first one
 * present wins. Resolution happens once per file (or per table) and the result is reused for every record in it.
 */
public class KeyResolver {

    public enum Field {
        FLUX, WAVELENGTH, TIME, ERROR;

        public String label () {
            return name().toLowerCase(Locale.ROOT);
        }
    }

    /** Names ending in this suffix hold a variance, which is converted to a standard deviation on read. */
    public static final String VARIANCE_SUFFIX = "stdvar";

    /** Root-level datasets of hierarchical (HDF5) files. */
    public static final KeyResolver HDF5 = new KeyResolver(
        ImmutableMap.of(
            Field.FLUX, ImmutableList.of("calibrated_optspec", "stdspec", "optspec"),
            Field.WAVELENGTH, ImmutableList.of("eureka_wave_1d", "wave_1d", "wavelength", "wave"),
            Field.TIME, ImmutableList.of("time", "bmjd", "mjd", "bjd", "time_bjd", "time_mjd"),
            Field.ERROR, ImmutableList.of("calibrated_opterr", "stdvar", "error", "flux_error", "sigma")
        ),
        ImmutableSet.of(Field.ERROR),
        false
    );

    /** Columns of a FITS spectral extraction table. */
    public static final KeyResolver FITS_SPECTRUM = new KeyResolver(
        ImmutableMap.of(
            Field.WAVELENGTH, ImmutableList.of("WAVELENGTH"),
            Field.FLUX, ImmutableList.of("FLUX"),
            Field.ERROR, ImmutableList.of("FLUX_ERROR", "ERROR")
        ),
        ImmutableSet.of(Field.ERROR),
        true
    );

    /** Per-row timestamp columns of a FITS extraction table holding one integration per row. */
    public static final KeyResolver FITS_ROW_TIME = new KeyResolver(
        ImmutableMap.of(Field.TIME, ImmutableList.of("MJD-AVG", "MJD-BEG", "MJD-END")),
        ImmutableSet.of(),
        true
    );

    /** Integration mid-times in the FITS INT_TIMES extension. */
    public static final KeyResolver FITS_INT_TIMES = new KeyResolver(
        ImmutableMap.of(Field.TIME, ImmutableList.of("int_mid_MJD_UTC", "int_mid_BJD_TDB")),
        ImmutableSet.of(),
        true
    );

    private final ImmutableMap<Field, ImmutableList<String>> candidates;

    private final ImmutableSet<Field> optional;

    private final boolean ignoreCase;

    public KeyResolver (Map<Field, ImmutableList<String>> candidates, Collection<Field> optional, boolean ignoreCase) {
        this.candidates = ImmutableMap.copyOf(candidates);
        this.optional = ImmutableSet.copyOf(optional);
        this.ignoreCase = ignoreCase;
    }

    public ImmutableList<String> candidates (Field field) {
        return candidates.getOrDefault(field, ImmutableList.of());
    }

    /**
     * @param fileName used only in error messages
     * @param available the names present in the file or table
     * @return the name to use for each field this resolver knows about
     * @throws FieldResolutionException if a required field has no acceptable name present
     */
    public ResolvedKeys resolve (String fileName, Collection<String> available) {
        Map<Field, String> resolved = new EnumMap<>(Field.class);
        for (Map.Entry<Field, ImmutableList<String>> entry : candidates.entrySet()) {
            String found = firstPresent(entry.getValue(), available);
            if (found != null) {
                resolved.put(entry.getKey(), found);
            } else if (!optional.contains(entry.getKey())) {
                throw new FieldResolutionException(fileName, entry.getKey().label(), entry.getValue());
            }
        }
        return new ResolvedKeys(resolved);
    }

    /** @return true if every required field has an acceptable name present. */
    public boolean canResolve (Collection<String> available) {
        for (Map.Entry<Field, ImmutableList<String>> entry : candidates.entrySet()) {
            if (!optional.contains(entry.getKey()) && firstPresent(entry.getValue(), available) == null) {
                return false;
            }
        }
        return true;
    }

    /** Returns the name as it appears in the file, which may differ in case from the candidate. */
    private String firstPresent (ImmutableList<String> names, Collection<String> available) {
        for (String name : names) {
            for (String present : available) {
                if (ignoreCase ? present.trim().equalsIgnoreCase(name) : present.equals(name)) {
                    return present;
                }
            }
        }
        return null;
    }

}
