package com.stamp.analysis;

import com.google.common.collect.ImmutableList;
import com.google.common.collect.ImmutableSortedSet;
import com.stamp.cube.CubeMetadata;
import com.stamp.cube.ExcludedFile;
import com.stamp.cube.SourceFile;
import com.stamp.cube.TimeSeriesCube;

import java.util.ArrayList;
import java.util.Collection;
import java.util.List;

/**
 * The expensive part of a job's output: the normalized (and possibly gap-filled) cube assembled from an archive,
 * together with the facts about its source files that end up in the metadata. This is the unit that is cached; it is
 * never modified once built, and every job reduces its own copy of the cube.
 */
public class AssembledArchive {

    public final TimeSeriesCube cube;

    public final int filesProcessed;

    public final ImmutableList<ExcludedFile> excludedFiles;

    public final int totalIntegrations;

    public final ImmutableSortedSet<String> targets;

    public final ImmutableSortedSet<String> instruments;

    public final ImmutableSortedSet<String> filters;

    public final ImmutableSortedSet<String> gratings;

    public final String fluxUnit;

    public final String referenceGridPolicy;

    public AssembledArchive (TimeSeriesCube cube, List<SourceFile> contributingFiles, List<ExcludedFile> excludedFiles,
                             int totalIntegrations, String referenceGridPolicy) {
        this.cube = cube;
        this.filesProcessed = contributingFiles.size();
        this.excludedFiles = ImmutableList.copyOf(excludedFiles);
        this.totalIntegrations = totalIntegrations;
        this.targets = headerValues(contributingFiles, SourceFile.TARGET);
        this.instruments = headerValues(contributingFiles, SourceFile.INSTRUMENT);
        this.filters = headerValues(contributingFiles, SourceFile.FILTER);
        this.gratings = headerValues(contributingFiles, SourceFile.GRATING);
        this.fluxUnit = contributingFiles.isEmpty()
            ? SourceFile.UNKNOWN
            : contributingFiles.get(0).header(SourceFile.FLUX_UNIT);
        this.referenceGridPolicy = referenceGridPolicy;
    }

    private static ImmutableSortedSet<String> headerValues (Collection<SourceFile> files, String key) {
        ImmutableSortedSet.Builder<String> values = ImmutableSortedSet.naturalOrder();
        for (SourceFile file : files) values.add(file.header(key));
        return values.build();
    }

    /** A fresh metadata object holding everything known at assembly time. Each job fills in the rest. */
    public CubeMetadata newMetadata (boolean fromCache) {
        CubeMetadata metadata = new CubeMetadata();
        metadata.filesProcessed = filesProcessed;
        metadata.excludedFiles = new ArrayList<>(excludedFiles);
        metadata.totalIntegrations = totalIntegrations;
        metadata.targets = new ArrayList<>(targets);
        metadata.instruments = new ArrayList<>(instruments);
        metadata.filters = new ArrayList<>(filters);
        metadata.gratings = new ArrayList<>(gratings);
        metadata.fluxUnit = fluxUnit;
        metadata.referenceGridPolicy = referenceGridPolicy;
        metadata.fromCache = fromCache;
        return metadata;
    }

}
