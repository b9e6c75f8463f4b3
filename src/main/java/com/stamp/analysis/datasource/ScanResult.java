package com.stamp.analysis.datasource;

import com.google.common.collect.ImmutableList;
import com.stamp.cube.ExcludedFile;

import java.util.List;

/** Files found in an archive, ordered by first timestamp, plus those that were recognized but could not be used. */
public class ScanResult {

    public final ImmutableList<ScannedFile> files;

    public final ImmutableList<ExcludedFile> excludedFiles;

    public ScanResult (List<ScannedFile> files, List<ExcludedFile> excludedFiles) {
        this.files = ImmutableList.copyOf(files);
        this.excludedFiles = ImmutableList.copyOf(excludedFiles);
    }

    /** Estimated number of integrations across all files, for progress reporting. */
    public int estimatedIntegrations () {
        return files.stream().mapToInt(f -> f.probe.integrationCount()).sum();
    }

}
