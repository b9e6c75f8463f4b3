package com.stamp.analysis.datasource;

import java.io.Closeable;
import java.util.Set;

/**
 * An open hierarchical (HDF5) file, seen through its root group: named datasets plus root attributes. Implemented
 * over jHDF for real files, and in memory in tests.
 */
public interface HierarchicalContainer extends Closeable {

    /** Names of the datasets directly under the root group. */
    Set<String> datasetNames ();

    /** @return the dataset's data as returned by the container library, typically a (nested) primitive array. */
    Object read (String datasetName);

    /** @return the dataset's dimensions. */
    int[] dimensions (String datasetName);

    /** @return a root attribute rendered as a string, or null when absent. */
    String attribute (String name);

}
