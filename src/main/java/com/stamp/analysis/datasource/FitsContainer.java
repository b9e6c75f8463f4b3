package com.stamp.analysis.datasource;

import java.io.Closeable;
import java.util.ArrayList;
import java.util.List;

/**
 * An open FITS file: a primary header followed by table extensions. Implemented over nom-tam-fits for real files,
 * and by simple in-memory objects in tests.
 */
public interface FitsContainer extends Closeable {

    /** @return a primary header value as a string, or null when absent. */
    String primaryHeader (String key);

    /** Table extensions in file order. */
    List<FitsTable> tables ();

    /** @return all table extensions with the given EXTNAME (case-insensitive), in file order. */
    default List<FitsTable> findAll (String extName) {
        List<FitsTable> found = new ArrayList<>();
        for (FitsTable table : tables()) {
            if (extName.equalsIgnoreCase(table.extName())) found.add(table);
        }
        return found;
    }

    /** @return the first table extension with the given EXTNAME, or null. */
    default FitsTable find (String extName) {
        List<FitsTable> found = findAll(extName);
        return found.isEmpty() ? null : found.get(0);
    }

    /** @return the table extension with the given EXTNAME and EXTVER, or null. */
    default FitsTable find (String extName, int extVersion) {
        for (FitsTable table : findAll(extName)) {
            if (table.extVersion() == extVersion) return table;
        }
        return null;
    }

}
