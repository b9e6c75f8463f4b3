package com.stamp.analysis.datasource;

import gnu.trove.list.array.TDoubleArrayList;

import java.util.List;

/** One table extension of a FITS file, reduced to what the readers need. */
public interface FitsTable {

    /** @return the EXTNAME header value, or null. */
    String extName ();

    /** @return the EXTVER header value, 1 when absent as the FITS standard prescribes. */
    int extVersion ();

    int nRows ();

    /** Column names (TTYPEn) in column order. */
    List<String> columnNames ();

    /** @return a header value of this extension as a string, or null when absent. */
    String header (String key);

    /** @return the contents of one cell as doubles. A scalar cell gives an array of length one. */
    double[] cell (String column, int row) throws Exception;

    /** @return the whole column in row order, cells concatenated. */
    default double[] column (String column) throws Exception {
        TDoubleArrayList values = new TDoubleArrayList();
        for (int row = 0; row < nRows(); row++) {
            values.add(cell(column, row));
        }
        return values.toArray();
    }

    /** @return the first value of a cell, NaN if the cell is empty. */
    default double scalar (String column, int row) throws Exception {
        double[] values = cell(column, row);
        return values.length == 0 ? Double.NaN : values[0];
    }

}
