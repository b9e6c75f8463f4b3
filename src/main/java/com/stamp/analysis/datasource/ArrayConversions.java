package com.stamp.analysis.datasource;

import gnu.trove.list.array.TDoubleArrayList;

import java.lang.reflect.Array;

/**
 * Container libraries hand back numeric data as untyped objects whose concrete type depends on how the file was
 * written: float or double, scalar or array, one or two dimensions. These methods turn any of them into doubles.
 */
public abstract class ArrayConversions {

    /**
     * Flatten any numeric value or (possibly nested) primitive or boxed array into a 1-D double array, in row-major
     * order.
     * @throws IllegalArgumentException if a non-numeric element is encountered.
     */
    public static double[] toDoubleArray (Object data) {
        if (data instanceof double[]) return ((double[]) data).clone();
        TDoubleArrayList values = new TDoubleArrayList();
        flatten(data, values);
        return values.toArray();
    }

    /**
     * Interpret data as a matrix. A 1-D array becomes a single row; deeper arrays are flattened within each row.
     */
    public static double[][] toDoubleMatrix (Object data) {
        if (data == null || !data.getClass().isArray()) {
            return new double[][] {toDoubleArray(data)};
        }
        Class<?> component = data.getClass().getComponentType();
        if (!component.isArray()) {
            return new double[][] {toDoubleArray(data)};
        }
        int n = Array.getLength(data);
        double[][] rows = new double[n][];
        for (int i = 0; i < n; i++) {
            rows[i] = toDoubleArray(Array.get(data, i));
        }
        return rows;
    }

    /** @return the number of dimensions of an array object, 0 for a scalar. */
    public static int rank (Object data) {
        int rank = 0;
        Class<?> type = data == null ? null : data.getClass();
        while (type != null && type.isArray()) {
            rank += 1;
            type = type.getComponentType();
        }
        return rank;
    }

    private static void flatten (Object data, TDoubleArrayList into) {
        if (data == null) {
            throw new IllegalArgumentException("Expected numeric data but found nothing.");
        }
        if (data instanceof Number) {
            into.add(((Number) data).doubleValue());
        } else if (data.getClass().isArray()) {
            int n = Array.getLength(data);
            for (int i = 0; i < n; i++) {
                Object element = Array.get(data, i);
                if (element instanceof Number) {
                    into.add(((Number) element).doubleValue());
                } else {
                    flatten(element, into);
                }
            }
        } else {
            throw new IllegalArgumentException("Expected numeric data but found " + data.getClass().getSimpleName());
        }
    }

}
