package com.stamp.cube;

import static com.google.common.base.Preconditions.checkArgument;

/**
 * A contiguous run of time-axis columns, both ends inclusive, within which consecutive timestamps are no further
 * apart than the gap threshold. Visits are derived from a time axis, never stored independently of it.
 */
public record Visit (int startIndex, int endIndex) {

    public Visit {
        checkArgument(startIndex >= 0 && endIndex >= startIndex, "Invalid visit [%s, %s]", startIndex, endIndex);
    }

    public int size () {
        return endIndex - startIndex + 1;
    }

    public boolean contains (int index) {
        return index >= startIndex && index <= endIndex;
    }

    @Override
    public String toString () {
        return "[" + startIndex + ", " + endIndex + "]";
    }

}
