package com.stamp.cube;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonProperty;

/**
 * A user-declared wavelength interval, used only to reduce the cube to a light curve for that interval.
 * Bands are not part of the cube itself.
 */
public class Band {

    public final String name;

    public final double start;

    public final double end;

    @JsonCreator
    public Band (@JsonProperty("name") String name,
                 @JsonProperty("start") double start,
                 @JsonProperty("end") double end) {
        this.name = name;
        this.start = start;
        this.end = end;
    }

    public boolean contains (double wavelength) {
        return wavelength >= start && wavelength <= end;
    }

    public boolean isValid () {
        return Double.isFinite(start) && Double.isFinite(end) && start < end;
    }

    @Override
    public String toString () {
        return String.format("%s [%.3f, %.3f]", name, start, end);
    }

}
