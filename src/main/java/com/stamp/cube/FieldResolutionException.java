package com.stamp.cube;

import java.util.List;

/**
 * Thrown when none of the candidate names for a required logical field is present in a file. This is a structural
 * problem with that one file, so the file is skipped rather than failing the whole archive.
 */
public class FieldResolutionException extends CubeAssemblyException {

    public final String field;

    public final List<String> candidates;

    public FieldResolutionException (String fileName, String field, List<String> candidates) {
        super(Kind.UNSUPPORTED_STRUCTURE,
              String.format("%s: no %s field found (looked for %s)", fileName, field, String.join(", ", candidates)));
        this.field = field;
        this.candidates = List.copyOf(candidates);
    }

}
