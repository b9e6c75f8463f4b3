package com.stamp.cube;

/**
 * A file from the archive that contributed nothing to the cube, with the reason it was left out. These are reported
 * in the result metadata so the user can see which inputs were ignored.
 */
public record ExcludedFile (String fileName, CubeAssemblyException.Kind kind, String reason) {

    public static ExcludedFile forException (String fileName, CubeAssemblyException exception) {
        return new ExcludedFile(fileName, exception.kind, exception.getMessage());
    }

}
