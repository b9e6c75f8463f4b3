package com.stamp.cube;

import com.stamp.util.ExceptionUtils;

/**
 * The single exception type thrown while assembling a cube. The kind tells callers whether the problem is local to
 * one file (which is then excluded and reported) or fatal for the whole archive. The message is shown to the person
 * who submitted the job, so it should always name the offending file or condition.
 */
public class CubeAssemblyException extends RuntimeException {

    public enum Kind {
        /** The archive contains nothing that any format reader recognizes. Fatal. */
        NO_SUPPORTED_FILES(false),
        /** A recognized file lacks required sections or columns. That file is skipped. */
        UNSUPPORTED_STRUCTURE(true),
        /** A recognized file could not be parsed. That file is skipped. */
        CORRUPT_FILE(true),
        /** Every file was skipped or yielded no usable data. Fatal. */
        EMPTY_RESULT(false),
        /** A file's wavelengths do not overlap the reference grid at all. That file's contribution is skipped. */
        INTERPOLATION_DOMAIN_EMPTY(true),
        /** Job options could not be interpreted. Raised at submission time. */
        BAD_REQUEST(false),
        /** The job stopped reporting progress and was presumed stalled. */
        TIMEOUT(false),
        /** Cancellation was requested by the caller. */
        CANCELLED(false),
        /** A defect in this code, for example a matrix shape mismatch between stages. */
        INTERNAL(false);

        /** Whether this kind of failure only excludes the current file rather than failing the job. */
        public final boolean perFile;

        Kind (boolean perFile) {
            this.perFile = perFile;
        }
    }

    public final Kind kind;

    public CubeAssemblyException (Kind kind, String message) {
        super(message);
        this.kind = kind;
    }

    public CubeAssemblyException (Kind kind, String message, Throwable cause) {
        super(message, cause);
        this.kind = kind;
    }

    public static CubeAssemblyException noSupportedFiles (String message) {
        return new CubeAssemblyException(Kind.NO_SUPPORTED_FILES, message);
    }

    /** The upload itself could not be read, so there is nothing to look for files in. */
    public static CubeAssemblyException unreadableArchive (String archiveName, Throwable cause) {
        return new CubeAssemblyException(
            Kind.NO_SUPPORTED_FILES,
            archiveName + " could not be read (" + ExceptionUtils.shortCauseString(cause) + "). Please upload it again.",
            cause
        );
    }

    public static CubeAssemblyException unsupportedStructure (String fileName, String detail) {
        return new CubeAssemblyException(Kind.UNSUPPORTED_STRUCTURE, fileName + ": " + detail);
    }

    public static CubeAssemblyException corruptFile (String fileName, Throwable cause) {
        return new CubeAssemblyException(
            Kind.CORRUPT_FILE,
            fileName + " could not be parsed (" + ExceptionUtils.shortCauseString(cause) + ")",
            cause
        );
    }

    public static CubeAssemblyException emptyResult (String message) {
        return new CubeAssemblyException(Kind.EMPTY_RESULT, message);
    }

    public static CubeAssemblyException interpolationDomainEmpty (String fileName, String detail) {
        return new CubeAssemblyException(Kind.INTERPOLATION_DOMAIN_EMPTY, fileName + ": " + detail);
    }

    public static CubeAssemblyException badRequest (String message) {
        return new CubeAssemblyException(Kind.BAD_REQUEST, message);
    }

    public static CubeAssemblyException timeout (String message) {
        return new CubeAssemblyException(Kind.TIMEOUT, message);
    }

    public static CubeAssemblyException cancelled () {
        return new CubeAssemblyException(Kind.CANCELLED, "Processing was cancelled.");
    }

    /** Wrap anything unexpected. The message is the short cause chain, never a stack trace. */
    public static CubeAssemblyException internal (Throwable cause) {
        return new CubeAssemblyException(
            Kind.INTERNAL, "Internal error: " + ExceptionUtils.shortCauseString(cause), cause
        );
    }

    /**
     * Return the throwable itself if it is already classified. An interrupt means the job was stopped from outside,
     * so it counts as cancellation. Anything else is an internal defect.
     */
    public static CubeAssemblyException classify (Throwable throwable) {
        if (throwable instanceof CubeAssemblyException) {
            return (CubeAssemblyException) throwable;
        }
        if (throwable instanceof InterruptedException) {
            return cancelled();
        }
        return internal(throwable);
    }

}
