package com.stamp.cube.progress;

import com.stamp.cube.CubeAssemblyException;

/**
 * This interface provides simple callbacks to allow long running, asynchronous operations to report on their progress.
 * Take care that all method implementations are very fast as the increment methods might be called in tight loops.
 */
public interface ProgressListener {

    /**
     * Call this method once at the beginning of a new unit of work, specifying how many sub-units of work will be
     * performed. This can be called repeatedly on the same listener to start named sub-tasks within a stage.
     */
    void beginTask (String description, int totalElements);

    /** Call this method to report that N units of work have been performed. */
    void increment (int n);

    /** Call this method to report that one unit of work has been performed. */
    default void increment () {
        increment(1);
    }

    /**
     * Move to a new stage of a staged pipeline. Listeners that do not track stages treat this as an ordinary
     * beginTask call.
     */
    default void beginStage (Stage stage, String description, int totalElements) {
        beginTask(description, totalElements);
    }

    /** Report a change of status message without counting any work. */
    default void setMessage (String message) { /* Default is no-op */ }

    /** @return true if the consumer of this progress no longer wants the work to continue. */
    default boolean isCancelled () {
        return false;
    }

    /**
     * Long running work should call this at every boundary where it can stop cleanly: between stages, files and
     * integrations. It throws rather than returning a flag so that no caller can forget to unwind. An interrupted
     * thread counts as cancelled; the interrupt flag is left set.
     */
    default void checkCancelled () {
        if (isCancelled() || Thread.currentThread().isInterrupted()) {
            throw CubeAssemblyException.cancelled();
        }
    }

}
