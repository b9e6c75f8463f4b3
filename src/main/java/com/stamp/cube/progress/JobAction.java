package com.stamp.cube.progress;

import com.stamp.cube.CubeResult;

/**
 * This represents the work actually carried out by a Job. It's a single-method interface so it can be defined with
 * lambda functions, or other objects can implement it.
 *
 * The parameter is a simpler interface of Job that only allows progress reporting and cancellation checks, to
 * encapsulate actions and prevent them from seeing or modifying the job record that manages them. The action either
 * returns a complete result or throws; a job never exposes a partially built result.
 */
public interface JobAction {

    CubeResult action (ProgressListener progressListener) throws Exception;

}
