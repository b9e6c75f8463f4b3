package com.stamp.cube.progress;

import com.stamp.cube.CubeAssemblyException;

/**
 * API model for a job as seen by a polling client: an immutable snapshot taken under the job's lock, so all fields are
 * mutually consistent. Times are durations rather than absolute to counter clock drift.
 */
public class JobRecord {
    public String id;
    public String title;
    public Job.Status status;
    public String stage;
    public double percent;
    public int processedCount;
    public int totalCount;
    /** Integrations per second within the current stage, null until measurable. */
    public Double throughput;
    public Integer etaSeconds;
    public String message;
    /** Classification of the failure when status is ERROR, otherwise null. */
    public CubeAssemblyException.Kind errorKind;
    public int secondsInQueue;
    public int secondsActive;
    public int secondsSinceProgress;
}
