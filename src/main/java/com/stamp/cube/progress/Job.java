package com.stamp.cube.progress;

import com.stamp.cube.CubeAssemblyException;
import com.stamp.cube.CubeResult;
import com.stamp.util.ExceptionUtils;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import javax.annotation.Nullable;

import java.time.Duration;
import java.time.Instant;
import java.util.UUID;

import static com.google.common.base.Preconditions.checkState;

/**
 * A background job assembling one cube, and at the same time the record of that job's state which clients poll.
 *
 * State moves QUEUED -> RUNNING -> DONE or ERROR and never backward. Only the worker thread that runs the job
 * reports progress on it; polling threads and the stall watchdog read it or mark it failed. All state changes and
 * snapshots are synchronized on the job itself, which is a lock per record rather than one shared by all jobs.
 *
 * The overall percentage is derived from the work done within the current stage, weighted by that stage's fixed
 * share of the total. It never decreases and stays below 100 until the result is stored.
 */
public class Job implements Runnable, ProgressListener {

    private static final Logger LOG = LoggerFactory.getLogger(Job.class);

    /** Percentage shown as long as the job has not actually finished. */
    private static final double MAX_UNFINISHED_PERCENT = 99;

    public enum Status {
        QUEUED, RUNNING, DONE, ERROR
    }

    /** Every job has an ID so clients can poll for it and fetch its result. */
    public final String id = UUID.randomUUID().toString();

    /** An unchanging, human readable name for this job. */
    public final String title;

    /** Encapsulates the actual work that this job will perform. */
    private final JobAction action;

    private final ThroughputMeter throughputMeter;

    private Status status;

    private Stage stage;

    /** Text describing the current work, which changes over the course of processing. */
    private String description;

    private int totalWorkUnits;

    private int currentWorkUnit;

    private double percent;

    private Instant enqueued;

    private Instant began;

    private Instant completed;

    private Instant lastProgress;

    private volatile boolean cancelRequested;

    private CubeResult result;

    private CubeAssemblyException failure;

    public Job (String title, JobAction action, ThroughputMeter throughputMeter) {
        this.title = title;
        this.action = action;
        this.throughputMeter = throughputMeter;
        markEnqueued();
    }

    public Job (String title, JobAction action) {
        this(title, action, new ThroughputMeter());
    }

    private synchronized void markEnqueued () {
        enqueued = Instant.now();
        lastProgress = enqueued;
        description = "Queued...";
        stage = Stage.QUEUED;
        status = Status.QUEUED;
    }

    /** @return false if the job was already started or was cancelled before it could start. */
    private synchronized boolean markActive () {
        if (status != Status.QUEUED) return false;
        began = Instant.now();
        lastProgress = began;
        status = Status.RUNNING;
        return true;
    }

    private synchronized void markComplete (CubeResult result) {
        if (status != Status.RUNNING) {
            // The watchdog already declared this job failed. Its verdict stands and the late result is dropped.
            LOG.warn("Job {} finished after being marked {}; discarding its result.", id, status);
            return;
        }
        this.result = result;
        completed = Instant.now();
        lastProgress = completed;
        currentWorkUnit = totalWorkUnits;
        stage = Stage.DONE;
        percent = 100;
        description = "Done";
        status = Status.DONE;
    }

    private synchronized void markError (Throwable throwable) {
        CubeAssemblyException classified = CubeAssemblyException.classify(throwable);
        if (status == Status.ERROR) {
            // Already failed (stalled or cancelled while queued). Keep the first classification.
            return;
        }
        if (classified.kind == CubeAssemblyException.Kind.CANCELLED) {
            LOG.info("Job {} ({}) was cancelled during stage {}.", id, title, stage.label());
        } else if (classified.kind == CubeAssemblyException.Kind.INTERNAL) {
            LOG.error("Job {} ({}) failed with an internal error:\n{}", id, title, ExceptionUtils.stackTraceString(throwable));
        } else {
            LOG.error("Job {} ({}) failed: {}", id, title, classified.getMessage());
        }
        failure = classified;
        completed = Instant.now();
        description = classified.getMessage();
        status = Status.ERROR;
    }

    /**
     * Called by the stall watchdog. A running job that has not reported progress for too long is failed with a
     * timeout and asked to stop at its next cancellation check.
     * @return true if the job was running and is now marked as timed out.
     */
    public synchronized boolean markStalled (Duration silence) {
        if (status != Status.RUNNING) return false;
        cancelRequested = true;
        failure = CubeAssemblyException.timeout(String.format(
            "No progress for %d seconds during stage %s (%s). The job was stopped.",
            silence.getSeconds(), stage.label(), description));
        LOG.warn("Job {} ({}) presumed stalled: {}", id, title, failure.getMessage());
        completed = Instant.now();
        description = failure.getMessage();
        status = Status.ERROR;
        return true;
    }

    /**
     * Request cooperative cancellation. A queued job fails immediately; a running job fails at its next boundary.
     * @return false if the job had already finished.
     */
    public synchronized boolean cancel () {
        if (isFinished()) return false;
        cancelRequested = true;
        if (status == Status.QUEUED) {
            markError(CubeAssemblyException.cancelled());
        }
        return true;
    }

    @Override
    public void run () {
        if (!markActive()) {
            LOG.info("Job {} was not started because it is {}.", id, getStatus());
            return;
        }
        try {
            CubeResult cubeResult = action.action(this);
            checkState(cubeResult != null, "Job action completed without producing a result.");
            markComplete(cubeResult);
        } catch (Throwable t) {
            markError(t);
        }
    }

    // PROGRESS LISTENER IMPLEMENTATION

    @Override
    public synchronized void beginStage (Stage newStage, String description, int totalElements) {
        checkState(newStage.ordinal() >= stage.ordinal(),
            "Stage may not move backward from %s to %s.", stage, newStage);
        this.stage = newStage;
        beginTask(description, totalElements);
    }

    @Override
    public synchronized void beginTask (String description, int totalElements) {
        // Within a stage this can be called repeatedly. The percentage does not reset because it never decreases.
        this.description = description;
        this.totalWorkUnits = Math.max(0, totalElements);
        this.currentWorkUnit = 0;
        throughputMeter.restart();
        lastProgress = Instant.now();
        updatePercent();
    }

    @Override
    public synchronized void increment (int n) {
        currentWorkUnit = Math.min(totalWorkUnits, currentWorkUnit + n);
        throughputMeter.mark(n);
        lastProgress = Instant.now();
        updatePercent();
    }

    @Override
    public synchronized void setMessage (String message) {
        this.description = message;
        lastProgress = Instant.now();
    }

    @Override
    public boolean isCancelled () {
        return cancelRequested;
    }

    private void updatePercent () {
        if (status == Status.DONE) return;
        double fraction = totalWorkUnits > 0 ? currentWorkUnit / (double) totalWorkUnits : 0;
        double computed = Math.min(MAX_UNFINISHED_PERCENT, stage.percentAt(fraction));
        percent = Math.max(percent, computed);
    }

    // ACCESSORS

    public synchronized Status getStatus () {
        return status;
    }

    public synchronized Stage getStage () {
        return stage;
    }

    public synchronized boolean isFinished () {
        return status == Status.DONE || status == Status.ERROR;
    }

    /** @return the result, or null unless the job is DONE. */
    public synchronized @Nullable CubeResult getResult () {
        return result;
    }

    /** @return the classified failure, or null unless the job is in ERROR. */
    public synchronized @Nullable CubeAssemblyException getFailure () {
        return failure;
    }

    public synchronized Duration durationInQueue () {
        Instant endTime = (began == null) ? Instant.now() : began;
        return Duration.between(enqueued, endTime);
    }

    public synchronized Duration durationExecuting () {
        if (began == null) return Duration.ZERO;
        Instant endTime = (completed == null) ? Instant.now() : completed;
        return Duration.between(began, endTime);
    }

    public synchronized Duration durationComplete () {
        if (completed == null) return Duration.ZERO;
        return Duration.between(completed, Instant.now());
    }

    public synchronized Duration durationSinceProgress () {
        return Duration.between(lastProgress, Instant.now());
    }

    /** Convert this job to its representation for JSON serialization and return to a polling client. */
    public synchronized JobRecord toRecord () {
        JobRecord record = new JobRecord();
        record.id = id;
        record.title = title;
        record.status = status;
        record.stage = stage.label();
        record.percent = percent;
        record.processedCount = currentWorkUnit;
        record.totalCount = totalWorkUnits;
        if (status == Status.RUNNING) {
            record.throughput = throughputMeter.unitsPerSecond();
            record.etaSeconds = throughputMeter.etaSeconds(totalWorkUnits - currentWorkUnit);
        }
        record.message = description;
        record.errorKind = failure == null ? null : failure.kind;
        record.secondsInQueue = (int) durationInQueue().getSeconds();
        record.secondsActive = (int) durationExecuting().getSeconds();
        record.secondsSinceProgress = (int) durationSinceProgress().getSeconds();
        return record;
    }

}
