package com.stamp.analysis.components;

import com.stamp.analysis.JobOptions;
import com.stamp.cube.CubeAssemblyException;
import com.stamp.cube.CubeResult;
import com.stamp.cube.progress.Job;
import com.stamp.cube.progress.JobAction;
import com.stamp.cube.progress.JobRecord;
import com.stamp.util.JsonUtil;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.File;
import java.time.Duration;
import java.util.List;
import java.util.Optional;
import java.util.stream.Collectors;

/**
 * The entry point for everything outside the pipeline: submit an archive, poll the resulting job, fetch its result,
 * or cancel it. Submission returns immediately with a job ID and the work happens on the TaskScheduler's job threads.
 * Each job gets its own action instance, so concurrent jobs share no mutable pipeline state.
 */
public class JobRunner implements Component {

    private static final Logger LOG = LoggerFactory.getLogger(JobRunner.class);

    public interface Config {
        /** Finished jobs whose results are never fetched are evicted this long after finishing. */
        int jobRetentionSeconds ();
    }

    /** Creates the action that will assemble a cube from an archive. */
    @FunctionalInterface
    public interface ActionFactory {
        JobAction create (File archive, JobOptions options);
    }

    private final TaskScheduler taskScheduler;
    private final JobStore jobStore;
    private final ActionFactory actionFactory;
    private final Duration retention;

    public JobRunner (Config config, TaskScheduler taskScheduler, JobStore jobStore, ActionFactory actionFactory) {
        this.taskScheduler = taskScheduler;
        this.jobStore = jobStore;
        this.actionFactory = actionFactory;
        this.retention = Duration.ofSeconds(config.jobRetentionSeconds());
        taskScheduler.repeatRegularly(new RetentionPurge());
    }

    /**
     * Start assembling a cube from the given archive in the background.
     * @return the ID with which to poll for and fetch the result.
     * @throws CubeAssemblyException BAD_REQUEST if the archive cannot be read.
     */
    public String submit (File archive, JobOptions options) {
        if (archive == null || !archive.isFile() || !archive.canRead()) {
            throw CubeAssemblyException.badRequest("The uploaded archive could not be found or read.");
        }
        if (archive.length() == 0) {
            throw CubeAssemblyException.badRequest("The uploaded archive is empty.");
        }
        return submit(archive.getName(), actionFactory.create(archive, options));
    }

    /** Run any action as a job. */
    public String submit (String title, JobAction action) {
        Job job = new Job(title, action);
        jobStore.put(job);
        taskScheduler.enqueueJob(job);
        LOG.info("Submitted job {} ({}).", job.id, title);
        return job.id;
    }

    /** @return a consistent snapshot of the job's state, or empty if no such job is stored. */
    public Optional<JobRecord> poll (String id) {
        return jobStore.get(id).map(Job::toRecord);
    }

    /**
     * Retrieve a finished job's result. The job is evicted once its result has been handed out.
     * @return the result if the job is DONE, or empty if it is unknown or still in progress.
     * @throws CubeAssemblyException the job's classified failure if it ended in ERROR.
     */
    public Optional<CubeResult> fetch (String id) {
        Optional<Job> found = jobStore.get(id);
        if (found.isEmpty()) return Optional.empty();
        Job job = found.get();
        switch (job.getStatus()) {
            case DONE:
                // Only the caller that actually removes the job receives the result.
                if (jobStore.remove(id)) return Optional.of(job.getResult());
                return Optional.empty();
            case ERROR:
                throw job.getFailure();
            default:
                return Optional.empty();
        }
    }

    /** As fetch, but serialized to JSON with missing values written as null. */
    public Optional<String> fetchJson (String id) {
        return fetch(id).map(JsonUtil::toJson);
    }

    /**
     * Request cooperative cancellation. The job ends in ERROR with kind CANCELLED at its next boundary.
     * @return false if the job is unknown or already finished.
     */
    public boolean cancel (String id) {
        boolean cancelled = jobStore.get(id).map(Job::cancel).orElse(false);
        if (cancelled) LOG.info("Cancellation requested for job {}.", id);
        return cancelled;
    }

    /** Evict finished jobs older than the retention period. */
    public int purgeExpired () {
        return jobStore.purgeFinishedOlderThan(retention);
    }

    /** Snapshots of every stored job, for status pages and logging. */
    public List<JobRecord> jobRecords () {
        return jobStore.jobs().stream().map(Job::toRecord).collect(Collectors.toList());
    }

    private class RetentionPurge implements TaskScheduler.PeriodicTask {
        @Override
        public int getPeriodSeconds () {
            return (int) Math.max(1, Math.min(60, retention.getSeconds()));
        }

        @Override
        public void run () {
            purgeExpired();
        }
    }

}
