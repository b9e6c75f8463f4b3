package com.stamp.analysis.components;

import com.stamp.cube.progress.Job;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Duration;

/**
 * Periodically looks for running jobs that appear stalled and fails them with a TIMEOUT classification, also
 * requesting their cancellation so the worker thread stops at its next boundary. What counts as stalled is decided
 * by a pluggable policy.
 */
public class StallWatchdog implements Component, TaskScheduler.PeriodicTask {

    private static final Logger LOG = LoggerFactory.getLogger(StallWatchdog.class);

    public interface Config {
        /** Seconds without any progress report after which a running job is presumed stalled. Zero disables. */
        int stallTimeoutSeconds ();
        int watchdogPeriodSeconds ();
    }

    /** Decides whether a running job should be presumed stalled. */
    @FunctionalInterface
    public interface StallPolicy {
        boolean isStalled (Job job);

        /** The standard policy: no progress report at all for longer than the given time. */
        static StallPolicy noProgressFor (Duration timeout) {
            return job -> job.durationSinceProgress().compareTo(timeout) > 0;
        }
    }

    private final JobStore jobStore;

    private final StallPolicy policy;

    private final int periodSeconds;

    public StallWatchdog (JobStore jobStore, StallPolicy policy, int periodSeconds) {
        this.jobStore = jobStore;
        this.policy = policy;
        this.periodSeconds = Math.max(1, periodSeconds);
    }

    public StallWatchdog (Config config, JobStore jobStore) {
        this(jobStore, StallPolicy.noProgressFor(Duration.ofSeconds(config.stallTimeoutSeconds())),
            config.watchdogPeriodSeconds());
    }

    @Override
    public int getPeriodSeconds () {
        return periodSeconds;
    }

    @Override
    public void run () {
        checkNow();
    }

    /** @return the number of jobs newly marked as stalled. */
    public int checkNow () {
        int stalled = 0;
        for (Job job : jobStore.jobs()) {
            if (job.getStatus() == Job.Status.RUNNING && policy.isStalled(job)) {
                if (job.markStalled(job.durationSinceProgress())) stalled += 1;
            }
        }
        if (stalled > 0) {
            LOG.warn("Marked {} jobs as stalled.", stalled);
        }
        return stalled;
    }

}
