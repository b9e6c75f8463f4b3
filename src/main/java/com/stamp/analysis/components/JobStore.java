package com.stamp.analysis.components;

import com.stamp.cube.progress.Job;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Duration;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;

/**
 * The one place job records live, shared by submitting threads, the worker running each job, polling threads and
 * housekeeping. Records are inserted on submission, updated only by the owning job, and evicted after their result is
 * fetched or after a retention period. The map is concurrent and each job guards its own state, so readers never hold
 * a lock shared with other jobs.
 */
public class JobStore implements Component {

    private static final Logger LOG = LoggerFactory.getLogger(JobStore.class);

    private final Map<String, Job> jobs = new ConcurrentHashMap<>();

    public void put (Job job) {
        Job previous = jobs.putIfAbsent(job.id, job);
        if (previous != null) {
            throw new IllegalStateException("A job with ID " + job.id + " is already stored.");
        }
    }

    public Optional<Job> get (String id) {
        if (id == null) return Optional.empty();
        return Optional.ofNullable(jobs.get(id));
    }

    public boolean remove (String id) {
        return jobs.remove(id) != null;
    }

    /** A snapshot of the jobs currently stored, safe to iterate while other threads add and remove jobs. */
    public List<Job> jobs () {
        return new ArrayList<>(jobs.values());
    }

    public int size () {
        return jobs.size();
    }

    /**
     * Evict finished jobs that completed longer ago than the retention period.
     * @return the number of jobs evicted.
     */
    public int purgeFinishedOlderThan (Duration retention) {
        int purged = 0;
        for (Job job : jobs()) {
            if (job.isFinished() && job.durationComplete().compareTo(retention) > 0) {
                if (jobs.remove(job.id, job)) purged += 1;
            }
        }
        if (purged > 0) {
            LOG.info("Purged {} finished jobs older than {} seconds.", purged, retention.getSeconds());
        }
        return purged;
    }

}
