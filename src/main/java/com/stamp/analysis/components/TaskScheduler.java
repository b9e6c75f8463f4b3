package com.stamp.analysis.components;

import com.stamp.util.ExceptionUtils;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.ScheduledFuture;
import java.util.concurrent.TimeUnit;

/**
 * Application-wide queues of one-off and repeating background work. Jobs run on their own executor, which is either
 * bounded by configuration or creates a thread per job; periodic housekeeping such as purging and stall detection runs
 * on a single scheduled thread.
 *
 * Everything submitted here is wrapped so that every Throwable is caught and logged and cannot kill a thread or
 * silently halt a periodic task.
 */
public class TaskScheduler implements Component {

    private static final Logger LOG = LoggerFactory.getLogger(TaskScheduler.class);

    // ExecutorService implementations use locks to make task submission threadsafe, so we don't need to synchronize
    // submission from several threads.
    private final ScheduledExecutorService scheduledExecutor;
    private final ExecutorService jobExecutor;

    // Keep the futures returned when periodic tasks are scheduled, giving access to status information and exceptions.
    private final List<ScheduledFuture<?>> periodicTaskFutures = new ArrayList<>();

    public interface Config {
        /** Maximum number of jobs processed at once, or zero for one thread per submitted job. */
        int jobThreads ();
    }

    /**
     * Interface for all actions that we want to repeat at regular intervals.
     * This is a single-method interface (beyond Runnable) to allow lambdas and method references.
     */
    public interface PeriodicTask extends Runnable {
        int getPeriodSeconds ();
    }

    public TaskScheduler (Config config) {
        scheduledExecutor = Executors.newScheduledThreadPool(1);
        if (config.jobThreads() > 0) {
            jobExecutor = Executors.newFixedThreadPool(config.jobThreads());
        } else {
            jobExecutor = Executors.newCachedThreadPool();
        }
    }

    public synchronized void repeatRegularly (PeriodicTask periodicTask) {
        String className = periodicTask.getClass().getSimpleName();
        int periodSeconds = periodicTask.getPeriodSeconds();
        LOG.info("An instance of {} will run every {} seconds.", className, periodSeconds);
        ErrorTrap wrappedPeriodicTask = new ErrorTrap(periodicTask);
        periodicTaskFutures.add(
            scheduledExecutor.scheduleAtFixedRate(wrappedPeriodicTask, periodSeconds, periodSeconds, TimeUnit.SECONDS)
        );
    }

    public void enqueueJob (Runnable runnable) {
        jobExecutor.submit(new ErrorTrap(runnable));
    }

    /**
     * Stop all threads. Running jobs are interrupted. ProgressListener.checkCancelled treats the interrupt as a
     * cancellation, so each job ends CANCELLED at its next check.
     */
    public synchronized void shutdown () {
        for (ScheduledFuture<?> future : periodicTaskFutures) {
            future.cancel(false);
        }
        scheduledExecutor.shutdownNow();
        jobExecutor.shutdownNow();
    }

    /**
     * Wrap a runnable, catching any Errors or Exceptions that occur. This prevents them from propagating up to the
     * executor, which would swallow them and silently halt the periodic execution of the runnable.
     */
    private static class ErrorTrap implements Runnable {

        private final Runnable runnable;

        public ErrorTrap (Runnable runnable) {
            this.runnable = runnable;
        }

        @Override
        public final void run () {
            try {
                runnable.run();
            } catch (Throwable t) {
                LOG.error("Background execution of {} caused exception:\n{}",
                    runnable.getClass(), ExceptionUtils.stackTraceString(t));
            }
        }
    }

}
