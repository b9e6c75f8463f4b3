package com.stamp.analysis.components;

import com.stamp.analysis.CubeAssemblyAction;
import com.stamp.analysis.StampConfig;
import com.stamp.analysis.datasource.FormatReader;
import com.stamp.cube.SourceFormat;

import java.util.Map;

/**
 * We are adopting a lightweight dependency injection approach, where we manually wire up our components instead of
 * relying on a framework. This establishes the implementations and dependencies between them, and supplies
 * configuration. No conditional logic beyond enabling optional components should be present here.
 *
 * Outside code should only need the JobRunner after construction.
 */
public class StampComponents {

    public final StampConfig config;
    public final TaskScheduler taskScheduler;
    public final JobStore jobStore;
    public final ResultCache resultCache;
    public final JobRunner jobRunner;
    /** Null when stall detection is disabled by configuration. */
    public final StallWatchdog stallWatchdog;

    public StampComponents (StampConfig config) {
        this(config, FormatReader.standardReaders(config.minValidPoints()));
    }

    /** Wire up components using the given format readers, which allows plugging in alternate readers. */
    public StampComponents (StampConfig config, Map<SourceFormat, FormatReader> readers) {
        this.config = config;
        taskScheduler = new TaskScheduler(config);
        jobStore = new JobStore();
        resultCache = new ResultCache(config);
        jobRunner = new JobRunner(config, taskScheduler, jobStore,
            (archive, options) -> new CubeAssemblyAction(config, readers, resultCache, archive, options));
        if (config.stallTimeoutSeconds() > 0) {
            stallWatchdog = new StallWatchdog(config, jobStore);
            taskScheduler.repeatRegularly(stallWatchdog);
        } else {
            stallWatchdog = null;
        }
    }

    public void shutdown () {
        taskScheduler.shutdown();
    }

}
