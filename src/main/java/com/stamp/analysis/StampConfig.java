package com.stamp.analysis;

import com.stamp.analysis.components.JobRunner;
import com.stamp.analysis.components.ResultCache;
import com.stamp.analysis.components.StallWatchdog;
import com.stamp.analysis.components.TaskScheduler;
import com.stamp.cube.GridReconciler.ReferenceGridPolicy;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.File;
import java.util.Properties;

/** Loads configuration for the cube assembly service and exposes it to the Components through their Config interfaces. */
public class StampConfig extends ConfigBase implements
        TaskScheduler.Config,
        JobRunner.Config,
        StallWatchdog.Config,
        ResultCache.Config,
        CubeAssemblyAction.Config
{

    // CONSTANTS AND STATIC FIELDS

    private static final Logger LOG = LoggerFactory.getLogger(StampConfig.class);
    public static final String STAMP_CONFIG_FILE = "stamp.properties";

    // INSTANCE FIELDS

    private final int jobThreads;
    private final int jobRetentionSeconds;
    private final double gapThresholdHours;
    private final int minValidPoints;
    private final ReferenceGridPolicy referenceGridPolicy;
    private final int commonGridPoints;
    private final int stallTimeoutSeconds;
    private final int watchdogPeriodSeconds;
    private final boolean resultCacheEnabled;
    private final int resultCacheTtlMinutes;
    private final int resultCacheMaxEntries;
    private final String workDirectory;

    // CONSTRUCTORS

    protected StampConfig (Properties properties) {
        super(properties);
        // We intentionally don't supply any defaults here.
        // Any 'defaults' should be shipped in an example config file.
        jobThreads = intProp("job-threads");
        jobRetentionSeconds = intProp("job-retention-seconds");
        gapThresholdHours = doubleProp("gap-threshold-hours");
        minValidPoints = intProp("min-valid-points");
        referenceGridPolicy = enumProp("reference-grid-policy", ReferenceGridPolicy.class);
        commonGridPoints = intProp("common-grid-points");
        stallTimeoutSeconds = intProp("stall-timeout-seconds");
        watchdogPeriodSeconds = intProp("watchdog-period-seconds");
        resultCacheEnabled = boolProp("result-cache-enabled");
        resultCacheTtlMinutes = intProp("result-cache-ttl-minutes");
        resultCacheMaxEntries = intProp("result-cache-max-entries");
        // May legitimately be empty, meaning the system temporary directory.
        workDirectory = strProp("work-directory");
        if (!(gapThresholdHours > 0)) {
            LOG.error("gap-threshold-hours must be positive.");
            keysWithErrors.add("gap-threshold-hours");
        }
        if (commonGridPoints < 2) {
            LOG.error("common-grid-points must be at least 2.");
            keysWithErrors.add("common-grid-points");
        }
        throwIfErrors();
    }

    // INTERFACE IMPLEMENTATIONS
    // Methods implementing Component Config interfaces.
    // Note that one method can implement several Config interfaces at once.

    @Override public int     jobThreads()              { return jobThreads; }
    @Override public int     jobRetentionSeconds()     { return jobRetentionSeconds; }
    @Override public double  gapThresholdHours()       { return gapThresholdHours; }
    @Override public int     minValidPoints()          { return minValidPoints; }
    @Override public ReferenceGridPolicy referenceGridPolicy() { return referenceGridPolicy; }
    @Override public int     commonGridPoints()        { return commonGridPoints; }
    @Override public int     stallTimeoutSeconds()     { return stallTimeoutSeconds; }
    @Override public int     watchdogPeriodSeconds()   { return watchdogPeriodSeconds; }
    @Override public boolean resultCacheEnabled()      { return resultCacheEnabled; }
    @Override public int     resultCacheTtlMinutes()   { return resultCacheTtlMinutes; }
    @Override public int     resultCacheMaxEntries()   { return resultCacheMaxEntries; }
    @Override public String  workDirectory()           { return workDirectory; }

    // STATIC FACTORY METHODS
    // Always use these to construct StampConfig objects for readability.

    /** Load stamp.properties from the working directory if present, otherwise the example packaged with the code. */
    public static StampConfig fromDefaultFile () {
        if (new File(STAMP_CONFIG_FILE).isFile()) {
            return fromFile(STAMP_CONFIG_FILE);
        }
        LOG.info("No {} in the working directory, using the packaged example configuration.", STAMP_CONFIG_FILE);
        return fromResource(STAMP_CONFIG_FILE);
    }

    public static StampConfig fromFile (String filename) {
        return new StampConfig(propsFromFile(filename));
    }

    public static StampConfig fromResource (String resourceName) {
        return new StampConfig(propsFromResource(resourceName));
    }

    public static StampConfig fromProperties (Properties properties) {
        return new StampConfig(properties);
    }

}
