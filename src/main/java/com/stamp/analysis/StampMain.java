package com.stamp.analysis;

import com.stamp.analysis.components.StampComponents;
import com.stamp.cube.CubeAssemblyException;
import com.stamp.cube.progress.Job;
import com.stamp.cube.progress.JobRecord;
import com.stamp.util.ExceptionUtils;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.File;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.util.HashMap;
import java.util.Map;
import java.util.Optional;

/**
 * Command line entry point: assemble one archive into a JSON result file.
 *
 * Usage: StampMain archive.zip output.json [key=value ...]
 * where the optional key=value pairs are the same fields accepted from an upload form, e.g. use_interpolation=true.
 */
public abstract class StampMain {

    private static final Logger LOG = LoggerFactory.getLogger(StampMain.class);

    private static final long POLL_INTERVAL_MILLIS = 1000;

    public static void main (String... args) {
        if (args.length < 2) {
            System.err.println("Usage: StampMain <archive.zip> <output.json> [key=value ...]");
            System.exit(2);
        }
        StampComponents components = null;
        int exitStatus;
        try {
            components = new StampComponents(StampConfig.fromDefaultFile());
            exitStatus = run(components, new File(args[0]), new File(args[1]), parseOptions(args));
        } catch (Throwable throwable) {
            LOG.error("Cube assembly failed.\n{}", ExceptionUtils.stackTraceString(throwable));
            exitStatus = 1;
        } finally {
            // The scheduler's non-daemon threads would otherwise keep the JVM alive.
            if (components != null) components.shutdown();
        }
        System.exit(exitStatus);
    }

    static Map<String, String> parseOptions (String[] args) {
        Map<String, String> fields = new HashMap<>();
        for (int i = 2; i < args.length; i++) {
            int eq = args[i].indexOf('=');
            if (eq <= 0) {
                throw CubeAssemblyException.badRequest("Options must be given as key=value, was: " + args[i]);
            }
            fields.put(args[i].substring(0, eq).trim(), args[i].substring(eq + 1));
        }
        return fields;
    }

    /** @return the process exit status. */
    static int run (StampComponents components, File archive, File output, Map<String, String> fields)
            throws Exception {
        JobOptions options = JobOptions.fromFormFields(fields);
        String jobId = components.jobRunner.submit(archive, options);
        while (true) {
            Thread.sleep(POLL_INTERVAL_MILLIS);
            Optional<JobRecord> polled = components.jobRunner.poll(jobId);
            if (polled.isEmpty()) {
                LOG.error("Job {} disappeared before completion.", jobId);
                return 1;
            }
            JobRecord record = polled.get();
            LOG.info("[{}] {} {}% ({}/{}) {}", record.status, record.stage, Math.round(record.percent),
                record.processedCount, record.totalCount, record.message);
            if (record.status == Job.Status.DONE) break;
            if (record.status == Job.Status.ERROR) {
                LOG.error("Job failed ({}): {}", record.errorKind, record.message);
                return 1;
            }
        }
        Optional<String> json = components.jobRunner.fetchJson(jobId);
        if (json.isEmpty()) {
            LOG.error("Job {} finished without a result.", jobId);
            return 1;
        }
        Files.writeString(output.toPath(), json.get(), StandardCharsets.UTF_8);
        LOG.info("Wrote result to {}", output.getAbsolutePath());
        return 0;
    }

}
