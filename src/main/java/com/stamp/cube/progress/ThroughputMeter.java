package com.stamp.cube.progress;

import com.google.common.base.Ticker;
import com.google.common.collect.EvictingQueue;

import java.util.concurrent.TimeUnit;

/**
 * Tracks how fast units of work (integrations) are being processed within a stage. Throughput is the average since
 * the stage began. The ETA is extrapolated from a moving average of the most recent per-unit durations, which reacts
 * to files that are slower or faster to read than the ones before them.
 */
public class ThroughputMeter {

    private final Ticker ticker;

    /** Nanoseconds spent on each of the most recent units of work. */
    private final EvictingQueue<Long> recentUnitNanos;

    private long stageStartNanos;

    private long lastMarkNanos;

    private long unitsDone;

    public ThroughputMeter (Ticker ticker, int windowSize) {
        this.ticker = ticker;
        this.recentUnitNanos = EvictingQueue.create(windowSize);
        restart();
    }

    public ThroughputMeter () {
        this(Ticker.systemTicker(), 50);
    }

    public synchronized void restart () {
        stageStartNanos = ticker.read();
        lastMarkNanos = stageStartNanos;
        unitsDone = 0;
        recentUnitNanos.clear();
    }

    /** Record that n units of work have completed since the previous call. */
    public synchronized void mark (int n) {
        if (n <= 0) return;
        long now = ticker.read();
        long perUnit = (now - lastMarkNanos) / n;
        for (int i = 0; i < n; i++) {
            recentUnitNanos.add(perUnit);
        }
        lastMarkNanos = now;
        unitsDone += n;
    }

    /** @return units per second since the stage began, or null if nothing measurable has happened yet. */
    public synchronized Double unitsPerSecond () {
        long elapsed = ticker.read() - stageStartNanos;
        if (unitsDone == 0 || elapsed <= 0) return null;
        return unitsDone / (elapsed / (double) TimeUnit.SECONDS.toNanos(1));
    }

    /** @return estimated seconds to finish the remaining units, or null if there is no basis for an estimate. */
    public synchronized Integer etaSeconds (long remainingUnits) {
        if (recentUnitNanos.isEmpty() || remainingUnits < 0) return null;
        double sum = 0;
        for (long nanos : recentUnitNanos) {
            sum += nanos;
        }
        double meanNanos = sum / recentUnitNanos.size();
        return (int) Math.round(meanNanos * remainingUnits / TimeUnit.SECONDS.toNanos(1));
    }

}
