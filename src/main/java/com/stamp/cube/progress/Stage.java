package com.stamp.cube.progress;

/**
 * The stages of cube assembly, in the order they run. Each stage owns a fixed share of the overall percentage so that
 * progress within a stage can be mapped onto a single monotonic figure for the whole job.
 */
public enum Stage {

    QUEUED(0, 0),
    SCAN(0, 10),
    READ(10, 60),
    REGRID(60, 88),
    INTERPOLATE(88, 92),
    FINALIZE(92, 100),
    DONE(100, 100);

    public final double startPercent;

    public final double endPercent;

    Stage (double startPercent, double endPercent) {
        this.startPercent = startPercent;
        this.endPercent = endPercent;
    }

    /** Map a fraction of this stage's work (clamped to 0..1) onto the overall percentage. */
    public double percentAt (double fraction) {
        double clamped = Math.max(0, Math.min(1, fraction));
        return startPercent + (endPercent - startPercent) * clamped;
    }

    public String label () {
        return name().toLowerCase();
    }

}
