package com.stamp.cube;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.List;

import static com.google.common.base.Preconditions.checkArgument;

/**
 * Partitions a time axis into visits: maximal runs of columns in which consecutive timestamps are no further apart than
 * a gap threshold. The visits cover every index of the axis exactly once, in order.
 */
public class VisitSegmenter {

    private static final Logger LOG = LoggerFactory.getLogger(VisitSegmenter.class);

    public static final double DEFAULT_GAP_THRESHOLD_HOURS = 0.5;

    public final double gapThresholdHours;

    public VisitSegmenter (double gapThresholdHours) {
        checkArgument(Double.isFinite(gapThresholdHours) && gapThresholdHours > 0,
            "Gap threshold must be a positive number of hours, was %s.", gapThresholdHours);
        this.gapThresholdHours = gapThresholdHours;
    }

    public VisitSegmenter () {
        this(DEFAULT_GAP_THRESHOLD_HOURS);
    }

    /**
     * @param timeAxis non-decreasing times in hours
     * @return the visits in time order, or an empty list for an empty axis
     */
    public List<Visit> segment (double[] timeAxis) {
        List<Visit> visits = new ArrayList<>();
        if (timeAxis.length == 0) return visits;
        int start = 0;
        for (int i = 1; i < timeAxis.length; i++) {
            if (timeAxis[i] - timeAxis[i - 1] > gapThresholdHours) {
                visits.add(new Visit(start, i - 1));
                start = i;
            }
        }
        visits.add(new Visit(start, timeAxis.length - 1));
        LOG.info("Identified {} visits separated by gaps over {} hours.", visits.size(), gapThresholdHours);
        return visits;
    }

    /**
     * Map visits found on a full time axis onto a selection of its columns. A visit keeps whichever of its columns
     * were selected and disappears if none were.
     * @param keptColumns increasing indices into the axis the visits were found on
     * @return the visits indexing into the selection
     */
    public static List<Visit> project (List<Visit> visits, int[] keptColumns) {
        List<Visit> projected = new ArrayList<>();
        int i = 0;
        for (Visit visit : visits) {
            while (i < keptColumns.length && keptColumns[i] < visit.startIndex()) i++;
            int start = i;
            while (i < keptColumns.length && visit.contains(keptColumns[i])) i++;
            if (i > start) projected.add(new Visit(start, i - 1));
        }
        return projected;
    }

}
