package com.stamp.cube;

import com.google.common.collect.ImmutableList;

import java.util.List;

/**
 * The complete output of a job: the emitted cube, the matrix of displayed values for the chosen mode, the light
 * curves of any declared bands and the metadata describing all of it. Only ever constructed fully populated.
 */
public class CubeResult {

    public final TimeSeriesCube cube;

    public final double[][] displayValues;

    public final ImmutableList<BandLightCurve> bandLightCurves;

    public final CubeMetadata metadata;

    public CubeResult (TimeSeriesCube cube, double[][] displayValues, List<BandLightCurve> bandLightCurves,
                       CubeMetadata metadata) {
        this.cube = cube;
        this.displayValues = displayValues;
        this.bandLightCurves = ImmutableList.copyOf(bandLightCurves);
        this.metadata = metadata;
    }

}
