package com.stamp.cube;

import gnu.trove.list.array.TDoubleArrayList;
import gnu.trove.list.array.TIntArrayList;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.List;

/**
 * Brings integrations with differing wavelength sampling onto one shared wavelength grid. Values are linearly
 * interpolated within each integration's own domain; grid points outside that domain become NaN. We never
 * extrapolate, because that would fabricate flux that was not observed.
 */
public class GridReconciler {

    private static final Logger LOG = LoggerFactory.getLogger(GridReconciler.class);

    /**
     * How the reference grid is chosen when the caller does not supply one. MOST_INTEGRATIONS is a pragmatic rule
     * for archives mixing instrument modes, not a scientific inference, which is why it is a policy and not fixed.
     */
    public enum ReferenceGridPolicy {
        /** Group integrations by identical grid; the grid shared by the most integrations wins, ties to the first. */
        MOST_INTEGRATIONS,
        /** Use the grid of the first integration in time order. */
        FIRST_INTEGRATION,
        /** Evenly spaced points over the wavelength range covered by every integration. */
        COMMON_OVERLAP
    }

    private final ReferenceGridPolicy policy;

    private final int commonGridPoints;

    public GridReconciler (ReferenceGridPolicy policy, int commonGridPoints) {
        this.policy = policy;
        this.commonGridPoints = commonGridPoints;
    }

    public ReferenceGridPolicy policy () {
        return policy;
    }

    /**
     * Pick the wavelength grid every integration will be interpolated onto.
     * @param integrations all integrations in assembly order
     * @param canonicalGrid a caller-supplied grid that overrides the policy, or null
     * @return a finite, strictly increasing grid
     */
    public double[] chooseReferenceGrid (List<Integration> integrations, double[] canonicalGrid) {
        double[] grid;
        if (canonicalGrid != null) {
            LOG.info("Using caller-supplied wavelength grid of {} points.", canonicalGrid.length);
            grid = canonicalGrid;
        } else {
            if (integrations.isEmpty()) {
                throw CubeAssemblyException.emptyResult("No integrations available to define a wavelength grid.");
            }
            switch (policy) {
                case FIRST_INTEGRATION:
                    grid = integrations.get(0).wavelength;
                    break;
                case COMMON_OVERLAP:
                    grid = commonOverlapGrid(integrations);
                    break;
                case MOST_INTEGRATIONS:
                default:
                    grid = mostCommonGrid(integrations);
            }
        }
        double[] sanitized = sanitizeGrid(grid);
        if (sanitized.length == 0) {
            throw CubeAssemblyException.emptyResult("The reference wavelength grid contains no finite values.");
        }
        LOG.info("Reference wavelength grid: {} points from {} to {}.",
            sanitized.length, sanitized[0], sanitized[sanitized.length - 1]);
        return sanitized;
    }

    private static double[] mostCommonGrid (List<Integration> integrations) {
        List<double[]> grids = new ArrayList<>();
        TIntArrayList counts = new TIntArrayList();
        for (Integration integration : integrations) {
            int found = -1;
            for (int g = 0; g < grids.size(); g++) {
                if (Arrays.equals(grids.get(g), integration.wavelength)) {
                    found = g;
                    break;
                }
            }
            if (found < 0) {
                grids.add(integration.wavelength);
                counts.add(1);
            } else {
                counts.set(found, counts.get(found) + 1);
            }
        }
        int best = 0;
        for (int g = 1; g < grids.size(); g++) {
            // Strictly greater, so that ties go to the grid seen first.
            if (counts.get(g) > counts.get(best)) best = g;
        }
        if (grids.size() > 1) {
            LOG.warn("Integrations use {} distinct wavelength grids; using the one shared by {} of {} integrations.",
                grids.size(), counts.get(best), integrations.size());
        }
        return grids.get(best);
    }

    private double[] commonOverlapGrid (List<Integration> integrations) {
        double lo = Double.NEGATIVE_INFINITY;
        double hi = Double.POSITIVE_INFINITY;
        int skipped = 0;
        for (Integration integration : integrations) {
            if (integration.size() == 0) continue;
            double newLo = Math.max(lo, integration.minWavelength());
            double newHi = Math.min(hi, integration.maxWavelength());
            if (newLo > newHi) {
                // This integration would empty the overlap. It will be reported when it fails to regrid.
                skipped += 1;
                continue;
            }
            lo = newLo;
            hi = newHi;
        }
        if (skipped > 0) {
            LOG.warn("{} integrations do not overlap the common wavelength range and were ignored for the grid.", skipped);
        }
        if (!Double.isFinite(lo) || !Double.isFinite(hi)) {
            throw CubeAssemblyException.emptyResult("No integration has any wavelength samples.");
        }
        return LinearInterpolation.linspace(lo, hi, lo == hi ? 1 : commonGridPoints);
    }

    /** Drop non-finite values, sort, and remove duplicates so the grid is strictly increasing. */
    static double[] sanitizeGrid (double[] grid) {
        TDoubleArrayList finite = new TDoubleArrayList(grid.length);
        for (double value : grid) {
            if (Double.isFinite(value)) finite.add(value);
        }
        finite.sort();
        TDoubleArrayList unique = new TDoubleArrayList(finite.size());
        for (int i = 0; i < finite.size(); i++) {
            if (unique.isEmpty() || finite.get(i) > unique.get(unique.size() - 1)) {
                unique.add(finite.get(i));
            }
        }
        return unique.toArray();
    }

    /**
     * Interpolate one integration onto the reference grid.
     * @throws CubeAssemblyException of kind INTERPOLATION_DOMAIN_EMPTY if the integration covers no grid point.
     */
    public RegriddedIntegration regrid (Integration integration, double[] grid, String fileName) {
        if (integration.size() == 0
                || integration.maxWavelength() < grid[0]
                || integration.minWavelength() > grid[grid.length - 1]) {
            throw CubeAssemblyException.interpolationDomainEmpty(fileName, String.format(
                "integration at %.6f has no wavelength overlap with the reference grid", integration.time));
        }
        double[] flux = LinearInterpolation.interpolate(integration.wavelength, integration.flux, grid);
        double[] error = integration.hasError()
            ? LinearInterpolation.interpolate(integration.wavelength, integration.error, grid)
            : null;
        boolean anyFinite = false;
        for (double value : flux) {
            if (Double.isFinite(value)) {
                anyFinite = true;
                break;
            }
        }
        if (!anyFinite) {
            // Domains touch but no grid point falls inside this integration's sampled range.
            throw CubeAssemblyException.interpolationDomainEmpty(fileName, String.format(
                "integration at %.6f covers no point of the reference grid", integration.time));
        }
        return new RegriddedIntegration(integration.time, flux, error);
    }

}
