package com.stamp.cube;

import com.stamp.cube.GridReconciler.ReferenceGridPolicy;
import org.junit.jupiter.api.Test;

import java.util.List;

import static com.stamp.cube.CubeFixtures.flat;
import static org.junit.jupiter.api.Assertions.assertArrayEquals;
import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertNull;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

class GridReconcilerTest {

    private static final double[] GRID_A = {1, 2, 3};
    private static final double[] GRID_B = {1.5, 2.5};

    private static double[] choose (ReferenceGridPolicy policy, List<Integration> integrations) {
        return new GridReconciler(policy, 5).chooseReferenceGrid(integrations, null);
    }

    @Test
    void mostCommonGridWins () {
        List<Integration> integrations = List.of(flat(GRID_B, 1, 0), flat(GRID_A, 1, 1), flat(GRID_A, 1, 2));
        assertArrayEquals(GRID_A, choose(ReferenceGridPolicy.MOST_INTEGRATIONS, integrations));
    }

    @Test
    void tiesGoToTheGridSeenFirst () {
        List<Integration> integrations = List.of(flat(GRID_B, 1, 0), flat(GRID_A, 1, 1));
        assertArrayEquals(GRID_B, choose(ReferenceGridPolicy.MOST_INTEGRATIONS, integrations));
    }

    @Test
    void firstIntegrationPolicy () {
        List<Integration> integrations = List.of(flat(GRID_B, 1, 0), flat(GRID_A, 1, 1), flat(GRID_A, 1, 2));
        assertArrayEquals(GRID_B, choose(ReferenceGridPolicy.FIRST_INTEGRATION, integrations));
    }

    @Test
    void commonOverlapPolicySpansTheSharedRange () {
        List<Integration> integrations = List.of(
            flat(new double[] {1, 2, 3, 4, 5}, 1, 0),
            flat(new double[] {2, 3, 4, 5, 6}, 1, 1));
        assertArrayEquals(new double[] {2, 2.75, 3.5, 4.25, 5},
            choose(ReferenceGridPolicy.COMMON_OVERLAP, integrations), 1e-12);
    }

    @Test
    void suppliedGridOverridesPolicyAndIsSanitized () {
        GridReconciler reconciler = new GridReconciler(ReferenceGridPolicy.MOST_INTEGRATIONS, 5);
        double[] grid = reconciler.chooseReferenceGrid(
            List.of(flat(GRID_A, 1, 0)), new double[] {3, Double.NaN, 1, 2, 2});
        assertArrayEquals(new double[] {1, 2, 3}, grid);
    }

    @Test
    void gridWithoutFiniteValuesIsAnEmptyResult () {
        GridReconciler reconciler = new GridReconciler(ReferenceGridPolicy.MOST_INTEGRATIONS, 5);
        CubeAssemblyException e = assertThrows(CubeAssemblyException.class,
            () -> reconciler.chooseReferenceGrid(List.of(), new double[] {Double.NaN}));
        assertEquals(CubeAssemblyException.Kind.EMPTY_RESULT, e.kind);
        e = assertThrows(CubeAssemblyException.class, () -> reconciler.chooseReferenceGrid(List.of(), null));
        assertEquals(CubeAssemblyException.Kind.EMPTY_RESULT, e.kind);
    }

    @Test
    void regridInterpolatesWithoutExtrapolating () {
        GridReconciler reconciler = new GridReconciler(ReferenceGridPolicy.MOST_INTEGRATIONS, 5);
        Integration integration = new Integration(
            new double[] {2, 3, 4}, new double[] {20, 30, 40}, new double[] {2, 3, 4}, 1.5);
        RegriddedIntegration regridded = reconciler.regrid(integration, new double[] {1, 2, 2.5, 4, 5}, "a.fits");
        assertEquals(1.5, regridded.time);
        assertTrue(Double.isNaN(regridded.flux[0]));
        assertEquals(20, regridded.flux[1]);
        assertEquals(25, regridded.flux[2], 1e-12);
        assertEquals(40, regridded.flux[3]);
        assertTrue(Double.isNaN(regridded.flux[4]));
        assertEquals(2.5, regridded.error[2], 1e-12);
    }

    @Test
    void regridKeepsMissingErrorMissing () {
        GridReconciler reconciler = new GridReconciler(ReferenceGridPolicy.MOST_INTEGRATIONS, 5);
        assertNull(reconciler.regrid(flat(GRID_A, 1, 0), GRID_A, "a.fits").error);
    }

    @Test
    void integrationOutsideTheGridHasAnEmptyDomain () {
        GridReconciler reconciler = new GridReconciler(ReferenceGridPolicy.MOST_INTEGRATIONS, 5);
        CubeAssemblyException disjoint = assertThrows(CubeAssemblyException.class,
            () -> reconciler.regrid(flat(new double[] {10, 11}, 1, 0), GRID_A, "far.fits"));
        assertEquals(CubeAssemblyException.Kind.INTERPOLATION_DOMAIN_EMPTY, disjoint.kind);
        assertTrue(disjoint.getMessage().startsWith("far.fits"));
        // Inside the grid's range but between two of its points.
        CubeAssemblyException between = assertThrows(CubeAssemblyException.class,
            () -> reconciler.regrid(flat(new double[] {2.1, 2.2}, 1, 0), GRID_A, "narrow.fits"));
        assertEquals(CubeAssemblyException.Kind.INTERPOLATION_DOMAIN_EMPTY, between.kind);
    }

}
