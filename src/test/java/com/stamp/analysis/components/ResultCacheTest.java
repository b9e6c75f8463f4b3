package com.stamp.analysis.components;

import com.stamp.analysis.AssembledArchive;
import com.stamp.analysis.JobOptions;
import com.stamp.cube.CubeFixtures;
import com.stamp.cube.GridReconciler.ReferenceGridPolicy;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.io.File;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertNotEquals;
import static org.junit.jupiter.api.Assertions.assertSame;
import static org.junit.jupiter.api.Assertions.assertTrue;

class ResultCacheTest {

    private static final ReferenceGridPolicy POLICY = ReferenceGridPolicy.MOST_INTEGRATIONS;

    @TempDir
    Path tempDir;

    private static ResultCache.Config config (boolean enabled) {
        return new ResultCache.Config() {
            @Override public boolean resultCacheEnabled () { return enabled; }
            @Override public int resultCacheTtlMinutes () { return 5; }
            @Override public int resultCacheMaxEntries () { return 2; }
        };
    }

    private File archive (String name, String content) throws Exception {
        File file = tempDir.resolve(name).toFile();
        Files.writeString(file.toPath(), content);
        return file;
    }

    @Test
    void keyDependsOnContentAndAssemblyOptionsOnly () throws Exception {
        File first = archive("first.zip", "same bytes");
        File copy = archive("copy.zip", "same bytes");
        File other = archive("other.zip", "other bytes");
        JobOptions options = new JobOptions();
        String key = ResultCache.cacheKey(first, options, 0.5, POLICY);

        assertEquals(key, ResultCache.cacheKey(copy, options, 0.5, POLICY));
        assertNotEquals(key, ResultCache.cacheKey(other, options, 0.5, POLICY));
        assertNotEquals(key, ResultCache.cacheKey(first, options, 0.75, POLICY));
        assertNotEquals(key, ResultCache.cacheKey(first, options, 0.5, ReferenceGridPolicy.COMMON_OVERLAP));

        JobOptions display = new JobOptions();
        display.integrationCap = 10;
        display.smoothingSigma = 2;
        assertEquals(key, ResultCache.cacheKey(first, display, 0.5, POLICY));

        JobOptions interpolated = new JobOptions();
        interpolated.useInterpolation = true;
        assertNotEquals(key, ResultCache.cacheKey(first, interpolated, 0.5, POLICY));

        JobOptions regridded = new JobOptions();
        regridded.canonicalGrid = new double[] {1, 2, 3};
        assertNotEquals(key, ResultCache.cacheKey(first, regridded, 0.5, POLICY));
    }

    @Test
    void cachedArchiveIsReturned () {
        ResultCache cache = new ResultCache(config(true));
        AssembledArchive assembled = new AssembledArchive(
            CubeFixtures.ramp(2, 2), List.of(), List.of(), 2, POLICY.name());
        assertTrue(cache.isEnabled());
        assertFalse(cache.get("key").isPresent());
        cache.put("key", assembled);
        assertSame(assembled, cache.get("key").orElseThrow());
        cache.invalidateAll();
        assertFalse(cache.get("key").isPresent());
    }

    @Test
    void disabledCacheHoldsNothing () {
        ResultCache cache = new ResultCache(config(false));
        cache.put("key", new AssembledArchive(CubeFixtures.ramp(1, 1), List.of(), List.of(), 1, POLICY.name()));
        assertFalse(cache.isEnabled());
        assertFalse(cache.get("key").isPresent());
    }

}
