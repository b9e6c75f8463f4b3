package com.stamp.analysis.components;

import com.github.benmanes.caffeine.cache.Cache;
import com.github.benmanes.caffeine.cache.Caffeine;
import com.google.common.hash.Hasher;
import com.google.common.hash.Hashing;
import com.google.common.io.Files;
import com.stamp.analysis.AssembledArchive;
import com.stamp.analysis.JobOptions;
import com.stamp.cube.GridReconciler.ReferenceGridPolicy;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import javax.annotation.Nonnull;

import java.io.File;
import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.util.Optional;
import java.util.concurrent.TimeUnit;

/**
 * A short-lived in-memory cache of assembled cubes, so that resubmitting the same archive with different display
 * options skips the expensive scan, read and regrid stages. Entries are keyed by a hash of the archive contents and of
 * every option that affects assembly; display options are not part of the key because reduction always runs afresh.
 */
public class ResultCache implements Component {

    private static final Logger LOG = LoggerFactory.getLogger(ResultCache.class);

    public interface Config {
        boolean resultCacheEnabled ();
        int resultCacheTtlMinutes ();
        int resultCacheMaxEntries ();
    }

    /** Null when caching is disabled. */
    private final Cache<String, AssembledArchive> cache;

    public ResultCache (Config config) {
        if (config.resultCacheEnabled()) {
            this.cache = Caffeine.newBuilder()
                .maximumSize(config.resultCacheMaxEntries())
                .expireAfterWrite(config.resultCacheTtlMinutes(), TimeUnit.MINUTES)
                .build();
        } else {
            this.cache = null;
        }
    }

    public boolean isEnabled () {
        return cache != null;
    }

    public Optional<AssembledArchive> get (String key) {
        if (cache == null) return Optional.empty();
        AssembledArchive cached = cache.getIfPresent(key);
        if (cached == null) {
            LOG.info("Result cache miss for {}", key);
        } else {
            LOG.info("Result cache hit for {}", key);
        }
        return Optional.ofNullable(cached);
    }

    public void put (String key, AssembledArchive assembled) {
        if (cache == null) return;
        cache.put(key, assembled);
    }

    public void invalidateAll () {
        if (cache != null) cache.invalidateAll();
    }

    /**
     * SHA-256 over the archive bytes and every option that changes the assembled cube.
     */
    public static @Nonnull String cacheKey (File archive, JobOptions options, double gapThresholdHours,
                                   ReferenceGridPolicy policy) throws IOException {
        String archiveHash = Files.asByteSource(archive).hash(Hashing.sha256()).toString();
        Hasher hasher = Hashing.sha256().newHasher()
            .putString(archiveHash, StandardCharsets.UTF_8)
            .putBoolean(options.useInterpolation)
            .putDouble(gapThresholdHours)
            .putString(policy.name(), StandardCharsets.UTF_8);
        if (options.canonicalGrid != null) {
            hasher.putInt(options.canonicalGrid.length);
            for (double w : options.canonicalGrid) hasher.putDouble(w);
        }
        return hasher.hash().toString();
    }

}
