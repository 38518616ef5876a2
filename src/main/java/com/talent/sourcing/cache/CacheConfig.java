package com.talent.sourcing.cache;

import java.time.Duration;

/**
 * Configuration for the two-tier resolution cache.
 *
 * @param maxEntries       maximum entries per tier held by the in-process stores
 * @param positiveTtl      how long a successful name resolution stays valid
 * @param negativeTtl      cooldown before a failed or empty resolution is retried; never longer than positiveTtl
 * @param profileTtl       age after which a cached profile is stale and re-fetched
 * @param cacheNegatives   whether failed and empty resolutions are written as negative entries
 * @param batchConcurrency maximum concurrent external calls during batch resolution and profile fetches
 */
public record CacheConfig(long maxEntries, Duration positiveTtl, Duration negativeTtl, Duration profileTtl,
                          boolean cacheNegatives, int batchConcurrency) {

    public CacheConfig {
        if (maxEntries <= 0) {
            throw new IllegalArgumentException("maxEntries must be > 0");
        }
        requirePositive(positiveTtl, "positiveTtl");
        requirePositive(negativeTtl, "negativeTtl");
        requirePositive(profileTtl, "profileTtl");
        if (negativeTtl.compareTo(positiveTtl) > 0) {
            throw new IllegalArgumentException("negativeTtl must not exceed positiveTtl");
        }
        if (batchConcurrency < 1) {
            throw new IllegalArgumentException("batchConcurrency must be >= 1");
        }
    }

    /**
     * Defaults: 100,000 entries, 180 day positive TTL, 7 day negative TTL,
     * 90 day profile TTL, negatives cached, 8 concurrent calls.
     */
    public static CacheConfig defaults() {
        return new CacheConfig(100_000, Duration.ofDays(180), Duration.ofDays(7), Duration.ofDays(90), true, 8);
    }

    public CacheConfig withProfileTtl(Duration ttl) {
        return new CacheConfig(maxEntries, positiveTtl, negativeTtl, ttl, cacheNegatives, batchConcurrency);
    }

    public CacheConfig withCacheNegatives(boolean enabled) {
        return new CacheConfig(maxEntries, positiveTtl, negativeTtl, profileTtl, enabled, batchConcurrency);
    }

    private static void requirePositive(Duration value, String name) {
        if (value == null || value.isNegative() || value.isZero()) {
            throw new IllegalArgumentException(name + " must be > 0");
        }
    }
}
