package com.talent.sourcing.cache;

/**
 * Counters of the resolution cache since it was created.
 *
 * @param hits           Tier-1 lookups answered from cache, negatives included
 * @param misses         Tier-1 lookups that went to the external resolver
 * @param negativeHits   Tier-1 hits on a negative entry
 * @param profileHits    Tier-2 fetches answered from cache
 * @param profileMisses  Tier-2 fetches that went to the profile API
 * @param errors         external calls that failed after retries
 * @param writeFailures  cache writes rejected by a store
 * @param coalesced      requests satisfied by another caller's in-flight call
 */
public record CacheStats(long hits, long misses, long negativeHits, long profileHits, long profileMisses,
                         long errors, long writeFailures, long coalesced) {

    /**
     * Tier-1 hit rate (0.0 to 1.0).
     */
    public double hitRate() {
        long total = hits + misses;
        return total == 0 ? 0.0 : (double) hits / total;
    }

    public static CacheStats empty() {
        return new CacheStats(0, 0, 0, 0, 0, 0, 0, 0);
    }
}
