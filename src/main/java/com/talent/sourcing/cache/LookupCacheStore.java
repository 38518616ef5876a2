package com.talent.sourcing.cache;

import java.time.Instant;
import java.util.Optional;

/**
 * Storage for Tier-1 entries, keyed uniquely by normalized key.
 * Freshness is decided by the caller; stores only keep records.
 */
public interface LookupCacheStore {

    Optional<LookupCacheEntry> find(String normalizedKey);

    /**
     * Inserts or replaces the entry for its normalized key.
     *
     * @throws CacheWriteException if the store rejects the write
     */
    void upsert(LookupCacheEntry entry);

    /**
     * Increments the hit count and updates the last access time, if the entry exists.
     */
    void recordHit(String normalizedKey, Instant accessedAt);

    void invalidate(String normalizedKey);

    long size();
}
