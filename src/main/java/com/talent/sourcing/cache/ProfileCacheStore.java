package com.talent.sourcing.cache;

import java.util.Optional;

/**
 * Storage for Tier-2 entries, keyed uniquely by stable identifier.
 */
public interface ProfileCacheStore {

    Optional<ProfileCacheEntry> find(String stableId);

    /**
     * @throws CacheWriteException if the store rejects the write
     */
    void upsert(ProfileCacheEntry entry);

    void invalidate(String stableId);

    long size();
}
