package com.talent.sourcing.cache;

import com.github.benmanes.caffeine.cache.Cache;
import com.github.benmanes.caffeine.cache.Caffeine;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.Optional;

/**
 * In-process Tier-2 store backed by a size-bounded Caffeine cache.
 */
public class CaffeineProfileCacheStore implements ProfileCacheStore {
    private static final Logger log = LoggerFactory.getLogger(CaffeineProfileCacheStore.class);

    private final Cache<String, ProfileCacheEntry> cache;

    public CaffeineProfileCacheStore(CacheConfig config) {
        this.cache = Caffeine.newBuilder()
                .maximumSize(config.maxEntries())
                .build();
        log.info("CaffeineProfileCacheStore initialized: maxEntries={}", config.maxEntries());
    }

    @Override
    public Optional<ProfileCacheEntry> find(String stableId) {
        if (stableId == null) {
            return Optional.empty();
        }
        return Optional.ofNullable(cache.getIfPresent(stableId));
    }

    @Override
    public void upsert(ProfileCacheEntry entry) {
        if (entry == null) {
            throw new CacheWriteException("Refusing to store a null profile entry");
        }
        cache.put(entry.stableId(), entry);
    }

    @Override
    public void invalidate(String stableId) {
        cache.invalidate(stableId);
    }

    @Override
    public long size() {
        cache.cleanUp();
        return cache.estimatedSize();
    }
}
