package com.talent.sourcing.cache;

import com.github.benmanes.caffeine.cache.Cache;
import com.github.benmanes.caffeine.cache.Caffeine;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Instant;
import java.util.Optional;

/**
 * In-process Tier-1 store backed by a size-bounded Caffeine cache.
 */
public class CaffeineLookupCacheStore implements LookupCacheStore {
    private static final Logger log = LoggerFactory.getLogger(CaffeineLookupCacheStore.class);

    private final Cache<String, LookupCacheEntry> cache;

    public CaffeineLookupCacheStore(CacheConfig config) {
        this.cache = Caffeine.newBuilder()
                .maximumSize(config.maxEntries())
                .build();
        log.info("CaffeineLookupCacheStore initialized: maxEntries={}", config.maxEntries());
    }

    @Override
    public Optional<LookupCacheEntry> find(String normalizedKey) {
        if (normalizedKey == null) {
            return Optional.empty();
        }
        return Optional.ofNullable(cache.getIfPresent(normalizedKey));
    }

    @Override
    public void upsert(LookupCacheEntry entry) {
        if (entry == null) {
            throw new CacheWriteException("Refusing to store a null lookup entry");
        }
        // Keep the usage counter across re-resolutions of the same key.
        cache.asMap().merge(entry.normalizedKey(), entry, (existing, replacement) ->
                new LookupCacheEntry(replacement.normalizedKey(), replacement.stableId(), replacement.confidence(),
                        replacement.lookupTier(), replacement.metadata(), existing.hitCount(),
                        replacement.resolvedAt(), replacement.lastAccessedAt()));
    }

    @Override
    public void recordHit(String normalizedKey, Instant accessedAt) {
        cache.asMap().computeIfPresent(normalizedKey, (key, entry) -> entry.withHit(accessedAt));
    }

    @Override
    public void invalidate(String normalizedKey) {
        cache.invalidate(normalizedKey);
    }

    @Override
    public long size() {
        cache.cleanUp();
        return cache.estimatedSize();
    }
}
