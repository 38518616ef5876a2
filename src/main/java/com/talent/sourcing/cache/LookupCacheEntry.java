package com.talent.sourcing.cache;

import com.talent.sourcing.core.model.EntityMetadata;
import com.talent.sourcing.lookup.LookupMatch;
import com.talent.sourcing.lookup.LookupTier;

import java.time.Duration;
import java.time.Instant;

/**
 * Tier-1 record: normalized name to stable identifier.
 *
 * <p>The normalized key is the only required field. A null {@code stableId} marks a negative
 * entry (a resolution that failed or found nothing), which is different from having no entry.</p>
 */
public record LookupCacheEntry(String normalizedKey, String stableId, double confidence, LookupTier lookupTier,
                               EntityMetadata metadata, long hitCount, Instant resolvedAt, Instant lastAccessedAt) {

    public LookupCacheEntry {
        if (normalizedKey == null || normalizedKey.isEmpty()) {
            throw new IllegalArgumentException("normalizedKey is required");
        }
        metadata = metadata != null ? metadata : EntityMetadata.empty();
    }

    public static LookupCacheEntry positive(String normalizedKey, LookupMatch match, Instant now) {
        return new LookupCacheEntry(normalizedKey, match.stableId(), match.confidence(), match.tier(),
                match.metadata(), 0, now, now);
    }

    public static LookupCacheEntry negative(String normalizedKey, Instant now) {
        return new LookupCacheEntry(normalizedKey, null, 0.0, null, null, 0, now, now);
    }

    public boolean isNegative() {
        return stableId == null;
    }

    /**
     * Whether this entry has outlived the TTL for its kind.
     */
    public boolean isExpired(Instant now, CacheConfig config) {
        if (resolvedAt == null) {
            return true;
        }
        Duration ttl = isNegative() ? config.negativeTtl() : config.positiveTtl();
        return !now.isBefore(resolvedAt.plus(ttl));
    }

    public LookupCacheEntry withHit(Instant accessedAt) {
        return new LookupCacheEntry(normalizedKey, stableId, confidence, lookupTier, metadata,
                hitCount + 1, resolvedAt, accessedAt);
    }
}
