package com.talent.sourcing.cache;

import com.talent.sourcing.lookup.ProfilePayload;

import java.time.Duration;
import java.time.Instant;
import java.util.Objects;

/**
 * Tier-2 record: stable identifier to full profile.
 */
public record ProfileCacheEntry(String stableId, ProfilePayload payload, Instant lastFetchedAt) {

    public ProfileCacheEntry {
        if (stableId == null || stableId.isEmpty()) {
            throw new IllegalArgumentException("stableId is required");
        }
        Objects.requireNonNull(payload, "payload is required");
        Objects.requireNonNull(lastFetchedAt, "lastFetchedAt is required");
    }

    public boolean isStale(Instant now, Duration ttl) {
        return !now.isBefore(lastFetchedAt.plus(ttl));
    }
}
