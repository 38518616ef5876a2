package com.talent.sourcing.cache;

import com.talent.sourcing.core.model.EntityMetadata;
import com.talent.sourcing.lookup.LookupTier;

import java.util.Objects;
import java.util.Optional;

/**
 * Outcome of resolving one organization name.
 *
 * @param normalizedKey cache key, null only for {@link ResolutionStatus#REJECTED}
 * @param stableId      identifier when resolved, otherwise null
 * @param confidence    match confidence, 0.0 when unresolved
 * @param tier          lookup tier that produced the match, or null
 * @param metadata      descriptive fields from the match
 * @param fromCache     whether the answer came from a Tier-1 entry
 * @param status        outcome category
 * @param failureReason detail for FAILED and REJECTED outcomes
 */
public record ResolutionResult(String normalizedKey, String stableId, double confidence, LookupTier tier,
                               EntityMetadata metadata, boolean fromCache, ResolutionStatus status,
                               String failureReason) {

    public ResolutionResult {
        Objects.requireNonNull(status, "status is required");
        if (status == ResolutionStatus.RESOLVED && stableId == null) {
            throw new IllegalArgumentException("A resolved result needs a stableId");
        }
        metadata = metadata != null ? metadata : EntityMetadata.empty();
    }

    static ResolutionResult fromEntry(LookupCacheEntry entry) {
        return new ResolutionResult(entry.normalizedKey(), entry.stableId(), entry.confidence(), entry.lookupTier(),
                entry.metadata(), true,
                entry.isNegative() ? ResolutionStatus.NOT_FOUND : ResolutionStatus.RESOLVED, null);
    }

    static ResolutionResult notFound(String normalizedKey) {
        return new ResolutionResult(normalizedKey, null, 0.0, null, null, false, ResolutionStatus.NOT_FOUND, null);
    }

    static ResolutionResult failed(String normalizedKey, String reason) {
        return new ResolutionResult(normalizedKey, null, 0.0, null, null, false, ResolutionStatus.FAILED, reason);
    }

    static ResolutionResult rejected(String reason) {
        return new ResolutionResult(null, null, 0.0, null, null, false, ResolutionStatus.REJECTED, reason);
    }

    public boolean isResolved() {
        return status == ResolutionStatus.RESOLVED;
    }

    public Optional<String> stableIdValue() {
        return Optional.ofNullable(stableId);
    }
}
