package com.talent.sourcing.lookup;

import com.talent.sourcing.core.model.EntityMetadata;

import java.util.Objects;

/**
 * A resolver hit accepted for an organization name.
 */
public record LookupMatch(String stableId, String matchedName, double confidence,
                          LookupTier tier, EntityMetadata metadata) {

    public LookupMatch {
        Objects.requireNonNull(stableId, "stableId is required");
        Objects.requireNonNull(tier, "tier is required");
        if (confidence < 0.0 || confidence > 1.0) {
            throw new IllegalArgumentException("confidence must be between 0.0 and 1.0");
        }
        metadata = metadata != null ? metadata : EntityMetadata.empty();
    }
}
