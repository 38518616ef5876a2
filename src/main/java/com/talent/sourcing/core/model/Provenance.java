package com.talent.sourcing.core.model;

import java.util.Objects;

/**
 * Where a candidate organization came from.
 *
 * @param source          the discovery strategy
 * @param sourceQuery     the query that surfaced the candidate (may be null for mentioned seeds)
 * @param sourceReference URL or other reference of the search hit (may be null)
 * @param rank            zero-based rank of the hit within its query's results
 */
public record Provenance(DiscoverySource source, String sourceQuery, String sourceReference, int rank) {

    public Provenance {
        Objects.requireNonNull(source, "source is required");
        if (rank < 0) {
            throw new IllegalArgumentException("rank must be >= 0");
        }
    }

    public static Provenance mentioned() {
        return new Provenance(DiscoverySource.MENTIONED, null, null, 0);
    }
}
