package com.talent.sourcing.core.model;

/**
 * The discovery strategy that produced a candidate organization.
 */
public enum DiscoverySource {
    /** Named by the caller as a seed organization. */
    MENTIONED,
    /** Found by broadening a seed ("similar to X", "competitors of X"). */
    SEED_EXPANSION,
    /** Found by a generic domain/industry keyword query. */
    KEYWORD_SEARCH
}
