package com.talent.sourcing.lookup;

/**
 * Resolver lookup strategies, declared in the order they are tried.
 */
public enum LookupTier {
    /** Phrase match on the organization name. */
    EXACT_NAME,
    /** Match on the organization's website domain; only tried when a website hint is known. */
    WEBSITE,
    /** Fuzzy match on the organization name. */
    FUZZY_NAME
}
