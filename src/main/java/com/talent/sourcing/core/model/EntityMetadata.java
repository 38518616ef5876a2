package com.talent.sourcing.core.model;

/**
 * Sparse descriptive fields of an organization. Every field is optional.
 */
public record EntityMetadata(String industry, String size, String location, String website) {

    private static final EntityMetadata EMPTY = new EntityMetadata(null, null, null, null);

    public EntityMetadata {
        industry = blankToNull(industry);
        size = blankToNull(size);
        location = blankToNull(location);
        website = blankToNull(website);
    }

    public static EntityMetadata empty() {
        return EMPTY;
    }

    public static EntityMetadata ofWebsite(String website) {
        return new EntityMetadata(null, null, null, website);
    }

    public boolean isEmpty() {
        return industry == null && size == null && location == null && website == null;
    }

    /**
     * Returns a copy where fields missing here are taken from {@code other}.
     */
    public EntityMetadata fillMissing(EntityMetadata other) {
        if (other == null || other.isEmpty()) {
            return this;
        }
        return new EntityMetadata(
                industry != null ? industry : other.industry,
                size != null ? size : other.size,
                location != null ? location : other.location,
                website != null ? website : other.website);
    }

    private static String blankToNull(String value) {
        return value == null || value.isBlank() ? null : value.strip();
    }
}
