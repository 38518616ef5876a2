package com.talent.sourcing.discovery;

import com.talent.sourcing.core.model.Provenance;

import java.util.Objects;

/**
 * An organization name extracted by a discovery strategy, before deduplication and resolution.
 */
public record DiscoveryCandidate(String name, String websiteHint, Provenance provenance) {

    public DiscoveryCandidate {
        Objects.requireNonNull(name, "name is required");
        Objects.requireNonNull(provenance, "provenance is required");
        name = name.strip();
        websiteHint = websiteHint == null || websiteHint.isBlank() ? null : websiteHint;
    }

    public DiscoveryCandidate withWebsiteHint(String website) {
        return new DiscoveryCandidate(name, website, provenance);
    }
}
