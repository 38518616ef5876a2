package com.talent.sourcing.cache;

import com.talent.sourcing.lookup.ProfilePayload;

import java.util.Map;

/**
 * Profiles fetched for a batch of distinct identifiers, plus the failures by identifier.
 */
public record ProfileBatchResult(Map<String, ProfilePayload> profiles, Map<String, String> failures) {

    public ProfileBatchResult {
        profiles = Map.copyOf(profiles);
        failures = Map.copyOf(failures);
    }
}
