package com.talent.sourcing.lookup;

/**
 * External profile API returning the full record for a stable identifier.
 * Each call may be billed, so callers go through the profile cache.
 */
public interface ProfileClient {

    ProfilePayload fetchProfile(String stableId);

    String endpointName();
}
