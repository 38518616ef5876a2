package com.talent.sourcing.lookup;

/**
 * Input to a resolver lookup.
 *
 * @param name        raw organization name
 * @param websiteHint website seen next to the name during discovery, or null
 */
public record LookupRequest(String name, String websiteHint) {

    public LookupRequest {
        websiteHint = websiteHint == null || websiteHint.isBlank() ? null : websiteHint.strip();
    }

    public static LookupRequest of(String name) {
        return new LookupRequest(name, null);
    }

    public boolean hasWebsite() {
        return websiteHint != null;
    }
}
