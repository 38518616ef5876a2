package com.talent.sourcing.lookup;

import com.fasterxml.jackson.databind.JsonNode;
import com.talent.sourcing.core.model.EntityMetadata;

import java.util.Objects;

/**
 * Full organization record as returned by the profile API.
 */
public record ProfilePayload(String stableId, JsonNode data) {

    public ProfilePayload {
        Objects.requireNonNull(stableId, "stableId is required");
        Objects.requireNonNull(data, "data is required");
    }

    /**
     * Descriptive fields extracted with the same fallbacks as search hits.
     */
    public EntityMetadata toMetadata() {
        return CompanyRecordParser.metadata(data);
    }
}
