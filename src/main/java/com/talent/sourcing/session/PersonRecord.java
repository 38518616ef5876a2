package com.talent.sourcing.session;

import com.fasterxml.jackson.databind.JsonNode;

import java.util.Objects;

/**
 * One person document returned by the search backend.
 *
 * @param recordId stable identifier used for deduplication across pages
 * @param data     the raw document
 */
public record PersonRecord(String recordId, JsonNode data) {

    public PersonRecord {
        Objects.requireNonNull(recordId, "recordId is required");
        Objects.requireNonNull(data, "data is required");
    }
}
