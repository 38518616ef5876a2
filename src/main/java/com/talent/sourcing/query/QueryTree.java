package com.talent.sourcing.query;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.ObjectNode;

import java.io.UncheckedIOException;
import java.util.Objects;

/**
 * A compiled person-search query. Immutable; equal trees serialize to identical JSON.
 */
public record QueryTree(QueryNode root) {

    private static final ObjectMapper MAPPER = new ObjectMapper();

    public QueryTree {
        Objects.requireNonNull(root, "root is required");
    }

    /**
     * Request body: {@code {"query": <root>}}.
     */
    public ObjectNode toJson() {
        ObjectNode body = MAPPER.createObjectNode();
        body.set("query", root.toJson(MAPPER.getNodeFactory()));
        return body;
    }

    public String toJsonString() {
        try {
            return MAPPER.writeValueAsString(toJson());
        } catch (JsonProcessingException e) {
            throw new UncheckedIOException(e);
        }
    }
}
