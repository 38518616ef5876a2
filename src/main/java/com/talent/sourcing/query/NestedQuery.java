package com.talent.sourcing.query;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.node.JsonNodeFactory;
import com.fasterxml.jackson.databind.node.ObjectNode;

import java.util.Objects;

/**
 * Scopes {@code query} to the repeated sub-documents under {@code path}, so every
 * condition inside must hold for the same work-history entry.
 */
public record NestedQuery(String path, QueryNode query) implements QueryNode {

    public NestedQuery {
        Objects.requireNonNull(path, "path is required");
        Objects.requireNonNull(query, "query is required");
    }

    @Override
    public JsonNode toJson(JsonNodeFactory factory) {
        ObjectNode nested = factory.objectNode();
        nested.put("path", path);
        nested.set("query", query.toJson(factory));
        ObjectNode root = factory.objectNode();
        root.set("nested", nested);
        return root;
    }
}
