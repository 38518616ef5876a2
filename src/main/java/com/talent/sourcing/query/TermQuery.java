package com.talent.sourcing.query;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.node.JsonNodeFactory;
import com.fasterxml.jackson.databind.node.ObjectNode;

import java.util.Objects;

/**
 * Exact match of one field value.
 */
public record TermQuery(String field, String value) implements QueryNode {

    public TermQuery {
        Objects.requireNonNull(field, "field is required");
        Objects.requireNonNull(value, "value is required");
    }

    @Override
    public JsonNode toJson(JsonNodeFactory factory) {
        ObjectNode root = factory.objectNode();
        root.putObject("term").put(field, value);
        return root;
    }
}
