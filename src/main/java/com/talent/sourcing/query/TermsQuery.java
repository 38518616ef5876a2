package com.talent.sourcing.query;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.node.ArrayNode;
import com.fasterxml.jackson.databind.node.JsonNodeFactory;
import com.fasterxml.jackson.databind.node.ObjectNode;

import java.util.List;
import java.util.Objects;

/**
 * Matches when the field equals any of the values. Counts as a single clause on the backend.
 */
public record TermsQuery(String field, List<String> values) implements QueryNode {

    public TermsQuery {
        Objects.requireNonNull(field, "field is required");
        if (values == null || values.isEmpty()) {
            throw new IllegalArgumentException("values must not be empty");
        }
        values = List.copyOf(values);
    }

    @Override
    public JsonNode toJson(JsonNodeFactory factory) {
        ObjectNode root = factory.objectNode();
        ArrayNode array = root.putObject("terms").putArray(field);
        values.forEach(array::add);
        return root;
    }
}
