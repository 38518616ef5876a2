package com.talent.sourcing.query;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.node.JsonNodeFactory;
import com.fasterxml.jackson.databind.node.ObjectNode;

import java.util.Objects;

/**
 * Free-text expression (with AND/OR operators and quoted phrases) against one field.
 */
public record QueryStringQuery(String query, String defaultField, String defaultOperator) implements QueryNode {

    public QueryStringQuery {
        Objects.requireNonNull(query, "query is required");
        Objects.requireNonNull(defaultField, "defaultField is required");
        defaultOperator = defaultOperator != null ? defaultOperator : "OR";
    }

    @Override
    public JsonNode toJson(JsonNodeFactory factory) {
        ObjectNode root = factory.objectNode();
        root.putObject("query_string")
                .put("query", query)
                .put("default_field", defaultField)
                .put("default_operator", defaultOperator);
        return root;
    }
}
