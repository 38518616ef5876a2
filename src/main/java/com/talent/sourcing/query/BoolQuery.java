package com.talent.sourcing.query;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.node.ArrayNode;
import com.fasterxml.jackson.databind.node.JsonNodeFactory;
import com.fasterxml.jackson.databind.node.ObjectNode;

import java.util.List;

/**
 * Boolean combination of clauses.
 *
 * @param must               clauses every match satisfies
 * @param should             optional clauses that raise the score
 * @param minimumShouldMatch how many {@code should} clauses must match; null leaves it unset
 */
public record BoolQuery(List<QueryNode> must, List<QueryNode> should, Integer minimumShouldMatch)
        implements QueryNode {

    public BoolQuery {
        must = must == null ? List.of() : List.copyOf(must);
        should = should == null ? List.of() : List.copyOf(should);
        if (minimumShouldMatch != null && minimumShouldMatch < 0) {
            throw new IllegalArgumentException("minimumShouldMatch must be >= 0");
        }
    }

    public static BoolQuery anyOf(List<QueryNode> clauses) {
        return new BoolQuery(List.of(), clauses, 1);
    }

    @Override
    public JsonNode toJson(JsonNodeFactory factory) {
        ObjectNode bool = factory.objectNode();
        if (!must.isEmpty()) {
            ArrayNode array = bool.putArray("must");
            must.forEach(clause -> array.add(clause.toJson(factory)));
        }
        if (!should.isEmpty()) {
            ArrayNode array = bool.putArray("should");
            should.forEach(clause -> array.add(clause.toJson(factory)));
        }
        if (minimumShouldMatch != null) {
            bool.put("minimum_should_match", minimumShouldMatch);
        }
        ObjectNode root = factory.objectNode();
        root.set("bool", bool);
        return root;
    }
}
