package com.talent.sourcing.query;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.node.JsonNodeFactory;

/**
 * A node of a compiled boolean query. Implementations are records, so two trees built
 * from the same input are {@code equals}.
 */
public interface QueryNode {

    JsonNode toJson(JsonNodeFactory factory);
}
