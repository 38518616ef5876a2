package com.talent.sourcing.lookup;

import com.fasterxml.jackson.databind.JsonNode;
import com.talent.sourcing.core.model.EntityMetadata;

import java.util.ArrayList;
import java.util.List;

/**
 * Parses organization records returned by the lookup and profile endpoints.
 * Responses vary in shape (bare arrays, {@code hits.hits[]._source} envelopes, numeric or
 * string identifiers), so every field has a declared fallback and missing values become null.
 */
final class CompanyRecordParser {

    private CompanyRecordParser() {
    }

    /**
     * A search hit that carries at least an identifier and a name.
     */
    record CompanyHit(String id, String name, double score, EntityMetadata metadata) {
    }

    static List<CompanyHit> parseHits(JsonNode body) {
        List<CompanyHit> hits = new ArrayList<>();
        if (body == null || body.isNull() || body.isMissingNode()) {
            return hits;
        }
        JsonNode items = body.isArray() ? body : body.path("hits").path("hits");
        if (!items.isArray()) {
            return hits;
        }
        for (JsonNode item : items) {
            JsonNode source = item.has("_source") ? item.get("_source") : item;
            String id = firstText(source, "id", "company_id");
            if (id == null) {
                id = text(item, "_id");
            }
            String name = firstText(source, "name", "company_name");
            if (id == null || name == null) {
                continue;
            }
            double score = item.path("_score").isNumber() ? item.path("_score").asDouble()
                    : source.path("_score").asDouble(0.0);
            hits.add(new CompanyHit(id, name, score, metadata(source)));
        }
        return hits;
    }

    static EntityMetadata metadata(JsonNode source) {
        if (source == null || !source.isObject()) {
            return EntityMetadata.empty();
        }
        String size = firstText(source, "size_range", "size", "employees_count", "employee_count");
        String location = firstText(source, "location", "hq_location", "headquarters_country_parsed", "hq_country");
        String website = firstText(source, "website", "domain");
        return new EntityMetadata(firstText(source, "industry"), size, location, website);
    }

    static String firstText(JsonNode node, String... fields) {
        for (String field : fields) {
            String value = text(node, field);
            if (value != null) {
                return value;
            }
        }
        return null;
    }

    static String text(JsonNode node, String field) {
        JsonNode value = node.path(field);
        if (value.isMissingNode() || value.isNull() || value.isContainerNode()) {
            return null;
        }
        String text = value.asText();
        return text.isBlank() ? null : text.strip();
    }
}
