package com.talent.sourcing.query;

import java.util.ArrayList;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Set;

/**
 * What a person search must and may match.
 *
 * @param requiredEntityIds stable ids of organizations; a person must have worked at one of them
 * @param keywordExpression title expression, or null for no keyword filter
 * @param keywordRequired   whether the keyword excludes non-matching people or only boosts matches
 * @param location          location term, or null
 * @param locationRequired  whether the location excludes or only boosts
 */
public record FilterRequest(List<String> requiredEntityIds, String keywordExpression, boolean keywordRequired,
                            String location, boolean locationRequired) {

    public FilterRequest {
        Set<String> ids = new LinkedHashSet<>();
        if (requiredEntityIds != null) {
            for (String id : requiredEntityIds) {
                if (id != null && !id.isBlank()) {
                    ids.add(id.strip());
                }
            }
        }
        requiredEntityIds = List.copyOf(ids);
        keywordExpression = keywordExpression == null || keywordExpression.isBlank() ? null : keywordExpression.strip();
        location = location == null || location.isBlank() ? null : location.strip();
    }

    public boolean hasKeyword() {
        return keywordExpression != null;
    }

    public boolean hasLocation() {
        return location != null;
    }

    public static Builder builder() {
        return new Builder();
    }

    public static class Builder {
        private final List<String> requiredEntityIds = new ArrayList<>();
        private String keywordExpression;
        private boolean keywordRequired;
        private String location;
        private boolean locationRequired;

        public Builder requiredEntityIds(List<String> ids) {
            this.requiredEntityIds.addAll(ids);
            return this;
        }

        public Builder requiredEntityId(String id) {
            this.requiredEntityIds.add(id);
            return this;
        }

        public Builder keyword(String expression, boolean required) {
            this.keywordExpression = expression;
            this.keywordRequired = required;
            return this;
        }

        public Builder location(String location, boolean required) {
            this.location = location;
            this.locationRequired = required;
            return this;
        }

        public FilterRequest build() {
            return new FilterRequest(requiredEntityIds, keywordExpression, keywordRequired,
                    location, locationRequired);
        }
    }
}
