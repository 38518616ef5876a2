package com.talent.sourcing.discovery;

/**
 * A generated search query. Lower priority values run first.
 */
public record PlannedQuery(String query, int priority) {

    public PlannedQuery {
        if (query == null || query.isBlank()) {
            throw new IllegalArgumentException("query is required");
        }
        if (priority < 1) {
            throw new IllegalArgumentException("priority must be >= 1");
        }
    }
}
