package com.talent.sourcing.scoring;

import com.talent.sourcing.core.model.Entity;

import java.util.List;

/**
 * One batch of entities to classify. Entities are addressed by their zero-based position.
 */
public record ClassificationRequest(ScoringContext context, List<Entity> entities, int minScore, int maxScore) {

    public ClassificationRequest {
        entities = List.copyOf(entities);
        if (entities.isEmpty()) {
            throw new IllegalArgumentException("A classification batch needs at least one entity");
        }
        if (minScore >= maxScore) {
            throw new IllegalArgumentException("minScore must be < maxScore");
        }
    }
}
