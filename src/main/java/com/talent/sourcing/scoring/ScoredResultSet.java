package com.talent.sourcing.scoring;

import com.talent.sourcing.core.model.Entity;

import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;

/**
 * Entities ordered for presentation. Scored entities come first, by descending score with
 * ties in discovery order; unscored entities follow in discovery order and never carry a score.
 */
public record ScoredResultSet(List<Entity> scored, List<Entity> unscored, boolean scoringSkipped,
                              String skipReason) {

    public ScoredResultSet {
        scored = List.copyOf(scored);
        unscored = List.copyOf(unscored);
    }

    /**
     * Splits entities given in discovery order into the two buckets.
     */
    public static ScoredResultSet rank(List<Entity> inDiscoveryOrder) {
        List<Entity> scored = new ArrayList<>();
        List<Entity> unscored = new ArrayList<>();
        for (Entity entity : inDiscoveryOrder) {
            (entity.isScored() ? scored : unscored).add(entity);
        }
        scored.sort(Comparator.comparingDouble((Entity e) -> e.getRelevanceScore().getAsDouble()).reversed());
        return new ScoredResultSet(scored, unscored, false, null);
    }

    /**
     * Result of a skipped stage: every entity unscored, discovery order kept.
     */
    public static ScoredResultSet skipped(List<Entity> inDiscoveryOrder, String reason) {
        List<Entity> unscored = new ArrayList<>(inDiscoveryOrder.size());
        for (Entity entity : inDiscoveryOrder) {
            unscored.add(entity.withoutScore("scoring skipped: " + reason));
        }
        return new ScoredResultSet(List.of(), unscored, true, reason);
    }

    public List<Entity> entities() {
        List<Entity> all = new ArrayList<>(scored.size() + unscored.size());
        all.addAll(scored);
        all.addAll(unscored);
        return all;
    }

    public int scoredCount() {
        return scored.size();
    }

    public int unscoredCount() {
        return unscored.size();
    }
}
