package com.talent.sourcing.discovery;

import com.talent.sourcing.cache.BatchResolution;
import com.talent.sourcing.core.model.Entity;

import java.util.ArrayList;
import java.util.List;
import java.util.Map;

/**
 * Entities in discovery order, with the counters a caller needs to judge completeness.
 */
public record DiscoveryResult(List<Entity> entities, CandidateSet candidates, BatchResolution resolution,
                              Map<String, String> profileFailures) {

    public DiscoveryResult {
        entities = List.copyOf(entities);
        profileFailures = Map.copyOf(profileFailures);
    }

    public List<Entity> resolvedEntities() {
        List<Entity> resolved = new ArrayList<>();
        for (Entity entity : entities) {
            if (entity.isResolved()) {
                resolved.add(entity);
            }
        }
        return resolved;
    }

    public int cacheHits() {
        return resolution.fromCache();
    }

    public int cacheMisses() {
        return resolution.total() - resolution.fromCache() - resolution.rejected();
    }

    public boolean isPartial() {
        return candidates.isPartial() || resolution.failed() > 0;
    }
}
