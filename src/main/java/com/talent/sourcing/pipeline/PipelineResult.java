package com.talent.sourcing.pipeline;

import com.talent.sourcing.core.model.Entity;
import com.talent.sourcing.query.QueryTree;
import com.talent.sourcing.session.SessionPage;

import java.util.List;
import java.util.Optional;

/**
 * Output of a full run. The person search is absent when no organization could be resolved.
 *
 * @param outcome   discovery and ranking
 * @param selected  resolved organizations the person search was built from, in ranking order
 * @param query     the compiled person search, or null
 * @param firstPage first page of people, or null
 */
public record PipelineResult(DiscoveryOutcome outcome, List<Entity> selected, QueryTree query,
                             SessionPage firstPage) {

    public PipelineResult {
        selected = List.copyOf(selected);
    }

    public String runId() {
        return outcome.runId();
    }

    public Optional<SessionPage> getFirstPage() {
        return Optional.ofNullable(firstPage);
    }

    public Optional<QueryTree> getQuery() {
        return Optional.ofNullable(query);
    }
}
