package com.talent.sourcing.discovery;

import java.util.List;

/**
 * Candidates produced by one strategy, with query accounting.
 *
 * @param strategyId    id of the producing strategy
 * @param candidates    candidates in extraction order
 * @param queriesIssued queries sent to the search provider
 * @param queriesFailed queries that failed after retries
 */
public record StrategyResult(String strategyId, List<DiscoveryCandidate> candidates,
                             int queriesIssued, int queriesFailed) {

    public StrategyResult {
        candidates = List.copyOf(candidates);
    }
}
