package com.talent.sourcing.discovery;

import java.util.List;
import java.util.Map;

/**
 * Merged output of all strategies: unique, non-excluded candidates in discovery order.
 *
 * @param candidates        candidates to resolve
 * @param extracted         candidates produced by all strategies before merging
 * @param duplicatesRemoved candidates dropped because an earlier one had the same normalized key
 * @param excluded          candidates dropped by the exclusion list
 * @param rejected          candidates dropped because their name was unusable
 * @param truncated         candidates dropped by the candidate limit
 * @param queriesIssued     web search queries issued
 * @param queriesFailed     web search queries that failed
 * @param strategyFailures  strategy id to failure reason, for strategies that produced nothing
 */
public record CandidateSet(List<DiscoveryCandidate> candidates, int extracted, int duplicatesRemoved,
                           int excluded, int rejected, int truncated, int queriesIssued, int queriesFailed,
                           Map<String, String> strategyFailures) {

    public CandidateSet {
        candidates = List.copyOf(candidates);
        strategyFailures = Map.copyOf(strategyFailures);
    }

    /**
     * True when a strategy or query failed, so the candidates may be incomplete.
     */
    public boolean isPartial() {
        return !strategyFailures.isEmpty() || queriesFailed > 0;
    }
}
