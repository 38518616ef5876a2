package com.talent.sourcing.discovery;

import java.time.Duration;

/**
 * Limits applied by the discovery strategies and the aggregator.
 *
 * @param maxSeeds                  seeds broadened by seed expansion (K)
 * @param maxKeywordQueries         planned keyword queries actually issued (M)
 * @param resultsPerQuery           web results requested per query
 * @param maxCandidatesPerResultSet candidates kept from one query's results
 * @param maxCandidates             unique candidates passed on to resolution
 * @param strategyConcurrency       strategies running at once
 * @param strategyTimeout           time after which a running strategy is abandoned
 * @param enrichProfiles            whether resolved entities get their profiles fetched for metadata
 */
public record DiscoveryOptions(int maxSeeds, int maxKeywordQueries, int resultsPerQuery,
                               int maxCandidatesPerResultSet, int maxCandidates, int strategyConcurrency,
                               Duration strategyTimeout, boolean enrichProfiles) {

    public DiscoveryOptions {
        if (maxSeeds < 0) {
            throw new IllegalArgumentException("maxSeeds must be >= 0");
        }
        if (maxKeywordQueries < 0) {
            throw new IllegalArgumentException("maxKeywordQueries must be >= 0");
        }
        if (resultsPerQuery < 1 || maxCandidatesPerResultSet < 1 || maxCandidates < 1) {
            throw new IllegalArgumentException("result and candidate limits must be >= 1");
        }
        if (strategyConcurrency < 1) {
            throw new IllegalArgumentException("strategyConcurrency must be >= 1");
        }
        if (strategyTimeout == null || strategyTimeout.isNegative() || strategyTimeout.isZero()) {
            throw new IllegalArgumentException("strategyTimeout must be > 0");
        }
    }

    /**
     * Defaults: 3 seeds, 5 keyword queries, 10 results per query, 20 candidates per result set,
     * 100 candidates overall, 2 concurrent strategies, 2 minute strategy timeout, profile enrichment off.
     */
    public static DiscoveryOptions defaults() {
        return new DiscoveryOptions(3, 5, 10, 20, 100, 2, Duration.ofMinutes(2), false);
    }

    public DiscoveryOptions withEnrichProfiles(boolean enabled) {
        return new DiscoveryOptions(maxSeeds, maxKeywordQueries, resultsPerQuery, maxCandidatesPerResultSet,
                maxCandidates, strategyConcurrency, strategyTimeout, enabled);
    }

    public DiscoveryOptions withMaxCandidates(int limit) {
        return new DiscoveryOptions(maxSeeds, maxKeywordQueries, resultsPerQuery, maxCandidatesPerResultSet,
                limit, strategyConcurrency, strategyTimeout, enrichProfiles);
    }

    public DiscoveryOptions withStrategyTimeout(Duration timeout) {
        return new DiscoveryOptions(maxSeeds, maxKeywordQueries, resultsPerQuery, maxCandidatesPerResultSet,
                maxCandidates, strategyConcurrency, timeout, enrichProfiles);
    }
}
