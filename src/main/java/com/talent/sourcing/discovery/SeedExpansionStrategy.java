package com.talent.sourcing.discovery;

import com.talent.sourcing.core.model.DiscoverySource;
import com.talent.sourcing.core.model.Provenance;
import com.talent.sourcing.core.model.Requirements;
import com.talent.sourcing.external.RetryExecutor;
import com.talent.sourcing.progress.CancellationToken;

import java.util.ArrayList;
import java.util.List;

/**
 * Emits the caller's seed organizations as MENTIONED candidates, then broadens the first
 * {@code maxSeeds} of them with similarity queries. Excluded seeds are dropped first.
 */
public class SeedExpansionStrategy extends SearchDrivenStrategy {

    public static final String ID = "seed-expansion";

    public SeedExpansionStrategy(WebSearchClient searchClient, CandidateExtractor extractor,
                                 RetryExecutor retryExecutor, DiscoveryOptions options) {
        super(searchClient, extractor, retryExecutor, options);
    }

    @Override
    public String id() {
        return ID;
    }

    @Override
    public StrategyResult discover(Requirements requirements, ExclusionFilter exclusions, CancellationToken token) {
        List<String> seeds = new ArrayList<>();
        for (String seed : requirements.getSeedEntities()) {
            if (!exclusions.isExcluded(seed)) {
                seeds.add(seed);
            }
        }

        List<DiscoveryCandidate> mentioned = new ArrayList<>();
        for (String seed : seeds) {
            mentioned.add(new DiscoveryCandidate(seed, null, Provenance.mentioned()));
        }

        List<String> queries = new ArrayList<>();
        for (String seed : seeds.subList(0, Math.min(options.maxSeeds(), seeds.size()))) {
            queries.add("companies similar to " + seed);
            queries.add(seed + " competitors alternatives");
        }
        return runQueries(queries, DiscoverySource.SEED_EXPANSION, mentioned, token);
    }
}
