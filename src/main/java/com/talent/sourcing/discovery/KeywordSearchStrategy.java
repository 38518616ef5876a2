package com.talent.sourcing.discovery;

import com.talent.sourcing.core.model.DiscoverySource;
import com.talent.sourcing.core.model.Requirements;
import com.talent.sourcing.external.RetryExecutor;
import com.talent.sourcing.progress.CancellationToken;

import java.util.ArrayList;
import java.util.List;

/**
 * Runs the top planned keyword queries. Lower-priority queries beyond
 * {@code maxKeywordQueries} are never issued.
 */
public class KeywordSearchStrategy extends SearchDrivenStrategy {

    public static final String ID = "keyword-search";

    private final SearchQueryPlanner planner;

    public KeywordSearchStrategy(WebSearchClient searchClient, CandidateExtractor extractor,
                                 RetryExecutor retryExecutor, SearchQueryPlanner planner,
                                 DiscoveryOptions options) {
        super(searchClient, extractor, retryExecutor, options);
        this.planner = planner;
    }

    @Override
    public String id() {
        return ID;
    }

    @Override
    public StrategyResult discover(Requirements requirements, ExclusionFilter exclusions, CancellationToken token) {
        List<PlannedQuery> planned = planner.plan(requirements, exclusions);
        List<String> queries = new ArrayList<>();
        for (PlannedQuery query : planned.subList(0, Math.min(options.maxKeywordQueries(), planned.size()))) {
            queries.add(query.query());
        }
        return runQueries(queries, DiscoverySource.KEYWORD_SEARCH, List.of(), token);
    }
}
