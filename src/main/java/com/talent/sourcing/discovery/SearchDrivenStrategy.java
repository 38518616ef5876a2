package com.talent.sourcing.discovery;

import com.talent.sourcing.core.model.DiscoverySource;
import com.talent.sourcing.external.ExternalCallException;
import com.talent.sourcing.external.RetryExecutor;
import com.talent.sourcing.progress.CancellationToken;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.List;

/**
 * Base for strategies that issue web search queries and extract candidates from the hits.
 * A failed query is logged and counted; the remaining queries still run.
 */
public abstract class SearchDrivenStrategy implements DiscoveryStrategy {
    private static final Logger log = LoggerFactory.getLogger(SearchDrivenStrategy.class);

    protected final WebSearchClient searchClient;
    protected final CandidateExtractor extractor;
    protected final RetryExecutor retryExecutor;
    protected final DiscoveryOptions options;

    protected SearchDrivenStrategy(WebSearchClient searchClient, CandidateExtractor extractor,
                                   RetryExecutor retryExecutor, DiscoveryOptions options) {
        this.searchClient = searchClient;
        this.extractor = extractor;
        this.retryExecutor = retryExecutor;
        this.options = options;
    }

    protected StrategyResult runQueries(List<String> queries, DiscoverySource source,
                                        List<DiscoveryCandidate> leading, CancellationToken token) {
        List<DiscoveryCandidate> candidates = new ArrayList<>(leading);
        int issued = 0;
        int failed = 0;
        for (String query : queries) {
            token.throwIfCancelled();
            issued++;
            try {
                List<WebSearchHit> hits = retryExecutor.execute(searchClient.endpointName(),
                        () -> searchClient.search(query, options.resultsPerQuery()));
                List<DiscoveryCandidate> extracted = extractor.extract(hits, source, query);
                log.debug("discovery.queryCompleted strategy={} query='{}' hits={} candidates={}",
                        id(), query, hits.size(), extracted.size());
                candidates.addAll(extracted);
            } catch (ExternalCallException e) {
                failed++;
                log.warn("discovery.queryFailed strategy={} query='{}' retryable={} error={}",
                        id(), query, e.isRetryable(), e.getMessage());
            }
        }
        return new StrategyResult(id(), candidates, issued, failed);
    }
}
