package com.talent.sourcing.discovery;

import java.util.List;

/**
 * External text-search provider used by the discovery strategies.
 */
public interface WebSearchClient {

    /**
     * @throws com.talent.sourcing.external.ExternalTransientException on network errors and throttling
     * @throws com.talent.sourcing.external.ExternalPermanentException when the provider rejects the query
     */
    List<WebSearchHit> search(String query, int maxResults);

    String endpointName();
}
