package com.talent.sourcing.session;

import com.talent.sourcing.query.QueryTree;

/**
 * The external person-search backend that evaluates compiled queries.
 */
public interface SearchBackend {

    /**
     * Fetches one page of results.
     *
     * @param page     1-based page number
     * @param pageSize records requested per page; a backend with a fixed page length may ignore it
     * @throws com.talent.sourcing.external.ExternalTransientException on network errors and throttling
     * @throws com.talent.sourcing.external.ExternalPermanentException when the backend rejects the query
     */
    SearchPage fetchPage(QueryTree query, int page, int pageSize);

    String endpointName();
}
