package com.talent.sourcing.session;

import com.github.benmanes.caffeine.cache.Cache;
import com.github.benmanes.caffeine.cache.Caffeine;
import com.github.benmanes.caffeine.cache.Ticker;

import java.util.Optional;

/**
 * Caffeine cache of backend pages keyed by compiled query, page number and page size,
 * so identical searches in different sessions do not pay for the same page twice.
 */
public class SearchPageCache {

    private final Cache<PageKey, SearchPage> pages;

    public SearchPageCache(SessionConfig config) {
        this(config, Ticker.systemTicker());
    }

    public SearchPageCache(SessionConfig config, Ticker ticker) {
        this.pages = Caffeine.newBuilder()
                .maximumSize(config.pageCacheMaxEntries())
                .expireAfterWrite(config.pageCacheTtl())
                .ticker(ticker)
                .build();
    }

    public Optional<SearchPage> get(String queryJson, int page, int pageSize) {
        return Optional.ofNullable(pages.getIfPresent(new PageKey(queryJson, page, pageSize)));
    }

    public void put(String queryJson, int page, int pageSize, SearchPage result) {
        pages.put(new PageKey(queryJson, page, pageSize), result);
    }

    public long size() {
        pages.cleanUp();
        return pages.estimatedSize();
    }

    private record PageKey(String queryJson, int page, int pageSize) {
    }
}
