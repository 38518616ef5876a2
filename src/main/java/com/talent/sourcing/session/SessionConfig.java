package com.talent.sourcing.session;

import java.time.Duration;

/**
 * Configuration for search sessions.
 *
 * @param pageSize            records requested per backend page
 * @param ttl                 session lifetime, extended by a refresh
 * @param minRequestInterval  minimum delay between consecutive backend calls
 * @param maxPages            backend pages a session may fetch before it counts as exhausted
 * @param pageCacheTtl        how long fetched pages are reused across sessions
 * @param pageCacheMaxEntries maximum cached pages
 */
public record SessionConfig(int pageSize, Duration ttl, Duration minRequestInterval, int maxPages,
                            Duration pageCacheTtl, long pageCacheMaxEntries) {

    public SessionConfig {
        if (pageSize < 1) {
            throw new IllegalArgumentException("pageSize must be >= 1");
        }
        if (ttl == null || ttl.isNegative() || ttl.isZero()) {
            throw new IllegalArgumentException("ttl must be > 0");
        }
        if (minRequestInterval == null || minRequestInterval.isNegative()) {
            throw new IllegalArgumentException("minRequestInterval must be >= 0");
        }
        if (maxPages < 1) {
            throw new IllegalArgumentException("maxPages must be >= 1");
        }
        if (pageCacheTtl == null || pageCacheTtl.isNegative() || pageCacheTtl.isZero()) {
            throw new IllegalArgumentException("pageCacheTtl must be > 0");
        }
        if (pageCacheMaxEntries < 1) {
            throw new IllegalArgumentException("pageCacheMaxEntries must be >= 1");
        }
    }

    /**
     * Pages of 20, 24 hour sessions, 1 second between backend calls, 5 pages, pages cached for 1 hour.
     */
    public static SessionConfig defaults() {
        return new SessionConfig(20, Duration.ofHours(24), Duration.ofSeconds(1), 5, Duration.ofHours(1), 1_000);
    }

    public SessionConfig withMaxPages(int pages) {
        return new SessionConfig(pageSize, ttl, minRequestInterval, pages, pageCacheTtl, pageCacheMaxEntries);
    }

    public SessionConfig withPageSize(int size) {
        return new SessionConfig(size, ttl, minRequestInterval, maxPages, pageCacheTtl, pageCacheMaxEntries);
    }
}
