package com.talent.sourcing.session;

import com.talent.sourcing.query.QueryTree;

import java.time.Instant;
import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Deque;
import java.util.HashSet;
import java.util.List;
import java.util.Set;

/**
 * Cursor state of one person search. The compiled query never changes; everything else is
 * mutated only by {@link SessionManager} while holding the session's monitor.
 */
public class SearchSession {

    private final String sessionId;
    private final QueryTree query;
    private final String queryJson;
    private final Instant createdAt;

    private Instant expiresAt;
    private SessionState state = SessionState.CREATED;
    private int cursor;
    private long rawFetched;
    private int pageLength;
    private long totalEstimate = SearchPage.UNKNOWN_TOTAL;
    private long returnedCount;
    private boolean backendExhausted;
    private boolean bypassPageCache;
    private final Set<String> seenRecordIds = new HashSet<>();
    private final Deque<PersonRecord> buffer = new ArrayDeque<>();

    SearchSession(String sessionId, QueryTree query, Instant createdAt, Instant expiresAt) {
        this.sessionId = sessionId;
        this.query = query;
        this.queryJson = query.toJsonString();
        this.createdAt = createdAt;
        this.expiresAt = expiresAt;
    }

    public String getSessionId() {
        return sessionId;
    }

    public QueryTree getQuery() {
        return query;
    }

    public String getQueryJson() {
        return queryJson;
    }

    public Instant getCreatedAt() {
        return createdAt;
    }

    public synchronized Instant getExpiresAt() {
        return expiresAt;
    }

    public synchronized SessionState getState() {
        return state;
    }

    /**
     * Last backend page fetched; 0 before the first fetch.
     */
    public synchronized int getCursor() {
        return cursor;
    }

    public synchronized long getTotalEstimate() {
        return totalEstimate;
    }

    public synchronized long getReturnedCount() {
        return returnedCount;
    }

    public synchronized int getSeenCount() {
        return seenRecordIds.size();
    }

    public synchronized boolean isExpired(Instant now) {
        return state == SessionState.EXPIRED || !now.isBefore(expiresAt);
    }

    synchronized void setState(SessionState state) {
        this.state = state;
    }

    synchronized boolean isBackendExhausted() {
        return backendExhausted;
    }

    synchronized boolean isBypassPageCache() {
        return bypassPageCache;
    }

    synchronized boolean hasBuffered() {
        return !buffer.isEmpty();
    }

    /**
     * Records a fetched page: advances the cursor and buffers records not seen before.
     *
     * <p>The backend may serve a fixed page length regardless of the size requested, so a page
     * counts as short only against the longest page this session has seen. Counts use the raw
     * item count, so items dropped while parsing neither shorten a page nor hide the total.</p>
     *
     * @return number of new unique records
     */
    synchronized int acceptPage(int page, SearchPage result, int maxPages) {
        cursor = page;
        int rawSize = result.rawSize();
        boolean shortPage = rawSize == 0 || rawSize < pageLength;
        pageLength = Math.max(pageLength, rawSize);
        rawFetched += rawSize;
        if (result.hasTotalEstimate()) {
            totalEstimate = result.totalEstimate();
        }
        int added = 0;
        for (PersonRecord record : result.records()) {
            if (seenRecordIds.add(record.recordId())) {
                buffer.addLast(record);
                added++;
            }
        }
        backendExhausted = shortPage
                || (totalEstimate >= 0 && rawFetched >= totalEstimate)
                || cursor >= maxPages;
        return added;
    }

    synchronized List<PersonRecord> drain(int max) {
        List<PersonRecord> out = new ArrayList<>(Math.min(max, buffer.size()));
        while (out.size() < max && !buffer.isEmpty()) {
            out.add(buffer.pollFirst());
        }
        returnedCount += out.size();
        return out;
    }

    /**
     * Forgets all cursor state so the query runs again from page 1 without the page cache.
     */
    synchronized void reset(Instant newExpiry) {
        expiresAt = newExpiry;
        state = SessionState.CREATED;
        cursor = 0;
        rawFetched = 0;
        pageLength = 0;
        totalEstimate = SearchPage.UNKNOWN_TOTAL;
        returnedCount = 0;
        backendExhausted = false;
        bypassPageCache = true;
        seenRecordIds.clear();
        buffer.clear();
    }
}
