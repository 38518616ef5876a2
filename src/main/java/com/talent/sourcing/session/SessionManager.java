package com.talent.sourcing.session;

import com.talent.sourcing.external.EndpointThrottle;
import com.talent.sourcing.external.ExternalPermanentException;
import com.talent.sourcing.external.ExternalTransientException;
import com.talent.sourcing.external.RetryExecutor;
import com.talent.sourcing.external.RetryPolicy;
import com.talent.sourcing.logging.LogContext;
import com.talent.sourcing.metrics.MetricsService;
import com.talent.sourcing.metrics.NoOpMetricsService;
import com.talent.sourcing.query.QueryTree;
import com.talent.sourcing.tracing.NoOpTracingService;
import com.talent.sourcing.tracing.Span;
import com.talent.sourcing.tracing.TracingService;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Clock;
import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.Objects;
import java.util.Optional;

/**
 * Runs compiled person-search queries as resumable sessions.
 *
 * <p>Each session keeps a page cursor and the set of record identifiers already seen, so
 * repeated {@link #loadMore} calls never return a record twice. Backend calls are spaced by
 * the configured minimum interval and retried on transient failures. Calls on the same
 * session are serialized.</p>
 *
 * <pre>
 * SessionPage page = sessions.createSession(query);
 * while (page.hasMore()) {
 *     page = sessions.loadMore(page.sessionId(), 20);
 * }
 * </pre>
 */
public class SessionManager {
    private static final Logger log = LoggerFactory.getLogger(SessionManager.class);

    private final SearchBackend backend;
    private final SessionStore store;
    private final SessionConfig config;
    private final SearchPageCache pageCache;
    private final EndpointThrottle throttle;
    private final RetryExecutor retryExecutor;
    private final Clock clock;
    private final MetricsService metrics;
    private final TracingService tracing;

    private SessionManager(Builder builder) {
        this.backend = Objects.requireNonNull(builder.backend, "backend is required");
        this.config = builder.config != null ? builder.config : SessionConfig.defaults();
        this.store = builder.store != null ? builder.store : new InMemorySessionStore();
        this.pageCache = builder.pageCache != null ? builder.pageCache : new SearchPageCache(config);
        this.throttle = builder.throttle != null ? builder.throttle : new EndpointThrottle(config.minRequestInterval());
        this.retryExecutor = builder.retryExecutor != null
                ? builder.retryExecutor : new RetryExecutor(RetryPolicy.defaults());
        this.clock = builder.clock != null ? builder.clock : Clock.systemUTC();
        this.metrics = builder.metrics != null ? builder.metrics : new NoOpMetricsService();
        this.tracing = builder.tracing != null ? builder.tracing : new NoOpTracingService();
    }

    /**
     * Creates a session and returns its first page of records.
     *
     * @throws ExternalPermanentException if the backend rejects the query
     */
    public SessionPage createSession(QueryTree query) {
        Objects.requireNonNull(query, "query is required");
        Instant now = clock.instant();
        SearchSession session = new SearchSession(LogContext.generateId(), query, now, now.plus(config.ttl()));
        store.save(session);
        try (LogContext ctx = LogContext.forSession(session.getSessionId(), "create")) {
            log.info("session.created sessionId={} ttlHours={}", session.getSessionId(), config.ttl().toHours());
            return fetchInto(session, config.pageSize());
        }
    }

    /**
     * Returns up to {@code count} records not returned before by this session.
     *
     * @throws SessionNotFoundException if no such session exists
     * @throws SessionExpiredException  if the session outlived its TTL
     * @throws ExternalPermanentException if the backend rejects the query
     */
    public SessionPage loadMore(String sessionId, int count) {
        if (count < 1) {
            throw new IllegalArgumentException("count must be >= 1");
        }
        SearchSession session = require(sessionId);
        try (LogContext ctx = LogContext.forSession(sessionId, "loadMore")) {
            synchronized (session) {
                checkNotExpired(session);
                return fetchInto(session, count);
            }
        }
    }

    /**
     * Re-runs the query from page 1, bypassing cached pages, and extends the session's TTL.
     *
     * @throws SessionNotFoundException if no such session exists
     * @throws SessionExpiredException  if the session already expired
     */
    public SessionPage refresh(String sessionId) {
        SearchSession session = require(sessionId);
        try (LogContext ctx = LogContext.forSession(sessionId, "refresh")) {
            synchronized (session) {
                checkNotExpired(session);
                session.reset(clock.instant().plus(config.ttl()));
                log.info("session.refreshed sessionId={}", sessionId);
                return fetchInto(session, config.pageSize());
            }
        }
    }

    public Optional<SearchSession> find(String sessionId) {
        return store.find(sessionId);
    }

    /**
     * Removes every expired session.
     *
     * @return number of sessions removed
     */
    public int evictExpired() {
        Instant now = clock.instant();
        int evicted = 0;
        for (SearchSession session : store.all()) {
            if (session.isExpired(now)) {
                session.setState(SessionState.EXPIRED);
                store.remove(session.getSessionId());
                evicted++;
            }
        }
        if (evicted > 0) {
            log.info("session.evicted count={}", evicted);
        }
        return evicted;
    }

    public SessionConfig getConfig() {
        return config;
    }

    private SearchSession require(String sessionId) {
        return store.find(sessionId).orElseThrow(() -> new SessionNotFoundException(sessionId));
    }

    private void checkNotExpired(SearchSession session) {
        if (session.isExpired(clock.instant())) {
            session.setState(SessionState.EXPIRED);
            log.info("session.expired sessionId={}", session.getSessionId());
            throw new SessionExpiredException(session.getSessionId());
        }
    }

    private SessionPage fetchInto(SearchSession session, int count) {
        session.setState(SessionState.FETCHING);
        List<PersonRecord> out = new ArrayList<>(session.drain(count));
        int failedPages = 0;
        try {
            while (out.size() < count && !session.isBackendExhausted()) {
                int page = session.getCursor() + 1;
                SearchPage result;
                try {
                    result = fetchPage(session, page);
                } catch (ExternalTransientException e) {
                    failedPages++;
                    log.warn("session.pageFailed sessionId={} page={} error={}",
                            session.getSessionId(), page, e.getMessage());
                    break;
                }
                int added = session.acceptPage(page, result, config.maxPages());
                metrics.recordPageFetched(added);
                log.debug("session.pageFetched sessionId={} page={} records={} newRecords={} total={}",
                        session.getSessionId(), page, result.records().size(), added, result.totalEstimate());
                out.addAll(session.drain(count - out.size()));
            }
        } catch (ExternalPermanentException e) {
            log.error("session.queryRejected sessionId={} page={} status={} query={}",
                    session.getSessionId(), session.getCursor() + 1, e.getStatusCode(), session.getQueryJson(), e);
            session.setState(idleState(session));
            throw e;
        }

        boolean hasMore = idleState(session) == SessionState.IDLE_HAS_MORE;
        session.setState(idleState(session));
        log.info("session.loaded sessionId={} returned={} cumulative={} cursor={} hasMore={} failedPages={}",
                session.getSessionId(), out.size(), session.getReturnedCount(), session.getCursor(),
                hasMore, failedPages);
        return new SessionPage(session.getSessionId(), out, hasMore, session.getTotalEstimate(),
                session.getCursor(), session.getReturnedCount(), failedPages);
    }

    private SearchPage fetchPage(SearchSession session, int page) {
        if (!session.isBypassPageCache()) {
            Optional<SearchPage> cached = pageCache.get(session.getQueryJson(), page, config.pageSize());
            if (cached.isPresent()) {
                log.debug("session.pageCacheHit sessionId={} page={}", session.getSessionId(), page);
                return cached.get();
            }
        }
        SearchPage result = retryExecutor.execute(backend.endpointName(), () -> {
            throttle.acquire(backend.endpointName());
            try (Span span = tracing.startExternalCallSpan(backend.endpointName(), "fetchPage")) {
                span.setAttribute("page", page);
                try {
                    SearchPage fetched = backend.fetchPage(session.getQuery(), page, config.pageSize());
                    span.setAttribute("records", fetched.records().size());
                    span.setStatus(Span.SpanStatus.OK);
                    return fetched;
                } catch (RuntimeException e) {
                    span.fail(e);
                    throw e;
                }
            }
        });
        pageCache.put(session.getQueryJson(), page, config.pageSize(), result);
        return result;
    }

    private static SessionState idleState(SearchSession session) {
        return session.hasBuffered() || !session.isBackendExhausted()
                ? SessionState.IDLE_HAS_MORE
                : SessionState.IDLE_EXHAUSTED;
    }

    public static Builder builder() {
        return new Builder();
    }

    public static class Builder {
        private SearchBackend backend;
        private SessionStore store;
        private SessionConfig config;
        private SearchPageCache pageCache;
        private EndpointThrottle throttle;
        private RetryExecutor retryExecutor;
        private Clock clock;
        private MetricsService metrics;
        private TracingService tracing;

        public Builder backend(SearchBackend backend) {
            this.backend = backend;
            return this;
        }

        public Builder store(SessionStore store) {
            this.store = store;
            return this;
        }

        public Builder config(SessionConfig config) {
            this.config = config;
            return this;
        }

        public Builder pageCache(SearchPageCache pageCache) {
            this.pageCache = pageCache;
            return this;
        }

        /**
         * Throttle shared with other users of the same backend; defaults to one built from
         * {@link SessionConfig#minRequestInterval()}.
         */
        public Builder throttle(EndpointThrottle throttle) {
            this.throttle = throttle;
            return this;
        }

        public Builder retryExecutor(RetryExecutor retryExecutor) {
            this.retryExecutor = retryExecutor;
            return this;
        }

        public Builder clock(Clock clock) {
            this.clock = clock;
            return this;
        }

        public Builder metrics(MetricsService metrics) {
            this.metrics = metrics;
            return this;
        }

        public Builder tracing(TracingService tracing) {
            this.tracing = tracing;
            return this;
        }

        public SessionManager build() {
            return new SessionManager(this);
        }
    }
}
