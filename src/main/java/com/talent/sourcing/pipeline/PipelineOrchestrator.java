package com.talent.sourcing.pipeline;

import com.talent.sourcing.core.model.Entity;
import com.talent.sourcing.core.model.Requirements;
import com.talent.sourcing.discovery.CandidateSet;
import com.talent.sourcing.discovery.DiscoveryAggregator;
import com.talent.sourcing.discovery.DiscoveryResult;
import com.talent.sourcing.logging.LogContext;
import com.talent.sourcing.metrics.MetricsService;
import com.talent.sourcing.metrics.NoOpMetricsService;
import com.talent.sourcing.progress.CancellationToken;
import com.talent.sourcing.progress.PipelineCancelledException;
import com.talent.sourcing.progress.PipelineStage;
import com.talent.sourcing.progress.ProgressListener;
import com.talent.sourcing.progress.ProgressReporter;
import com.talent.sourcing.query.FilterRequest;
import com.talent.sourcing.query.KeywordExpression;
import com.talent.sourcing.query.QueryCompiler;
import com.talent.sourcing.query.QueryTree;
import com.talent.sourcing.scoring.RelevanceScorer;
import com.talent.sourcing.scoring.ScoredResultSet;
import com.talent.sourcing.scoring.ScoringContext;
import com.talent.sourcing.session.SessionManager;
import com.talent.sourcing.session.SessionPage;
import com.talent.sourcing.tracing.NoOpTracingService;
import com.talent.sourcing.tracing.Span;
import com.talent.sourcing.tracing.TracingService;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Duration;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.concurrent.Executors;
import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.ScheduledFuture;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.function.Function;
import java.util.function.Supplier;

/**
 * Sequences discovery, resolution, scoring, query compilation and the first person-search
 * page, reporting each stage to a {@link ProgressListener}.
 *
 * <p>Usage:</p>
 * <pre>
 * PipelineOrchestrator pipeline = PipelineOrchestrator.builder()
 *     .aggregator(aggregator)
 *     .scorer(scorer)
 *     .sessionManager(sessions)
 *     .build();
 *
 * PipelineResult result = pipeline.run(requirements, event -> log.info("{}", event), CancellationToken.create());
 * </pre>
 *
 * <p>Cancellation is cooperative: stages check the token between units of work. A run that
 * exceeds {@link PipelineOptions#runTimeout()} has its token cancelled and fails with
 * {@link PipelineTimeoutException}.</p>
 */
public class PipelineOrchestrator implements AutoCloseable {
    private static final Logger log = LoggerFactory.getLogger(PipelineOrchestrator.class);

    private static final String TIMEOUT_REASON = "run deadline exceeded";

    private final DiscoveryAggregator aggregator;
    private final RelevanceScorer scorer;
    private final QueryCompiler compiler;
    private final SessionManager sessionManager;
    private final PipelineOptions options;
    private final MetricsService metrics;
    private final TracingService tracing;
    private final ScheduledExecutorService deadlines;

    private PipelineOrchestrator(Builder builder) {
        this.aggregator = Objects.requireNonNull(builder.aggregator, "aggregator is required");
        this.sessionManager = Objects.requireNonNull(builder.sessionManager, "sessionManager is required");
        this.scorer = builder.scorer;
        this.compiler = builder.compiler != null ? builder.compiler : new QueryCompiler();
        this.options = builder.options != null ? builder.options : PipelineOptions.defaults();
        this.metrics = builder.metrics != null ? builder.metrics : new NoOpMetricsService();
        this.tracing = builder.tracing != null ? builder.tracing : new NoOpTracingService();
        this.deadlines = Executors.newSingleThreadScheduledExecutor(r -> {
            Thread t = new Thread(r, "pipeline-deadline");
            t.setDaemon(true);
            return t;
        });
    }

    /**
     * Discovers, resolves and ranks organizations.
     *
     * @throws PipelineCancelledException if the token was cancelled
     */
    public DiscoveryOutcome discover(Requirements requirements, ProgressListener listener, CancellationToken token) {
        ProgressReporter reporter = new ProgressReporter(LogContext.generateId(), listener);
        try (LogContext ctx = LogContext.forRun(reporter.getRunId())) {
            return discover(requirements, reporter, tokenOrNew(token));
        }
    }

    /**
     * Builds the person search for the given organizations and returns its first page.
     *
     * @throws com.talent.sourcing.query.InvalidFilterException if no entity is resolved
     */
    public SessionPage searchPeople(List<Entity> selected, Requirements requirements, ProgressListener listener,
                                    CancellationToken token) {
        ProgressReporter reporter = new ProgressReporter(LogContext.generateId(), listener);
        try (LogContext ctx = LogContext.forRun(reporter.getRunId())) {
            CancellationToken cancellation = tokenOrNew(token);
            QueryTree query = compileQuery(selected, requirements, reporter);
            return sample(query, reporter, cancellation);
        }
    }

    /**
     * Full pipeline: discover, score, select the top resolved organizations, compile and
     * fetch the first page of people.
     *
     * @throws PipelineCancelledException if the caller cancelled the token
     * @throws PipelineTimeoutException   if the run deadline passed
     */
    public PipelineResult run(Requirements requirements, ProgressListener listener, CancellationToken token) {
        ProgressReporter reporter = new ProgressReporter(LogContext.generateId(), listener);
        CancellationToken cancellation = tokenOrNew(token);
        AtomicBoolean timedOut = new AtomicBoolean();
        ScheduledFuture<?> deadline = deadlines.schedule(() -> {
            timedOut.set(true);
            cancellation.cancel(TIMEOUT_REASON);
        }, options.runTimeout().toMillis(), TimeUnit.MILLISECONDS);

        try (LogContext ctx = LogContext.forRun(reporter.getRunId())) {
            log.info("pipeline.started runId={} requirements={}", reporter.getRunId(), requirements);
            DiscoveryOutcome outcome = discover(requirements, reporter, cancellation);
            List<Entity> selected = select(outcome.ranking());
            if (selected.isEmpty()) {
                String reason = "no resolved organizations";
                reporter.skipped(PipelineStage.QUERY, reason);
                reporter.skipped(PipelineStage.SAMPLING, reason);
                log.warn("pipeline.noPersonSearch runId={} reason={}", reporter.getRunId(), reason);
                return new PipelineResult(outcome, selected, null, null);
            }
            cancellation.throwIfCancelled();
            QueryTree query = compileQuery(selected, requirements, reporter);
            SessionPage firstPage = sample(query, reporter, cancellation);
            log.info("pipeline.completed runId={} selected={} sessionId={} records={}",
                    reporter.getRunId(), selected.size(), firstPage.sessionId(), firstPage.records().size());
            return new PipelineResult(outcome, selected, query, firstPage);
        } catch (PipelineCancelledException e) {
            if (timedOut.get()) {
                throw new PipelineTimeoutException(reporter.getRunId(), options.runTimeout(), e);
            }
            throw e;
        } finally {
            deadline.cancel(false);
        }
    }

    public SessionPage loadMore(String sessionId, int count) {
        return sessionManager.loadMore(sessionId, count);
    }

    public SessionPage refresh(String sessionId) {
        return sessionManager.refresh(sessionId);
    }

    public SessionManager getSessionManager() {
        return sessionManager;
    }

    private DiscoveryOutcome discover(Requirements requirements, ProgressReporter reporter, CancellationToken token) {
        CandidateSet candidates = stage(PipelineStage.DISCOVERY, reporter,
                () -> aggregator.collectCandidates(requirements, token),
                set -> counts("candidates", set.candidates().size(),
                        "extracted", set.extracted(),
                        "duplicates", set.duplicatesRemoved(),
                        "excluded", set.excluded(),
                        "failedQueries", set.queriesFailed(),
                        "failedStrategies", set.strategyFailures().size()));
        token.throwIfCancelled();

        DiscoveryResult discovery = stage(PipelineStage.RESOLUTION, reporter,
                () -> aggregator.resolveCandidates(candidates, reporter.callbackFor(PipelineStage.RESOLUTION), token),
                result -> counts("resolved", result.resolution().success(),
                        "notFound", result.resolution().notFound(),
                        "failed", result.resolution().failed(),
                        "cacheHits", result.cacheHits(),
                        "cacheMisses", result.cacheMisses()));
        token.throwIfCancelled();

        ScoredResultSet ranking = score(requirements, discovery.entities(), reporter, token);
        return new DiscoveryOutcome(reporter.getRunId(), discovery, ranking);
    }

    private ScoredResultSet score(Requirements requirements, List<Entity> entities, ProgressReporter reporter,
                                  CancellationToken token) {
        String skipReason = null;
        if (!options.scoringEnabled()) {
            skipReason = "scoring disabled";
        } else if (scorer == null || !scorer.isAvailable()) {
            skipReason = "classifier unavailable";
        } else if (entities.isEmpty()) {
            skipReason = "nothing to score";
        }
        if (skipReason != null) {
            reporter.skipped(PipelineStage.SCORING, skipReason);
            metrics.incrementUnscored(entities.size());
            log.info("scoring.skipped runId={} reason={} entities={}", reporter.getRunId(), skipReason, entities.size());
            return ScoredResultSet.skipped(entities, skipReason);
        }
        ScoringContext context = ScoringContext.from(requirements);
        return stage(PipelineStage.SCORING, reporter,
                () -> scorer.score(entities, context, reporter.callbackFor(PipelineStage.SCORING), token),
                set -> counts("scored", set.scoredCount(), "unscored", set.unscoredCount()));
    }

    private List<Entity> select(ScoredResultSet ranking) {
        List<Entity> selected = new ArrayList<>();
        for (Entity entity : ranking.entities()) {
            if (entity.isResolved()) {
                selected.add(entity);
                if (selected.size() == options.maxSelectedEntities()) {
                    break;
                }
            }
        }
        return selected;
    }

    private QueryTree compileQuery(List<Entity> selected, Requirements requirements, ProgressReporter reporter) {
        return stage(PipelineStage.QUERY, reporter, () -> {
            List<String> ids = new ArrayList<>();
            for (Entity entity : selected) {
                entity.getStableId().ifPresent(ids::add);
            }
            List<String> titleTerms = new ArrayList<>();
            titleTerms.add(requirements.getRoleTitle());
            titleTerms.addAll(requirements.getMustHave());
            FilterRequest filter = FilterRequest.builder()
                    .requiredEntityIds(ids)
                    .keyword(KeywordExpression.anyOf(titleTerms), options.keywordRequired())
                    .location(requirements.getLocation(), options.locationRequired())
                    .build();
            return compiler.compile(filter);
        }, tree -> counts("entities", selected.size()));
    }

    private SessionPage sample(QueryTree query, ProgressReporter reporter, CancellationToken token) {
        token.throwIfCancelled();
        return stage(PipelineStage.SAMPLING, reporter,
                () -> sessionManager.createSession(query),
                page -> counts("records", page.records().size(),
                        "totalEstimate", page.totalEstimate(),
                        "hasMore", page.hasMore() ? 1 : 0,
                        "failedPages", page.failedPages()));
    }

    private <T> T stage(PipelineStage stage, ProgressReporter reporter, Supplier<T> body,
                        Function<T, Map<String, Long>> completedCounts) {
        reporter.started(stage, Map.of());
        long start = System.nanoTime();
        try (LogContext ctx = LogContext.forStage(reporter.getRunId(), stage.name());
             Span span = tracing.startStageSpan(stage.name(), reporter.getRunId())) {
            try {
                T result = body.get();
                Map<String, Long> counts = completedCounts.apply(result);
                counts.forEach((key, value) -> span.setAttribute(key, value.longValue()));
                span.setStatus(Span.SpanStatus.OK);
                reporter.completed(stage, counts);
                log.info("stage.completed stage={} counts={}", stage, counts);
                return result;
            } catch (PipelineCancelledException e) {
                span.setStatus(Span.SpanStatus.ERROR);
                reporter.failed(stage, "cancelled: " + e.getMessage());
                log.info("stage.cancelled stage={} reason={}", stage, e.getMessage());
                throw e;
            } catch (RuntimeException e) {
                span.fail(e);
                reporter.failed(stage, e.getMessage());
                log.error("stage.failed stage={} error={}", stage, e.getMessage(), e);
                throw e;
            }
        } finally {
            metrics.recordStageDuration(stage.name(), Duration.ofNanos(System.nanoTime() - start));
        }
    }

    private static Map<String, Long> counts(Object... pairs) {
        Map<String, Long> counts = new LinkedHashMap<>();
        for (int i = 0; i < pairs.length; i += 2) {
            counts.put((String) pairs[i], ((Number) pairs[i + 1]).longValue());
        }
        return counts;
    }

    private static CancellationToken tokenOrNew(CancellationToken token) {
        return token != null ? token : CancellationToken.create();
    }

    @Override
    public void close() {
        deadlines.shutdownNow();
    }

    public static Builder builder() {
        return new Builder();
    }

    public static class Builder {
        private DiscoveryAggregator aggregator;
        private RelevanceScorer scorer;
        private QueryCompiler compiler;
        private SessionManager sessionManager;
        private PipelineOptions options;
        private MetricsService metrics;
        private TracingService tracing;

        public Builder aggregator(DiscoveryAggregator aggregator) {
            this.aggregator = aggregator;
            return this;
        }

        /**
         * Optional; without a scorer the scoring stage is always skipped.
         */
        public Builder scorer(RelevanceScorer scorer) {
            this.scorer = scorer;
            return this;
        }

        public Builder compiler(QueryCompiler compiler) {
            this.compiler = compiler;
            return this;
        }

        public Builder sessionManager(SessionManager sessionManager) {
            this.sessionManager = sessionManager;
            return this;
        }

        public Builder options(PipelineOptions options) {
            this.options = options;
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

        public PipelineOrchestrator build() {
            return new PipelineOrchestrator(this);
        }
    }
}
