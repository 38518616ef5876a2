package com.talent.sourcing.scoring;

import com.talent.sourcing.core.model.Entity;
import com.talent.sourcing.external.ExternalCallException;
import com.talent.sourcing.external.RetryExecutor;
import com.talent.sourcing.metrics.MetricsService;
import com.talent.sourcing.metrics.NoOpMetricsService;
import com.talent.sourcing.progress.CancellationToken;
import com.talent.sourcing.progress.PipelineCancelledException;
import com.talent.sourcing.progress.ProgressCallback;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CompletionException;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicInteger;

/**
 * Attaches classifier scores to entities in fixed-size batches.
 *
 * <p>A batch whose classifier call fails leaves all of its entities unscored; an entity the
 * parser cannot read is unscored on its own. No entity ever receives a placeholder score.</p>
 */
public class RelevanceScorer implements AutoCloseable {
    private static final Logger log = LoggerFactory.getLogger(RelevanceScorer.class);

    private final RelevanceClassifier classifier;
    private final ScoreResponseParser parser;
    private final RetryExecutor retryExecutor;
    private final ScoringOptions options;
    private final MetricsService metrics;
    private final ExecutorService executor;

    public RelevanceScorer(RelevanceClassifier classifier, ScoreResponseParser parser, RetryExecutor retryExecutor,
                           ScoringOptions options, MetricsService metrics) {
        this.classifier = classifier;
        this.parser = parser;
        this.retryExecutor = retryExecutor;
        this.options = options != null ? options : ScoringOptions.defaults();
        this.metrics = metrics != null ? metrics : new NoOpMetricsService();
        AtomicInteger threadCount = new AtomicInteger();
        this.executor = Executors.newFixedThreadPool(this.options.concurrency(), r -> {
            Thread t = new Thread(r, "scoring-worker-" + threadCount.incrementAndGet());
            t.setDaemon(true);
            return t;
        });
    }

    public boolean isAvailable() {
        return classifier.isAvailable();
    }

    /**
     * Scores entities given in discovery order.
     *
     * @throws PipelineCancelledException if the token was cancelled
     */
    public ScoredResultSet score(List<Entity> entities, ScoringContext context, ProgressCallback progress,
                                 CancellationToken token) {
        if (entities.isEmpty()) {
            return ScoredResultSet.rank(entities);
        }
        if (!classifier.isAvailable()) {
            log.warn("scoring.skipped provider={} reason=unavailable entities={}",
                    classifier.getProviderName(), entities.size());
            metrics.incrementUnscored(entities.size());
            return ScoredResultSet.skipped(entities, "classifier unavailable");
        }
        ProgressCallback callback = ProgressCallback.orNoop(progress);
        CancellationToken cancellation = token != null ? token : CancellationToken.create();
        int total = entities.size();
        Object progressLock = new Object();
        int[] processed = {0};

        List<CompletableFuture<List<Entity>>> futures = new ArrayList<>();
        for (int start = 0; start < total; start += options.batchSize()) {
            List<Entity> batch = entities.subList(start, Math.min(total, start + options.batchSize()));
            futures.add(CompletableFuture.supplyAsync(() -> {
                cancellation.throwIfCancelled();
                List<Entity> scored = scoreBatch(batch, context);
                synchronized (progressLock) {
                    processed[0] += batch.size();
                    callback.onProgress(processed[0], total, null);
                }
                return scored;
            }, executor));
        }

        List<Entity> results = new ArrayList<>(total);
        for (CompletableFuture<List<Entity>> future : futures) {
            try {
                results.addAll(future.join());
            } catch (CompletionException e) {
                if (e.getCause() instanceof PipelineCancelledException pce) {
                    futures.forEach(f -> f.cancel(false));
                    throw pce;
                }
                throw e;
            }
        }

        ScoredResultSet ranked = ScoredResultSet.rank(results);
        metrics.incrementUnscored(ranked.unscoredCount());
        log.info("scoring.completed provider={} entities={} scored={} unscored={}",
                classifier.getProviderName(), total, ranked.scoredCount(), ranked.unscoredCount());
        return ranked;
    }

    List<Entity> scoreBatch(List<Entity> batch, ScoringContext context) {
        ClassificationRequest request = new ClassificationRequest(context, batch,
                options.minScore(), options.maxScore());
        String raw;
        try {
            raw = retryExecutor.execute("relevance-classifier", () -> classifier.classify(request));
        } catch (ExternalCallException e) {
            log.warn("scoring.batchFailed size={} retryable={} error={}", batch.size(), e.isRetryable(), e.getMessage());
            List<Entity> unscored = new ArrayList<>(batch.size());
            for (Entity entity : batch) {
                unscored.add(entity.withoutScore("classifier call failed: " + e.getMessage()));
            }
            return unscored;
        }

        List<ParsedScore> parsed = parser.parse(raw, batch);
        List<Entity> result = new ArrayList<>(batch.size());
        int failures = 0;
        for (int i = 0; i < batch.size(); i++) {
            ParsedScore score = parsed.get(i);
            if (score.parseFailed()) {
                failures++;
                result.add(batch.get(i).withoutScore(score.failureReason()));
            } else {
                result.add(batch.get(i).withScore(score.score(), score.rationale()));
            }
        }
        if (failures > 0) {
            log.info("scoring.partialBatch size={} unparsed={}", batch.size(), failures);
        }
        return result;
    }

    @Override
    public void close() {
        executor.shutdown();
        try {
            if (!executor.awaitTermination(5, TimeUnit.SECONDS)) {
                executor.shutdownNow();
            }
        } catch (InterruptedException e) {
            executor.shutdownNow();
            Thread.currentThread().interrupt();
        }
    }
}
