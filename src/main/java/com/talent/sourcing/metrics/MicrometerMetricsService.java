package com.talent.sourcing.metrics;

import io.micrometer.core.instrument.Counter;
import io.micrometer.core.instrument.DistributionSummary;
import io.micrometer.core.instrument.MeterRegistry;
import io.micrometer.core.instrument.Timer;

import java.time.Duration;
import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;

/**
 * Micrometer-based implementation of {@link MetricsService}.
 *
 * <p>Recorded metrics:</p>
 * <ul>
 *   <li>{@code sourcing.cache.hit} / {@code sourcing.cache.miss} / {@code sourcing.cache.error}
 *       / {@code sourcing.cache.write.failure} / {@code sourcing.cache.coalesced}: Counters (tag: tier)</li>
 *   <li>{@code sourcing.cache.negative.hit}: Counter</li>
 *   <li>{@code sourcing.external.call}: Timer (tags: endpoint, outcome)</li>
 *   <li>{@code sourcing.retry}: Counter (tag: operation)</li>
 *   <li>{@code sourcing.stage.duration}: Timer (tag: stage)</li>
 *   <li>{@code sourcing.scoring.unscored}: Counter</li>
 *   <li>{@code sourcing.session.page.records}: DistributionSummary of new unique records per page</li>
 * </ul>
 */
public class MicrometerMetricsService implements MetricsService {

    private final MeterRegistry registry;
    private final Map<String, Timer> timerCache = new ConcurrentHashMap<>();
    private final Map<String, Counter> counterCache = new ConcurrentHashMap<>();
    private final Counter negativeHitCounter;
    private final Counter unscoredCounter;
    private final DistributionSummary pageRecordsSummary;

    public MicrometerMetricsService(MeterRegistry registry) {
        this.registry = registry;
        this.negativeHitCounter = Counter.builder("sourcing.cache.negative.hit")
                .description("Lookups answered by a cached negative resolution")
                .register(registry);
        this.unscoredCounter = Counter.builder("sourcing.scoring.unscored")
                .description("Entities left without a relevance score")
                .register(registry);
        this.pageRecordsSummary = DistributionSummary.builder("sourcing.session.page.records")
                .description("New unique records per fetched page")
                .register(registry);
    }

    @Override
    public void recordCacheHit(String tier) {
        tierCounter("sourcing.cache.hit", "Resolution cache hits", tier).increment();
    }

    @Override
    public void recordCacheMiss(String tier) {
        tierCounter("sourcing.cache.miss", "Resolution cache misses", tier).increment();
    }

    @Override
    public void recordNegativeCacheHit() {
        negativeHitCounter.increment();
    }

    @Override
    public void recordCacheError(String tier) {
        tierCounter("sourcing.cache.error", "External failures while filling the cache", tier).increment();
    }

    @Override
    public void recordCacheWriteFailure(String tier) {
        tierCounter("sourcing.cache.write.failure", "Rejected cache writes", tier).increment();
    }

    @Override
    public void recordCoalescedRequest(String tier) {
        tierCounter("sourcing.cache.coalesced", "Requests served by another caller's in-flight call", tier)
                .increment();
    }

    @Override
    public void recordExternalCall(String endpoint, String outcome, Duration duration) {
        String key = "external:" + endpoint + ":" + outcome;
        Timer timer = timerCache.computeIfAbsent(key, k ->
                Timer.builder("sourcing.external.call")
                        .description("Duration of third-party calls")
                        .tag("endpoint", endpoint)
                        .tag("outcome", outcome)
                        .register(registry));
        timer.record(duration);
    }

    @Override
    public void recordRetry(String operation) {
        String key = "retry:" + operation;
        Counter counter = counterCache.computeIfAbsent(key, k ->
                Counter.builder("sourcing.retry")
                        .description("Retried external calls")
                        .tag("operation", operation)
                        .register(registry));
        counter.increment();
    }

    @Override
    public void recordStageDuration(String stage, Duration duration) {
        String key = "stage:" + stage;
        Timer timer = timerCache.computeIfAbsent(key, k ->
                Timer.builder("sourcing.stage.duration")
                        .description("Duration of pipeline stages")
                        .tag("stage", stage)
                        .register(registry));
        timer.record(duration);
    }

    @Override
    public void incrementUnscored(int count) {
        unscoredCounter.increment(count);
    }

    @Override
    public void recordPageFetched(int newRecords) {
        pageRecordsSummary.record(newRecords);
    }

    private Counter tierCounter(String name, String description, String tier) {
        return counterCache.computeIfAbsent(name + ":" + tier, k ->
                Counter.builder(name)
                        .description(description)
                        .tag("tier", tier)
                        .register(registry));
    }
}
