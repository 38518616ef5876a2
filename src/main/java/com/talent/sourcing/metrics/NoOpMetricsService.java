package com.talent.sourcing.metrics;

import java.time.Duration;

/**
 * No-op implementation of {@link MetricsService}.
 */
public class NoOpMetricsService implements MetricsService {

    @Override
    public void recordCacheHit(String tier) {
    }

    @Override
    public void recordCacheMiss(String tier) {
    }

    @Override
    public void recordNegativeCacheHit() {
    }

    @Override
    public void recordCacheError(String tier) {
    }

    @Override
    public void recordCacheWriteFailure(String tier) {
    }

    @Override
    public void recordCoalescedRequest(String tier) {
    }

    @Override
    public void recordExternalCall(String endpoint, String outcome, Duration duration) {
    }

    @Override
    public void recordRetry(String operation) {
    }

    @Override
    public void recordStageDuration(String stage, Duration duration) {
    }

    @Override
    public void incrementUnscored(int count) {
    }

    @Override
    public void recordPageFetched(int newRecords) {
    }
}
