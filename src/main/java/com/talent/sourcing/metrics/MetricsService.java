package com.talent.sourcing.metrics;

import java.time.Duration;

/**
 * Interface for recording sourcing pipeline metrics.
 * The default {@link NoOpMetricsService} does nothing, so the pipeline runs
 * without a metrics registry wired in.
 *
 * <p>Cache tiers are identified by {@link #LOOKUP_TIER} and {@link #PROFILE_TIER}.</p>
 */
public interface MetricsService {

    String LOOKUP_TIER = "lookup";
    String PROFILE_TIER = "profile";

    void recordCacheHit(String tier);

    void recordCacheMiss(String tier);

    void recordNegativeCacheHit();

    void recordCacheError(String tier);

    void recordCacheWriteFailure(String tier);

    void recordCoalescedRequest(String tier);

    void recordExternalCall(String endpoint, String outcome, Duration duration);

    void recordRetry(String operation);

    void recordStageDuration(String stage, Duration duration);

    void incrementUnscored(int count);

    void recordPageFetched(int newRecords);
}
