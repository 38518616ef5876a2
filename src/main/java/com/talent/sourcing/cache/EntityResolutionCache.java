package com.talent.sourcing.cache;

import com.talent.sourcing.core.InputSanitizer;
import com.talent.sourcing.core.ValidationException;
import com.talent.sourcing.external.ExternalCallException;
import com.talent.sourcing.external.ExternalPermanentException;
import com.talent.sourcing.external.ExternalTransientException;
import com.talent.sourcing.external.RetryExecutor;
import com.talent.sourcing.external.RetryPolicy;
import com.talent.sourcing.lookup.CompanyLookupClient;
import com.talent.sourcing.lookup.LookupMatch;
import com.talent.sourcing.lookup.LookupRequest;
import com.talent.sourcing.lookup.LookupTier;
import com.talent.sourcing.lookup.ProfileClient;
import com.talent.sourcing.lookup.ProfilePayload;
import com.talent.sourcing.metrics.MetricsService;
import com.talent.sourcing.metrics.NoOpMetricsService;
import com.talent.sourcing.progress.CancellationToken;
import com.talent.sourcing.progress.PipelineCancelledException;
import com.talent.sourcing.progress.ProgressCallback;
import com.talent.sourcing.rules.NameNormalizer;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Clock;
import java.time.Instant;
import java.util.ArrayList;
import java.util.Collection;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CompletionException;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.concurrent.atomic.AtomicLong;

/**
 * Two-tier cache in front of the paid resolver and profile APIs.
 *
 * <p>Tier 1 maps normalized organization names to stable identifiers, including negative
 * entries for names that could not be resolved. Tier 2 maps stable identifiers to full
 * profiles and treats entries older than {@link CacheConfig#profileTtl()} as misses.
 * Concurrent requests for the same key share one external call.</p>
 *
 * <pre>
 * try (EntityResolutionCache cache = EntityResolutionCache.builder()
 *         .lookupClient(client)
 *         .profileClient(client)
 *         .build()) {
 *     ResolutionResult result = cache.resolve("Acme Corp");
 * }
 * </pre>
 */
public class EntityResolutionCache implements AutoCloseable {
    private static final Logger log = LoggerFactory.getLogger(EntityResolutionCache.class);

    private final CompanyLookupClient lookupClient;
    private final ProfileClient profileClient;
    private final LookupCacheStore lookupStore;
    private final ProfileCacheStore profileStore;
    private final NameNormalizer normalizer;
    private final RetryExecutor retry;
    private final CacheConfig config;
    private final List<LookupTier> tiers;
    private final Clock clock;
    private final MetricsService metrics;
    private final ExecutorService executor;

    private final InFlightRequests<String, ResolutionResult> lookupsInFlight = new InFlightRequests<>();
    private final InFlightRequests<String, ProfilePayload> profilesInFlight = new InFlightRequests<>();

    private final AtomicLong hits = new AtomicLong();
    private final AtomicLong misses = new AtomicLong();
    private final AtomicLong negativeHits = new AtomicLong();
    private final AtomicLong profileHits = new AtomicLong();
    private final AtomicLong profileMisses = new AtomicLong();
    private final AtomicLong errors = new AtomicLong();
    private final AtomicLong writeFailures = new AtomicLong();

    private EntityResolutionCache(Builder builder) {
        if (builder.lookupClient == null) {
            throw new IllegalArgumentException("lookupClient is required");
        }
        this.lookupClient = builder.lookupClient;
        this.profileClient = builder.profileClient;
        this.config = builder.config != null ? builder.config : CacheConfig.defaults();
        this.lookupStore = builder.lookupStore != null ? builder.lookupStore : new CaffeineLookupCacheStore(config);
        this.profileStore = builder.profileStore != null ? builder.profileStore : new CaffeineProfileCacheStore(config);
        this.normalizer = builder.normalizer != null ? builder.normalizer : NameNormalizer.withDefaultRules();
        this.metrics = builder.metrics != null ? builder.metrics : new NoOpMetricsService();
        this.retry = builder.retryExecutor != null ? builder.retryExecutor
                : new RetryExecutor(RetryPolicy.defaults());
        this.tiers = builder.tiers != null ? List.copyOf(builder.tiers) : List.of(LookupTier.values());
        this.clock = builder.clock != null ? builder.clock : Clock.systemUTC();
        AtomicInteger threadCount = new AtomicInteger();
        this.executor = Executors.newFixedThreadPool(config.batchConcurrency(), r -> {
            Thread t = new Thread(r, "resolution-worker-" + threadCount.incrementAndGet());
            t.setDaemon(true);
            return t;
        });
    }

    public ResolutionResult resolve(String name) {
        return resolve(name, null);
    }

    /**
     * Resolves a name to a stable identifier.
     *
     * @param name        raw organization name
     * @param websiteHint website seen next to the name, enabling the website tier; may be null
     * @throws ValidationException if the name is blank, too long, or normalizes to nothing
     */
    public ResolutionResult resolve(String name, String websiteHint) {
        InputSanitizer.validateEntityName(name);
        String key = normalizer.normalizeKey(name);
        if (key.isEmpty()) {
            throw new ValidationException("Entity name '" + name.strip() + "' has no usable characters");
        }

        Optional<ResolutionResult> cached = readLookup(key);
        if (cached.isPresent()) {
            return cached.get();
        }

        return lookupsInFlight.run(key, () -> {
            // A caller that finished just before this one may already have written the entry.
            Optional<ResolutionResult> again = readLookup(key);
            return again.orElseGet(() -> resolveExternally(new LookupRequest(name, websiteHint), key));
        }, () -> metrics.recordCoalescedRequest(MetricsService.LOOKUP_TIER));
    }

    /**
     * Resolves a batch with bounded concurrency. Each request is isolated: a rejected name
     * or a failed lookup is reported in the counts and never aborts the batch.
     *
     * @throws PipelineCancelledException if the token was cancelled before the batch finished
     */
    public BatchResolution resolveAll(List<LookupRequest> requests, ProgressCallback progress,
                                      CancellationToken token) {
        ProgressCallback callback = ProgressCallback.orNoop(progress);
        CancellationToken cancellation = token != null ? token : CancellationToken.create();
        int total = requests.size();
        Object progressLock = new Object();
        int[] completed = {0};

        List<CompletableFuture<ResolutionResult>> futures = new ArrayList<>(total);
        for (LookupRequest request : requests) {
            futures.add(CompletableFuture.supplyAsync(() -> {
                cancellation.throwIfCancelled();
                ResolutionResult result = resolveIsolated(request);
                synchronized (progressLock) {
                    completed[0]++;
                    callback.onProgress(completed[0], total, null);
                }
                return result;
            }, executor));
        }

        List<ResolutionResult> results = new ArrayList<>(total);
        for (CompletableFuture<ResolutionResult> future : futures) {
            try {
                results.add(future.join());
            } catch (CompletionException e) {
                if (e.getCause() instanceof PipelineCancelledException pce) {
                    futures.forEach(f -> f.cancel(false));
                    throw pce;
                }
                throw e;
            }
        }
        BatchResolution batch = BatchResolution.of(results);
        log.info("resolution.batchCompleted total={} success={} notFound={} failed={} rejected={} fromCache={}",
                batch.total(), batch.success(), batch.notFound(), batch.failed(), batch.rejected(),
                batch.fromCache());
        return batch;
    }

    /**
     * Returns the profile for a stable identifier, fetching it when absent or stale.
     *
     * @throws ExternalTransientException if the profile API kept failing
     * @throws ExternalPermanentException if the profile API rejected the request
     */
    public ProfilePayload fetchProfile(String stableId) {
        InputSanitizer.validateStableId(stableId);
        if (profileClient == null) {
            throw new IllegalStateException("No profile client configured");
        }
        Optional<ProfilePayload> cached = readProfile(stableId);
        if (cached.isPresent()) {
            return cached.get();
        }

        return profilesInFlight.run(stableId,
                () -> readProfile(stableId).orElseGet(() -> fetchProfileExternally(stableId)),
                () -> metrics.recordCoalescedRequest(MetricsService.PROFILE_TIER));
    }

    /**
     * Fetches profiles for a batch. Repeated identifiers are fetched once.
     */
    public ProfileBatchResult fetchProfiles(Collection<String> stableIds, CancellationToken token) {
        CancellationToken cancellation = token != null ? token : CancellationToken.create();
        Map<String, CompletableFuture<ProfilePayload>> futures = new LinkedHashMap<>();
        for (String id : new LinkedHashSet<>(stableIds)) {
            futures.put(id, CompletableFuture.supplyAsync(() -> {
                cancellation.throwIfCancelled();
                return fetchProfile(id);
            }, executor));
        }

        Map<String, ProfilePayload> profiles = new ConcurrentHashMap<>();
        Map<String, String> failures = new LinkedHashMap<>();
        for (Map.Entry<String, CompletableFuture<ProfilePayload>> entry : futures.entrySet()) {
            try {
                profiles.put(entry.getKey(), entry.getValue().join());
            } catch (CompletionException e) {
                Throwable cause = e.getCause();
                if (cause instanceof PipelineCancelledException pce) {
                    throw pce;
                }
                if (cause instanceof ExternalCallException || cause instanceof ValidationException) {
                    failures.put(entry.getKey(), cause.getMessage());
                } else {
                    throw e;
                }
            }
        }
        return new ProfileBatchResult(profiles, failures);
    }

    public CacheStats getStats() {
        return new CacheStats(hits.get(), misses.get(), negativeHits.get(), profileHits.get(),
                profileMisses.get(), errors.get(), writeFailures.get(),
                lookupsInFlight.coalescedCount() + profilesInFlight.coalescedCount());
    }

    public NameNormalizer getNormalizer() {
        return normalizer;
    }

    public CacheConfig getConfig() {
        return config;
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

    private ResolutionResult resolveIsolated(LookupRequest request) {
        try {
            return resolve(request.name(), request.websiteHint());
        } catch (ValidationException e) {
            log.debug("resolution.rejected name='{}' reason={}", request.name(), e.getMessage());
            return ResolutionResult.rejected(e.getMessage());
        } catch (RuntimeException e) {
            errors.incrementAndGet();
            log.error("resolution.unexpectedError name='{}' error={}", request.name(), e.getMessage(), e);
            return ResolutionResult.failed(normalizer.normalizeKey(request.name()), e.getMessage());
        }
    }

    private Optional<ResolutionResult> readLookup(String key) {
        Optional<LookupCacheEntry> entry = lookupStore.find(key);
        if (entry.isEmpty()) {
            return Optional.empty();
        }
        Instant now = clock.instant();
        if (entry.get().isExpired(now, config)) {
            log.debug("resolution.expired key={} negative={}", key, entry.get().isNegative());
            return Optional.empty();
        }
        hits.incrementAndGet();
        metrics.recordCacheHit(MetricsService.LOOKUP_TIER);
        if (entry.get().isNegative()) {
            negativeHits.incrementAndGet();
            metrics.recordNegativeCacheHit();
        }
        lookupStore.recordHit(key, now);
        return Optional.of(ResolutionResult.fromEntry(entry.get()));
    }

    private ResolutionResult resolveExternally(LookupRequest request, String key) {
        misses.incrementAndGet();
        metrics.recordCacheMiss(MetricsService.LOOKUP_TIER);

        for (LookupTier tier : tiers) {
            if (tier == LookupTier.WEBSITE && !request.hasWebsite()) {
                continue;
            }
            Optional<LookupMatch> match;
            try {
                match = retry.execute("lookup." + tier.name().toLowerCase(),
                        () -> lookupClient.lookup(request, tier));
            } catch (ExternalTransientException e) {
                errors.incrementAndGet();
                metrics.recordCacheError(MetricsService.LOOKUP_TIER);
                log.warn("resolution.failed key={} tier={} error={}", key, tier, e.getMessage());
                if (config.cacheNegatives()) {
                    write(LookupCacheEntry.negative(key, clock.instant()));
                }
                return ResolutionResult.failed(key, e.getMessage());
            } catch (ExternalPermanentException e) {
                errors.incrementAndGet();
                metrics.recordCacheError(MetricsService.LOOKUP_TIER);
                log.error("resolution.rejectedByResolver key={} tier={} status={} error={}",
                        key, tier, e.getStatusCode(), e.getMessage());
                return ResolutionResult.failed(key, e.getMessage());
            }

            if (match.isPresent()) {
                LookupMatch found = match.get();
                write(LookupCacheEntry.positive(key, found, clock.instant()));
                log.debug("resolution.resolved key={} stableId={} tier={} confidence={}",
                        key, found.stableId(), tier, found.confidence());
                return new ResolutionResult(key, found.stableId(), found.confidence(), tier,
                        found.metadata(), false, ResolutionStatus.RESOLVED, null);
            }
        }

        log.debug("resolution.notFound key={}", key);
        if (config.cacheNegatives()) {
            write(LookupCacheEntry.negative(key, clock.instant()));
        }
        return ResolutionResult.notFound(key);
    }

    private Optional<ProfilePayload> readProfile(String stableId) {
        Optional<ProfileCacheEntry> entry = profileStore.find(stableId);
        if (entry.isEmpty()) {
            return Optional.empty();
        }
        if (entry.get().isStale(clock.instant(), config.profileTtl())) {
            log.debug("profile.stale stableId={} lastFetchedAt={}", stableId, entry.get().lastFetchedAt());
            return Optional.empty();
        }
        profileHits.incrementAndGet();
        metrics.recordCacheHit(MetricsService.PROFILE_TIER);
        return Optional.of(entry.get().payload());
    }

    private ProfilePayload fetchProfileExternally(String stableId) {
        profileMisses.incrementAndGet();
        metrics.recordCacheMiss(MetricsService.PROFILE_TIER);
        ProfilePayload payload;
        try {
            payload = retry.execute("profile.fetch", () -> profileClient.fetchProfile(stableId));
        } catch (ExternalCallException e) {
            errors.incrementAndGet();
            metrics.recordCacheError(MetricsService.PROFILE_TIER);
            log.warn("profile.fetchFailed stableId={} retryable={} error={}",
                    stableId, e.isRetryable(), e.getMessage());
            throw e;
        }
        try {
            profileStore.upsert(new ProfileCacheEntry(stableId, payload, clock.instant()));
        } catch (CacheWriteException e) {
            recordWriteFailure(MetricsService.PROFILE_TIER, stableId, e);
        }
        return payload;
    }

    private void write(LookupCacheEntry entry) {
        try {
            lookupStore.upsert(entry);
        } catch (CacheWriteException e) {
            recordWriteFailure(MetricsService.LOOKUP_TIER, entry.normalizedKey(), e);
        }
    }

    private void recordWriteFailure(String tier, String key, CacheWriteException e) {
        writeFailures.incrementAndGet();
        metrics.recordCacheWriteFailure(tier);
        log.warn("cache.writeFailed tier={} key={} error={}", tier, key, e.getMessage());
    }

    public static Builder builder() {
        return new Builder();
    }

    public static class Builder {
        private CompanyLookupClient lookupClient;
        private ProfileClient profileClient;
        private LookupCacheStore lookupStore;
        private ProfileCacheStore profileStore;
        private NameNormalizer normalizer;
        private RetryExecutor retryExecutor;
        private CacheConfig config;
        private List<LookupTier> tiers;
        private Clock clock;
        private MetricsService metrics;

        public Builder lookupClient(CompanyLookupClient lookupClient) {
            this.lookupClient = lookupClient;
            return this;
        }

        public Builder profileClient(ProfileClient profileClient) {
            this.profileClient = profileClient;
            return this;
        }

        public Builder lookupStore(LookupCacheStore lookupStore) {
            this.lookupStore = lookupStore;
            return this;
        }

        public Builder profileStore(ProfileCacheStore profileStore) {
            this.profileStore = profileStore;
            return this;
        }

        public Builder normalizer(NameNormalizer normalizer) {
            this.normalizer = normalizer;
            return this;
        }

        public Builder retryExecutor(RetryExecutor retryExecutor) {
            this.retryExecutor = retryExecutor;
            return this;
        }

        public Builder config(CacheConfig config) {
            this.config = config;
            return this;
        }

        /**
         * Lookup tiers in the order they are tried. Defaults to every tier in declaration order.
         */
        public Builder tiers(List<LookupTier> tiers) {
            if (tiers == null || tiers.isEmpty()) {
                throw new IllegalArgumentException("At least one lookup tier is required");
            }
            this.tiers = tiers;
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

        public EntityResolutionCache build() {
            return new EntityResolutionCache(this);
        }
    }
}
