package com.talent.sourcing.discovery;

import com.talent.sourcing.cache.BatchResolution;
import com.talent.sourcing.cache.EntityResolutionCache;
import com.talent.sourcing.cache.ProfileBatchResult;
import com.talent.sourcing.cache.ResolutionResult;
import com.talent.sourcing.core.InputSanitizer;
import com.talent.sourcing.core.ValidationException;
import com.talent.sourcing.core.model.Entity;
import com.talent.sourcing.core.model.EntityMetadata;
import com.talent.sourcing.core.model.Requirements;
import com.talent.sourcing.lookup.LookupRequest;
import com.talent.sourcing.lookup.ProfilePayload;
import com.talent.sourcing.progress.CancellationToken;
import com.talent.sourcing.progress.PipelineCancelledException;
import com.talent.sourcing.progress.ProgressCallback;
import com.talent.sourcing.rules.NameNormalizer;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CompletionException;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;
import java.util.concurrent.atomic.AtomicInteger;

/**
 * Runs the discovery strategies, merges their candidates and resolves them.
 *
 * <p>Strategies run concurrently and independently: a strategy that throws or exceeds
 * its timeout is reported in {@link CandidateSet#strategyFailures()} while the others'
 * candidates are kept. Candidates are merged in strategy order, deduplicated by normalized
 * key (first occurrence wins), filtered against the exclusion list and capped before
 * resolution.</p>
 */
public class DiscoveryAggregator implements AutoCloseable {
    private static final Logger log = LoggerFactory.getLogger(DiscoveryAggregator.class);

    private final List<DiscoveryStrategy> strategies;
    private final EntityResolutionCache cache;
    private final NameNormalizer normalizer;
    private final DiscoveryOptions options;
    private final ExecutorService executor;

    public DiscoveryAggregator(List<DiscoveryStrategy> strategies, EntityResolutionCache cache,
                               DiscoveryOptions options) {
        if (strategies.isEmpty()) {
            throw new IllegalArgumentException("At least one discovery strategy is required");
        }
        this.strategies = List.copyOf(strategies);
        this.cache = cache;
        this.normalizer = cache.getNormalizer();
        this.options = options != null ? options : DiscoveryOptions.defaults();
        AtomicInteger threadCount = new AtomicInteger();
        this.executor = Executors.newFixedThreadPool(this.options.strategyConcurrency(), r -> {
            Thread t = new Thread(r, "discovery-worker-" + threadCount.incrementAndGet());
            t.setDaemon(true);
            return t;
        });
    }

    /**
     * Collects and resolves candidates without progress reporting.
     */
    public DiscoveryResult discover(Requirements requirements) {
        CancellationToken token = CancellationToken.create();
        return resolveCandidates(collectCandidates(requirements, token), ProgressCallback.NOOP, token);
    }

    /**
     * Runs every strategy and merges the candidates.
     *
     * @throws PipelineCancelledException if the token was cancelled
     */
    public CandidateSet collectCandidates(Requirements requirements, CancellationToken token) {
        ExclusionFilter exclusions = new ExclusionFilter(normalizer, requirements.getExcludedEntities());
        long timeoutMillis = options.strategyTimeout().toMillis();

        Map<DiscoveryStrategy, CompletableFuture<StrategyResult>> futures = new LinkedHashMap<>();
        for (DiscoveryStrategy strategy : strategies) {
            CancellationToken strategyToken = token.child();
            CompletableFuture<StrategyResult> future = CompletableFuture
                    .supplyAsync(() -> strategy.discover(requirements, exclusions, strategyToken), executor)
                    .orTimeout(timeoutMillis, TimeUnit.MILLISECONDS);
            // a timed-out strategy is still running; stop it before its next query
            future.whenComplete((result, error) -> {
                if (unwrap(error) instanceof TimeoutException) {
                    strategyToken.cancel("strategy " + strategy.id() + " timed out");
                }
            });
            futures.put(strategy, future);
        }

        List<StrategyResult> results = new ArrayList<>();
        Map<String, String> failures = new LinkedHashMap<>();
        for (Map.Entry<DiscoveryStrategy, CompletableFuture<StrategyResult>> entry : futures.entrySet()) {
            String id = entry.getKey().id();
            try {
                StrategyResult result = entry.getValue().join();
                results.add(result);
                log.info("discovery.strategyCompleted strategy={} candidates={} queries={} failedQueries={}",
                        id, result.candidates().size(), result.queriesIssued(), result.queriesFailed());
            } catch (CompletionException e) {
                Throwable cause = unwrap(e);
                if (cause instanceof PipelineCancelledException pce && token.isCancelled()) {
                    throw pce;
                }
                String reason = cause instanceof TimeoutException
                        ? "timed out after " + options.strategyTimeout().toSeconds() + "s"
                        : String.valueOf(cause.getMessage());
                failures.put(id, reason);
                log.warn("discovery.strategyFailed strategy={} reason={}", id, reason, cause);
            }
        }
        token.throwIfCancelled();
        return merge(results, failures, exclusions);
    }

    private static Throwable unwrap(Throwable error) {
        return error instanceof CompletionException && error.getCause() != null ? error.getCause() : error;
    }

    /**
     * Resolves the candidates through the cache. Entities keep candidate order; failed or
     * unmatched names stay in the list unresolved.
     */
    public DiscoveryResult resolveCandidates(CandidateSet candidateSet, ProgressCallback progress,
                                             CancellationToken token) {
        List<DiscoveryCandidate> candidates = candidateSet.candidates();
        List<LookupRequest> requests = new ArrayList<>(candidates.size());
        for (DiscoveryCandidate candidate : candidates) {
            requests.add(new LookupRequest(candidate.name(), candidate.websiteHint()));
        }
        BatchResolution batch = cache.resolveAll(requests, progress, token);

        List<Entity> entities = new ArrayList<>(candidates.size());
        for (int i = 0; i < candidates.size(); i++) {
            entities.add(toEntity(candidates.get(i), batch.results().get(i)));
        }

        Map<String, String> profileFailures = Map.of();
        if (options.enrichProfiles()) {
            token.throwIfCancelled();
            ProfileBatchResult profiles = enrich(entities, token);
            profileFailures = profiles.failures();
        }

        log.info("discovery.resolved candidates={} resolved={} notFound={} failed={} fromCache={}",
                candidates.size(), batch.success(), batch.notFound(), batch.failed(), batch.fromCache());
        return new DiscoveryResult(entities, candidateSet, batch, profileFailures);
    }

    private CandidateSet merge(List<StrategyResult> results, Map<String, String> failures,
                               ExclusionFilter exclusions) {
        Map<String, DiscoveryCandidate> byKey = new LinkedHashMap<>();
        int extracted = 0;
        int duplicates = 0;
        int excluded = 0;
        int rejected = 0;
        int queriesIssued = 0;
        int queriesFailed = 0;

        for (StrategyResult result : results) {
            queriesIssued += result.queriesIssued();
            queriesFailed += result.queriesFailed();
            for (DiscoveryCandidate candidate : result.candidates()) {
                extracted++;
                String key = usableKey(candidate.name());
                if (key == null) {
                    rejected++;
                    continue;
                }
                if (exclusions.isExcluded(candidate.name())) {
                    excluded++;
                    continue;
                }
                DiscoveryCandidate existing = byKey.get(key);
                if (existing != null) {
                    duplicates++;
                    if (existing.websiteHint() == null && candidate.websiteHint() != null) {
                        byKey.put(key, existing.withWebsiteHint(candidate.websiteHint()));
                    }
                    continue;
                }
                byKey.put(key, candidate);
            }
        }

        List<DiscoveryCandidate> merged = new ArrayList<>(byKey.values());
        int truncated = 0;
        if (merged.size() > options.maxCandidates()) {
            truncated = merged.size() - options.maxCandidates();
            merged = new ArrayList<>(merged.subList(0, options.maxCandidates()));
        }
        log.info("discovery.merged extracted={} unique={} duplicates={} excluded={} rejected={} truncated={}",
                extracted, merged.size(), duplicates, excluded, rejected, truncated);
        return new CandidateSet(merged, extracted, duplicates, excluded, rejected, truncated,
                queriesIssued, queriesFailed, failures);
    }

    private String usableKey(String name) {
        try {
            InputSanitizer.validateEntityName(name);
        } catch (ValidationException e) {
            log.debug("discovery.candidateRejected name='{}' reason={}", name, e.getMessage());
            return null;
        }
        String key = normalizer.normalizeKey(name);
        return key.isEmpty() ? null : key;
    }

    private Entity toEntity(DiscoveryCandidate candidate, ResolutionResult result) {
        Entity entity = Entity.builder()
                .name(candidate.name())
                .normalizedKey(result.normalizedKey() != null
                        ? result.normalizedKey()
                        : normalizer.normalizeKey(candidate.name()))
                .provenance(candidate.provenance())
                .metadata(EntityMetadata.ofWebsite(candidate.websiteHint()))
                .build();
        if (!result.isResolved()) {
            return entity;
        }
        return entity.withStableId(result.stableId(), result.confidence())
                .withMetadata(result.metadata().fillMissing(entity.getMetadata()));
    }

    private ProfileBatchResult enrich(List<Entity> entities, CancellationToken token) {
        Set<String> ids = new LinkedHashSet<>();
        for (Entity entity : entities) {
            entity.getStableId().ifPresent(ids::add);
        }
        ProfileBatchResult profiles = cache.fetchProfiles(ids, token);
        for (int i = 0; i < entities.size(); i++) {
            Entity entity = entities.get(i);
            ProfilePayload payload = entity.getStableId().map(profiles.profiles()::get).orElse(null);
            if (payload != null) {
                entities.set(i, entity.withMetadata(entity.getMetadata().fillMissing(payload.toMetadata())));
            }
        }
        if (!profiles.failures().isEmpty()) {
            log.warn("discovery.enrichmentIncomplete requested={} failed={}", ids.size(), profiles.failures().size());
        }
        return profiles;
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
