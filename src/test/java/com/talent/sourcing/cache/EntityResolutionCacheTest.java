package com.talent.sourcing.cache;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.talent.sourcing.MutableClock;
import com.talent.sourcing.core.ValidationException;
import com.talent.sourcing.core.model.EntityMetadata;
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
import com.talent.sourcing.metrics.MicrometerMetricsService;
import com.talent.sourcing.metrics.NoOpMetricsService;
import com.talent.sourcing.progress.CancellationToken;
import com.talent.sourcing.progress.PipelineCancelledException;
import io.micrometer.core.instrument.simple.SimpleMeterRegistry;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

import java.time.Duration;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicInteger;

import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.Mockito.doThrow;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.when;

@DisplayName("EntityResolutionCache Tests")
class EntityResolutionCacheTest {

    private MutableClock clock;
    private FakeCompanyApi api;
    private CaffeineLookupCacheStore lookupStore;
    private SimpleMeterRegistry registry;
    private EntityResolutionCache cache;

    @BeforeEach
    void setUp() {
        clock = MutableClock.startingAt("2026-03-01T10:00:00Z");
        api = new FakeCompanyApi();
        lookupStore = new CaffeineLookupCacheStore(CacheConfig.defaults());
        registry = new SimpleMeterRegistry();
        cache = newCache(lookupStore);
    }

    @AfterEach
    void tearDown() {
        cache.close();
    }

    private EntityResolutionCache newCache(LookupCacheStore store) {
        return EntityResolutionCache.builder()
                .lookupClient(api)
                .profileClient(api)
                .lookupStore(store)
                .retryExecutor(new RetryExecutor(RetryPolicy.defaults(), d -> { }, () -> 0.5,
                        new NoOpMetricsService()))
                .clock(clock)
                .metrics(new MicrometerMetricsService(registry))
                .build();
    }

    @Nested
    @DisplayName("Single lookups")
    class SingleLookups {

        @Test
        @DisplayName("Should resolve a name and cache the positive entry")
        void shouldResolveAndCachePositiveEntry() {
            ResolutionResult first = cache.resolve("Acme Corp");
            ResolutionResult second = cache.resolve("Acme Corp");

            assertEquals(ResolutionStatus.RESOLVED, first.status());
            assertEquals("id-acme", first.stableId());
            assertEquals("acme", first.normalizedKey());
            assertFalse(first.fromCache());
            assertTrue(second.fromCache());
            assertEquals("id-acme", second.stableId());
            assertEquals(1, api.lookupCalls.get());
        }

        @Test
        @DisplayName("Should share one entry between name variants")
        void nameVariantsShareOneEntry() {
            cache.resolve("Acme Corp");
            cache.resolve("ACME corp.");
            cache.resolve("  acme   Corporation ");

            assertEquals(1, api.lookupCalls.get());
            assertEquals(1, lookupStore.size());
            CacheStats stats = cache.getStats();
            assertEquals(2, stats.hits());
            assertEquals(1, stats.misses());
        }

        @Test
        @DisplayName("Should track the hit count on the entry")
        void hitCountIsTrackedOnTheEntry() {
            cache.resolve("Acme Corp");
            cache.resolve("Acme Corp");
            cache.resolve("Acme Corp");

            assertEquals(2, lookupStore.find("acme").orElseThrow().hitCount());
        }

        @Test
        @DisplayName("Should fall through lookup tiers until one matches")
        void fallsThroughTiersUntilAMatch() {
            ResolutionResult result = cache.resolve("Fuzzy Only", "https://fuzzy.io");

            assertTrue(result.isResolved());
            assertEquals(LookupTier.FUZZY_NAME, result.tier());
            assertEquals(List.of(LookupTier.EXACT_NAME, LookupTier.WEBSITE, LookupTier.FUZZY_NAME),
                    api.tiersFor("Fuzzy Only"));
        }

        @Test
        @DisplayName("Should skip the website tier without a website hint")
        void websiteTierIsSkippedWithoutHint() {
            cache.resolve("Fuzzy Only");

            assertEquals(List.of(LookupTier.EXACT_NAME, LookupTier.FUZZY_NAME), api.tiersFor("Fuzzy Only"));
        }

        @Test
        @DisplayName("Should reject empty names without external calls")
        void emptyNamesAreRejectedWithoutExternalCalls() {
            assertThrows(ValidationException.class, () -> cache.resolve("   "));
            assertThrows(ValidationException.class, () -> cache.resolve("Inc."));
            assertThrows(ValidationException.class, () -> cache.resolve(null));
            assertEquals(0, api.lookupCalls.get());
        }
    }

    @Nested
    @DisplayName("Negative entries and expiry")
    class NegativeEntries {

        @Test
        @DisplayName("Should cache not-found until the negative TTL expires")
        void notFoundIsCachedUntilNegativeTtlExpires() {
            ResolutionResult first = cache.resolve("Unknown Startup");
            ResolutionResult cached = cache.resolve("Unknown Startup");

            assertEquals(ResolutionStatus.NOT_FOUND, first.status());
            assertEquals(ResolutionStatus.NOT_FOUND, cached.status());
            assertTrue(cached.fromCache());
            int callsAfterFirst = api.lookupCalls.get();

            clock.advance(Duration.ofDays(7));
            ResolutionResult expired = cache.resolve("Unknown Startup");

            assertFalse(expired.fromCache());
            assertEquals(callsAfterFirst * 2, api.lookupCalls.get());
            assertEquals(1.0, registry.get("sourcing.cache.negative.hit").counter().count());
        }

        @Test
        @DisplayName("Should keep positive entries past the negative TTL")
        void positiveEntriesOutliveNegativeTtl() {
            cache.resolve("Acme Corp");
            clock.advance(Duration.ofDays(30));

            assertTrue(cache.resolve("Acme Corp").fromCache());

            clock.advance(Duration.ofDays(150));
            assertFalse(cache.resolve("Acme Corp").fromCache());
            assertEquals(2, api.lookupCalls.get());
        }

        @Test
        @DisplayName("Should write a negative entry after transient failures")
        void transientFailureWritesNegativeEntry() {
            api.transientFailures.add("Flaky Labs");

            ResolutionResult result = cache.resolve("Flaky Labs");

            assertEquals(ResolutionStatus.FAILED, result.status());
            assertNotNull(result.failureReason());
            assertTrue(lookupStore.find("flaky labs").orElseThrow().isNegative());
            assertEquals(3, api.lookupCalls.get());
        }

        @Test
        @DisplayName("Should not cache permanent failures")
        void permanentFailureIsNotCached() {
            api.permanentFailures.add("Forbidden Co");

            ResolutionResult result = cache.resolve("Forbidden Co");

            assertEquals(ResolutionStatus.FAILED, result.status());
            assertTrue(lookupStore.find("forbidden").isEmpty());
            assertEquals(1, api.lookupCalls.get());
        }

        @Test
        @DisplayName("Should not cache misses when negative caching is disabled")
        void negativeCachingCanBeDisabled() {
            cache.close();
            cache = EntityResolutionCache.builder()
                    .lookupClient(api)
                    .lookupStore(lookupStore)
                    .config(CacheConfig.defaults().withCacheNegatives(false))
                    .clock(clock)
                    .build();

            cache.resolve("Unknown Startup");
            cache.resolve("Unknown Startup");

            assertTrue(lookupStore.find("unknown startup").isEmpty());
        }
    }

    @Nested
    @DisplayName("Concurrency")
    class Concurrency {

        @Test
        @DisplayName("Should share one in-flight lookup between concurrent callers")
        void concurrentLookupsForOneNameShareOneCall() throws Exception {
            CountDownLatch release = new CountDownLatch(1);
            api.gate = release;
            int callers = 10;
            ExecutorService pool = Executors.newFixedThreadPool(callers);
            try {
                List<Future<ResolutionResult>> futures = new ArrayList<>();
                for (int i = 0; i < callers; i++) {
                    futures.add(pool.submit(() -> cache.resolve("Acme Corp")));
                }

                long deadline = System.nanoTime() + TimeUnit.SECONDS.toNanos(5);
                while (cache.getStats().coalesced() < callers - 1 && System.nanoTime() < deadline) {
                    Thread.sleep(5);
                }
                release.countDown();

                for (Future<ResolutionResult> future : futures) {
                    assertEquals("id-acme", future.get(5, TimeUnit.SECONDS).stableId());
                }
            } finally {
                pool.shutdownNow();
            }

            assertEquals(1, api.lookupCalls.get());
            assertEquals(callers - 1, cache.getStats().coalesced());
            assertEquals(9.0, registry.get("sourcing.cache.coalesced").tag("tier", "lookup").counter().count());
        }
    }

    @Nested
    @DisplayName("Batch resolution")
    class BatchResolutionTests {

        @Test
        @DisplayName("Should isolate failures within a batch")
        void failuresAreIsolatedWithinBatch() {
            List<LookupRequest> requests = new ArrayList<>();
            for (int i = 0; i < 464; i++) {
                requests.add(LookupRequest.of("Orgname " + i));
            }
            api.transientFailures.add("Orgname 17");
            api.transientFailures.add("Orgname 300");

            BatchResolution batch = cache.resolveAll(requests, null, null);

            assertEquals(464, batch.total());
            assertEquals(462, batch.success());
            assertEquals(2, batch.failed());
            assertEquals(0, batch.notFound());
            long positives = requests.stream()
                    .map(r -> lookupStore.find(cache.getNormalizer().normalizeKey(r.name())))
                    .filter(e -> e.isPresent() && !e.get().isNegative())
                    .count();
            assertEquals(462, positives);
        }

        @Test
        @DisplayName("Should keep request order and report progress")
        void resultsKeepRequestOrderAndReportProgress() {
            List<Long> progress = new ArrayList<>();
            List<LookupRequest> requests = List.of(
                    LookupRequest.of("Acme Corp"), LookupRequest.of("Inc."), LookupRequest.of("Globex"));

            BatchResolution batch = cache.resolveAll(requests,
                    (processed, total, message) -> progress.add(processed), CancellationToken.create());

            assertEquals("acme", batch.results().get(0).normalizedKey());
            assertEquals(ResolutionStatus.REJECTED, batch.results().get(1).status());
            assertEquals("globex", batch.results().get(2).normalizedKey());
            assertEquals(1, batch.rejected());
            assertEquals(List.of(1L, 2L, 3L), progress);
        }

        @Test
        @DisplayName("Should serve a repeated batch from the cache")
        void repeatedBatchIsServedFromCache() {
            List<LookupRequest> requests = List.of(LookupRequest.of("Acme Corp"), LookupRequest.of("Globex"));
            cache.resolveAll(requests, null, null);

            BatchResolution again = cache.resolveAll(requests, null, null);

            assertEquals(2, again.fromCache());
            assertEquals(2, api.lookupCalls.get());
        }

        @Test
        @DisplayName("Should stop the batch when cancelled")
        void cancelledTokenStopsTheBatch() {
            CancellationToken token = CancellationToken.create();
            token.cancel("user aborted");

            assertThrows(PipelineCancelledException.class,
                    () -> cache.resolveAll(List.of(LookupRequest.of("Acme Corp")), null, token));
            assertEquals(0, api.lookupCalls.get());
        }
    }

    @Nested
    @DisplayName("Profiles")
    class Profiles {

        @Test
        @DisplayName("Should fetch a profile once while it is fresh")
        void profileIsFetchedOnceWhileFresh() {
            ProfilePayload first = cache.fetchProfile("id-acme");
            ProfilePayload second = cache.fetchProfile("id-acme");

            assertSame(first, second);
            assertEquals(1, api.profileCalls.get());
        }

        @Test
        @DisplayName("Should refetch a stale profile")
        void staleProfileIsRefetched() {
            cache.fetchProfile("id-acme");
            clock.advance(Duration.ofDays(90));

            cache.fetchProfile("id-acme");

            assertEquals(2, api.profileCalls.get());
        }

        @Test
        @DisplayName("Should fetch each identifier of a batch once")
        void batchFetchesEachIdentifierOnce() {
            api.profileFailures.add("id-broken");

            ProfileBatchResult result = cache.fetchProfiles(
                    List.of("id-acme", "id-globex", "id-acme", "id-broken"), null);

            assertEquals(Set.of("id-acme", "id-globex"), result.profiles().keySet());
            assertTrue(result.failures().containsKey("id-broken"));
            assertEquals(2, api.profileCallsFor("id-acme") + api.profileCallsFor("id-globex"));
        }

        @Test
        @DisplayName("Should share one in-flight profile fetch between concurrent callers")
        void concurrentFetchesForOneIdentifierShareOneCall() throws Exception {
            CountDownLatch release = new CountDownLatch(1);
            api.profileGate = release;
            int callers = 8;
            ExecutorService pool = Executors.newFixedThreadPool(callers);
            try {
                List<Future<ProfilePayload>> futures = new ArrayList<>();
                for (int i = 0; i < callers; i++) {
                    futures.add(pool.submit(() -> cache.fetchProfile("id-x")));
                }

                long deadline = System.nanoTime() + TimeUnit.SECONDS.toNanos(5);
                while (cache.getStats().coalesced() < callers - 1 && System.nanoTime() < deadline) {
                    Thread.sleep(5);
                }
                release.countDown();

                for (Future<ProfilePayload> future : futures) {
                    assertEquals("id-x", future.get(5, TimeUnit.SECONDS).stableId());
                }
            } finally {
                pool.shutdownNow();
            }

            assertEquals(1, api.profileCalls.get());
            assertEquals(callers - 1, cache.getStats().coalesced());
            assertEquals(7.0, registry.get("sourcing.cache.coalesced").tag("tier", "profile").counter().count());
        }

        @Test
        @DisplayName("Should reject profile fetches without a profile client")
        void profileFetchNeedsAClient() {
            cache.close();
            cache = EntityResolutionCache.builder().lookupClient(api).build();

            assertThrows(IllegalStateException.class, () -> cache.fetchProfile("id-acme"));
        }
    }

    @Test
    @DisplayName("Should count cache write failures without failing the lookup")
    void writeFailuresAreCountedButNotFatal() {
        LookupCacheStore failing = mock(LookupCacheStore.class);
        when(failing.find(any())).thenReturn(Optional.empty());
        doThrow(new CacheWriteException("store unavailable")).when(failing).upsert(any());
        cache.close();
        cache = newCache(failing);

        ResolutionResult result = cache.resolve("Acme Corp");

        assertTrue(result.isResolved());
        assertEquals(1, cache.getStats().writeFailures());
        assertEquals(1.0, registry.get("sourcing.cache.write.failure").tag("tier", "lookup").counter().count());
    }

    /**
     * Resolves names starting with "Acme", "Globex" or "Orgname" on the exact tier and
     * "Fuzzy Only" on the fuzzy tier; everything else is not found.
     */
    static class FakeCompanyApi implements CompanyLookupClient, ProfileClient {
        final AtomicInteger lookupCalls = new AtomicInteger();
        final AtomicInteger profileCalls = new AtomicInteger();
        final Set<String> transientFailures = ConcurrentHashMap.newKeySet();
        final Set<String> permanentFailures = ConcurrentHashMap.newKeySet();
        final Set<String> profileFailures = ConcurrentHashMap.newKeySet();
        final Map<String, List<LookupTier>> tiersByName = new ConcurrentHashMap<>();
        final Map<String, AtomicInteger> profileCallsById = new ConcurrentHashMap<>();
        volatile CountDownLatch gate;
        volatile CountDownLatch profileGate;

        @Override
        public Optional<LookupMatch> lookup(LookupRequest request, LookupTier tier) {
            lookupCalls.incrementAndGet();
            tiersByName.computeIfAbsent(request.name(), k -> new ArrayList<>()).add(tier);
            awaitGate();
            if (transientFailures.contains(request.name())) {
                throw new ExternalTransientException("company-lookup", "HTTP 503", 503);
            }
            if (permanentFailures.contains(request.name())) {
                throw new ExternalPermanentException("company-lookup", "HTTP 403", 403);
            }
            String name = request.name().strip();
            String lower = name.toLowerCase();
            if (tier == LookupTier.EXACT_NAME && (lower.startsWith("acme") || lower.startsWith("globex")
                    || lower.startsWith("orgname"))) {
                String id = lower.startsWith("orgname") ? "id-" + lower.replace(' ', '-')
                        : "id-" + lower.split(" ")[0];
                return Optional.of(new LookupMatch(id, name, 0.95, tier, EntityMetadata.empty()));
            }
            if (tier == LookupTier.FUZZY_NAME && name.equals("Fuzzy Only")) {
                return Optional.of(new LookupMatch("id-fuzzy", name, 0.81, tier, EntityMetadata.empty()));
            }
            return Optional.empty();
        }

        @Override
        public ProfilePayload fetchProfile(String stableId) {
            profileCalls.incrementAndGet();
            profileCallsById.computeIfAbsent(stableId, k -> new AtomicInteger()).incrementAndGet();
            await(profileGate);
            if (profileFailures.contains(stableId)) {
                throw new ExternalPermanentException("company-profile", "HTTP 404", 404);
            }
            return new ProfilePayload(stableId, new ObjectMapper().createObjectNode().put("id", stableId));
        }

        @Override
        public String endpointName() {
            return "company-lookup";
        }

        List<LookupTier> tiersFor(String name) {
            return tiersByName.getOrDefault(name, List.of());
        }

        int profileCallsFor(String id) {
            AtomicInteger calls = profileCallsById.get(id);
            return calls == null ? 0 : calls.get();
        }

        private void awaitGate() {
            await(gate);
        }

        private static void await(CountDownLatch latch) {
            if (latch == null) {
                return;
            }
            try {
                latch.await(5, TimeUnit.SECONDS);
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
            }
        }
    }
}
