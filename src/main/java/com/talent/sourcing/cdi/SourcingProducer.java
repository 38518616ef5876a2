package com.talent.sourcing.cdi;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.talent.sourcing.cache.CacheConfig;
import com.talent.sourcing.cache.CaffeineLookupCacheStore;
import com.talent.sourcing.cache.CaffeineProfileCacheStore;
import com.talent.sourcing.cache.EntityResolutionCache;
import com.talent.sourcing.discovery.CandidateExtractor;
import com.talent.sourcing.discovery.DiscoveryAggregator;
import com.talent.sourcing.discovery.DiscoveryOptions;
import com.talent.sourcing.discovery.KeywordSearchStrategy;
import com.talent.sourcing.discovery.SearchQueryPlanner;
import com.talent.sourcing.discovery.SeedExpansionStrategy;
import com.talent.sourcing.discovery.TavilyWebSearchClient;
import com.talent.sourcing.discovery.WebSearchClient;
import com.talent.sourcing.external.EndpointThrottle;
import com.talent.sourcing.external.RetryExecutor;
import com.talent.sourcing.external.RetryPolicy;
import com.talent.sourcing.external.Sleeper;
import com.talent.sourcing.lookup.HttpCompanyLookupClient;
import com.talent.sourcing.metrics.MetricsService;
import com.talent.sourcing.metrics.MicrometerMetricsService;
import com.talent.sourcing.metrics.NoOpMetricsService;
import com.talent.sourcing.pipeline.PipelineOptions;
import com.talent.sourcing.pipeline.PipelineOrchestrator;
import com.talent.sourcing.query.CompilerOptions;
import com.talent.sourcing.query.QueryCompiler;
import com.talent.sourcing.rules.NameNormalizer;
import com.talent.sourcing.scoring.NoOpRelevanceClassifier;
import com.talent.sourcing.scoring.OllamaRelevanceClassifier;
import com.talent.sourcing.scoring.RelevanceClassifier;
import com.talent.sourcing.scoring.RelevanceScorer;
import com.talent.sourcing.scoring.ScoreResponseParser;
import com.talent.sourcing.scoring.ScoringOptions;
import com.talent.sourcing.session.HttpSearchBackend;
import com.talent.sourcing.session.SessionConfig;
import com.talent.sourcing.session.SessionManager;
import com.talent.sourcing.tracing.NoOpTracingService;
import com.talent.sourcing.tracing.OpenTelemetryTracingService;
import com.talent.sourcing.tracing.TracingService;
import io.micrometer.core.instrument.Metrics;
import io.opentelemetry.api.GlobalOpenTelemetry;
import jakarta.enterprise.context.ApplicationScoped;
import jakarta.enterprise.inject.Disposes;
import jakarta.enterprise.inject.Produces;
import jakarta.inject.Inject;
import org.eclipse.microprofile.config.inject.ConfigProperty;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Duration;
import java.util.List;
import java.util.Optional;
import java.util.concurrent.ThreadLocalRandom;

/**
 * CDI producer that wires the sourcing pipeline from MicroProfile Config properties.
 *
 * <p>Defaults live in {@code META-INF/microprofile-config.properties}. At minimum the data
 * provider must be configured:</p>
 * <pre>
 * talent-sourcing.provider.base-url=https://api.example-data.com
 * talent-sourcing.provider.api-key=...
 * talent-sourcing.web-search.api-key=...
 * </pre>
 *
 * <p>Inject the orchestrator directly:</p>
 * <pre>
 * &#64;Inject PipelineOrchestrator pipeline;
 * </pre>
 */
@ApplicationScoped
public class SourcingProducer {

    private static final Logger log = LoggerFactory.getLogger(SourcingProducer.class);

    // ── Data provider (company lookup, profiles, person search) ──

    @Inject
    @ConfigProperty(name = "talent-sourcing.provider.base-url")
    String providerBaseUrl;

    @Inject
    @ConfigProperty(name = "talent-sourcing.provider.api-key")
    Optional<String> providerApiKey;

    @Inject
    @ConfigProperty(name = "talent-sourcing.provider.timeout-seconds", defaultValue = "10")
    int providerTimeoutSeconds;

    @Inject
    @ConfigProperty(name = "talent-sourcing.provider.min-confidence", defaultValue = "0.8")
    double minConfidence;

    // ── Web search ────────────────────────────────────────────

    @Inject
    @ConfigProperty(name = "talent-sourcing.web-search.base-url", defaultValue = "https://api.tavily.com")
    String webSearchBaseUrl;

    @Inject
    @ConfigProperty(name = "talent-sourcing.web-search.api-key")
    Optional<String> webSearchApiKey;

    @Inject
    @ConfigProperty(name = "talent-sourcing.web-search.timeout-seconds", defaultValue = "15")
    int webSearchTimeoutSeconds;

    // ── Resolution cache ──────────────────────────────────────

    @Inject
    @ConfigProperty(name = "talent-sourcing.cache.max-entries", defaultValue = "100000")
    long cacheMaxEntries;

    @Inject
    @ConfigProperty(name = "talent-sourcing.cache.positive-ttl-days", defaultValue = "180")
    int positiveTtlDays;

    @Inject
    @ConfigProperty(name = "talent-sourcing.cache.negative-ttl-days", defaultValue = "7")
    int negativeTtlDays;

    @Inject
    @ConfigProperty(name = "talent-sourcing.cache.profile-ttl-days", defaultValue = "90")
    int profileTtlDays;

    @Inject
    @ConfigProperty(name = "talent-sourcing.cache.cache-negatives", defaultValue = "true")
    boolean cacheNegatives;

    @Inject
    @ConfigProperty(name = "talent-sourcing.cache.batch-concurrency", defaultValue = "8")
    int batchConcurrency;

    // ── Retry and rate limits ─────────────────────────────────

    @Inject
    @ConfigProperty(name = "talent-sourcing.retry.max-attempts", defaultValue = "3")
    int retryMaxAttempts;

    @Inject
    @ConfigProperty(name = "talent-sourcing.retry.base-delay-millis", defaultValue = "1000")
    long retryBaseDelayMillis;

    @Inject
    @ConfigProperty(name = "talent-sourcing.retry.max-delay-millis", defaultValue = "8000")
    long retryMaxDelayMillis;

    @Inject
    @ConfigProperty(name = "talent-sourcing.throttle.min-interval-millis", defaultValue = "1000")
    long minRequestIntervalMillis;

    // ── Discovery ─────────────────────────────────────────────

    @Inject
    @ConfigProperty(name = "talent-sourcing.discovery.max-seeds", defaultValue = "3")
    int maxSeeds;

    @Inject
    @ConfigProperty(name = "talent-sourcing.discovery.max-keyword-queries", defaultValue = "5")
    int maxKeywordQueries;

    @Inject
    @ConfigProperty(name = "talent-sourcing.discovery.results-per-query", defaultValue = "10")
    int resultsPerQuery;

    @Inject
    @ConfigProperty(name = "talent-sourcing.discovery.max-candidates", defaultValue = "100")
    int maxCandidates;

    @Inject
    @ConfigProperty(name = "talent-sourcing.discovery.strategy-timeout-seconds", defaultValue = "120")
    int strategyTimeoutSeconds;

    @Inject
    @ConfigProperty(name = "talent-sourcing.discovery.enrich-profiles", defaultValue = "false")
    boolean enrichProfiles;

    // ── Scoring ───────────────────────────────────────────────

    @Inject
    @ConfigProperty(name = "talent-sourcing.scoring.enabled", defaultValue = "true")
    boolean scoringEnabled;

    @Inject
    @ConfigProperty(name = "talent-sourcing.scoring.provider", defaultValue = "ollama")
    String scoringProvider;

    @Inject
    @ConfigProperty(name = "talent-sourcing.scoring.batch-size", defaultValue = "20")
    int scoringBatchSize;

    @Inject
    @ConfigProperty(name = "talent-sourcing.scoring.concurrency", defaultValue = "2")
    int scoringConcurrency;

    @Inject
    @ConfigProperty(name = "talent-sourcing.scoring.ollama.base-url", defaultValue = "http://localhost:11434")
    String ollamaBaseUrl;

    @Inject
    @ConfigProperty(name = "talent-sourcing.scoring.ollama.model", defaultValue = "llama3.2")
    String ollamaModel;

    @Inject
    @ConfigProperty(name = "talent-sourcing.scoring.ollama.timeout-seconds", defaultValue = "60")
    int ollamaTimeoutSeconds;

    // ── Sessions ──────────────────────────────────────────────

    @Inject
    @ConfigProperty(name = "talent-sourcing.session.page-size", defaultValue = "20")
    int pageSize;

    @Inject
    @ConfigProperty(name = "talent-sourcing.session.ttl-hours", defaultValue = "24")
    int sessionTtlHours;

    @Inject
    @ConfigProperty(name = "talent-sourcing.session.max-pages", defaultValue = "5")
    int maxPages;

    @Inject
    @ConfigProperty(name = "talent-sourcing.session.page-cache-minutes", defaultValue = "60")
    int pageCacheMinutes;

    // ── Pipeline ──────────────────────────────────────────────

    @Inject
    @ConfigProperty(name = "talent-sourcing.pipeline.max-selected-entities", defaultValue = "50")
    int maxSelectedEntities;

    @Inject
    @ConfigProperty(name = "talent-sourcing.pipeline.keyword-required", defaultValue = "false")
    boolean keywordRequired;

    @Inject
    @ConfigProperty(name = "talent-sourcing.pipeline.location-required", defaultValue = "false")
    boolean locationRequired;

    @Inject
    @ConfigProperty(name = "talent-sourcing.pipeline.run-timeout-minutes", defaultValue = "10")
    int runTimeoutMinutes;

    @Inject
    @ConfigProperty(name = "talent-sourcing.query.max-terms-per-group", defaultValue = "100")
    int maxTermsPerGroup;

    // ── Observability ─────────────────────────────────────────

    @Inject
    @ConfigProperty(name = "talent-sourcing.metrics.enabled", defaultValue = "true")
    boolean metricsEnabled;

    @Inject
    @ConfigProperty(name = "talent-sourcing.tracing.enabled", defaultValue = "false")
    boolean tracingEnabled;

    private final ObjectMapper objectMapper = new ObjectMapper();

    // ══════════════════════════════════════════════════════════
    //  Producers
    // ══════════════════════════════════════════════════════════

    @Produces
    @ApplicationScoped
    public MetricsService metricsService() {
        return metricsEnabled ? new MicrometerMetricsService(Metrics.globalRegistry) : new NoOpMetricsService();
    }

    @Produces
    @ApplicationScoped
    public TracingService tracingService() {
        return tracingEnabled
                ? new OpenTelemetryTracingService(GlobalOpenTelemetry.getTracer("talent-sourcing"))
                : new NoOpTracingService();
    }

    @Produces
    @ApplicationScoped
    public EndpointThrottle endpointThrottle() {
        return new EndpointThrottle(Duration.ofMillis(minRequestIntervalMillis));
    }

    @Produces
    @ApplicationScoped
    public EntityResolutionCache entityResolutionCache(MetricsService metrics) {
        CacheConfig config = cacheConfig();
        log.info("Producing EntityResolutionCache: provider={} maxEntries={} profileTtlDays={} cacheNegatives={}",
                providerBaseUrl, config.maxEntries(), profileTtlDays, config.cacheNegatives());

        NameNormalizer normalizer = NameNormalizer.withDefaultRules();
        HttpCompanyLookupClient client = HttpCompanyLookupClient.builder()
                .baseUrl(providerBaseUrl)
                .apiKey(providerApiKey.orElse(null))
                .timeout(Duration.ofSeconds(providerTimeoutSeconds))
                .minConfidence(minConfidence)
                .normalizer(normalizer)
                .objectMapper(objectMapper)
                .metrics(metrics)
                .build();

        return EntityResolutionCache.builder()
                .lookupClient(client)
                .profileClient(client)
                .lookupStore(new CaffeineLookupCacheStore(config))
                .profileStore(new CaffeineProfileCacheStore(config))
                .normalizer(normalizer)
                .retryExecutor(retryExecutor(metrics))
                .config(config)
                .metrics(metrics)
                .build();
    }

    public void closeCache(@Disposes EntityResolutionCache cache) {
        log.info("Closing EntityResolutionCache");
        cache.close();
    }

    @Produces
    @ApplicationScoped
    public DiscoveryAggregator discoveryAggregator(EntityResolutionCache cache, EndpointThrottle throttle,
                                                   MetricsService metrics) {
        DiscoveryOptions options = discoveryOptions();
        WebSearchClient search = TavilyWebSearchClient.builder()
                .baseUrl(webSearchBaseUrl)
                .apiKey(webSearchApiKey.orElseThrow(() -> new IllegalStateException(
                        "talent-sourcing.web-search.api-key is required for discovery")))
                .timeout(Duration.ofSeconds(webSearchTimeoutSeconds))
                .throttle(throttle)
                .objectMapper(objectMapper)
                .metrics(metrics)
                .build();
        CandidateExtractor extractor = new CandidateExtractor(options.maxCandidatesPerResultSet());
        RetryExecutor retry = retryExecutor(metrics);

        log.info("Producing DiscoveryAggregator: maxSeeds={} maxKeywordQueries={} maxCandidates={}",
                options.maxSeeds(), options.maxKeywordQueries(), options.maxCandidates());
        return new DiscoveryAggregator(List.of(
                new SeedExpansionStrategy(search, extractor, retry, options),
                new KeywordSearchStrategy(search, extractor, retry,
                        new SearchQueryPlanner(options.maxSeeds(), options.maxKeywordQueries()), options)),
                cache, options);
    }

    public void closeAggregator(@Disposes DiscoveryAggregator aggregator) {
        aggregator.close();
    }

    @Produces
    @ApplicationScoped
    public RelevanceScorer relevanceScorer(EntityResolutionCache cache, MetricsService metrics) {
        ScoringOptions options = new ScoringOptions(scoringBatchSize, 1, 10, scoringConcurrency);
        RelevanceClassifier classifier = createClassifier(metrics);
        log.info("Scoring: enabled={} provider={} batchSize={}",
                scoringEnabled, classifier.getProviderName(), options.batchSize());
        ScoreResponseParser parser = new ScoreResponseParser(objectMapper, cache.getNormalizer(),
                options.minScore(), options.maxScore());
        return new RelevanceScorer(classifier, parser, retryExecutor(metrics), options, metrics);
    }

    public void closeScorer(@Disposes RelevanceScorer scorer) {
        scorer.close();
    }

    @Produces
    @ApplicationScoped
    public SessionManager sessionManager(EndpointThrottle throttle, MetricsService metrics, TracingService tracing) {
        SessionConfig config = sessionConfig();
        log.info("Producing SessionManager: pageSize={} ttlHours={} maxPages={}",
                config.pageSize(), sessionTtlHours, config.maxPages());
        HttpSearchBackend backend = HttpSearchBackend.builder()
                .baseUrl(providerBaseUrl)
                .apiKey(providerApiKey.orElse(null))
                .timeout(Duration.ofSeconds(providerTimeoutSeconds * 3L))
                .objectMapper(objectMapper)
                .metrics(metrics)
                .build();
        return SessionManager.builder()
                .backend(backend)
                .config(config)
                .throttle(throttle)
                .retryExecutor(retryExecutor(metrics))
                .metrics(metrics)
                .tracing(tracing)
                .build();
    }

    @Produces
    @ApplicationScoped
    public PipelineOrchestrator pipelineOrchestrator(DiscoveryAggregator aggregator, RelevanceScorer scorer,
                                                     SessionManager sessionManager, MetricsService metrics,
                                                     TracingService tracing) {
        return PipelineOrchestrator.builder()
                .aggregator(aggregator)
                .scorer(scorer)
                .compiler(new QueryCompiler(CompilerOptions.defaults().withMaxTermsPerGroup(maxTermsPerGroup)))
                .sessionManager(sessionManager)
                .options(pipelineOptions())
                .metrics(metrics)
                .tracing(tracing)
                .build();
    }

    public void closeOrchestrator(@Disposes PipelineOrchestrator orchestrator) {
        log.info("Closing PipelineOrchestrator");
        orchestrator.close();
    }

    // ══════════════════════════════════════════════════════════
    //  Internal
    // ══════════════════════════════════════════════════════════

    CacheConfig cacheConfig() {
        return new CacheConfig(cacheMaxEntries, Duration.ofDays(positiveTtlDays), Duration.ofDays(negativeTtlDays),
                Duration.ofDays(profileTtlDays), cacheNegatives, batchConcurrency);
    }

    RetryPolicy retryPolicy() {
        return new RetryPolicy(retryMaxAttempts, Duration.ofMillis(retryBaseDelayMillis),
                Duration.ofMillis(retryMaxDelayMillis), 0.2);
    }

    DiscoveryOptions discoveryOptions() {
        DiscoveryOptions defaults = DiscoveryOptions.defaults();
        return new DiscoveryOptions(maxSeeds, maxKeywordQueries, resultsPerQuery,
                defaults.maxCandidatesPerResultSet(), maxCandidates, defaults.strategyConcurrency(),
                Duration.ofSeconds(strategyTimeoutSeconds), enrichProfiles);
    }

    SessionConfig sessionConfig() {
        return new SessionConfig(pageSize, Duration.ofHours(sessionTtlHours), Duration.ofMillis(minRequestIntervalMillis),
                maxPages, Duration.ofMinutes(pageCacheMinutes), SessionConfig.defaults().pageCacheMaxEntries());
    }

    PipelineOptions pipelineOptions() {
        return new PipelineOptions(scoringEnabled, maxSelectedEntities, keywordRequired, locationRequired,
                Duration.ofMinutes(runTimeoutMinutes));
    }

    RelevanceClassifier createClassifier(MetricsService metrics) {
        if (!scoringEnabled) {
            return new NoOpRelevanceClassifier();
        }
        if ("ollama".equalsIgnoreCase(scoringProvider)) {
            return OllamaRelevanceClassifier.builder()
                    .baseUrl(ollamaBaseUrl)
                    .model(ollamaModel)
                    .timeout(Duration.ofSeconds(ollamaTimeoutSeconds))
                    .objectMapper(objectMapper)
                    .metrics(metrics)
                    .build();
        }
        log.warn("Unknown scoring provider '{}', scoring will be skipped", scoringProvider);
        return new NoOpRelevanceClassifier();
    }

    private RetryExecutor retryExecutor(MetricsService metrics) {
        return new RetryExecutor(retryPolicy(), Sleeper.SYSTEM, () -> ThreadLocalRandom.current().nextDouble(), metrics);
    }
}
