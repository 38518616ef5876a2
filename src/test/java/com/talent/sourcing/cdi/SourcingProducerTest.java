package com.talent.sourcing.cdi;

import com.talent.sourcing.cache.CacheConfig;
import com.talent.sourcing.cache.EntityResolutionCache;
import com.talent.sourcing.discovery.DiscoveryOptions;
import com.talent.sourcing.external.EndpointThrottle;
import com.talent.sourcing.external.RetryPolicy;
import com.talent.sourcing.metrics.MicrometerMetricsService;
import com.talent.sourcing.metrics.NoOpMetricsService;
import com.talent.sourcing.pipeline.PipelineOptions;
import com.talent.sourcing.scoring.NoOpRelevanceClassifier;
import com.talent.sourcing.scoring.OllamaRelevanceClassifier;
import com.talent.sourcing.session.SessionConfig;
import com.talent.sourcing.tracing.NoOpTracingService;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

import java.time.Duration;
import java.util.Optional;

import static org.junit.jupiter.api.Assertions.*;

@DisplayName("SourcingProducer Tests")
class SourcingProducerTest {

    private SourcingProducer producer;

    /**
     * Mirrors the values in META-INF/microprofile-config.properties.
     */
    @BeforeEach
    void setUp() {
        producer = new SourcingProducer();
        producer.providerBaseUrl = "https://api.example-data.com";
        producer.providerApiKey = Optional.of("provider-key");
        producer.providerTimeoutSeconds = 10;
        producer.minConfidence = 0.8;
        producer.webSearchBaseUrl = "https://api.tavily.com";
        producer.webSearchApiKey = Optional.empty();
        producer.webSearchTimeoutSeconds = 15;
        producer.cacheMaxEntries = 100_000;
        producer.positiveTtlDays = 180;
        producer.negativeTtlDays = 7;
        producer.profileTtlDays = 90;
        producer.cacheNegatives = true;
        producer.batchConcurrency = 8;
        producer.retryMaxAttempts = 3;
        producer.retryBaseDelayMillis = 1000;
        producer.retryMaxDelayMillis = 8000;
        producer.minRequestIntervalMillis = 1000;
        producer.maxSeeds = 3;
        producer.maxKeywordQueries = 5;
        producer.resultsPerQuery = 10;
        producer.maxCandidates = 100;
        producer.strategyTimeoutSeconds = 120;
        producer.enrichProfiles = false;
        producer.scoringEnabled = true;
        producer.scoringProvider = "ollama";
        producer.scoringBatchSize = 20;
        producer.scoringConcurrency = 2;
        producer.ollamaBaseUrl = "http://localhost:11434";
        producer.ollamaModel = "llama3.2";
        producer.ollamaTimeoutSeconds = 60;
        producer.pageSize = 20;
        producer.sessionTtlHours = 24;
        producer.maxPages = 5;
        producer.pageCacheMinutes = 60;
        producer.maxSelectedEntities = 50;
        producer.keywordRequired = false;
        producer.locationRequired = false;
        producer.runTimeoutMinutes = 10;
        producer.maxTermsPerGroup = 100;
        producer.metricsEnabled = true;
        producer.tracingEnabled = false;
    }

    @Nested
    @DisplayName("Configuration mapping")
    class ConfigurationMapping {

        @Test
        @DisplayName("Should build cache config with TTLs in days")
        void cacheConfigUsesDayTtls() {
            CacheConfig config = producer.cacheConfig();

            assertEquals(Duration.ofDays(180), config.positiveTtl());
            assertEquals(Duration.ofDays(7), config.negativeTtl());
            assertEquals(Duration.ofDays(90), config.profileTtl());
            assertTrue(config.cacheNegatives());
            assertEquals(8, config.batchConcurrency());
        }

        @Test
        @DisplayName("Should build the default retry policy")
        void retryPolicyMatchesDefaults() {
            assertEquals(RetryPolicy.defaults(), producer.retryPolicy());
        }

        @Test
        @DisplayName("Should map discovery and session settings")
        void discoveryAndSessionOptions() {
            DiscoveryOptions discovery = producer.discoveryOptions();
            assertEquals(3, discovery.maxSeeds());
            assertEquals(Duration.ofMinutes(2), discovery.strategyTimeout());
            assertFalse(discovery.enrichProfiles());

            SessionConfig sessions = producer.sessionConfig();
            assertEquals(SessionConfig.defaults(), sessions);
        }

        @Test
        @DisplayName("Should build the default pipeline options")
        void pipelineOptionsMatchDefaults() {
            assertEquals(PipelineOptions.defaults(), producer.pipelineOptions());
        }
    }

    @Nested
    @DisplayName("Component selection")
    class ComponentSelection {

        @Test
        @DisplayName("Should pick the classifier from the provider setting")
        void classifierFollowsProviderSetting() {
            assertInstanceOf(OllamaRelevanceClassifier.class, producer.createClassifier(new NoOpMetricsService()));

            producer.scoringProvider = "unknown";
            assertInstanceOf(NoOpRelevanceClassifier.class, producer.createClassifier(new NoOpMetricsService()));

            producer.scoringProvider = "ollama";
            producer.scoringEnabled = false;
            assertInstanceOf(NoOpRelevanceClassifier.class, producer.createClassifier(new NoOpMetricsService()));
        }

        @Test
        @DisplayName("Should switch metrics and tracing on and off")
        void observabilityToggles() {
            assertInstanceOf(MicrometerMetricsService.class, producer.metricsService());
            assertInstanceOf(NoOpTracingService.class, producer.tracingService());

            producer.metricsEnabled = false;
            assertInstanceOf(NoOpMetricsService.class, producer.metricsService());
        }

        @Test
        @DisplayName("Should require a web-search API key for discovery")
        void discoveryRequiresWebSearchKey() {
            EntityResolutionCache cache = producer.entityResolutionCache(new NoOpMetricsService());
            try {
                IllegalStateException e = assertThrows(IllegalStateException.class, () -> producer.discoveryAggregator(
                        cache, new EndpointThrottle(Duration.ZERO), new NoOpMetricsService()));
                assertTrue(e.getMessage().contains("web-search.api-key"));
            } finally {
                producer.closeCache(cache);
            }
        }
    }
}
