package com.talent.sourcing.pipeline;

import com.fasterxml.jackson.databind.node.JsonNodeFactory;
import com.talent.sourcing.cache.BatchResolution;
import com.talent.sourcing.core.model.Entity;
import com.talent.sourcing.core.model.Provenance;
import com.talent.sourcing.core.model.Requirements;
import com.talent.sourcing.discovery.CandidateSet;
import com.talent.sourcing.discovery.DiscoveryAggregator;
import com.talent.sourcing.discovery.DiscoveryResult;
import com.talent.sourcing.external.EndpointThrottle;
import com.talent.sourcing.external.RetryExecutor;
import com.talent.sourcing.external.RetryPolicy;
import com.talent.sourcing.metrics.MicrometerMetricsService;
import com.talent.sourcing.progress.CancellationToken;
import com.talent.sourcing.progress.PipelineCancelledException;
import com.talent.sourcing.progress.PipelineStage;
import com.talent.sourcing.progress.ProgressEvent;
import com.talent.sourcing.progress.StagePhase;
import com.talent.sourcing.query.InvalidFilterException;
import com.talent.sourcing.query.QueryTree;
import com.talent.sourcing.rules.NameNormalizer;
import com.talent.sourcing.scoring.RelevanceScorer;
import com.talent.sourcing.scoring.ScoredResultSet;
import com.talent.sourcing.session.PersonRecord;
import com.talent.sourcing.session.SearchBackend;
import com.talent.sourcing.session.SearchPage;
import com.talent.sourcing.session.SessionManager;
import com.talent.sourcing.session.SessionPage;
import io.micrometer.core.instrument.simple.SimpleMeterRegistry;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;
import org.mockito.junit.jupiter.MockitoSettings;
import org.mockito.quality.Strictness;

import java.time.Duration;
import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Map;
import java.util.concurrent.CopyOnWriteArrayList;

import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyList;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

@ExtendWith(MockitoExtension.class)
@MockitoSettings(strictness = Strictness.LENIENT)
@DisplayName("PipelineOrchestrator Tests")
class PipelineOrchestratorTest {

    private static final NameNormalizer NORMALIZER = NameNormalizer.withDefaultRules();

    private static final Requirements REQUIREMENTS = Requirements.builder()
            .roleTitle("Backend Engineer")
            .mustHave(List.of("Kotlin"))
            .seedEntities(List.of("Acme"))
            .location("Berlin")
            .build();

    @Mock
    private DiscoveryAggregator aggregator;

    @Mock
    private RelevanceScorer scorer;

    private final List<ProgressEvent> events = new CopyOnWriteArrayList<>();
    private final List<QueryTree> searchedQueries = Collections.synchronizedList(new ArrayList<>());
    private SimpleMeterRegistry registry;
    private SessionManager sessions;
    private PipelineOrchestrator pipeline;

    private static Entity entity(String name, String stableId) {
        Entity entity = Entity.builder()
                .name(name)
                .normalizedKey(NORMALIZER.normalizeKey(name))
                .provenance(Provenance.mentioned())
                .build();
        return stableId != null ? entity.withStableId(stableId, 0.95) : entity;
    }

    private static DiscoveryResult discovered(List<Entity> entities) {
        CandidateSet candidates = new CandidateSet(List.of(), entities.size(), 0, 0, 0, 0, 3, 0, Map.of());
        int resolved = (int) entities.stream().filter(Entity::isResolved).count();
        BatchResolution resolution = new BatchResolution(List.of(), resolved, entities.size() - resolved, 0, 0, 0);
        return new DiscoveryResult(entities, candidates, resolution, Map.of());
    }

    private static CandidateSet emptyCandidates() {
        return new CandidateSet(List.of(), 0, 0, 0, 0, 0, 0, 0, Map.of());
    }

    @BeforeEach
    void setUp() {
        registry = new SimpleMeterRegistry();
        SearchBackend backend = new SearchBackend() {
            @Override
            public SearchPage fetchPage(QueryTree query, int page, int pageSize) {
                searchedQueries.add(query);
                List<PersonRecord> records = new ArrayList<>();
                for (int i = 0; i < pageSize; i++) {
                    String id = "person-" + ((page - 1) * pageSize + i);
                    records.add(new PersonRecord(id, JsonNodeFactory.instance.objectNode().put("id", id)));
                }
                return new SearchPage(records, 87);
            }

            @Override
            public String endpointName() {
                return "person-search";
            }
        };
        sessions = SessionManager.builder()
                .backend(backend)
                .throttle(new EndpointThrottle(Duration.ZERO))
                .retryExecutor(new RetryExecutor(RetryPolicy.noRetry()))
                .build();

        when(aggregator.collectCandidates(any(), any())).thenReturn(emptyCandidates());
        when(aggregator.resolveCandidates(any(), any(), any())).thenReturn(discovered(List.of(
                entity("Acme", "id-acme"),
                entity("Initech", null),
                entity("Globex", "id-globex"))));
        when(scorer.isAvailable()).thenReturn(true);
        when(scorer.score(anyList(), any(), any(), any())).thenAnswer(invocation -> {
            List<Entity> entities = invocation.getArgument(0);
            Map<String, Double> scores = Map.of("Acme", 6.0, "Initech", 8.0, "Globex", 9.0);
            List<Entity> scored = new ArrayList<>();
            for (Entity entity : entities) {
                scored.add(entity.withScore(scores.get(entity.getName()), null));
            }
            return ScoredResultSet.rank(scored);
        });

        pipeline = pipeline(PipelineOptions.defaults());
    }

    private PipelineOrchestrator pipeline(PipelineOptions options) {
        return PipelineOrchestrator.builder()
                .aggregator(aggregator)
                .scorer(scorer)
                .sessionManager(sessions)
                .options(options)
                .metrics(new MicrometerMetricsService(registry))
                .build();
    }

    @AfterEach
    void tearDown() {
        pipeline.close();
    }

    private List<String> phases() {
        return events.stream().map(e -> e.stage() + " " + e.phase()).toList();
    }

    @Nested
    @DisplayName("Full run")
    class FullRun {

        @Test
        @DisplayName("Should emit ordered events for every stage")
        void emitsOrderedEventsForEveryStage() {
            PipelineResult result = pipeline.run(REQUIREMENTS, events::add, CancellationToken.create());

            assertEquals(List.of(
                    "DISCOVERY STARTED", "DISCOVERY COMPLETED",
                    "RESOLUTION STARTED", "RESOLUTION COMPLETED",
                    "SCORING STARTED", "SCORING COMPLETED",
                    "QUERY STARTED", "QUERY COMPLETED",
                    "SAMPLING STARTED", "SAMPLING COMPLETED"), phases());
            for (int i = 0; i < events.size(); i++) {
                assertEquals(i + 1, events.get(i).sequence());
                assertEquals(result.runId(), events.get(i).runId());
            }
            assertEquals(2, events.get(3).count("resolved"));
            assertEquals(3, events.get(5).count("scored"));
            assertEquals(20, events.get(9).count("records"));
        }

        @Test
        @DisplayName("Should select resolved entities in ranking order")
        void selectsResolvedEntitiesInRankingOrder() {
            PipelineResult result = pipeline.run(REQUIREMENTS, events::add, CancellationToken.create());

            assertEquals(List.of("Globex", "Initech", "Acme"),
                    result.outcome().ranking().entities().stream().map(Entity::getName).toList());
            assertEquals(List.of("Globex", "Acme"), result.selected().stream().map(Entity::getName).toList());

            String query = result.getQuery().orElseThrow().toJsonString();
            assertTrue(query.contains("id-globex"));
            assertTrue(query.contains("id-acme"));
            assertTrue(query.contains("Backend Engineer"));
            assertTrue(query.contains("Berlin"));

            SessionPage firstPage = result.getFirstPage().orElseThrow();
            assertEquals(20, firstPage.records().size());
            assertTrue(firstPage.hasMore());
            assertEquals(20, pipeline.loadMore(firstPage.sessionId(), 20).records().size());
            assertEquals(2, searchedQueries.size());
        }

        @Test
        @DisplayName("Should record a duration for each stage")
        void recordsStageDurations() {
            pipeline.run(REQUIREMENTS, null, null);

            for (PipelineStage stage : PipelineStage.values()) {
                assertEquals(1, registry.get("sourcing.stage.duration").tag("stage", stage.name()).timer().count());
            }
        }

        @Test
        @DisplayName("Should cap the selection")
        void selectionIsCappedByOptions() {
            pipeline.close();
            pipeline = pipeline(new PipelineOptions(true, 1, false, false, Duration.ofMinutes(1)));

            PipelineResult result = pipeline.run(REQUIREMENTS, events::add, CancellationToken.create());

            assertEquals(List.of("Globex"), result.selected().stream().map(Entity::getName).toList());
        }
    }

    @Nested
    @DisplayName("Skipped stages")
    class SkippedStages {

        @Test
        @DisplayName("Should keep discovery order when scoring is disabled")
        void disabledScoringKeepsDiscoveryOrder() {
            pipeline.close();
            pipeline = pipeline(PipelineOptions.defaults().withScoringEnabled(false));

            PipelineResult result = pipeline.run(REQUIREMENTS, events::add, CancellationToken.create());

            ProgressEvent scoring = events.get(4);
            assertEquals(PipelineStage.SCORING, scoring.stage());
            assertEquals(StagePhase.SKIPPED, scoring.phase());
            assertEquals("scoring disabled", scoring.message());
            assertTrue(result.outcome().ranking().scoringSkipped());
            assertEquals(List.of("Acme", "Globex"), result.selected().stream().map(Entity::getName).toList());
            assertTrue(result.outcome().ranking().entities().stream().noneMatch(Entity::isScored));
            assertEquals(3.0, registry.get("sourcing.scoring.unscored").counter().count());
            verify(scorer, never()).score(anyList(), any(), any(), any());
        }

        @Test
        @DisplayName("Should skip scoring when the classifier is unavailable")
        void unavailableClassifierSkipsScoring() {
            when(scorer.isAvailable()).thenReturn(false);

            PipelineResult result = pipeline.run(REQUIREMENTS, events::add, CancellationToken.create());

            assertEquals("classifier unavailable", events.get(4).message());
            assertTrue(result.getFirstPage().isPresent());
        }

        @Test
        @DisplayName("Should skip person search without resolved entities")
        void noResolvedEntitiesSkipsPersonSearch() {
            when(aggregator.resolveCandidates(any(), any(), any())).thenReturn(discovered(List.of(
                    entity("Acme", null), entity("Globex", null))));

            PipelineResult result = pipeline.run(REQUIREMENTS, events::add, CancellationToken.create());

            assertTrue(result.selected().isEmpty());
            assertTrue(result.getQuery().isEmpty());
            assertTrue(result.getFirstPage().isEmpty());
            assertEquals(List.of("QUERY SKIPPED", "SAMPLING SKIPPED"), phases().subList(6, 8));
            assertEquals("no resolved organizations", events.get(7).message());
            assertTrue(searchedQueries.isEmpty());
        }

        @Test
        @DisplayName("Should require a resolved entity to search people")
        void searchPeopleRequiresAResolvedEntity() {
            assertThrows(InvalidFilterException.class, () -> pipeline.searchPeople(
                    List.of(entity("Acme", null)), REQUIREMENTS, events::add, null));

            assertEquals(List.of("QUERY STARTED", "QUERY FAILED"), phases());
        }
    }

    @Nested
    @DisplayName("Abort")
    class Abort {

        @Test
        @DisplayName("Should fail the running stage on cancellation")
        void cancellationFailsTheRunningStage() {
            CancellationToken token = CancellationToken.create();
            when(aggregator.resolveCandidates(any(), any(), any())).thenAnswer(invocation -> {
                token.cancel("user aborted");
                token.throwIfCancelled();
                return null;
            });

            assertThrows(PipelineCancelledException.class,
                    () -> pipeline.run(REQUIREMENTS, events::add, token));

            assertEquals(List.of("DISCOVERY STARTED", "DISCOVERY COMPLETED", "RESOLUTION STARTED", "RESOLUTION FAILED"),
                    phases());
            assertTrue(events.get(3).message().startsWith("cancelled"));
            verify(scorer, never()).score(anyList(), any(), any(), any());
        }

        @Test
        @DisplayName("Should cancel the run at its deadline")
        void deadlineCancelsTheRun() {
            pipeline.close();
            pipeline = pipeline(PipelineOptions.defaults().withRunTimeout(Duration.ofMillis(50)));
            when(aggregator.collectCandidates(any(), any())).thenAnswer(invocation -> {
                CancellationToken token = invocation.getArgument(1);
                long giveUp = System.currentTimeMillis() + 5_000;
                while (!token.isCancelled() && System.currentTimeMillis() < giveUp) {
                    Thread.sleep(5);
                }
                token.throwIfCancelled();
                return emptyCandidates();
            });

            PipelineTimeoutException e = assertThrows(PipelineTimeoutException.class,
                    () -> pipeline.run(REQUIREMENTS, events::add, CancellationToken.create()));

            assertEquals(Duration.ofMillis(50), e.getTimeout());
            assertInstanceOf(PipelineCancelledException.class, e.getCause());
            assertEquals(StagePhase.FAILED, events.get(events.size() - 1).phase());
        }

        @Test
        @DisplayName("Should propagate a stage failure")
        void stageFailurePropagates() {
            when(aggregator.collectCandidates(any(), any())).thenThrow(new IllegalStateException("no strategies ran"));

            IllegalStateException e = assertThrows(IllegalStateException.class,
                    () -> pipeline.run(REQUIREMENTS, events::add, CancellationToken.create()));

            assertEquals("no strategies ran", e.getMessage());
            assertEquals(List.of("DISCOVERY STARTED", "DISCOVERY FAILED"), phases());
            assertEquals("no strategies ran", events.get(1).message());
        }
    }

    @Test
    @DisplayName("Should stop after ranking when only discovering")
    void discoverStopsAfterRanking() {
        DiscoveryOutcome outcome = pipeline.discover(REQUIREMENTS, events::add, null);

        assertEquals(3, outcome.ranking().scoredCount());
        assertEquals(2, outcome.discovery().resolvedEntities().size());
        assertEquals(PipelineStage.SCORING, events.get(events.size() - 1).stage());
        assertTrue(searchedQueries.isEmpty());
    }
}
