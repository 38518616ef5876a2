package com.talent.sourcing.progress;

import com.talent.sourcing.MutableClock;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.TimeUnit;

import static org.junit.jupiter.api.Assertions.*;

@DisplayName("ProgressReporter Tests")
class ProgressReporterTest {

    @Nested
    @DisplayName("Event stream")
    class EventStream {

        @Test
        @DisplayName("Should number events from one")
        void numbersEventsFromOne() {
            List<ProgressEvent> events = new ArrayList<>();
            MutableClock clock = MutableClock.startingAt("2026-03-01T09:00:00Z");
            ProgressReporter reporter = new ProgressReporter("run-1", events::add, clock);

            reporter.started(PipelineStage.DISCOVERY, Map.of());
            clock.advance(Duration.ofSeconds(3));
            reporter.completed(PipelineStage.DISCOVERY, Map.of("candidates", 12L));
            reporter.skipped(PipelineStage.SCORING, "scoring disabled");
            reporter.failed(PipelineStage.QUERY, "no ids");

            assertEquals(List.of(1L, 2L, 3L, 4L), events.stream().map(ProgressEvent::sequence).toList());
            assertEquals(StagePhase.COMPLETED, events.get(1).phase());
            assertEquals(12L, events.get(1).count("candidates"));
            assertEquals(0L, events.get(1).count("missing"));
            assertEquals(Instant.parse("2026-03-01T09:00:03Z"), events.get(1).timestamp());
            assertEquals("scoring disabled", events.get(2).message());
            assertTrue(events.stream().allMatch(e -> e.runId().equals("run-1")));
        }

        @Test
        @DisplayName("Should emit progress counts through the callback")
        void callbackEmitsProgressCounts() {
            List<ProgressEvent> events = new ArrayList<>();
            ProgressReporter reporter = new ProgressReporter("run-2", events::add);

            ProgressCallback callback = reporter.callbackFor(PipelineStage.RESOLUTION);
            callback.onProgress(3, 10, "Acme");
            callback.onProgress(10, 10, null);

            ProgressEvent first = events.get(0);
            assertEquals(PipelineStage.RESOLUTION, first.stage());
            assertEquals(StagePhase.PROGRESS, first.phase());
            assertEquals(List.of("processed", "total"), new ArrayList<>(first.counts().keySet()));
            assertEquals(3L, first.count("processed"));
            assertEquals("Acme", first.message());
            assertEquals(10L, events.get(1).count("processed"));
        }

        @Test
        @DisplayName("Should give concurrent emitters strictly increasing sequences")
        void concurrentEmittersGetStrictlyIncreasingSequences() throws Exception {
            List<ProgressEvent> events = new CopyOnWriteArrayList<>();
            ProgressReporter reporter = new ProgressReporter("run-3", events::add);
            ExecutorService pool = Executors.newFixedThreadPool(4);
            for (int i = 0; i < 200; i++) {
                pool.submit(() -> reporter.progress(PipelineStage.SCORING, Map.of()));
            }
            pool.shutdown();
            assertTrue(pool.awaitTermination(10, TimeUnit.SECONDS));

            assertEquals(200, events.size());
            for (int i = 0; i < events.size(); i++) {
                assertEquals(i + 1, events.get(i).sequence());
            }
        }
    }

    @Test
    @DisplayName("Should keep reporting when the listener fails")
    void failingListenerDoesNotStopTheReporter() {
        List<Long> seen = new ArrayList<>();
        ProgressReporter reporter = new ProgressReporter("run-4", event -> {
            seen.add(event.sequence());
            throw new IllegalStateException("websocket closed");
        });

        assertDoesNotThrow(() -> reporter.started(PipelineStage.DISCOVERY, Map.of()));
        reporter.completed(PipelineStage.DISCOVERY, Map.of());

        assertEquals(List.of(1L, 2L), seen);
    }

    @Test
    @DisplayName("Should accept a null listener")
    void nullListenerIsSilent() {
        ProgressReporter reporter = new ProgressReporter("run-5", null);

        assertDoesNotThrow(() -> reporter.started(PipelineStage.SAMPLING, Map.of()));
        assertEquals("run-6", ProgressReporter.silent("run-6").getRunId());
    }

    @Test
    @DisplayName("Should keep event counts immutable")
    void eventCountsAreImmutable() {
        ProgressEvent event = new ProgressEvent("run", 1, PipelineStage.QUERY, StagePhase.STARTED, null, null,
                Instant.EPOCH);

        assertTrue(event.counts().isEmpty());
        assertThrows(UnsupportedOperationException.class, () -> event.counts().put("x", 1L));
        assertThrows(NullPointerException.class, () -> new ProgressEvent(null, 1, PipelineStage.QUERY,
                StagePhase.STARTED, Map.of(), null, Instant.EPOCH));
    }

    @Nested
    @DisplayName("CancellationToken")
    class Cancellation {

        @Test
        @DisplayName("Should keep the first cancellation reason")
        void firstReasonWins() {
            CancellationToken token = CancellationToken.create();
            assertFalse(token.isCancelled());
            assertDoesNotThrow(token::throwIfCancelled);

            token.cancel("user aborted");
            token.cancel("deadline");

            assertTrue(token.isCancelled());
            assertEquals("user aborted", token.getReason());
            PipelineCancelledException e = assertThrows(PipelineCancelledException.class, token::throwIfCancelled);
            assertEquals("Run cancelled: user aborted", e.getMessage());
        }

        @Test
        @DisplayName("Should use \"cancelled\" for a null reason")
        void nullReasonBecomesCancelled() {
            CancellationToken token = CancellationToken.create();
            token.cancel(null);

            assertEquals("cancelled", token.getReason());
        }

        @Test
        @DisplayName("Should cancel a child with its parent but not the other way round")
        void childFollowsParent() {
            CancellationToken parent = CancellationToken.create();
            CancellationToken first = parent.child();
            CancellationToken second = parent.child();

            first.cancel("strategy timed out");
            assertTrue(first.isCancelled());
            assertFalse(parent.isCancelled());
            assertFalse(second.isCancelled());

            parent.cancel("user aborted");
            assertEquals("user aborted", second.getReason());
            assertEquals("strategy timed out", first.getReason());
            assertThrows(PipelineCancelledException.class, second::throwIfCancelled);
        }
    }
}
