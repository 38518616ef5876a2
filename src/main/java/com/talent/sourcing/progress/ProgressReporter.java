package com.talent.sourcing.progress;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Clock;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Emits the ordered event stream of one run. Emission is serialized so that listeners
 * see strictly increasing sequence numbers even when stages report from worker threads.
 * A listener that throws is logged and otherwise ignored.
 */
public class ProgressReporter {
    private static final Logger log = LoggerFactory.getLogger(ProgressReporter.class);

    private final String runId;
    private final ProgressListener listener;
    private final Clock clock;
    private long sequence;

    public ProgressReporter(String runId, ProgressListener listener) {
        this(runId, listener, Clock.systemUTC());
    }

    public ProgressReporter(String runId, ProgressListener listener, Clock clock) {
        this.runId = runId;
        this.listener = listener != null ? listener : ProgressListener.NOOP;
        this.clock = clock;
    }

    /**
     * A reporter that drops every event.
     */
    public static ProgressReporter silent(String runId) {
        return new ProgressReporter(runId, ProgressListener.NOOP);
    }

    public String getRunId() {
        return runId;
    }

    public void started(PipelineStage stage, Map<String, Long> counts) {
        emit(stage, StagePhase.STARTED, counts, null);
    }

    public void progress(PipelineStage stage, Map<String, Long> counts) {
        emit(stage, StagePhase.PROGRESS, counts, null);
    }

    public void completed(PipelineStage stage, Map<String, Long> counts) {
        emit(stage, StagePhase.COMPLETED, counts, null);
    }

    public void skipped(PipelineStage stage, String reason) {
        emit(stage, StagePhase.SKIPPED, Map.of(), reason);
    }

    public void failed(PipelineStage stage, String reason) {
        emit(stage, StagePhase.FAILED, Map.of(), reason);
    }

    /**
     * Adapts per-item progress of {@code stage} into PROGRESS events with
     * {@code processed} and {@code total} counts.
     */
    public ProgressCallback callbackFor(PipelineStage stage) {
        return (processed, total, message) -> {
            Map<String, Long> counts = new LinkedHashMap<>();
            counts.put("processed", processed);
            counts.put("total", total);
            emit(stage, StagePhase.PROGRESS, counts, message);
        };
    }

    public synchronized void emit(PipelineStage stage, StagePhase phase, Map<String, Long> counts, String message) {
        ProgressEvent event = new ProgressEvent(runId, ++sequence, stage, phase, counts, message, clock.instant());
        try {
            listener.onEvent(event);
        } catch (RuntimeException e) {
            log.warn("progress.listenerFailed runId={} stage={} phase={} error={}",
                    runId, stage, phase, e.getMessage(), e);
        }
    }
}
