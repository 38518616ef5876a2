package com.talent.sourcing.progress;

import java.time.Instant;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Objects;

/**
 * A status event pushed to the caller during a run.
 *
 * @param runId     the run the event belongs to
 * @param sequence  strictly increasing within a run, starting at 1
 * @param stage     pipeline stage
 * @param phase     stage phase
 * @param counts    named counters (processed, total, failed, ...), in insertion order
 * @param message   optional human-readable detail
 * @param timestamp emission time
 */
public record ProgressEvent(String runId, long sequence, PipelineStage stage, StagePhase phase,
                            Map<String, Long> counts, String message, Instant timestamp) {

    public ProgressEvent {
        Objects.requireNonNull(runId, "runId is required");
        Objects.requireNonNull(stage, "stage is required");
        Objects.requireNonNull(phase, "phase is required");
        counts = counts == null ? Map.of() : Collections.unmodifiableMap(new LinkedHashMap<>(counts));
    }

    public long count(String name) {
        return counts.getOrDefault(name, 0L);
    }
}
