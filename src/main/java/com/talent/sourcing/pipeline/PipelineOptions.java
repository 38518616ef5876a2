package com.talent.sourcing.pipeline;

import java.time.Duration;

/**
 * @param scoringEnabled      whether the relevance scoring stage runs
 * @param maxSelectedEntities resolved organizations used to build the person search
 * @param keywordRequired     whether title keywords must match, rather than only boost
 * @param locationRequired    whether the location must match, rather than only boost
 * @param runTimeout          deadline for a whole {@code run}
 */
public record PipelineOptions(boolean scoringEnabled, int maxSelectedEntities, boolean keywordRequired,
                              boolean locationRequired, Duration runTimeout) {

    public PipelineOptions {
        if (maxSelectedEntities < 1) {
            throw new IllegalArgumentException("maxSelectedEntities must be >= 1");
        }
        if (runTimeout == null || runTimeout.isNegative() || runTimeout.isZero()) {
            throw new IllegalArgumentException("runTimeout must be > 0");
        }
    }

    /**
     * Scoring on, 50 organizations, optional keyword and location, 10 minute deadline.
     */
    public static PipelineOptions defaults() {
        return new PipelineOptions(true, 50, false, false, Duration.ofMinutes(10));
    }

    public PipelineOptions withScoringEnabled(boolean enabled) {
        return new PipelineOptions(enabled, maxSelectedEntities, keywordRequired, locationRequired, runTimeout);
    }

    public PipelineOptions withRunTimeout(Duration timeout) {
        return new PipelineOptions(scoringEnabled, maxSelectedEntities, keywordRequired, locationRequired, timeout);
    }

    public PipelineOptions withKeywordRequired(boolean required) {
        return new PipelineOptions(scoringEnabled, maxSelectedEntities, required, locationRequired, runTimeout);
    }
}
