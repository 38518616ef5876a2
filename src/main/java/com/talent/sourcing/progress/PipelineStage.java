package com.talent.sourcing.progress;

/**
 * Stages of a sourcing run, in execution order.
 */
public enum PipelineStage {
    DISCOVERY,
    RESOLUTION,
    SCORING,
    QUERY,
    SAMPLING
}
