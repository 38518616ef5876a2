package com.talent.sourcing.progress;

public enum StagePhase {
    STARTED,
    PROGRESS,
    COMPLETED,
    SKIPPED,
    FAILED
}
