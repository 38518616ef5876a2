package com.talent.sourcing.scoring;

/**
 * @param batchSize   entities per classifier call
 * @param minScore    lowest valid score
 * @param maxScore    highest valid score
 * @param concurrency classifier calls in flight at once
 */
public record ScoringOptions(int batchSize, int minScore, int maxScore, int concurrency) {

    public ScoringOptions {
        if (batchSize < 1) {
            throw new IllegalArgumentException("batchSize must be >= 1");
        }
        if (minScore >= maxScore) {
            throw new IllegalArgumentException("minScore must be < maxScore");
        }
        if (concurrency < 1) {
            throw new IllegalArgumentException("concurrency must be >= 1");
        }
    }

    /**
     * Batches of 20, scores 1 to 10, 2 concurrent calls.
     */
    public static ScoringOptions defaults() {
        return new ScoringOptions(20, 1, 10, 2);
    }
}
