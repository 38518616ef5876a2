package com.talent.sourcing.lookup;

/**
 * Combines name similarity with the backend relevance score:
 * {@code 0.7 * similarity + 0.3 * min(score / 10, 1)}.
 */
public final class MatchConfidence {

    public static final double NAME_WEIGHT = 0.7;
    public static final double SCORE_WEIGHT = 0.3;
    public static final double SCORE_SCALE = 10.0;

    private MatchConfidence() {
    }

    public static double combine(double nameSimilarity, double backendScore) {
        double similarity = Math.max(0.0, Math.min(1.0, nameSimilarity));
        double normalizedScore = Math.max(0.0, Math.min(1.0, backendScore / SCORE_SCALE));
        return NAME_WEIGHT * similarity + SCORE_WEIGHT * normalizedScore;
    }
}
