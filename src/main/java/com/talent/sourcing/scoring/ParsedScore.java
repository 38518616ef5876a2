package com.talent.sourcing.scoring;

/**
 * The parser's verdict for one entity of a batch. A failed parse carries no score.
 */
public record ParsedScore(int index, Double score, String rationale, boolean parseFailed, String failureReason) {

    public ParsedScore {
        if (parseFailed && score != null) {
            throw new IllegalArgumentException("A failed parse must not carry a score");
        }
        if (!parseFailed && score == null) {
            throw new IllegalArgumentException("A successful parse needs a score");
        }
    }

    static ParsedScore ok(int index, double score, String rationale) {
        return new ParsedScore(index, score, rationale, false, null);
    }

    static ParsedScore failed(int index, String reason) {
        return new ParsedScore(index, null, null, true, reason);
    }
}
