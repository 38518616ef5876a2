package com.talent.sourcing.scoring;

/**
 * External classifier that rates how relevant organizations are for a hiring need.
 * Implementations return the raw response text; {@link ScoreResponseParser} interprets it.
 */
public interface RelevanceClassifier {

    /**
     * Returns the classifier's raw answer for the batch, expected to be JSON of the form
     * {@code {"scores":[{"index":0,"score":8,"rationale":"..."}]}}.
     *
     * @throws com.talent.sourcing.external.ExternalTransientException on network errors and timeouts
     * @throws com.talent.sourcing.external.ExternalPermanentException when the request is rejected
     */
    String classify(ClassificationRequest request);

    String getProviderName();

    /**
     * Whether the classifier can be reached. When false the scoring stage is skipped.
     */
    boolean isAvailable();
}
