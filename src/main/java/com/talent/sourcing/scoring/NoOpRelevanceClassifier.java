package com.talent.sourcing.scoring;

/**
 * Classifier used when scoring is not configured. Always unavailable, so the stage is skipped.
 */
public class NoOpRelevanceClassifier implements RelevanceClassifier {

    @Override
    public String classify(ClassificationRequest request) {
        throw new IllegalStateException("No relevance classifier configured");
    }

    @Override
    public String getProviderName() {
        return "NoOp";
    }

    @Override
    public boolean isAvailable() {
        return false;
    }
}
