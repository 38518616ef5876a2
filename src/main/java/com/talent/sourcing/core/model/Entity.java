package com.talent.sourcing.core.model;

import java.util.Objects;
import java.util.Optional;
import java.util.OptionalDouble;

/**
 * A discovered organization.
 *
 * <p>Instances are immutable: resolution and scoring produce new instances via the
 * {@code with*} methods, so an entity handed to a caller inside a result set never changes.
 * A relevance score is present if and only if {@link #isScored()} is true; an entity whose
 * scoring was skipped or failed carries no numeric score at all.</p>
 */
public final class Entity {

    private final String name;
    private final String normalizedKey;
    private final String stableId;
    private final double resolutionConfidence;
    private final EntityMetadata metadata;
    private final Provenance provenance;
    private final Double relevanceScore;
    private final String scoreRationale;
    private final String scoreFailureReason;

    private Entity(Builder builder) {
        if (builder.name == null || builder.name.isBlank()) {
            throw new IllegalArgumentException("Entity name is required");
        }
        if (builder.normalizedKey == null || builder.normalizedKey.isEmpty()) {
            throw new IllegalArgumentException("Entity normalizedKey is required");
        }
        this.name = builder.name.strip();
        this.normalizedKey = builder.normalizedKey;
        this.stableId = builder.stableId;
        this.resolutionConfidence = builder.stableId != null ? builder.resolutionConfidence : 0.0;
        this.metadata = builder.metadata != null ? builder.metadata : EntityMetadata.empty();
        this.provenance = Objects.requireNonNull(builder.provenance, "provenance is required");
        this.relevanceScore = builder.relevanceScore;
        this.scoreRationale = builder.relevanceScore != null ? builder.scoreRationale : null;
        this.scoreFailureReason = builder.relevanceScore == null ? builder.scoreFailureReason : null;
    }

    public String getName() {
        return name;
    }

    public String getNormalizedKey() {
        return normalizedKey;
    }

    public Optional<String> getStableId() {
        return Optional.ofNullable(stableId);
    }

    public boolean isResolved() {
        return stableId != null;
    }

    public double getResolutionConfidence() {
        return resolutionConfidence;
    }

    public EntityMetadata getMetadata() {
        return metadata;
    }

    public Provenance getProvenance() {
        return provenance;
    }

    public OptionalDouble getRelevanceScore() {
        return relevanceScore != null ? OptionalDouble.of(relevanceScore) : OptionalDouble.empty();
    }

    public boolean isScored() {
        return relevanceScore != null;
    }

    public Optional<String> getScoreRationale() {
        return Optional.ofNullable(scoreRationale);
    }

    /**
     * Why this entity carries no score, when scoring was attempted and failed.
     */
    public Optional<String> getScoreFailureReason() {
        return Optional.ofNullable(scoreFailureReason);
    }

    public Entity withStableId(String stableId, double confidence) {
        return toBuilder().stableId(stableId).resolutionConfidence(confidence).build();
    }

    public Entity withMetadata(EntityMetadata metadata) {
        return toBuilder().metadata(metadata).build();
    }

    public Entity withScore(double score, String rationale) {
        return toBuilder().relevanceScore(score).scoreRationale(rationale).scoreFailureReason(null).build();
    }

    public Entity withoutScore(String failureReason) {
        return toBuilder().relevanceScore(null).scoreRationale(null).scoreFailureReason(failureReason).build();
    }

    public Builder toBuilder() {
        return new Builder()
                .name(name)
                .normalizedKey(normalizedKey)
                .stableId(stableId)
                .resolutionConfidence(resolutionConfidence)
                .metadata(metadata)
                .provenance(provenance)
                .relevanceScore(relevanceScore)
                .scoreRationale(scoreRationale)
                .scoreFailureReason(scoreFailureReason);
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (o == null || getClass() != o.getClass()) return false;
        Entity entity = (Entity) o;
        return normalizedKey.equals(entity.normalizedKey)
                && Objects.equals(stableId, entity.stableId)
                && Objects.equals(relevanceScore, entity.relevanceScore);
    }

    @Override
    public int hashCode() {
        return Objects.hash(normalizedKey, stableId, relevanceScore);
    }

    @Override
    public String toString() {
        return "Entity{" +
                "name='" + name + '\'' +
                ", normalizedKey='" + normalizedKey + '\'' +
                ", stableId=" + stableId +
                ", source=" + provenance.source() +
                ", scored=" + isScored() +
                (relevanceScore != null ? ", relevanceScore=" + relevanceScore : "") +
                '}';
    }

    public static Builder builder() {
        return new Builder();
    }

    public static class Builder {
        private String name;
        private String normalizedKey;
        private String stableId;
        private double resolutionConfidence;
        private EntityMetadata metadata;
        private Provenance provenance;
        private Double relevanceScore;
        private String scoreRationale;
        private String scoreFailureReason;

        public Builder name(String name) {
            this.name = name;
            return this;
        }

        public Builder normalizedKey(String normalizedKey) {
            this.normalizedKey = normalizedKey;
            return this;
        }

        public Builder stableId(String stableId) {
            this.stableId = stableId;
            return this;
        }

        public Builder resolutionConfidence(double resolutionConfidence) {
            this.resolutionConfidence = resolutionConfidence;
            return this;
        }

        public Builder metadata(EntityMetadata metadata) {
            this.metadata = metadata;
            return this;
        }

        public Builder provenance(Provenance provenance) {
            this.provenance = provenance;
            return this;
        }

        public Builder relevanceScore(Double relevanceScore) {
            this.relevanceScore = relevanceScore;
            return this;
        }

        public Builder scoreRationale(String scoreRationale) {
            this.scoreRationale = scoreRationale;
            return this;
        }

        public Builder scoreFailureReason(String scoreFailureReason) {
            this.scoreFailureReason = scoreFailureReason;
            return this;
        }

        public Entity build() {
            return new Entity(this);
        }
    }
}
