package com.talent.sourcing.core.model;

import java.util.ArrayList;
import java.util.List;

/**
 * Structured hiring requirements, as produced by the upstream job-description parser.
 * Only the role title is mandatory; every list defaults to empty.
 */
public final class Requirements {

    private final String roleTitle;
    private final String seniority;
    private final List<String> mustHave;
    private final List<String> niceToHave;
    private final List<String> domainKeywords;
    private final List<String> seedEntities;
    private final List<String> excludedEntities;
    private final String location;

    private Requirements(Builder builder) {
        if (builder.roleTitle == null || builder.roleTitle.isBlank()) {
            throw new IllegalArgumentException("roleTitle is required");
        }
        this.roleTitle = builder.roleTitle.strip();
        this.seniority = blankToNull(builder.seniority);
        this.mustHave = clean(builder.mustHave);
        this.niceToHave = clean(builder.niceToHave);
        this.domainKeywords = clean(builder.domainKeywords);
        this.seedEntities = clean(builder.seedEntities);
        this.excludedEntities = clean(builder.excludedEntities);
        this.location = blankToNull(builder.location);
    }

    public String getRoleTitle() {
        return roleTitle;
    }

    public String getSeniority() {
        return seniority;
    }

    public List<String> getMustHave() {
        return mustHave;
    }

    public List<String> getNiceToHave() {
        return niceToHave;
    }

    public List<String> getDomainKeywords() {
        return domainKeywords;
    }

    public List<String> getSeedEntities() {
        return seedEntities;
    }

    public List<String> getExcludedEntities() {
        return excludedEntities;
    }

    public String getLocation() {
        return location;
    }

    private static List<String> clean(List<String> values) {
        List<String> result = new ArrayList<>();
        for (String value : values) {
            if (value != null && !value.isBlank()) {
                result.add(value.strip());
            }
        }
        return List.copyOf(result);
    }

    private static String blankToNull(String value) {
        return value == null || value.isBlank() ? null : value.strip();
    }

    @Override
    public String toString() {
        return "Requirements{" +
                "roleTitle='" + roleTitle + '\'' +
                ", seniority=" + seniority +
                ", domainKeywords=" + domainKeywords +
                ", seeds=" + seedEntities.size() +
                ", excluded=" + excludedEntities.size() +
                ", location=" + location +
                '}';
    }

    public static Builder builder() {
        return new Builder();
    }

    public static class Builder {
        private String roleTitle;
        private String seniority;
        private final List<String> mustHave = new ArrayList<>();
        private final List<String> niceToHave = new ArrayList<>();
        private final List<String> domainKeywords = new ArrayList<>();
        private final List<String> seedEntities = new ArrayList<>();
        private final List<String> excludedEntities = new ArrayList<>();
        private String location;

        public Builder roleTitle(String roleTitle) {
            this.roleTitle = roleTitle;
            return this;
        }

        public Builder seniority(String seniority) {
            this.seniority = seniority;
            return this;
        }

        public Builder mustHave(List<String> terms) {
            this.mustHave.addAll(terms);
            return this;
        }

        public Builder niceToHave(List<String> terms) {
            this.niceToHave.addAll(terms);
            return this;
        }

        public Builder domainKeywords(List<String> keywords) {
            this.domainKeywords.addAll(keywords);
            return this;
        }

        public Builder seedEntities(List<String> names) {
            this.seedEntities.addAll(names);
            return this;
        }

        public Builder excludedEntities(List<String> names) {
            this.excludedEntities.addAll(names);
            return this;
        }

        public Builder location(String location) {
            this.location = location;
            return this;
        }

        public Requirements build() {
            return new Requirements(this);
        }
    }
}
