package com.talent.sourcing.scoring;

import com.talent.sourcing.core.model.Requirements;

import java.util.List;

/**
 * The hiring context sent to the classifier with every batch.
 */
public record ScoringContext(String roleTitle, String seniority, List<String> mustHave,
                             List<String> niceToHave, List<String> domainKeywords) {

    public ScoringContext {
        if (roleTitle == null || roleTitle.isBlank()) {
            throw new IllegalArgumentException("roleTitle is required");
        }
        mustHave = mustHave != null ? List.copyOf(mustHave) : List.of();
        niceToHave = niceToHave != null ? List.copyOf(niceToHave) : List.of();
        domainKeywords = domainKeywords != null ? List.copyOf(domainKeywords) : List.of();
    }

    public static ScoringContext from(Requirements requirements) {
        return new ScoringContext(requirements.getRoleTitle(), requirements.getSeniority(),
                requirements.getMustHave(), requirements.getNiceToHave(), requirements.getDomainKeywords());
    }
}
