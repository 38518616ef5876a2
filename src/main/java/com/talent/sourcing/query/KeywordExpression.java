package com.talent.sourcing.query;

import java.util.LinkedHashSet;
import java.util.List;
import java.util.Locale;
import java.util.Set;

/**
 * Builds title expressions for {@link QueryStringQuery}: each term is one alternative,
 * multi-word terms are quoted as phrases, and seniority words are dropped so that
 * "Senior ML Engineer" also matches people whose title omits the level.
 */
public final class KeywordExpression {

    private static final Set<String> SENIORITY_WORDS = Set.of(
            "junior", "jr", "mid", "mid-level", "senior", "sr", "staff", "principal", "lead", "head");

    private KeywordExpression() {
    }

    /**
     * Joins the given title terms with OR. Returns null when nothing usable remains.
     */
    public static String anyOf(List<String> terms) {
        Set<String> alternatives = new LinkedHashSet<>();
        for (String term : terms) {
            String cleaned = stripSeniority(term);
            if (cleaned.isEmpty()) {
                continue;
            }
            alternatives.add(cleaned.contains(" ") ? "\"" + cleaned + "\"" : cleaned);
        }
        return alternatives.isEmpty() ? null : String.join(" OR ", alternatives);
    }

    static String stripSeniority(String term) {
        if (term == null) {
            return "";
        }
        StringBuilder kept = new StringBuilder();
        for (String word : term.replace("\"", " ").strip().split("\\s+")) {
            String lower = word.toLowerCase(Locale.ROOT).replaceAll("[.,]", "");
            if (word.isEmpty() || SENIORITY_WORDS.contains(lower)) {
                continue;
            }
            if (kept.length() > 0) {
                kept.append(' ');
            }
            kept.append(lower);
        }
        return kept.toString();
    }
}
