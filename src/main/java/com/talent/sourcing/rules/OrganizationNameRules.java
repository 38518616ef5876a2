package com.talent.sourcing.rules;

import java.util.ArrayList;
import java.util.List;

/**
 * Built-in normalization rules for organization names.
 */
public final class OrganizationNameRules {

    // A suffix only counts when separated from the name, so "Zinc" keeps its "inc".
    private static final String SUFFIX_PREFIX = "(?:^|,?\\s+)";

    private OrganizationNameRules() {
        // Utility class
    }

    /**
     * Suffix rules followed by the punctuation rules.
     */
    public static List<NormalizationRule> all() {
        List<NormalizationRule> rules = new ArrayList<>(legalSuffixRules());
        rules.addAll(punctuationRules());
        return List.copyOf(rules);
    }

    /**
     * Strips trailing legal-form suffixes. Same-priority rules run in list order,
     * so "Acme Co., Ltd." loses both suffixes.
     */
    public static List<NormalizationRule> legalSuffixRules() {
        return List.of(
                suffix("inc", "Inc\\.?|Incorporated"),
                suffix("ltd", "Ltd\\.?|Limited"),
                suffix("llc", "LLC|L\\.L\\.C\\.?"),
                suffix("plc", "PLC|P\\.L\\.C\\.?"),
                suffix("corp", "Corp\\.?|Corporation"),
                suffix("co", "Co\\.?|Company"),
                suffix("gmbh", "GmbH"),
                suffix("ag", "AG"),
                suffix("sa", "S\\.?A\\.?"),
                suffix("nv", "N\\.?V\\.?"),
                suffix("bv", "B\\.?V\\.?")
        );
    }

    /**
     * Removes punctuation other than hyphens; "&" and "+" become word separators.
     */
    public static List<NormalizationRule> punctuationRules() {
        return List.of(
                NormalizationRule.of("punct-ampersand", "\\s*[&+]\\s*", " ", 50),
                NormalizationRule.removing("punct-strip", "[^\\p{L}\\p{N}\\s-]", 100)
        );
    }

    private static NormalizationRule suffix(String name, String alternatives) {
        return NormalizationRule.removing("suffix-" + name, SUFFIX_PREFIX + "(?:" + alternatives + ")$", 10);
    }
}
