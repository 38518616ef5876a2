package com.talent.sourcing.rules;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;
import java.util.Locale;

/**
 * Derives the normalized key of an organization name: the lowercased, punctuation-stripped,
 * suffix-free form used as the resolution cache key and for candidate deduplication.
 * Instances are immutable and safe to share between threads.
 */
public class NameNormalizer {
    private static final Logger log = LoggerFactory.getLogger(NameNormalizer.class);

    private final List<NormalizationRule> rules;

    public NameNormalizer(List<NormalizationRule> rules) {
        List<NormalizationRule> sorted = new ArrayList<>(rules);
        sorted.sort(Comparator.comparingInt(NormalizationRule::priority));
        this.rules = List.copyOf(sorted);
    }

    /**
     * Creates a normalizer with the built-in organization rules.
     */
    public static NameNormalizer withDefaultRules() {
        return new NameNormalizer(OrganizationNameRules.all());
    }

    public List<NormalizationRule> getRules() {
        return rules;
    }

    /**
     * Normalizes the given name. Null or blank input yields an empty string,
     * as does a name made only of punctuation or a legal suffix.
     */
    public String normalizeKey(String name) {
        if (name == null || name.isBlank()) {
            return "";
        }

        String result = name.strip();
        for (NormalizationRule rule : rules) {
            String before = result;
            result = rule.apply(result).strip();
            if (log.isTraceEnabled() && !before.equals(result)) {
                log.trace("normalize.rule rule={} before='{}' after='{}'", rule.name(), before, result);
            }
        }

        return result.toLowerCase(Locale.ROOT)
                .replaceAll("\\s+", " ")
                .trim();
    }

    /**
     * Checks if two names collapse to the same key.
     */
    public boolean sameKey(String name1, String name2) {
        String key1 = normalizeKey(name1);
        return !key1.isEmpty() && key1.equals(normalizeKey(name2));
    }
}
