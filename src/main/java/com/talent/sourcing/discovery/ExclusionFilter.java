package com.talent.sourcing.discovery;

import com.talent.sourcing.rules.NameNormalizer;

import java.util.Collection;
import java.util.HashSet;
import java.util.Set;

/**
 * Caller-specified organizations that must never be returned, compared by normalized key.
 */
public class ExclusionFilter {

    private final NameNormalizer normalizer;
    private final Set<String> excludedKeys = new HashSet<>();

    public ExclusionFilter(NameNormalizer normalizer, Collection<String> excludedNames) {
        this.normalizer = normalizer;
        for (String name : excludedNames) {
            String key = normalizer.normalizeKey(name);
            if (!key.isEmpty()) {
                excludedKeys.add(key);
            }
        }
    }

    public static ExclusionFilter none(NameNormalizer normalizer) {
        return new ExclusionFilter(normalizer, Set.of());
    }

    public boolean isExcluded(String name) {
        return !excludedKeys.isEmpty() && excludedKeys.contains(normalizer.normalizeKey(name));
    }

    public int size() {
        return excludedKeys.size();
    }
}
