package com.talent.sourcing.rules;

import java.util.Objects;
import java.util.regex.Pattern;

/**
 * A case-insensitive regex rewrite applied while deriving an organization's normalized key.
 * Lower priorities run first; rules of equal priority keep their list order.
 *
 * @param name        identifies the rule in trace logs
 * @param pattern     compiled pattern
 * @param replacement replacement text, may use group references
 * @param priority    ordering key
 */
public record NormalizationRule(String name, Pattern pattern, String replacement, int priority) {

    public NormalizationRule {
        Objects.requireNonNull(name, "name is required");
        Objects.requireNonNull(pattern, "pattern is required");
        replacement = replacement != null ? replacement : "";
    }

    public static NormalizationRule of(String name, String regex, String replacement, int priority) {
        return new NormalizationRule(name,
                Pattern.compile(regex, Pattern.CASE_INSENSITIVE | Pattern.UNICODE_CASE), replacement, priority);
    }

    /**
     * Rule that deletes every match.
     */
    public static NormalizationRule removing(String name, String regex, int priority) {
        return of(name, regex, "", priority);
    }

    public String apply(String input) {
        return input == null ? null : pattern.matcher(input).replaceAll(replacement);
    }
}
