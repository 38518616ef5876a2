package com.talent.sourcing.core;

/**
 * Input validation for organization names and identifiers entering the pipeline.
 */
public final class InputSanitizer {

    /** Maximum allowed length for organization names. */
    public static final int MAX_NAME_LENGTH = 200;

    /** Maximum allowed length for stable identifiers. */
    public static final int MAX_IDENTIFIER_LENGTH = 128;

    private InputSanitizer() {
        // utility class
    }

    /**
     * Validates an organization name for resolution.
     * Rejects null, blank, overly long, or control-character-containing names.
     *
     * @param name the raw name
     * @throws ValidationException if the name is invalid
     */
    public static void validateEntityName(String name) {
        if (name == null || name.isBlank()) {
            throw new ValidationException("Entity name must not be null or blank");
        }
        if (name.strip().length() > MAX_NAME_LENGTH) {
            throw new ValidationException(
                    "Entity name exceeds maximum length of " + MAX_NAME_LENGTH +
                            " characters (was " + name.strip().length() + ")");
        }
        if (containsControlCharacters(name)) {
            throw new ValidationException("Entity name must not contain control characters");
        }
    }

    /**
     * Validates a stable identifier handed back by the resolver.
     *
     * @throws ValidationException if the identifier is blank or too long
     */
    public static void validateStableId(String stableId) {
        if (stableId == null || stableId.isBlank()) {
            throw new ValidationException("Stable id must not be null or blank");
        }
        if (stableId.length() > MAX_IDENTIFIER_LENGTH) {
            throw new ValidationException(
                    "Stable id exceeds maximum length of " + MAX_IDENTIFIER_LENGTH + " characters");
        }
    }

    /**
     * Checks whether a string contains ASCII control characters (0x00-0x1F, 0x7F),
     * excluding tab, newline and carriage return.
     */
    private static boolean containsControlCharacters(String s) {
        for (int i = 0; i < s.length(); i++) {
            char c = s.charAt(i);
            if ((c < 0x20 && c != '\t' && c != '\n' && c != '\r') || c == 0x7F) {
                return true;
            }
        }
        return false;
    }
}
