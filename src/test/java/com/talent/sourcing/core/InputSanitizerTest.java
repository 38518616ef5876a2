package com.talent.sourcing.core;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.NullAndEmptySource;
import org.junit.jupiter.params.provider.ValueSource;

import static org.junit.jupiter.api.Assertions.*;

@DisplayName("InputSanitizer Tests")
class InputSanitizerTest {

    @Test
    @DisplayName("Should accept ordinary names")
    void acceptsOrdinaryNames() {
        assertDoesNotThrow(() -> InputSanitizer.validateEntityName("  Acme Robotics GmbH "));
        assertDoesNotThrow(() -> InputSanitizer.validateEntityName("Müller & Söhne\tAG"));
    }

    @ParameterizedTest
    @NullAndEmptySource
    @ValueSource(strings = {"   ", "Acme\u0000Corp", "Acme\u007F"})
    @DisplayName("Should reject unusable names")
    void rejectsUnusableNames(String name) {
        ValidationException e = assertThrows(ValidationException.class, () -> InputSanitizer.validateEntityName(name));
        assertInstanceOf(IllegalArgumentException.class, e);
    }

    @Test
    @DisplayName("Should apply the length limit after stripping")
    void lengthLimitAppliesAfterStripping() {
        String atLimit = "a".repeat(InputSanitizer.MAX_NAME_LENGTH);

        assertDoesNotThrow(() -> InputSanitizer.validateEntityName("  " + atLimit + "  "));
        ValidationException e = assertThrows(ValidationException.class,
                () -> InputSanitizer.validateEntityName(atLimit + "b"));
        assertTrue(e.getMessage().contains("(was 201)"));
    }

    @Test
    @DisplayName("Should require present and bounded stable ids")
    void stableIdsMustBePresentAndBounded() {
        assertDoesNotThrow(() -> InputSanitizer.validateStableId("id-acme"));
        assertThrows(ValidationException.class, () -> InputSanitizer.validateStableId(" "));
        assertThrows(ValidationException.class, () -> InputSanitizer.validateStableId(null));
        assertThrows(ValidationException.class,
                () -> InputSanitizer.validateStableId("x".repeat(InputSanitizer.MAX_IDENTIFIER_LENGTH + 1)));
    }
}
