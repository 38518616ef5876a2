package com.talent.sourcing.core;

/**
 * Raised when caller input is malformed, before any external call or cache write is attempted.
 * Extends {@link IllegalArgumentException} so callers that already guard argument errors keep working.
 */
public class ValidationException extends IllegalArgumentException {

    public ValidationException(String message) {
        super(message);
    }
}
