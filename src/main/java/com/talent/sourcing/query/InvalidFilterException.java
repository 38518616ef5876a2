package com.talent.sourcing.query;

import com.talent.sourcing.core.ValidationException;

/**
 * The filter request cannot be compiled into a meaningful query.
 */
public class InvalidFilterException extends ValidationException {

    public InvalidFilterException(String message) {
        super(message);
    }
}
