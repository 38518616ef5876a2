package com.talent.sourcing.external;

/**
 * The third party rejected the request itself (for example a malformed query).
 * Never retried; surfaced to the caller as a stage failure.
 */
public class ExternalPermanentException extends ExternalCallException {

    public ExternalPermanentException(String endpoint, String message, int statusCode) {
        super(endpoint, message, statusCode, null);
    }

    public ExternalPermanentException(String endpoint, String message, Throwable cause) {
        super(endpoint, message, -1, cause);
    }

    @Override
    public boolean isRetryable() {
        return false;
    }
}
