package com.talent.sourcing.external;

/**
 * A network error, timeout or throttling response. Retried with bounded backoff,
 * then degraded to an unresolved or unscored result.
 */
public class ExternalTransientException extends ExternalCallException {

    public ExternalTransientException(String endpoint, String message) {
        super(endpoint, message, -1, null);
    }

    public ExternalTransientException(String endpoint, String message, Throwable cause) {
        super(endpoint, message, -1, cause);
    }

    public ExternalTransientException(String endpoint, String message, int statusCode) {
        super(endpoint, message, statusCode, null);
    }

    @Override
    public boolean isRetryable() {
        return true;
    }
}
