package com.talent.sourcing.external;

/**
 * Base class for failures of third-party calls (resolver, profile API, web search,
 * relevance classifier, person-search backend).
 */
public abstract class ExternalCallException extends RuntimeException {

    private final String endpoint;
    private final int statusCode;

    protected ExternalCallException(String endpoint, String message, int statusCode, Throwable cause) {
        super("[" + endpoint + "] " + message, cause);
        this.endpoint = endpoint;
        this.statusCode = statusCode;
    }

    public String getEndpoint() {
        return endpoint;
    }

    /**
     * HTTP status of the failed call, or -1 when no response was received.
     */
    public int getStatusCode() {
        return statusCode;
    }

    public abstract boolean isRetryable();
}
