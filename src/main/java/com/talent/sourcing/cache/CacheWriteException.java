package com.talent.sourcing.cache;

/**
 * The cache store rejected a write. Callers log it and continue without caching the entry.
 */
public class CacheWriteException extends RuntimeException {

    public CacheWriteException(String message) {
        super(message);
    }

    public CacheWriteException(String message, Throwable cause) {
        super(message, cause);
    }
}
