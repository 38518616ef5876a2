package com.talent.sourcing.cache;

public enum ResolutionStatus {
    /** A stable identifier was found. */
    RESOLVED,
    /** Every lookup tier came back empty, now or in a cached negative entry. */
    NOT_FOUND,
    /** The external resolver failed after retries or rejected the request. */
    FAILED,
    /** The name was rejected by input validation; nothing was looked up or written. */
    REJECTED
}
