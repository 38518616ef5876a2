package com.talent.sourcing.session;

/**
 * Lifecycle of a search session.
 */
public enum SessionState {
    CREATED,
    FETCHING,
    /** Idle, more records can be loaded. */
    IDLE_HAS_MORE,
    /** Idle, every record has been returned. */
    IDLE_EXHAUSTED,
    EXPIRED
}
