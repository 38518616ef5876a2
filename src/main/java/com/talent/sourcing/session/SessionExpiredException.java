package com.talent.sourcing.session;

/**
 * Thrown when a session is used after its TTL. The caller must create a new session.
 */
public class SessionExpiredException extends RuntimeException {

    private final String sessionId;

    public SessionExpiredException(String sessionId) {
        super("Session " + sessionId + " has expired");
        this.sessionId = sessionId;
    }

    public String getSessionId() {
        return sessionId;
    }
}
