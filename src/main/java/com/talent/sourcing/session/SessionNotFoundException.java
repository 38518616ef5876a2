package com.talent.sourcing.session;

public class SessionNotFoundException extends RuntimeException {

    public SessionNotFoundException(String sessionId) {
        super("No session with id " + sessionId);
    }
}
