package com.talent.sourcing.session;

import java.util.Collection;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;

public class InMemorySessionStore implements SessionStore {

    private final Map<String, SearchSession> sessions = new ConcurrentHashMap<>();

    @Override
    public void save(SearchSession session) {
        sessions.put(session.getSessionId(), session);
    }

    @Override
    public Optional<SearchSession> find(String sessionId) {
        return Optional.ofNullable(sessions.get(sessionId));
    }

    @Override
    public void remove(String sessionId) {
        sessions.remove(sessionId);
    }

    @Override
    public Collection<SearchSession> all() {
        return List.copyOf(sessions.values());
    }
}
