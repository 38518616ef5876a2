package com.talent.sourcing.session;

import java.util.Collection;
import java.util.Optional;

/**
 * Keyed storage of live sessions.
 */
public interface SessionStore {

    void save(SearchSession session);

    Optional<SearchSession> find(String sessionId);

    void remove(String sessionId);

    Collection<SearchSession> all();
}
