package com.habitrack.backend.support;

import java.time.OffsetDateTime;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;

import com.habitrack.backend.modules.auth.application.SessionStore;
import com.habitrack.backend.modules.auth.domain.UserSession;

public class InMemorySessionStore implements SessionStore {

    private final Map<String, UserSession> sessions = new ConcurrentHashMap<>();

    @Override
    public UserSession save(UserSession session) {
        sessions.put(session.getSid(), session);
        return session;
    }

    @Override
    public Optional<UserSession> find(String sid) {
        return Optional.ofNullable(sessions.get(sid));
    }

    @Override
    public void delete(String sid) {
        sessions.remove(sid);
    }

    @Override
    public int deleteAllForUser(Long userId) {
        int before = sessions.size();
        sessions.values().removeIf(session -> session.getUserId().equals(userId));
        return before - sessions.size();
    }

    @Override
    public int deleteExpired(OffsetDateTime now) {
        int before = sessions.size();
        sessions.values().removeIf(session -> session.isExpiredAt(now));
        return before - sessions.size();
    }

    public boolean contains(String sid) {
        return sessions.containsKey(sid);
    }

    public int size() {
        return sessions.size();
    }
}
