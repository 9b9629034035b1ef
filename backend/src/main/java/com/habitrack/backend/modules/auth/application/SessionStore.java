package com.habitrack.backend.modules.auth.application;

import java.time.OffsetDateTime;
import java.util.Optional;

import com.habitrack.backend.modules.auth.domain.UserSession;

/**
 * Persistence port for server-side sessions.
 */
public interface SessionStore {

    UserSession save(UserSession session);

    Optional<UserSession> find(String sid);

    void delete(String sid);

    int deleteAllForUser(Long userId);

    int deleteExpired(OffsetDateTime now);
}
