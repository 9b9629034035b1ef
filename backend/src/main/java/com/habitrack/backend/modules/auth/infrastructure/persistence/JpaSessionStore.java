package com.habitrack.backend.modules.auth.infrastructure.persistence;

import java.time.OffsetDateTime;
import java.util.Optional;

import com.habitrack.backend.modules.auth.application.SessionStore;
import com.habitrack.backend.modules.auth.domain.UserSession;

import org.springframework.stereotype.Component;
import org.springframework.transaction.annotation.Transactional;

@Component
@Transactional
public class JpaSessionStore implements SessionStore {

    private final UserSessionRepository userSessionRepository;

    public JpaSessionStore(UserSessionRepository userSessionRepository) {
        this.userSessionRepository = userSessionRepository;
    }

    @Override
    public UserSession save(UserSession session) {
        return userSessionRepository.save(session);
    }

    @Override
    @Transactional(readOnly = true)
    public Optional<UserSession> find(String sid) {
        if (sid == null || sid.isEmpty()) {
            return Optional.empty();
        }
        return userSessionRepository.findById(sid);
    }

    @Override
    public void delete(String sid) {
        if (sid == null || sid.isEmpty()) {
            return;
        }
        userSessionRepository.deleteById(sid);
    }

    @Override
    public int deleteAllForUser(Long userId) {
        return userSessionRepository.deleteAllByUserId(userId);
    }

    @Override
    public int deleteExpired(OffsetDateTime now) {
        return userSessionRepository.deleteExpired(now);
    }
}
