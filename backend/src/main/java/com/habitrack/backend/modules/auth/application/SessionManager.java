package com.habitrack.backend.modules.auth.application;

import java.security.SecureRandom;
import java.time.Clock;
import java.time.Duration;
import java.time.OffsetDateTime;
import java.util.Base64;
import java.util.Optional;

import com.habitrack.backend.modules.auth.domain.SessionRequest;
import com.habitrack.backend.modules.auth.domain.UserSession;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Service;

/**
 * Server-side session lifecycle on top of a {@link SessionStore}.
 */
@Service
public class SessionManager {

    private static final Logger log = LoggerFactory.getLogger(SessionManager.class);

    /** 36 random bytes encode to exactly 48 URL-safe characters. */
    private static final int SID_BYTES = 36;
    private static final Base64.Encoder SID_ENCODER = Base64.getUrlEncoder().withoutPadding();

    private final SessionStore sessionStore;
    private final SecureRandom secureRandom;
    private final Clock clock;
    private final Duration sessionTtl;
    private final Duration kioskTtl;
    private final boolean rolling;

    public SessionManager(
            SessionStore sessionStore,
            SecureRandom secureRandom,
            Clock clock,
            @Value("${habitrack.session.ttl:P30D}") Duration sessionTtl,
            @Value("${habitrack.session.kiosk-ttl:PT4H}") Duration kioskTtl,
            @Value("${habitrack.session.rolling:true}") boolean rolling
    ) {
        this.sessionStore = sessionStore;
        this.secureRandom = secureRandom;
        this.clock = clock;
        this.sessionTtl = sessionTtl;
        this.kioskTtl = kioskTtl;
        this.rolling = rolling;
    }

    public UserSession create(SessionRequest request) {
        OffsetDateTime now = OffsetDateTime.now(clock);
        UserSession session = new UserSession();
        session.setSid(newSid());
        session.setUserId(request.userId());
        session.setRole(request.role());
        session.setCreatedAt(now);
        session.setLastSeenAt(now);
        session.setExpiresAt(now.plus(request.ttl()));
        session.setKiosk(request.kiosk());
        session.setImpersonatedBy(request.impersonatedBy());
        session.setClientIp(request.clientIp());
        UserSession saved = sessionStore.save(session);
        log.debug("Opened {} session for user {}", request.kiosk() ? "kiosk" : "regular", request.userId());
        return saved;
    }

    /**
     * Returns the live session for {@code sid}. Expired rows are removed as they are found.
     */
    public Optional<UserSession> get(String sid) {
        if (sid == null || sid.isEmpty()) {
            return Optional.empty();
        }
        Optional<UserSession> found = sessionStore.find(sid);
        if (found.isEmpty()) {
            return Optional.empty();
        }
        UserSession session = found.get();
        if (session.isExpiredAt(OffsetDateTime.now(clock))) {
            sessionStore.delete(sid);
            return Optional.empty();
        }
        return Optional.of(session);
    }

    /**
     * Records activity and, with rolling sessions enabled, pushes the expiry out by {@code ttl}.
     */
    public Optional<UserSession> touch(String sid, Duration ttl) {
        Optional<UserSession> current = get(sid);
        if (current.isEmpty()) {
            return Optional.empty();
        }
        UserSession session = current.get();
        OffsetDateTime now = OffsetDateTime.now(clock);
        session.setLastSeenAt(now);
        if (rolling) {
            session.setExpiresAt(now.plus(ttl));
        }
        return Optional.of(sessionStore.save(session));
    }

    public Optional<UserSession> touch(UserSession session) {
        return touch(session.getSid(), ttlFor(session.isKiosk()));
    }

    public void destroy(String sid) {
        sessionStore.delete(sid);
    }

    public int destroyAllForUser(Long userId) {
        int removed = sessionStore.deleteAllForUser(userId);
        log.info("Destroyed {} session(s) for user {}", removed, userId);
        return removed;
    }

    public int purgeExpired() {
        return sessionStore.deleteExpired(OffsetDateTime.now(clock));
    }

    public Duration ttlFor(boolean kiosk) {
        return kiosk ? kioskTtl : sessionTtl;
    }

    public Duration getSessionTtl() {
        return sessionTtl;
    }

    public Duration getKioskTtl() {
        return kioskTtl;
    }

    private String newSid() {
        byte[] bytes = new byte[SID_BYTES];
        secureRandom.nextBytes(bytes);
        return SID_ENCODER.encodeToString(bytes);
    }
}
