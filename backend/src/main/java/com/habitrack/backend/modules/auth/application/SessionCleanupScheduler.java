package com.habitrack.backend.modules.auth.application;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.dao.DataAccessException;
import org.springframework.scheduling.annotation.Scheduled;
import org.springframework.stereotype.Service;

/**
 * Storage hygiene only: expired sessions are already rejected on read.
 */
@Service
public class SessionCleanupScheduler {

    private static final Logger log = LoggerFactory.getLogger(SessionCleanupScheduler.class);

    private final SessionManager sessionManager;

    public SessionCleanupScheduler(SessionManager sessionManager) {
        this.sessionManager = sessionManager;
    }

    @Scheduled(fixedDelayString = "${habitrack.session.cleanup-interval:PT1H}",
            initialDelayString = "${habitrack.session.cleanup-initial-delay:PT5M}")
    public void purgeExpiredSessions() {
        try {
            int removed = sessionManager.purgeExpired();
            if (removed > 0) {
                log.info("Purged {} expired session(s)", removed);
            }
        } catch (DataAccessException ex) {
            log.warn("[ALERT][Batch][SESSION_CLEANUP] detail={}", ex.getMessage(), ex);
        }
    }
}
