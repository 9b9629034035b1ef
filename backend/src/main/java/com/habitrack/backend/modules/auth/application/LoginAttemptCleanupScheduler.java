package com.habitrack.backend.modules.auth.application;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.scheduling.annotation.Scheduled;
import org.springframework.stereotype.Service;

@Service
public class LoginAttemptCleanupScheduler {

    private static final Logger log = LoggerFactory.getLogger(LoginAttemptCleanupScheduler.class);

    private final LockoutGuard lockoutGuard;

    public LoginAttemptCleanupScheduler(LockoutGuard lockoutGuard) {
        this.lockoutGuard = lockoutGuard;
    }

    @Scheduled(fixedDelayString = "${habitrack.auth.lockout.cleanup-interval:PT1H}",
            initialDelayString = "${habitrack.auth.lockout.cleanup-initial-delay:PT5M}")
    public void purgeOldFailures() {
        int removed = lockoutGuard.cleanup();
        if (removed > 0) {
            log.info("Purged {} stale failed login attempt(s)", removed);
        }
    }
}
