package com.habitrack.backend.modules.auth.application;

import java.time.Clock;
import java.time.Duration;
import java.time.OffsetDateTime;

import com.habitrack.backend.modules.auth.domain.BookkeepingResult;
import com.habitrack.backend.modules.auth.domain.LockoutStatus;
import com.habitrack.backend.modules.auth.domain.LoginAttempt;
import com.habitrack.backend.modules.auth.infrastructure.persistence.LoginAttemptRepository;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.dao.DataAccessException;
import org.springframework.stereotype.Service;

/**
 * Sliding-window brute-force lockout over the {@code login_attempt} log.
 * <p>
 * The check and the following record are not atomic, so concurrent attempts may slightly overshoot
 * the threshold. If the attempt store is unreachable the guard fails open and logins proceed.
 */
@Service
public class LockoutGuard {

    private static final Logger log = LoggerFactory.getLogger(LockoutGuard.class);

    private final LoginAttemptRepository loginAttemptRepository;
    private final Clock clock;
    private final int threshold;
    private final Duration window;
    private final Duration retention;

    public LockoutGuard(
            LoginAttemptRepository loginAttemptRepository,
            Clock clock,
            @Value("${habitrack.auth.lockout.threshold:5}") int threshold,
            @Value("${habitrack.auth.lockout.window:PT15M}") Duration window,
            @Value("${habitrack.auth.lockout.retention:PT24H}") Duration retention
    ) {
        if (threshold < 1) {
            throw new IllegalArgumentException("lockout threshold must be at least 1");
        }
        this.loginAttemptRepository = loginAttemptRepository;
        this.clock = clock;
        this.threshold = threshold;
        this.window = window;
        this.retention = retention;
    }

    public LockoutStatus check(Long userId) {
        OffsetDateTime since = OffsetDateTime.now(clock).minus(window);
        try {
            int failed = (int) Math.min(Integer.MAX_VALUE, loginAttemptRepository.countFailedSince(userId, since));
            int remaining = Math.max(0, threshold - failed);
            if (failed < threshold) {
                return new LockoutStatus(false, failed, remaining, null);
            }
            OffsetDateTime latest = loginAttemptRepository.findLatestFailedSince(userId, since);
            OffsetDateTime expiresAt = latest != null ? latest.plus(window) : OffsetDateTime.now(clock).plus(window);
            return new LockoutStatus(true, failed, remaining, expiresAt);
        } catch (DataAccessException ex) {
            log.warn("Lockout check unavailable for user {}; allowing attempt", userId, ex);
            return LockoutStatus.unlocked(threshold);
        }
    }

    public BookkeepingResult record(Long userId, boolean success, String ip) {
        try {
            loginAttemptRepository.save(new LoginAttempt(userId, ip, success, OffsetDateTime.now(clock)));
            if (success) {
                loginAttemptRepository.deleteFailedByUserId(userId);
            }
            return BookkeepingResult.ok();
        } catch (DataAccessException ex) {
            log.warn("Could not record login attempt for user {}", userId, ex);
            return BookkeepingResult.failed(ex.getClass().getSimpleName());
        }
    }

    public BookkeepingResult clear(Long userId) {
        try {
            loginAttemptRepository.deleteFailedByUserId(userId);
            return BookkeepingResult.ok();
        } catch (DataAccessException ex) {
            log.warn("Could not clear failed login attempts for user {}", userId, ex);
            return BookkeepingResult.failed(ex.getClass().getSimpleName());
        }
    }

    public int cleanup() {
        OffsetDateTime horizon = OffsetDateTime.now(clock).minus(retention);
        try {
            return loginAttemptRepository.deleteFailedOlderThan(horizon);
        } catch (DataAccessException ex) {
            log.warn("Login attempt cleanup failed", ex);
            return 0;
        }
    }

    /**
     * Seconds until the lock lifts, rounded up and never below one while locked.
     */
    public long retryAfterSeconds(LockoutStatus status) {
        if (!status.locked() || status.lockoutExpiresAt() == null) {
            return 0;
        }
        long millis = Duration.between(OffsetDateTime.now(clock), status.lockoutExpiresAt()).toMillis();
        return Math.max(1, (millis + 999) / 1000);
    }

    public int getThreshold() {
        return threshold;
    }

    public Duration getWindow() {
        return window;
    }
}
