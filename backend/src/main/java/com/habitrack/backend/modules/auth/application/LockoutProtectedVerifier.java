package com.habitrack.backend.modules.auth.application;

import java.util.Map;

import com.habitrack.backend.global.error.RetryableProblemException;
import com.habitrack.backend.global.web.RequestMetadata;
import com.habitrack.backend.modules.audit.application.AuditLogService;
import com.habitrack.backend.modules.audit.application.AuditLogService.AuditLogCommand;
import com.habitrack.backend.modules.audit.domain.AuditResult;
import com.habitrack.backend.modules.auth.domain.CredentialProvider;
import com.habitrack.backend.modules.auth.domain.LockoutStatus;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.http.HttpStatus;
import org.springframework.stereotype.Component;

/**
 * Check, verify, record: the shape shared by password and PIN authentication.
 */
@Component
public class LockoutProtectedVerifier {

    public static final String ACCOUNT_LOCKED = "ACCOUNT_LOCKED";

    private static final Logger log = LoggerFactory.getLogger(LockoutProtectedVerifier.class);

    private final LockoutGuard lockoutGuard;
    private final CredentialVault credentialVault;
    private final AuditLogService auditLogService;

    public LockoutProtectedVerifier(LockoutGuard lockoutGuard, CredentialVault credentialVault,
                                    AuditLogService auditLogService) {
        this.lockoutGuard = lockoutGuard;
        this.credentialVault = credentialVault;
        this.auditLogService = auditLogService;
    }

    /**
     * @throws RetryableProblemException 423 when the account is already locked
     */
    public Outcome verify(Long userId, CredentialProvider provider, String secret, RequestMetadata metadata) {
        LockoutStatus before = lockoutGuard.check(userId);
        if (before.locked()) {
            long retryAfter = lockoutGuard.retryAfterSeconds(before);
            auditLogService.record(AuditLogCommand.of("auth.lockout", AuditResult.DENY, userId, metadata,
                    Map.of("failedAttempts", before.failedAttempts(), "provider", provider.name())));
            throw locked(retryAfter);
        }

        if (!credentialVault.verifyCredential(userId, provider, secret)) {
            // the attempt log is best-effort; a failed write was already logged
            lockoutGuard.record(userId, false, metadata.clientIp());
            LockoutStatus after = lockoutGuard.check(userId);
            log.info("Rejected {} for user {} ({} attempt(s) left)", provider, userId, after.remainingAttempts());
            auditLogService.record(AuditLogCommand.of("auth.login.fail", AuditResult.DENY, userId, metadata,
                    Map.of("remainingAttempts", after.remainingAttempts(), "provider", provider.name())));
            return new Outcome(false, after);
        }

        lockoutGuard.record(userId, true, metadata.clientIp());
        return new Outcome(true, LockoutStatus.unlocked(lockoutGuard.getThreshold()));
    }

    public RetryableProblemException locked(long retryAfterSeconds) {
        long minutes = Math.max(1, (retryAfterSeconds + 59) / 60);
        return new RetryableProblemException(HttpStatus.LOCKED, ACCOUNT_LOCKED,
                "Account locked. Try again in " + minutes + " minute(s).", retryAfterSeconds);
    }

    public long retryAfterSeconds(LockoutStatus status) {
        return lockoutGuard.retryAfterSeconds(status);
    }

    public record Outcome(boolean valid, LockoutStatus status) {
    }
}
