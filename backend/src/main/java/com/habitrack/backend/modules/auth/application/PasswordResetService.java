package com.habitrack.backend.modules.auth.application;

import java.security.MessageDigest;
import java.time.Clock;
import java.time.Duration;
import java.time.OffsetDateTime;
import java.util.Map;
import java.util.Optional;

import com.habitrack.backend.global.error.ProblemException;
import com.habitrack.backend.global.web.RequestMetadata;
import com.habitrack.backend.modules.audit.application.AuditLogService;
import com.habitrack.backend.modules.audit.application.AuditLogService.AuditLogCommand;
import com.habitrack.backend.modules.audit.domain.AuditResult;
import com.habitrack.backend.modules.auth.domain.CredentialProvider;
import com.habitrack.backend.modules.auth.domain.HouseholdUser;
import com.habitrack.backend.modules.auth.domain.PasswordResetCode;
import com.habitrack.backend.modules.auth.domain.SessionRequest;
import com.habitrack.backend.modules.auth.domain.UserSession;
import com.habitrack.backend.modules.auth.infrastructure.persistence.HouseholdUserRepository;
import com.habitrack.backend.modules.auth.infrastructure.persistence.PasswordResetCodeRepository;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.http.HttpStatus;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;
import org.springframework.web.server.ResponseStatusException;

/**
 * Forgot/reset password with short numeric codes.
 */
@Service
@Transactional(noRollbackFor = ResponseStatusException.class)
public class PasswordResetService {

    public static final String INVALID_OR_EXPIRED_CODE = "INVALID_OR_EXPIRED_CODE";

    private static final Logger log = LoggerFactory.getLogger(PasswordResetService.class);
    private static final int CODE_LENGTH = 6;
    private static final int MIN_SECRET_LENGTH = 8;

    private final HouseholdUserRepository householdUserRepository;
    private final PasswordResetCodeRepository passwordResetCodeRepository;
    private final CredentialVault credentialVault;
    private final LockoutGuard lockoutGuard;
    private final SessionManager sessionManager;
    private final ResetCodeDelivery resetCodeDelivery;
    private final AuditLogService auditLogService;
    private final Clock clock;
    private final Duration codeTtl;

    public PasswordResetService(
            HouseholdUserRepository householdUserRepository,
            PasswordResetCodeRepository passwordResetCodeRepository,
            CredentialVault credentialVault,
            LockoutGuard lockoutGuard,
            SessionManager sessionManager,
            ResetCodeDelivery resetCodeDelivery,
            AuditLogService auditLogService,
            Clock clock,
            @Value("${habitrack.auth.reset.code-ttl:PT10M}") Duration codeTtl
    ) {
        this.householdUserRepository = householdUserRepository;
        this.passwordResetCodeRepository = passwordResetCodeRepository;
        this.credentialVault = credentialVault;
        this.lockoutGuard = lockoutGuard;
        this.sessionManager = sessionManager;
        this.resetCodeDelivery = resetCodeDelivery;
        this.auditLogService = auditLogService;
        this.clock = clock;
        this.codeTtl = codeTtl;
    }

    /**
     * Issues a code when the account exists and is active. The caller always answers the same way.
     */
    public void requestReset(Long userId, String email, RequestMetadata metadata) {
        Optional<HouseholdUser> user = resolveActiveUser(userId, email);
        if (user.isEmpty()) {
            log.debug("Reset requested for an unknown or inactive account");
            return;
        }
        HouseholdUser target = user.get();
        OffsetDateTime now = OffsetDateTime.now(clock);

        PasswordResetCode resetCode = passwordResetCodeRepository.findById(target.getId()).orElse(null);
        if (resetCode != null && resetCode.isGuessWindowOpenAt(now, codeTtl)) {
            if (resetCode.getAttempts() >= PasswordResetCode.MAX_ATTEMPTS) {
                log.info("Reset code not issued for user {}: attempts exhausted until {}",
                        target.getId(), resetCode.getCreatedAt().plus(codeTtl));
                auditLogService.record(AuditLogCommand.of("auth.forgot", AuditResult.DENY, target.getId(), metadata,
                        Map.of("reason", "attempts_exhausted")));
                return;
            }
        } else {
            if (resetCode == null) {
                resetCode = new PasswordResetCode();
                resetCode.setUserId(target.getId());
            }
            resetCode.setAttempts(0);
            resetCode.setCreatedAt(now);
        }
        String code = credentialVault.generateCode(CODE_LENGTH);
        resetCode.setCodeHash(credentialVault.digestCode(code));
        resetCode.setExpiresAt(now.plus(codeTtl));
        passwordResetCodeRepository.save(resetCode);

        try {
            resetCodeDelivery.deliver(target, code, resetCode.getExpiresAt());
        } catch (RuntimeException ex) {
            log.warn("Reset code delivery failed for user {}", target.getId(), ex);
            auditLogService.record(AuditLogCommand.of("auth.forgot", AuditResult.ERROR, target.getId(), metadata,
                    Map.of("reason", "delivery_failed")));
            return;
        }
        auditLogService.record(AuditLogCommand.of("auth.forgot", AuditResult.OK, target.getId(), metadata, null));
    }

    /**
     * Redeems a code: sets the new password, lifts any lockout, ends every existing session and
     * opens a fresh one.
     */
    public UserSession reset(Long userId, String email, String code, String newSecret, RequestMetadata metadata) {
        boolean identified = userId != null || (email != null && !email.isBlank());
        if (!identified || code == null || code.isBlank() || newSecret == null || newSecret.isEmpty()) {
            throw new ProblemException(HttpStatus.BAD_REQUEST, "VALIDATION_ERROR",
                    "email (or userId), code and newSecret required");
        }
        if (newSecret.length() < MIN_SECRET_LENGTH) {
            throw new ProblemException(HttpStatus.BAD_REQUEST, "VALIDATION_ERROR",
                    "newSecret must be at least " + MIN_SECRET_LENGTH + " characters");
        }

        HouseholdUser user = resolveActiveUser(userId, email).orElseThrow(this::invalidCode);
        OffsetDateTime now = OffsetDateTime.now(clock);
        PasswordResetCode stored = passwordResetCodeRepository.findById(user.getId()).orElse(null);
        if (stored == null) {
            auditDenied(user.getId(), metadata);
            throw invalidCode();
        }
        boolean matches = MessageDigest.isEqual(credentialVault.digestCode(code.trim()), stored.getCodeHash());
        if (!stored.isUsableAt(now) || !matches) {
            stored.registerFailedAttempt();
            passwordResetCodeRepository.save(stored);
            auditDenied(user.getId(), metadata);
            throw invalidCode();
        }

        credentialVault.updateCredential(user.getId(), CredentialProvider.PASSWORD, newSecret);
        // lockout bookkeeping is best-effort; failures are logged by the guard
        lockoutGuard.clear(user.getId());
        sessionManager.destroyAllForUser(user.getId());
        passwordResetCodeRepository.delete(stored);

        UserSession session = sessionManager.create(SessionRequest.regular(
                user.getId(), user.getRole(), sessionManager.ttlFor(false), metadata.clientIp()));
        auditLogService.record(AuditLogCommand.of("auth.reset", AuditResult.OK, user.getId(), metadata, null));
        return session;
    }

    private Optional<HouseholdUser> resolveActiveUser(Long userId, String email) {
        Optional<HouseholdUser> user;
        if (userId != null) {
            user = householdUserRepository.findById(userId);
        } else if (email != null && !email.isBlank()) {
            user = householdUserRepository.findByEmailIgnoreCase(email.trim());
        } else {
            user = Optional.empty();
        }
        return user.filter(HouseholdUser::isActive);
    }

    private void auditDenied(Long userId, RequestMetadata metadata) {
        auditLogService.record(AuditLogCommand.of("auth.reset", AuditResult.DENY, userId, metadata,
                Map.of("reason", INVALID_OR_EXPIRED_CODE)));
    }

    private ProblemException invalidCode() {
        return new ProblemException(HttpStatus.BAD_REQUEST, INVALID_OR_EXPIRED_CODE, "Invalid or expired code");
    }
}
