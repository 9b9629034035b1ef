package com.habitrack.backend.modules.auth.application;

import java.util.Map;
import java.util.Optional;

import com.habitrack.backend.global.error.BadCredentialsProblemException;
import com.habitrack.backend.global.error.ProblemException;
import com.habitrack.backend.global.security.SessionPrincipal;
import com.habitrack.backend.global.web.RequestMetadata;
import com.habitrack.backend.modules.audit.application.AuditLogService;
import com.habitrack.backend.modules.audit.application.AuditLogService.AuditLogCommand;
import com.habitrack.backend.modules.audit.domain.AuditResult;
import com.habitrack.backend.modules.auth.application.LockoutProtectedVerifier.Outcome;
import com.habitrack.backend.modules.auth.domain.CredentialProvider;
import com.habitrack.backend.modules.auth.domain.HouseholdUser;
import com.habitrack.backend.modules.auth.domain.SessionRequest;
import com.habitrack.backend.modules.auth.domain.UserSession;
import com.habitrack.backend.modules.auth.infrastructure.persistence.HouseholdUserRepository;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.http.HttpStatus;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;
import org.springframework.web.server.ResponseStatusException;

/**
 * Password authentication: login, first-time registration, credential change and logout.
 */
@Service
@Transactional(noRollbackFor = ResponseStatusException.class)
public class AuthService {

    private static final Logger log = LoggerFactory.getLogger(AuthService.class);

    private final HouseholdUserRepository householdUserRepository;
    private final CredentialVault credentialVault;
    private final LockoutProtectedVerifier verifier;
    private final SessionManager sessionManager;
    private final OnboardTokenService onboardTokenService;
    private final AuditLogService auditLogService;

    public AuthService(
            HouseholdUserRepository householdUserRepository,
            CredentialVault credentialVault,
            LockoutProtectedVerifier verifier,
            SessionManager sessionManager,
            OnboardTokenService onboardTokenService,
            AuditLogService auditLogService
    ) {
        this.householdUserRepository = householdUserRepository;
        this.credentialVault = credentialVault;
        this.verifier = verifier;
        this.sessionManager = sessionManager;
        this.onboardTokenService = onboardTokenService;
        this.auditLogService = auditLogService;
    }

    public LoginResult login(Long userId, String email, String secret, RequestMetadata metadata) {
        if ((userId == null && (email == null || email.isBlank())) || secret == null || secret.isEmpty()) {
            throw new ProblemException(HttpStatus.BAD_REQUEST, "VALIDATION_ERROR", "(userId or email) and secret required");
        }
        HouseholdUser user = resolveUser(userId, email)
                .orElseThrow(() -> new ProblemException(HttpStatus.UNAUTHORIZED, "INVALID_CREDENTIALS", "Invalid credentials"));

        Outcome outcome = verifier.verify(user.getId(), CredentialProvider.PASSWORD, secret, metadata);
        if (!outcome.valid()) {
            if (outcome.status().locked()) {
                throw verifier.locked(verifier.retryAfterSeconds(outcome.status()));
            }
            throw new BadCredentialsProblemException(outcome.status().remainingAttempts());
        }

        if (!user.isActive()) {
            throw new ProblemException(HttpStatus.FORBIDDEN, "USER_INACTIVE", "User is inactive");
        }

        if (user.isFirstLoginRequired()) {
            log.info("User {} must set a password before the first session", user.getId());
            return LoginResult.firstLogin(onboardTokenService.issue(user.getId()));
        }

        UserSession session = openSession(user, metadata);
        auditLogService.record(AuditLogCommand.of("auth.login.ok", AuditResult.OK, user.getId(), metadata, null));
        return LoginResult.session(session);
    }

    /**
     * Sets the first password of an existing account and signs it in. Accounts that already have a
     * password must use the change or reset flows.
     */
    public UserSession register(Long userId, String secret, RequestMetadata metadata) {
        HouseholdUser user = householdUserRepository.findById(userId)
                .orElseThrow(() -> new ProblemException(HttpStatus.NOT_FOUND, "USER_NOT_FOUND", "User not found"));
        if (!user.isActive()) {
            throw new ProblemException(HttpStatus.FORBIDDEN, "USER_INACTIVE", "User is inactive");
        }
        if (credentialVault.hasCredential(userId, CredentialProvider.PASSWORD)) {
            throw new ProblemException(HttpStatus.CONFLICT, "CREDENTIALS_EXIST", "A password is already registered");
        }
        credentialVault.updateCredential(userId, CredentialProvider.PASSWORD, secret);
        auditLogService.record(AuditLogCommand.of("auth.register", AuditResult.OK, userId, metadata, null));
        return openSession(user, metadata);
    }

    /**
     * Replaces the caller's password and rotates every session the user holds.
     */
    public UserSession changeCredential(SessionPrincipal principal, String oldSecret, String newSecret,
                                        RequestMetadata metadata) {
        Long userId = principal.userId();
        if (!credentialVault.verifyCredential(userId, CredentialProvider.PASSWORD, oldSecret)) {
            auditLogService.record(AuditLogCommand.of("auth.password.change", AuditResult.DENY, userId, metadata,
                    Map.of("reason", "old_secret_mismatch")));
            throw new ProblemException(HttpStatus.UNAUTHORIZED, BadCredentialsProblemException.CODE, "Invalid credentials");
        }
        HouseholdUser user = householdUserRepository.findById(userId)
                .orElseThrow(() -> new ProblemException(HttpStatus.UNAUTHORIZED, "AUTH_EXPIRED", "Session user no longer exists"));

        credentialVault.updateCredential(userId, CredentialProvider.PASSWORD, newSecret);
        sessionManager.destroyAllForUser(userId);
        UserSession session = openSession(user, metadata);
        auditLogService.record(AuditLogCommand.of("auth.password.change", AuditResult.OK, userId, metadata,
                Map.of("rotatedSessions", true)));
        return session;
    }

    public void logout(String sid, Long actorUserId, RequestMetadata metadata) {
        if (sid == null) {
            return;
        }
        sessionManager.destroy(sid);
        if (actorUserId != null) {
            auditLogService.record(AuditLogCommand.of("auth.logout", AuditResult.OK, actorUserId, metadata, null));
        }
    }

    private Optional<HouseholdUser> resolveUser(Long userId, String email) {
        if (userId != null) {
            return householdUserRepository.findById(userId);
        }
        return householdUserRepository.findByEmailIgnoreCase(email.trim());
    }

    private UserSession openSession(HouseholdUser user, RequestMetadata metadata) {
        return sessionManager.create(SessionRequest.regular(
                user.getId(), user.getRole(), sessionManager.ttlFor(false), metadata.clientIp()));
    }

    /**
     * Either a live session or, for accounts that still need a first password, an onboarding token.
     */
    public record LoginResult(UserSession session, String onboardToken) {

        static LoginResult session(UserSession session) {
            return new LoginResult(session, null);
        }

        static LoginResult firstLogin(String onboardToken) {
            return new LoginResult(null, onboardToken);
        }

        public boolean firstLoginRequired() {
            return onboardToken != null;
        }
    }
}
