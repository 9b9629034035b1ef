package com.habitrack.backend.modules.auth.application;

import java.util.Map;

import com.habitrack.backend.global.error.ProblemException;
import com.habitrack.backend.global.web.RequestMetadata;
import com.habitrack.backend.modules.audit.application.AuditLogService;
import com.habitrack.backend.modules.audit.application.AuditLogService.AuditLogCommand;
import com.habitrack.backend.modules.audit.domain.AuditResult;
import com.habitrack.backend.modules.auth.application.OnboardTokenService.InvalidOnboardTokenException;
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

@Service
@Transactional(noRollbackFor = ResponseStatusException.class)
public class OnboardingService {

    private static final Logger log = LoggerFactory.getLogger(OnboardingService.class);

    private final OnboardTokenService onboardTokenService;
    private final HouseholdUserRepository householdUserRepository;
    private final CredentialVault credentialVault;
    private final SessionManager sessionManager;
    private final AuditLogService auditLogService;

    public OnboardingService(
            OnboardTokenService onboardTokenService,
            HouseholdUserRepository householdUserRepository,
            CredentialVault credentialVault,
            SessionManager sessionManager,
            AuditLogService auditLogService
    ) {
        this.onboardTokenService = onboardTokenService;
        this.householdUserRepository = householdUserRepository;
        this.credentialVault = credentialVault;
        this.sessionManager = sessionManager;
        this.auditLogService = auditLogService;
    }

    public UserSession setInitialPassword(String token, String newPassword, RequestMetadata metadata) {
        Long userId;
        try {
            userId = onboardTokenService.parse(token);
        } catch (InvalidOnboardTokenException ex) {
            log.warn("Rejected onboarding token: {}", ex.getMessage());
            throw new ProblemException(HttpStatus.UNAUTHORIZED, "INVALID_TOKEN",
                    "Invalid or expired token. Please log in again.");
        }

        HouseholdUser user = householdUserRepository.findById(userId)
                .filter(HouseholdUser::isActive)
                .orElseThrow(() -> new ProblemException(HttpStatus.NOT_FOUND, "USER_NOT_FOUND", "User not found"));
        if (!user.isFirstLoginRequired()) {
            log.info("User {} already completed first login; replacing password anyway", userId);
        }

        credentialVault.updateCredential(userId, CredentialProvider.PASSWORD, newPassword);
        user.setFirstLoginRequired(false);
        householdUserRepository.save(user);

        UserSession session = sessionManager.create(SessionRequest.regular(
                userId, user.getRole(), sessionManager.ttlFor(false), metadata.clientIp()));
        auditLogService.record(AuditLogCommand.of("auth.first_login.complete", AuditResult.OK, userId, metadata,
                Map.of("displayName", user.getDisplayName())));
        return session;
    }
}
