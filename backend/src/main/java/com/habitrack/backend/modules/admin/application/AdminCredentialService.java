package com.habitrack.backend.modules.admin.application;

import java.util.Map;
import java.util.regex.Pattern;

import com.habitrack.backend.global.error.ProblemException;
import com.habitrack.backend.global.web.RequestMetadata;
import com.habitrack.backend.modules.audit.application.AuditLogService;
import com.habitrack.backend.modules.audit.application.AuditLogService.AuditLogCommand;
import com.habitrack.backend.modules.audit.domain.AuditResult;
import com.habitrack.backend.modules.auth.application.CredentialVault;
import com.habitrack.backend.modules.auth.application.LockoutGuard;
import com.habitrack.backend.modules.auth.domain.CredentialProvider;
import com.habitrack.backend.modules.auth.infrastructure.persistence.HouseholdUserRepository;

import org.springframework.http.HttpStatus;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;
import org.springframework.web.server.ResponseStatusException;

@Service
@Transactional(noRollbackFor = ResponseStatusException.class)
public class AdminCredentialService {

    static final int MIN_PASSWORD_LENGTH = 8;
    private static final Pattern PIN_PATTERN = Pattern.compile("\\d{4,8}");

    private final HouseholdUserRepository householdUserRepository;
    private final CredentialVault credentialVault;
    private final LockoutGuard lockoutGuard;
    private final AuditLogService auditLogService;

    public AdminCredentialService(
            HouseholdUserRepository householdUserRepository,
            CredentialVault credentialVault,
            LockoutGuard lockoutGuard,
            AuditLogService auditLogService
    ) {
        this.householdUserRepository = householdUserRepository;
        this.credentialVault = credentialVault;
        this.lockoutGuard = lockoutGuard;
        this.auditLogService = auditLogService;
    }

    public void setPassword(Long actorId, Long userId, String password, RequestMetadata metadata) {
        if (password == null || password.length() < MIN_PASSWORD_LENGTH) {
            throw new ProblemException(HttpStatus.BAD_REQUEST, "VALIDATION_ERROR",
                    "Password must be at least " + MIN_PASSWORD_LENGTH + " characters");
        }
        store(actorId, userId, CredentialProvider.PASSWORD, password, metadata);
    }

    public void setPin(Long actorId, Long userId, String pin, RequestMetadata metadata) {
        if (pin == null || !PIN_PATTERN.matcher(pin).matches()) {
            throw new ProblemException(HttpStatus.BAD_REQUEST, "VALIDATION_ERROR", "PIN must be 4 to 8 digits");
        }
        store(actorId, userId, CredentialProvider.KIOSK_PIN, pin, metadata);
    }

    private void store(Long actorId, Long userId, CredentialProvider provider, String secret, RequestMetadata metadata) {
        if (userId == null || !householdUserRepository.existsById(userId)) {
            throw new ProblemException(HttpStatus.NOT_FOUND, "USER_NOT_FOUND", "User not found");
        }
        credentialVault.updateCredential(userId, provider, secret);
        // a fresh secret starts with a clean failure count
        lockoutGuard.clear(userId);
        auditLogService.record(AuditLogCommand.of("admin.credential.set", AuditResult.OK, actorId, metadata,
                Map.of("targetUserId", userId, "provider", provider.name())));
    }
}
