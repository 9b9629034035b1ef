package com.habitrack.backend.modules.auth.application;

import java.util.List;
import java.util.Map;

import com.habitrack.backend.global.error.BadCredentialsProblemException;
import com.habitrack.backend.global.error.ProblemException;
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
import com.habitrack.backend.modules.kiosk.application.NetworkTrustClassifier;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.http.HttpStatus;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;
import org.springframework.web.server.ResponseStatusException;

/**
 * Kiosk PIN authentication. Every entry point re-checks the network boundary even though
 * the kiosk filter has already done so.
 */
@Service
@Transactional(noRollbackFor = ResponseStatusException.class)
public class PinAuthService {

    public static final String KIOSK_LOCAL_ONLY = "KIOSK_LOCAL_ONLY";

    private static final Logger log = LoggerFactory.getLogger(PinAuthService.class);

    private final HouseholdUserRepository householdUserRepository;
    private final NetworkTrustClassifier networkTrustClassifier;
    private final LockoutProtectedVerifier verifier;
    private final SessionManager sessionManager;
    private final AuditLogService auditLogService;

    public PinAuthService(
            HouseholdUserRepository householdUserRepository,
            NetworkTrustClassifier networkTrustClassifier,
            LockoutProtectedVerifier verifier,
            SessionManager sessionManager,
            AuditLogService auditLogService
    ) {
        this.householdUserRepository = householdUserRepository;
        this.networkTrustClassifier = networkTrustClassifier;
        this.verifier = verifier;
        this.sessionManager = sessionManager;
        this.auditLogService = auditLogService;
    }

    @Transactional(readOnly = true)
    public List<HouseholdUser> listPinUsers(RequestMetadata metadata) {
        requireLocal(metadata);
        return householdUserRepository.findActiveWithCredential(CredentialProvider.KIOSK_PIN);
    }

    public PinLogin login(Long userId, String pin, RequestMetadata metadata) {
        requireLocal(metadata);
        HouseholdUser user = findActiveUser(userId);

        Outcome outcome = verifier.verify(user.getId(), CredentialProvider.KIOSK_PIN, pin, metadata);
        if (!outcome.valid()) {
            if (outcome.status().locked()) {
                throw verifier.locked(verifier.retryAfterSeconds(outcome.status()));
            }
            throw new BadCredentialsProblemException(outcome.status().remainingAttempts());
        }

        UserSession session = sessionManager.create(new SessionRequest(
                user.getId(),
                user.getRole(),
                sessionManager.ttlFor(true),
                true,
                null,
                metadata.clientIp()
        ));
        auditLogService.record(AuditLogCommand.of("auth.pin_login", AuditResult.OK, user.getId(), metadata,
                Map.of("kiosk", true)));
        return new PinLogin(user, session);
    }

    /**
     * Confirms a PIN without opening a session. Wrong PINs still count towards the lockout.
     */
    public boolean verify(Long userId, String pin, RequestMetadata metadata) {
        requireLocal(metadata);
        HouseholdUser user = householdUserRepository.findById(userId)
                .filter(HouseholdUser::isActive)
                .orElse(null);
        if (user == null) {
            return false;
        }
        return verifier.verify(user.getId(), CredentialProvider.KIOSK_PIN, pin, metadata).valid();
    }

    private HouseholdUser findActiveUser(Long userId) {
        return householdUserRepository.findById(userId)
                .filter(HouseholdUser::isActive)
                .orElseThrow(() -> new ProblemException(HttpStatus.UNAUTHORIZED, "INVALID_CREDENTIALS", "Invalid PIN"));
    }

    private void requireLocal(RequestMetadata metadata) {
        if (!networkTrustClassifier.isLocal(metadata.clientIp())) {
            log.warn("PIN authentication refused for non-local address {}", metadata.clientIp());
            throw new ProblemException(HttpStatus.FORBIDDEN, KIOSK_LOCAL_ONLY,
                    "Kiosk login is only available on the local network");
        }
    }

    public record PinLogin(HouseholdUser user, UserSession session) {
    }
}
