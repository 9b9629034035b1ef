package com.habitrack.backend.modules.admin.application;

import java.util.Map;
import java.util.Optional;

import com.habitrack.backend.global.error.ProblemException;
import com.habitrack.backend.global.security.SessionPrincipal;
import com.habitrack.backend.global.web.RequestMetadata;
import com.habitrack.backend.modules.audit.application.AuditLogService;
import com.habitrack.backend.modules.audit.application.AuditLogService.AuditLogCommand;
import com.habitrack.backend.modules.audit.domain.AuditResult;
import com.habitrack.backend.modules.auth.application.SessionManager;
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
 * Lets an administrator act as another household member through a separate session.
 * <p>
 * Starting leaves the admin's own session untouched. Stopping discards the impersonation session and
 * signs the admin in again with a fresh sid. Impersonation does not nest.
 */
@Service
@Transactional(noRollbackFor = ResponseStatusException.class)
public class ImpersonationService {

    private static final Logger log = LoggerFactory.getLogger(ImpersonationService.class);

    private final HouseholdUserRepository householdUserRepository;
    private final SessionManager sessionManager;
    private final AuditLogService auditLogService;

    public ImpersonationService(
            HouseholdUserRepository householdUserRepository,
            SessionManager sessionManager,
            AuditLogService auditLogService
    ) {
        this.householdUserRepository = householdUserRepository;
        this.sessionManager = sessionManager;
        this.auditLogService = auditLogService;
    }

    public UserSession start(SessionPrincipal actor, Long targetUserId, RequestMetadata metadata) {
        if (actor.isImpersonating()) {
            throw new ProblemException(HttpStatus.CONFLICT, "ALREADY_IMPERSONATING",
                    "Stop the current impersonation first");
        }
        if (!actor.isAdmin()) {
            throw new ProblemException(HttpStatus.FORBIDDEN, "FORBIDDEN", "Admin role required");
        }
        if (targetUserId == null || targetUserId <= 0 || targetUserId.equals(actor.userId())) {
            throw new ProblemException(HttpStatus.BAD_REQUEST, "INVALID_USER_ID", "Invalid target user");
        }
        HouseholdUser target = householdUserRepository.findById(targetUserId)
                .filter(HouseholdUser::isActive)
                .orElseThrow(() -> new ProblemException(HttpStatus.NOT_FOUND, "USER_NOT_FOUND", "User not found"));

        UserSession session = sessionManager.create(new SessionRequest(
                target.getId(), target.getRole(), sessionManager.ttlFor(false), false, actor.userId(),
                metadata.clientIp()));
        log.info("Admin {} started impersonating user {}", actor.userId(), target.getId());
        auditLogService.record(AuditLogCommand.of("admin.impersonate.start", AuditResult.OK, actor.userId(), metadata,
                Map.of("targetUserId", target.getId())));
        return session;
    }

    /**
     * Ends the impersonation held by {@code sid} and returns a new session for the original admin.
     */
    public UserSession stop(String sid, RequestMetadata metadata) {
        if (sid == null || sid.isEmpty()) {
            throw new ProblemException(HttpStatus.UNAUTHORIZED, "AUTH_REQUIRED", "Authentication required");
        }
        UserSession current = sessionManager.get(sid)
                .filter(UserSession::isImpersonation)
                .orElseThrow(() -> new ProblemException(HttpStatus.BAD_REQUEST, "NOT_IMPERSONATING",
                        "This session is not an impersonation"));

        Long adminId = current.getImpersonatedBy();
        HouseholdUser admin = householdUserRepository.findById(adminId)
                .orElseThrow(() -> {
                    log.error("Impersonating admin {} no longer exists", adminId);
                    return new ProblemException(HttpStatus.INTERNAL_SERVER_ERROR, "SERVER_ERROR",
                            "Original admin account is missing");
                });

        sessionManager.destroy(sid);
        UserSession restored = sessionManager.create(SessionRequest.regular(
                admin.getId(), admin.getRole(), sessionManager.ttlFor(false), metadata.clientIp()));
        log.info("Admin {} stopped impersonating user {}", admin.getId(), current.getUserId());
        auditLogService.record(AuditLogCommand.of("admin.impersonate.stop", AuditResult.OK, admin.getId(), metadata,
                Map.of("targetUserId", current.getUserId())));
        return restored;
    }

    @Transactional(readOnly = true)
    public ImpersonationStatus status(SessionPrincipal principal) {
        if (!principal.isImpersonating()) {
            return ImpersonationStatus.NONE;
        }
        return new ImpersonationStatus(true, householdUserRepository.findById(principal.impersonatedBy()));
    }

    public record ImpersonationStatus(boolean impersonating, Optional<HouseholdUser> originalAdmin) {

        static final ImpersonationStatus NONE = new ImpersonationStatus(false, Optional.empty());
    }
}
