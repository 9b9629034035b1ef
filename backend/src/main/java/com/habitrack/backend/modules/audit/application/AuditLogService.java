package com.habitrack.backend.modules.audit.application;

import java.time.Clock;
import java.time.OffsetDateTime;
import java.util.HashMap;
import java.util.Map;
import java.util.Objects;

import com.habitrack.backend.global.web.RequestMetadata;
import com.habitrack.backend.modules.audit.domain.AuditLog;
import com.habitrack.backend.modules.audit.domain.AuditResult;
import com.habitrack.backend.modules.audit.infrastructure.AuditLogRepository;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.dao.DataAccessException;
import org.springframework.stereotype.Service;

/**
 * Fire-and-forget audit sink. A failed write is logged and never reaches the caller.
 */
@Service
public class AuditLogService {

    private static final Logger log = LoggerFactory.getLogger(AuditLogService.class);
    private static final int USER_AGENT_MAX_LENGTH = 255;

    private final AuditLogRepository auditLogRepository;
    private final Clock clock;

    public AuditLogService(AuditLogRepository auditLogRepository, Clock clock) {
        this.auditLogRepository = auditLogRepository;
        this.clock = clock;
    }

    public void record(AuditLogCommand command) {
        Objects.requireNonNull(command.action(), "action is required");
        Objects.requireNonNull(command.result(), "result is required");

        AuditLog auditLog = new AuditLog();
        auditLog.setAction(command.action());
        auditLog.setResult(command.result());
        auditLog.setActorUserId(command.actorUserId());
        auditLog.setIp(command.ip());
        auditLog.setUserAgent(truncate(command.userAgent()));
        auditLog.setCreatedAt(OffsetDateTime.now(clock));
        if (command.detail() != null && !command.detail().isEmpty()) {
            auditLog.setDetail(new HashMap<>(command.detail()));
        }

        try {
            auditLogRepository.save(auditLog);
        } catch (DataAccessException ex) {
            log.warn("Audit write failed for action {}", command.action(), ex);
        }
    }

    private static String truncate(String userAgent) {
        if (userAgent == null || userAgent.length() <= USER_AGENT_MAX_LENGTH) {
            return userAgent;
        }
        return userAgent.substring(0, USER_AGENT_MAX_LENGTH);
    }

    public record AuditLogCommand(
            String action,
            AuditResult result,
            Long actorUserId,
            String ip,
            String userAgent,
            Map<String, Object> detail
    ) {

        public static AuditLogCommand of(String action, AuditResult result, Long actorUserId, RequestMetadata metadata,
                                         Map<String, Object> detail) {
            return new AuditLogCommand(action, result, actorUserId, metadata.clientIp(), metadata.userAgent(), detail);
        }
    }
}
