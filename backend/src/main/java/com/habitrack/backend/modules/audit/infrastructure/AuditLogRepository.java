package com.habitrack.backend.modules.audit.infrastructure;

import java.util.List;

import com.habitrack.backend.modules.audit.domain.AuditLog;

import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.transaction.annotation.Propagation;
import org.springframework.transaction.annotation.Transactional;

public interface AuditLogRepository extends JpaRepository<AuditLog, Long> {

    @Override
    @Transactional(propagation = Propagation.REQUIRES_NEW)
    <S extends AuditLog> S save(S entity);

    List<AuditLog> findByActionOrderByIdAsc(String action);
}
