package com.habitrack.backend.modules.auth.infrastructure.persistence;

import com.habitrack.backend.modules.auth.domain.PasswordResetCode;

import org.springframework.data.jpa.repository.JpaRepository;

public interface PasswordResetCodeRepository extends JpaRepository<PasswordResetCode, Long> {
}
