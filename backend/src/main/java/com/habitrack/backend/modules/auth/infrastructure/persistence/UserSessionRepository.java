package com.habitrack.backend.modules.auth.infrastructure.persistence;

import java.time.OffsetDateTime;

import com.habitrack.backend.modules.auth.domain.UserSession;

import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Modifying;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.query.Param;
import org.springframework.transaction.annotation.Transactional;

public interface UserSessionRepository extends JpaRepository<UserSession, String> {

    @Modifying
    @Transactional
    @Query("delete from UserSession us where us.userId = :userId")
    int deleteAllByUserId(@Param("userId") Long userId);

    @Modifying
    @Transactional
    @Query("delete from UserSession us where us.expiresAt <= :now")
    int deleteExpired(@Param("now") OffsetDateTime now);
}
