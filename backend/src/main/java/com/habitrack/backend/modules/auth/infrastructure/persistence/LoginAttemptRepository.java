package com.habitrack.backend.modules.auth.infrastructure.persistence;

import java.time.OffsetDateTime;

import com.habitrack.backend.modules.auth.domain.LoginAttempt;

import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Modifying;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.query.Param;
import org.springframework.transaction.annotation.Propagation;
import org.springframework.transaction.annotation.Transactional;

/**
 * Every method runs in its own transaction so that a failing attempt write never rolls back the
 * surrounding login.
 */
public interface LoginAttemptRepository extends JpaRepository<LoginAttempt, Long> {

    @Override
    @Transactional(propagation = Propagation.REQUIRES_NEW)
    <S extends LoginAttempt> S save(S entity);

    @Transactional(propagation = Propagation.REQUIRES_NEW, readOnly = true)
    @Query("""
            select count(a)
              from LoginAttempt a
             where a.userId = :userId
               and a.success = false
               and a.attemptedAt > :since
            """)
    long countFailedSince(@Param("userId") Long userId, @Param("since") OffsetDateTime since);

    @Transactional(propagation = Propagation.REQUIRES_NEW, readOnly = true)
    @Query("""
            select max(a.attemptedAt)
              from LoginAttempt a
             where a.userId = :userId
               and a.success = false
               and a.attemptedAt > :since
            """)
    OffsetDateTime findLatestFailedSince(@Param("userId") Long userId, @Param("since") OffsetDateTime since);

    @Modifying
    @Transactional(propagation = Propagation.REQUIRES_NEW)
    @Query("delete from LoginAttempt a where a.userId = :userId and a.success = false")
    int deleteFailedByUserId(@Param("userId") Long userId);

    @Modifying
    @Transactional(propagation = Propagation.REQUIRES_NEW)
    @Query("delete from LoginAttempt a where a.success = false and a.attemptedAt < :before")
    int deleteFailedOlderThan(@Param("before") OffsetDateTime before);
}
