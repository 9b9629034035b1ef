package com.habitrack.backend.modules.auth.infrastructure.persistence;

import java.util.List;
import java.util.Optional;

import com.habitrack.backend.modules.auth.domain.CredentialProvider;
import com.habitrack.backend.modules.auth.domain.HouseholdUser;

import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.query.Param;

public interface HouseholdUserRepository extends JpaRepository<HouseholdUser, Long> {

    Optional<HouseholdUser> findByEmailIgnoreCase(String email);

    @Query("""
            select u
              from HouseholdUser u
             where u.active = true
               and u.kioskOnly = false
               and exists (
                   select c.id from Credential c
                    where c.userId = u.id
                      and c.provider = :provider
               )
             order by u.displayName
            """)
    List<HouseholdUser> findActiveWithCredential(@Param("provider") CredentialProvider provider);
}
