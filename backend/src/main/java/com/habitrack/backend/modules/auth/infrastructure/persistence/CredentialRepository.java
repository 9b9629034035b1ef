package com.habitrack.backend.modules.auth.infrastructure.persistence;

import java.util.Optional;

import com.habitrack.backend.modules.auth.domain.Credential;
import com.habitrack.backend.modules.auth.domain.CredentialProvider;

import org.springframework.data.jpa.repository.JpaRepository;

public interface CredentialRepository extends JpaRepository<Credential, Long> {

    Optional<Credential> findByUserIdAndProvider(Long userId, CredentialProvider provider);

    boolean existsByUserIdAndProvider(Long userId, CredentialProvider provider);
}
