package com.habitrack.backend.support;

import com.habitrack.backend.modules.auth.application.CredentialVault;
import com.habitrack.backend.modules.auth.domain.CredentialProvider;
import com.habitrack.backend.modules.auth.domain.HouseholdRole;
import com.habitrack.backend.modules.auth.domain.HouseholdUser;
import com.habitrack.backend.modules.auth.infrastructure.persistence.HouseholdUserRepository;

import org.springframework.stereotype.Component;
import org.springframework.transaction.annotation.Transactional;

@Component
@Transactional
public class TestUserFactory {

    private final HouseholdUserRepository householdUserRepository;
    private final CredentialVault credentialVault;

    public TestUserFactory(HouseholdUserRepository householdUserRepository, CredentialVault credentialVault) {
        this.householdUserRepository = householdUserRepository;
        this.credentialVault = credentialVault;
    }

    public HouseholdUser ensureAdmin(String email, String rawPassword) {
        return ensureUser(email, rawPassword, HouseholdRole.ADMIN);
    }

    public HouseholdUser ensureMember(String email, String rawPassword) {
        return ensureUser(email, rawPassword, HouseholdRole.MEMBER);
    }

    public HouseholdUser ensureUser(String email, String rawPassword, HouseholdRole role) {
        HouseholdUser user = householdUserRepository.findByEmailIgnoreCase(email)
                .orElseGet(HouseholdUser::new);
        user.setEmail(email);
        user.setDisplayName(email.substring(0, email.indexOf('@')));
        user.setRole(role);
        user.setActive(true);
        user.setFirstLoginRequired(false);
        HouseholdUser saved = householdUserRepository.save(user);
        if (rawPassword != null) {
            credentialVault.updateCredential(saved.getId(), CredentialProvider.PASSWORD, rawPassword);
        }
        return saved;
    }

    public void setPin(HouseholdUser user, String pin) {
        credentialVault.updateCredential(user.getId(), CredentialProvider.KIOSK_PIN, pin);
    }
}
