package com.habitrack.backend.modules.admin.application;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

import com.habitrack.backend.global.error.ProblemException;
import com.habitrack.backend.global.web.RequestMetadata;
import com.habitrack.backend.modules.audit.application.AuditLogService;
import com.habitrack.backend.modules.auth.application.CredentialVault;
import com.habitrack.backend.modules.auth.application.LockoutGuard;
import com.habitrack.backend.modules.auth.domain.CredentialProvider;
import com.habitrack.backend.modules.auth.infrastructure.persistence.HouseholdUserRepository;

import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.InjectMocks;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

@ExtendWith(MockitoExtension.class)
class AdminCredentialServiceTest {

    private static final RequestMetadata METADATA = new RequestMetadata("192.168.1.10", "JUnit");

    @Mock
    private HouseholdUserRepository householdUserRepository;

    @Mock
    private CredentialVault credentialVault;

    @Mock
    private LockoutGuard lockoutGuard;

    @Mock
    private AuditLogService auditLogService;

    @InjectMocks
    private AdminCredentialService service;

    @Test
    void setPasswordStoresAndClearsLockout() {
        when(householdUserRepository.existsById(7L)).thenReturn(true);

        service.setPassword(1L, 7L, "long-enough", METADATA);

        verify(credentialVault).updateCredential(7L, CredentialProvider.PASSWORD, "long-enough");
        verify(lockoutGuard).clear(7L);
        verify(auditLogService).record(any());
    }

    @Test
    void setPinAcceptsFourToEightDigits() {
        when(householdUserRepository.existsById(7L)).thenReturn(true);

        service.setPin(1L, 7L, "0420", METADATA);

        verify(credentialVault).updateCredential(7L, CredentialProvider.KIOSK_PIN, "0420");
    }

    @Test
    void malformedSecretsAreValidationErrors() {
        assertThatThrownBy(() -> service.setPassword(1L, 7L, "short", METADATA))
                .isInstanceOfSatisfying(ProblemException.class,
                        ex -> assertThat(ex.getCode()).isEqualTo("VALIDATION_ERROR"));
        assertThatThrownBy(() -> service.setPin(1L, 7L, "12a4", METADATA))
                .isInstanceOfSatisfying(ProblemException.class,
                        ex -> assertThat(ex.getCode()).isEqualTo("VALIDATION_ERROR"));
        assertThatThrownBy(() -> service.setPin(1L, 7L, "123456789", METADATA))
                .isInstanceOf(ProblemException.class);
        verify(credentialVault, never()).updateCredential(any(), any(), any());
    }

    @Test
    void unknownUserIsNotFound() {
        when(householdUserRepository.existsById(404L)).thenReturn(false);

        assertThatThrownBy(() -> service.setPassword(1L, 404L, "long-enough", METADATA))
                .isInstanceOfSatisfying(ProblemException.class,
                        ex -> assertThat(ex.getCode()).isEqualTo("USER_NOT_FOUND"));
    }
}
