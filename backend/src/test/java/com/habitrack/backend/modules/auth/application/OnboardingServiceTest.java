package com.habitrack.backend.modules.auth.application;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

import java.security.SecureRandom;
import java.time.Duration;
import java.util.Optional;

import com.habitrack.backend.global.error.ProblemException;
import com.habitrack.backend.global.web.RequestMetadata;
import com.habitrack.backend.modules.audit.application.AuditLogService;
import com.habitrack.backend.modules.auth.domain.CredentialProvider;
import com.habitrack.backend.modules.auth.domain.HouseholdUser;
import com.habitrack.backend.modules.auth.domain.UserSession;
import com.habitrack.backend.modules.auth.infrastructure.persistence.HouseholdUserRepository;
import com.habitrack.backend.modules.auth.infrastructure.token.OnboardTokenKeyProvider;
import com.habitrack.backend.support.InMemorySessionStore;
import com.habitrack.backend.support.MutableClock;
import com.habitrack.backend.support.TestUsers;

import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

@ExtendWith(MockitoExtension.class)
class OnboardingServiceTest {

    private static final RequestMetadata METADATA = new RequestMetadata("192.168.1.10", "JUnit");

    @Mock
    private HouseholdUserRepository householdUserRepository;

    @Mock
    private CredentialVault credentialVault;

    @Mock
    private AuditLogService auditLogService;

    private MutableClock clock;
    private OnboardTokenService tokenService;
    private InMemorySessionStore sessionStore;
    private OnboardingService service;

    @BeforeEach
    void setUp() {
        clock = MutableClock.at("2025-03-01T08:00:00Z");
        tokenService = new OnboardTokenService(
                new OnboardTokenKeyProvider("test-onboard-secret-with-at-least-32-bytes-of-entropy"),
                Duration.ofMinutes(10), clock);
        sessionStore = new InMemorySessionStore();
        SessionManager sessionManager = new SessionManager(sessionStore, new SecureRandom(), clock,
                Duration.ofDays(30), Duration.ofHours(4), true);
        service = new OnboardingService(tokenService, householdUserRepository, credentialVault, sessionManager,
                auditLogService);
    }

    @Test
    void validTokenSetsPasswordAndClearsFirstLoginFlag() {
        HouseholdUser user = TestUsers.member(5L);
        user.setFirstLoginRequired(true);
        when(householdUserRepository.findById(5L)).thenReturn(Optional.of(user));

        UserSession session = service.setInitialPassword(tokenService.issue(5L), "brand-new-password", METADATA);

        verify(credentialVault).updateCredential(5L, CredentialProvider.PASSWORD, "brand-new-password");
        verify(householdUserRepository).save(user);
        assertThat(user.isFirstLoginRequired()).isFalse();
        assertThat(session.getUserId()).isEqualTo(5L);
        assertThat(sessionStore.contains(session.getSid())).isTrue();
    }

    @Test
    void expiredTokenIsInvalidToken() {
        String token = tokenService.issue(5L);
        clock.advance(Duration.ofMinutes(11));

        assertThatThrownBy(() -> service.setInitialPassword(token, "brand-new-password", METADATA))
                .isInstanceOfSatisfying(ProblemException.class,
                        ex -> assertThat(ex.getCode()).isEqualTo("INVALID_TOKEN"));
        assertThat(sessionStore.size()).isZero();
    }

    @Test
    void tokenForRemovedUserIsNotFound() {
        when(householdUserRepository.findById(5L)).thenReturn(Optional.empty());

        assertThatThrownBy(() -> service.setInitialPassword(tokenService.issue(5L), "brand-new-password", METADATA))
                .isInstanceOfSatisfying(ProblemException.class,
                        ex -> assertThat(ex.getCode()).isEqualTo("USER_NOT_FOUND"));
    }
}
