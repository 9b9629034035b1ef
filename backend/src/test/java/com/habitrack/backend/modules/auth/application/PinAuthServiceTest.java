package com.habitrack.backend.modules.auth.application;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyLong;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.lenient;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.verifyNoInteractions;
import static org.mockito.Mockito.when;

import java.security.SecureRandom;
import java.time.Duration;
import java.time.OffsetDateTime;
import java.util.List;
import java.util.Optional;

import com.habitrack.backend.global.error.BadCredentialsProblemException;
import com.habitrack.backend.global.error.ProblemException;
import com.habitrack.backend.global.web.RequestMetadata;
import com.habitrack.backend.modules.audit.application.AuditLogService;
import com.habitrack.backend.modules.auth.application.PinAuthService.PinLogin;
import com.habitrack.backend.modules.auth.domain.CredentialProvider;
import com.habitrack.backend.modules.auth.domain.HouseholdRole;
import com.habitrack.backend.modules.auth.domain.HouseholdUser;
import com.habitrack.backend.modules.auth.infrastructure.persistence.HouseholdUserRepository;
import com.habitrack.backend.modules.auth.infrastructure.persistence.LoginAttemptRepository;
import com.habitrack.backend.modules.kiosk.application.NetworkTrustClassifier;
import com.habitrack.backend.support.InMemoryLoginAttempts;
import com.habitrack.backend.support.InMemorySessionStore;
import com.habitrack.backend.support.MutableClock;
import com.habitrack.backend.support.TestUsers;

import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

@ExtendWith(MockitoExtension.class)
class PinAuthServiceTest {

    private static final String PIN = "2468";
    private static final RequestMetadata LAN = new RequestMetadata("192.168.1.30", "Kiosk");
    private static final RequestMetadata INTERNET = new RequestMetadata("8.8.8.8", "curl");

    @Mock
    private HouseholdUserRepository householdUserRepository;

    @Mock
    private CredentialVault credentialVault;

    @Mock
    private LoginAttemptRepository loginAttemptRepository;

    @Mock
    private AuditLogService auditLogService;

    private MutableClock clock;
    private InMemoryLoginAttempts attempts;
    private InMemorySessionStore sessionStore;
    private PinAuthService pinAuthService;
    private HouseholdUser kid;

    @BeforeEach
    void setUp() {
        clock = MutableClock.at("2025-05-10T16:00:00Z");
        attempts = InMemoryLoginAttempts.wire(loginAttemptRepository);
        sessionStore = new InMemorySessionStore();
        SessionManager sessionManager = new SessionManager(sessionStore, new SecureRandom(), clock,
                Duration.ofDays(30), Duration.ofHours(4), true);
        LockoutGuard lockoutGuard = new LockoutGuard(loginAttemptRepository, clock, 5, Duration.ofMinutes(15), Duration.ofHours(24));
        LockoutProtectedVerifier verifier = new LockoutProtectedVerifier(lockoutGuard, credentialVault, auditLogService);
        pinAuthService = new PinAuthService(householdUserRepository, new NetworkTrustClassifier(), verifier,
                sessionManager, auditLogService);

        kid = TestUsers.user(7L, HouseholdRole.KID);
        lenient().when(householdUserRepository.findById(7L)).thenReturn(Optional.of(kid));
        lenient().when(credentialVault.verifyCredential(anyLong(), eq(CredentialProvider.KIOSK_PIN), anyString()))
                .thenAnswer(invocation -> PIN.equals(invocation.getArgument(2)));
    }

    @Test
    void correctPinOnLanOpensShortKioskSession() {
        PinLogin login = pinAuthService.login(7L, PIN, LAN);

        assertThat(login.user()).isSameAs(kid);
        assertThat(login.session().isKiosk()).isTrue();
        assertThat(login.session().getClientIp()).isEqualTo("192.168.1.30");
        assertThat(login.session().getExpiresAt()).isEqualTo(OffsetDateTime.now(clock).plusHours(4));
    }

    @Test
    void correctPinFromInternetIsRefusedBeforeCredentialsAreTouched() {
        assertThatThrownBy(() -> pinAuthService.login(7L, PIN, INTERNET))
                .isInstanceOfSatisfying(ProblemException.class,
                        ex -> assertThat(ex.getCode()).isEqualTo(PinAuthService.KIOSK_LOCAL_ONLY));

        verifyNoInteractions(loginAttemptRepository);
        verify(credentialVault, never()).verifyCredential(any(), any(), any());
        assertThat(sessionStore.size()).isZero();
    }

    @Test
    void listAndVerifyAreAlsoLocalOnly() {
        assertThatThrownBy(() -> pinAuthService.listPinUsers(INTERNET)).isInstanceOf(ProblemException.class);
        assertThatThrownBy(() -> pinAuthService.verify(7L, PIN, INTERNET)).isInstanceOf(ProblemException.class);
    }

    @Test
    void wrongPinCountsTowardsLockout() {
        assertThatThrownBy(() -> pinAuthService.login(7L, "0000", LAN))
                .isInstanceOfSatisfying(BadCredentialsProblemException.class,
                        ex -> assertThat(ex.getRemainingAttempts()).isEqualTo(4));

        assertThat(attempts.failedCount(7L)).isEqualTo(1);
    }

    @Test
    void verifyAnswersWithoutSessionButStillCountsFailures() {
        assertThat(pinAuthService.verify(7L, PIN, LAN)).isTrue();
        assertThat(pinAuthService.verify(7L, "1111", LAN)).isFalse();

        assertThat(sessionStore.size()).isZero();
        assertThat(attempts.failedCount(7L)).isEqualTo(1);
    }

    @Test
    void verifyForUnknownUserIsFalse() {
        when(householdUserRepository.findById(404L)).thenReturn(Optional.empty());

        assertThat(pinAuthService.verify(404L, PIN, LAN)).isFalse();
    }

    @Test
    void inactiveUserCannotUsePin() {
        kid.setActive(false);

        assertThatThrownBy(() -> pinAuthService.login(7L, PIN, LAN))
                .isInstanceOfSatisfying(ProblemException.class,
                        ex -> assertThat(ex.getCode()).isEqualTo("INVALID_CREDENTIALS"));
    }

    @Test
    void listsUsersWithPinOnLan() {
        when(householdUserRepository.findActiveWithCredential(CredentialProvider.KIOSK_PIN)).thenReturn(List.of(kid));

        assertThat(pinAuthService.listPinUsers(LAN)).containsExactly(kid);
    }
}
