package com.habitrack.backend.modules.auth.application;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

import java.time.Duration;
import java.util.Date;

import com.habitrack.backend.modules.auth.application.OnboardTokenService.InvalidOnboardTokenException;
import com.habitrack.backend.modules.auth.infrastructure.token.OnboardTokenKeyProvider;
import com.habitrack.backend.support.MutableClock;

import io.jsonwebtoken.Jwts;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

class OnboardTokenServiceTest {

    private static final String SECRET = "test-onboard-secret-with-at-least-32-bytes-of-entropy";

    private MutableClock clock;
    private OnboardTokenKeyProvider keyProvider;
    private OnboardTokenService service;

    @BeforeEach
    void setUp() {
        clock = MutableClock.at("2025-03-01T08:00:00Z");
        keyProvider = new OnboardTokenKeyProvider(SECRET);
        service = new OnboardTokenService(keyProvider, Duration.ofMinutes(10), clock);
    }

    @Test
    void issuedTokenParsesBackToUser() {
        String token = service.issue(17L);

        assertThat(service.parse(token)).isEqualTo(17L);
    }

    @Test
    void tokenExpiresAfterTtl() {
        String token = service.issue(17L);
        clock.advance(Duration.ofMinutes(10).plusSeconds(1));

        assertThatThrownBy(() -> service.parse(token)).isInstanceOf(InvalidOnboardTokenException.class);
    }

    @Test
    void tokenSignedWithAnotherKeyIsRejected() {
        OnboardTokenService other = new OnboardTokenService(
                new OnboardTokenKeyProvider("another-onboard-secret-that-is-long-enough-too"), Duration.ofMinutes(10), clock);

        assertThatThrownBy(() -> service.parse(other.issue(17L))).isInstanceOf(InvalidOnboardTokenException.class);
    }

    @Test
    void tokenForAnotherPurposeIsRejected() {
        String token = Jwts.builder()
                .subject("17")
                .issuedAt(Date.from(clock.instant()))
                .expiration(Date.from(clock.instant().plusSeconds(600)))
                .claim(OnboardTokenService.PURPOSE_CLAIM, "reset")
                .signWith(keyProvider.getSecretKey(), Jwts.SIG.HS256)
                .compact();

        assertThatThrownBy(() -> service.parse(token)).isInstanceOf(InvalidOnboardTokenException.class);
    }

    @Test
    void garbageAndBlankAreRejected() {
        assertThatThrownBy(() -> service.parse("not-a-token")).isInstanceOf(InvalidOnboardTokenException.class);
        assertThatThrownBy(() -> service.parse(" ")).isInstanceOf(InvalidOnboardTokenException.class);
    }

    @Test
    void shortSecretIsRefusedAtStartup() {
        assertThatThrownBy(() -> new OnboardTokenKeyProvider("too-short"))
                .isInstanceOf(IllegalStateException.class);
    }
}
